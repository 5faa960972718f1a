package com.jmerl.syntax;

public enum NodeType {
    // leaves
    ATOM(true),
    VARIABLE(true),
    INTEGER(true),
    FLOAT(true),
    CHAR(true),
    STRING(true),
    OPERATOR(true),
    NIL(true),

    // expressions
    APPLICATION(false),
    MODULE_QUALIFIER(false),
    INFIX_EXPR(false),
    PREFIX_EXPR(false),
    MATCH_EXPR(false),
    TUPLE(false),
    LIST(false),
    LIST_COMP(false),
    GENERATOR(false),
    BINARY(false),
    BINARY_FIELD(false),
    SIZE_QUALIFIER(false),
    BINARY_COMP(false),
    BINARY_GENERATOR(false),
    BLOCK_EXPR(false),
    CATCH_EXPR(false),
    CASE_EXPR(false),
    IF_EXPR(false),
    RECEIVE_EXPR(false),
    TRY_EXPR(false),
    CLASS_QUALIFIER(false),
    FUN_EXPR(false),
    IMPLICIT_FUN(false),
    ARITY_QUALIFIER(false),
    RECORD_EXPR(false),
    RECORD_FIELD(false),
    RECORD_ACCESS(false),
    MAP_EXPR(false),
    MAP_FIELD_ASSOC(false),
    MAP_FIELD_EXACT(false),

    // types
    TYPE_SPEC(false),
    TYPE_DEFINITION(false),
    FUNCTION_TYPE(false),
    CONSTRAINED_FUNCTION_TYPE(false),
    FUN_TYPE(false),
    TYPE_APPLICATION(false),
    TYPE_UNION(false),
    INTEGER_RANGE_TYPE(false),
    ANNOTATED_TYPE(false),
    TYPED_RECORD_FIELD(false),

    // clauses and guards
    CLAUSE(false),
    DISJUNCTION(false),
    CONJUNCTION(false),

    // forms
    FUNCTION(false),
    ATTRIBUTE(false),
    EXPR_FORM(false);

    private final boolean leaf;

    NodeType(boolean leaf) {
        this.leaf = leaf;
    }

    public boolean isLeafKind() {
        return leaf;
    }

    public boolean isForm() {
        return this == FUNCTION || this == ATTRIBUTE || this == EXPR_FORM;
    }
}
