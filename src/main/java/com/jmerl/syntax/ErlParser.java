package com.jmerl.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive descent parser for the supported subset of Erlang.
 *
 * <p>Clause heads are read with a restricted pattern grammar: no calls, no remote
 * qualifiers and no block constructs. Grouping parentheses leave no node behind. A case or
 * handler clause head may not be one whole parenthesized pattern, so {@code (X) -> X} only
 * reads as a function clause.
 *
 * <p>{@code -spec}, {@code -callback}, {@code -type} and {@code -opaque} attributes are read
 * with a separate type grammar.
 */
public class ErlParser {
    private static final Set<String> COMPARISON_OPS = Set.of("==", "/=", "=<", "<", ">=", ">", "=:=", "=/=");
    private static final Set<String> LIST_OPS = Set.of("++", "--");
    private static final Set<String> ADD_OPS = Set.of("+", "-", "bor", "bxor", "bsl", "bsr", "or", "xor");
    private static final Set<String> MULT_OPS = Set.of("/", "*", "div", "rem", "band", "and");
    private static final Set<String> PREFIX_OPS = Set.of("+", "-", "bnot", "not");
    private static final Set<String> SPEC_ATTRIBUTES = Set.of("spec", "callback");
    private static final Set<String> TYPE_ATTRIBUTES = Set.of("type", "opaque");

    private final ImmutableList<Token> tokens;
    private int index;
    private boolean pattern;

    public ErlParser(ImmutableList<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses one dot-terminated form: a function, an attribute or a top-level expression sequence.
     */
    public static Tree parseForm(ImmutableList<Token> tokens) {
        ErlParser parser = new ErlParser(tokens);
        Tree form = parser.form();
        parser.expectDot();
        parser.expectEnd();
        return form;
    }

    /**
     * Parses a dot-terminated sequence of comma-separated expressions.
     */
    public static ImmutableList<Tree> parseExprs(ImmutableList<Token> tokens) {
        ErlParser parser = new ErlParser(tokens);
        ImmutableList<Tree> exprs = parser.exprs();
        parser.expectDot();
        parser.expectEnd();
        return exprs;
    }

    // ============================================================
    // Forms

    private Tree form() {
        if (peekPunctuation("-") && peek(1) != null && peek(1).kind() == TokenKind.ATOM) {
            return attribute();
        }
        if (peekKind(TokenKind.ATOM) && peek(1) != null && peek(1).isPunctuation("(")) {
            int start = index;
            try {
                return function();
            } catch (ParseException functionError) {
                index = start;
                try {
                    return exprForm();
                } catch (ParseException exprError) {
                    throw furthest(functionError, exprError);
                }
            }
        }
        return exprForm();
    }

    private Tree exprForm() {
        Position at = currentPosition();
        ImmutableList<Tree> exprs = exprs();
        if (!peekKind(TokenKind.DOT)) {
            throw unexpected();
        }
        return Trees.make(NodeType.EXPR_FORM, Attributes.at(at), Lists.immutable.of(exprs));
    }

    private Tree attribute() {
        Position at = currentPosition();
        expectPunctuation("-");
        Token name = expect(TokenKind.ATOM);
        Tree nameTree = Trees.atom(name.text(), Attributes.at(name.position()));
        if (SPEC_ATTRIBUTES.contains(name.text()) || TYPE_ATTRIBUTES.contains(name.text())) {
            boolean wrapped = acceptPunctuation("(");
            Tree declaration = SPEC_ATTRIBUTES.contains(name.text()) ? typeSpec() : typeDefinition();
            if (wrapped) {
                expectPunctuation(")");
            }
            return Trees.make(NodeType.ATTRIBUTE, Attributes.at(at), List.of(nameTree), List.of(declaration));
        }
        if (!acceptPunctuation("(")) {
            return Trees.make(NodeType.ATTRIBUTE, Attributes.at(at), List.of(nameTree));
        }
        ImmutableList<Tree> args = name.text().equals("record") ? recordDeclaration() : exprs();
        expectPunctuation(")");
        return Trees.make(NodeType.ATTRIBUTE, Attributes.at(at), Lists.immutable.of(Lists.immutable.of(nameTree), args));
    }

    private ImmutableList<Tree> recordDeclaration() {
        Tree name = exprMax();
        expectPunctuation(",");
        Position at = currentPosition();
        expectPunctuation("{");
        MutableList<Tree> fields = Lists.mutable.empty();
        if (!peekPunctuation("}")) {
            do {
                fields.add(recordField(true));
            } while (acceptPunctuation(","));
        }
        expectPunctuation("}");
        return Lists.immutable.of(name, Trees.make(NodeType.TUPLE, Attributes.at(at), fields));
    }

    private Tree function() {
        Position at = currentPosition();
        Token name = expect(TokenKind.ATOM);
        MutableList<Tree> clauses = Lists.mutable.of(functionClause());
        while (acceptPunctuation(";")) {
            Token next = expect(TokenKind.ATOM);
            if (!next.text().equals(name.text())) {
                throw new ParseException("head mismatch", next.position());
            }
            clauses.add(functionClause());
        }
        Tree nameTree = Trees.atom(name.text(), Attributes.at(name.position()));
        return Trees.make(NodeType.FUNCTION, Attributes.at(at), List.of(nameTree), clauses);
    }

    private Tree functionClause() {
        Position at = currentPosition();
        ImmutableList<Tree> patterns = argumentPatterns();
        return clauseRest(at, patterns);
    }

    // ============================================================
    // Clauses

    private ImmutableList<Tree> argumentPatterns() {
        expectPunctuation("(");
        MutableList<Tree> patterns = Lists.mutable.empty();
        if (!peekPunctuation(")")) {
            do {
                patterns.add(pattern());
            } while (acceptPunctuation(","));
        }
        expectPunctuation(")");
        return patterns.toImmutable();
    }

    private Tree clauseRest(Position at, ImmutableList<Tree> patterns) {
        Tree guard = acceptKeyword("when") ? guard() : null;
        expectPunctuation("->");
        ImmutableList<Tree> body = exprs();
        MutableList<ImmutableList<Tree>> groups = Lists.mutable.of(patterns);
        if (guard != null) {
            groups.add(Lists.immutable.of(guard));
        }
        groups.add(body);
        return Trees.make(NodeType.CLAUSE, Attributes.at(at), groups.toImmutable());
    }

    private Tree guard() {
        Position at = currentPosition();
        MutableList<Tree> conjunctions = Lists.mutable.empty();
        do {
            Position conjunctionAt = currentPosition();
            conjunctions.add(Trees.make(NodeType.CONJUNCTION, Attributes.at(conjunctionAt), Lists.immutable.of(exprs())));
        } while (acceptPunctuation(";"));
        return Trees.make(NodeType.DISJUNCTION, Attributes.at(at), conjunctions);
    }

    private MutableList<Tree> caseClauses() {
        MutableList<Tree> clauses = Lists.mutable.empty();
        do {
            Position at = currentPosition();
            clauses.add(clauseRest(at, Lists.immutable.of(clauseHead())));
        } while (acceptPunctuation(";"));
        return clauses;
    }

    private Tree clauseHead() {
        int start = index;
        Tree head = pattern();
        if (!peekPunctuation(":") && closingParenthesis(start) == index - 1) {
            index = start;
            throw unexpected();
        }
        return head;
    }

    /**
     * The index of the parenthesis closing the one at {@code start}, or -1 if there is none there.
     */
    private int closingParenthesis(int start) {
        if (!tokens.get(start).isPunctuation("(")) {
            return -1;
        }
        int depth = 0;
        for (int i = start; i < index; i++) {
            Token token = tokens.get(i);
            if (token.isPunctuation("(")) {
                depth++;
            } else if (token.isPunctuation(")") && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private MutableList<Tree> handlerClauses() {
        MutableList<Tree> clauses = Lists.mutable.empty();
        do {
            Position at = currentPosition();
            Tree head = clauseHead();
            if (acceptPunctuation(":")) {
                Tree body = pattern();
                if (acceptPunctuation(":")) {
                    Tree stack = Trees.variable(expect(TokenKind.VARIABLE).text());
                    head = Trees.make(NodeType.CLASS_QUALIFIER, Attributes.at(at), List.of(head), List.of(body), List.of(stack));
                } else {
                    head = Trees.make(NodeType.CLASS_QUALIFIER, Attributes.at(at), List.of(head), List.of(body));
                }
            }
            clauses.add(clauseRest(at, Lists.immutable.of(head)));
        } while (acceptPunctuation(";"));
        return clauses;
    }

    private MutableList<Tree> funClauses() {
        MutableList<Tree> clauses = Lists.mutable.empty();
        do {
            Position at = currentPosition();
            clauses.add(clauseRest(at, argumentPatterns()));
        } while (acceptPunctuation(";"));
        return clauses;
    }

    private MutableList<Tree> ifClauses() {
        MutableList<Tree> clauses = Lists.mutable.empty();
        do {
            Position at = currentPosition();
            Tree guard = guard();
            expectPunctuation("->");
            clauses.add(Trees.make(NodeType.CLAUSE, Attributes.at(at),
                    Lists.immutable.of(Lists.immutable.<Tree>empty(), Lists.immutable.of(guard), exprs())));
        } while (acceptPunctuation(";"));
        return clauses;
    }

    // ============================================================
    // Expressions, lowest precedence first

    private ImmutableList<Tree> exprs() {
        MutableList<Tree> exprs = Lists.mutable.of(expr());
        while (acceptPunctuation(",")) {
            exprs.add(expr());
        }
        return exprs.toImmutable();
    }

    private Tree pattern() {
        return inMode(true, this::expr100);
    }

    private Tree expr() {
        if (!pattern && peekKeyword("catch")) {
            Position at = currentPosition();
            index++;
            return Trees.make(NodeType.CATCH_EXPR, Attributes.at(at), List.of(expr()));
        }
        return expr100();
    }

    private Tree expr100() {
        Position at = currentPosition();
        Tree left = expr150();
        if (acceptPunctuation("=")) {
            return Trees.make(NodeType.MATCH_EXPR, Attributes.at(at), List.of(left), List.of(expr100()));
        }
        if (!pattern && peekPunctuation("!")) {
            Token op = next();
            return infix(at, left, op, expr100());
        }
        return left;
    }

    private Tree expr150() {
        Position at = currentPosition();
        Tree left = expr160();
        if (!pattern && peekKeyword("orelse")) {
            Token op = next();
            return infix(at, left, op, expr150());
        }
        return left;
    }

    private Tree expr160() {
        Position at = currentPosition();
        Tree left = expr200();
        if (!pattern && peekKeyword("andalso")) {
            Token op = next();
            return infix(at, left, op, expr160());
        }
        return left;
    }

    private Tree expr200() {
        Position at = currentPosition();
        Tree left = expr300();
        if (peekOperator(COMPARISON_OPS)) {
            Token op = next();
            return infix(at, left, op, expr300());
        }
        return left;
    }

    private Tree expr300() {
        Position at = currentPosition();
        Tree left = expr400();
        if (peekOperator(LIST_OPS)) {
            Token op = next();
            return infix(at, left, op, expr300());
        }
        return left;
    }

    private Tree expr400() {
        Position at = currentPosition();
        Tree left = expr500();
        while (peekOperator(ADD_OPS)) {
            Token op = next();
            left = infix(at, left, op, expr500());
        }
        return left;
    }

    private Tree expr500() {
        Position at = currentPosition();
        Tree left = expr600();
        while (peekOperator(MULT_OPS)) {
            Token op = next();
            left = infix(at, left, op, expr600());
        }
        return left;
    }

    private Tree expr600() {
        if (peekOperator(PREFIX_OPS)) {
            Token op = next();
            Tree operand = expr600();
            Tree operator = Trees.operator(op.text(), Attributes.at(op.position()));
            return Trees.make(NodeType.PREFIX_EXPR, Attributes.at(op.position()), List.of(operator), List.of(operand));
        }
        return expr700();
    }

    private Tree expr700() {
        Position at = currentPosition();
        Tree expr = expr800();
        while (true) {
            if (!pattern && peekPunctuation("(")) {
                expr = Trees.make(NodeType.APPLICATION, Attributes.at(at),
                        Lists.immutable.of(Lists.immutable.of(expr), argumentList()));
            } else if (peekPunctuation("#")) {
                expr = peek(1) != null && peek(1).isPunctuation("{") ? mapExpr(at, expr) : recordExpr(at, expr);
            } else {
                return expr;
            }
        }
    }

    private Tree expr800() {
        Position at = currentPosition();
        Tree expr = exprMax();
        if (!pattern && acceptPunctuation(":")) {
            return Trees.make(NodeType.MODULE_QUALIFIER, Attributes.at(at), List.of(expr), List.of(exprMax()));
        }
        return expr;
    }

    private ImmutableList<Tree> argumentList() {
        expectPunctuation("(");
        if (acceptPunctuation(")")) {
            return Lists.immutable.empty();
        }
        ImmutableList<Tree> args = exprs();
        expectPunctuation(")");
        return args;
    }

    private Tree exprMax() {
        Token token = peek(0);
        if (token == null) {
            throw unexpected();
        }
        Attributes attrs = Attributes.at(token.position());
        switch (token.kind()) {
            case VARIABLE -> {
                index++;
                return Trees.variable(token.text(), attrs);
            }
            case ATOM -> {
                index++;
                return Trees.atom(token.text(), attrs);
            }
            case INTEGER -> {
                index++;
                return Trees.integer((BigInteger) token.value(), attrs);
            }
            case FLOAT -> {
                index++;
                return Trees.floatLiteral((Double) token.value(), attrs);
            }
            case CHAR -> {
                index++;
                return Trees.charLiteral((Integer) token.value(), attrs);
            }
            case STRING -> {
                StringBuilder sb = new StringBuilder();
                while (peekKind(TokenKind.STRING)) {
                    sb.append(next().value());
                }
                return Trees.string(sb.toString(), attrs);
            }
            case PUNCTUATION -> {
                switch (token.text()) {
                    case "[":
                        return list();
                    case "{":
                        return tuple();
                    case "#":
                        return peek(1) != null && peek(1).isPunctuation("{")
                                ? mapExpr(token.position(), null)
                                : recordExpr(token.position(), null);
                    case "<<":
                        return binary();
                    case "(":
                        index++;
                        Tree body = expr();
                        expectPunctuation(")");
                        return body;
                    default:
                        break;
                }
            }
            case KEYWORD -> {
                if (!pattern) {
                    switch (token.text()) {
                        case "begin":
                            index++;
                            ImmutableList<Tree> body = exprs();
                            expectKeyword("end");
                            return Trees.make(NodeType.BLOCK_EXPR, attrs, Lists.immutable.of(body));
                        case "if":
                            index++;
                            MutableList<Tree> clauses = ifClauses();
                            expectKeyword("end");
                            return Trees.make(NodeType.IF_EXPR, attrs, clauses);
                        case "case":
                            return caseExpr();
                        case "receive":
                            return receiveExpr();
                        case "fun":
                            return funExpr();
                        case "try":
                            return tryExpr();
                        default:
                            break;
                    }
                }
            }
            default -> {
            }
        }
        throw unexpected();
    }

    private Tree list() {
        Position at = currentPosition();
        expectPunctuation("[");
        if (acceptPunctuation("]")) {
            return Trees.nil(Attributes.at(at));
        }
        Tree first = expr();
        if (!pattern && acceptPunctuation("||")) {
            ImmutableList<Tree> qualifiers = qualifiers();
            expectPunctuation("]");
            return Trees.make(NodeType.LIST_COMP, Attributes.at(at), Lists.immutable.of(Lists.immutable.of(first), qualifiers));
        }
        MutableList<Tree> prefix = Lists.mutable.of(first);
        while (acceptPunctuation(",")) {
            prefix.add(expr());
        }
        if (acceptPunctuation("|")) {
            Tree tail = expr();
            expectPunctuation("]");
            return Trees.make(NodeType.LIST, Attributes.at(at), prefix, List.of(tail));
        }
        expectPunctuation("]");
        return Trees.make(NodeType.LIST, Attributes.at(at), prefix);
    }

    private ImmutableList<Tree> qualifiers() {
        MutableList<Tree> qualifiers = Lists.mutable.empty();
        do {
            qualifiers.add(qualifier());
        } while (acceptPunctuation(","));
        return qualifiers.toImmutable();
    }

    private Tree qualifier() {
        Position at = currentPosition();
        Tree expr = expr();
        if (acceptPunctuation("<-")) {
            return Trees.make(NodeType.GENERATOR, Attributes.at(at), List.of(expr), List.of(expr()));
        }
        if (acceptPunctuation("<=")) {
            return Trees.make(NodeType.BINARY_GENERATOR, Attributes.at(at), List.of(expr), List.of(expr()));
        }
        return expr;
    }

    private Tree binary() {
        Position at = currentPosition();
        expectPunctuation("<<");
        if (acceptPunctuation(">>")) {
            return Trees.make(NodeType.BINARY, Attributes.at(at), Lists.immutable.of(Lists.immutable.<Tree>empty()));
        }
        Tree first = binaryField();
        if (!pattern && peekPunctuation("||")) {
            Tree template = Trees.single(first, 0);
            if (first.groups().size() > 1 || template.type() == NodeType.SIZE_QUALIFIER) {
                throw unexpected();
            }
            index++;
            ImmutableList<Tree> qualifiers = qualifiers();
            expectPunctuation(">>");
            return Trees.make(NodeType.BINARY_COMP, Attributes.at(at), Lists.immutable.of(Lists.immutable.of(template), qualifiers));
        }
        MutableList<Tree> fields = Lists.mutable.of(first);
        while (acceptPunctuation(",")) {
            fields.add(binaryField());
        }
        expectPunctuation(">>");
        return Trees.make(NodeType.BINARY, Attributes.at(at), fields);
    }

    private Tree binaryField() {
        Position at = currentPosition();
        Tree body = bitExpr();
        if (acceptPunctuation(":")) {
            body = Trees.make(NodeType.SIZE_QUALIFIER, Attributes.at(at), List.of(body), List.of(exprMax()));
        }
        if (!acceptPunctuation("/")) {
            return Trees.make(NodeType.BINARY_FIELD, Attributes.at(at), List.of(body));
        }
        MutableList<Tree> types = Lists.mutable.empty();
        do {
            Token name = expect(TokenKind.ATOM);
            Tree type = Trees.atom(name.text(), Attributes.at(name.position()));
            if (acceptPunctuation(":")) {
                type = Trees.make(NodeType.SIZE_QUALIFIER, Attributes.at(name.position()), List.of(type), List.of(exprMax()));
            }
            types.add(type);
        } while (acceptPunctuation("-"));
        return Trees.make(NodeType.BINARY_FIELD, Attributes.at(at), List.of(body), types);
    }

    private Tree bitExpr() {
        if (peekOperator(PREFIX_OPS)) {
            Token op = next();
            Tree operator = Trees.operator(op.text(), Attributes.at(op.position()));
            return Trees.make(NodeType.PREFIX_EXPR, Attributes.at(op.position()), List.of(operator), List.of(exprMax()));
        }
        return exprMax();
    }

    private Tree mapExpr(Position at, Tree argument) {
        expectPunctuation("#");
        expectPunctuation("{");
        MutableList<Tree> fields = Lists.mutable.empty();
        if (!peekPunctuation("}")) {
            do {
                Position fieldAt = currentPosition();
                Tree key = expr();
                fields.add(mapField(fieldAt, key, this::expr));
            } while (acceptPunctuation(","));
        }
        expectPunctuation("}");
        return argument == null
                ? Trees.make(NodeType.MAP_EXPR, Attributes.at(at), fields)
                : Trees.make(NodeType.MAP_EXPR, Attributes.at(at), List.of(argument), fields);
    }

    private Tree mapField(Position at, Tree key, Supplier<Tree> value) {
        NodeType type;
        if (acceptPunctuation("=>")) {
            type = NodeType.MAP_FIELD_ASSOC;
        } else if (acceptPunctuation(":=")) {
            type = NodeType.MAP_FIELD_EXACT;
        } else {
            throw unexpected();
        }
        return Trees.make(type, Attributes.at(at), List.of(key), List.of(value.get()));
    }

    private Tree tuple() {
        Position at = currentPosition();
        expectPunctuation("{");
        if (acceptPunctuation("}")) {
            return Trees.make(NodeType.TUPLE, Attributes.at(at), Lists.immutable.of(Lists.immutable.<Tree>empty()));
        }
        ImmutableList<Tree> elements = exprs();
        expectPunctuation("}");
        return Trees.make(NodeType.TUPLE, Attributes.at(at), Lists.immutable.of(elements));
    }

    private Tree recordExpr(Position at, Tree argument) {
        expectPunctuation("#");
        Token typeToken = expect(TokenKind.ATOM);
        Tree type = Trees.atom(typeToken.text(), Attributes.at(typeToken.position()));
        if (argument != null && acceptPunctuation(".")) {
            Token field = expect(TokenKind.ATOM);
            Tree fieldTree = Trees.atom(field.text(), Attributes.at(field.position()));
            return Trees.make(NodeType.RECORD_ACCESS, Attributes.at(at), List.of(argument), List.of(type), List.of(fieldTree));
        }
        expectPunctuation("{");
        MutableList<Tree> fields = Lists.mutable.empty();
        if (!peekPunctuation("}")) {
            do {
                fields.add(recordField(false));
            } while (acceptPunctuation(","));
        }
        expectPunctuation("}");
        return argument == null
                ? Trees.make(NodeType.RECORD_EXPR, Attributes.at(at), List.of(type), fields)
                : Trees.make(NodeType.RECORD_EXPR, Attributes.at(at), List.of(argument), List.of(type), fields);
    }

    private Tree recordField(boolean declaration) {
        Token name = peek(0);
        if (name == null || (name.kind() != TokenKind.ATOM && name.kind() != TokenKind.VARIABLE)) {
            throw unexpected();
        }
        index++;
        Attributes attrs = Attributes.at(name.position());
        Tree nameTree = name.kind() == TokenKind.ATOM ? Trees.atom(name.text(), attrs) : Trees.variable(name.text(), attrs);
        Tree field;
        if (acceptPunctuation("=")) {
            Tree value = inMode(false, this::expr);
            field = Trees.make(NodeType.RECORD_FIELD, attrs, List.of(nameTree), List.of(value));
        } else if (declaration) {
            field = Trees.make(NodeType.RECORD_FIELD, attrs, List.of(nameTree));
        } else {
            throw unexpected();
        }
        if (declaration && acceptPunctuation("::")) {
            return Trees.make(NodeType.TYPED_RECORD_FIELD, attrs, List.of(field), List.of(topType()));
        }
        return field;
    }

    private Tree caseExpr() {
        Position at = currentPosition();
        expectKeyword("case");
        Tree argument = expr();
        expectKeyword("of");
        MutableList<Tree> clauses = caseClauses();
        expectKeyword("end");
        return Trees.make(NodeType.CASE_EXPR, Attributes.at(at), List.of(argument), clauses);
    }

    private Tree receiveExpr() {
        Position at = currentPosition();
        expectKeyword("receive");
        MutableList<Tree> clauses = peekKeyword("after") ? Lists.mutable.empty() : caseClauses();
        if (acceptKeyword("after")) {
            Tree timeout = expr();
            expectPunctuation("->");
            ImmutableList<Tree> action = exprs();
            expectKeyword("end");
            return Trees.make(NodeType.RECEIVE_EXPR, Attributes.at(at),
                    Lists.immutable.of(clauses.toImmutable(), Lists.immutable.of(timeout), action));
        }
        expectKeyword("end");
        return Trees.make(NodeType.RECEIVE_EXPR, Attributes.at(at), clauses);
    }

    private Tree funExpr() {
        Position at = currentPosition();
        expectKeyword("fun");
        if (peekPunctuation("(")) {
            MutableList<Tree> clauses = funClauses();
            expectKeyword("end");
            return Trees.make(NodeType.FUN_EXPR, Attributes.at(at), clauses);
        }
        Tree name = exprMax();
        if (acceptPunctuation(":")) {
            Tree function = exprMax();
            expectPunctuation("/");
            Tree qualifier = Trees.arityQualifier(function, exprMax());
            name = Trees.make(NodeType.MODULE_QUALIFIER, Attributes.at(at), List.of(name), List.of(qualifier));
        } else {
            expectPunctuation("/");
            name = Trees.arityQualifier(name, exprMax());
        }
        return Trees.make(NodeType.IMPLICIT_FUN, Attributes.at(at), List.of(name));
    }

    private Tree tryExpr() {
        Position at = currentPosition();
        expectKeyword("try");
        ImmutableList<Tree> body = exprs();
        ImmutableList<Tree> clauses = acceptKeyword("of") ? caseClauses().toImmutable() : Lists.immutable.empty();
        ImmutableList<Tree> handlers = acceptKeyword("catch") ? handlerClauses().toImmutable() : Lists.immutable.empty();
        ImmutableList<Tree> after = acceptKeyword("after") ? exprs() : Lists.immutable.empty();
        if (handlers.isEmpty() && after.isEmpty()) {
            throw unexpected();
        }
        expectKeyword("end");
        return Trees.make(NodeType.TRY_EXPR, Attributes.at(at), Lists.immutable.of(body, clauses, handlers, after));
    }

    // ============================================================
    // Types

    private Tree typeSpec() {
        Position at = currentPosition();
        Tree name = atom(expect(TokenKind.ATOM));
        if (acceptPunctuation(":")) {
            name = Trees.make(NodeType.MODULE_QUALIFIER, Attributes.at(at), List.of(name), List.of(atom(expect(TokenKind.ATOM))));
        }
        MutableList<Tree> signatures = Lists.mutable.empty();
        do {
            signatures.add(typeSignature());
        } while (acceptPunctuation(";"));
        return Trees.make(NodeType.TYPE_SPEC, Attributes.at(at), List.of(name), signatures);
    }

    private Tree typeSignature() {
        Position at = currentPosition();
        Tree function = functionType();
        if (!acceptKeyword("when")) {
            return function;
        }
        MutableList<Tree> constraints = Lists.mutable.empty();
        do {
            Position constraintAt = currentPosition();
            Tree variable = variable(expect(TokenKind.VARIABLE));
            expectPunctuation("::");
            constraints.add(Trees.make(NodeType.ANNOTATED_TYPE, Attributes.at(constraintAt), List.of(variable), List.of(topType())));
        } while (acceptPunctuation(","));
        return Trees.make(NodeType.CONSTRAINED_FUNCTION_TYPE, Attributes.at(at), List.of(function), constraints);
    }

    /**
     * {@code (Args) -> Result}; {@code (...)} accepts any arguments and leaves out the argument group.
     */
    private Tree functionType() {
        Position at = currentPosition();
        expectPunctuation("(");
        boolean anyArguments = acceptPunctuation("...");
        ImmutableList<Tree> arguments = anyArguments || peekPunctuation(")") ? Lists.immutable.empty() : topTypes();
        expectPunctuation(")");
        expectPunctuation("->");
        Tree result = topType();
        return anyArguments
                ? Trees.make(NodeType.FUNCTION_TYPE, Attributes.at(at), List.of(result))
                : Trees.make(NodeType.FUNCTION_TYPE, Attributes.at(at), arguments.castToList(), List.of(result));
    }

    private Tree typeDefinition() {
        Position at = currentPosition();
        Tree name = atom(expect(TokenKind.ATOM));
        expectPunctuation("(");
        MutableList<Tree> parameters = Lists.mutable.empty();
        if (!peekPunctuation(")")) {
            do {
                parameters.add(variable(expect(TokenKind.VARIABLE)));
            } while (acceptPunctuation(","));
        }
        expectPunctuation(")");
        expectPunctuation("::");
        return Trees.make(NodeType.TYPE_DEFINITION, Attributes.at(at), List.of(name), parameters, List.of(topType()));
    }

    private ImmutableList<Tree> topTypes() {
        MutableList<Tree> types = Lists.mutable.of(topType());
        while (acceptPunctuation(",")) {
            types.add(topType());
        }
        return types.toImmutable();
    }

    private Tree topType() {
        Position at = currentPosition();
        if (peekKind(TokenKind.VARIABLE) && peek(1) != null && peek(1).isPunctuation("::")) {
            Tree variable = variable(next());
            index++;
            return Trees.make(NodeType.ANNOTATED_TYPE, Attributes.at(at), List.of(variable), List.of(topType()));
        }
        Tree first = rangeType();
        if (!peekPunctuation("|")) {
            return first;
        }
        MutableList<Tree> alternatives = Lists.mutable.of(first);
        while (acceptPunctuation("|")) {
            alternatives.add(rangeType());
        }
        return Trees.make(NodeType.TYPE_UNION, Attributes.at(at), alternatives);
    }

    private Tree rangeType() {
        Position at = currentPosition();
        Tree low = primaryType();
        if (acceptPunctuation("..")) {
            return Trees.make(NodeType.INTEGER_RANGE_TYPE, Attributes.at(at), List.of(low), List.of(primaryType()));
        }
        return low;
    }

    private Tree primaryType() {
        Token token = peek(0);
        if (token == null) {
            throw unexpected();
        }
        Attributes attrs = Attributes.at(token.position());
        switch (token.kind()) {
            case VARIABLE -> {
                index++;
                return Trees.variable(token.text(), attrs);
            }
            case INTEGER, CHAR -> {
                return exprMax();
            }
            case ATOM -> {
                index++;
                Tree name = Trees.atom(token.text(), attrs);
                if (acceptPunctuation(":")) {
                    name = Trees.make(NodeType.MODULE_QUALIFIER, attrs, List.of(name), List.of(atom(expect(TokenKind.ATOM))));
                } else if (!peekPunctuation("(")) {
                    return name;
                }
                return Trees.make(NodeType.TYPE_APPLICATION, attrs, List.of(name), typeArguments().castToList());
            }
            case KEYWORD -> {
                if (token.isKeyword("fun")) {
                    return funType();
                }
            }
            case PUNCTUATION -> {
                switch (token.text()) {
                    case "(":
                        index++;
                        Tree type = topType();
                        expectPunctuation(")");
                        return type;
                    case "[":
                        return listType();
                    case "{":
                        index++;
                        ImmutableList<Tree> elements = peekPunctuation("}") ? Lists.immutable.empty() : topTypes();
                        expectPunctuation("}");
                        return Trees.make(NodeType.TUPLE, attrs, Lists.immutable.of(elements));
                    case "#":
                        return peek(1) != null && peek(1).isPunctuation("{") ? mapType() : recordType();
                    case "<<":
                        return inMode(true, this::binary);
                    case "-":
                        index++;
                        Tree operator = Trees.operator("-", attrs);
                        return Trees.make(NodeType.PREFIX_EXPR, attrs, List.of(operator), List.of(primaryType()));
                    default:
                        break;
                }
            }
            default -> {
            }
        }
        throw unexpected();
    }

    private ImmutableList<Tree> typeArguments() {
        expectPunctuation("(");
        if (acceptPunctuation(")")) {
            return Lists.immutable.empty();
        }
        ImmutableList<Tree> arguments = topTypes();
        expectPunctuation(")");
        return arguments;
    }

    /**
     * {@code [T]}, or {@code [T, ...]} which reads as {@code nonempty_list(T)}.
     */
    private Tree listType() {
        Position at = currentPosition();
        expectPunctuation("[");
        if (acceptPunctuation("]")) {
            return Trees.nil(Attributes.at(at));
        }
        Tree element = topType();
        if (acceptPunctuation(",")) {
            expectPunctuation("...");
            expectPunctuation("]");
            return Trees.make(NodeType.TYPE_APPLICATION, Attributes.at(at), List.of(Trees.atom("nonempty_list")), List.of(element));
        }
        expectPunctuation("]");
        return Trees.make(NodeType.LIST, Attributes.at(at), List.of(element));
    }

    private Tree mapType() {
        Position at = currentPosition();
        expectPunctuation("#");
        expectPunctuation("{");
        MutableList<Tree> fields = Lists.mutable.empty();
        if (!peekPunctuation("}")) {
            do {
                Position fieldAt = currentPosition();
                Tree key = topType();
                fields.add(mapField(fieldAt, key, this::topType));
            } while (acceptPunctuation(","));
        }
        expectPunctuation("}");
        return Trees.make(NodeType.MAP_EXPR, Attributes.at(at), fields);
    }

    private Tree recordType() {
        Position at = currentPosition();
        expectPunctuation("#");
        Tree type = atom(expect(TokenKind.ATOM));
        expectPunctuation("{");
        MutableList<Tree> fields = Lists.mutable.empty();
        if (!peekPunctuation("}")) {
            do {
                Token field = expect(TokenKind.ATOM);
                expectPunctuation("::");
                fields.add(Trees.make(NodeType.ANNOTATED_TYPE, Attributes.at(field.position()), List.of(atom(field)), List.of(topType())));
            } while (acceptPunctuation(","));
        }
        expectPunctuation("}");
        return Trees.make(NodeType.RECORD_EXPR, Attributes.at(at), List.of(type), fields);
    }

    private Tree funType() {
        Position at = currentPosition();
        expectKeyword("fun");
        expectPunctuation("(");
        if (acceptPunctuation(")")) {
            return Trees.make(NodeType.FUN_TYPE, Attributes.at(at), Lists.immutable.of(Lists.immutable.<Tree>empty()));
        }
        Tree function = functionType();
        expectPunctuation(")");
        return Trees.make(NodeType.FUN_TYPE, Attributes.at(at), List.of(function));
    }

    private static Tree atom(Token token) {
        return Trees.atom(token.text(), Attributes.at(token.position()));
    }

    private static Tree variable(Token token) {
        return Trees.variable(token.text(), Attributes.at(token.position()));
    }

    private Tree infix(Position at, Tree left, Token op, Tree right) {
        Tree operator = Trees.operator(op.text(), Attributes.at(op.position()));
        return Trees.make(NodeType.INFIX_EXPR, Attributes.at(at), List.of(left), List.of(operator), List.of(right));
    }

    // ============================================================
    // Token helpers

    private <T> T inMode(boolean patternMode, Supplier<T> parse) {
        boolean saved = pattern;
        pattern = patternMode;
        try {
            return parse.get();
        } finally {
            pattern = saved;
        }
    }

    private Token peek(int offset) {
        int i = index + offset;
        return i < tokens.size() ? tokens.get(i) : null;
    }

    private Token next() {
        Token token = peek(0);
        if (token == null) {
            throw unexpected();
        }
        index++;
        return token;
    }

    private Position currentPosition() {
        Token token = peek(0);
        return token == null ? Position.NONE : token.position();
    }

    private boolean peekKind(TokenKind kind) {
        Token token = peek(0);
        return token != null && token.kind() == kind;
    }

    private boolean peekPunctuation(String symbol) {
        Token token = peek(0);
        return token != null && token.isPunctuation(symbol);
    }

    private boolean peekKeyword(String word) {
        Token token = peek(0);
        return token != null && token.isKeyword(word);
    }

    private boolean peekOperator(Set<String> operators) {
        Token token = peek(0);
        return token != null
                && (token.kind() == TokenKind.PUNCTUATION || token.kind() == TokenKind.KEYWORD)
                && operators.contains(token.text());
    }

    private boolean acceptPunctuation(String symbol) {
        if (peekPunctuation(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String word) {
        if (peekKeyword(word)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectPunctuation(String symbol) {
        if (!acceptPunctuation(symbol)) {
            throw unexpected();
        }
    }

    private void expectKeyword(String word) {
        if (!acceptKeyword(word)) {
            throw unexpected();
        }
    }

    private Token expect(TokenKind kind) {
        if (!peekKind(kind)) {
            throw unexpected();
        }
        return next();
    }

    private void expectDot() {
        if (!peekKind(TokenKind.DOT)) {
            throw unexpected();
        }
        index++;
    }

    private void expectEnd() {
        if (index < tokens.size()) {
            throw unexpected();
        }
    }

    private ParseException unexpected() {
        Token token = peek(0);
        if (token == null) {
            Token last = tokens.isEmpty() ? null : tokens.getLast();
            return new ParseException("syntax error before: end of input", last == null ? Position.NONE : last.position());
        }
        return new ParseException("syntax error before: " + token.describe(), token.position());
    }

    private static ParseException furthest(ParseException e1, ParseException e2) {
        return e2.position().compareTo(e1.position()) > 0 ? e2 : e1;
    }
}
