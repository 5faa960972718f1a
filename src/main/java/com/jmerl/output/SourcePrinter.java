package com.jmerl.output;

import com.jmerl.syntax.NodeType;
import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Prints trees as Erlang source text. Forms are terminated with a dot; operands are
 * parenthesized where the operator precedence requires it.
 */
public class SourcePrinter {
    private static final Pattern BARE_ATOM = Pattern.compile("[a-z][A-Za-z0-9_@]*");
    private static final Set<String> RESERVED = Set.of(
            "after", "and", "andalso", "band", "begin", "bnot", "bor", "bsl", "bsr", "bxor",
            "case", "catch", "cond", "div", "end", "fun", "if", "let", "not", "of", "or",
            "orelse", "receive", "rem", "try", "when", "xor");

    private static final int MAX_PRECEDENCE = 1000;
    private static final int PREFIX_PRECEDENCE = 600;
    private static final Map<String, Integer> INFIX_PRECEDENCE = Map.ofEntries(
            Map.entry("!", 100),
            Map.entry("orelse", 150),
            Map.entry("andalso", 160),
            Map.entry("==", 200), Map.entry("/=", 200), Map.entry("=<", 200), Map.entry("<", 200),
            Map.entry(">=", 200), Map.entry(">", 200), Map.entry("=:=", 200), Map.entry("=/=", 200),
            Map.entry("++", 300), Map.entry("--", 300),
            Map.entry("+", 400), Map.entry("-", 400), Map.entry("bor", 400), Map.entry("bxor", 400),
            Map.entry("bsl", 400), Map.entry("bsr", 400), Map.entry("or", 400), Map.entry("xor", 400),
            Map.entry("/", 500), Map.entry("*", 500), Map.entry("div", 500), Map.entry("rem", 500),
            Map.entry("band", 500), Map.entry("and", 500));
    private static final Set<String> RIGHT_ASSOCIATIVE = Set.of("!", "orelse", "andalso", "++", "--");

    /** How a clause is introduced, which decides how its head is printed. */
    private enum ClauseContext { FUNCTION, FUN, CASE, IF, STANDALONE }

    public String print(Tree tree) {
        StringBuilder sb = new StringBuilder();
        if (tree.type().isForm()) {
            form(tree, sb);
        } else {
            expr(tree, sb);
        }
        return sb.toString();
    }

    public String printAll(Iterable<? extends Tree> trees) {
        StringBuilder sb = new StringBuilder();
        for (Tree tree : trees) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(print(tree));
        }
        return sb.toString();
    }

    // ============================================================
    // Forms

    private void form(Tree tree, StringBuilder sb) {
        switch (tree.type()) {
            case FUNCTION -> {
                Tree name = Trees.single(tree, 0);
                ImmutableList<Tree> clauses = tree.groups().get(1);
                for (int i = 0; i < clauses.size(); i++) {
                    if (i > 0) {
                        sb.append(";\n");
                    }
                    expr(name, sb);
                    clause(clauses.get(i), ClauseContext.FUNCTION, sb);
                }
            }
            case ATTRIBUTE -> {
                sb.append('-');
                expr(Trees.single(tree, 0), sb);
                if (isTypeDeclaration(tree)) {
                    sb.append(' ');
                    expr(Trees.single(tree, 1), sb);
                } else if (tree.groups().size() > 1) {
                    sb.append('(');
                    sequence(tree.groups().get(1), ", ", sb);
                    sb.append(')');
                }
            }
            default -> sequence(tree.groups().get(0), ", ", sb);
        }
        sb.append('.');
    }

    private static boolean isTypeDeclaration(Tree attribute) {
        if (attribute.groups().size() != 2 || attribute.groups().get(1).size() != 1) {
            return false;
        }
        NodeType type = attribute.groups().get(1).getOnly().type();
        return type == NodeType.TYPE_SPEC || type == NodeType.TYPE_DEFINITION;
    }

    // ============================================================
    // Expressions

    private void expr(Tree tree, StringBuilder sb) {
        if (tree.isLeaf()) {
            leaf(tree, sb);
            return;
        }
        ImmutableList<ImmutableList<Tree>> groups = tree.groups();
        switch (tree.type()) {
            case APPLICATION -> {
                operand(groups.get(0), MAX_PRECEDENCE, sb);
                sb.append('(');
                sequence(groups.get(1), ", ", sb);
                sb.append(')');
            }
            case MODULE_QUALIFIER -> {
                operand(groups.get(0), MAX_PRECEDENCE, sb);
                sb.append(':');
                operand(groups.get(1), MAX_PRECEDENCE, sb);
            }
            case INFIX_EXPR -> infix(tree, sb);
            case PREFIX_EXPR -> prefix(tree, sb);
            case MATCH_EXPR -> {
                operand(groups.get(0), 101, sb);
                sb.append(" = ");
                operand(groups.get(1), 100, sb);
            }
            case TUPLE -> {
                sb.append('{');
                sequence(groups.get(0), ", ", sb);
                sb.append('}');
            }
            case LIST -> list(tree, sb);
            case LIST_COMP -> {
                sb.append('[');
                sequence(groups.get(0), "", sb);
                sb.append(" || ");
                sequence(groups.get(1), ", ", sb);
                sb.append(']');
            }
            case GENERATOR -> {
                sequence(groups.get(0), "", sb);
                sb.append(" <- ");
                sequence(groups.get(1), "", sb);
            }
            case BINARY_GENERATOR -> {
                sequence(groups.get(0), "", sb);
                sb.append(" <= ");
                sequence(groups.get(1), "", sb);
            }
            case BINARY -> {
                sb.append("<<");
                sequence(groups.get(0), ", ", sb);
                sb.append(">>");
            }
            case BINARY_FIELD -> binaryField(tree, sb);
            case SIZE_QUALIFIER -> {
                operand(groups.get(0), PREFIX_PRECEDENCE, sb);
                sb.append(':');
                operand(groups.get(1), MAX_PRECEDENCE, sb);
            }
            case BINARY_COMP -> {
                sb.append("<< ");
                operand(groups.get(0), MAX_PRECEDENCE, sb);
                sb.append(" || ");
                sequence(groups.get(1), ", ", sb);
                sb.append(" >>");
            }
            case BLOCK_EXPR -> {
                sb.append("begin ");
                sequence(groups.get(0), ", ", sb);
                sb.append(" end");
            }
            case CATCH_EXPR -> {
                sb.append("catch ");
                sequence(groups.get(0), "", sb);
            }
            case CASE_EXPR -> {
                sb.append("case ");
                sequence(groups.get(0), "", sb);
                sb.append(" of ");
                clauses(groups.get(1), ClauseContext.CASE, sb);
                sb.append(" end");
            }
            case IF_EXPR -> {
                sb.append("if ");
                clauses(groups.get(0), ClauseContext.IF, sb);
                sb.append(" end");
            }
            case RECEIVE_EXPR -> {
                sb.append("receive");
                if (groups.get(0).notEmpty()) {
                    sb.append(' ');
                    clauses(groups.get(0), ClauseContext.CASE, sb);
                }
                if (groups.size() > 2) {
                    sb.append(" after ");
                    sequence(groups.get(1), "", sb);
                    sb.append(" -> ");
                    sequence(groups.get(2), ", ", sb);
                }
                sb.append(" end");
            }
            case TRY_EXPR -> tryExpr(groups, sb);
            case CLASS_QUALIFIER -> sequence(groups.flatCollect(g -> g), ":", sb);
            case FUN_EXPR -> {
                sb.append("fun ");
                clauses(groups.get(0), ClauseContext.FUN, sb);
                sb.append(" end");
            }
            case IMPLICIT_FUN -> {
                sb.append("fun ");
                sequence(groups.get(0), "", sb);
            }
            case ARITY_QUALIFIER -> {
                sequence(groups.get(0), "", sb);
                sb.append('/');
                sequence(groups.get(1), "", sb);
            }
            case RECORD_EXPR -> {
                int type = groups.size() - 2;
                if (type > 0) {
                    operand(groups.get(0), MAX_PRECEDENCE, sb);
                }
                sb.append('#');
                sequence(groups.get(type), "", sb);
                sb.append('{');
                sequence(groups.get(type + 1), ", ", sb);
                sb.append('}');
            }
            case RECORD_FIELD -> {
                sequence(groups.get(0), "", sb);
                if (groups.size() > 1) {
                    sb.append(" = ");
                    sequence(groups.get(1), "", sb);
                }
            }
            case RECORD_ACCESS -> {
                operand(groups.get(0), MAX_PRECEDENCE, sb);
                sb.append('#');
                sequence(groups.get(1), "", sb);
                sb.append('.');
                sequence(groups.get(2), "", sb);
            }
            case MAP_EXPR -> {
                if (groups.size() > 1) {
                    operand(groups.get(0), MAX_PRECEDENCE, sb);
                }
                sb.append("#{");
                sequence(groups.getLast(), ", ", sb);
                sb.append('}');
            }
            case MAP_FIELD_ASSOC -> pair(groups, " => ", sb);
            case MAP_FIELD_EXACT -> pair(groups, " := ", sb);
            case TYPE_SPEC -> {
                sequence(groups.get(0), "", sb);
                sequence(groups.get(1), "; ", sb);
            }
            case TYPE_DEFINITION -> {
                sequence(groups.get(0), "", sb);
                sb.append('(');
                sequence(groups.get(1), ", ", sb);
                sb.append(") :: ");
                sequence(groups.get(2), "", sb);
            }
            case FUNCTION_TYPE -> {
                sb.append('(');
                if (groups.size() > 1) {
                    sequence(groups.get(0), ", ", sb);
                } else {
                    sb.append("...");
                }
                sb.append(") -> ");
                sequence(groups.getLast(), "", sb);
            }
            case CONSTRAINED_FUNCTION_TYPE -> {
                sequence(groups.get(0), "", sb);
                sb.append(" when ");
                sequence(groups.get(1), ", ", sb);
            }
            case FUN_TYPE -> {
                sb.append("fun(");
                sequence(groups.get(0), "", sb);
                sb.append(')');
            }
            case TYPE_APPLICATION -> {
                sequence(groups.get(0), "", sb);
                sb.append('(');
                sequence(groups.get(1), ", ", sb);
                sb.append(')');
            }
            case TYPE_UNION -> sequence(groups.get(0), " | ", sb);
            case INTEGER_RANGE_TYPE -> pair(groups, "..", sb);
            case ANNOTATED_TYPE, TYPED_RECORD_FIELD -> pair(groups, " :: ", sb);
            case CLAUSE -> clause(tree, ClauseContext.STANDALONE, sb);
            case DISJUNCTION -> sequence(groups.get(0), "; ", sb);
            case CONJUNCTION -> sequence(groups.get(0), ", ", sb);
            default -> form(tree, sb);
        }
    }

    private void tryExpr(ImmutableList<ImmutableList<Tree>> groups, StringBuilder sb) {
        sb.append("try ");
        sequence(groups.get(0), ", ", sb);
        if (groups.get(1).notEmpty()) {
            sb.append(" of ");
            clauses(groups.get(1), ClauseContext.CASE, sb);
        }
        if (groups.get(2).notEmpty()) {
            sb.append(" catch ");
            clauses(groups.get(2), ClauseContext.CASE, sb);
        }
        if (groups.get(3).notEmpty()) {
            sb.append(" after ");
            sequence(groups.get(3), ", ", sb);
        }
        sb.append(" end");
    }

    private void pair(ImmutableList<ImmutableList<Tree>> groups, String separator, StringBuilder sb) {
        sequence(groups.get(0), "", sb);
        sb.append(separator);
        sequence(groups.get(1), "", sb);
    }

    private void binaryField(Tree tree, StringBuilder sb) {
        ImmutableList<Tree> body = tree.groups().get(0);
        if (body.size() == 1 && body.getFirst().type() == NodeType.SIZE_QUALIFIER) {
            expr(body.getFirst(), sb);
        } else {
            operand(body, PREFIX_PRECEDENCE, sb);
        }
        if (tree.groups().size() > 1) {
            sb.append('/');
            sequence(tree.groups().get(1), "-", sb);
        }
    }

    private void list(Tree tree, StringBuilder sb) {
        ImmutableList<Tree> prefix = tree.groups().get(0);
        boolean hasTail = tree.groups().size() > 1;
        if (prefix.isEmpty()) {
            if (hasTail) {
                sequence(tree.groups().get(1), "", sb);
            } else {
                sb.append("[]");
            }
            return;
        }
        sb.append('[');
        sequence(prefix, ", ", sb);
        if (hasTail) {
            sb.append(" | ");
            sequence(tree.groups().get(1), "", sb);
        }
        sb.append(']');
    }

    private void infix(Tree tree, StringBuilder sb) {
        String op = operatorOf(tree.groups().get(1));
        int precedence = INFIX_PRECEDENCE.getOrDefault(op, MAX_PRECEDENCE);
        boolean right = RIGHT_ASSOCIATIVE.contains(op);
        boolean nonAssociative = precedence == 200;
        int leftMin = right || nonAssociative ? precedence + 1 : precedence;
        int rightMin = right ? precedence : precedence + 1;
        operand(tree.groups().get(0), leftMin, sb);
        sb.append(' ');
        sequence(tree.groups().get(1), "", sb);
        sb.append(' ');
        operand(tree.groups().get(2), rightMin, sb);
    }

    private void prefix(Tree tree, StringBuilder sb) {
        String op = operatorOf(tree.groups().get(0));
        sequence(tree.groups().get(0), "", sb);
        StringBuilder operand = new StringBuilder();
        operand(tree.groups().get(1), PREFIX_PRECEDENCE, operand);
        if (Character.isLetter(op.charAt(0)) || operand.charAt(0) == '-' || operand.charAt(0) == '+') {
            sb.append(' ');
        }
        sb.append(operand);
    }

    private void operand(ImmutableList<Tree> group, int minimum, StringBuilder sb) {
        if (group.size() == 1 && precedence(group.getFirst()) < minimum) {
            sb.append('(');
            expr(group.getFirst(), sb);
            sb.append(')');
        } else {
            sequence(group, ", ", sb);
        }
    }

    private static int precedence(Tree tree) {
        return switch (tree.type()) {
            case CATCH_EXPR -> 0;
            case MATCH_EXPR -> 100;
            case PREFIX_EXPR -> PREFIX_PRECEDENCE;
            case INFIX_EXPR -> INFIX_PRECEDENCE.getOrDefault(operatorOf(tree.groups().get(1)), MAX_PRECEDENCE);
            default -> MAX_PRECEDENCE;
        };
    }

    private static String operatorOf(ImmutableList<Tree> group) {
        return group.size() == 1 && group.getFirst().type() == NodeType.OPERATOR ? Trees.operatorName(group.getFirst()) : "";
    }

    // ============================================================
    // Clauses

    private void clauses(ImmutableList<Tree> clauses, ClauseContext context, StringBuilder sb) {
        for (int i = 0; i < clauses.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            Tree clause = clauses.get(i);
            if (clause.type() == NodeType.CLAUSE) {
                clause(clause, context, sb);
            } else {
                expr(clause, sb);
            }
        }
    }

    private void clause(Tree clause, ClauseContext context, StringBuilder sb) {
        ImmutableList<ImmutableList<Tree>> groups = clause.groups();
        ImmutableList<Tree> patterns = groups.get(0);
        ImmutableList<Tree> guard = groups.size() > 2 ? groups.get(1) : null;
        ImmutableList<Tree> body = groups.getLast();
        boolean parenthesized = switch (context) {
            case FUNCTION, FUN -> true;
            case CASE, IF -> false;
            case STANDALONE -> patterns.size() != 1 && !(patterns.isEmpty() && guard != null);
        };
        if (parenthesized) {
            sb.append('(');
            sequence(patterns, ", ", sb);
            sb.append(')');
        } else {
            sequence(patterns, ", ", sb);
        }
        if (guard != null) {
            sb.append(patterns.isEmpty() && !parenthesized ? "" : " when ");
            sequence(guard, ", ", sb);
        }
        sb.append(" -> ");
        sequence(body, ", ", sb);
    }

    // ============================================================
    // Leaves

    private void leaf(Tree tree, StringBuilder sb) {
        switch (tree.type()) {
            case ATOM -> sb.append(atom(Trees.atomName(tree)));
            case VARIABLE -> sb.append(Trees.variableName(tree));
            case INTEGER -> sb.append(Trees.integerValue(tree));
            case FLOAT -> sb.append(Trees.floatValue(tree));
            case CHAR -> sb.append('$').append(escape(new String(Character.toChars(Trees.charValue(tree))), '\0'));
            case STRING -> sb.append('"').append(escape(Trees.stringValue(tree), '"')).append('"');
            case OPERATOR -> sb.append(Trees.operatorName(tree));
            case NIL -> sb.append("[]");
            default -> sb.append(tree.type().name().toLowerCase());
        }
    }

    static String atom(String name) {
        if (BARE_ATOM.matcher(name).matches() && !RESERVED.contains(name)) {
            return name;
        }
        return "'" + escape(name, '\'') + "'";
    }

    private static String escape(String s, char quote) {
        StringBuilder result = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                case ' ' -> result.append(quote == '\0' ? "\\s" : " ");
                default -> {
                    if (c == quote) {
                        result.append('\\').append(c);
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }

    private void sequence(ImmutableList<Tree> trees, String separator, StringBuilder sb) {
        for (int i = 0; i < trees.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            expr(trees.get(i), sb);
        }
    }
}
