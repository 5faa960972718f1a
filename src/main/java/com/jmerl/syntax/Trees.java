package com.jmerl.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Constructors, accessors and comparison for {@link Tree}s.
 */
public final class Trees {
    private Trees() {
    }

    // ------------------------------------------------------------
    // Leaves

    public static Tree.Leaf atom(String name) {
        return atom(name, Attributes.NONE);
    }

    public static Tree.Leaf atom(String name, Attributes attributes) {
        return new Tree.Leaf(NodeType.ATOM, attributes, Objects.requireNonNull(name));
    }

    public static Tree.Leaf variable(String name) {
        return variable(name, Attributes.NONE);
    }

    public static Tree.Leaf variable(String name, Attributes attributes) {
        return new Tree.Leaf(NodeType.VARIABLE, attributes, Objects.requireNonNull(name));
    }

    public static Tree.Leaf integer(long value) {
        return integer(BigInteger.valueOf(value), Attributes.NONE);
    }

    public static Tree.Leaf integer(BigInteger value, Attributes attributes) {
        return new Tree.Leaf(NodeType.INTEGER, attributes, Objects.requireNonNull(value));
    }

    public static Tree.Leaf floatLiteral(double value) {
        return floatLiteral(value, Attributes.NONE);
    }

    public static Tree.Leaf floatLiteral(double value, Attributes attributes) {
        return new Tree.Leaf(NodeType.FLOAT, attributes, value);
    }

    public static Tree.Leaf charLiteral(int codePoint) {
        return charLiteral(codePoint, Attributes.NONE);
    }

    public static Tree.Leaf charLiteral(int codePoint, Attributes attributes) {
        return new Tree.Leaf(NodeType.CHAR, attributes, codePoint);
    }

    public static Tree.Leaf string(String value) {
        return string(value, Attributes.NONE);
    }

    public static Tree.Leaf string(String value, Attributes attributes) {
        return new Tree.Leaf(NodeType.STRING, attributes, Objects.requireNonNull(value));
    }

    public static Tree.Leaf operator(String name) {
        return operator(name, Attributes.NONE);
    }

    public static Tree.Leaf operator(String name, Attributes attributes) {
        return new Tree.Leaf(NodeType.OPERATOR, attributes, Objects.requireNonNull(name));
    }

    public static Tree.Leaf nil() {
        return nil(Attributes.NONE);
    }

    public static Tree.Leaf nil(Attributes attributes) {
        return new Tree.Leaf(NodeType.NIL, attributes, null);
    }

    // ------------------------------------------------------------
    // Interior nodes

    public static Tree.Node make(NodeType type, Attributes attributes, ImmutableList<ImmutableList<Tree>> groups) {
        if (type.isLeafKind()) {
            throw new IllegalArgumentException("not an interior node type: " + type);
        }
        return new Tree.Node(type, attributes, groups);
    }

    @SafeVarargs
    public static Tree.Node make(NodeType type, Attributes attributes, List<? extends Tree>... groups) {
        ImmutableList<ImmutableList<Tree>> gs = Lists.immutable.<List<? extends Tree>>of(groups)
                .collect(g -> Lists.immutable.<Tree>ofAll(g));
        return make(type, attributes, gs);
    }

    @SafeVarargs
    public static Tree.Node make(NodeType type, List<? extends Tree>... groups) {
        return make(type, Attributes.NONE, groups);
    }

    public static Tree.Node application(Tree operator, List<? extends Tree> arguments) {
        return make(NodeType.APPLICATION, List.of(operator), arguments);
    }

    public static Tree.Node tuple(List<? extends Tree> elements) {
        return make(NodeType.TUPLE, elements);
    }

    /**
     * A proper list, or {@code []} when there are no elements.
     */
    public static Tree list(List<? extends Tree> elements) {
        return elements.isEmpty() ? nil() : make(NodeType.LIST, elements);
    }

    public static Tree.Node infix(Tree left, String operator, Tree right) {
        return make(NodeType.INFIX_EXPR, List.of(left), List.of(operator(operator)), List.of(right));
    }

    public static Tree.Node arityQualifier(Tree body, Tree arity) {
        return make(NodeType.ARITY_QUALIFIER, List.of(body), List.of(arity));
    }

    public static Tree.Node clause(List<? extends Tree> patterns, Tree guard, List<? extends Tree> body) {
        return guard == null
                ? make(NodeType.CLAUSE, patterns, body)
                : make(NodeType.CLAUSE, patterns, List.of(guard), body);
    }

    public static Tree.Node attribute(String name, List<? extends Tree> arguments) {
        return make(NodeType.ATTRIBUTE, List.of(atom(name)), arguments);
    }

    // ------------------------------------------------------------
    // Accessors

    public static String atomName(Tree tree) {
        return (String) leafValue(tree, NodeType.ATOM);
    }

    public static String variableName(Tree tree) {
        return (String) leafValue(tree, NodeType.VARIABLE);
    }

    public static BigInteger integerValue(Tree tree) {
        return (BigInteger) leafValue(tree, NodeType.INTEGER);
    }

    public static double floatValue(Tree tree) {
        return (Double) leafValue(tree, NodeType.FLOAT);
    }

    public static int charValue(Tree tree) {
        return (Integer) leafValue(tree, NodeType.CHAR);
    }

    public static String stringValue(Tree tree) {
        return (String) leafValue(tree, NodeType.STRING);
    }

    public static String operatorName(Tree tree) {
        return (String) leafValue(tree, NodeType.OPERATOR);
    }

    private static Object leafValue(Tree tree, NodeType expected) {
        if (tree.type() != expected || !(tree instanceof Tree.Leaf leaf)) {
            throw new IllegalArgumentException("expected " + expected + " leaf, got " + tree.type());
        }
        return leaf.value();
    }

    /**
     * The single member of a one-element group.
     */
    public static Tree single(Tree tree, int group) {
        ImmutableList<Tree> members = tree.groups().get(group);
        if (members.size() != 1) {
            throw new IllegalArgumentException(tree.type() + " group " + group + " has " + members.size() + " members");
        }
        return members.getFirst();
    }

    /**
     * True if the tree is built only from literal leaves, tuples and lists.
     */
    public static boolean isLiteral(Tree tree) {
        return switch (tree.type()) {
            case ATOM, INTEGER, FLOAT, CHAR, STRING, NIL -> true;
            case TUPLE, LIST -> tree.groups().allSatisfy(g -> g.allSatisfy(Trees::isLiteral));
            default -> false;
        };
    }

    // ------------------------------------------------------------
    // Comparison

    /**
     * Deep equality that ignores attributes. Leaves compare by their kind's scalar; leaves of
     * kinds without a scalar (nil) are trivially equal.
     */
    public static boolean structurallyEqual(Tree t1, Tree t2) {
        if (t1.type() != t2.type()) {
            return false;
        }
        if (t1.isLeaf() || t2.isLeaf()) {
            return t1.isLeaf() && t2.isLeaf() && compareLeaves(t1, t2);
        }
        return groupsEqual(t1.groups(), t2.groups());
    }

    private static boolean groupsEqual(ImmutableList<ImmutableList<Tree>> gs1, ImmutableList<ImmutableList<Tree>> gs2) {
        if (gs1.size() != gs2.size()) {
            return false;
        }
        for (int i = 0; i < gs1.size(); i++) {
            ImmutableList<Tree> g1 = gs1.get(i);
            ImmutableList<Tree> g2 = gs2.get(i);
            if (g1.size() != g2.size()) {
                return false;
            }
            for (int j = 0; j < g1.size(); j++) {
                if (!structurallyEqual(g1.get(j), g2.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean compareLeaves(Tree t1, Tree t2) {
        if (!(t1 instanceof Tree.Leaf l1) || !(t2 instanceof Tree.Leaf l2)) {
            // interior node whose groups were substituted away
            return t1.type() == t2.type();
        }
        return switch (t1.type()) {
            case FLOAT -> ((Double) l1.value()).doubleValue() == ((Double) l2.value()).doubleValue();
            case ATOM, VARIABLE, INTEGER, CHAR, STRING, OPERATOR -> l1.value().equals(l2.value());
            default -> true;
        };
    }
}
