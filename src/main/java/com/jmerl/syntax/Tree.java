package com.jmerl.syntax;

import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * An immutable syntax tree. Interior nodes hold ordered groups of children; a tree with no
 * groups is a leaf and carries a scalar value instead.
 */
public sealed interface Tree {
    NodeType type();
    Attributes attributes();
    ImmutableList<ImmutableList<Tree>> groups();

    default boolean isLeaf() {
        return groups().isEmpty();
    }

    Tree withAttributes(Attributes attributes);

    /**
     * A leaf. The value is a String for atoms, variables, strings and operators, a BigInteger
     * for integers, a Double for floats, an Integer code point for chars and null for nil.
     */
    record Leaf(NodeType type, Attributes attributes, Object value) implements Tree {
        @Override
        public ImmutableList<ImmutableList<Tree>> groups() {
            return Lists.immutable.empty();
        }

        @Override
        public Leaf withAttributes(Attributes attributes) {
            return new Leaf(type, attributes, value);
        }
    }

    record Node(NodeType type, Attributes attributes, ImmutableList<ImmutableList<Tree>> groups) implements Tree {
        @Override
        public Node withAttributes(Attributes attributes) {
            return new Node(type, attributes, groups);
        }
    }
}
