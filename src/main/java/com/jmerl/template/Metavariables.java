package com.jmerl.template;

import com.jmerl.syntax.Attributes;
import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Recognizes placeholder leaves: atoms starting with {@code @}, variables starting with
 * {@code _@} and integers starting with the digits {@code 909}, each followed by at least one
 * more character.
 */
public final class Metavariables {
    private static final BigInteger MIN_INTEGER = BigInteger.valueOf(9090);

    private Metavariables() {
    }

    /**
     * The raw name following the placeholder prefix, if the tree is a placeholder leaf.
     */
    public static Optional<String> rawName(Tree tree) {
        switch (tree.type()) {
            case ATOM: {
                String name = Trees.atomName(tree);
                return name.length() > 1 && name.startsWith("@") ? Optional.of(name.substring(1)) : Optional.empty();
            }
            case VARIABLE: {
                String name = Trees.variableName(tree);
                return name.length() > 2 && name.startsWith("_@") ? Optional.of(name.substring(2)) : Optional.empty();
            }
            case INTEGER: {
                BigInteger value = Trees.integerValue(tree);
                if (value.compareTo(MIN_INTEGER) < 0) {
                    return Optional.empty();
                }
                String digits = value.toString();
                return digits.startsWith("909") ? Optional.of(digits.substring(3)) : Optional.empty();
            }
            default:
                return Optional.empty();
        }
    }

    public static boolean isMetavariable(Tree tree) {
        return rawName(tree).isPresent();
    }

    /**
     * The leaf spelling of a node-level placeholder.
     */
    public static Tree nodeLeaf(Tag name) {
        if (name instanceof Tag.Int i) {
            return Trees.integer(new BigInteger("909" + i.value()), Attributes.NONE);
        }
        return Trees.atom("@" + name);
    }

    /**
     * The leaf spelling of a group-level placeholder.
     */
    public static Tree groupLeaf(Tag name) {
        if (name instanceof Tag.Int i) {
            return Trees.integer(new BigInteger("9099" + i.value()), Attributes.NONE);
        }
        return Trees.atom("@@" + name);
    }
}
