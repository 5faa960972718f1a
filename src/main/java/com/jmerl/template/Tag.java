package com.jmerl.template;

import java.math.BigInteger;

/**
 * The name of a placeholder: a text tag or an integer tag. Integer tags sort before text tags.
 */
public sealed interface Tag extends Comparable<Tag> {
    Tag ANONYMOUS_TEXT = new Text("_");
    Tag ANONYMOUS_INTEGER = new Int(BigInteger.ZERO);

    boolean isAnonymous();

    record Text(String name) implements Tag {
        @Override
        public boolean isAnonymous() {
            return name.equals("_");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Int(BigInteger value) implements Tag {
        @Override
        public boolean isAnonymous() {
            return value.signum() == 0;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * An integer tag if the name is all digits, a text tag otherwise.
     */
    static Tag of(String name) {
        if (!name.isEmpty() && name.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return new Int(new BigInteger(name));
        }
        return new Text(name);
    }

    @Override
    default int compareTo(Tag other) {
        if (this instanceof Int a && other instanceof Int b) {
            return a.value().compareTo(b.value());
        }
        if (this instanceof Text a && other instanceof Text b) {
            return a.name().compareTo(b.name());
        }
        return this instanceof Int ? -1 : 1;
    }
}
