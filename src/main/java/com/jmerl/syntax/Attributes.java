package com.jmerl.syntax;

/**
 * Metadata carried by a tree node. Never consulted when trees are compared or matched.
 */
public record Attributes(Position position) {
    public static final Attributes NONE = new Attributes(Position.NONE);

    public static Attributes at(Position position) {
        return position.isConcrete() ? new Attributes(position) : NONE;
    }
}
