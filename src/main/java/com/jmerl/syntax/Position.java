package com.jmerl.syntax;

/**
 * A source position. Line 0 means "no position" (synthetic tokens and constructed trees);
 * column 0 means the column is not tracked.
 */
public record Position(int line, int column) implements Comparable<Position> {
    public static final Position NONE = new Position(0, 0);

    public static Position of(int line) {
        return new Position(line, 0);
    }

    public boolean isConcrete() {
        return line > 0;
    }

    public boolean hasColumn() {
        return column > 0;
    }

    @Override
    public int compareTo(Position other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return hasColumn() ? line + ":" + column : Integer.toString(line);
    }
}
