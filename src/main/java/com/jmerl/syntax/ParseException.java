package com.jmerl.syntax;

import com.jmerl.MerlException;

/**
 * Source text could not be scanned or parsed. The position is {@link Position#NONE} when the
 * failure is not attributable to a concrete token.
 */
public class ParseException extends MerlException {
    private final String reason;
    private final Position position;

    public ParseException(String reason, Position position) {
        super(format(reason, position));
        this.reason = reason;
        this.position = position;
    }

    public ParseException(String reason) {
        this(reason, Position.NONE);
    }

    public String reason() {
        return reason;
    }

    public Position position() {
        return position;
    }

    private static String format(String reason, Position position) {
        return position.isConcrete() ? position + ": " + reason : reason;
    }
}
