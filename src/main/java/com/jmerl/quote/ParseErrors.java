package com.jmerl.quote;

import com.jmerl.syntax.ParseException;

import java.util.Collection;
import java.util.Comparator;

/**
 * Chooses which of several rejected parse attempts to report.
 */
public final class ParseErrors {
    /**
     * Orders errors by how far the parser got: positioned errors above unpositioned ones,
     * then by line, column and reason.
     */
    public static final Comparator<ParseException> BY_PROGRESS =
            Comparator.comparing((ParseException e) -> e.position().isConcrete())
                    .thenComparing(ParseException::position)
                    .thenComparing(ParseException::reason);

    private ParseErrors() {
    }

    /**
     * The error attributed to the furthest position reached, or a generic error when none of
     * the candidates carries a reason.
     */
    public static ParseException select(Collection<ParseException> errors) {
        return errors.stream()
                .filter(e -> e.reason() != null && !e.reason().isEmpty())
                .max(BY_PROGRESS)
                .orElseGet(() -> new ParseException("unknown parse error"));
    }
}
