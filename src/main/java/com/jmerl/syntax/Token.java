package com.jmerl.syntax;

import java.util.Set;

/**
 * A lexical token. {@code text} is the symbol for keywords and punctuation, the name for atoms
 * and variables, and the decoded value's source spelling otherwise; {@code value} holds the
 * decoded scalar for literals.
 */
public record Token(TokenKind kind, String text, Object value, Position position) {
    static final Set<String> KEYWORDS = Set.of(
            "after", "and", "andalso", "band", "begin", "bnot", "bor", "bsl", "bsr", "bxor",
            "case", "catch", "cond", "div", "end", "fun", "if", "let", "not", "of", "or",
            "orelse", "receive", "rem", "try", "when", "xor");

    public static Token keyword(String word) {
        return new Token(TokenKind.KEYWORD, word, null, Position.NONE);
    }

    public static Token atom(String name) {
        return new Token(TokenKind.ATOM, name, name, Position.NONE);
    }

    public static Token dot() {
        return new Token(TokenKind.DOT, ".", null, Position.NONE);
    }

    public boolean is(TokenKind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    public boolean isKeyword(String word) {
        return is(TokenKind.KEYWORD, word);
    }

    public boolean isPunctuation(String symbol) {
        return is(TokenKind.PUNCTUATION, symbol);
    }

    /**
     * How the token is quoted in error messages.
     */
    public String describe() {
        return switch (kind) {
            case DOT -> "'.'";
            case STRING -> "\"" + text + "\"";
            case VARIABLE, INTEGER, FLOAT, CHAR -> text;
            default -> "'" + text + "'";
        };
    }
}
