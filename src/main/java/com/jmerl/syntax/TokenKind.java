package com.jmerl.syntax;

public enum TokenKind {
    ATOM,
    VARIABLE,
    INTEGER,
    FLOAT,
    CHAR,
    STRING,
    KEYWORD,
    PUNCTUATION,
    DOT
}
