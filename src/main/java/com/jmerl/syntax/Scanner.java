package com.jmerl.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;

/**
 * Splits Erlang source text into {@link Token}s.
 */
public class Scanner {
    // longest first, so that "=:=" wins over "=" and "==".
    private static final String[] SYMBOLS = {
            "=:=", "=/=", "...",
            "->", "..", "=>", ":=", "<<", ">>", "<-", "<=", "||", "::", "==", "/=", "=<", ">=", "++", "--",
            "(", ")", "[", "]", "{", "}", ",", ";", "|", ":", "#", "!", "=", "<", ">", "+", "-", "*", "/", "."
    };

    private final String text;
    private final boolean trackColumns;
    private int index;
    private int line;
    private int column;

    public Scanner(String text, Position start) {
        this.text = text;
        this.trackColumns = start.hasColumn();
        this.line = start.line();
        this.column = trackColumns ? start.column() : 1;
    }

    public static ImmutableList<Token> scan(String text, Position start) {
        return new Scanner(text, start).tokens();
    }

    public ImmutableList<Token> tokens() {
        MutableList<Token> tokens = Lists.mutable.empty();
        while (true) {
            skipWhitespaceAndComments();
            if (atEnd()) {
                return tokens.toImmutable();
            }
            tokens.add(next());
        }
    }

    private Token next() {
        Position at = position();
        char c = peek(0);
        if (isDigit(c)) {
            return number(at);
        }
        if (isLower(c)) {
            String name = identifier();
            return Token.KEYWORDS.contains(name)
                    ? new Token(TokenKind.KEYWORD, name, null, at)
                    : new Token(TokenKind.ATOM, name, name, at);
        }
        if (isUpper(c) || c == '_') {
            String name = identifier();
            return new Token(TokenKind.VARIABLE, name, name, at);
        }
        switch (c) {
            case '\'' -> {
                advance();
                String name = quoted('\'', at);
                return new Token(TokenKind.ATOM, name, name, at);
            }
            case '"' -> {
                advance();
                String value = quoted('"', at);
                return new Token(TokenKind.STRING, value, value, at);
            }
            case '$' -> {
                advance();
                if (atEnd()) {
                    throw new ParseException("unterminated character", at);
                }
                int codePoint = peek(0) == '\\' ? escape(at) : advanceCodePoint();
                return new Token(TokenKind.CHAR, "$" + new String(Character.toChars(codePoint)), codePoint, at);
            }
            case '.' -> {
                if (index + 1 >= text.length() || Character.isWhitespace(peek(1)) || peek(1) == '%') {
                    advance();
                    return new Token(TokenKind.DOT, ".", null, at);
                }
            }
            default -> {
            }
        }
        for (String symbol : SYMBOLS) {
            if (text.startsWith(symbol, index)) {
                for (int i = 0; i < symbol.length(); i++) {
                    advance();
                }
                return new Token(TokenKind.PUNCTUATION, symbol, null, at);
            }
        }
        throw new ParseException("illegal character '" + c + "'", at);
    }

    private Token number(Position at) {
        int begin = index;
        while (!atEnd() && isDigit(peek(0))) {
            advance();
        }
        if (!atEnd() && peek(0) == '#' && index + 1 < text.length() && isAlphanumeric(peek(1))) {
            int base = Integer.parseInt(text.substring(begin, index));
            if (base < 2 || base > 36) {
                throw new ParseException("illegal base '" + base + "'", at);
            }
            advance();
            int digits = index;
            while (!atEnd() && isAlphanumeric(peek(0)) && Character.digit(peek(0), base) >= 0) {
                advance();
            }
            BigInteger value = new BigInteger(text.substring(digits, index), base);
            return new Token(TokenKind.INTEGER, text.substring(begin, index), value, at);
        }
        if (index + 1 < text.length() && peek(0) == '.' && isDigit(peek(1))) {
            advance();
            while (!atEnd() && isDigit(peek(0))) {
                advance();
            }
            if (!atEnd() && (peek(0) == 'e' || peek(0) == 'E')) {
                advance();
                if (!atEnd() && (peek(0) == '+' || peek(0) == '-')) {
                    advance();
                }
                if (atEnd() || !isDigit(peek(0))) {
                    throw new ParseException("malformed float exponent", at);
                }
                while (!atEnd() && isDigit(peek(0))) {
                    advance();
                }
            }
            String spelling = text.substring(begin, index);
            return new Token(TokenKind.FLOAT, spelling, Double.parseDouble(spelling), at);
        }
        String spelling = text.substring(begin, index);
        return new Token(TokenKind.INTEGER, spelling, new BigInteger(spelling), at);
    }

    private String identifier() {
        int begin = index;
        while (!atEnd() && (isAlphanumeric(peek(0)) || peek(0) == '_' || peek(0) == '@')) {
            advance();
        }
        return text.substring(begin, index);
    }

    private String quoted(char quote, Position at) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw new ParseException(quote == '"' ? "unterminated string" : "unterminated atom", at);
            }
            char c = peek(0);
            if (c == quote) {
                advance();
                return sb.toString();
            }
            if (c == '\\') {
                sb.appendCodePoint(escape(at));
            } else {
                sb.appendCodePoint(advanceCodePoint());
            }
        }
    }

    private int escape(Position at) {
        advance();
        if (atEnd()) {
            throw new ParseException("unterminated escape sequence", at);
        }
        char c = peek(0);
        if (c >= '0' && c <= '7') {
            int value = 0;
            for (int i = 0; i < 3 && !atEnd() && peek(0) >= '0' && peek(0) <= '7'; i++) {
                value = value * 8 + (advance() - '0');
            }
            return value;
        }
        advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'v' -> 0x0b;
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'e' -> 0x1b;
            case 's' -> ' ';
            case 'd' -> 0x7f;
            case 'x' -> hexEscape(at);
            case '^' -> {
                if (atEnd()) {
                    throw new ParseException("unterminated escape sequence", at);
                }
                yield advance() & 0x1f;
            }
            default -> c;
        };
    }

    private int hexEscape(Position at) {
        int begin = index;
        if (!atEnd() && peek(0) == '{') {
            advance();
            begin = index;
            while (!atEnd() && peek(0) != '}') {
                advance();
            }
            if (atEnd()) {
                throw new ParseException("unterminated escape sequence", at);
            }
            String digits = text.substring(begin, index);
            advance();
            return parseHex(digits, at);
        }
        for (int i = 0; i < 2 && !atEnd() && Character.digit(peek(0), 16) >= 0; i++) {
            advance();
        }
        return parseHex(text.substring(begin, index), at);
    }

    private static int parseHex(String digits, Position at) {
        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new ParseException("illegal hexadecimal escape '" + digits + "'", at);
        }
    }

    private void skipWhitespaceAndComments() {
        while (!atEnd()) {
            char c = peek(0);
            if (c == '%') {
                while (!atEnd() && peek(0) != '\n') {
                    advance();
                }
            } else if (Character.isWhitespace(c)) {
                advance();
            } else {
                return;
            }
        }
    }

    private Position position() {
        return new Position(line, trackColumns ? column : 0);
    }

    private boolean atEnd() {
        return index >= text.length();
    }

    private char peek(int offset) {
        return text.charAt(index + offset);
    }

    private char advance() {
        char c = text.charAt(index++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private int advanceCodePoint() {
        int codePoint = text.codePointAt(index);
        for (int i = Character.charCount(codePoint); i > 0; i--) {
            advance();
        }
        return codePoint;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLower(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'ß' && c <= 'ÿ' && c != '÷');
    }

    private static boolean isUpper(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'À' && c <= 'Þ' && c != '×');
    }

    private static boolean isAlphanumeric(char c) {
        return isDigit(c) || isLower(c) || isUpper(c);
    }
}
