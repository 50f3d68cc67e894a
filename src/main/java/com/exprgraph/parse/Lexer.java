package com.exprgraph.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens.
 *
 * <p>
 * Recognizes:
 * <ul>
 * <li>Numbers: {@code 12}, {@code 12.}, {@code 12.5}, {@code .5}</li>
 * <li>Identifiers: a letter or underscore followed by letters, digits or
 * underscores</li>
 * <li>The operators {@code + - * /} and parentheses</li>
 * </ul>
 * Whitespace only separates tokens. The returned list always ends with a
 * single {@link TokenType#END} token.
 */
public final class Lexer {
    private final String input;
    private int pos;

    private Lexer(String input) {
        this.input = input;
    }

    public static List<Token> tokenize(String input) {
        return new Lexer(input).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWS();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.END, "", pos));
                return tokens;
            }
            char c = input.charAt(pos);
            int start = pos;
            TokenType single = switch (c) {
                case '+' -> TokenType.PLUS;
                case '-' -> TokenType.MINUS;
                case '*' -> TokenType.STAR;
                case '/' -> TokenType.SLASH;
                case '(' -> TokenType.LPAREN;
                case ')' -> TokenType.RPAREN;
                default -> null;
            };
            if (single != null) {
                pos++;
                tokens.add(new Token(single, String.valueOf(c), start));
            } else if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
                tokens.add(new Token(TokenType.NUMBER, scanNumber(), start));
            } else if (isIdentStart(c)) {
                while (pos < input.length() && isIdentPart(input.charAt(pos)))
                    pos++;
                tokens.add(new Token(TokenType.IDENT, input.substring(start, pos), start));
            } else {
                throw new ExpressionParseException(ParseErrorKind.UNEXPECTED_TOKEN,
                        "Unexpected character '" + c + "'", pos);
            }
        }
    }

    private String scanNumber() {
        int s = pos;
        while (pos < input.length() && isDigit(input.charAt(pos)))
            pos++;
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos)))
                pos++;
        }
        return input.substring(s, pos);
    }

    private void skipWS() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
            pos++;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
