package com.exprgraph.parse;

/**
 * A lexical token.
 *
 * @param type     Token category.
 * @param text     Source text of the token (empty for {@link TokenType#END}).
 * @param position Character offset of the token in the source text.
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType t) {
        return type == t;
    }

    /** Human-readable form for error messages. */
    public String describe() {
        return type == TokenType.END ? "end of input" : "'" + text + "'";
    }
}
