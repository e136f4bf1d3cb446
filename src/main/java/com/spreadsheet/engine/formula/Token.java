package com.spreadsheet.engine.formula;

/**
 * A lexical token. For CELL_REF the text is the reference as written, uppercased
 * (e.g. "$A1"); for STRING it is the unquoted content.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
