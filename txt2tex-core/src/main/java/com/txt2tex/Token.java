package com.txt2tex;

/**
 * A lexical unit with its 1-based source position.
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    /** Column just past the last character of this token, on the same line. */
    public int endColumn() {
        return column + lexeme.length();
    }

    /** True when {@code next} starts exactly where this token ends. */
    public boolean isAdjacentTo(Token next) {
        return next.line == line && next.column == endColumn();
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "') at " + line + ":" + column;
    }
}
