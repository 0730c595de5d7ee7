package com.txt2tex;

/**
 * Raised on the first character the lexer cannot turn into a token.
 */
public class LexerException extends RuntimeException {
    private final String rawMessage;
    private final int line;
    private final int column;

    public LexerException(String message, int line, int column) {
        super("Line " + line + ", column " + column + ": " + message);
        this.rawMessage = message;
        this.line = line;
        this.column = column;
    }

    public String getRawMessage() {
        return rawMessage;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
