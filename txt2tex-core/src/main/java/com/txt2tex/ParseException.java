package com.txt2tex;

/**
 * Raised on the first structural violation in a token stream. Carries the
 * offending token so callers can point at the source position.
 */
public class ParseException extends RuntimeException {
    private final String rawMessage;
    private final Token token;

    public ParseException(String message, Token token) {
        super("Line " + token.line() + ", column " + token.column() + ": " + message);
        this.rawMessage = message;
        this.token = token;
    }

    public String getRawMessage() {
        return rawMessage;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token.line();
    }

    public int getColumn() {
        return token.column();
    }
}
