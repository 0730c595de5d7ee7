package com.txt2tex;

public class ExpectedTokenException extends ParseException {
    public ExpectedTokenException(String message, Token token) {
        super(message + " (found " + describe(token) + ")", token);
    }

    static String describe(Token token) {
        return switch (token.type()) {
            case EOF -> "end of input";
            case NEWLINE -> "end of line";
            default -> "'" + token.lexeme() + "'";
        };
    }
}
