package com.txt2tex;

public class UnexpectedTokenException extends ParseException {
    public UnexpectedTokenException(Token token, String context) {
        super("Unexpected " + ExpectedTokenException.describe(token) + " in " + context, token);
    }
}
