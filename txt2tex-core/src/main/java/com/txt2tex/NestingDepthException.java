package com.txt2tex;

/**
 * Raised when expressions or blocks nest deeper than the parser's configured limit.
 */
public class NestingDepthException extends ParseException {
    private final int maxDepth;

    public NestingDepthException(int maxDepth, Token token) {
        super("Nesting exceeds maximum depth of " + maxDepth, token);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
