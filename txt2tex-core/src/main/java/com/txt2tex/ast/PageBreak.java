package com.txt2tex.ast;

public record PageBreak(
    int line,
    int column
) implements DocumentItem {
    @Override
    public String type() {
        return "PageBreak";
    }
}
