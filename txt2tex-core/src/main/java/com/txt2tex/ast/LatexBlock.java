package com.txt2tex.ast;

public record LatexBlock(
    int line,
    int column,
    String latex
) implements DocumentItem {
    @Override
    public String type() {
        return "LatexBlock";
    }
}
