package com.txt2tex.ast;

public record PureParagraph(
    int line,
    int column,
    String text
) implements DocumentItem {
    @Override
    public String type() {
        return "PureParagraph";
    }
}
