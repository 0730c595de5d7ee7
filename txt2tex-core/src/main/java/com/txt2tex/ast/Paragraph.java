package com.txt2tex.ast;

public record Paragraph(
    int line,
    int column,
    String text
) implements DocumentItem {
    @Override
    public String type() {
        return "Paragraph";
    }
}
