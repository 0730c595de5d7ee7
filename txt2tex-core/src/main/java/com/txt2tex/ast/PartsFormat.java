package com.txt2tex.ast;

public record PartsFormat(
    int line,
    int column,
    String style
) implements DocumentItem {
    @Override
    public String type() {
        return "PartsFormat";
    }
}
