package com.txt2tex.ast;

public record TitleMetadata(
    int line,
    int column,
    String title,
    String subtitle,
    String author,
    String date,
    String institution
) implements Node {
    @Override
    public String type() {
        return "TitleMetadata";
    }
}
