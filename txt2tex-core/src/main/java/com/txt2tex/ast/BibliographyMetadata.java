package com.txt2tex.ast;

public record BibliographyMetadata(
    int line,
    int column,
    String file,
    String style
) implements Node {
    @Override
    public String type() {
        return "BibliographyMetadata";
    }
}
