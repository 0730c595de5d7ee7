package com.txt2tex.ast;

import java.util.List;

/**
 * A parsed document: its ordered top-level items plus any title and bibliography settings.
 */
public record Document(
    int line,
    int column,
    List<DocumentItem> items,
    TitleMetadata titleMetadata,
    BibliographyMetadata bibliographyMetadata
) implements ParseResult {
    @Override
    public String type() {
        return "Document";
    }
}
