package com.txt2tex.ast;

/**
 * Base interface for all txt2tex AST nodes. Positions are 1-based and refer to
 * the token that starts the node.
 */
public sealed interface Node permits
    ParseResult,
    DocumentItem,
    ProofStep,
    Declaration,
    FreeBranch,
    SyntaxDefinition,
    ArgueStep,
    InfruleLine,
    TitleMetadata,
    BibliographyMetadata {

    String type();
    int line();
    int column();
}
