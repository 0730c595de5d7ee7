package com.txt2tex.ast;

public sealed interface DocumentItem extends Node permits
    Expr,
    Section,
    Solution,
    Part,
    Schema,
    AxDef,
    GenDef,
    GivenType,
    FreeType,
    Abbreviation,
    Zed,
    SyntaxBlock,
    TruthTable,
    ArgueChain,
    InfruleBlock,
    ProofTree,
    Paragraph,
    PureParagraph,
    LatexBlock,
    PageBreak,
    Contents,
    PartsFormat {
}
