package com.txt2tex.ast;

/**
 * Expressions and predicates. A bare expression may also stand as a document item.
 */
public sealed interface Expr extends DocumentItem, ParseResult permits
    Identifier,
    NumberLiteral,
    BinaryOp,
    UnaryOp,
    Quantifier,
    Lambda,
    Conditional,
    GuardedBranch,
    GuardedCases,
    SetLiteral,
    SetComprehension,
    SequenceLiteral,
    BagLiteral,
    Tuple,
    TupleProjection,
    FunctionApp,
    FunctionType,
    GenericInstantiation,
    Range,
    RelationalImage,
    Subscript,
    Superscript {
}
