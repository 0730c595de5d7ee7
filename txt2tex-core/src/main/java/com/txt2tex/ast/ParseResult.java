package com.txt2tex.ast;

/**
 * What a parse returns: a whole {@link Document}, or a single {@link Expr} when
 * the input is one bare expression.
 */
public sealed interface ParseResult extends Node permits Document, Expr {
}
