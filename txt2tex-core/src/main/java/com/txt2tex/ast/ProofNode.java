package com.txt2tex.ast;

import java.util.List;

/**
 * One line of a proof tree and the lines indented beneath it.
 *
 * <p>{@code label} is the {@code [n]} written before the expression,
 * {@code justification} the bracketed text after it. {@code sibling} marks a
 * line introduced by {@code ::}. {@code indentLevel} is the line's column
 * relative to the first line of the proof.
 */
public record ProofNode(
    int line,
    int column,
    Expr expression,
    String justification,
    Integer label,
    boolean assumption,
    boolean sibling,
    List<ProofStep> children,
    int indentLevel
) implements ProofStep {
    @Override
    public String type() {
        return "ProofNode";
    }
}
