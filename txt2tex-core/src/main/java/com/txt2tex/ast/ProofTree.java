package com.txt2tex.ast;

public record ProofTree(
    int line,
    int column,
    ProofNode conclusion
) implements DocumentItem {
    @Override
    public String type() {
        return "ProofTree";
    }
}
