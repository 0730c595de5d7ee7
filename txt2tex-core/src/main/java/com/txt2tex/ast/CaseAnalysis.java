package com.txt2tex.ast;

import java.util.List;

public record CaseAnalysis(
    int line,
    int column,
    String caseName,
    List<ProofNode> steps
) implements ProofStep {
    @Override
    public String type() {
        return "CaseAnalysis";
    }
}
