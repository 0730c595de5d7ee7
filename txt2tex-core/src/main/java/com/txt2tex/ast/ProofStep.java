package com.txt2tex.ast;

/**
 * A child of a proof node: either another node or a case split.
 */
public sealed interface ProofStep extends Node permits ProofNode, CaseAnalysis {
}
