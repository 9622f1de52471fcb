package com.jscst;

import com.jscst.cst.Script;

import java.util.List;

/**
 * A parsed unit: always a tree, plus the diagnostics collected while building it.
 */
public record ParseResult(
    Script script,
    List<Diagnostic> diagnostics,
    int droppedDiagnostics  // diagnostics beyond ParserOptions.maxDiagnostics
) {
    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
