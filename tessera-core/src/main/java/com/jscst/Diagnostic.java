package com.jscst;

import com.jscst.cst.Span;

/**
 * A problem found while parsing. {@code expected} and {@code found} describe tokens or
 * constructs; either may be null when it does not apply.
 */
public record Diagnostic(
    DiagnosticKind kind,
    Span span,
    String expected,  // Can be null
    String found      // Can be null
) {
}
