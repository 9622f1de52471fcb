package com.jscst;

/**
 * Thrown when a source unit cannot be parsed at all. Only lexical errors are fatal; every
 * other problem is reported as a {@link Diagnostic} on the {@link ParseResult}.
 */
public class ParseException extends RuntimeException {

    private final Diagnostic diagnostic;

    public ParseException(Diagnostic diagnostic) {
        super(describe(diagnostic));
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    private static String describe(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostic.kind()).append(" at ").append(diagnostic.span().start());
        if (diagnostic.expected() != null) {
            sb.append(": expected ").append(diagnostic.expected());
        }
        if (diagnostic.found() != null) {
            sb.append(", found ").append(diagnostic.found());
        }
        return sb.toString();
    }
}
