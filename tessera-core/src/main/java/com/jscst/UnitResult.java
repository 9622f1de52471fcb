package com.jscst;

/**
 * Outcome of parsing one unit of a batch.
 */
public record UnitResult(
    String name,
    Status status,
    ParseResult result,  // null unless PARSED
    Diagnostic fatal     // null unless FATAL
) {
    public enum Status {
        PARSED,
        FATAL,
        TIMED_OUT
    }

    public static UnitResult parsed(String name, ParseResult result) {
        return new UnitResult(name, Status.PARSED, result, null);
    }

    public static UnitResult fatal(String name, Diagnostic fatal) {
        return new UnitResult(name, Status.FATAL, null, fatal);
    }

    public static UnitResult timedOut(String name) {
        return new UnitResult(name, Status.TIMED_OUT, null, null);
    }
}
