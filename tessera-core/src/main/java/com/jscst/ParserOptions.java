package com.jscst;

/**
 * Read-only parser configuration. Safe to share between parsers running on different threads.
 *
 * @param strictMode                 report strict-mode-only violations such as {@code with}
 * @param allowReturnOutsideFunction accept {@code return} at the top level of a unit
 * @param maxDiagnostics             diagnostics kept per unit; later ones are counted and dropped
 * @param maxRecoverySkip            tokens one resynchronization may discard
 * @param maxNestingDepth            statements and expressions that may be open at once before
 *                                   the rest of the unit is skipped
 */
public record ParserOptions(
    boolean strictMode,
    boolean allowReturnOutsideFunction,
    int maxDiagnostics,
    int maxRecoverySkip,
    int maxNestingDepth
) {
    public static final int DEFAULT_MAX_DIAGNOSTICS = 1000;
    public static final int DEFAULT_MAX_RECOVERY_SKIP = 1024;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public ParserOptions {
        if (maxDiagnostics < 1) {
            throw new IllegalArgumentException("maxDiagnostics must be positive: " + maxDiagnostics);
        }
        if (maxRecoverySkip < 1) {
            throw new IllegalArgumentException("maxRecoverySkip must be positive: " + maxRecoverySkip);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(false, false, DEFAULT_MAX_DIAGNOSTICS, DEFAULT_MAX_RECOVERY_SKIP, DEFAULT_MAX_NESTING_DEPTH);
    }

    public ParserOptions withStrictMode(boolean strictMode) {
        return new ParserOptions(strictMode, allowReturnOutsideFunction, maxDiagnostics, maxRecoverySkip, maxNestingDepth);
    }

    public ParserOptions withAllowReturnOutsideFunction(boolean allow) {
        return new ParserOptions(strictMode, allow, maxDiagnostics, maxRecoverySkip, maxNestingDepth);
    }

    public ParserOptions withMaxDiagnostics(int maxDiagnostics) {
        return new ParserOptions(strictMode, allowReturnOutsideFunction, maxDiagnostics, maxRecoverySkip, maxNestingDepth);
    }

    public ParserOptions withMaxRecoverySkip(int maxRecoverySkip) {
        return new ParserOptions(strictMode, allowReturnOutsideFunction, maxDiagnostics, maxRecoverySkip, maxNestingDepth);
    }

    public ParserOptions withMaxNestingDepth(int maxNestingDepth) {
        return new ParserOptions(strictMode, allowReturnOutsideFunction, maxDiagnostics, maxRecoverySkip, maxNestingDepth);
    }
}
