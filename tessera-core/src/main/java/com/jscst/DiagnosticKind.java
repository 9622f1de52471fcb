package com.jscst;

public enum DiagnosticKind {
    /** A mandatory token is missing or a different one is in its place. */
    EXPECTED_TOKEN,
    /** A statement that needs a semicolon is followed on the same line by something else. */
    ASI_VIOLATION,
    /** A token that cannot start a statement or expression. */
    UNEXPECTED_TOKEN,
    DUPLICATE_DEFAULT,
    MISSING_CATCH_OR_FINALLY,
    ILLEGAL_LINE_BREAK,
    ILLEGAL_JUMP,
    UNDEFINED_LABEL,
    ILLEGAL_RETURN,
    DECLARATION_NOT_ALLOWED,
    STRICT_MODE_VIOLATION,
    /**
     * Statements or expressions nested deeper than {@link ParserOptions#maxNestingDepth()}.
     * The rest of the unit is skipped and no later diagnostic is recorded.
     */
    NESTING_TOO_DEEP,
    /** Fatal: unterminated string, comment, template or regular expression. */
    LEXICAL_ERROR
}
