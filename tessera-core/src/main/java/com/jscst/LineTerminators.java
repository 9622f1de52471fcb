package com.jscst;

/**
 * The line terminator predicate that automatic semicolon insertion and the restricted
 * productions are decided by.
 */
public final class LineTerminators {

    private LineTerminators() {
        // Utility class
    }

    public static boolean isLineTerminator(char ch) {
        return ch == '\n' || ch == '\r' || ch == '\u2028' || ch == '\u2029';
    }

    public static boolean containsLineTerminator(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            if (isLineTerminator(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsLineTerminator(CharSequence source, int start, int end) {
        for (int i = start; i < end; i++) {
            if (isLineTerminator(source.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
