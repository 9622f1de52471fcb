package com.jscst.cst;

/**
 * Half-open interval {@code [start, end)} of UTF-16 offsets into the source text.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static Span empty(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public Span union(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    public String slice(CharSequence source) {
        return source.subSequence(start, end).toString();
    }
}
