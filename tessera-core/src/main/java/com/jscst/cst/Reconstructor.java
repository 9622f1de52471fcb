package com.jscst.cst;

/**
 * Rebuilds source text from a tree by emitting, for every token in order, its leading
 * trivia, the token and its trailing trivia.
 */
public final class Reconstructor {

    private Reconstructor() {
    }

    /**
     * @param script a tree parsed from {@code source}
     * @param source the text the tree was parsed from; spans index into it
     * @return {@code source} itself when the tree holds every token, which is the case for
     *         any input parsed without diagnostics
     */
    public static String print(Script script, String source) {
        StringBuilder out = new StringBuilder(source.length());
        for (LiteralWhitespace token : CstWalker.tokens(script)) {
            out.append(source, token.before().start(), token.after().end());
        }
        return out.toString();
    }
}
