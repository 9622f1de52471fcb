package com.jscst;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Collects the diagnostics of one unit in the order they are reported.
 */
final class Diagnostics {

    private static final Logger logger = Logger.getLogger(Diagnostics.class.getName());

    private final List<Diagnostic> reported = new ArrayList<>();
    private final int limit;
    private int dropped = 0;

    Diagnostics(int limit) {
        this.limit = limit;
    }

    void report(Diagnostic diagnostic) {
        if (reported.size() < limit) {
            reported.add(diagnostic);
            return;
        }
        if (dropped == 0) {
            logger.fine("Diagnostic limit of " + limit + " reached, dropping further diagnostics");
        }
        dropped++;
    }

    List<Diagnostic> reported() {
        return reported;
    }

    int dropped() {
        return dropped;
    }
}
