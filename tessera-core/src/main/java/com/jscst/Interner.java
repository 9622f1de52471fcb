package com.jscst;

import java.util.HashMap;
import java.util.Map;

/**
 * Identifier table of a single unit. Not thread-safe; each parser owns its own.
 */
final class Interner {

    private final Map<String, String> strings = new HashMap<>();

    String intern(String value) {
        String existing = strings.putIfAbsent(value, value);
        return existing != null ? existing : value;
    }
}
