package com.jscst;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class UnitParserTest {

    @Test
    void resultsFollowInputOrder() throws Exception {
        Map<String, String> units = new LinkedHashMap<>();
        for (int i = 0; i < 20; i++) {
            units.put("unit" + i + ".js", "var v" + i + " = " + i + ";\nf(v" + i + ")");
        }

        List<UnitResult> results;
        try (UnitParser parser = new UnitParser(4, ParserOptions.defaults(), 0)) {
            results = parser.parseAll(units);
        }

        assertEquals(20, results.size());
        for (int i = 0; i < 20; i++) {
            UnitResult result = results.get(i);
            assertEquals("unit" + i + ".js", result.name());
            assertEquals(UnitResult.Status.PARSED, result.status());
            assertEquals(2, result.result().script().items().size());
            assertFalse(result.result().hasDiagnostics());
        }
    }

    @Test
    void lexicalErrorIsIsolatedToItsUnit() throws Exception {
        Map<String, String> units = new LinkedHashMap<>();
        units.put("good.js", "a();");
        units.put("bad.js", "a = 'unterminated");
        units.put("recovered.js", "a b");

        List<UnitResult> results;
        try (UnitParser parser = new UnitParser(2, ParserOptions.defaults(), 10_000)) {
            results = parser.parseAll(units);
        }

        assertEquals(UnitResult.Status.PARSED, results.get(0).status());

        UnitResult bad = results.get(1);
        assertEquals(UnitResult.Status.FATAL, bad.status());
        assertNull(bad.result());
        assertEquals(DiagnosticKind.LEXICAL_ERROR, bad.fatal().kind());

        UnitResult recovered = results.get(2);
        assertEquals(UnitResult.Status.PARSED, recovered.status());
        assertEquals(DiagnosticKind.ASI_VIOLATION, recovered.result().diagnostics().get(0).kind());
    }

    @Test
    void deeplyNestedUnitDoesNotAbortBatch() throws Exception {
        Map<String, String> units = new LinkedHashMap<>();
        units.put("deep.js", "[".repeat(50000));
        units.put("ok.js", "a;");

        List<UnitResult> results;
        try (UnitParser parser = new UnitParser(2, ParserOptions.defaults(), 0)) {
            results = parser.parseAll(units);
        }

        UnitResult deep = results.get(0);
        assertEquals(UnitResult.Status.PARSED, deep.status());
        assertEquals(DiagnosticKind.NESTING_TOO_DEEP, deep.result().diagnostics().get(0).kind());

        UnitResult ok = results.get(1);
        assertEquals(UnitResult.Status.PARSED, ok.status());
        assertFalse(ok.result().hasDiagnostics());
    }

    @Test
    void optionsApplyToEveryUnit() throws Exception {
        Map<String, String> units = new LinkedHashMap<>();
        units.put("a.js", "with (o) {}");
        units.put("b.js", "with (p) q;");

        List<UnitResult> results;
        try (UnitParser parser = new UnitParser(2, ParserOptions.defaults().withStrictMode(true), 0)) {
            results = parser.parseAll(units);
        }

        for (UnitResult result : results) {
            assertEquals(DiagnosticKind.STRICT_MODE_VIOLATION, result.result().diagnostics().get(0).kind());
        }
    }

    @Test
    void emptyBatch() throws Exception {
        try (UnitParser parser = new UnitParser(1, ParserOptions.defaults(), 0)) {
            assertEquals(List.of(), parser.parseAll(Map.of()));
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new UnitParser(0, ParserOptions.defaults(), 0));
        assertThrows(IllegalArgumentException.class, () -> new UnitParser(1, ParserOptions.defaults(), -1));
    }
}
