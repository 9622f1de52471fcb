package com.jscst.tools;

import com.jscst.Diagnostic;
import com.jscst.DiagnosticKind;
import com.jscst.cst.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CstToolTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        CstTool.Config config = CstTool.Config.parse(args);
        assertNotNull(config);
        return new CstTool(config,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)).run();
    }

    @Test
    void testCheckCleanDirectory() throws Exception {
        Files.writeString(dir.resolve("a.js"), "var a = 1;");
        Files.writeString(dir.resolve("b.mjs"), "f(a)\n");
        Files.writeString(dir.resolve("notes.txt"), "not javascript at all {");

        assertEquals(0, run(dir.toString()));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testCheckReportsDiagnostics() throws Exception {
        Path file = dir.resolve("bad.js");
        Files.writeString(file, "a b");

        assertEquals(1, run("--mode=check", file.toString()));
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains(file + ":2-3 ASI_VIOLATION"), printed);
    }

    @Test
    void testFatalErrorGoesToStderr() throws Exception {
        Path file = dir.resolve("broken.js");
        Files.writeString(file, "/* never closed");

        assertEquals(1, run(file.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("LEXICAL_ERROR"));
    }

    @Test
    void testUnreadableFileDoesNotStopOthers() throws Exception {
        Path latin1 = dir.resolve("latin1.js");
        Files.write(latin1, new byte[] {'s', ' ', '=', ' ', '\'', (byte) 0xE9, '\'', ';'});
        Path next = dir.resolve("next.js");
        Files.writeString(next, "a b");

        assertEquals(1, run(dir.toString()));
        String errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains(latin1 + ": cannot read: java.nio.charset.MalformedInputException"), errors);
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains(next + ":2-3 ASI_VIOLATION"), printed);
    }

    @Test
    void testJsonMode() throws Exception {
        Path file = dir.resolve("ok.js");
        Files.writeString(file, "x;");

        assertEquals(0, run("--mode=json", "--threads=1", file.toString()));
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("\"type\":\"ExprStmt\""), printed);
        assertTrue(printed.contains("\"diagnostics\":[]"), printed);
    }

    @Test
    void testStrictFlag() throws Exception {
        Path file = dir.resolve("with.js");
        Files.writeString(file, "with (o) {}");

        assertEquals(0, run(file.toString()));
        assertEquals(1, run("--strict", file.toString()));
    }

    @Test
    void testInvalidArguments() {
        assertNull(CstTool.Config.parse(new String[0]));
        assertNull(CstTool.Config.parse(new String[] {"--threads=0", "a.js"}));
        assertNull(CstTool.Config.parse(new String[] {"--mode=xml", "a.js"}));
        assertNull(CstTool.Config.parse(new String[] {"--bogus", "a.js"}));
        assertNull(CstTool.Config.parse(new String[] {"--help"}));
    }

    @Test
    void testFormat() {
        Diagnostic diagnostic = new Diagnostic(DiagnosticKind.EXPECTED_TOKEN, new Span(4, 5), "')'", "';'");
        assertEquals("x.js:4-5 EXPECTED_TOKEN expected ')', found ';'", CstTool.format("x.js", diagnostic));
    }
}
