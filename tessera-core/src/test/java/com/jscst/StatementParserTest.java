package com.jscst;

import com.jscst.cst.AssignExpr;
import com.jscst.cst.BlockStmt;
import com.jscst.cst.BreakStmt;
import com.jscst.cst.CallExpr;
import com.jscst.cst.Case;
import com.jscst.cst.CstWalker;
import com.jscst.cst.DoWhileStmt;
import com.jscst.cst.EmptyStmt;
import com.jscst.cst.ExprKind;
import com.jscst.cst.ExprStmt;
import com.jscst.cst.ForInStmt;
import com.jscst.cst.ForStmt;
import com.jscst.cst.FunctionDecl;
import com.jscst.cst.IfStmt;
import com.jscst.cst.InvalidExpr;
import com.jscst.cst.LabelledStmt;
import com.jscst.cst.LiteralExpr;
import com.jscst.cst.LiteralKind;
import com.jscst.cst.MemberExpr;
import com.jscst.cst.ReturnStmt;
import com.jscst.cst.Semicolon;
import com.jscst.cst.Span;
import com.jscst.cst.StmtKind;
import com.jscst.cst.StmtListItem;
import com.jscst.cst.SwitchStmt;
import com.jscst.cst.ThrowStmt;
import com.jscst.cst.TryStmt;
import com.jscst.cst.VarKind;
import com.jscst.cst.VarStmt;
import com.jscst.cst.WhileStmt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParserTest {

    private static final ParserOptions SCRIPT_RETURN = ParserOptions.defaults().withAllowReturnOutsideFunction(true);

    private static ParseResult parseClean(String source) {
        return parseClean(source, ParserOptions.defaults());
    }

    private static ParseResult parseClean(String source, ParserOptions options) {
        ParseResult result = Parser.parse(source, options);
        assertEquals(List.of(), result.diagnostics(), "diagnostics for: " + source);
        assertEquals(List.of(), CstWalker.checkSpans(result.script()), "span violations for: " + source);
        return result;
    }

    private static List<DiagnosticKind> kinds(ParseResult result) {
        return result.diagnostics().stream().map(Diagnostic::kind).toList();
    }

    private static StmtListItem single(ParseResult result) {
        List<StmtListItem> items = result.script().items();
        assertEquals(1, items.size(), "items: " + items);
        return items.get(0);
    }

    // ========================================================================
    // Semicolons and ASI
    // ========================================================================

    @Test
    @DisplayName("if/else: explicit semicolon before else, implicit at end of input")
    void ifElseSemicolons() {
        IfStmt stmt = (IfStmt) single(parseClean("if (x) y; else z"));

        assertEquals(new Span(0, 16), stmt.span());
        ExprStmt cons = (ExprStmt) stmt.cons();
        ExprStmt alt = (ExprStmt) stmt.alt();

        Semicolon.Explicit semi = assertInstanceOf(Semicolon.Explicit.class, cons.semi());
        assertEquals(new Span(8, 9), semi.span().orElseThrow());
        assertEquals(new Span(7, 9), cons.span());
        assertSame(Semicolon.IMPLICIT, alt.semi());
        assertEquals(new Span(15, 16), alt.span());
        assertNotNull(stmt.elseWhitespace());
    }

    @Test
    void lineBreakInsertsSemicolon() {
        List<StmtListItem> items = parseClean("a = 1\nb = 2").script().items();
        assertEquals(2, items.size());
        assertSame(Semicolon.IMPLICIT, ((ExprStmt) items.get(0)).semi());
        assertEquals(new Span(0, 5), items.get(0).span());
    }

    @Test
    void closingBraceInsertsSemicolon() {
        BlockStmt block = (BlockStmt) single(parseClean("{ a }"));
        assertSame(Semicolon.IMPLICIT, ((ExprStmt) block.stmts().get(0)).semi());
        assertEquals(new Span(0, 5), block.span());
    }

    @Test
    @DisplayName("return followed by a line break returns nothing")
    void restrictedReturn() {
        List<StmtListItem> items = parseClean("return\n5;", SCRIPT_RETURN).script().items();
        assertEquals(2, items.size());

        ReturnStmt ret = (ReturnStmt) items.get(0);
        assertNull(ret.value());
        assertSame(Semicolon.IMPLICIT, ret.semi());
        assertEquals(new Span(0, 6), ret.span());

        ExprStmt five = (ExprStmt) items.get(1);
        assertInstanceOf(Semicolon.Explicit.class, five.semi());
        assertEquals("5", ((LiteralExpr) five.expr()).raw());
    }

    @Test
    void returnInsideFunction() {
        FunctionDecl fn = (FunctionDecl) single(parseClean("function f(a, b) { return a + b; }"));
        assertEquals("f", fn.name().raw());
        assertEquals(2, fn.params().params().size());
        ReturnStmt ret = (ReturnStmt) fn.body().stmts().get(0);
        assertEquals(ExprKind.BINARY, ret.value().kind());
    }

    @Test
    void returnAtTopLevelIsReported() {
        ParseResult result = Parser.parse("return 1;");
        assertEquals(List.of(DiagnosticKind.ILLEGAL_RETURN), kinds(result));
        assertEquals(StmtKind.RETURN, ((ReturnStmt) single(result)).kind());
    }

    @Test
    void asiViolationResynchronizesAtLineBreak() {
        ParseResult result = Parser.parse("a = 1 b = 2\nc;");
        assertEquals(List.of(DiagnosticKind.ASI_VIOLATION), kinds(result));
        assertEquals(new Span(6, 7), result.diagnostics().get(0).span());

        List<StmtListItem> items = result.script().items();
        assertEquals(2, items.size());
        assertInstanceOf(AssignExpr.class, ((ExprStmt) items.get(0)).expr());
        assertEquals("c", ((LiteralExpr) ((ExprStmt) items.get(1)).expr()).raw());
    }

    @Test
    void asiViolationStopsAtStatementKeyword() {
        ParseResult result = Parser.parse("x y z if (a) b;");
        assertEquals(List.of(DiagnosticKind.ASI_VIOLATION), kinds(result));
        List<StmtListItem> items = result.script().items();
        assertEquals(2, items.size());
        assertEquals(StmtKind.IF, ((IfStmt) items.get(1)).kind());
    }

    @Test
    void throwRequiresOperandOnSameLine() {
        ParseResult result = Parser.parse("throw\nerr;");
        assertEquals(List.of(DiagnosticKind.ILLEGAL_LINE_BREAK), kinds(result));
        ThrowStmt stmt = (ThrowStmt) single(result);
        assertEquals("err", ((LiteralExpr) stmt.arg()).raw());
    }

    @Test
    void debuggerIsExpressionStatement() {
        ExprStmt stmt = (ExprStmt) single(parseClean("debugger;"));
        assertEquals(LiteralKind.DEBUGGER, ((LiteralExpr) stmt.expr()).literalKind());
        assertEquals(new Span(0, 9), stmt.span());
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    @Test
    void variableDeclarators() {
        VarStmt stmt = (VarStmt) single(parseClean("var a = 1, b;"));
        assertEquals(VarKind.VAR, stmt.declarationKind());
        assertEquals(2, stmt.declared().size());
        assertEquals(1, stmt.commaWhitespaces().size());
        assertEquals(new Span(4, 9), stmt.declared().get(0).span());
        assertNull(stmt.declared().get(1).value());
        assertEquals(new Span(0, 13), stmt.span());
    }

    @Test
    void letIsDeclarationOnlyBeforeName() {
        VarStmt decl = (VarStmt) single(parseClean("let x = 1;"));
        assertEquals(VarKind.LET, decl.declarationKind());

        ExprStmt assign = (ExprStmt) single(parseClean("let = 1;"));
        assertEquals(ExprKind.ASSIGN, assign.expr().kind());
    }

    @Test
    void functionInStatementPositionIsReported() {
        ParseResult result = Parser.parse("if (x) function f() {}");
        assertEquals(List.of(DiagnosticKind.DECLARATION_NOT_ALLOWED), kinds(result));
        IfStmt stmt = (IfStmt) single(result);
        assertEquals(ExprKind.FUNCTION, ((ExprStmt) stmt.cons()).expr().kind());
    }

    // ========================================================================
    // Compound statements
    // ========================================================================

    @Test
    void switchWithDefault() {
        SwitchStmt stmt = (SwitchStmt) single(parseClean("switch (x) { case 1: a(); break; default: b(); }"));
        assertEquals(2, stmt.cases().size());

        Case first = stmt.cases().get(0);
        assertFalse(first.isDefault());
        assertEquals(2, first.cons().size());
        assertEquals(StmtKind.BREAK, ((BreakStmt) first.cons().get(1)).kind());

        Case second = stmt.cases().get(1);
        assertTrue(second.isDefault());
        assertNull(second.test());
    }

    @Test
    void duplicateDefaultIsKeptAsCase() {
        ParseResult result = Parser.parse("switch (x) { default: a; default: b; }");
        assertEquals(List.of(DiagnosticKind.DUPLICATE_DEFAULT), kinds(result));

        SwitchStmt stmt = (SwitchStmt) single(result);
        assertEquals(2, stmt.cases().size());
        assertTrue(stmt.cases().get(0).isDefault());

        Case duplicate = stmt.cases().get(1);
        assertFalse(duplicate.isDefault());
        assertInstanceOf(InvalidExpr.class, duplicate.test());
        assertEquals(new Span(32, 32), duplicate.test().span());
        assertEquals(List.of(), CstWalker.checkSpans(result.script()));
    }

    @Test
    void whileLoop() {
        WhileStmt stmt = (WhileStmt) single(parseClean("while (i < 10) i++;"));
        assertEquals(ExprKind.BINARY, stmt.condition().kind());
        assertEquals(ExprKind.UPDATE, ((ExprStmt) stmt.cons()).expr().kind());
    }

    @Test
    void doWhileEndsAfterParenWithoutSemicolon() {
        List<StmtListItem> items = parseClean("do x++; while (y) z()").script().items();
        assertEquals(2, items.size());

        DoWhileStmt loop = (DoWhileStmt) items.get(0);
        assertSame(Semicolon.IMPLICIT, loop.semi());
        assertEquals(new Span(0, 17), loop.span());
        assertEquals(ExprKind.CALL, ((ExprStmt) items.get(1)).expr().kind());
    }

    @Test
    void doWhileWithSemicolon() {
        DoWhileStmt loop = (DoWhileStmt) single(parseClean("do {} while (false);"));
        assertInstanceOf(Semicolon.Explicit.class, loop.semi());
        assertEquals(new Span(0, 20), loop.span());
    }

    @Test
    void classicForLoop() {
        ForStmt stmt = (ForStmt) single(parseClean("for (var i = 0; i < n; i++) {}"));
        VarStmt init = (VarStmt) stmt.init();
        assertSame(Semicolon.IMPLICIT, init.semi());
        assertEquals(new Span(5, 14), init.span());
        assertEquals(ExprKind.BINARY, stmt.test().kind());
        assertEquals(ExprKind.UPDATE, stmt.update().kind());
        assertEquals(StmtKind.BLOCK, stmt.body().kind());
    }

    @Test
    void emptyForHead() {
        ForStmt stmt = (ForStmt) single(parseClean("for (;;) ;"));
        assertNull(stmt.init());
        assertNull(stmt.test());
        assertNull(stmt.update());
        assertInstanceOf(EmptyStmt.class, stmt.body());
    }

    @Test
    void forInLoops() {
        ForInStmt withVar = (ForInStmt) single(parseClean("for (var k in o) {}"));
        assertInstanceOf(VarStmt.class, withVar.left());

        ForInStmt withExpr = (ForInStmt) single(parseClean("for (k in o) ;"));
        assertEquals("k", ((LiteralExpr) withExpr.left()).raw());
        assertEquals("o", ((LiteralExpr) withExpr.right()).raw());
    }

    @Test
    void inInsideParenthesesIsAllowedInForInit() {
        ForStmt stmt = (ForStmt) single(parseClean("for (var a = (b in c); a; ) {}"));
        assertEquals(ExprKind.GROUPING, ((VarStmt) stmt.init()).declared().get(0).value().kind());
    }

    @Test
    void tryCatchFinally() {
        TryStmt stmt = (TryStmt) single(parseClean("try { a(); } catch (e) { b(); } finally { c(); }"));
        assertEquals("e", stmt.handler().param().raw());
        assertNotNull(stmt.finalizer());
        assertNotNull(stmt.finalWhitespace());
    }

    @Test
    void tryFinallyWithoutCatch() {
        TryStmt stmt = (TryStmt) single(parseClean("try {} finally {}"));
        assertNull(stmt.handler());
        assertNotNull(stmt.finalizer());
    }

    @Test
    void catchWithoutBinding() {
        TryStmt stmt = (TryStmt) single(parseClean("try {} catch {}"));
        assertNull(stmt.handler().param());
        assertNull(stmt.handler().openParenWhitespace());
    }

    @Test
    void bareTryIsReported() {
        ParseResult result = Parser.parse("try {}");
        assertEquals(List.of(DiagnosticKind.MISSING_CATCH_OR_FINALLY), kinds(result));
        TryStmt stmt = (TryStmt) single(result);
        assertNull(stmt.handler());
        assertNull(stmt.finalizer());
    }

    @Test
    void withIsRejectedOnlyInStrictMode() {
        parseClean("with (o) { x; }");
        ParseResult strict = Parser.parse("with (o) { x; }", ParserOptions.defaults().withStrictMode(true));
        assertEquals(List.of(DiagnosticKind.STRICT_MODE_VIOLATION), kinds(strict));
    }

    @Test
    @DisplayName("A slash that starts a statement body is a regular expression")
    void regexAfterStatementHead() {
        IfStmt stmt = (IfStmt) single(parseClean("if (x) /re/.test(s);"));
        CallExpr call = (CallExpr) ((ExprStmt) stmt.cons()).expr();
        LiteralExpr regex = (LiteralExpr) ((MemberExpr) call.callee()).object();
        assertEquals(LiteralKind.REGEX, regex.literalKind());
        assertEquals("/re/", regex.raw());
        assertEquals(new Span(7, 11), regex.span());

        List<StmtListItem> items = parseClean("{}\n/=/g.exec(s)").script().items();
        assertEquals(StmtKind.BLOCK, ((BlockStmt) items.get(0)).kind());
        CallExpr exec = (CallExpr) ((ExprStmt) items.get(1)).expr();
        assertEquals("/=/g", ((LiteralExpr) ((MemberExpr) exec.callee()).object()).raw());
    }

    @Test
    void slashAfterOperandStaysDivision() {
        ExprStmt stmt = (ExprStmt) single(parseClean("(a) / b / c;"));
        assertEquals(ExprKind.BINARY, stmt.expr().kind());
        ExprStmt object = (ExprStmt) single(parseClean("x = {} / 2"));
        assertEquals(ExprKind.ASSIGN, object.expr().kind());
    }

    // ========================================================================
    // Labels and jumps
    // ========================================================================

    @Test
    void labelledJumps() {
        LabelledStmt outer = (LabelledStmt) single(parseClean(
            "outer: for (;;) { inner: while (x) { continue outer; break inner; } }"));
        assertEquals("outer", outer.label().raw());
        assertEquals(StmtKind.FOR, outer.body().kind());
    }

    @Test
    void breakOutsideLoopIsReported() {
        assertEquals(List.of(DiagnosticKind.ILLEGAL_JUMP), kinds(Parser.parse("break;")));
        assertEquals(List.of(DiagnosticKind.ILLEGAL_JUMP), kinds(Parser.parse("continue;")));
    }

    @Test
    void undefinedLabelIsReported() {
        ParseResult result = Parser.parse("while (x) { break nowhere; }");
        assertEquals(List.of(DiagnosticKind.UNDEFINED_LABEL), kinds(result));
    }

    @Test
    void continueToNonLoopLabelIsReported() {
        ParseResult result = Parser.parse("a: { while (x) continue a; }");
        assertEquals(List.of(DiagnosticKind.ILLEGAL_JUMP), kinds(result));
    }

    @Test
    void labelIsScopedToItsBody() {
        ParseResult result = Parser.parse("a: ;\nwhile (x) break a;");
        assertEquals(List.of(DiagnosticKind.UNDEFINED_LABEL), kinds(result));
    }

    @Test
    void labelOnNextLineIsNotJumpTarget() {
        List<StmtListItem> items = parseClean("a: while (x) { break\na; }").script().items();
        LabelledStmt labelled = (LabelledStmt) items.get(0);
        BlockStmt body = (BlockStmt) ((WhileStmt) labelled.body()).cons();
        assertNull(((BreakStmt) body.stmts().get(0)).label());
        assertEquals(2, body.stmts().size());
    }

    @Test
    void functionBodyResetsJumpTargets() {
        ParseResult result = Parser.parse("while (x) { function f() { break; } }");
        assertEquals(List.of(DiagnosticKind.ILLEGAL_JUMP), kinds(result));
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    @Test
    void strayClosersAreSkipped() {
        ParseResult result = Parser.parse(") ] } a;");
        assertEquals(
            List.of(DiagnosticKind.UNEXPECTED_TOKEN, DiagnosticKind.UNEXPECTED_TOKEN, DiagnosticKind.UNEXPECTED_TOKEN),
            kinds(result));
        assertEquals(1, result.script().items().size());
    }

    @Test
    void missingTokensBecomePlaceholders() {
        ParseResult result = Parser.parse("if (");
        assertFalse(result.diagnostics().isEmpty());
        IfStmt stmt = (IfStmt) single(result);
        assertEquals(new Span(0, 4), stmt.span());
        assertEquals(0, stmt.closeParenWhitespace().tokenSpan().length());
        assertEquals(List.of(), CstWalker.checkSpans(result.script()));
    }

    @Test
    void missingBlockBecomesEmptyBlock() {
        ParseResult result = Parser.parse("try catch (e) {}");
        assertEquals(List.of(DiagnosticKind.EXPECTED_TOKEN), kinds(result));
        TryStmt stmt = (TryStmt) single(result);
        assertEquals(new Span(3, 3), stmt.test().span());
        assertTrue(stmt.test().stmts().isEmpty());
    }

    @Test
    void malformedInputAlwaysTerminatesWithWellFormedSpans() {
        String[] inputs = {
            "var ;", "for (", "switch (x) { foo; case 1: }", "a +", "function (", "x = {a:, b}",
            "do while", "f(1, 2", "[1, 2", "try { } catch (", "var a = 1 2 3", "else x", "case 1:",
            "{{{{", "}}}}", "if (a) else b", "(((", "a ? b", "new", "label: }"
        };
        for (String input : inputs) {
            ParseResult result = assertDoesNotThrow(() -> Parser.parse(input), input);
            assertTrue(result.hasDiagnostics(), "expected diagnostics for: " + input);
            assertEquals(List.of(), CstWalker.checkSpans(result.script()), "span violations for: " + input);
        }
    }

    @Test
    void diagnosticsAreCapped() {
        ParseResult result = Parser.parse(") ) ) ) )", ParserOptions.defaults().withMaxDiagnostics(2));
        assertEquals(2, result.diagnostics().size());
        assertEquals(3, result.droppedDiagnostics());
    }

    @Test
    void lexicalErrorIsFatal() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("var s = \"open;"));
        assertEquals(DiagnosticKind.LEXICAL_ERROR, e.diagnostic().kind());
    }

    @Test
    void recoverySkipIsBounded() {
        ParseResult result = Parser.parse("a b c d e f g h", ParserOptions.defaults().withMaxRecoverySkip(2));
        assertEquals(
            List.of(DiagnosticKind.ASI_VIOLATION, DiagnosticKind.ASI_VIOLATION, DiagnosticKind.ASI_VIOLATION),
            kinds(result));
        assertEquals(
            List.of(2, 8, 14),
            result.diagnostics().stream().map(d -> d.span().start()).toList());
        // a, d and g each start a statement after two skipped tokens
        assertEquals(3, result.script().items().size());
        assertEquals(List.of(), CstWalker.checkSpans(result.script()));
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.defaults().withMaxDiagnostics(0));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.defaults().withMaxRecoverySkip(0));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.defaults().withMaxNestingDepth(0));
    }

    // ========================================================================
    // Nesting limit
    // ========================================================================

    @Test
    @DisplayName("Deeply nested input is reported once and never overflows the stack")
    void deepNestingIsReported() {
        String[] inputs = {
            "(".repeat(50000), "{".repeat(50000), "[".repeat(50000), "if (a) ".repeat(50000) + "b;",
            "function f() {".repeat(50000), "x = {a: ".repeat(50000), "!".repeat(50000) + "a;",
            "a = ".repeat(50000) + "b;", "a ** ".repeat(50000) + "b;", "new ".repeat(50000) + "a;",
            "l: ".repeat(50000) + "x;"
        };
        for (String input : inputs) {
            String label = input.substring(0, 16);
            ParseResult result = assertDoesNotThrow(() -> Parser.parse(input), label);
            assertEquals(List.of(DiagnosticKind.NESTING_TOO_DEEP), kinds(result), label);
            assertEquals(List.of(), CstWalker.checkSpans(result.script()), "span violations for: " + label);
        }
    }

    @Test
    void nestingLimitPointsAtFirstTokenTooDeep() {
        ParseResult result = Parser.parse("(".repeat(50000));
        Diagnostic diagnostic = result.diagnostics().get(0);
        // One level for the statement, one per parenthesized expression
        int offset = ParserOptions.DEFAULT_MAX_NESTING_DEPTH - 1;
        assertEquals(new Span(offset, offset + 1), diagnostic.span());
        assertEquals(1, result.script().items().size());
    }

    @Test
    void nestedTooDeepLeavesPlaceholders() {
        ParseResult result = Parser.parse("((a)); b;", ParserOptions.defaults().withMaxNestingDepth(3));
        assertEquals(List.of(DiagnosticKind.NESTING_TOO_DEEP), kinds(result));
        assertEquals(new Span(2, 3), result.diagnostics().get(0).span());

        ExprStmt stmt = (ExprStmt) single(result);
        assertEquals(new Span(0, 9), stmt.span());
        assertEquals(Semicolon.IMPLICIT, stmt.semi());
        assertEquals(List.of(), CstWalker.checkSpans(result.script()));
    }

    @Test
    void statementsWithinLimitParseCleanly() {
        String source = "{".repeat(100) + "a;" + "}".repeat(100);
        // 100 blocks, the inner statement and its expression
        parseClean(source, ParserOptions.defaults().withMaxNestingDepth(102));
        assertEquals(List.of(DiagnosticKind.NESTING_TOO_DEEP),
            kinds(Parser.parse(source, ParserOptions.defaults().withMaxNestingDepth(101))));
    }

    @Test
    void stackOverflowKeepsCompletedItems() throws Exception {
        String source = "a;\n" + "(".repeat(200_000);
        ParserOptions unlimited = ParserOptions.defaults().withMaxNestingDepth(Integer.MAX_VALUE);
        AtomicReference<Object> outcome = new AtomicReference<>();

        Thread thread = new Thread(null, () -> {
            try {
                outcome.set(Parser.parse(source, unlimited));
            } catch (Throwable t) {
                outcome.set(t);
            }
        }, "small-stack", 256 * 1024);
        thread.start();
        thread.join();

        ParseResult result = assertInstanceOf(ParseResult.class, outcome.get());
        assertEquals(List.of(DiagnosticKind.NESTING_TOO_DEEP), kinds(result));
        assertInstanceOf(ExprStmt.class, single(result));
    }
}
