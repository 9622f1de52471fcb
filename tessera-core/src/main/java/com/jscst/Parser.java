package com.jscst;

import com.jscst.cst.Script;
import com.jscst.cst.Span;
import com.jscst.cst.StmtListItem;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses one source unit into a lossless concrete syntax tree.
 *
 * <p>Malformed statements never stop the parse: they are reported in the
 * {@link ParseResult} and the tree is completed with placeholders. Only a lexical error
 * such as an unterminated string or comment throws {@link ParseException}. Input nested
 * deeper than {@link ParserOptions#maxNestingDepth()} is reported once and the rest of the
 * unit is skipped.</p>
 *
 * <p>A {@code Parser} holds no state beyond its input, and each call to {@link #parse()}
 * works on a fresh context, so independent units can be parsed on different threads.</p>
 */
public class Parser {

    private static final Logger logger = Logger.getLogger(Parser.class.getName());

    private final String source;
    private final ParserOptions options;

    public Parser(String source) {
        this(source, ParserOptions.defaults());
    }

    public Parser(String source, ParserOptions options) {
        this.source = source;
        this.options = options;
    }

    public static ParseResult parse(String source) {
        return new Parser(source).parse();
    }

    public static ParseResult parse(String source, ParserOptions options) {
        return new Parser(source, options).parse();
    }

    public ParseResult parse() {
        long startTime = System.nanoTime();

        ParseContext ctx = new ParseContext(new Lexer(source), options);
        List<StmtListItem> items = new ArrayList<>();
        try {
            ctx.statements.parseStatementList(items);
        } catch (StackOverflowError e) {
            // The nesting limit bounds the recursion of every routine, but the stack size is
            // set by whoever runs the parser. Items completed before the overflow are kept.
            ctx.abandonTooDeep();
        }

        Token eof = ctx.peek();
        Script script = new Script(new Span(0, source.length()), items, eof.whitespace());
        ParseResult result = new ParseResult(script, ctx.diagnostics(), ctx.droppedDiagnostics());

        if (logger.isLoggable(Level.FINE)) {
            long micros = (System.nanoTime() - startTime) / 1000;
            logger.fine("Parsed " + source.length() + " chars, " + ctx.tokenCount() + " tokens, "
                + items.size() + " items, " + result.diagnostics().size() + " diagnostics in " + micros + "us");
        }
        return result;
    }
}
