package com.jscst;

import com.jscst.cst.Arguments;
import com.jscst.cst.ArrayExpr;
import com.jscst.cst.AssignExpr;
import com.jscst.cst.AssignOp;
import com.jscst.cst.BinaryExpr;
import com.jscst.cst.BinaryOp;
import com.jscst.cst.BracketExpr;
import com.jscst.cst.CallExpr;
import com.jscst.cst.ConditionalExpr;
import com.jscst.cst.Expr;
import com.jscst.cst.GroupingExpr;
import com.jscst.cst.InvalidExpr;
import com.jscst.cst.LiteralExpr;
import com.jscst.cst.LiteralKind;
import com.jscst.cst.LiteralWhitespace;
import com.jscst.cst.MemberExpr;
import com.jscst.cst.NewExpr;
import com.jscst.cst.ObjectExpr;
import com.jscst.cst.ObjectProp;
import com.jscst.cst.SequenceExpr;
import com.jscst.cst.Span;
import com.jscst.cst.UnaryExpr;
import com.jscst.cst.UnaryOp;
import com.jscst.cst.UpdateExpr;
import com.jscst.cst.UpdateOp;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Precedence-climbing expression parser.
 *
 * <p>Binary operators bind according to {@link BinaryOp#bindingPower()}; assignment and
 * {@code **} are right-associative. The {@code noIn} flag keeps {@code in} from being read
 * as an operator inside a {@code for} head.</p>
 */
final class ExpressionParser {

    private final ParseContext ctx;

    ExpressionParser(ParseContext ctx) {
        this.ctx = ctx;
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    /**
     * Expression: AssignmentExpression ( ',' AssignmentExpression )*
     */
    Expr parseExpression(boolean noIn) {
        Expr first = parseAssignment(noIn);
        if (!ctx.check(TokenType.COMMA)) {
            return first;
        }

        List<Expr> exprs = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();
        exprs.add(first);
        while (ctx.check(TokenType.COMMA)) {
            commas.add(ctx.advance().whitespace());
            exprs.add(parseAssignment(noIn));
        }
        return new SequenceExpr(ctx.spanFrom(first.span().start()), exprs, commas);
    }

    Expr parseAssignment(boolean noIn) {
        return nested(() -> parseAssignmentBody(noIn));
    }

    private Expr parseAssignmentBody(boolean noIn) {
        Expr target = parseConditional(noIn);

        AssignOp op = assignOp(ctx.peek().type());
        if (op == null) {
            return target;
        }

        LiteralWhitespace opWhitespace = ctx.advance().whitespace();
        Expr value = parseAssignment(noIn);  // right-associative
        return new AssignExpr(ctx.spanFrom(target.span().start()), target, op, opWhitespace, value);
    }

    private Expr parseConditional(boolean noIn) {
        Expr test = parseBinary(0, noIn);
        if (!ctx.check(TokenType.QUESTION)) {
            return test;
        }

        LiteralWhitespace question = ctx.advance().whitespace();
        Expr cons = parseAssignment(false);
        LiteralWhitespace colon = ctx.expect(TokenType.COLON);
        Expr alt = parseAssignment(noIn);
        return new ConditionalExpr(ctx.spanFrom(test.span().start()), test, question, cons, colon, alt);
    }

    private Expr parseBinary(int minBp, boolean noIn) {
        Expr left = parseUnary();

        while (true) {
            BinaryOp op = binaryOp(ctx.peek().type());
            if (op == null || op.bindingPower() <= minBp || (noIn && op == BinaryOp.IN)) {
                return left;
            }

            LiteralWhitespace opWhitespace = ctx.advance().whitespace();
            int rightBp = op.rightAssociative() ? op.bindingPower() - 1 : op.bindingPower();
            Expr right = nested(() -> parseBinary(rightBp, noIn));
            left = new BinaryExpr(ctx.spanFrom(left.span().start()), left, op, opWhitespace, right);
        }
    }

    private Expr parseUnary() {
        Token token = ctx.peek();

        UnaryOp unary = unaryOp(token.type());
        if (unary != null) {
            ctx.advance();
            Expr operand = nested(this::parseUnary);
            return new UnaryExpr(ctx.spanFrom(token.start()), unary, token.whitespace(), operand);
        }

        UpdateOp update = updateOp(token.type());
        if (update != null) {
            ctx.advance();
            Expr operand = nested(this::parseUnary);
            return new UpdateExpr(ctx.spanFrom(token.start()), true, update, token.whitespace(), operand);
        }

        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr expr = parseLeftHandSide();

        // [no LineTerminator here] before a postfix operator
        Token next = ctx.peek();
        UpdateOp update = updateOp(next.type());
        if (update != null && !next.lineBreakBefore()) {
            ctx.advance();
            return new UpdateExpr(ctx.spanFrom(expr.span().start()), false, update, next.whitespace(), expr);
        }
        return expr;
    }

    // ========================================================================
    // Member, call and new
    // ========================================================================

    private Expr parseLeftHandSide() {
        Expr expr = ctx.check(TokenType.NEW) ? parseNew() : parsePrimary();
        return parseMemberTail(expr, true);
    }

    private Expr parseNew() {
        Token keyword = ctx.advance();
        Expr target = ctx.check(TokenType.NEW) ? nested(this::parseNew) : parsePrimary();
        target = parseMemberTail(target, false);

        Arguments arguments = ctx.check(TokenType.LPAREN) ? parseArguments() : null;
        return new NewExpr(ctx.spanFrom(keyword.start()), keyword.whitespace(), target, arguments);
    }

    /**
     * Apply {@code .name}, {@code [expr]} and, when {@code allowCall} is set, {@code (args)}
     * suffixes to {@code expr}.
     */
    private Expr parseMemberTail(Expr expr, boolean allowCall) {
        while (true) {
            int start = expr.span().start();
            if (ctx.check(TokenType.DOT)) {
                LiteralWhitespace dot = ctx.advance().whitespace();
                LiteralExpr property = propertyName();
                expr = new MemberExpr(ctx.spanFrom(start), expr, dot, property);
            } else if (ctx.check(TokenType.LBRACKET)) {
                LiteralWhitespace open = ctx.advance().whitespace();
                Expr property = parseExpression(false);
                LiteralWhitespace close = ctx.expect(TokenType.RBRACKET);
                expr = new BracketExpr(ctx.spanFrom(start), expr, open, property, close);
            } else if (allowCall && ctx.check(TokenType.LPAREN)) {
                Arguments arguments = parseArguments();
                expr = new CallExpr(ctx.spanFrom(start), expr, arguments);
            } else {
                return expr;
            }
        }
    }

    private Arguments parseArguments() {
        Token open = ctx.advance();
        List<Expr> args = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();

        while (!ctx.check(TokenType.RPAREN) && !ctx.isAtEnd()) {
            args.add(parseAssignment(false));
            if (!ctx.check(TokenType.COMMA)) {
                break;
            }
            commas.add(ctx.advance().whitespace());
        }

        LiteralWhitespace close = ctx.expect(TokenType.RPAREN);
        return new Arguments(ctx.spanFrom(open.start()), open.whitespace(), args, commas, close);
    }

    /**
     * A property name after {@code .}; any keyword is allowed there.
     */
    private LiteralExpr propertyName() {
        Token token = ctx.peek();
        if (token.type() == TokenType.IDENTIFIER || token.type().keyword()) {
            return identifier(ctx.advance());
        }
        return missingIdentifier();
    }

    // ========================================================================
    // Primary expressions
    // ========================================================================

    private Expr parsePrimary() {
        Token token = ctx.peek();

        return switch (token.type()) {
            case IDENTIFIER, LET -> identifier(ctx.advance());
            case THIS -> literal(LiteralKind.THIS);
            case NULL -> literal(LiteralKind.NULL);
            case TRUE -> literal(LiteralKind.TRUE);
            case FALSE -> literal(LiteralKind.FALSE);
            case NUMBER -> literal(LiteralKind.NUMBER);
            case STRING -> literal(LiteralKind.STRING);
            case REGEX -> literal(LiteralKind.REGEX);
            case TEMPLATE -> literal(LiteralKind.TEMPLATE);
            case SLASH, SLASH_ASSIGN -> regex();
            case LPAREN -> parseGrouping();
            case LBRACKET -> parseArray();
            case LBRACE -> parseObject();
            case FUNCTION -> ctx.declarations.parseFunctionExpression();
            default -> invalid(token);
        };
    }

    private LiteralExpr literal(LiteralKind kind) {
        Token token = ctx.advance();
        return new LiteralExpr(token.span(), kind, token.lexeme(), token.whitespace());
    }

    /**
     * A slash where an operand is expected starts a regular expression, even where the
     * lexer took it for division, as after the head of {@code if (x) /re/.test(s)}.
     */
    private LiteralExpr regex() {
        ctx.rescanAsRegex();
        return literal(LiteralKind.REGEX);
    }

    private GroupingExpr parseGrouping() {
        Token open = ctx.advance();
        Expr expr = parseExpression(false);
        LiteralWhitespace close = ctx.expect(TokenType.RPAREN);
        return new GroupingExpr(ctx.spanFrom(open.start()), open.whitespace(), expr, close);
    }

    private ArrayExpr parseArray() {
        Token open = ctx.advance();
        List<Expr> elements = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();

        while (!ctx.check(TokenType.RBRACKET) && !ctx.isAtEnd()) {
            if (ctx.check(TokenType.COMMA)) {
                elements.add(null);  // hole
                commas.add(ctx.advance().whitespace());
                continue;
            }
            elements.add(parseAssignment(false));
            if (!ctx.check(TokenType.COMMA)) {
                break;
            }
            commas.add(ctx.advance().whitespace());
        }

        LiteralWhitespace close = ctx.expect(TokenType.RBRACKET);
        return new ArrayExpr(ctx.spanFrom(open.start()), open.whitespace(), elements, commas, close);
    }

    private ObjectExpr parseObject() {
        Token open = ctx.advance();
        List<ObjectProp> props = new ArrayList<>();
        List<LiteralWhitespace> commas = new ArrayList<>();

        while (!ctx.check(TokenType.RBRACE) && !ctx.isAtEnd()) {
            props.add(parseProperty());
            if (!ctx.check(TokenType.COMMA)) {
                break;
            }
            commas.add(ctx.advance().whitespace());
        }

        LiteralWhitespace close = ctx.expect(TokenType.RBRACE);
        return new ObjectExpr(ctx.spanFrom(open.start()), open.whitespace(), props, commas, close);
    }

    private ObjectProp parseProperty() {
        Token token = ctx.peek();

        Expr key;
        if (token.type() == TokenType.IDENTIFIER || token.type().keyword()) {
            key = identifier(ctx.advance());
        } else if (token.type() == TokenType.STRING) {
            key = literal(LiteralKind.STRING);
        } else if (token.type() == TokenType.NUMBER) {
            key = literal(LiteralKind.NUMBER);
        } else {
            key = invalid(token);
        }

        if (ctx.check(TokenType.COLON)) {
            LiteralWhitespace colon = ctx.advance().whitespace();
            Expr value = parseAssignment(false);
            return new ObjectProp(ctx.spanFrom(key.span().start()), key, colon, value);
        }

        // Shorthand: { a }
        return new ObjectProp(key.span(), key, null, null);
    }

    // ========================================================================
    // Identifiers and placeholders
    // ========================================================================

    /**
     * Run one recursive step one nesting level deeper. When the unit is nested too deeply
     * the step is not run and an empty placeholder stands in for its result.
     */
    private Expr nested(Supplier<Expr> step) {
        if (!ctx.enterNesting()) {
            return new InvalidExpr(Span.empty(ctx.lastEnd()), null);
        }
        try {
            return step.get();
        } finally {
            ctx.exitNesting();
        }
    }

    LiteralExpr identifier(Token token) {
        return new LiteralExpr(token.span(), LiteralKind.IDENTIFIER, ctx.intern(token.lexeme()), token.whitespace());
    }

    /**
     * A name being declared: variable, parameter, function or catch binding.
     */
    LiteralExpr bindingIdentifier() {
        if (ctx.check(TokenType.IDENTIFIER) || ctx.check(TokenType.LET)) {
            return identifier(ctx.advance());
        }
        return missingIdentifier();
    }

    private LiteralExpr missingIdentifier() {
        ctx.reportExpected(TokenType.IDENTIFIER.describe());
        int at = ctx.lastEnd();
        return new LiteralExpr(Span.empty(at), LiteralKind.IDENTIFIER, "", LiteralWhitespace.empty(at));
    }

    /**
     * Report a token that cannot start an expression. Tokens that end a statement or a
     * bracketed list are left for the caller; any other token is consumed into the placeholder.
     */
    private InvalidExpr invalid(Token token) {
        ctx.reportExpected("expression");
        if (isBoundary(token.type())) {
            return new InvalidExpr(Span.empty(ctx.lastEnd()), null);
        }
        ctx.advance();
        return new InvalidExpr(token.span(), token.whitespace());
    }

    private static boolean isBoundary(TokenType type) {
        return switch (type) {
            case SEMICOLON, RBRACE, RPAREN, RBRACKET, COMMA, COLON, EOF,
                 ELSE, CASE, DEFAULT, CATCH, FINALLY -> true;
            default -> StatementParser.startsStatement(type);
        };
    }

    // ========================================================================
    // Operator tables
    // ========================================================================

    private static BinaryOp binaryOp(TokenType type) {
        return switch (type) {
            case QUESTION_QUESTION -> BinaryOp.NULLISH;
            case PIPE_PIPE -> BinaryOp.OR;
            case AMP_AMP -> BinaryOp.AND;
            case PIPE -> BinaryOp.BIT_OR;
            case CARET -> BinaryOp.BIT_XOR;
            case AMP -> BinaryOp.BIT_AND;
            case EQ -> BinaryOp.EQ;
            case NE -> BinaryOp.NOT_EQ;
            case EQ_STRICT -> BinaryOp.STRICT_EQ;
            case NE_STRICT -> BinaryOp.STRICT_NOT_EQ;
            case LT -> BinaryOp.LESS;
            case LE -> BinaryOp.LESS_EQ;
            case GT -> BinaryOp.GREATER;
            case GE -> BinaryOp.GREATER_EQ;
            case IN -> BinaryOp.IN;
            case INSTANCEOF -> BinaryOp.INSTANCEOF;
            case LSHIFT -> BinaryOp.SHL;
            case RSHIFT -> BinaryOp.SHR;
            case URSHIFT -> BinaryOp.USHR;
            case PLUS -> BinaryOp.ADD;
            case MINUS -> BinaryOp.SUB;
            case STAR -> BinaryOp.MUL;
            case SLASH -> BinaryOp.DIV;
            case PERCENT -> BinaryOp.MOD;
            case STAR_STAR -> BinaryOp.EXP;
            default -> null;
        };
    }

    private static AssignOp assignOp(TokenType type) {
        return switch (type) {
            case ASSIGN -> AssignOp.ASSIGN;
            case PLUS_ASSIGN -> AssignOp.ADD_ASSIGN;
            case MINUS_ASSIGN -> AssignOp.SUB_ASSIGN;
            case STAR_ASSIGN -> AssignOp.MUL_ASSIGN;
            case SLASH_ASSIGN -> AssignOp.DIV_ASSIGN;
            case PERCENT_ASSIGN -> AssignOp.MOD_ASSIGN;
            case STAR_STAR_ASSIGN -> AssignOp.EXP_ASSIGN;
            case LSHIFT_ASSIGN -> AssignOp.SHL_ASSIGN;
            case RSHIFT_ASSIGN -> AssignOp.SHR_ASSIGN;
            case URSHIFT_ASSIGN -> AssignOp.USHR_ASSIGN;
            case AMP_ASSIGN -> AssignOp.BIT_AND_ASSIGN;
            case PIPE_ASSIGN -> AssignOp.BIT_OR_ASSIGN;
            case CARET_ASSIGN -> AssignOp.BIT_XOR_ASSIGN;
            case AMP_AMP_ASSIGN -> AssignOp.AND_ASSIGN;
            case PIPE_PIPE_ASSIGN -> AssignOp.OR_ASSIGN;
            case QUESTION_QUESTION_ASSIGN -> AssignOp.NULLISH_ASSIGN;
            default -> null;
        };
    }

    private static UnaryOp unaryOp(TokenType type) {
        return switch (type) {
            case BANG -> UnaryOp.NOT;
            case TILDE -> UnaryOp.BIT_NOT;
            case PLUS -> UnaryOp.PLUS;
            case MINUS -> UnaryOp.MINUS;
            case TYPEOF -> UnaryOp.TYPEOF;
            case VOID -> UnaryOp.VOID;
            case DELETE -> UnaryOp.DELETE;
            default -> null;
        };
    }

    private static UpdateOp updateOp(TokenType type) {
        return switch (type) {
            case PLUS_PLUS -> UpdateOp.INCREMENT;
            case MINUS_MINUS -> UpdateOp.DECREMENT;
            default -> null;
        };
    }
}
