package com.jscst.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Source-order traversal of concrete syntax trees.
 *
 * <p>{@link #forEachInOrder(Node, CstVisitor)} is the single place that knows the layout of
 * every node; {@link #children}, {@link #tokens}, {@link #checkSpans} and
 * {@link Reconstructor} are built on it.</p>
 */
public final class CstWalker {

    private CstWalker() {
    }

    /**
     * The direct child nodes of {@code node} in source order.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        forEachInOrder(node, new CstVisitor() {
            @Override
            public void child(Node child) {
                children.add(child);
            }
        });
        return children;
    }

    /**
     * Every token in the subtree of {@code node} in source order.
     */
    public static List<LiteralWhitespace> tokens(Node node) {
        List<LiteralWhitespace> tokens = new ArrayList<>();
        collectTokens(node, tokens);
        return tokens;
    }

    private static void collectTokens(Node node, List<LiteralWhitespace> tokens) {
        forEachInOrder(node, new CstVisitor() {
            @Override
            public void token(LiteralWhitespace whitespace) {
                tokens.add(whitespace);
            }

            @Override
            public void child(Node child) {
                collectTokens(child, tokens);
            }
        });
    }

    /**
     * Check that every child and token lies within its parent's span and that siblings
     * appear in source order without overlapping.
     *
     * @return one message per violation, empty for a well-formed tree
     */
    public static List<String> checkSpans(Node root) {
        List<String> violations = new ArrayList<>();
        checkSpans(root, violations);
        return violations;
    }

    private static void checkSpans(Node node, List<String> violations) {
        Span parent = node.span();
        int[] previousEnd = {parent.start()};

        forEachInOrder(node, new CstVisitor() {
            @Override
            public void token(LiteralWhitespace whitespace) {
                check(whitespace.tokenSpan(), "token");
            }

            @Override
            public void child(Node child) {
                check(child.span(), child.getClass().getSimpleName());
                checkSpans(child, violations);
            }

            private void check(Span span, String what) {
                String owner = node.getClass().getSimpleName() + " " + parent;
                if (!parent.contains(span)) {
                    violations.add(what + " " + span + " escapes " + owner);
                }
                if (span.start() < previousEnd[0]) {
                    violations.add(what + " " + span + " overlaps its previous sibling in " + owner);
                }
                previousEnd[0] = Math.max(previousEnd[0], span.end());
            }
        });
    }

    /**
     * Visit the tokens and direct children of {@code node} in source order.
     */
    public static void forEachInOrder(Node node, CstVisitor visitor) {
        if (node instanceof Stmt stmt) {
            visitStmt(stmt, visitor);
        } else if (node instanceof Expr expr) {
            visitExpr(expr, visitor);
        } else if (node instanceof Script script) {
            script.items().forEach(visitor::child);
            visitor.token(script.eofWhitespace());
        } else if (node instanceof FunctionDecl decl) {
            visitor.token(decl.functionWhitespace());
            visitor.child(decl.name());
            visitor.child(decl.params());
            visitor.child(decl.body());
        } else if (node instanceof Declarator declarator) {
            visitor.child(declarator.name());
            token(visitor, declarator.initializerWhitespace());
            child(visitor, declarator.value());
        } else if (node instanceof Case clause) {
            visitor.token(clause.whitespace());
            child(visitor, clause.test());
            visitor.token(clause.colonWhitespace());
            clause.cons().forEach(visitor::child);
        } else if (node instanceof CatchClause handler) {
            visitor.token(handler.catchWhitespace());
            token(visitor, handler.openParenWhitespace());
            child(visitor, handler.param());
            token(visitor, handler.closeParenWhitespace());
            visitor.child(handler.body());
        } else if (node instanceof Parameters params) {
            visitor.token(params.openParenWhitespace());
            interleave(visitor, params.params(), params.commaWhitespaces());
            visitor.token(params.closeParenWhitespace());
        } else if (node instanceof Arguments args) {
            visitor.token(args.openParenWhitespace());
            interleave(visitor, args.args(), args.commaWhitespaces());
            visitor.token(args.closeParenWhitespace());
        } else if (node instanceof ObjectProp prop) {
            visitor.child(prop.key());
            token(visitor, prop.colonWhitespace());
            child(visitor, prop.value());
        } else {
            throw new IllegalArgumentException("Unknown node type: " + node.getClass().getName());
        }
    }

    private static void visitStmt(Stmt stmt, CstVisitor visitor) {
        switch (stmt.kind()) {
            case VARIABLE -> {
                VarStmt s = (VarStmt) stmt;
                visitor.token(s.varWhitespace());
                interleave(visitor, s.declared(), s.commaWhitespaces());
                semicolon(visitor, s.semi());
            }
            case EMPTY -> visitor.token(((EmptyStmt) stmt).semiWhitespace());
            case BLOCK -> {
                BlockStmt s = (BlockStmt) stmt;
                visitor.token(s.openBraceWhitespace());
                s.stmts().forEach(visitor::child);
                visitor.token(s.closeBraceWhitespace());
            }
            case EXPR -> {
                ExprStmt s = (ExprStmt) stmt;
                visitor.child(s.expr());
                semicolon(visitor, s.semi());
            }
            case IF -> {
                IfStmt s = (IfStmt) stmt;
                visitor.token(s.ifWhitespace());
                visitor.token(s.openParenWhitespace());
                visitor.child(s.condition());
                visitor.token(s.closeParenWhitespace());
                visitor.child(s.cons());
                token(visitor, s.elseWhitespace());
                child(visitor, s.alt());
            }
            case SWITCH -> {
                SwitchStmt s = (SwitchStmt) stmt;
                visitor.token(s.switchWhitespace());
                visitor.token(s.openParenWhitespace());
                visitor.child(s.test());
                visitor.token(s.closeParenWhitespace());
                visitor.token(s.openBraceWhitespace());
                s.cases().forEach(visitor::child);
                visitor.token(s.closeBraceWhitespace());
            }
            case THROW -> {
                ThrowStmt s = (ThrowStmt) stmt;
                visitor.token(s.throwWhitespace());
                visitor.child(s.arg());
                semicolon(visitor, s.semi());
            }
            case WHILE -> {
                WhileStmt s = (WhileStmt) stmt;
                visitor.token(s.whileWhitespace());
                visitor.token(s.openParenWhitespace());
                visitor.child(s.condition());
                visitor.token(s.closeParenWhitespace());
                visitor.child(s.cons());
            }
            case DO_WHILE -> {
                DoWhileStmt s = (DoWhileStmt) stmt;
                visitor.token(s.doWhitespace());
                visitor.child(s.cons());
                visitor.token(s.whileWhitespace());
                visitor.token(s.openParenWhitespace());
                visitor.child(s.condition());
                visitor.token(s.closeParenWhitespace());
                semicolon(visitor, s.semi());
            }
            case LABELLED -> {
                LabelledStmt s = (LabelledStmt) stmt;
                visitor.child(s.label());
                visitor.token(s.colonWhitespace());
                visitor.child(s.body());
            }
            case BREAK -> {
                BreakStmt s = (BreakStmt) stmt;
                visitor.token(s.breakWhitespace());
                child(visitor, s.label());
                semicolon(visitor, s.semi());
            }
            case CONTINUE -> {
                ContinueStmt s = (ContinueStmt) stmt;
                visitor.token(s.continueWhitespace());
                child(visitor, s.label());
                semicolon(visitor, s.semi());
            }
            case RETURN -> {
                ReturnStmt s = (ReturnStmt) stmt;
                visitor.token(s.returnWhitespace());
                child(visitor, s.value());
                semicolon(visitor, s.semi());
            }
            case TRY -> {
                TryStmt s = (TryStmt) stmt;
                visitor.token(s.tryWhitespace());
                visitor.child(s.test());
                child(visitor, s.handler());
                token(visitor, s.finalWhitespace());
                child(visitor, s.finalizer());
            }
            case FOR -> {
                ForStmt s = (ForStmt) stmt;
                visitor.token(s.forWhitespace());
                visitor.token(s.openParenWhitespace());
                child(visitor, s.init());
                visitor.token(s.initSemicolonWhitespace());
                child(visitor, s.test());
                visitor.token(s.testSemicolonWhitespace());
                child(visitor, s.update());
                visitor.token(s.closeParenWhitespace());
                visitor.child(s.body());
            }
            case FOR_IN -> {
                ForInStmt s = (ForInStmt) stmt;
                visitor.token(s.forWhitespace());
                visitor.token(s.openParenWhitespace());
                visitor.child(s.left());
                visitor.token(s.inWhitespace());
                visitor.child(s.right());
                visitor.token(s.closeParenWhitespace());
                visitor.child(s.body());
            }
            case WITH -> {
                WithStmt s = (WithStmt) stmt;
                visitor.token(s.withWhitespace());
                visitor.token(s.openParenWhitespace());
                visitor.child(s.object());
                visitor.token(s.closeParenWhitespace());
                visitor.child(s.body());
            }
        }
    }

    private static void visitExpr(Expr expr, CstVisitor visitor) {
        switch (expr.kind()) {
            case LITERAL -> visitor.token(((LiteralExpr) expr).whitespace());
            case INVALID -> token(visitor, ((InvalidExpr) expr).whitespace());
            case ARRAY -> {
                ArrayExpr e = (ArrayExpr) expr;
                visitor.token(e.openBracketWhitespace());
                interleave(visitor, e.elements(), e.commaWhitespaces());
                visitor.token(e.closeBracketWhitespace());
            }
            case OBJECT -> {
                ObjectExpr e = (ObjectExpr) expr;
                visitor.token(e.openBraceWhitespace());
                interleave(visitor, e.props(), e.commaWhitespaces());
                visitor.token(e.closeBraceWhitespace());
            }
            case GROUPING -> {
                GroupingExpr e = (GroupingExpr) expr;
                visitor.token(e.openParenWhitespace());
                visitor.child(e.expr());
                visitor.token(e.closeParenWhitespace());
            }
            case MEMBER -> {
                MemberExpr e = (MemberExpr) expr;
                visitor.child(e.object());
                visitor.token(e.dotWhitespace());
                visitor.child(e.property());
            }
            case BRACKET -> {
                BracketExpr e = (BracketExpr) expr;
                visitor.child(e.object());
                visitor.token(e.openBracketWhitespace());
                visitor.child(e.property());
                visitor.token(e.closeBracketWhitespace());
            }
            case CALL -> {
                CallExpr e = (CallExpr) expr;
                visitor.child(e.callee());
                visitor.child(e.arguments());
            }
            case NEW -> {
                NewExpr e = (NewExpr) expr;
                visitor.token(e.newWhitespace());
                visitor.child(e.target());
                child(visitor, e.arguments());
            }
            case UPDATE -> {
                UpdateExpr e = (UpdateExpr) expr;
                if (e.prefix()) {
                    visitor.token(e.opWhitespace());
                    visitor.child(e.object());
                } else {
                    visitor.child(e.object());
                    visitor.token(e.opWhitespace());
                }
            }
            case UNARY -> {
                UnaryExpr e = (UnaryExpr) expr;
                visitor.token(e.opWhitespace());
                visitor.child(e.object());
            }
            case BINARY -> {
                BinaryExpr e = (BinaryExpr) expr;
                visitor.child(e.left());
                visitor.token(e.opWhitespace());
                visitor.child(e.right());
            }
            case CONDITIONAL -> {
                ConditionalExpr e = (ConditionalExpr) expr;
                visitor.child(e.test());
                visitor.token(e.questionWhitespace());
                visitor.child(e.cons());
                visitor.token(e.colonWhitespace());
                visitor.child(e.alt());
            }
            case ASSIGN -> {
                AssignExpr e = (AssignExpr) expr;
                visitor.child(e.target());
                visitor.token(e.opWhitespace());
                visitor.child(e.value());
            }
            case SEQUENCE -> {
                SequenceExpr e = (SequenceExpr) expr;
                interleave(visitor, e.exprs(), e.commaWhitespaces());
            }
            case FUNCTION -> {
                FunctionExpr e = (FunctionExpr) expr;
                visitor.token(e.functionWhitespace());
                child(visitor, e.name());
                visitor.child(e.params());
                visitor.child(e.body());
            }
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Items separated by commas: item 0, comma 0, item 1, comma 1, ... A trailing comma
     * follows the last item; a null item is an array hole.
     */
    private static void interleave(CstVisitor visitor, List<? extends Node> items, List<LiteralWhitespace> commas) {
        int count = Math.max(items.size(), commas.size());
        for (int i = 0; i < count; i++) {
            if (i < items.size()) {
                child(visitor, items.get(i));
            }
            if (i < commas.size()) {
                visitor.token(commas.get(i));
            }
        }
    }

    private static void semicolon(CstVisitor visitor, Semicolon semi) {
        if (semi instanceof Semicolon.Explicit explicit) {
            visitor.token(explicit.whitespace());
        }
    }

    private static void token(CstVisitor visitor, LiteralWhitespace whitespace) {
        if (whitespace != null) {
            visitor.token(whitespace);
        }
    }

    private static void child(CstVisitor visitor, Node node) {
        if (node != null) {
            visitor.child(node);
        }
    }
}
