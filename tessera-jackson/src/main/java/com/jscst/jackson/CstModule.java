package com.jscst.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jscst.cst.*;

import java.util.List;

/**
 * Jackson module for the concrete syntax tree records.
 *
 * This module handles:
 * - Polymorphic nodes and semicolons via a "type" property holding the record name
 * - Writing Case.isDefault as "default"
 * - Writing null for optional children whose absence is meaningful
 */
public class CstModule extends SimpleModule {

    // Every polymorphic record, written under its simple name
    private static final List<Class<?>> NODE_TYPES = List.of(
        Script.class,
        VarStmt.class, EmptyStmt.class, BlockStmt.class, ExprStmt.class, IfStmt.class,
        SwitchStmt.class, ThrowStmt.class, WhileStmt.class, DoWhileStmt.class, LabelledStmt.class,
        BreakStmt.class, ContinueStmt.class, ReturnStmt.class, TryStmt.class, ForStmt.class,
        ForInStmt.class, WithStmt.class,
        FunctionDecl.class,
        LiteralExpr.class, ArrayExpr.class, ObjectExpr.class, GroupingExpr.class, MemberExpr.class,
        BracketExpr.class, CallExpr.class, NewExpr.class, UpdateExpr.class, UnaryExpr.class,
        BinaryExpr.class, ConditionalExpr.class, AssignExpr.class, SequenceExpr.class,
        FunctionExpr.class, InvalidExpr.class,
        Declarator.class, Case.class, CatchClause.class, Parameters.class, Arguments.class,
        ObjectProp.class
    );

    public CstModule() {
        super("CstModule", new Version(0, 1, 0, null, "com.jscst", "tessera-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Polymorphic type handling, on every sum type a property can be declared as
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(StmtListItem.class, NodeMixin.class);
        context.setMixInAnnotations(Stmt.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, NodeMixin.class);
        context.setMixInAnnotations(Expr.class, NodeMixin.class);
        context.setMixInAnnotations(ForStmtInit.class, NodeMixin.class);
        context.setMixInAnnotations(Semicolon.class, NodeMixin.class);

        for (Class<?> type : NODE_TYPES) {
            context.registerSubtypes(new NamedType(type, type.getSimpleName()));
        }
        context.registerSubtypes(
            new NamedType(Semicolon.Implicit.class, "Implicit"),
            new NamedType(Semicolon.Explicit.class, "Explicit")
        );

        context.setMixInAnnotations(Case.class, CaseMixin.class);
        context.setMixInAnnotations(Declarator.class, DeclaratorMixin.class);
        context.setMixInAnnotations(IfStmt.class, IfStmtMixin.class);
        context.setMixInAnnotations(TryStmt.class, TryStmtMixin.class);
        context.setMixInAnnotations(ForStmt.class, ForStmtMixin.class);
        context.setMixInAnnotations(ReturnStmt.class, ReturnStmtMixin.class);
        context.setMixInAnnotations(BreakStmt.class, JumpStmtMixin.class);
        context.setMixInAnnotations(ContinueStmt.class, JumpStmtMixin.class);
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private interface NodeMixin {
    }

    private abstract static class CaseMixin {
        @JsonCreator
        CaseMixin(@JsonProperty("span") Span span,
                  @JsonProperty("default") boolean isDefault,
                  @JsonProperty("whitespace") LiteralWhitespace whitespace,
                  @JsonProperty("test") Expr test,
                  @JsonProperty("colonWhitespace") LiteralWhitespace colonWhitespace,
                  @JsonProperty("cons") List<StmtListItem> cons) {
        }

        @JsonProperty("default")
        abstract boolean isDefault();

        // Null for the default case
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr test();
    }

    // Declarator also has a constructor that derives its span; read through the canonical one
    private abstract static class DeclaratorMixin {
        @JsonCreator
        DeclaratorMixin(@JsonProperty("span") Span span,
                        @JsonProperty("name") LiteralExpr name,
                        @JsonProperty("initializerWhitespace") LiteralWhitespace initializerWhitespace,
                        @JsonProperty("value") Expr value) {
        }
    }

    private abstract static class IfStmtMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Stmt alt();
    }

    private abstract static class TryStmtMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract CatchClause handler();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract BlockStmt finalizer();
    }

    private abstract static class ForStmtMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract ForStmtInit init();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr test();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr update();
    }

    private abstract static class ReturnStmtMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expr value();
    }

    private abstract static class JumpStmtMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract LiteralExpr label();
    }
}
