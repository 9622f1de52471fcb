package com.jscst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public enum TokenType {
    // Names and literals
    IDENTIFIER,
    NUMBER,
    STRING,
    TEMPLATE,
    REGEX,

    // Keywords
    VAR("var", true),
    LET("let", true),
    CONST("const", true),
    IF("if", true),
    ELSE("else", true),
    SWITCH("switch", true),
    CASE("case", true),
    DEFAULT("default", true),
    THROW("throw", true),
    WHILE("while", true),
    DO("do", true),
    BREAK("break", true),
    CONTINUE("continue", true),
    RETURN("return", true),
    TRY("try", true),
    CATCH("catch", true),
    FINALLY("finally", true),
    FOR("for", true),
    IN("in", true),
    WITH("with", true),
    FUNCTION("function", true),
    NEW("new", true),
    TYPEOF("typeof", true),
    VOID("void", true),
    DELETE("delete", true),
    INSTANCEOF("instanceof", true),
    THIS("this", true),
    NULL("null", true),
    TRUE("true", true),
    FALSE("false", true),
    DEBUGGER("debugger", true),

    // Punctuators
    LBRACE("{"),
    RBRACE("}"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    SEMICOLON(";"),
    COMMA(","),
    DOT("."),
    ELLIPSIS("..."),
    COLON(":"),
    QUESTION("?"),
    QUESTION_DOT("?."),
    ARROW("=>"),
    ASSIGN("="),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-="),
    STAR_ASSIGN("*="),
    SLASH_ASSIGN("/="),
    PERCENT_ASSIGN("%="),
    STAR_STAR_ASSIGN("**="),
    LSHIFT_ASSIGN("<<="),
    RSHIFT_ASSIGN(">>="),
    URSHIFT_ASSIGN(">>>="),
    AMP_ASSIGN("&="),
    PIPE_ASSIGN("|="),
    CARET_ASSIGN("^="),
    AMP_AMP_ASSIGN("&&="),
    PIPE_PIPE_ASSIGN("||="),
    QUESTION_QUESTION_ASSIGN("??="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    STAR_STAR("**"),
    PLUS_PLUS("++"),
    MINUS_MINUS("--"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    URSHIFT(">>>"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    EQ_STRICT("==="),
    NE_STRICT("!=="),
    AMP("&"),
    PIPE("|"),
    CARET("^"),
    BANG("!"),
    TILDE("~"),
    AMP_AMP("&&"),
    PIPE_PIPE("||"),
    QUESTION_QUESTION("??"),

    // A character no token starts with
    INVALID,
    EOF;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
    private static final List<TokenType> PUNCTUATORS_LONGEST_FIRST;

    static {
        List<TokenType> punctuators = new ArrayList<>();
        for (TokenType type : values()) {
            if (type.keyword) {
                KEYWORDS.put(type.text, type);
            } else if (type.text != null) {
                punctuators.add(type);
            }
        }
        punctuators.sort(Comparator.comparingInt((TokenType t) -> t.text.length()).reversed());
        PUNCTUATORS_LONGEST_FIRST = Collections.unmodifiableList(punctuators);
    }

    private final String text;
    private final boolean keyword;

    TokenType() {
        this(null, false);
    }

    TokenType(String text) {
        this(text, false);
    }

    TokenType(String text, boolean keyword) {
        this.text = text;
        this.keyword = keyword;
    }

    /**
     * Fixed source text of a keyword or punctuator, null for tokens whose text varies.
     */
    public String text() {
        return text;
    }

    public boolean keyword() {
        return keyword;
    }

    static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    static List<TokenType> punctuatorsLongestFirst() {
        return PUNCTUATORS_LONGEST_FIRST;
    }

    /**
     * How a token of this type is named in a diagnostic.
     */
    public String describe() {
        return switch (this) {
            case IDENTIFIER -> "identifier";
            case NUMBER -> "number";
            case STRING -> "string";
            case TEMPLATE -> "template";
            case REGEX -> "regular expression";
            case INVALID -> "invalid character";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
