/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cformat;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The kinds of token produced by the {@link Lexer}.
 *
 * Kinds with a fixed spelling (keywords, operators and punctuation)
 * carry that spelling in {@link #getText()}.
 */
public enum TokenType {

    /* Trivia */
    WHITESPACE(null),
    NEWLINE(null),
    COMMENT_LINE(null),
    COMMENT_BLOCK(null),

    PREPROCESSOR(null),

    /* Literals */
    INTEGER(null),
    FLOAT(null),
    STRING(null),
    CHAR(null),

    IDENTIFIER(null),

    /* Keywords */
    AUTO("auto"),
    BREAK("break"),
    CASE("case"),
    CHAR_KW("char"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DO("do"),
    DOUBLE("double"),
    ELSE("else"),
    ENUM("enum"),
    EXTERN("extern"),
    FLOAT_KW("float"),
    FOR("for"),
    GOTO("goto"),
    IF("if"),
    INT("int"),
    LONG("long"),
    REGISTER("register"),
    RETURN("return"),
    SHORT("short"),
    SIGNED("signed"),
    SIZEOF("sizeof"),
    STATIC("static"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPEDEF("typedef"),
    UNION("union"),
    UNSIGNED("unsigned"),
    VOID("void"),
    VOLATILE("volatile"),
    WHILE("while"),

    /* Operators */
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    ASSIGN("="),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-="),
    STAR_ASSIGN("*="),
    SLASH_ASSIGN("/="),
    PERCENT_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    LSHIFT_ASSIGN("<<="),
    RSHIFT_ASSIGN(">>="),
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    AND("&&"),
    OR("||"),
    NOT("!"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^"),
    BIT_NOT("~"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    INCREMENT("++"),
    DECREMENT("--"),
    ARROW("->"),
    DOT("."),
    QUESTION("?"),
    COLON(":"),

    /* Punctuation */
    SEMICOLON(";"),
    COMMA(","),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    ELLIPSIS("..."),

    EOF(null),
    ERROR(null);

    private static final Map<String, TokenType> BY_TEXT = new HashMap<String, TokenType>();

    static {
        for (TokenType type : values()) {
            if (type.text != null)
                BY_TEXT.put(type.text, type);
        }
    }

    private final String text;

    TokenType(@CheckForNull String text) {
        this.text = text;
    }

    /**
     * Returns the fixed spelling of this token type, or null
     * if tokens of this type carry arbitrary text.
     */
    @CheckForNull
    public String getText() {
        return text;
    }

    public boolean isKeyword() {
        return ordinal() >= AUTO.ordinal() && ordinal() <= WHILE.ordinal();
    }

    public boolean isTrivia() {
        switch (this) {
            case WHITESPACE:
            case NEWLINE:
            case COMMENT_LINE:
            case COMMENT_BLOCK:
                return true;
            default:
                return false;
        }
    }

    public boolean isComment() {
        return this == COMMENT_LINE || this == COMMENT_BLOCK;
    }

    /** True for the assignment family, which is right-associative. */
    public boolean isAssignment() {
        return ordinal() >= ASSIGN.ordinal() && ordinal() <= RSHIFT_ASSIGN.ordinal();
    }

    /**
     * Returns the binary operator precedence of this token type,
     * or -1 if it is not a binary operator. Higher binds tighter.
     */
    public int getPrecedence() {
        if (isAssignment())
            return 1;
        switch (this) {
            case OR:
                return 2;
            case AND:
                return 3;
            case BIT_OR:
                return 4;
            case BIT_XOR:
                return 5;
            case BIT_AND:
                return 6;
            case EQ:
            case NE:
                return 7;
            case LT:
            case GT:
            case LE:
            case GE:
                return 8;
            case LSHIFT:
            case RSHIFT:
                return 9;
            case PLUS:
            case MINUS:
                return 10;
            case STAR:
            case SLASH:
            case PERCENT:
                return 11;
            default:
                return -1;
        }
    }

    /**
     * Returns the token type with the given fixed spelling, or null.
     */
    @CheckForNull
    public static TokenType forText(@Nonnull String text) {
        return BY_TEXT.get(text);
    }
}
