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

import java.util.List;
import javax.annotation.Nonnull;

/**
 * Text helpers over runs of tokens.
 */
/* pp */ final class Tokens {

    private Tokens() {
    }

    /** Concatenates the verbatim text of tokens [from, to). */
    @Nonnull
    public static String raw(@Nonnull List<Token> tokens, int from, int to) {
        StringBuilder buf = new StringBuilder();
        for (int i = from; i < to; i++)
            buf.append(tokens.get(i).getText());
        return buf.toString();
    }

    /**
     * Joins significant tokens, putting a single space wherever the
     * source had any whitespace or comment between them.
     */
    @Nonnull
    public static String spaced(@Nonnull List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        Token prev = null;
        for (Token tok : tokens) {
            if (prev != null && prev.getEndOffset() != tok.getOffset())
                buf.append(' ');
            buf.append(tok.getText());
            prev = tok;
        }
        return buf.toString();
    }

    /**
     * Joins the tokens of a type name in house style: words are
     * separated by single spaces, stars stick together, and brackets
     * hug their contents. {@code char*} becomes {@code char *}.
     */
    @Nonnull
    public static String typeText(@Nonnull List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        Token prev = null;
        for (Token tok : tokens) {
            if (prev != null && needsSpace(prev.getType(), tok.getType()))
                buf.append(' ');
            buf.append(tok.getText());
            prev = tok;
        }
        return buf.toString();
    }

    private static boolean needsSpace(@Nonnull TokenType prev, @Nonnull TokenType next) {
        if (prev == TokenType.STAR && next == TokenType.STAR)
            return false;
        switch (next) {
            case LBRACKET:
            case RBRACKET:
            case RPAREN:
            case COMMA:
                return false;
            default:
                break;
        }
        return prev != TokenType.LBRACKET && prev != TokenType.LPAREN;
    }

    /**
     * Renders the pointer part of a declarator so that it attaches
     * to the declared name: {@code *}, {@code **}, {@code *const }.
     */
    @Nonnull
    public static String pointerText(@Nonnull List<Token> pointers) {
        StringBuilder buf = new StringBuilder();
        for (Token tok : pointers) {
            buf.append(tok.getText());
            if (tok.getType() != TokenType.STAR)
                buf.append(' ');
        }
        return buf.toString();
    }
}
