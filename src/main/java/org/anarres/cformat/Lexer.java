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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits C source text into a lossless sequence of {@link Token Tokens}.
 *
 * Whitespace, newlines and comments are returned as tokens in their
 * own right. Preprocessor directives are returned whole, one token
 * per logical line. The lexer never fails: characters it does not
 * recognise become {@link TokenType#ERROR} tokens.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final String OPERATOR_CHARS = "+-*/%=<>!&|^~.?:;,(){}[]";

    private final CharSequence source;
    private final int length;
    private int pos;
    private int line;
    private int column;

    public Lexer(@Nonnull CharSequence source) {
        if (source == null)
            throw new NullPointerException("Source was null.");
        this.source = source;
        this.length = source.length();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    @Nonnull
    public static List<Token> tokenize(@Nonnull String source) {
        return new Lexer(source).tokenize();
    }

    /**
     * Tokenizes the whole source.
     *
     * The returned list always ends with exactly one
     * {@link TokenType#EOF} token.
     */
    @Nonnull
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<Token>();
        while (pos < length)
            tokens.add(next());
        tokens.add(new Token(TokenType.EOF, "", line, column, pos));
        if (LOG.isTraceEnabled())
            LOG.trace("Lexed " + tokens.size() + " tokens from " + length + " characters");
        return tokens;
    }

    private char peek(int ahead) {
        int idx = pos + ahead;
        if (idx < length)
            return source.charAt(idx);
        return 0;
    }

    private static boolean isWhite(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    @Nonnull
    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (c == '\n') {
            pos++;
            return make(TokenType.NEWLINE, start);
        }
        if (isWhite(c)) {
            while (pos < length && isWhite(source.charAt(pos)))
                pos++;
            return make(TokenType.WHITESPACE, start);
        }
        if (c == '/' && peek(1) == '/') {
            while (pos < length && source.charAt(pos) != '\n')
                pos++;
            return make(TokenType.COMMENT_LINE, start);
        }
        if (c == '/' && peek(1) == '*') {
            pos += 2;
            while (pos < length && !(source.charAt(pos) == '*' && peek(1) == '/'))
                pos++;
            /* Unterminated comments run to the end of input. */
            pos = Math.min(pos + 2, length);
            return make(TokenType.COMMENT_BLOCK, start);
        }
        if (c == '#')
            return directive(start);
        if (isDigit(c) || (c == '.' && isDigit(peek(1))))
            return number(start);
        if (isIdentifierStart(c)) {
            while (pos < length && isIdentifierPart(source.charAt(pos)))
                pos++;
            String text = source.subSequence(start, pos).toString();
            TokenType keyword = TokenType.forText(text);
            if (keyword != null && keyword.isKeyword())
                return make(keyword, start);
            return make(TokenType.IDENTIFIER, start);
        }
        if (c == '"')
            return quoted(start, '"', TokenType.STRING);
        if (c == '\'')
            return quoted(start, '\'', TokenType.CHAR);
        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            for (int len = 3; len > 0; len--) {
                if (pos + len > length)
                    continue;
                TokenType type = TokenType.forText(source.subSequence(pos, pos + len).toString());
                if (type != null && !type.isKeyword()) {
                    pos += len;
                    return make(type, start);
                }
            }
        }
        pos++;
        return make(TokenType.ERROR, start);
    }

    /* A directive runs to the end of the line, including backslash-newline continuations. */
    @Nonnull
    private Token directive(int start) {
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == '\n') {
                int prev = pos - 1;
                if (prev > start && source.charAt(prev) == '\r')
                    prev--;
                if (prev <= start || source.charAt(prev) != '\\')
                    break;
            }
            pos++;
        }
        return make(TokenType.PREPROCESSOR, start);
    }

    @Nonnull
    private Token number(int start) {
        boolean isFloat = false;
        if (source.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            pos += 2;
            while (pos < length && isHexDigit(source.charAt(pos)))
                pos++;
        } else {
            while (pos < length && isDigit(source.charAt(pos)))
                pos++;
            if (pos < length && source.charAt(pos) == '.') {
                isFloat = true;
                pos++;
                while (pos < length && isDigit(source.charAt(pos)))
                    pos++;
            }
            if (pos < length && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                char sign = peek(1);
                if (isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(peek(2)))) {
                    isFloat = true;
                    pos += 2;
                    while (pos < length && isDigit(source.charAt(pos)))
                        pos++;
                }
            }
        }
        /* Suffixes: 10UL, 1.5f, and so on. */
        while (pos < length && isIdentifierPart(source.charAt(pos)))
            pos++;
        return make(isFloat ? TokenType.FLOAT : TokenType.INTEGER, start);
    }

    @Nonnull
    private Token quoted(int start, char quote, @Nonnull TokenType type) {
        pos++;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                return make(type, start);
            }
            if (c == '\n')
                break;
            if (c == '\\' && pos + 1 < length)
                pos++;
            pos++;
        }
        if (pos > length)
            pos = length;
        return make(TokenType.ERROR, start);
    }

    @Nonnull
    private Token make(@Nonnull TokenType type, int start) {
        String text = source.subSequence(start, pos).toString();
        Token token = new Token(type, text, line, column, start);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return token;
    }
}
