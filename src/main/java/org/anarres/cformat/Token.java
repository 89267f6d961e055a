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

import com.google.gson.JsonObject;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A lexical token, carrying its verbatim source text.
 *
 * Tokens are immutable. Concatenating the text of every token
 * produced by a {@link Lexer} reproduces the source exactly.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    private final int offset;

    public Token(@Nonnull TokenType type, @Nonnull String text,
            @Nonnegative int line, @Nonnegative int column, @Nonnegative int offset) {
        if (type == null)
            throw new NullPointerException("Token type was null.");
        if (text == null)
            throw new NullPointerException("Token text was null.");
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    @Nonnull
    public TokenType getType() {
        return type;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    /** Returns the 1-based line on which this token starts. */
    public int getLine() {
        return line;
    }

    /** Returns the 1-based column at which this token starts. */
    public int getColumn() {
        return column;
    }

    /** Returns the 0-based character offset of this token in the source. */
    public int getOffset() {
        return offset;
    }

    /** Returns the offset just past the end of this token. */
    public int getEndOffset() {
        return offset + text.length();
    }

    public boolean isTrivia() {
        return type.isTrivia();
    }

    public boolean isComment() {
        return type.isComment();
    }

    public boolean is(@Nonnull TokenType type) {
        return this.type == type;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("type", type.name());
        result.addProperty("text", text);
        result.addProperty("line", line);
        result.addProperty("column", column);
        return result;
    }

    @Override
    public int hashCode() {
        return type.hashCode() ^ text.hashCode() ^ offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Token) {
            Token other = (Token) obj;
            return other.type == type
                    && other.offset == offset
                    && other.line == line
                    && other.column == column
                    && other.text.equals(text);
        }
        return false;
    }

    @Override
    public String toString() {
        return type + "(" + line + ":" + column + ")'" + text + "'";
    }
}
