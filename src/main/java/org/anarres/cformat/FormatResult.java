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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * The outcome of formatting one source text.
 *
 * Besides the formatted text, a result says how much of the source
 * the parser could not analyse, so that callers can decide whether
 * to trust the output.
 */
public final class FormatResult {

    private final String source;
    private final String text;
    private final int errorCount;
    private final int unparsedTokenCount;
    private final int significantTokenCount;

    public FormatResult(@Nonnull String source, @Nonnull String text, @Nonnegative int errorCount,
            @Nonnegative int unparsedTokenCount, @Nonnegative int significantTokenCount) {
        this.source = source;
        this.text = text;
        this.errorCount = errorCount;
        this.unparsedTokenCount = unparsedTokenCount;
        this.significantTokenCount = significantTokenCount;
    }

    @Nonnull
    public String getSource() {
        return source;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    /** Returns the number of regions kept verbatim. */
    @Nonnegative
    public int getErrorCount() {
        return errorCount;
    }

    /** Returns the number of non-trivia tokens inside regions kept verbatim. */
    @Nonnegative
    public int getUnparsedTokenCount() {
        return unparsedTokenCount;
    }

    /** Returns the number of non-trivia tokens in the source. */
    @Nonnegative
    public int getSignificantTokenCount() {
        return significantTokenCount;
    }

    /**
     * Returns the share of significant tokens which lie in regions
     * kept verbatim, between 0 and 1. An empty source gives 0.
     */
    public double getUnparsedRatio() {
        if (significantTokenCount == 0)
            return 0;
        return (double) unparsedTokenCount / significantTokenCount;
    }

    public boolean isChanged() {
        return !text.equals(source);
    }

    @Override
    public String toString() {
        return "FormatResult(errors=" + errorCount + ", unparsed=" + unparsedTokenCount
                + "/" + significantTokenCount + ", changed=" + isChanged() + ")";
    }
}
