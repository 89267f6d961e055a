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
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats C source text.
 *
 * This class runs the {@link Lexer}, {@link Parser} and
 * {@link Formatter} over a string, with a common set of features
 * and options:
 * <pre>
 * SourceFormatter formatter = new SourceFormatter();
 * formatter.addTypedef("my_handle");
 * FormatResult result = formatter.format(source);
 * if (result.getErrorCount() == 0)
 *     ...
 * </pre>
 *
 * A SourceFormatter holds no state between calls to
 * {@link #format(String)}.
 */
public class SourceFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFormatter.class);

    private final Set<Feature> features = EnumSet.noneOf(Feature.class);
    private final List<String> typedefs = new ArrayList<String>();
    private ParseListener listener;
    private int tabWidth = 8;
    private int maxLineLength = 80;

    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    public void addFeatures(@Nonnull Collection<Feature> f) {
        features.addAll(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /** Declares an identifier as a type name for every source formatted. */
    public void addTypedef(@Nonnull String name) {
        typedefs.add(name);
    }

    @Nonnull
    public List<String> getTypedefs() {
        return typedefs;
    }

    public void setListener(@CheckForNull ParseListener listener) {
        this.listener = listener;
    }

    @CheckForNull
    public ParseListener getListener() {
        return listener;
    }

    public void setTabWidth(@Nonnegative int tabWidth) {
        this.tabWidth = tabWidth;
    }

    public void setMaxLineLength(@Nonnegative int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    @Nonnull
    private Parser newParser(@Nonnull List<Token> tokens, @Nonnull String name) {
        Parser parser = new Parser(tokens);
        parser.setSourceName(name);
        parser.setListener(listener);
        parser.addFeatures(features);
        for (String typedef : typedefs)
            parser.addTypedef(typedef);
        return parser;
    }

    /** Parses the source without formatting it. */
    @Nonnull
    public Node parse(@Nonnull String source, @Nonnull String name) {
        return newParser(Lexer.tokenize(source), name).parse();
    }

    @Nonnull
    public FormatResult format(@Nonnull String source) {
        return format(source, "<input>");
    }

    /**
     * Formats the source, using the given name in diagnostics.
     */
    @Nonnull
    public FormatResult format(@Nonnull String source, @Nonnull String name) {
        List<Token> tokens = Lexer.tokenize(source);
        Parser parser = newParser(tokens, name);
        Node program = parser.parse();

        Formatter formatter = new Formatter();
        formatter.addFeatures(features);
        formatter.setTabWidth(tabWidth);
        formatter.setMaxLineLength(maxLineLength);
        formatter.setListener(listener);
        formatter.setSourceName(name);
        String text = formatter.format(program);

        int significant = countSignificant(tokens);
        int unparsed = countUnparsed(program);
        FormatResult result = new FormatResult(source, text, parser.getErrorCount(), unparsed, significant);
        if (getFeature(Feature.DEBUG))
            LOG.debug(name + ": " + result);
        return result;
    }

    @Nonnegative
    private static int countSignificant(@Nonnull List<Token> tokens) {
        int count = 0;
        for (Token tok : tokens) {
            if (!tok.isTrivia() && !tok.is(TokenType.EOF))
                count++;
        }
        return count;
    }

    @Nonnegative
    private static int countUnparsed(@Nonnull Node node) {
        if (node.is(NodeKind.UNPARSED))
            return countSignificant(Lexer.tokenize(node.getUnparsed().text));
        int count = 0;
        for (Node child : node.getChildren())
            count += countUnparsed(child);
        return count;
    }
}
