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
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A node of the syntax tree built by the {@link Parser}.
 *
 * A node has a {@link NodeKind}, an optional token (an operator,
 * a name or a keyword, depending on the kind), ordered children,
 * and the comment and blank-line metadata the {@link Formatter}
 * needs. Kinds which need more carry a {@link NodeData} payload of
 * the class {@link NodeKind#getDataType()} names.
 */
public class Node {

    private final NodeKind kind;
    private final Token token;
    private final NodeData data;
    private final List<Node> children = new ArrayList<Node>();
    private final List<Token> leadingComments = new ArrayList<Token>();
    private final List<Token> trailingComments = new ArrayList<Token>();
    private final List<Token> footerComments = new ArrayList<Token>();
    private boolean blankLineBefore;

    public Node(@Nonnull NodeKind kind, @CheckForNull Token token, @CheckForNull NodeData data) {
        if (kind == null)
            throw new NullPointerException("Node kind was null.");
        Class<? extends NodeData> type = kind.getDataType();
        if (type == null) {
            if (data != null)
                throw new IllegalArgumentException(kind + " takes no payload, got " + data);
        } else if (!type.isInstance(data)) {
            throw new IllegalArgumentException(kind + " requires a " + type.getSimpleName() + ", got " + data);
        }
        this.kind = kind;
        this.token = token;
        this.data = data;
    }

    public Node(@Nonnull NodeKind kind, @CheckForNull Token token) {
        this(kind, token, null);
    }

    @Nonnull
    public NodeKind getKind() {
        return kind;
    }

    public boolean is(@Nonnull NodeKind kind) {
        return this.kind == kind;
    }

    @CheckForNull
    public Token getToken() {
        return token;
    }

    /** Returns the text of this node's token, or null if it has none. */
    @CheckForNull
    public String getText() {
        return token == null ? null : token.getText();
    }

    @CheckForNull
    public NodeData getData() {
        return data;
    }

    @Nonnull
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Nonnull
    public Node getChild(int index) {
        return children.get(index);
    }

    public int getChildCount() {
        return children.size();
    }

    public void addChild(@Nonnull Node child) {
        if (child == null)
            throw new NullPointerException("Child was null.");
        children.add(child);
    }

    /** Comments printed on their own lines above this node. */
    @Nonnull
    public List<Token> getLeadingComments() {
        return leadingComments;
    }

    /** Comments printed after this node on its last line. */
    @Nonnull
    public List<Token> getTrailingComments() {
        return trailingComments;
    }

    /** Comments after the last child, before a closing brace or the end of the file. */
    @Nonnull
    public List<Token> getFooterComments() {
        return footerComments;
    }

    public boolean isBlankLineBefore() {
        return blankLineBefore;
    }

    public void setBlankLineBefore(boolean blankLineBefore) {
        this.blankLineBefore = blankLineBefore;
    }

    @Nonnull
    private <T extends NodeData> T data(@Nonnull Class<T> type) {
        if (!type.isInstance(data))
            throw new IllegalStateException(kind + " has no " + type.getSimpleName());
        return type.cast(data);
    }

    @Nonnull
    /* pp */ FunctionData getFunction() {
        return data(FunctionData.class);
    }

    @Nonnull
    /* pp */ ParamData getParam() {
        return data(ParamData.class);
    }

    @Nonnull
    /* pp */ VarDeclData getVarDecl() {
        return data(VarDeclData.class);
    }

    @Nonnull
    /* pp */ FuncPtrData getFuncPtr() {
        return data(FuncPtrData.class);
    }

    @Nonnull
    /* pp */ TagData getTag() {
        return data(TagData.class);
    }

    @Nonnull
    /* pp */ TypedefData getTypedef() {
        return data(TypedefData.class);
    }

    @Nonnull
    /* pp */ ForData getFor() {
        return data(ForData.class);
    }

    @Nonnull
    /* pp */ UnaryData getUnary() {
        return data(UnaryData.class);
    }

    @Nonnull
    /* pp */ MemberData getMember() {
        return data(MemberData.class);
    }

    @Nonnull
    /* pp */ LiteralData getLiteral() {
        return data(LiteralData.class);
    }

    @Nonnull
    /* pp */ TypeData getTypeData() {
        return data(TypeData.class);
    }

    @Nonnull
    /* pp */ UnparsedData getUnparsed() {
        return data(UnparsedData.class);
    }

    /**
     * Renders this subtree one node per line, indented two
     * spaces per level, for debugging.
     */
    @Nonnull
    public String dump() {
        StringBuilder buf = new StringBuilder();
        dump(buf, 0);
        return buf.toString();
    }

    private void dump(@Nonnull StringBuilder buf, int depth) {
        for (int i = 0; i < depth; i++)
            buf.append("  ");
        buf.append(kind);
        if (token != null)
            buf.append(" \"").append(token.getText()).append('"');
        if (data != null)
            buf.append(" (").append(data.describe()).append(')');
        if (!children.isEmpty())
            buf.append(" [").append(children.size()).append(" children]");
        buf.append('\n');
        for (Node child : children)
            child.dump(buf, depth + 1);
    }

    @Override
    public String toString() {
        return kind + (token == null ? "" : "(" + token.getText() + ")")
                + (children.isEmpty() ? "" : children.toString());
    }
}
