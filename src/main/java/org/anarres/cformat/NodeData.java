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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.pcollections.PVector;

/**
 * A kind-specific payload attached to a {@link Node}.
 *
 * {@link NodeKind#getDataType()} names the payload class each kind
 * requires; {@link Node} refuses any other combination.
 */
public abstract class NodeData {

    /* pp */ NodeData() {
    }

    /** Returns a short description for tree dumps. */
    @Nonnull
    public abstract String describe();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + describe() + "]";
    }
}

/* Return type and name of a function; the body, if any, is the only child. */
class FunctionData extends NodeData {

    public final PVector<Token> returnType;
    public final PVector<Token> pointers;
    public final Token name;
    public final PVector<Node> parameters;
    public final boolean definition;

    public FunctionData(@Nonnull PVector<Token> returnType, @Nonnull PVector<Token> pointers,
            @Nonnull Token name, @Nonnull PVector<Node> parameters, boolean definition) {
        this.returnType = returnType;
        this.pointers = pointers;
        this.name = name;
        this.parameters = parameters;
        this.definition = definition;
    }

    @Override
    public String describe() {
        return Tokens.typeText(returnType) + " " + Tokens.typeText(pointers) + name.getText()
                + "/" + parameters.size() + (definition ? "" : " prototype");
    }
}

class ParamData extends NodeData {

    public final PVector<Token> typeTokens;
    public final PVector<Token> pointers;
    @CheckForNull
    public final Token name;
    public final PVector<Token> arrays;
    public final boolean variadic;
    /* Unstructured parameters, such as function pointers, keep their whole token run in typeTokens. */
    public final boolean opaque;

    public ParamData(@Nonnull PVector<Token> typeTokens, @Nonnull PVector<Token> pointers,
            @CheckForNull Token name, @Nonnull PVector<Token> arrays,
            boolean variadic, boolean opaque) {
        this.typeTokens = typeTokens;
        this.pointers = pointers;
        this.name = name;
        this.arrays = arrays;
        this.variadic = variadic;
        this.opaque = opaque;
    }

    @Override
    public String describe() {
        if (variadic)
            return "...";
        if (opaque)
            return Tokens.spaced(typeTokens);
        return Tokens.typeText(typeTokens) + " " + Tokens.typeText(pointers)
                + (name == null ? "" : name.getText());
    }
}

/*
 * One declarator of a variable declaration. Chained declarators
 * ("int i, j, k;") share the type of the first and carry no type tokens.
 */
class VarDeclData extends NodeData {

    public final PVector<Token> typeTokens;
    public final PVector<Token> pointers;
    public final Token name;
    public final PVector<Token> arrays;
    @CheckForNull
    public final Node bitWidth;
    @CheckForNull
    public final Node initializer;
    public final PVector<VarDeclData> declarators;

    public VarDeclData(@Nonnull PVector<Token> typeTokens, @Nonnull PVector<Token> pointers,
            @Nonnull Token name, @Nonnull PVector<Token> arrays,
            @CheckForNull Node bitWidth, @CheckForNull Node initializer,
            @Nonnull PVector<VarDeclData> declarators) {
        this.typeTokens = typeTokens;
        this.pointers = pointers;
        this.name = name;
        this.arrays = arrays;
        this.bitWidth = bitWidth;
        this.initializer = initializer;
        this.declarators = declarators;
    }

    @Override
    public String describe() {
        StringBuilder buf = new StringBuilder();
        buf.append(Tokens.typeText(typeTokens)).append(' ').append(name.getText());
        for (VarDeclData d : declarators)
            buf.append(", ").append(d.name.getText());
        return buf.toString();
    }
}

class FuncPtrData extends NodeData {

    public final PVector<Token> returnType;
    public final Token name;
    public final PVector<Token> parameters;

    public FuncPtrData(@Nonnull PVector<Token> returnType, @Nonnull Token name, @Nonnull PVector<Token> parameters) {
        this.returnType = returnType;
        this.name = name;
        this.parameters = parameters;
    }

    @Override
    public String describe() {
        return Tokens.typeText(returnType) + " (*" + name.getText() + ")(" + Tokens.spaced(parameters) + ")";
    }
}

/* struct, union and enum definitions and references. Members or values are the children. */
class TagData extends NodeData {

    public final Token keyword;
    @CheckForNull
    public final Token name;
    public final boolean body;
    /* Declarators after the closing brace, as in "struct p { ... } origin;". */
    public final PVector<Token> declarators;

    public TagData(@Nonnull Token keyword, @CheckForNull Token name, boolean body, @Nonnull PVector<Token> declarators) {
        this.keyword = keyword;
        this.name = name;
        this.body = body;
        this.declarators = declarators;
    }

    @Override
    public String describe() {
        return keyword.getText() + (name == null ? "" : " " + name.getText()) + (body ? " {}" : "");
    }
}

/* An inner tag definition or function pointer, if present, is the only child. */
class TypedefData extends NodeData {

    public final PVector<Token> baseTokens;
    public final PVector<Token> pointers;
    @CheckForNull
    public final Token alias;
    public final PVector<Token> arrays;

    public TypedefData(@Nonnull PVector<Token> baseTokens, @Nonnull PVector<Token> pointers,
            @CheckForNull Token alias, @Nonnull PVector<Token> arrays) {
        this.baseTokens = baseTokens;
        this.pointers = pointers;
        this.alias = alias;
        this.arrays = arrays;
    }

    @Override
    public String describe() {
        return Tokens.typeText(baseTokens) + " " + Tokens.typeText(pointers)
                + (alias == null ? "" : alias.getText());
    }
}

/* The loop header; the body is the only child. */
class ForData extends NodeData {

    public final PVector<Node> init;
    @CheckForNull
    public final Node initDeclaration;
    @CheckForNull
    public final Node condition;
    public final PVector<Node> update;

    public ForData(@Nonnull PVector<Node> init, @CheckForNull Node initDeclaration,
            @CheckForNull Node condition, @Nonnull PVector<Node> update) {
        this.init = init;
        this.initDeclaration = initDeclaration;
        this.condition = condition;
        this.update = update;
    }

    @Override
    public String describe() {
        return (initDeclaration != null ? "decl" : init.size()) + ";"
                + (condition == null ? "" : "cond") + ";" + update.size();
    }
}

class UnaryData extends NodeData {

    public final boolean postfix;

    public UnaryData(boolean postfix) {
        this.postfix = postfix;
    }

    @Override
    public String describe() {
        return postfix ? "postfix" : "prefix";
    }
}

class MemberData extends NodeData {

    public final boolean arrow;

    public MemberData(boolean arrow) {
        this.arrow = arrow;
    }

    @Override
    public String describe() {
        return arrow ? "->" : ".";
    }
}

/* Adjacent string literals are one literal with several pieces. */
class LiteralData extends NodeData {

    public final PVector<Token> pieces;

    public LiteralData(@Nonnull PVector<Token> pieces) {
        if (pieces.isEmpty())
            throw new IllegalArgumentException("Literal has no tokens.");
        this.pieces = pieces;
    }

    @Override
    public String describe() {
        return Tokens.spaced(pieces);
    }
}

/* The type of a cast, sizeof or type expression. Empty for sizeof applied to an expression. */
class TypeData extends NodeData {

    public final PVector<Token> tokens;

    public TypeData(@Nonnull PVector<Token> tokens) {
        this.tokens = tokens;
    }

    public boolean isType() {
        return !tokens.isEmpty();
    }

    @Override
    public String describe() {
        return Tokens.typeText(tokens);
    }
}

class UnparsedData extends NodeData {

    public final String text;
    public final int firstLine;
    public final int lastLine;

    public UnparsedData(@Nonnull String text, @Nonnegative int firstLine, @Nonnegative int lastLine) {
        this.text = text;
        this.firstLine = firstLine;
        this.lastLine = lastLine;
    }

    @Override
    public String describe() {
        return "lines " + firstLine + "-" + lastLine;
    }
}
