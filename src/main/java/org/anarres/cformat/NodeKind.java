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

/**
 * The kinds of {@link Node} in a syntax tree.
 *
 * Each kind names the payload class its nodes carry, if any.
 */
public enum NodeKind {

    PROGRAM,
    FUNCTION(FunctionData.class),
    PARAMETER(ParamData.class),
    VAR_DECL(VarDeclData.class),
    FUNC_PTR(FuncPtrData.class),
    STRUCT(TagData.class),
    UNION(TagData.class),
    ENUM(TagData.class),
    ENUM_VALUE,
    TYPEDEF(TypedefData.class),
    BLOCK,

    IF,
    WHILE,
    FOR(ForData.class),
    DO_WHILE,
    SWITCH,
    CASE,
    RETURN,
    BREAK,
    CONTINUE,
    GOTO,
    LABEL,
    EXPR_STMT,

    BINARY,
    UNARY(UnaryData.class),
    CALL,
    LITERAL(LiteralData.class),
    IDENTIFIER,
    MEMBER_ACCESS(MemberData.class),
    ARRAY_ACCESS,
    CAST(TypeData.class),
    SIZEOF(TypeData.class),
    TERNARY,
    PAREN,
    TYPE_EXPR(TypeData.class),
    INIT_LIST,

    PREPROCESSOR,
    UNPARSED(UnparsedData.class);

    private final Class<? extends NodeData> dataType;

    NodeKind() {
        this(null);
    }

    NodeKind(@CheckForNull Class<? extends NodeData> dataType) {
        this.dataType = dataType;
    }

    /** Returns the payload class of this kind, or null if it has none. */
    @CheckForNull
    public Class<? extends NodeData> getDataType() {
        return dataType;
    }

    /** True for the kinds which declare a name rather than run code. */
    public boolean isDeclaration() {
        switch (this) {
            case VAR_DECL:
            case FUNC_PTR:
            case TYPEDEF:
            case STRUCT:
            case UNION:
            case ENUM:
                return true;
            default:
                return false;
        }
    }
}
