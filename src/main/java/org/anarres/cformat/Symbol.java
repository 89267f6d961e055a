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
 * A name binding in a scope of a {@link SymbolTable}.
 */
public final class Symbol {

    private final String name;
    private final SymbolKind kind;
    private final int scope;

    /* pp */ Symbol(@Nonnull String name, @Nonnull SymbolKind kind, @Nonnegative int scope) {
        this.name = name;
        this.kind = kind;
        this.scope = scope;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public SymbolKind getKind() {
        return kind;
    }

    /** Returns the handle of the scope holding this binding. */
    public int getScope() {
        return scope;
    }

    @Override
    public int hashCode() {
        return name.hashCode() ^ kind.hashCode() ^ scope;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Symbol) {
            Symbol other = (Symbol) obj;
            return other.name.equals(name) && other.kind == kind && other.scope == scope;
        }
        return false;
    }

    @Override
    public String toString() {
        return kind + " " + name + "@" + scope;
    }
}
