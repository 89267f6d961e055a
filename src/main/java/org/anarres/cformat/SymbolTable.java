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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Chained scopes of name bindings, used by the {@link Parser}
 * to tell type names from other identifiers.
 *
 * Scopes live in an arena and are addressed by integer handles.
 * The global scope, {@link #GLOBAL}, exists from construction and
 * is pre-seeded with common platform typedefs so that types from
 * headers the parser never sees still parse as types.
 */
public class SymbolTable {

    /** The handle of the global scope. */
    public static final int GLOBAL = 0;

    /* pp */ static final List<String> PLATFORM_TYPEDEFS = Collections.unmodifiableList(Arrays.asList(
            "size_t", "ssize_t", "ptrdiff_t", "intptr_t", "uintptr_t",
            "off_t", "pid_t", "time_t", "clock_t", "wchar_t", "bool",
            "FILE", "va_list", "DIR", "sig_atomic_t", "jmp_buf", "fpos_t",
            "socklen_t", "pthread_t", "pthread_mutex_t",
            "int8_t", "int16_t", "int32_t", "int64_t",
            "uint8_t", "uint16_t", "uint32_t", "uint64_t",
            "intmax_t", "uintmax_t"
    ));

    private final List<Map<String, Symbol>> bindings = new ArrayList<Map<String, Symbol>>();
    private final List<Integer> parents = new ArrayList<Integer>();

    public SymbolTable() {
        bindings.add(new HashMap<String, Symbol>());
        parents.add(-1);
        for (String name : PLATFORM_TYPEDEFS)
            add(GLOBAL, name, SymbolKind.TYPEDEF);
    }

    /**
     * Creates a new scope whose lookups fall back to the given parent.
     *
     * @return the handle of the new scope.
     */
    public int createScope(@Nonnegative int parent) {
        check(parent);
        bindings.add(new HashMap<String, Symbol>());
        parents.add(parent);
        return bindings.size() - 1;
    }

    /** Returns the parent of the given scope, or -1 for the global scope. */
    public int getParent(@Nonnegative int scope) {
        check(scope);
        return parents.get(scope);
    }

    /**
     * Binds a name in the given scope.
     *
     * The first binding of a name in a scope wins; later
     * additions of the same name to that scope are ignored.
     */
    public void add(@Nonnegative int scope, @Nonnull String name, @Nonnull SymbolKind kind) {
        check(scope);
        if (name == null)
            throw new NullPointerException("Name was null.");
        Map<String, Symbol> map = bindings.get(scope);
        if (!map.containsKey(name))
            map.put(name, new Symbol(name, kind, scope));
    }

    /**
     * Returns the nearest binding of the given name, searching
     * the given scope and then its ancestors.
     */
    @CheckForNull
    public Symbol lookup(@Nonnegative int scope, @Nonnull String name) {
        check(scope);
        for (int s = scope; s >= 0; s = parents.get(s)) {
            Symbol symbol = bindings.get(s).get(name);
            if (symbol != null)
                return symbol;
        }
        return null;
    }

    public boolean isTypedef(@Nonnegative int scope, @Nonnull String name) {
        Symbol symbol = lookup(scope, name);
        return symbol != null && symbol.getKind() == SymbolKind.TYPEDEF;
    }

    private void check(int scope) {
        if (scope < 0 || scope >= bindings.size())
            throw new IllegalArgumentException("No such scope: " + scope);
    }
}
