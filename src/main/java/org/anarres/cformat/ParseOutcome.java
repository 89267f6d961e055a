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
import javax.annotation.Nonnull;

/**
 * The result of one attempt by the {@link Parser} to apply a
 * grammar production.
 *
 * An attempt either parsed a node, found that the production does
 * not apply here (nothing was consumed), or committed to the
 * production and failed part-way through. In the last two cases
 * the parser has already rewound to where the attempt started.
 */
/* pp */ final class ParseOutcome {

    public static enum Status {
        PARSED,
        NOT_APPLICABLE,
        FAILED
    }

    private static final ParseOutcome NOT_APPLICABLE = new ParseOutcome(Status.NOT_APPLICABLE, null, null, null);

    private final Status status;
    private final Node node;
    private final String message;
    private final Token token;

    private ParseOutcome(@Nonnull Status status, @CheckForNull Node node,
            @CheckForNull String message, @CheckForNull Token token) {
        this.status = status;
        this.node = node;
        this.message = message;
        this.token = token;
    }

    @Nonnull
    public static ParseOutcome parsed(@Nonnull Node node) {
        return new ParseOutcome(Status.PARSED, node, null, null);
    }

    @Nonnull
    public static ParseOutcome notApplicable() {
        return NOT_APPLICABLE;
    }

    @Nonnull
    public static ParseOutcome failed(@Nonnull String message, @Nonnull Token token) {
        return new ParseOutcome(Status.FAILED, null, message, token);
    }

    @Nonnull
    public Status getStatus() {
        return status;
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public boolean isNotApplicable() {
        return status == Status.NOT_APPLICABLE;
    }

    /** Returns the parsed node; only valid when {@link #isParsed()}. */
    @Nonnull
    public Node getNode() {
        if (node == null)
            throw new IllegalStateException("No node in " + status + " outcome.");
        return node;
    }

    /** Returns the error which ended a failed attempt, or null. */
    @CheckForNull
    public String getMessage() {
        return message;
    }

    /** Returns the token at which a failed attempt gave up, or null. */
    @CheckForNull
    public Token getToken() {
        return token;
    }

    @Override
    public String toString() {
        return status + (message == null ? "" : ": " + message);
    }
}
