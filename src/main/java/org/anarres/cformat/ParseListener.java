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

import javax.annotation.Nonnull;

/**
 * A handler for parse and format events.
 *
 * A listener installed on a {@link Parser} is told about every
 * region the parser could not analyse and kept verbatim. A listener
 * installed on a {@link Formatter} is warned about each output line
 * longer than the maximum line length.
 *
 * @see DefaultParseListener
 */
public interface ParseListener {

    /**
     * Handles a warning.
     *
     * The line is a line of the formatted output. The behaviour of
     * this method is defined by the implementation. It may simply
     * record the warning message.
     */
    public void handleWarning(@Nonnull String source, int line, int column,
            @Nonnull String msg);

    /**
     * Handles an error.
     *
     * The parser has already recovered from the error: the region
     * concerned is kept in the tree as unparsed text.
     */
    public void handleError(@Nonnull String source, int line, int column,
            @Nonnull String msg);
}
