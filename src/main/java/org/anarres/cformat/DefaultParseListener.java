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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handler for parse events which logs each event and counts them.
 */
public class DefaultParseListener implements ParseListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultParseListener.class);

    private int errors;
    private int warnings;

    public DefaultParseListener() {
        clear();
    }

    public void clear() {
        errors = 0;
        warnings = 0;
    }

    @Nonnegative
    public int getErrors() {
        return errors;
    }

    @Nonnegative
    public int getWarnings() {
        return warnings;
    }

    protected void print(@Nonnull String msg) {
        LOG.warn(msg);
    }

    @Override
    public void handleWarning(String source, int line, int column, String msg) {
        warnings++;
        print(source + ":" + line + ":" + column + ": warning: " + msg);
    }

    @Override
    public void handleError(String source, int line, int column, String msg) {
        errors++;
        print(source + ":" + line + ":" + column + ": error: " + msg);
    }
}
