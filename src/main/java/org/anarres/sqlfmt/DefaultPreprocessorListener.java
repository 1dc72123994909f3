/*
 * Anarres SQL Formatter
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
package org.anarres.sqlfmt;

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handler for preprocessor warnings.
 *
 * This class logs each warning and keeps a count.
 */
public class DefaultPreprocessorListener implements PreprocessorListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultPreprocessorListener.class);

    private final String name;
    private int warnings;

    public DefaultPreprocessorListener(@Nonnull String name) {
        this.name = name;
        clear();
    }

    public DefaultPreprocessorListener() {
        this("<input>");
    }

    public void clear() {
        warnings = 0;
    }

    @Nonnegative
    public int getWarnings() {
        return warnings;
    }

    @Override
    public void handleWarning(Warning warning, int line, String msg) {
        warnings++;
        LOG.warn(name + ":" + line + ": warning: " + msg);
    }
}
