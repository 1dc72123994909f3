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

import javax.annotation.Nonnull;

/**
 * A handler for preprocessor and lexer warnings.
 *
 * Only warnings enabled in the owning {@link ScriptFormatter} are
 * delivered.
 */
public interface PreprocessorListener {

    /**
     * Handles a warning.
     *
     * @param warning the warning class.
     * @param line the line of the original source, before any #define
     *  lines were removed, numbered from 1.
     * @param msg the message.
     */
    public void handleWarning(@Nonnull Warning warning, int line, @Nonnull String msg);
}
