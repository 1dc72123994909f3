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

/**
 * A textual macro.
 *
 * Every occurrence of the name in a line following the definition is
 * replaced by the value, including occurrences inside longer words.
 */
public final class Macro {

    private final String name;
    private final String value;
    private final int line;

    /**
     * @param line the line of the #define, or 0 for a macro defined
     *  before preprocessing started.
     */
    public Macro(@Nonnull String name, @Nonnull String value, @Nonnegative int line) {
        this.name = name;
        this.value = value;
        this.line = line;
    }

    public Macro(@Nonnull String name, @Nonnull String value) {
        this(name, value, 0);
    }

    /**
     * Returns the name of this macro.
     */
    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Returns the replacement text of this macro.
     */
    @Nonnull
    public String getValue() {
        return value;
    }

    /**
     * Returns the line at which this macro was defined, or 0 if
     * it was predefined.
     */
    @Nonnegative
    public int getLine() {
        return line;
    }

    /* pp */ boolean isPredefined() {
        return line == 0;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
