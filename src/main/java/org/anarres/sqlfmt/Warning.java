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

/**
 * Warning classes which may be enabled in a {@link ScriptFormatter}.
 *
 * Warnings never alter the formatted output; they are only reported
 * to the {@link PreprocessorListener}.
 */
public enum Warning {

    /** A character which belongs to no token class was discarded. */
    UNKNOWN_CHARACTER,
    /** A #define line without a macro name was ignored. */
    MALFORMED_DIRECTIVE,
    /** A macro was redefined with a different value. */
    MACRO_REDEFINED
}
