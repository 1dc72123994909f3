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
 * The kinds of {@link Token} produced by the {@link Lexer}.
 */
public enum TokenType {

    KEYWORD,
    IDENTIFIER,
    /** An unsigned integer literal. */
    LITERAL,
    /** Reserved; the current lexer reports all punctuation as {@link #SYMBOL}. */
    OPERATOR,
    SYMBOL,
    /** A double-quoted string, delimiters stripped. */
    STRING,
    EOF;

    /**
     * Returns true if a token of this type may be captured as a
     * function-call argument.
     */
    public boolean isArgument() {
        return this == LITERAL || this == IDENTIFIER || this == STRING;
    }
}
