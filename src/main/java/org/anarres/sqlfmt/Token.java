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

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A lexical token.
 *
 * Tokens are immutable once produced by the {@link Lexer}.
 */
public final class Token {

    private final TokenType type;
    private final int line;
    private final String text;

    public Token(@Nonnull TokenType type, int line, @Nonnull String text) {
        this.type = type;
        this.line = line;
        this.text = text;
    }

    /* pp */ static Token eof(int line) {
        return new Token(TokenType.EOF, line, "");
    }

    /**
     * Returns the semantic type of this token.
     */
    @Nonnull
    public TokenType getType() {
        return type;
    }

    /**
     * Returns the line at which this token started.
     *
     * Lines are numbered from 1.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the lexed text of this token.
     *
     * String literals are returned without their quotes.
     */
    @Nonnull
    public String getText() {
        return text;
    }

    /* pp */ boolean isSymbol(char c) {
        return type == TokenType.SYMBOL
                && text.length() == 1
                && text.charAt(0) == c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;
        Token other = (Token) o;
        return type == other.type
                && line == other.line
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, line, text);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(type);
        buf.append('@').append(line);
        if (type != TokenType.EOF)
            buf.append(':').append('"').append(text).append('"');
        return buf.append(']').toString();
    }
}
