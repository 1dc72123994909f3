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

import org.pcollections.PVector;

/**
 * A read-only cursor over a lexed token sequence.
 *
 * Any number of cursors may walk the same sequence independently.
 * Reading past the end returns the final EOF token.
 */
public class TokenCursor {

    private final PVector<Token> tokens;
    private final Token eof;
    private int pos;

    public TokenCursor(@Nonnull PVector<Token> tokens) {
        this.tokens = tokens;
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() == TokenType.EOF)
            this.eof = tokens.get(tokens.size() - 1);
        else
            this.eof = Token.eof(-1);
        this.pos = 0;
    }

    @Nonnull
    private Token at(int index) {
        return index < tokens.size() ? tokens.get(index) : eof;
    }

    /** Returns the current token without consuming it. */
    @Nonnull
    public Token peek() {
        return at(pos);
    }

    /** Returns the token after the current one. */
    @Nonnull
    public Token peekNext() {
        return at(pos + 1);
    }

    /** Consumes and returns the current token. */
    @Nonnull
    public Token next() {
        Token tok = at(pos);
        if (pos < tokens.size())
            pos++;
        return tok;
    }

    public boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }
}
