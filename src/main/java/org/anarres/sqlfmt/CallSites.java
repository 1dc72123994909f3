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

import java.util.List;
import javax.annotation.Nonnull;

/**
 * Call-site recognition shared by both passes over a token sequence.
 */
public final class CallSites {

    private CallSites() {
    }

    /**
     * Returns true if current starts a function call, that is, if it is
     * an identifier immediately followed by an opening parenthesis.
     */
    public static boolean isCallSite(@Nonnull Token current, @Nonnull Token next) {
        return current.getType() == TokenType.IDENTIFIER && next.isSymbol('(');
    }

    public static boolean isCallSite(@Nonnull TokenCursor cursor) {
        return isCallSite(cursor.peek(), cursor.peekNext());
    }

    /**
     * Consumes an argument list whose opening parenthesis has already
     * been consumed.
     *
     * Literals, identifiers and strings are captured as arguments; any
     * other token is skipped. A comma following an argument is skipped.
     * The list ends at a closing parenthesis, which is consumed, or at
     * EOF.
     *
     * @param arguments receives the text of each captured argument.
     * @return true if the closing parenthesis was found.
     */
    public static boolean arguments(@Nonnull TokenCursor cursor, @Nonnull List<String> arguments) {
        for (;;) {
            Token tok = cursor.peek();
            if (tok.getType() == TokenType.EOF)
                return false;
            if (tok.isSymbol(')')) {
                cursor.next();
                return true;
            }
            if (tok.getType().isArgument())
                arguments.add(tok.getText());
            cursor.next();
            if (cursor.peek().isSymbol(','))
                cursor.next();
        }
    }
}
