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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.PVector;

/**
 * The second pass: renders a token sequence one statement per line and
 * checks every call against a {@link FunctionTable}.
 *
 * Problems are written into the output as comment lines and collected
 * as {@link Diagnostic Diagnostics}; they never stop the pass.
 */
public class Resolver {

    /** The indentation for each nesting level. */
    public static final String INDENT = "    ";

    private final FunctionTable functions;
    private final StringBuilder output;
    private final List<Diagnostic> diagnostics;
    /* Always 0; statements do not nest. */
    private int indentLevel;
    private boolean used;

    public Resolver(@Nonnull FunctionTable functions) {
        this.functions = functions;
        this.output = new StringBuilder();
        this.diagnostics = new ArrayList<Diagnostic>();
        this.indentLevel = 0;
    }

    private void line(@Nonnull String text) {
        for (int i = 0; i < indentLevel; i++)
            output.append(INDENT);
        output.append(text).append('\n');
    }

    private void diagnostic(@Nonnull Diagnostic d) {
        diagnostics.add(d);
        line(d.toComment());
    }

    private void call(@Nonnull TokenCursor cursor) {
        Token name = cursor.next();
        cursor.next();  // (
        line(name.getText() + " (");

        List<String> arguments = new ArrayList<String>();
        if (!CallSites.arguments(cursor, arguments))
            diagnostic(Diagnostic.missingParenthesis(name.getLine()));

        FunctionSignature signature = functions.get(name.getText());
        if (signature == null)
            diagnostic(Diagnostic.unknownFunction(name.getText(), name.getLine()));
        else if (signature.getArity() != arguments.size())
            diagnostic(Diagnostic.arityMismatch(signature, name.getLine(), arguments.size()));

        line(");");
    }

    /**
     * Formats the given tokens.
     *
     * A Resolver formats a single sequence; use a new instance for
     * each run.
     */
    @Nonnull
    public FormatResult resolve(@Nonnull PVector<Token> tokens) {
        if (used)
            throw new IllegalStateException("Resolver already used");
        used = true;
        TokenCursor cursor = new TokenCursor(tokens);
        while (!cursor.isAtEnd()) {
            Token tok = cursor.peek();
            if (tok.getType() == TokenType.KEYWORD) {
                cursor.next();
                line(tok.getText());
            } else if (CallSites.isCallSite(cursor)) {
                call(cursor);
            } else {
                cursor.next();
                line(tok.getText() + ";");
            }
        }
        return new FormatResult(output.toString(), functions, diagnostics);
    }
}
