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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The first pass: collects the signature of the first call of every
 * function in a token sequence.
 *
 * This pass produces no diagnostics.
 */
public class FunctionTableBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionTableBuilder.class);

    @Nonnull
    public FunctionTable build(@Nonnull PVector<Token> tokens) {
        TokenCursor cursor = new TokenCursor(tokens);
        FunctionTable table = FunctionTable.empty();
        while (!cursor.isAtEnd()) {
            if (!CallSites.isCallSite(cursor)) {
                cursor.next();
                continue;
            }
            Token name = cursor.next();
            cursor.next();  // (
            List<String> arguments = new ArrayList<String>();
            CallSites.arguments(cursor, arguments);
            if (LOG.isTraceEnabled())
                LOG.trace("Call " + name.getText() + arguments + " at line " + name.getLine());
            table = table.plusIfAbsent(new FunctionSignature(name.getText(), arguments, name.getLine()));
        }
        return table;
    }
}
