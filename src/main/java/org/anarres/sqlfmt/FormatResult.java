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

import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.TreePVector;

/**
 * The result of formatting a script.
 */
public final class FormatResult {

    private final String output;
    private final FunctionTable functions;
    private final List<Diagnostic> diagnostics;

    public FormatResult(@Nonnull String output, @Nonnull FunctionTable functions, @Nonnull List<Diagnostic> diagnostics) {
        this.output = output;
        this.functions = functions;
        this.diagnostics = TreePVector.from(diagnostics);
    }

    /**
     * Returns the formatted text, including diagnostic comments.
     */
    @Nonnull
    public String getOutput() {
        return output;
    }

    /**
     * Returns the table built by the first pass.
     */
    @Nonnull
    public FunctionTable getFunctions() {
        return functions;
    }

    /**
     * Returns the diagnostics in the order in which they appear in the output.
     */
    @Nonnull
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int getDiagnosticCount(@Nonnull Diagnostic.Kind kind) {
        int count = 0;
        for (Diagnostic d : diagnostics)
            if (d.getKind() == kind)
                count++;
        return count;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
