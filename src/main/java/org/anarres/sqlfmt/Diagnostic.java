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
 * A problem found in a script, rendered as a comment in the output.
 */
public final class Diagnostic {

    public static enum Kind {
        MISSING_PARENTHESIS,
        ARITY_MISMATCH,
        UNKNOWN_FUNCTION
    }

    /** The prefix of every rendered diagnostic. */
    public static final String PREFIX = "-- Error: ";

    private final Kind kind;
    private final int line;
    private final String message;

    public Diagnostic(@Nonnull Kind kind, int line, @Nonnull String message) {
        this.kind = kind;
        this.line = line;
        this.message = message;
    }

    @Nonnull
    public static Diagnostic missingParenthesis(int line) {
        return new Diagnostic(Kind.MISSING_PARENTHESIS, line,
                "Missing closing parenthesis for function call.");
    }

    @Nonnull
    public static Diagnostic arityMismatch(@Nonnull FunctionSignature signature, int line, int actual) {
        return new Diagnostic(Kind.ARITY_MISMATCH, line,
                "Function '" + signature.getName() + "' at line " + signature.getLine()
                + " expects " + signature.getArity() + " arguments, but "
                + actual + " were provided.");
    }

    @Nonnull
    public static Diagnostic unknownFunction(@Nonnull String name, int line) {
        return new Diagnostic(Kind.UNKNOWN_FUNCTION, line,
                "Unknown function '" + name + "' at line " + line + ".");
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the line of the call which caused this diagnostic.
     */
    public int getLine() {
        return line;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    /**
     * Returns this diagnostic as a comment line, without indentation.
     */
    @Nonnull
    public String toComment() {
        return PREFIX + message;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Diagnostic))
            return false;
        Diagnostic other = (Diagnostic) o;
        return kind == other.kind
                && line == other.line
                && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, message);
    }

    @Override
    public String toString() {
        return line + ": " + kind + ": " + message;
    }
}
