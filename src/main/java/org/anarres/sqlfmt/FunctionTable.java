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

import java.util.*;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * An immutable map from function name to the signature of its first
 * call site.
 *
 * Every call anywhere in a script is visible to every other call of
 * the same name, whichever comes first.
 *
 * @see FunctionTableBuilder
 */
public final class FunctionTable {

    private static final FunctionTable EMPTY = new FunctionTable(HashTreePMap.<String, FunctionSignature>empty());

    private final PMap<String, FunctionSignature> signatures;

    private FunctionTable(@Nonnull PMap<String, FunctionSignature> signatures) {
        this.signatures = signatures;
    }

    @Nonnull
    public static FunctionTable empty() {
        return EMPTY;
    }

    /**
     * Returns a table which additionally contains the given signature,
     * unless a signature of the same name is already present.
     */
    @Nonnull
    public FunctionTable plusIfAbsent(@Nonnull FunctionSignature signature) {
        if (signatures.containsKey(signature.getName()))
            return this;
        return new FunctionTable(signatures.plus(signature.getName(), signature));
    }

    @CheckForNull
    public FunctionSignature get(@Nonnull String name) {
        return signatures.get(name);
    }

    public boolean contains(@Nonnull String name) {
        return signatures.containsKey(name);
    }

    @Nonnegative
    public int size() {
        return signatures.size();
    }

    public boolean isEmpty() {
        return signatures.isEmpty();
    }

    /**
     * Returns all signatures, ordered by line and then by name.
     */
    @Nonnull
    public List<FunctionSignature> getSignatures() {
        List<FunctionSignature> out = new ArrayList<FunctionSignature>(signatures.values());
        out.sort(Comparator.comparingInt(FunctionSignature::getLine)
                .thenComparing(FunctionSignature::getName));
        return out;
    }

    @Nonnull
    public JsonArray toJson() {
        JsonArray result = new JsonArray();
        for (FunctionSignature signature : getSignatures())
            result.add(signature.toJson());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FunctionTable
                && signatures.equals(((FunctionTable) o).signatures);
    }

    @Override
    public int hashCode() {
        return signatures.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
