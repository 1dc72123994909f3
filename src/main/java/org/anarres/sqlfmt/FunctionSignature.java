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
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * The signature of a function, as captured at its first call site.
 */
public final class FunctionSignature {

    private final String name;
    private final PVector<String> arguments;
    private final int line;

    public FunctionSignature(@Nonnull String name, @Nonnull List<String> arguments, int line) {
        this.name = name;
        this.arguments = TreePVector.from(arguments);
        this.line = line;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Returns the text of the arguments of the first call.
     */
    @Nonnull
    public PVector<String> getArguments() {
        return arguments;
    }

    @Nonnegative
    public int getArity() {
        return arguments.size();
    }

    /**
     * Returns the line of the first call.
     */
    public int getLine() {
        return line;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        JsonArray args = new JsonArray();
        for (String argument : arguments)
            args.add(new JsonPrimitive(argument));
        result.add("arguments", args);
        result.addProperty("line", line);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FunctionSignature))
            return false;
        FunctionSignature other = (FunctionSignature) o;
        return name.equals(other.name)
                && line == other.line
                && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + arguments.hashCode()) * 31 + line;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
