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
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A line-oriented macro preprocessor.
 *
 * Lines starting with {@link #DEFINE} define a macro and are removed
 * from the output. Every other line has each macro known at that point
 * substituted textually, in the order in which the macros were first
 * defined. A macro is never visible before the line which defines it.
 *
 * Macros added through {@link #addMacro(Macro)} are visible from the
 * first line. Definitions read by {@link #process(CharSequence)} live
 * only for the duration of that call, so a Preprocessor may be reused.
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    /** The directive marker. It must start in the first column. */
    public static final String DEFINE = "#define";

    /* Predefined macros. */
    private Map<String, Macro> macros;
    private Set<Warning> warnings;
    private PreprocessorListener listener;

    public Preprocessor() {
        this.macros = Collections.emptyMap();
        this.warnings = EnumSet.noneOf(Warning.class);
        this.listener = null;
    }

    /**
     * Sets the PreprocessorListener which receives the warnings of
     * this Preprocessor.
     */
    public void setListener(@CheckForNull PreprocessorListener listener) {
        this.listener = listener;
    }

    @CheckForNull
    public PreprocessorListener getListener() {
        return listener;
    }

    /**
     * Returns the warning-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Warning> getWarnings() {
        return warnings;
    }

    public void addWarning(@Nonnull Warning w) {
        warnings.add(w);
    }

    public void addWarnings(@Nonnull Collection<Warning> w) {
        warnings.addAll(w);
    }

    /**
     * Adds a predefined Macro to this Preprocessor.
     *
     * A later macro of the same name replaces the earlier one.
     */
    public void addMacro(@Nonnull Macro m) {
        if (m.getName().isEmpty())
            throw new IllegalArgumentException("Macro name may not be empty");
        Map<String, Macro> macros = new LinkedHashMap<String, Macro>(this.macros);
        macros.put(m.getName(), m);
        this.macros = Collections.unmodifiableMap(macros);
    }

    /**
     * Defines the given name as a macro with the given value.
     */
    public void addMacro(@Nonnull String name, @Nonnull String value) {
        addMacro(new Macro(name, value));
    }

    /**
     * Defines the given name as a macro, with the value <code>1</code>.
     */
    public void addMacro(@Nonnull String name) {
        addMacro(name, "1");
    }

    /**
     * Removes a predefined macro.
     *
     * @return true if the macro was defined.
     */
    public boolean removeMacro(@Nonnull String name) {
        if (!macros.containsKey(name))
            return false;
        Map<String, Macro> macros = new LinkedHashMap<String, Macro>(this.macros);
        macros.remove(name);
        this.macros = Collections.unmodifiableMap(macros);
        return true;
    }

    /**
     * Returns the predefined macros, in order of definition.
     */
    @Nonnull
    public Map<String, Macro> getMacros() {
        return macros;
    }

    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.get(name);
    }

    /**
     * Preprocesses the given text.
     *
     * The line terminators of all retained lines are preserved, so
     * text without any definition is returned unchanged.
     */
    @Nonnull
    public String process(@Nonnull CharSequence input) {
        return process(input, null);
    }

    /**
     * Preprocesses the given text, recording where each output line
     * came from.
     *
     * @param sourceLines if not null, receives the input line number of
     *  each line of the output, in order.
     */
    @Nonnull
    public String process(@Nonnull CharSequence input, @CheckForNull List<Integer> sourceLines) {
        Map<String, Macro> table = new LinkedHashMap<String, Macro>(macros);
        String text = input.toString();
        StringBuilder out = new StringBuilder(text.length());
        int line = 0;
        int start = 0;
        while (start < text.length()) {
            line++;
            int nl = text.indexOf('\n', start);
            int end = (nl < 0) ? text.length() : nl + 1;
            String content = text.substring(start, (nl < 0) ? end : nl);
            String terminator = text.substring(start + content.length(), end);
            start = end;

            if (content.startsWith(DEFINE)) {
                define(table, content, line);
                continue;
            }
            for (Macro m : table.values())
                content = substitute(content, m.getName(), m.getValue());
            out.append(content).append(terminator);
            if (sourceLines != null)
                sourceLines.add(line);
        }
        LOG.debug("Preprocessed " + line + " lines with " + table.size() + " macros");
        return out.toString();
    }

    private void define(@Nonnull Map<String, Macro> table, @Nonnull String content, int line) {
        int pos = skipNonWhite(content, 0);
        pos = skipWhite(content, pos);
        int keyEnd = skipNonWhite(content, pos);
        String name = content.substring(pos, keyEnd);
        if (name.isEmpty()) {
            warning(Warning.MALFORMED_DIRECTIVE, line, DEFINE + " without a macro name ignored");
            return;
        }
        String value = content.substring(keyEnd).trim();

        Macro previous = table.get(name);
        if (previous != null && !previous.getValue().equals(value)) {
            if (previous.isPredefined())
                warning(Warning.MACRO_REDEFINED, line, "Predefined macro " + name + " redefined");
            else
                warning(Warning.MACRO_REDEFINED, line, "Macro " + name + " redefined (previous definition at line " + previous.getLine() + ")");
        }
        table.put(name, new Macro(name, value, line));
    }

    private void warning(@Nonnull Warning w, int line, @Nonnull String msg) {
        if (listener != null && warnings.contains(w))
            listener.handleWarning(w, line, msg);
    }

    /**
     * Replaces every occurrence of key in line by value.
     *
     * Scanning resumes after each inserted value, so a value which
     * contains its own key is not expanded again.
     */
    @Nonnull
    /* pp */ static String substitute(@Nonnull String line, @Nonnull String key, @Nonnull String value) {
        if (key.isEmpty())
            return line;
        int pos = line.indexOf(key);
        if (pos < 0)
            return line;
        StringBuilder buf = new StringBuilder(line);
        while (pos >= 0) {
            buf.replace(pos, pos + key.length(), value);
            pos = buf.indexOf(key, pos + value.length());
        }
        return buf.toString();
    }

    /* pp */ static boolean isWhite(char c) {
        switch (c) {
            case ' ':
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
                return true;
            default:
                return false;
        }
    }

    private static int skipWhite(@Nonnull String s, int pos) {
        while (pos < s.length() && isWhite(s.charAt(pos)))
            pos++;
        return pos;
    }

    private static int skipNonWhite(@Nonnull String s, int pos) {
        while (pos < s.length() && !isWhite(s.charAt(pos)))
            pos++;
        return pos;
    }
}
