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

import org.pcollections.PVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats and validates a script.
 *
 * The script is preprocessed, lexed, scanned once by a
 * {@link FunctionTableBuilder} and then rendered by a {@link Resolver}
 * using the table from the first scan. Each call to
 * {@link #format(CharSequence)} is independent of the others.
 */
public class ScriptFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptFormatter.class);

    private final Preprocessor preprocessor;
    private final Set<Feature> features;

    public ScriptFormatter() {
        this.preprocessor = new Preprocessor();
        this.features = EnumSet.noneOf(Feature.class);
    }

    /**
     * Returns the Preprocessor, for adding predefined macros.
     */
    @Nonnull
    public Preprocessor getPreprocessor() {
        return preprocessor;
    }

    public void setListener(@CheckForNull PreprocessorListener listener) {
        preprocessor.setListener(listener);
    }

    /**
     * Returns the feature-set for this ScriptFormatter.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Feature> getFeatures() {
        return features;
    }

    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Returns the warning-set shared by the preprocessor and lexer.
     */
    @Nonnull
    public Set<Warning> getWarnings() {
        return preprocessor.getWarnings();
    }

    public void addWarning(@Nonnull Warning w) {
        preprocessor.addWarning(w);
    }

    /**
     * Lexes already preprocessed text.
     */
    @Nonnull
    public PVector<Token> tokenize(@Nonnull CharSequence text) {
        return tokenize(text, null);
    }

    @Nonnull
    private PVector<Token> tokenize(@Nonnull CharSequence text, @CheckForNull List<Integer> sourceLines) {
        Lexer lexer = new Lexer(text, preprocessor.getWarnings(), preprocessor.getListener(), sourceLines);
        return lexer.tokenize();
    }

    /**
     * Runs both passes over a token sequence.
     */
    @Nonnull
    public FormatResult format(@Nonnull PVector<Token> tokens) {
        FunctionTable functions = new FunctionTableBuilder().build(tokens);
        if (getFeature(Feature.DEBUG))
            LOG.info("Found " + functions.size() + " functions: " + functions);
        FormatResult result = new Resolver(functions).resolve(tokens);
        if (getFeature(Feature.DEBUG))
            LOG.info("Resolved with " + result.getDiagnostics().size() + " diagnostics");
        return result;
    }

    /**
     * Formats a script.
     */
    @Nonnull
    public FormatResult format(@Nonnull CharSequence source) {
        List<Integer> sourceLines = new ArrayList<Integer>();
        String text = preprocessor.process(source, sourceLines);
        PVector<Token> tokens = tokenize(text, sourceLines);
        if (getFeature(Feature.DEBUG))
            LOG.info("Lexed " + (tokens.size() - 1) + " tokens");
        return format(tokens);
    }
}
