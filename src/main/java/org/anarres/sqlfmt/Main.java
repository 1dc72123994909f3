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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.*;
import javax.annotation.Nonnull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end.
 *
 * Formats a single script file and writes the result next to it, with
 * {@link #SUFFIX} appended to the file name.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final String SUFFIX = ".formatted";

    @Nonnull
    private static CharSequence getWarnings() {
        StringBuilder buf = new StringBuilder();
        for (Warning w : Warning.values()) {
            if (buf.length() > 0)
                buf.append(", ");
            String name = w.name().toLowerCase(Locale.ROOT);
            buf.append(name.replace('_', '-'));
        }
        return buf;
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, System.err));
    }

    private static void usage(@Nonnull OptionParser parser, @Nonnull PrintStream err) throws IOException {
        err.println("Usage: sqlfmt [options] <filename>");
        parser.printHelpOn(err);
    }

    /**
     * Runs the formatter with the given command-line arguments.
     *
     * @return the process exit status.
     */
    public static int run(@Nonnull String[] args, @Nonnull PrintStream out, @Nonnull PrintStream err) throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");
        OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
                "Defines the given macro for the whole file.")
                .withRequiredArg().ofType(String.class).describedAs("name[=definition]");
        OptionSpec<String> undefineOption = parser.acceptsAll(Arrays.asList("undefine", "U"),
                "Undefines the given macro, previously defined using -D.")
                .withRequiredArg().describedAs("name");
        OptionSpec<String> warningOption = parser.acceptsAll(Arrays.asList("warning", "W"),
                "Enables the named warning class (" + getWarnings() + ", all).")
                .withRequiredArg().ofType(String.class).describedAs("warning");
        OptionSpec<?> dumpOption = parser.accepts("dump-functions",
                "Prints the function table as JSON.");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("File to process.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            err.println(e.getMessage());
            usage(parser, err);
            return 1;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return 0;
        }

        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.size() != 1) {
            usage(parser, err);
            return 1;
        }
        File input = inputs.get(0);

        ScriptFormatter formatter = new ScriptFormatter();
        DefaultPreprocessorListener listener = new DefaultPreprocessorListener(input.getPath());
        formatter.setListener(listener);
        if (options.has(debugOption))
            formatter.addFeature(Feature.DEBUG);

        try {
            for (String warning : options.valuesOf(warningOption)) {
                warning = warning.toUpperCase(Locale.ROOT);
                warning = warning.replace('-', '_');
                if (warning.equals("ALL"))
                    formatter.getWarnings().addAll(EnumSet.allOf(Warning.class));
                else
                    formatter.addWarning(Enum.valueOf(Warning.class, warning));
            }

            Preprocessor pp = formatter.getPreprocessor();
            for (String arg : options.valuesOf(defineOption)) {
                int idx = arg.indexOf('=');
                if (idx == -1)
                    pp.addMacro(arg);
                else
                    pp.addMacro(arg.substring(0, idx), arg.substring(idx + 1));
            }
            for (String arg : options.valuesOf(undefineOption))
                pp.removeMacro(arg);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            usage(parser, err);
            return 1;
        }

        if (formatter.getFeature(Feature.DEBUG))
            LOG.info("Predefined macros: " + formatter.getPreprocessor().getMacros().values());

        String source;
        try {
            source = FileUtils.readFileToString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.debug("Read failed", e);
            err.println("Error: Cannot open file " + input.getPath());
            return 1;
        }

        FormatResult result = formatter.format(source);

        File output = new File(input.getPath() + SUFFIX);
        try {
            FileUtils.writeStringToFile(output, result.getOutput(), StandardCharsets.UTF_8);
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("Write failed", e);
            err.println("Error: Cannot write to file " + output.getPath());
            return 1;
        }

        LOG.info(input.getPath() + ": " + result.getFunctions().size() + " functions, "
                + result.getDiagnosticCount(Diagnostic.Kind.MISSING_PARENTHESIS) + " missing parentheses, "
                + result.getDiagnosticCount(Diagnostic.Kind.ARITY_MISMATCH) + " arity mismatches, "
                + result.getDiagnosticCount(Diagnostic.Kind.UNKNOWN_FUNCTION) + " unknown functions, "
                + listener.getWarnings() + " warnings");

        if (options.has(dumpOption)) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(result.getFunctions().toJson()));
        }
        out.println("Formatted and validated code written to " + output.getPath());
        return 0;
    }
}
