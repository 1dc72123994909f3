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
import org.pcollections.TreePVector;

/**
 * Splits preprocessed text into {@link Token Tokens}.
 *
 * Only ASCII letters, digits and punctuation form tokens. Whitespace
 * separates tokens and any other character is discarded.
 */
public class Lexer {

    /** Keywords, in lower case. They are matched case-insensitively. */
    public static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "select", "insert", "update", "delete", "create", "table",
            "begin", "end", "declare", "do", "values"
    )));

    private final String input;
    private final Set<Warning> warnings;
    private final PreprocessorListener listener;
    private final List<Integer> sourceLines;
    private int pos;
    private int line;

    /**
     * @param sourceLines if not null, the source line of each line of
     *  input, as recorded by {@link Preprocessor#process(CharSequence, List)}.
     *  Warnings are reported at source lines; tokens keep the lines of
     *  the input.
     */
    public Lexer(@Nonnull CharSequence input, @Nonnull Set<Warning> warnings, @CheckForNull PreprocessorListener listener,
            @CheckForNull List<Integer> sourceLines) {
        this.input = input.toString();
        this.warnings = warnings;
        this.listener = listener;
        this.sourceLines = sourceLines;
        this.pos = 0;
        this.line = 1;
    }

    public Lexer(@Nonnull CharSequence input, @Nonnull Set<Warning> warnings, @CheckForNull PreprocessorListener listener) {
        this(input, warnings, listener, null);
    }

    public Lexer(@Nonnull CharSequence input) {
        this(input, EnumSet.noneOf(Warning.class), null);
    }

    private int sourceLine(int line) {
        if (sourceLines != null && line >= 1 && line <= sourceLines.size())
            return sourceLines.get(line - 1);
        return line;
    }

    private int peek() {
        return pos < input.length() ? input.charAt(pos) : -1;
    }

    private char read() {
        char c = input.charAt(pos++);
        if (c == '\n')
            line++;
        return c;
    }

    /* pp */ static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /* pp */ static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /* pp */ static boolean isPunct(int c) {
        return (c >= '!' && c <= '/')
                || (c >= ':' && c <= '@')
                || (c >= '[' && c <= '`')
                || (c >= '{' && c <= '~');
    }

    @Nonnull
    private Token identifier(int start) {
        StringBuilder text = new StringBuilder();
        while (isLetter(peek()) || isDigit(peek()) || peek() == '_')
            text.append(read());
        String word = text.toString();
        if (KEYWORDS.contains(word.toLowerCase(Locale.ROOT)))
            return new Token(TokenType.KEYWORD, start, word);
        return new Token(TokenType.IDENTIFIER, start, word);
    }

    @Nonnull
    private Token number(int start) {
        StringBuilder text = new StringBuilder();
        while (isDigit(peek()))
            text.append(read());
        return new Token(TokenType.LITERAL, start, text.toString());
    }

    /* An unterminated string runs to the end of input. */
    @Nonnull
    private Token string(int start) {
        read();
        StringBuilder text = new StringBuilder();
        while (peek() != '"' && peek() != -1)
            text.append(read());
        if (peek() == '"')
            read();
        return new Token(TokenType.STRING, start, text.toString());
    }

    /**
     * Returns the next token from the input.
     *
     * Once the input is exhausted, every call returns an EOF token.
     */
    @Nonnull
    public Token token() {
        for (;;) {
            int c = peek();
            if (c == -1)
                return Token.eof(line);
            int start = line;
            if (isLetter(c) || c == '_')
                return identifier(start);
            if (isDigit(c))
                return number(start);
            if (c == '"')
                return string(start);
            if (isPunct(c))
                return new Token(TokenType.SYMBOL, start, String.valueOf(read()));
            if (Preprocessor.isWhite((char) c)) {
                read();
                continue;
            }
            int cp = input.codePointAt(pos);
            pos += Character.charCount(cp);
            if (listener != null && warnings.contains(Warning.UNKNOWN_CHARACTER))
                listener.handleWarning(Warning.UNKNOWN_CHARACTER, sourceLine(start),
                        String.format("Discarded unknown character U+%04X", cp));
        }
    }

    /**
     * Lexes the remaining input.
     *
     * @return the tokens, always terminated by exactly one EOF token.
     */
    @Nonnull
    public PVector<Token> tokenize() {
        List<Token> tokens = new ArrayList<Token>();
        for (;;) {
            Token tok = token();
            tokens.add(tok);
            if (tok.getType() == TokenType.EOF)
                break;
        }
        return TreePVector.from(tokens);
    }
}
