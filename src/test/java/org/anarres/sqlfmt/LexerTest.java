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

import static com.google.common.truth.Truth.assertThat;
import static org.anarres.sqlfmt.TokenType.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.pcollections.PVector;

public class LexerTest {

    private static List<String> lex(String text) {
        List<String> out = new ArrayList<>();
        for (Token tok : new Lexer(text).tokenize())
            out.add(tok.getType() + ":" + tok.getText() + "@" + tok.getLine());
        return out;
    }

    @Test
    public void testFromIsNotKeyword() {
        assertThat(lex("select a from t")).containsExactly(
                "KEYWORD:select@1",
                "IDENTIFIER:a@1",
                "IDENTIFIER:from@1",
                "IDENTIFIER:t@1",
                "EOF:@1").inOrder();
    }

    @Test
    public void testKeywordCase() {
        PVector<Token> tokens = new Lexer("SeLeCt Values ENDING").tokenize();
        assertThat(tokens.get(0)).isEqualTo(new Token(KEYWORD, 1, "SeLeCt"));
        assertThat(tokens.get(1)).isEqualTo(new Token(KEYWORD, 1, "Values"));
        assertThat(tokens.get(2)).isEqualTo(new Token(IDENTIFIER, 1, "ENDING"));
    }

    @Test
    public void testIdentifiersAndNumbers() {
        assertThat(lex("foo_1 _bar 123abc -7")).containsExactly(
                "IDENTIFIER:foo_1@1",
                "IDENTIFIER:_bar@1",
                "LITERAL:123@1",
                "IDENTIFIER:abc@1",
                "SYMBOL:-@1",
                "LITERAL:7@1",
                "EOF:@1").inOrder();
    }

    @Test
    public void testSymbols() {
        assertThat(lex("a(1,2);")).containsExactly(
                "IDENTIFIER:a@1",
                "SYMBOL:(@1",
                "LITERAL:1@1",
                "SYMBOL:,@1",
                "LITERAL:2@1",
                "SYMBOL:)@1",
                "SYMBOL:;@1",
                "EOF:@1").inOrder();
    }

    @Test
    public void testStrings() {
        assertThat(lex("\"hello world\" x \"\"")).containsExactly(
                "STRING:hello world@1",
                "IDENTIFIER:x@1",
                "STRING:@1",
                "EOF:@1").inOrder();
    }

    @Test
    public void testUnterminatedString() {
        assertThat(lex("x \"abc\ndef")).containsExactly(
                "IDENTIFIER:x@1",
                "STRING:abc\ndef@1",
                "EOF:@2").inOrder();
    }

    @Test
    public void testLines() {
        assertThat(lex("a\nb\r\n\n\tc\n")).containsExactly(
                "IDENTIFIER:a@1",
                "IDENTIFIER:b@2",
                "IDENTIFIER:c@4",
                "EOF:@5").inOrder();
    }

    @Test
    public void testEmpty() {
        assertThat(lex("")).containsExactly("EOF:@1");
        assertThat(lex(" \n ")).containsExactly("EOF:@2");
    }

    @Test
    public void testUnknownCharactersAreDropped() {
        assertThat(lex("a\u00e9b \u0001c")).containsExactly(
                "IDENTIFIER:a@1",
                "IDENTIFIER:b@1",
                "IDENTIFIER:c@1",
                "EOF:@1").inOrder();
    }

    @Test
    public void testUnknownCharacterWarning() {
        List<String> warnings = new ArrayList<>();
        PreprocessorListener listener = (w, line, msg) -> warnings.add(line + ":" + msg);

        new Lexer("a\n\u00e9", EnumSet.noneOf(Warning.class), listener).tokenize();
        assertThat(warnings).isEmpty();

        new Lexer("a\n\u00e9", EnumSet.of(Warning.UNKNOWN_CHARACTER), listener).tokenize();
        assertThat(warnings).containsExactly("2:Discarded unknown character U+00E9");
    }

    @Test
    public void testSupplementaryCharacterWarning() {
        List<String> warnings = new ArrayList<>();
        PreprocessorListener listener = (w, line, msg) -> warnings.add(msg);

        PVector<Token> tokens = new Lexer("a\uD83D\uDE00b", EnumSet.of(Warning.UNKNOWN_CHARACTER), listener).tokenize();
        assertThat(warnings).containsExactly("Discarded unknown character U+1F600");
        assertThat(tokens).hasSize(3);
    }

    @Test
    public void testWarningAtSourceLine() {
        List<String> warnings = new ArrayList<>();
        PreprocessorListener listener = (w, line, msg) -> warnings.add(w + "@" + line);

        new Lexer("x\n\u0001", EnumSet.of(Warning.UNKNOWN_CHARACTER), listener, Arrays.asList(3, 7)).tokenize();
        assertThat(warnings).containsExactly("UNKNOWN_CHARACTER@7");
    }

    @Test
    public void testTokenAfterEnd() {
        Lexer lexer = new Lexer("x");
        assertThat(lexer.token().getType()).isEqualTo(IDENTIFIER);
        assertThat(lexer.token().getType()).isEqualTo(EOF);
        assertThat(lexer.token().getType()).isEqualTo(EOF);
    }
}
