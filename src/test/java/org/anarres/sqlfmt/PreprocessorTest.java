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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PreprocessorTest {

    private Preprocessor pp;
    private List<String> warnings;

    @BeforeEach
    public void setUp() {
        pp = new Preprocessor();
        warnings = new ArrayList<>();
        pp.setListener((w, line, msg) -> warnings.add(w + "@" + line));
    }

    @Test
    public void testNoDefinitions() {
        String text = "select a\r\nfrom t\n\n  foo(1, 2)";
        assertThat(pp.process(text)).isEqualTo(text);
        assertThat(pp.process("")).isEmpty();
    }

    @Test
    public void testDefinitionLineIsRemoved() {
        assertThat(pp.process("#define X 1\n")).isEmpty();
        assertThat(pp.process("a\n#define X 1\nb")).isEqualTo("a\nb");
    }

    @Test
    public void testOnlyFollowingLines() {
        assertThat(pp.process("X\n#define X 1\nX\n")).isEqualTo("X\n1\n");
    }

    @Test
    public void testRedefinition() {
        assertThat(pp.process("#define K 1\nK\n#define K 2\nK K\n")).isEqualTo("1\n2 2\n");
    }

    @Test
    public void testValueIsTrimmed() {
        assertThat(pp.process("#define   N    4 2   \n[N]\n")).isEqualTo("[4 2]\n");
    }

    @Test
    public void testEmptyValue() {
        assertThat(pp.process("#define X\naXbX\n")).isEqualTo("ab\n");
    }

    @Test
    public void testSelfReference() {
        assertThat(pp.process("#define a aa\na b a\n")).isEqualTo("aa b aa\n");
        assertThat(pp.process("#define LOOP x LOOP\nLOOP\n")).isEqualTo("x LOOP\n");
    }

    @Test
    public void testSubstringOfIdentifier() {
        assertThat(pp.process("#define id x\nidentity\n")).isEqualTo("xentity\n");
    }

    @Test
    public void testDefinitionOrder() {
        assertThat(pp.process("#define A B\n#define B C\nA\n")).isEqualTo("C\n");
        assertThat(pp.process("#define B C\n#define A B\nA\n")).isEqualTo("B\n");
    }

    @Test
    public void testDirectiveMustStartLine() {
        assertThat(pp.process(" #define X 1\nX\n")).isEqualTo(" #define X 1\nX\n");
    }

    @Test
    public void testPredefined() {
        pp.addMacro("N", "7");
        pp.addMacro("FLAG");
        assertThat(pp.process("N FLAG\n")).isEqualTo("7 1\n");

        assertThat(pp.removeMacro("N")).isTrue();
        assertThat(pp.removeMacro("N")).isFalse();
        assertThat(pp.process("N FLAG\n")).isEqualTo("N 1\n");
    }

    @Test
    public void testPredefinedCollision() {
        pp.addMacro("N", "7");
        pp.addMacro("ON");
        assertThat(pp.process("N ON\n")).isEqualTo("7 O7\n");
    }

    @Test
    public void testSourceLines() {
        List<Integer> lines = new ArrayList<>();
        assertThat(pp.process("a\n#define X 1\n#define\nb\nX", lines)).isEqualTo("a\nb\n1");
        assertThat(lines).containsExactly(1, 4, 5).inOrder();
    }

    @Test
    public void testDefinitionsDoNotOutliveProcess() {
        pp.process("#define A 1\n");
        assertThat(pp.getMacro("A")).isNull();
        assertThat(pp.process("A\n")).isEqualTo("A\n");
    }

    @Test
    public void testMalformedDirective() {
        assertThat(pp.process("#define\nx\n")).isEqualTo("x\n");
        assertThat(warnings).isEmpty();

        pp.addWarning(Warning.MALFORMED_DIRECTIVE);
        assertThat(pp.process("x\n#define   \nx\n")).isEqualTo("x\nx\n");
        assertThat(warnings).containsExactly("MALFORMED_DIRECTIVE@2");
    }

    @Test
    public void testRedefinedWarning() {
        pp.addWarning(Warning.MACRO_REDEFINED);
        pp.addMacro("P", "0");
        pp.process("#define K 1\n#define K 1\n#define K 2\n#define P 1\n");
        assertThat(warnings).containsExactly("MACRO_REDEFINED@3", "MACRO_REDEFINED@4").inOrder();
    }

    @Test
    public void testSubstitute() {
        assertThat(Preprocessor.substitute("foo", "", "x")).isEqualTo("foo");
        assertThat(Preprocessor.substitute("foo", "bar", "x")).isEqualTo("foo");
        assertThat(Preprocessor.substitute("aaa", "a", "ab")).isEqualTo("ababab");
        assertThat(Preprocessor.substitute("aaa", "aa", "")).isEqualTo("a");
    }
}
