/*
 * Copyright 2015-2023 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package uk.co.real_logic.nifgen.schema.generation;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertEquals;

public class CodeWriterTest
{
    private final CodeWriter writer = new CodeWriter();

    @Test
    public void shouldIndentByBracesAndOutdentLabels()
    {
        writer
            .code("class A {")
            .code("public:")
            .code("int a;")
            .code("};");

        assertEquals("class A {\npublic:\n\tint a;\n};\n", writer.toString());
    }

    @Test
    public void shouldIndentEmbeddedLineBreaks()
    {
        writer
            .code("if ( x ) {")
            .code("if ( y != NULL )\n\tuse(y);")
            .code("};");

        assertEquals("if ( x ) {\n\tif ( y != NULL )\n\t\tuse(y);\n};\n", writer.toString());
    }

    @Test
    public void shouldDropTrailingWhitespace()
    {
        writer.code("int a;  \t").code(null);

        assertEquals("int a;\n\n", writer.toString());
    }

    @Test
    public void shouldReportIndentForLoopIndices()
    {
        writer.code("for (;;) {");
        assertEquals(1, writer.indent());

        writer.code("};");
        assertEquals(0, writer.indent());
    }

    @Test
    public void shouldWriteSingleLineDoxygenComment()
    {
        writer.comment("Number of vertices.");

        assertEquals("/*! Number of vertices. */\n", writer.toString());
    }

    @Test
    public void shouldWriteMultiLineDoxygenComment()
    {
        writer.comment("First line.\nSecond line.");

        assertEquals("/*!\n * First line.\n * Second line.\n */\n", writer.toString());
    }

    @Test
    public void shouldWrapLineCommentsAtEightyColumns()
    {
        final StringBuilder text = new StringBuilder();
        for (int i = 0; i < 30; i++)
        {
            text.append("word ");
        }

        writer.comment(text.toString(), false);

        final String[] lines = writer.toString().split("\n");
        assertEquals(2, lines.length);
        for (final String line : lines)
        {
            assertThat(line, startsWith("// word"));
            assertThat(line.length(), lessThanOrEqualTo(83));
        }
    }

    @Test
    public void shouldIgnoreBlankComments()
    {
        writer.comment("  \n ").comment(null);

        assertEquals("", writer.toString());
    }

    @Test
    public void shouldOpenGuardAndNamespaceOnceAndCloseBoth()
    {
        writer
            .guard("NI_NODE")
            .guard("NI_NODE")
            .namespace("Niflib")
            .namespace("Niflib")
            .code("class NiNode;")
            .end()
            .end();

        assertEquals(
            "\n#ifndef _NI_NODE_H_\n#define _NI_NODE_H_\n" +
            "namespace Niflib {\n" +
            "class NiNode;\n" +
            "}\n" +
            "#endif\n",
            writer.toString());
    }

    @Test
    public void shouldWriteIncludes()
    {
        writer.include("\"NiObject.h\"").include("<string>");

        assertEquals("#include \"NiObject.h\"\n#include <string>\n", writer.toString());
    }
}
