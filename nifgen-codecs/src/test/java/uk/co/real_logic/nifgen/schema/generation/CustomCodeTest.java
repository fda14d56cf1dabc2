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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static uk.co.real_logic.nifgen.schema.generation.CustomRegion.*;

public class CustomCodeTest
{
    private static final List<String> PREVIOUS_FILE = Arrays.asList(
        "#include \"NiNode.h\"\n",
        "//--BEGIN PRE-READ CUSTOM CODE--//\n",
        "\tinitialise();\n",
        "//--BEGIN MISC CUSTOM CODE--//\n",
        "//--END CUSTOM CODE--//\n",
        "NifStream( flags, in, info );\n",
        "//--BEGIN SHINY CUSTOM CODE--//\n",
        "lost();\n",
        "//--END CUSTOM CODE--//\n",
        "//--BEGIN INCLUDE CUSTOM CODE--//\n",
        "#include <map>\n",
        "//--END CUSTOM CODE--//\n");

    @Test
    public void shouldCaptureLinesBetweenMarkers()
    {
        final CustomCode customCode = CustomCode.extract(PREVIOUS_FILE);

        assertThat(customCode.lines(PRE_READ), contains("\tinitialise();\n", "//--BEGIN MISC CUSTOM CODE--//\n"));
        assertThat(customCode.lines(INCLUDE), contains("#include <map>\n"));
    }

    @Test
    public void shouldIgnoreRegionsNotInFile()
    {
        final CustomCode customCode = CustomCode.extract(PREVIOUS_FILE);

        assertThat(customCode.lines(MISC), is(empty()));
        assertThat(customCode.lines(POST_WRITE), is(empty()));
    }

    @Test
    public void shouldIgnoreUnknownRegions()
    {
        final CustomCode customCode = CustomCode.extract(PREVIOUS_FILE);

        for (final CustomRegion region : CustomRegion.values())
        {
            assertThat(customCode.lines(region), not(hasItem("lost();\n")));
        }
    }

    @Test
    public void shouldKeepEmptyRegionsEmpty()
    {
        final CustomCode customCode = CustomCode.extract(Arrays.asList(
            "//--BEGIN CONSTRUCTOR CUSTOM CODE--//\n",
            "//--END CUSTOM CODE--//\n"));

        assertThat(customCode.lines(CONSTRUCTOR), is(empty()));
    }

    @Test
    public void shouldDefaultToBlankLineExceptIncludes()
    {
        final CustomCode defaults = CustomCode.defaults();

        assertThat(defaults.lines(FILE_HEAD), contains("\n"));
        assertThat(defaults.lines(DESTRUCTOR), contains("\n"));
        assertThat(defaults.lines(INCLUDE), is(empty()));
    }

    @Test
    public void shouldWriteRegionBackVerbatim()
    {
        final CodeWriter writer = new CodeWriter();
        writer.code("void Read() {");

        CustomCode.extract(PREVIOUS_FILE).writeRegion(writer, PRE_READ);

        assertEquals(
            "void Read() {\n" +
            "\t//--BEGIN PRE-READ CUSTOM CODE--//\n" +
            "\tinitialise();\n" +
            "//--BEGIN MISC CUSTOM CODE--//\n" +
            "\t//--END CUSTOM CODE--//\n",
            writer.toString());
    }

    @Test
    public void shouldReproduceExtractedRegions()
    {
        final CodeWriter writer = new CodeWriter();
        final CustomCode defaults = CustomCode.defaults();
        defaults.writeRegion(writer, MISC);
        defaults.writeRegion(writer, INCLUDE);

        final List<String> lines = FileTreeOutputManager.splitLines(writer.toString());
        final CustomCode extracted = CustomCode.extract(lines);

        assertEquals(defaults.lines(MISC), extracted.lines(MISC));
        assertEquals(defaults.lines(INCLUDE), extracted.lines(INCLUDE));
    }

    @Test
    public void shouldExtractCustomCodeFromExistingFile()
    {
        final CustomCodeSource source = mock(CustomCodeSource.class, CALLS_REAL_METHODS);
        doReturn(PREVIOUS_FILE).when(source).existingLines("src/obj/NiNode.cpp");

        final CustomCode customCode = source.customCode("src/obj/NiNode.cpp");

        verify(source).existingLines("src/obj/NiNode.cpp");
        assertThat(customCode.lines(INCLUDE), contains("#include <map>\n"));
    }

    @Test
    public void shouldUseDefaultsWithoutExistingFile()
    {
        final CustomCodeSource source = mock(CustomCodeSource.class, CALLS_REAL_METHODS);
        doReturn(null).when(source).existingLines(anyString());

        final CustomCode customCode = source.customCode("src/obj/NiNew.cpp");

        assertThat(customCode.lines(MISC), contains("\n"));
    }

    @Test
    public void shouldCaptureUnterminatedRegionToEndOfFile()
    {
        final CustomCode customCode = CustomCode.extract(Collections.singletonList(
            "//--BEGIN FILE FOOT CUSTOM CODE--//\n"));

        assertThat(customCode.lines(FILE_FOOT), is(empty()));
    }
}
