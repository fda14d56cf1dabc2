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
package uk.co.real_logic.nifgen.schema;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import uk.co.real_logic.nifgen.schema.generation.CodeGenerator;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;
import static uk.co.real_logic.nifgen.schema.CodeGenerationTool.parseArguments;
import static uk.co.real_logic.nifgen.schema.ExampleSchema.exampleStream;

public class CodeGenerationToolTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private String schemaFile;
    private String outputPath;

    @Before
    public void setUp() throws Exception
    {
        final File schema = folder.newFile("nif.xml");
        try (InputStream in = exampleStream())
        {
            Files.copy(in, schema.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
        schemaFile = schema.getPath();
        outputPath = folder.newFolder("out").getPath();
    }

    @Test
    public void shouldGenerateSelectedTypesIntoOutputRoot() throws Exception
    {
        CodeGenerator.generate(parseArguments(new String[]{ schemaFile, "-p", outputPath, "-n", "NiTriData" }));

        assertTrue(new File(outputPath, "src/obj/NiTriData.cpp").exists());
        assertFalse(new File(outputPath, "src/obj/NiAVObject.cpp").exists());
        assertFalse(new File(outputPath, "src/gen/register.cpp").exists());
    }

    @Test
    public void shouldGenerateAccessorsWhenRequested() throws Exception
    {
        CodeGenerator.generate(parseArguments(new String[]{ schemaFile, "-p", outputPath, "-n", "NiAVObject", "-a" }));

        final String header = read("include/obj/NiAVObject.h");
        assertThat(header, containsString("GetFlags()"));
        assertThat(header, containsString("SetFlags("));
    }

    @Test
    public void shouldMarkManuallyUpdatedFields() throws Exception
    {
        CodeGenerator.generate(parseArguments(new String[]{
            schemaFile, "-p", outputPath, "-n", "NiTriData", "-m", "NiTriData:Num Vertices" }));

        assertThat(read("src/obj/NiTriData.cpp"), not(containsString("numVertices = (unsigned short)")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectUnknownOption()
    {
        parseArguments(new String[]{ schemaFile, "-x" });
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectMissingOptionValue()
    {
        parseArguments(new String[]{ schemaFile, "-p" });
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectManualUpdateWithoutField()
    {
        parseArguments(new String[]{ schemaFile, "-m", "NiTriData:" });
    }

    private String read(final String name) throws Exception
    {
        return new String(Files.readAllBytes(new File(outputPath, name).toPath()), UTF_8);
    }
}
