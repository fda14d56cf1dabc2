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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class FileTreeOutputManagerTest
{
    private static final FileTime LONG_AGO = FileTime.fromMillis(1_000_000_000L);

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void shouldSplitLinesKeepingTerminators()
    {
        assertThat(FileTreeOutputManager.splitLines("a\r\nb\n\nc"), contains("a\r\n", "b\n", "\n", "c"));
        assertThat(FileTreeOutputManager.splitLines(""), is(empty()));
    }

    @Test
    public void shouldCreateDirectoriesForNestedFiles() throws Exception
    {
        final FileTreeOutputManager outputManager = new FileTreeOutputManager(folder.getRoot().getPath());

        write(outputManager, "include/obj/NiNode.h", "class NiNode;\n");

        final Path file = folder.getRoot().toPath().resolve("include/obj/NiNode.h");
        assertEquals("class NiNode;\n", new String(Files.readAllBytes(file), UTF_8));
        assertThat(outputManager.existingLines("include/obj/NiNode.h"), contains("class NiNode;\n"));
    }

    @Test
    public void shouldNotRewriteUnchangedFiles() throws Exception
    {
        final FileTreeOutputManager outputManager = new FileTreeOutputManager(folder.getRoot().getPath());
        final Path file = folder.getRoot().toPath().resolve("src/gen/enums.cpp");

        write(outputManager, "src/gen/enums.cpp", "int a;\n");
        Files.setLastModifiedTime(file, LONG_AGO);

        write(outputManager, "src/gen/enums.cpp", "int a;\n");
        assertEquals(LONG_AGO, Files.getLastModifiedTime(file));

        write(outputManager, "src/gen/enums.cpp", "int b;\n");
        assertNotEquals(LONG_AGO, Files.getLastModifiedTime(file));
    }

    @Test
    public void shouldRewriteExistingBytesUnchanged() throws Exception
    {
        final FileTreeOutputManager outputManager = new FileTreeOutputManager(folder.getRoot().getPath());
        final Path file = folder.getRoot().toPath().resolve("src/obj/NiNode.cpp");
        final byte[] latin1 = { '/', '/', ' ', 'c', 'a', 'f', (byte)0xE9, ' ', (byte)0xA9, '\n' };
        final byte[] utf8 = "// caf\u00E9\n".getBytes(UTF_8);
        final byte[] original = new byte[latin1.length + utf8.length];
        System.arraycopy(latin1, 0, original, 0, latin1.length);
        System.arraycopy(utf8, 0, original, latin1.length, utf8.length);
        Files.createDirectories(file.getParent());
        Files.write(file, original);

        final StringBuilder content = new StringBuilder();
        for (final String line : outputManager.existingLines("src/obj/NiNode.cpp"))
        {
            content.append(line);
        }
        write(outputManager, "src/obj/NiNode.cpp", content.toString());

        assertArrayEquals(original, Files.readAllBytes(file));
    }

    @Test
    public void shouldHaveNoLinesForMissingFile()
    {
        final FileTreeOutputManager outputManager = new FileTreeOutputManager(folder.getRoot().getPath());

        assertNull(outputManager.existingLines("src/obj/NiMissing.cpp"));
    }

    private static void write(final FileTreeOutputManager outputManager, final String name, final String content)
        throws Exception
    {
        try (Writer out = outputManager.createOutput(name))
        {
            out.append(content);
        }
    }
}
