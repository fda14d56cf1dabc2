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

import org.agrona.LangUtil;
import org.agrona.generation.OutputManager;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.GENERATION;

/**
 * Writes generated files under a root directory, naming each by its path relative to the root, eg:
 * <code>include/obj/NiNode.h</code>. A file is only rewritten when its content changes so that build tools
 * don't recompile untouched sources.
 * <p>
 * Files are read and written as ISO-8859-1, which maps each byte to one char, so custom code in any
 * encoding passes through unchanged.
 */
public final class FileTreeOutputManager implements OutputManager, CustomCodeSource
{
    static final Charset FILE_CHARSET = ISO_8859_1;

    private final Path root;

    public FileTreeOutputManager(final String root)
    {
        this.root = Paths.get(root);
    }

    public Writer createOutput(final String name) throws IOException
    {
        final Path file = resolve(name);
        Files.createDirectories(file.getParent());

        return new StringWriter()
        {
            public void close() throws IOException
            {
                super.close();
                writeIfChanged(file, toString());
            }
        };
    }

    public List<String> existingLines(final String name)
    {
        final Path file = resolve(name);
        if (!Files.isRegularFile(file))
        {
            return null;
        }

        try
        {
            return splitLines(new String(Files.readAllBytes(file), FILE_CHARSET));
        }
        catch (final IOException ex)
        {
            LangUtil.rethrowUnchecked(ex);
            return null;
        }
    }

    public Path root()
    {
        return root;
    }

    private Path resolve(final String name)
    {
        return root.resolve(name);
    }

    private static void writeIfChanged(final Path file, final String content) throws IOException
    {
        final byte[] bytes = content.getBytes(FILE_CHARSET);
        if (Files.isRegularFile(file) && Arrays.equals(Files.readAllBytes(file), bytes))
        {
            log(GENERATION, "Unchanged %s", file);
            return;
        }

        Files.write(file, bytes);
        log(GENERATION, "Wrote %s", file);
    }

    /**
     * Split text into lines, each keeping its terminator.
     *
     * @param text the text.
     * @return the lines.
     */
    static List<String> splitLines(final String text)
    {
        final List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++)
        {
            if (text.charAt(i) == '\n')
            {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }

        if (start < text.length())
        {
            lines.add(text.substring(start));
        }

        return lines;
    }
}
