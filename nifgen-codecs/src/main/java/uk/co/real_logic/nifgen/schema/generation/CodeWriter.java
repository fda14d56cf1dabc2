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

/**
 * Accumulates C++ source text, indenting each line by brackets and colons: a line starting with <code>}</code>
 * de-indents, a line ending with <code>{</code> indents the lines after it, and a label such as
 * <code>public:</code> is written one level out from the lines around it. Indentation uses tabs.
 */
public final class CodeWriter
{
    private static final int COMMENT_WIDTH = 80;

    private final StringBuilder out = new StringBuilder();
    private int indent;
    private boolean guarding;
    private boolean namespaced;

    /**
     * @return the current indentation level, also used to name loop indices.
     */
    public int indent()
    {
        return indent;
    }

    /**
     * Write a line break.
     *
     * @return this
     */
    public CodeWriter code()
    {
        out.append('\n');
        return this;
    }

    /**
     * Write one or more lines of code at the current indentation.
     *
     * @param text the code, trailing whitespace is dropped and embedded line breaks are indented too.
     * @return this
     */
    public CodeWriter code(final String text)
    {
        if (text == null)
        {
            return code();
        }

        if (text.startsWith("}"))
        {
            indent--;
        }
        if (text.endsWith(":"))
        {
            indent--;
        }

        final String prefix = tabs(indent);
        final String line = stripTrailing(text);
        out.append(prefix).append(line.replace("\n", "\n" + prefix)).append('\n');

        if (line.endsWith("{"))
        {
            indent++;
        }
        if (line.endsWith(":"))
        {
            indent++;
        }

        return this;
    }

    /**
     * Write text without any indentation or line break.
     *
     * @param text the text.
     * @return this
     */
    public CodeWriter write(final CharSequence text)
    {
        out.append(text);
        return this;
    }

    public CodeWriter guard(final String name)
    {
        if (!guarding)
        {
            guarding = true;
            code("\n#ifndef _" + name + "_H_\n#define _" + name + "_H_\n");
        }
        return this;
    }

    public CodeWriter namespace(final String name)
    {
        if (!namespaced)
        {
            namespaced = true;
            out.append("namespace ").append(name).append(" {\n");
        }
        return this;
    }

    public CodeWriter include(final String file)
    {
        out.append("#include ").append(file).append('\n');
        return this;
    }

    /**
     * Close the namespace and include guard if open.
     *
     * @return this
     */
    public CodeWriter end()
    {
        if (namespaced)
        {
            out.append("}\n");
            namespaced = false;
        }
        if (guarding)
        {
            code("#endif");
            guarding = false;
        }
        return this;
    }

    public CodeWriter comment(final String text)
    {
        return comment(text, true);
    }

    /**
     * Write text as a comment, wrapping each line at 80 columns. Blank text writes nothing.
     *
     * @param text the comment text.
     * @param doxygen true for a <code>/*!</code> block, false for <code>//</code> lines.
     * @return this
     */
    public CodeWriter comment(final String text, final boolean doxygen)
    {
        if (text == null)
        {
            return this;
        }

        final StringBuilder filled = new StringBuilder();
        for (final String line : text.split("\n", -1))
        {
            filled.append(fill(line)).append('\n');
        }

        final String body = filled.toString().trim();
        if (body.isEmpty())
        {
            return this;
        }

        if (doxygen)
        {
            if (body.indexOf('\n') != -1)
            {
                code("/*!\n * " + body.replace("\n", "\n * ") + "\n */");
            }
            else
            {
                code("/*! " + body + " */");
            }
        }
        else
        {
            for (final String line : body.split("\n"))
            {
                code("// " + line);
            }
        }

        return this;
    }

    public String toString()
    {
        return out.toString();
    }

    static String fill(final String line)
    {
        final String[] words = line.trim().split("\\s+");
        final StringBuilder filled = new StringBuilder();
        int lineLength = 0;
        for (final String word : words)
        {
            if (word.isEmpty())
            {
                continue;
            }

            if (lineLength > 0 && lineLength + 1 + word.length() > COMMENT_WIDTH)
            {
                filled.append('\n');
                lineLength = 0;
            }

            String remaining = word;
            while (lineLength == 0 && remaining.length() > COMMENT_WIDTH)
            {
                filled.append(remaining, 0, COMMENT_WIDTH).append('\n');
                remaining = remaining.substring(COMMENT_WIDTH);
            }

            if (lineLength > 0)
            {
                filled.append(' ');
                lineLength++;
            }
            filled.append(remaining);
            lineLength += remaining.length();
        }

        return filled.toString();
    }

    private static String tabs(final int count)
    {
        final StringBuilder tabs = new StringBuilder(Math.max(count, 0));
        for (int i = 0; i < count; i++)
        {
            tabs.append('\t');
        }
        return tabs.toString();
    }

    private static String stripTrailing(final String text)
    {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1)))
        {
            end--;
        }
        return text.substring(0, end);
    }
}
