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
package uk.co.real_logic.nifgen;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import static uk.co.real_logic.nifgen.CommonConfiguration.DEBUG_FILE;
import static uk.co.real_logic.nifgen.CommonConfiguration.DEBUG_FILE_PROPERTY;

public class PrintingDebugAppender extends AbstractDebugAppender
{
    private final StringBuilder builder = new StringBuilder();
    private final PrintWriter output;

    public PrintingDebugAppender()
    {
        output = makeOutputStream();
    }

    private PrintWriter makeOutputStream()
    {
        if (DEBUG_FILE == null)
        {
            return new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        }
        else
        {
            try
            {
                return new PrintWriter(new OutputStreamWriter(
                    new FileOutputStream(DEBUG_FILE), StandardCharsets.UTF_8));
            }
            catch (final IOException ex)
            {
                throw new IllegalStateException(
                    "Unable to configure DebugLogger, please check " + DEBUG_FILE_PROPERTY, ex);
            }
        }
    }

    public synchronized void log(final LogTag tag, final CharSequence message)
    {
        final StringBuilder builder = this.builder;
        builder.setLength(0);
        builder
            .append(System.currentTimeMillis())
            .append(':')
            .append(Thread.currentThread().getName())
            .append(tag.logStr())
            .append(' ')
            .append(message)
            .append(System.lineSeparator());

        output.append(builder);
        output.flush();
    }
}
