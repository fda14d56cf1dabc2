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

import java.util.Iterator;
import java.util.ServiceLoader;

import static uk.co.real_logic.nifgen.CommonConfiguration.*;

/**
 * A logger purely for debug data. Every call checks {@link #isEnabled(LogTag)} before formatting so that disabled
 * tags cost no more than a set lookup.
 */
public final class DebugLogger
{
    private static final AbstractDebugAppender APPENDER;

    static
    {
        final ServiceLoader<AbstractDebugAppender> loader = ServiceLoader.load(AbstractDebugAppender.class);
        final Iterator<AbstractDebugAppender> it = loader.iterator();
        if (it.hasNext())
        {
            APPENDER = it.next();
            if (DEBUG_FILE != null)
            {
                System.err.println("Warning: -D" + DEBUG_FILE_PROPERTY + " has been set, despite a custom " +
                    "AbstractDebugAppender (" + APPENDER.getClass() + ") being configured via the service loader. " +
                    "The file property will be ignored and your custom appender used instead.");
            }
        }
        else
        {
            APPENDER = new PrintingDebugAppender();
        }
    }

    private DebugLogger()
    {
    }

    public static void log(final LogTag tag, final String message)
    {
        if (isEnabled(tag))
        {
            APPENDER.log(tag, message);
        }
    }

    public static void log(final LogTag tag, final String format, final Object first)
    {
        if (isEnabled(tag))
        {
            APPENDER.log(tag, String.format(format, first));
        }
    }

    public static void log(final LogTag tag, final String format, final Object first, final Object second)
    {
        if (isEnabled(tag))
        {
            APPENDER.log(tag, String.format(format, first, second));
        }
    }

    public static void log(
        final LogTag tag,
        final String format,
        final Object first,
        final Object second,
        final Object third)
    {
        if (isEnabled(tag))
        {
            APPENDER.log(tag, String.format(format, first, second, third));
        }
    }

    public static void log(final LogTag tag, final String format, final Object... arguments)
    {
        if (isEnabled(tag))
        {
            APPENDER.log(tag, String.format(format, arguments));
        }
    }

    public static boolean isEnabled(final LogTag tag)
    {
        return DEBUG_PRINT && DEBUG_TAGS.contains(tag);
    }
}
