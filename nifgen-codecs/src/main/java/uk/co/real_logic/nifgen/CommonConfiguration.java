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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

import static java.lang.System.getProperty;
import static java.util.stream.Collectors.toCollection;

/**
 * Configuration shared by the whole code generator rather than by a single generation run.
 */
public final class CommonConfiguration
{
    /**
     * Property to enable debug logging. Set to "all" or "true" for every {@link LogTag}, or to a comma separated
     * list of tag names, eg: <code>SCHEMA,GENERATION</code>.
     */
    public static final String DEBUG_PRINT_PROPERTY = "nifgen.debug";

    /**
     * Property that redirects debug logging into a file rather than standard out.
     */
    public static final String DEBUG_FILE_PROPERTY = "nifgen.debug.file";

    public static final boolean DEBUG_PRINT;
    public static final Set<LogTag> DEBUG_TAGS;
    public static final String DEBUG_FILE = getProperty(DEBUG_FILE_PROPERTY);

    static
    {
        final String debugPrintValue = getProperty(DEBUG_PRINT_PROPERTY);
        boolean debugPrint = false;
        Set<LogTag> debugTags = Collections.emptySet();
        if (debugPrintValue != null)
        {
            if ("all".equalsIgnoreCase(debugPrintValue) || "true".equalsIgnoreCase(debugPrintValue))
            {
                debugPrint = true;
                debugTags = EnumSet.allOf(LogTag.class);
            }
            else
            {
                try
                {
                    debugTags = Stream
                        .of(debugPrintValue.split(","))
                        .map(String::trim)
                        .map(LogTag::valueOf)
                        .collect(toCollection(() -> EnumSet.noneOf(LogTag.class)));

                    debugPrint = !debugTags.isEmpty();
                }
                catch (final IllegalArgumentException ex)
                {
                    System.err.println("Ignoring invalid -D" + DEBUG_PRINT_PROPERTY + "=" + debugPrintValue +
                        ", expected all or a list of " + EnumSet.allOf(LogTag.class));
                }
            }
        }

        DEBUG_PRINT = debugPrint;
        DEBUG_TAGS = debugTags;
    }

    private CommonConfiguration()
    {
    }
}
