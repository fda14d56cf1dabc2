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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.CUSTOM_CODE;

/**
 * The hand written code captured from a previously generated file, by region. Captured lines keep their line
 * terminators so that writing them back reproduces them exactly.
 */
public final class CustomCode
{
    private static final String BEGIN_PREFIX = "//--BEGIN ";
    private static final String BEGIN_SUFFIX = " CUSTOM CODE--//";

    private final Map<CustomRegion, List<String>> linesByRegion = new EnumMap<>(CustomRegion.class);

    private CustomCode()
    {
    }

    /**
     * The custom code of a file that doesn't exist yet: every region holds a single blank line, apart from the
     * include region which is empty.
     *
     * @return the default custom code.
     */
    public static CustomCode defaults()
    {
        final CustomCode customCode = new CustomCode();
        for (final CustomRegion region : CustomRegion.values())
        {
            if (region != CustomRegion.INCLUDE)
            {
                customCode.linesByRegion.put(region, Collections.singletonList("\n"));
            }
        }
        return customCode;
    }

    /**
     * Capture the lines strictly between each begin marker and the following end marker. Begin markers met while
     * a region is open are captured as content. Unknown region kinds are ignored.
     *
     * @param lines the lines of the previous file, with their terminators.
     * @return the captured code.
     */
    public static CustomCode extract(final List<String> lines)
    {
        final CustomCode customCode = new CustomCode();
        CustomRegion open = null;
        for (final String line : lines)
        {
            if (open != null)
            {
                if (line.contains(CustomRegion.END_MARKER))
                {
                    open = null;
                }
                else
                {
                    customCode.linesByRegion.computeIfAbsent(open, (region) -> new ArrayList<>()).add(line);
                }
                continue;
            }

            final CustomRegion region = CustomRegion.beginningAt(line);
            if (region != null)
            {
                open = region;
                customCode.linesByRegion.putIfAbsent(region, new ArrayList<>());
            }
            else if (line.contains(BEGIN_PREFIX) && line.contains(BEGIN_SUFFIX))
            {
                log(CUSTOM_CODE, "Ignoring unknown custom code region: %s", line.trim());
            }
        }

        if (open != null)
        {
            log(CUSTOM_CODE, "Custom code region %s has no end marker", open.label());
        }

        return customCode;
    }

    /**
     * @param region the region.
     * @return the captured lines, empty if the region wasn't present.
     */
    public List<String> lines(final CustomRegion region)
    {
        final List<String> lines = linesByRegion.get(region);
        return lines == null ? Collections.emptyList() : Collections.unmodifiableList(lines);
    }

    /**
     * Write a region's begin marker, its captured lines verbatim and the end marker.
     *
     * @param writer the file being generated.
     * @param region the region.
     */
    public void writeRegion(final CodeWriter writer, final CustomRegion region)
    {
        writer.code(region.beginMarker());
        for (final String line : lines(region))
        {
            writer.write(line);
        }
        writer.code(CustomRegion.END_MARKER);
    }
}
