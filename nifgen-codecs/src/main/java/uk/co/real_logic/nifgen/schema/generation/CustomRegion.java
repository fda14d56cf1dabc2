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
 * A region of a partially generated file that holds hand written code. The code between a region's begin
 * marker and the shared {@link #END_MARKER} survives regeneration.
 */
public enum CustomRegion
{
    MISC("MISC"),
    FILE_HEAD("FILE HEAD"),
    FILE_FOOT("FILE FOOT"),
    PRE_READ("PRE-READ"),
    POST_READ("POST-READ"),
    PRE_WRITE("PRE-WRITE"),
    POST_WRITE("POST-WRITE"),
    PRE_STRING("PRE-STRING"),
    POST_STRING("POST-STRING"),
    PRE_FIXLINKS("PRE-FIXLINKS"),
    POST_FIXLINKS("POST-FIXLINKS"),
    CONSTRUCTOR("CONSTRUCTOR"),
    DESTRUCTOR("DESTRUCTOR"),
    INCLUDE("INCLUDE");

    public static final String END_MARKER = "//--END CUSTOM CODE--//";

    private final String label;
    private final String beginMarker;

    CustomRegion(final String label)
    {
        this.label = label;
        this.beginMarker = "//--BEGIN " + label + " CUSTOM CODE--//";
    }

    public String label()
    {
        return label;
    }

    public String beginMarker()
    {
        return beginMarker;
    }

    /**
     * @param line a line of a previously generated file.
     * @return the region whose begin marker the line contains, or null.
     */
    public static CustomRegion beginningAt(final String line)
    {
        for (final CustomRegion region : values())
        {
            if (line.contains(region.beginMarker))
            {
                return region;
            }
        }

        return null;
    }
}
