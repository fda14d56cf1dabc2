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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class NamesTest
{
    @Test
    public void shouldCamelCaseMemberNames()
    {
        assertEquals("numVertices", Names.memberName("Num Vertices"));
        assertEquals("unknownInt1", Names.memberName("Unknown Int 1"));
        assertEquals("hasUv", Names.memberName("Has UV"));
        assertEquals("numBv", Names.memberName("Num BV"));
    }

    @Test
    public void shouldReplacePunctuationInMemberNames()
    {
        assertEquals("bits_perPixel", Names.memberName("Bits/Per Pixel"));
        assertEquals("target.name", Names.memberName("Target\\Name"));
        assertEquals("count_1", Names.memberName("Count_1"));
    }

    @Test
    public void shouldKeepArgumentPlaceholder()
    {
        assertEquals("ARG", Names.memberName("ARG"));
        assertNull(Names.memberName(null));
    }

    @Test
    public void shouldReplaceSpacesAndColonsInClassNames()
    {
        assertEquals("Union_BV", Names.className("Union BV"));
        assertEquals("bhk_Shape", Names.className("bhk:Shape"));
        assertEquals("NiNode", Names.className("NiNode"));
    }
}
