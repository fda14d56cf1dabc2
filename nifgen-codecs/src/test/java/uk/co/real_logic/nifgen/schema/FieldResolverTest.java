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

import org.junit.BeforeClass;
import org.junit.Test;
import uk.co.real_logic.nifgen.schema.ir.BlockType;
import uk.co.real_logic.nifgen.schema.ir.CompoundType;
import uk.co.real_logic.nifgen.schema.ir.Field;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.*;
import static uk.co.real_logic.nifgen.schema.ExampleSchema.exampleSchema;
import static uk.co.real_logic.nifgen.schema.ExampleSchema.parse;

public class FieldResolverTest
{
    private static SchemaContext context;

    @BeforeClass
    public static void setUp() throws Exception
    {
        context = exampleSchema();
    }

    @Test
    public void shouldMarkLaterFieldsWithSameNameAsDuplicates()
    {
        final List<Field> fields = context.block("NiGeometryData").fields();

        assertFalse(fields.get(0).isDuplicate());
        assertTrue(fields.get(1).isDuplicate());
        assertFalse(fields.get(2).isDuplicate());
    }

    @Test
    public void shouldNotTreatSuffixedFieldsAsDuplicates()
    {
        final SchemaContext context = parse(
            "<compound name=\"Pair\">\n" +
            "    <add name=\"Value\" type=\"uint\" />\n" +
            "    <add name=\"Value\" type=\"uint\" suffix=\"B\" />\n" +
            "    <add name=\"Value\" type=\"float\" />\n" +
            "</compound>\n");
        final List<Field> fields = context.structure("Pair").fields();

        assertFalse(fields.get(1).isDuplicate());
        assertEquals("Value_B", fields.get(1).uniqueName());
        assertTrue(fields.get(2).isDuplicate());
    }

    @Test
    public void shouldRecordFieldsSizedByEachField()
    {
        final BlockType triData = context.block("NiTriData");

        assertThat(triData.field("Num Vertices").arr1References(), contains("Normals", "Vertex Flags"));
        assertThat(triData.field("Num Strips").arr1References(), contains("Strip Lengths", "Strips"));
        assertThat(triData.field("Strip Lengths").arr2References(), contains("Strips"));
        assertThat(triData.field("Has Normals").condReferences(), contains("Normals"));
        assertThat(triData.field("Normals").arr1References(), empty());
    }

    @Test
    public void shouldIgnoreReferencesWithSymbolicRightSide()
    {
        final SchemaContext context = parse(
            "<compound name=\"Pair\">\n" +
            "    <add name=\"Count\" type=\"uint\" />\n" +
            "    <add name=\"Extra\" type=\"uint\" />\n" +
            "    <add name=\"Values\" type=\"float\" arr1=\"Count - Extra\" />\n" +
            "    <add name=\"Masked\" type=\"float\" arr1=\"Count &amp; 7\" />\n" +
            "</compound>\n");

        assertThat(context.structure("Pair").field("Count").arr1References(), contains("Masked"));
    }

    @Test
    public void shouldDetectDynamicSecondDimension()
    {
        final BlockType triData = context.block("NiTriData");

        assertTrue(triData.field("Strips").isArr2Dynamic());
        assertFalse(triData.field("Matrix").isArr2Dynamic());
        assertFalse(triData.field("Normals").isArr2Dynamic());
    }

    @Test
    public void shouldRecordArgumentUse()
    {
        final SchemaContext context = parse(
            "<compound name=\"KeyGroup\">\n" +
            "    <add name=\"Num Keys\" type=\"uint\" />\n" +
            "    <add name=\"Values\" type=\"float\" arr1=\"Num Keys\" cond=\"ARG == 2\" />\n" +
            "</compound>\n");
        final CompoundType keyGroup = context.structure("KeyGroup");

        assertTrue(keyGroup.usesArgument());
        assertTrue(keyGroup.field("Values").usesArgument());
        assertFalse(keyGroup.field("Num Keys").usesArgument());
    }

    @Test
    public void shouldSynthesizeDefaultsByValueFamily()
    {
        final BlockType avObject = context.block("NiAVObject");

        assertEquals("(unsigned int)0", avObject.field("Num Children").defaultValue());
        assertEquals("NULL", avObject.field("Parent").defaultValue());
        assertEquals("false", avObject.field("Has Bounding Volume").defaultValue());
        assertEquals("(DataFlags)0", context.block("NiTriData").field("Data Flags").defaultValue());
        assertNull(context.block("NiExtraData").field("Name").defaultValue());
        assertNull(avObject.field("Children").defaultValue());
        assertNull(avObject.field("Bounding Volume").defaultValue());
    }

    @Test
    public void shouldFormatDeclaredDefaults()
    {
        final BlockType avObject = context.block("NiAVObject");

        assertEquals("(unsigned short)8", avObject.field("Flags").defaultValue());
        assertEquals("1.0f", avObject.field("Scale").defaultValue());
        assertEquals("(unsigned int)0x04000002", context.structure("Header").field("Version").defaultValue());
    }

    @Test
    public void shouldSpreadDefaultOverStaticArray()
    {
        final SchemaContext context = parse(
            "<compound name=\"Triple\">\n" +
            "    <add name=\"Values\" type=\"float\" arr1=\"3\" default=\"1 2 3\" />\n" +
            "    <add name=\"Label\" type=\"string\" default=\"none\" />\n" +
            "    <add name=\"Offset\" type=\"float\" default=\"(0.50)\" />\n" +
            "</compound>\n");
        final CompoundType triple = context.structure("Triple");

        assertEquals("3,(float)1,(float)2,(float)3", triple.field("Values").defaultValue());
        assertEquals("\"none\"", triple.field("Label").defaultValue());
        assertEquals("0.5f", triple.field("Offset").defaultValue());
    }

    @Test
    public void shouldComputeTransitiveReferences()
    {
        assertTrue(context.block("NiAVObject").hasLinks());
        assertTrue(context.block("NiAVObject").hasCrossRefs());
        assertTrue(context.structure("Footer").hasLinks());
        assertFalse(context.structure("Footer").hasCrossRefs());
        assertFalse(context.block("NiTriData").hasReferences());
        assertFalse(context.structure("SkinData").hasReferences());
    }

    @Test
    public void shouldTerminateOnRecursiveCompounds()
    {
        assertFalse(context.structure("BoundingVolume").hasReferences());
        assertTrue(context.structure("Union BV").hasArrays());
    }

    @Test
    public void shouldFindReferencesThroughMutuallyContainedCompounds()
    {
        final SchemaContext context = parse(
            "<compound name=\"Outer\">\n" +
            "    <add name=\"Inner\" type=\"Inner\" />\n" +
            "    <add name=\"Target\" type=\"Ref\" />\n" +
            "</compound>\n" +
            "<compound name=\"Inner\">\n" +
            "    <add name=\"Outer\" type=\"Outer\" />\n" +
            "    <add name=\"Owner\" type=\"Ptr\" />\n" +
            "</compound>\n");

        assertTrue(context.structure("Outer").hasLinks());
        assertTrue(context.structure("Inner").hasLinks());
        assertTrue(context.structure("Outer").hasCrossRefs());
        assertTrue(context.structure("Inner").hasCrossRefs());
    }
}
