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
import uk.co.real_logic.nifgen.schema.expression.ExpressionSyntaxException;
import uk.co.real_logic.nifgen.schema.ir.*;

import java.io.ByteArrayInputStream;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;
import static uk.co.real_logic.nifgen.schema.ExampleSchema.exampleSchema;
import static uk.co.real_logic.nifgen.schema.ExampleSchema.parse;

public class SchemaParserTest
{
    private static SchemaContext context;

    @BeforeClass
    public static void setUp() throws Exception
    {
        context = exampleSchema();
    }

    @Test
    public void shouldParseVersions()
    {
        final List<Version> versions = context.versions();

        assertEquals(3, versions.size());
        assertEquals("4.0.0.2", versions.get(0).number());
        assertEquals("Morrowind", versions.get(0).description());
        assertEquals(0x14000005L, versions.get(2).packed());
    }

    @Test
    public void shouldParseBasicsWithNativeNames()
    {
        final BasicType uint = (BasicType)context.type("uint");

        assertEquals("unsigned int", uint.nativeName());
        assertEquals(ValueFamily.INTEGER, uint.family());
        assertTrue(context.type("Ref").isLink());
        assertTrue(context.type("Ptr").isCrossRef());
        assertTrue(context.type("Ref").isTemplate());
    }

    @Test
    public void shouldAddTemplateParameterType()
    {
        final TypeEntity template = context.type(BasicType.TEMPLATE);

        assertThat(template, instanceOf(BasicType.class));
        assertEquals("T", template.nativeName());
    }

    @Test
    public void shouldParseEnumsBeforeFlagsInDocumentOrder()
    {
        assertThat(names(context.enums()), contains("AlphaFormat", "Unused Enum", "DataFlags"));
        assertThat(context.type("DataFlags"), instanceOf(FlagType.class));
        assertSame(context.type("uint"), ((EnumType)context.type("AlphaFormat")).storage());
    }

    @Test
    public void shouldParseEnumOptions()
    {
        final List<Option> options = ((EnumType)context.type("AlphaFormat")).options();

        assertEquals(3, options.size());
        assertEquals("ALPHA_BINARY", options.get(1).name());
        assertEquals(1L, options.get(1).value());
        assertEquals("Each texel is opaque or transparent.", options.get(1).description());
        assertEquals("ALPHA_SMOOTH", options.get(2).description());
        assertTrue(((EnumType)context.type("Unused Enum")).options().isEmpty());
    }

    @Test
    public void shouldPrefixFlagOptionsAndShiftTheirBits()
    {
        final List<Option> options = ((EnumType)context.type("DataFlags")).options();

        assertEquals("DF_Has UV", options.get(0).name());
        assertEquals("DF_HAS_UV", options.get(0).constantName());
        assertEquals(1L, options.get(0).value());
        assertEquals(12, options.get(1).bit());
        assertEquals(4096L, options.get(1).value());
    }

    @Test
    public void shouldParseCompoundsAndBlocksInDocumentOrder()
    {
        assertThat(names(context.compounds()),
            contains("Header", "Footer", "SkinWeight", "SkinData", "BoundingVolume", "Union BV"));
        assertThat(names(context.blocks()),
            contains("NiObject", "NiExtraData", "NiAVObject", "NiTriData", "NiGeometryData"));
    }

    @Test
    public void shouldParseBlockInheritance()
    {
        final BlockType avObject = context.block("NiAVObject");

        assertSame(context.block("NiObject"), avObject.parent());
        assertTrue(avObject.isAbstract());
        assertFalse(context.block("NiTriData").isAbstract());
        assertNull(context.block("NiObject").parent());
        assertThat(names(context.block("NiExtraData").ancestors()), contains("NiObject"));
    }

    @Test
    public void shouldRecordInterfaceMarker()
    {
        final SchemaContext declared = parse(
            "<niobject name=\"NiObject\" abstract=\"1\" />\n" +
            "<niobject name=\"NiProperty\" inherit=\"NiObject\"><interface /></niobject>\n");

        assertTrue(declared.block("NiProperty").hasInterface());
        assertFalse(declared.block("NiObject").hasInterface());
    }

    @Test
    public void shouldParseFields()
    {
        final CompoundType header = context.structure("Header");
        final Field version = header.field("Version");

        assertEquals(4, header.fields().size());
        assertEquals("FileVersion", version.typeName());
        assertSame(context.type("FileVersion"), version.type());
        assertEquals(Long.valueOf(0x04000002L), version.ver1());
        assertNull(version.ver2());
        assertEquals("The version of the file.", version.description());
    }

    @Test
    public void shouldLinkTemplatesAndExpressions()
    {
        final BlockType avObject = context.block("NiAVObject");
        final Field children = avObject.field("Children");

        assertSame(avObject, children.template());
        assertEquals("Num Children", children.arr1().leftName());
        assertEquals("Has Bounding Volume", avObject.field("Bounding Volume").cond().leftName());
    }

    @Test
    public void shouldParseUserVersions()
    {
        final Field alpha = context.block("NiTriData").field("Alpha");

        assertEquals(Long.valueOf(0x14000005L), alpha.ver1());
        assertEquals(Long.valueOf(11L), alpha.userVersion());
        assertNull(alpha.userVersion2());
    }

    @Test
    public void shouldDescribeUnknownFields()
    {
        assertEquals("Unknown.", context.block("NiTriData").field("Unknown Int").description());
    }

    @Test
    public void shouldExcludeFields() throws Exception
    {
        final SchemaContext excluded = exampleSchema("BoundingVolume:Union");

        assertEquals(1, excluded.structure("BoundingVolume").fields().size());
        assertEquals(2, context.structure("BoundingVolume").fields().size());
    }

    @Test
    public void shouldMapClassNames()
    {
        assertEquals("unsigned int", context.className("uint"));
        assertEquals("Ref", context.className("Ref"));
        assertEquals("Union_BV", context.className("Union BV"));
        assertEquals("AlphaFormat", context.className("AlphaFormat"));
        assertEquals("NiTriData", context.className("NiTriData"));
        assertNull(context.className(null));
    }

    @Test
    public void shouldMarkManuallyUpdatedFields() throws Exception
    {
        final SchemaContext patched = exampleSchema();

        patched.markManualUpdate("NiTriData", "Num Vertices");

        assertTrue(patched.block("NiTriData").field("Num Vertices").isManualUpdate());
        assertFalse(patched.block("NiTriData").field("Num Strips").isManualUpdate());
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectManualUpdateOfUnknownField()
    {
        context.markManualUpdate("NiTriData", "Num Faces");
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectManualUpdateOfUnknownType()
    {
        context.markManualUpdate("NiMissing", "Num Vertices");
    }

    @Test
    public void shouldRejectDuplicateTypeNames()
    {
        try
        {
            parse("<compound name=\"uint\"><add name=\"Value\" type=\"byte\" /></compound>");
            fail("Expected duplicate type name to be rejected");
        }
        catch (final SchemaLoadException ex)
        {
            assertThat(ex.getMessage(), containsString("Cannot define the same type name twice"));
        }
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectEnumStorageThatIsNotBasic()
    {
        parse(
            "<compound name=\"Pair\"><add name=\"A\" type=\"uint\" /></compound>\n" +
            "<enum name=\"Broken\" storage=\"Pair\"><option value=\"0\" name=\"NONE\" /></enum>\n");
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectInheritanceFromUndeclaredBlock()
    {
        parse(
            "<niobject name=\"NiChild\" inherit=\"NiParent\" />\n" +
            "<niobject name=\"NiParent\" />\n");
    }

    @Test
    public void shouldRejectUnknownFieldType()
    {
        try
        {
            parse("<compound name=\"Pair\"><add name=\"A\" type=\"quad\" /></compound>");
            fail("Expected unknown field type to be rejected");
        }
        catch (final SchemaLoadException ex)
        {
            assertThat(ex.getMessage(), allOf(containsString("quad"), containsString("Pair.A")));
        }
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectUnknownTemplate()
    {
        parse("<compound name=\"Pair\"><add name=\"A\" type=\"Ref\" template=\"NiMissing\" /></compound>");
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectBlockAsFieldType()
    {
        parse(
            "<niobject name=\"NiObject\" />\n" +
            "<compound name=\"Pair\"><add name=\"A\" type=\"NiObject\" /></compound>\n");
    }

    @Test
    public void shouldNameFieldOfInvalidExpression()
    {
        try
        {
            parse("<compound name=\"Pair\"><add name=\"A\" type=\"uint\" cond=\"(B == 1\" /></compound>");
            fail("Expected invalid expression to be rejected");
        }
        catch (final SchemaLoadException ex)
        {
            assertThat(ex.getMessage(), containsString("Pair.A"));
        }
    }

    @Test
    public void shouldNameFieldWithOutOfRangeLiteral()
    {
        try
        {
            parse("<compound name=\"Big\"><add name=\"Data\" type=\"byte\" arr1=\"99999999999999999999\" /></compound>");
            fail("expected a load failure");
        }
        catch (final SchemaLoadException ex)
        {
            assertThat(ex.getMessage(), containsString("Big.Data"));
            assertThat(ex.getCause(), instanceOf(ExpressionSyntaxException.class));
        }
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectWrongRootElement()
    {
        new SchemaParser().parse(new ByteArrayInputStream("<fix major=\"4\" />".getBytes(UTF_8)));
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectMalformedDocument()
    {
        new SchemaParser().parse(new ByteArrayInputStream("<niftoolsxml>".getBytes(UTF_8)));
    }

    @Test(expected = SchemaLoadException.class)
    public void shouldRejectMissingDocument()
    {
        new SchemaParser().parse(Paths.get("does-not-exist", "nif.xml"));
    }

    private static List<String> names(final List<? extends TypeEntity> types)
    {
        return types.stream().map(TypeEntity::name).collect(Collectors.toList());
    }
}
