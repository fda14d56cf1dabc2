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

import uk.co.real_logic.nifgen.schema.ir.ValueFamily;

import java.util.HashMap;
import java.util.Map;

import static uk.co.real_logic.nifgen.schema.ir.ValueFamily.*;

/**
 * Schema types that the runtime library implements by hand, with the runtime's class name for each.
 */
public final class NativeTypes
{
    private static final Map<String, String> NATIVE_NAMES = new HashMap<>();
    private static final Map<String, ValueFamily> FAMILIES = new HashMap<>();

    static
    {
        add("bool", "bool", BOOLEAN);
        add("byte", "byte", INTEGER);
        add("uint", "unsigned int", INTEGER);
        add("ulittle32", "unsigned int", INTEGER);
        add("ushort", "unsigned short", INTEGER);
        add("int", "int", INTEGER);
        add("short", "short", INTEGER);
        add("BlockTypeIndex", "unsigned short", INTEGER);
        add("char", "byte", INTEGER);
        add("FileVersion", "unsigned int", INTEGER);
        add("Flags", "unsigned short", INTEGER);
        add("float", "float", FLOAT);
        add("hfloat", "hfloat", FLOAT);
        add("HeaderString", "HeaderString", STRING);
        add("LineString", "LineString", STRING);
        add("Ptr", "*", CROSS_REF);
        add("Ref", "Ref", LINK);
        add("StringOffset", "unsigned int", STRING_OFFSET);
        add("StringIndex", "IndexString", STRING);
        add("SizedString", "string", STRING);
        add("string", "IndexString", STRING);
        add("FilePath", "IndexString", STRING);
        add("Color3", "Color3", OTHER);
        add("Color4", "Color4", OTHER);
        add("ByteColor4", "ByteColor4", OTHER);
        add("Vector3", "Vector3", OTHER);
        add("Vector4", "Vector4", OTHER);
        add("Quaternion", "Quaternion", OTHER);
        add("Matrix22", "Matrix22", OTHER);
        add("Matrix33", "Matrix33", OTHER);
        add("Matrix34", "Matrix34", OTHER);
        add("Matrix44", "Matrix44", OTHER);
        add("hkMatrix3", "InertiaMatrix", OTHER);
        add("ShortString", "ShortString", STRING);
        add("Key", "Key", OTHER);
        add("QuatKey", "Key", OTHER);
        add("TexCoord", "TexCoord", OTHER);
        add("Triangle", "Triangle", OTHER);
        add("BSVertexData", "BSVertexData", OTHER);
        add("BSVertexDataSSE", "BSVertexData", OTHER);
        add("TEMPLATE", "T", OTHER);

        FAMILIES.put("Char8String", STRING);
    }

    private NativeTypes()
    {
    }

    private static void add(final String schemaName, final String nativeName, final ValueFamily family)
    {
        NATIVE_NAMES.put(schemaName, nativeName);
        FAMILIES.put(schemaName, family);
    }

    /**
     * @param schemaName the type name used by the schema.
     * @return the runtime class name or null if the type isn't natively implemented.
     */
    public static String nativeName(final String schemaName)
    {
        return NATIVE_NAMES.get(schemaName);
    }

    /**
     * @param schemaName the name of a basic type.
     * @return the value family, {@link ValueFamily#OTHER} for types the table doesn't know.
     */
    public static ValueFamily family(final String schemaName)
    {
        return FAMILIES.getOrDefault(schemaName, OTHER);
    }
}
