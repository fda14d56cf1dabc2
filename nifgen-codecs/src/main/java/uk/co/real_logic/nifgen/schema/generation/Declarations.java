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

import uk.co.real_logic.nifgen.schema.SchemaContext;
import uk.co.real_logic.nifgen.schema.expression.Expression;
import uk.co.real_logic.nifgen.schema.expression.Literal;
import uk.co.real_logic.nifgen.schema.ir.BasicType;
import uk.co.real_logic.nifgen.schema.ir.BlockType;
import uk.co.real_logic.nifgen.schema.ir.CompoundType;
import uk.co.real_logic.nifgen.schema.ir.Field;
import uk.co.real_logic.nifgen.schema.ir.TypeEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.memberName;

/**
 * The C++ declarations of types and their fields: member variables, constructor initializer lists, include
 * directives, forward declarations and the optional example accessors.
 */
final class Declarations
{
    private static final String ROOT_BLOCK_INCLUDES =
        "#include \"../RefObject.h\"\n" +
        "#include \"../Type.h\"\n" +
        "#include \"../Ref.h\"\n" +
        "#include \"../nif_basic_types.h\"\n" +
        "#include <iostream>\n" +
        "#include <fstream>\n" +
        "#include <iomanip>\n" +
        "#include <sstream>\n" +
        "#include <string>\n" +
        "#include <list>\n" +
        "#include <map>\n" +
        "#include <vector>";

    private final SchemaContext context;

    Declarations(final SchemaContext context)
    {
        this.context = context;
    }

    String className(final TypeEntity type)
    {
        return context.className(type.name());
    }

    String typeName(final Field field)
    {
        return context.className(field.typeName());
    }

    /**
     * @return the value type of a field, with its template parameter if any, before any array dimensions.
     */
    String valueType(final Field field)
    {
        final String type = typeName(field);
        final String template = context.className(field.templateName());
        if (template == null)
        {
            return type;
        }

        return "*".equals(type) ? template + " *" : type + "<" + template + " >";
    }

    /**
     * Member variable declaration. Sizes of later arrays and calculated values are mutable as they're updated
     * by const member functions before writing.
     */
    String declare(final Field field)
    {
        String keyword = "";
        if (!field.isDuplicate())
        {
            if (!field.arr1References().isEmpty())
            {
                if (!field.isArray())
                {
                    keyword = "mutable ";
                }
            }
            else if (!field.arr2References().isEmpty() || field.isCalculated())
            {
                keyword = "mutable ";
            }
        }

        final String result;
        final String type = valueType(field);
        final String arr1 = staticSize(field.arr1());
        final String arr2 = staticSize(field.arr2());
        if (!field.isArray())
        {
            result = type;
        }
        else if (arr1 != null)
        {
            result = arr2 != null ?
                "array< " + arr1 + ", array<" + arr2 + "," + type + " > >" :
                "array<" + arr1 + "," + type + " >";
        }
        else if (arr2 != null)
        {
            result = "vector< array<" + arr2 + "," + type + " > >";
        }
        else if (!field.arr2().isEmpty())
        {
            result = "vector< vector<" + type + " > >";
        }
        else
        {
            result = "vector<" + type + " >";
        }

        return keyword + result + " " + memberName(field) + ";";
    }

    /**
     * @return the constructor initializer list, eg: <code> : numVertices((unsigned short)0)</code>, or empty.
     */
    String construct(final CompoundType type)
    {
        final List<String> initializers = new ArrayList<>();
        for (final Field field : type.fields())
        {
            if (field.defaultValue() != null && !field.isDuplicate())
            {
                initializers.add(memberName(field) + "(" + field.defaultValue() + ")");
            }
        }

        return initializers.isEmpty() ? "" : " : " + String.join(", ", initializers);
    }

    /**
     * Include directives for a header: the parent class or runtime headers for blocks, then the headers of the
     * compounds used by value.
     */
    String includeHeader(final CompoundType type)
    {
        if (type.isNative())
        {
            return "";
        }

        final boolean isBlock = type instanceof BlockType;
        final String genPrefix = isBlock ? "../gen/" : "";
        final String rootPrefix = "../";

        final StringBuilder result = new StringBuilder();
        if (isBlock)
        {
            final BlockType parent = ((BlockType)type).parent();
            result.append(parent != null ? "#include \"" + className(parent) + ".h\"\n" : ROOT_BLOCK_INCLUDES);
        }

        final Set<String> structures = new LinkedHashSet<>();
        for (final Field field : type.fields())
        {
            final TypeEntity fieldType = field.type();
            if (fieldType == type)
            {
                continue;
            }

            if (fieldType instanceof CompoundType && !fieldType.isNative())
            {
                structures.add(genPrefix + className(fieldType) + ".h");
            }
            else if (fieldType instanceof BasicType && "Ref".equals(fieldType.nativeName()))
            {
                structures.add(rootPrefix + "Ref.h");
            }
        }

        if (!structures.isEmpty())
        {
            result.append("\n// Include structures\n");
            for (final String file : structures)
            {
                result.append("#include \"").append(file).append("\"\n");
            }
        }

        return result.toString();
    }

    /**
     * @return forward declarations of the blocks used as template parameters, or empty.
     */
    String forwardDeclarations(final CompoundType type)
    {
        if (type.isNative())
        {
            return "";
        }

        final Set<String> blocks = new LinkedHashSet<>();
        for (final Field field : type.fields())
        {
            final TypeEntity template = field.template();
            if (template instanceof BlockType && template != type)
            {
                blocks.add(className(template));
            }
        }

        if (blocks.isEmpty())
        {
            return "";
        }

        final StringBuilder result = new StringBuilder("\n// Forward define of referenced NIF objects\n");
        for (final String block : blocks)
        {
            result.append("class ").append(block).append(";\n");
        }
        return result.toString();
    }

    /**
     * Include directives for a source file: the type's own header followed, in sorted order, by the headers of
     * referenced blocks, of blocks tested by conditions and those needed by the compounds used by value.
     */
    String includeSource(final CompoundType type)
    {
        if (type.isNative())
        {
            return "";
        }

        final StringBuilder result = new StringBuilder();
        result.append(ownInclude(type));
        final Set<String> includes = new TreeSet<>();
        collectSourceIncludes(type, includes, Collections.newSetFromMap(new IdentityHashMap<>()));
        for (final String include : includes)
        {
            result.append(include);
        }
        return result.toString();
    }

    private String ownInclude(final CompoundType type)
    {
        final String prefix = type instanceof BlockType ?
            GenerationUtil.SOURCE_OBJ_INCLUDE_PREFIX : GenerationUtil.SOURCE_GEN_INCLUDE_PREFIX;
        return "#include \"" + prefix + className(type) + ".h\"\n";
    }

    private void collectSourceIncludes(
        final CompoundType type, final Set<String> includes, final Set<CompoundType> visited)
    {
        if (!visited.add(type))
        {
            return;
        }

        for (final Field field : type.fields())
        {
            final TypeEntity template = field.template();
            if (template instanceof BlockType && template != type)
            {
                includes.add(objInclude(className(template)));
            }

            final TypeEntity fieldType = field.type();
            if (fieldType instanceof CompoundType && !fieldType.isNative())
            {
                includes.add(ownInclude((CompoundType)fieldType));
                collectSourceIncludes((CompoundType)fieldType, includes, visited);
            }

            for (final String blockName : field.cond().typeChecks())
            {
                includes.add(objInclude(context.className(blockName)));
            }
        }
    }

    private static String objInclude(final String className)
    {
        return "#include \"" + GenerationUtil.SOURCE_OBJ_INCLUDE_PREFIX + className + ".h\"\n";
    }

    /**
     * Fields eligible for example accessors: not the size of another array and not of unknown purpose.
     */
    List<Field> accessorFields(final CompoundType type)
    {
        final List<Field> fields = new ArrayList<>();
        for (final Field field : type.fields())
        {
            if (field.arr1References().isEmpty() && field.arr2References().isEmpty() &&
                !memberName(field).toLowerCase().contains("unk"))
            {
                fields.add(field);
            }
        }
        return fields;
    }

    String getter(final Field field, final String scope, final String suffix)
    {
        String type = valueType(field);
        final String arr1 = staticSize(field.arr1());
        final String arr2 = staticSize(field.arr2());
        if (field.isArray())
        {
            if (arr1 != null)
            {
                type = "array<" + arr1 + "," + type + " > ";
            }
            else
            {
                type = arr2 != null ? "vector< array<" + arr2 + "," + type + " > >" : "vector<" + type + " >";
            }

            if (!field.arr2().isEmpty())
            {
                if (arr2 == null)
                {
                    type = "vector<" + type + " >";
                }
                else if (arr1 != null)
                {
                    type = "array<" + arr2 + "," + type + " >";
                }
            }
        }

        return type + " " + scope + "Get" + capitalized(memberName(field)) + "() const" + suffix;
    }

    String setter(final Field field, final String scope, final String suffix)
    {
        String type = valueType(field);
        final String arr1 = staticSize(field.arr1());
        final String arr2 = staticSize(field.arr2());
        if (field.isArray())
        {
            if (arr1 != null)
            {
                type = arr2 != null ?
                    "const array< " + arr1 + ", array<" + arr2 + "," + type + " > >&" :
                    "const array<" + arr1 + "," + type + " >& ";
            }
            else
            {
                type = arr2 != null ?
                    "const vector< array<" + arr2 + "," + type + " > >&" :
                    "const vector<" + type + " >&";
            }
        }
        else if (!(field.type() instanceof BasicType))
        {
            type = "const " + type + " &";
        }

        return "void " + scope + "Set" + capitalized(memberName(field)) + "( " + type + " value )" + suffix;
    }

    private static String capitalized(final String name)
    {
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * @return the literal size of an array dimension, or null if the size is only known at runtime.
     */
    static String staticSize(final Expression dimension)
    {
        return dimension.hasStaticSize() ? ((Literal)dimension.left()).toString() : null;
    }
}
