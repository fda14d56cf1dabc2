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

import org.agrona.generation.OutputManager;
import uk.co.real_logic.nifgen.schema.SchemaContext;
import uk.co.real_logic.nifgen.schema.ir.EnumType;
import uk.co.real_logic.nifgen.schema.ir.Option;

import java.util.Collections;

import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.*;

/**
 * Generates the enumerations and bit flags: the public declarations in <code>include/gen/enums.h</code>, the
 * stream functions in <code>include/gen/enums_intl.h</code> and their implementation in
 * <code>src/gen/enums.cpp</code>. Types without options are left out.
 */
final class EnumGenerator extends Generator
{
    static final String ENUMS_HEADER = INCLUDE_DIR + GEN_DIR + "enums.h";
    static final String ENUMS_INTERNAL_HEADER = INCLUDE_DIR + GEN_DIR + "enums_intl.h";
    static final String ENUMS_SOURCE = SOURCE_DIR + GEN_DIR + "enums.cpp";

    private static final String ENUM_IMPLEMENTATION =
        "//--%1$s--//\n" +
        "\n" +
        "void NifStream( %1$s & val, istream& in, const NifInfo & info ) {\n" +
        "\t%2$s temp;\n" +
        "\tNifStream( temp, in, info );\n" +
        "\tval = %1$s(temp);\n" +
        "}\n" +
        "\n" +
        "void NifStream( %1$s const & val, ostream& out, const NifInfo & info ) {\n" +
        "\tNifStream( (%2$s)(val), out, info );\n" +
        "}\n" +
        "\n" +
        "ostream & operator<<( ostream & out, %1$s const & val ) {\n" +
        "\tswitch ( val ) {\n" +
        "\t\t%3$sdefault: return out << \"Invalid Value! - \" << (%2$s)(val);\n" +
        "\t}\n" +
        "}";

    private static final String ENUM_CASE = "case %1$s: return out << \"%2$s\";\n\t\t";

    EnumGenerator(
        final SchemaContext context,
        final StreamEmitter emitter,
        final OutputManager outputManager,
        final CustomCodeSource customCodeSource)
    {
        super(context, emitter, outputManager, customCodeSource, Collections.emptySet());
    }

    void generate()
    {
        generateDeclarations();
        generateStreamDeclarations();
        generateImplementation();
    }

    private void generateDeclarations()
    {
        final CodeWriter out = new CodeWriter();
        out.code(FULLY_GENERATED_NOTICE);
        out.guard("NIF_ENUMS");
        out.code();
        out.include("<iostream>");
        out.code("using namespace std;");
        out.code();
        out.namespace(NAMESPACE);
        out.code();

        for (final EnumType enumType : context.enums())
        {
            if (enumType.options().isEmpty())
            {
                continue;
            }

            final String className = declarations.className(enumType);
            if (!enumType.description().isEmpty())
            {
                out.comment(enumType.description());
            }
            out.code("enum " + className + " {");
            for (final Option option : enumType.options())
            {
                out.code(option.constantName() + " = " + option.value() + ", /*!< " + option.description() + " */");
            }
            out.code("};");
            out.code();
            out.code("ostream & operator<<( ostream & out, " + className + " const & val );");
            out.code();
        }

        out.end();
        write(ENUMS_HEADER, out);
    }

    private void generateStreamDeclarations()
    {
        final CodeWriter out = new CodeWriter();
        out.code(FULLY_GENERATED_NOTICE);
        out.guard("NIF_ENUMS_INTL");
        out.code();
        out.include("<iostream>");
        out.code("using namespace std;");
        out.code();
        out.include(quoted("../nif_basic_types.h"));
        out.code();
        out.namespace(NAMESPACE);
        out.code();

        for (final EnumType enumType : context.enums())
        {
            if (enumType.options().isEmpty())
            {
                continue;
            }

            final String className = declarations.className(enumType);
            if (!enumType.description().isEmpty())
            {
                out.code();
                out.code("//---" + className + "---//");
                out.code();
            }
            out.code("void NifStream( " + className + " & val, istream& in, const NifInfo & info = NifInfo() );");
            out.code("void NifStream( " + className + " const & val, ostream& out, " +
                "const NifInfo & info = NifInfo() );");
            out.code();
        }

        out.end();
        write(ENUMS_INTERNAL_HEADER, out);
    }

    private void generateImplementation()
    {
        final CodeWriter out = new CodeWriter();
        out.code(FULLY_GENERATED_NOTICE);
        out.code();
        out.include("<string>");
        out.include("<iostream>");
        out.include(quoted("../../include/NIF_IO.h"));
        out.include(quoted("../../include/gen/enums.h"));
        out.include(quoted("../../include/gen/enums_intl.h"));
        out.code();
        out.code("using namespace std;");
        out.code();
        out.namespace(NAMESPACE);
        out.code();
        out.code();

        for (final EnumType enumType : context.enums())
        {
            if (enumType.options().isEmpty())
            {
                continue;
            }

            final StringBuilder cases = new StringBuilder();
            for (final Option option : enumType.options())
            {
                cases.append(String.format(ENUM_CASE, option.constantName(), option.name()));
            }

            out.code(String.format(
                ENUM_IMPLEMENTATION,
                declarations.className(enumType),
                declarations.className(enumType.storage()),
                cases));
            out.code();
        }

        out.end();
        write(ENUMS_SOURCE, out);
    }
}
