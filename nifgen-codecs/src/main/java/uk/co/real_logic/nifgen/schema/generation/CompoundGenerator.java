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
import uk.co.real_logic.nifgen.schema.ir.CompoundType;
import uk.co.real_logic.nifgen.schema.ir.Field;

import java.util.Collection;

import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.*;

/**
 * Generates a struct per compound that the runtime doesn't implement natively: the header
 * <code>include/gen/Name.h</code> and, unless the compound is a template, the source <code>src/gen/Name.cpp</code>.
 * Root compounds such as the file header and footer also get Read, Write and asString functions.
 */
final class CompoundGenerator extends Generator
{
    static final String HEADER = "Header";

    private final Collection<String> rootCompounds;

    CompoundGenerator(
        final SchemaContext context,
        final StreamEmitter emitter,
        final OutputManager outputManager,
        final CustomCodeSource customCodeSource,
        final Collection<String> typeFilter,
        final Collection<String> rootCompounds)
    {
        super(context, emitter, outputManager, customCodeSource, typeFilter);
        this.rootCompounds = rootCompounds;
    }

    void generate()
    {
        for (final CompoundType compound : context.compounds())
        {
            if (compound.isNative() || !isSelected(compound))
            {
                continue;
            }

            generateHeader(compound);
            if (!compound.isTemplate())
            {
                generateSource(compound);
            }
        }
    }

    static String headerName(final String className)
    {
        return INCLUDE_DIR + GEN_DIR + className + ".h";
    }

    static String sourceName(final String className)
    {
        return SOURCE_DIR + GEN_DIR + className + ".cpp";
    }

    private void generateHeader(final CompoundType compound)
    {
        final String className = declarations.className(compound);
        final String fileName = headerName(className);
        final CustomCode customCode = customCodeSource.customCode(fileName);
        final boolean isRoot = rootCompounds.contains(compound.name());

        final CodeWriter out = new CodeWriter();
        out.code(FULLY_GENERATED_NOTICE);
        out.guard(className.toUpperCase());
        out.code();
        out.include(quoted("../NIF_IO.h"));
        if (isRoot)
        {
            out.include(quoted("../obj/NiObject.h"));
        }
        out.code(declarations.includeHeader(compound));
        out.namespace(NAMESPACE);
        out.code(declarations.forwardDeclarations(compound));
        out.code();

        out.comment(compound.description());
        out.code((compound.isTemplate() ? "template <class T >\n" : "") + "struct " + className + " {");
        if (!compound.isTemplate())
        {
            out.code(String.format(COMPOUND_DECLARATION, className));
        }

        declareFields(out, compound, false);

        if (isRoot)
        {
            if (HEADER.equals(compound.name()))
            {
                out.code("NIFLIB_HIDDEN NifInfo Read( istream& in );");
                out.code("NIFLIB_HIDDEN void Write( ostream& out, const NifInfo & info = NifInfo() ) const;");
            }
            else
            {
                out.code("NIFLIB_HIDDEN void Read( istream& in, list<unsigned int> & link_stack, " +
                    "const NifInfo & info );");
                out.code("NIFLIB_HIDDEN void Write( ostream& out, const map<NiObjectRef,unsigned int> & link_map, " +
                    "list<NiObject *> & missing_link_stack, const NifInfo & info ) const;");
            }
            out.code("NIFLIB_HIDDEN string asString( bool verbose = false ) const;");
        }

        customCode.writeRegion(out, CustomRegion.MISC);

        out.code("};");
        out.code();
        out.end();

        write(fileName, out);
    }

    private void generateSource(final CompoundType compound)
    {
        final String className = declarations.className(compound);
        final String fileName = sourceName(className);
        final CustomCode customCode = customCodeSource.customCode(fileName);

        final CodeWriter out = new CodeWriter();
        out.code(PARTIALLY_GENERATED_NOTICE);
        out.code();
        out.code(declarations.includeSource(compound));
        out.code("using namespace Niflib;");
        out.code();

        out.code("//Constructor");
        out.code(className + "::" + className + "()" + declarations.construct(compound) + " {};");
        out.code();

        out.code("//Copy Constructor");
        out.code(className + "::" + className + "( const " + className + " & src ) {");
        out.code("*this = src;");
        out.code("};");
        out.code();

        out.code("//Copy Operator");
        out.code(className + " & " + className + "::operator=( const " + className + " & src ) {");
        for (final Field field : compound.fields())
        {
            if (!field.isDuplicate())
            {
                final String member = memberName(field);
                out.code("this->" + member + " = src." + member + ";");
            }
        }
        out.code("return *this;");
        out.code("};");
        out.code();

        out.code("//Destructor");
        out.code(className + "::~" + className + "() {};");

        if (rootCompounds.contains(compound.name()))
        {
            if (HEADER.equals(compound.name()))
            {
                generateHeaderFunctions(compound, className, out);
            }
            else
            {
                generateRootFunctions(compound, className, out);
            }
        }

        out.code();
        customCode.writeRegion(out, CustomRegion.MISC);
        out.end();

        write(fileName, out);
    }

    /**
     * The file header is read before any version information is known so its Read function returns the
     * version information it reads.
     */
    private void generateHeaderFunctions(final CompoundType compound, final String className, final CodeWriter out)
    {
        out.code("NifInfo " + className + "::Read( istream& in ) {");
        out.code("//Declare NifInfo structure");
        out.code("NifInfo info;");
        out.code();
        emitter.emit(compound, Action.READ, out);
        out.code();
        out.code("//Copy info.version to local version var.");
        out.code("version = info.version;");
        out.code();
        out.code("//Fill out and return NifInfo structure.");
        out.code("info.userVersion = userVersion;");
        out.code("info.userVersion2 = userVersion2;");
        out.code("info.endian = EndianType(endianType);");
        out.code("info.creator = exportInfo.creator.str;");
        out.code("info.exportInfo1 = exportInfo.exportInfo1.str;");
        out.code("info.exportInfo2 = exportInfo.exportInfo2.str;");
        out.code();
        out.code("return info;");
        out.code();
        out.code("}");
        out.code();
        out.code("void " + className + "::Write( ostream& out, const NifInfo & info ) const {");
        emitter.emit(compound, Action.WRITE, out);
        out.code("}");
        out.code();
        out.code("string " + className + "::asString( bool verbose ) const {");
        emitter.emit(compound, Action.DESCRIBE, out);
        out.code("}");
    }

    private void generateRootFunctions(final CompoundType compound, final String className, final CodeWriter out)
    {
        out.code();
        out.code(String.format(READ_SIGNATURE, className));
        emitter.emit(compound, Action.READ, out);
        out.code("}");
        out.code();
        out.code(String.format(WRITE_SIGNATURE, className));
        emitter.emit(compound, Action.WRITE, out);
        out.code("}");
        out.code();
        out.code("string " + className + "::asString( bool verbose ) const {");
        emitter.emit(compound, Action.DESCRIBE, out);
        out.code("}");
    }
}
