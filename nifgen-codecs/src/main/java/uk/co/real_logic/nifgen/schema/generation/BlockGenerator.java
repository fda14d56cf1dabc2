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
import uk.co.real_logic.nifgen.schema.ir.BlockType;
import uk.co.real_logic.nifgen.schema.ir.Field;

import java.util.Collection;
import java.util.List;

import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.*;

/**
 * Generates a class per block: the header <code>include/obj/Name.h</code> and the source
 * <code>src/obj/Name.cpp</code>. Both are partially generated, hand written code in their custom code regions is
 * carried over from the previous files.
 */
final class BlockGenerator extends Generator
{
    private static final String NO_ACCESSORS =
        "//--This object has no eligible attributes.  No example implementation generated--//";
    private static final String BEGIN_ACCESSORS = "/***Begin Example Naive Implementation****";
    private static final String END_ACCESSORS = "****End Example Naive Implementation***/";

    private final boolean accessorsEnabled;

    BlockGenerator(
        final SchemaContext context,
        final StreamEmitter emitter,
        final OutputManager outputManager,
        final CustomCodeSource customCodeSource,
        final Collection<String> typeFilter,
        final boolean accessorsEnabled)
    {
        super(context, emitter, outputManager, customCodeSource, typeFilter);
        this.accessorsEnabled = accessorsEnabled;
    }

    void generate()
    {
        for (final BlockType block : context.blocks())
        {
            if (isSelected(block))
            {
                generateHeader(block);
                generateSource(block);
            }
        }
    }

    static String headerName(final String className)
    {
        return INCLUDE_DIR + OBJ_DIR + className + ".h";
    }

    static String sourceName(final String className)
    {
        return SOURCE_DIR + OBJ_DIR + className + ".cpp";
    }

    private void generateHeader(final BlockType block)
    {
        final String className = declarations.className(block);
        final String fileName = headerName(className);
        final CustomCode customCode = customCodeSource.customCode(fileName);
        final BlockType parent = block.parent();

        final CodeWriter out = new CodeWriter();
        out.code(PARTIALLY_GENERATED_NOTICE);
        out.guard(className.toUpperCase());
        out.code();
        customCode.writeRegion(out, CustomRegion.FILE_HEAD);
        out.code();
        out.code(declarations.includeHeader(block));
        out.namespace(NAMESPACE);
        if (parent == null)
        {
            out.code("using namespace std;");
        }
        out.code(declarations.forwardDeclarations(block));
        out.code("class " + className + ";");
        out.code("typedef Ref<" + className + "> " + className + "Ref;");
        out.code();

        out.comment(block.description());
        out.code("class " + className + " : public " +
            (parent != null ? declarations.className(parent) : "RefObject") + " {");
        out.code("public:");
        out.code(String.format(CLASS_DECLARATION, className));
        out.code();

        if (accessorsEnabled)
        {
            final List<Field> fields = declarations.accessorFields(block);
            if (fields.isEmpty())
            {
                out.code(NO_ACCESSORS);
            }
            else
            {
                out.code(BEGIN_ACCESSORS);
                out.code();
                for (final Field field : fields)
                {
                    out.comment(field.description() + "\n\\return The current value.", false);
                    out.code(declarations.getter(field, "", ";"));
                    out.code();
                    out.comment(field.description() + "\n\\param[in] value The new value.", false);
                    out.code(declarations.setter(field, "", ";"));
                    out.code();
                }
                out.code(END_ACCESSORS);
            }
            out.code();
        }

        customCode.writeRegion(out, CustomRegion.MISC);
        if (!block.fields().isEmpty())
        {
            out.code("protected:");
        }
        declareFields(out, block, true);
        out.code("public:");
        out.code(CLASS_INTERNALS);
        out.code("};");
        out.code();
        customCode.writeRegion(out, CustomRegion.FILE_FOOT);
        out.code();
        out.end();

        write(fileName, out);
    }

    private void generateSource(final BlockType block)
    {
        final String className = declarations.className(block);
        final String fileName = sourceName(className);
        final CustomCode customCode = customCodeSource.customCode(fileName);
        final BlockType parent = block.parent();

        final CodeWriter out = new CodeWriter();
        out.code(PARTIALLY_GENERATED_NOTICE);
        out.code();
        customCode.writeRegion(out, CustomRegion.FILE_HEAD);
        out.code();
        out.include(quoted("../../include/FixLink.h"));
        out.include(quoted("../../include/ObjectRegistry.h"));
        out.include(quoted("../../include/NIF_IO.h"));
        out.code(declarations.includeSource(block));
        customCode.writeRegion(out, CustomRegion.INCLUDE);
        out.code("using namespace Niflib;");
        out.code();

        out.code("//Definition of TYPE constant");
        out.code("const Type " + className + "::TYPE(\"" + block.name() + "\", &" +
            (parent != null ? declarations.className(parent) : "RefObject") + "::TYPE );");
        out.code();

        out.code(className + "::" + className + "()" + declarations.construct(block) + " {");
        customCode.writeRegion(out, CustomRegion.CONSTRUCTOR);
        out.code("}");
        out.code();

        out.code(className + "::~" + className + "() {");
        customCode.writeRegion(out, CustomRegion.DESTRUCTOR);
        out.code("}");
        out.code();

        out.code("const Type & " + className + "::GetType() const {");
        out.code("return TYPE;");
        out.code("}");
        out.code();

        out.code("NiObject * " + className + "::Create() {");
        out.code("return new " + className + ";");
        out.code("}");
        out.code();

        streamFunction(out, block, String.format(READ_SIGNATURE, className), Action.READ, customCode,
            CustomRegion.PRE_READ, CustomRegion.POST_READ);
        streamFunction(out, block, String.format(WRITE_SIGNATURE, className), Action.WRITE, customCode,
            CustomRegion.PRE_WRITE, CustomRegion.POST_WRITE);
        streamFunction(out, block, "std::string " + className + "::asString( bool verbose ) const {",
            Action.DESCRIBE, customCode, CustomRegion.PRE_STRING, CustomRegion.POST_STRING);
        streamFunction(out, block, String.format(FIX_LINKS_SIGNATURE, className), Action.FIX_LINKS, customCode,
            CustomRegion.PRE_FIXLINKS, CustomRegion.POST_FIXLINKS);

        out.code("std::list<NiObjectRef> " + className + "::GetRefs() const {");
        emitter.emit(block, Action.GET_REFS, out);
        out.code("}");
        out.code();

        out.code("std::list<NiObject *> " + className + "::GetPtrs() const {");
        emitter.emit(block, Action.GET_PTRS, out);
        out.code("}");
        out.code();

        if (accessorsEnabled)
        {
            generateAccessors(out, block, className);
        }

        customCode.writeRegion(out, CustomRegion.MISC);
        out.end();

        write(fileName, out);
    }

    private void streamFunction(
        final CodeWriter out,
        final BlockType block,
        final String signature,
        final Action action,
        final CustomCode customCode,
        final CustomRegion before,
        final CustomRegion after)
    {
        out.code(signature);
        customCode.writeRegion(out, before);
        out.code();
        emitter.emit(block, action, out);
        out.code();
        customCode.writeRegion(out, after);
        out.code("}");
        out.code();
    }

    private void generateAccessors(final CodeWriter out, final BlockType block, final String className)
    {
        final List<Field> fields = declarations.accessorFields(block);
        if (fields.isEmpty())
        {
            out.code(NO_ACCESSORS);
        }
        else
        {
            out.code(BEGIN_ACCESSORS);
            out.code();
            for (final Field field : fields)
            {
                final String member = memberName(field);
                out.code(declarations.getter(field, className + "::", " {"));
                out.code("return " + member + ";");
                out.code("}");
                out.code();

                out.code(declarations.setter(field, className + "::", " {"));
                out.code(member + " = value;");
                out.code("}");
                out.code();
            }
            out.code(END_ACCESSORS);
        }
        out.code();
    }
}
