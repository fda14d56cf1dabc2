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

import java.util.Collections;

import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.*;

/**
 * Generates <code>src/gen/register.cpp</code>, which registers the factory function of every block by its schema
 * name so that the reader can create objects by the names found in files.
 */
final class RegistrationGenerator extends Generator
{
    static final String REGISTER_SOURCE = SOURCE_DIR + GEN_DIR + "register.cpp";

    RegistrationGenerator(
        final SchemaContext context,
        final StreamEmitter emitter,
        final OutputManager outputManager,
        final CustomCodeSource customCodeSource)
    {
        super(context, emitter, outputManager, customCodeSource, Collections.emptySet());
    }

    void generate()
    {
        final CodeWriter out = new CodeWriter();
        out.code(FULLY_GENERATED_NOTICE);
        out.code();
        out.include(quoted("../../include/ObjectRegistry.h"));
        for (final BlockType block : context.blocks())
        {
            out.include(quoted(SOURCE_OBJ_INCLUDE_PREFIX + declarations.className(block) + ".h"));
        }
        out.code();
        out.namespace(NAMESPACE);
        out.code("void RegisterObjects() {");
        out.code();
        for (final BlockType block : context.blocks())
        {
            out.code("ObjectRegistry::RegisterObject( \"" + block.name() + "\", " +
                declarations.className(block) + "::Create );");
        }
        out.code();
        out.code("}");
        out.end();

        write(REGISTER_SOURCE, out);
    }
}
