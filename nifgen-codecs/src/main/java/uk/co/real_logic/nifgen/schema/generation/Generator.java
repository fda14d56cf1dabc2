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

import org.agrona.LangUtil;
import org.agrona.generation.OutputManager;
import uk.co.real_logic.nifgen.schema.SchemaContext;
import uk.co.real_logic.nifgen.schema.ir.CompoundType;
import uk.co.real_logic.nifgen.schema.ir.Field;

import java.io.IOException;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.GENERATION;

/**
 * Common parts of the generators that write one or two files per type.
 */
abstract class Generator
{
    protected final SchemaContext context;
    protected final Declarations declarations;
    protected final StreamEmitter emitter;
    protected final OutputManager outputManager;
    protected final CustomCodeSource customCodeSource;
    private final Set<String> typeFilter;

    protected Generator(
        final SchemaContext context,
        final StreamEmitter emitter,
        final OutputManager outputManager,
        final CustomCodeSource customCodeSource,
        final Collection<String> typeFilter)
    {
        this.context = context;
        this.declarations = new Declarations(context);
        this.emitter = emitter;
        this.outputManager = outputManager;
        this.customCodeSource = customCodeSource;
        this.typeFilter = new HashSet<>(typeFilter);
    }

    abstract void generate();

    /**
     * @param type a compound or block.
     * @return true if no type filter is set or the type's class name is in it.
     */
    protected boolean isSelected(final CompoundType type)
    {
        return typeFilter.isEmpty() || typeFilter.contains(declarations.className(type));
    }

    /**
     * Declare the member variables of a type. Block members are protected unless declared public.
     */
    protected void declareFields(final CodeWriter writer, final CompoundType type, final boolean isBlock)
    {
        boolean isProtected = true;
        for (final Field field : type.fields())
        {
            if (field.isDuplicate())
            {
                continue;
            }

            if (isBlock)
            {
                if (field.isPublic() && isProtected)
                {
                    writer.code("public:");
                    isProtected = false;
                }
                else if (!field.isPublic() && !isProtected)
                {
                    writer.code("protected:");
                    isProtected = true;
                }
            }

            writer.comment(field.description());
            writer.code(declarations.declare(field));
            if (field.function() != null)
            {
                writer.comment(field.description());
                writer.code(declarations.typeName(field) + " " + field.function() + "() const;");
            }
        }
    }

    protected void write(final String name, final CodeWriter writer)
    {
        outputManager.withOutput(name, (out) ->
        {
            try
            {
                out.append(writer.toString());
            }
            catch (final IOException ex)
            {
                LangUtil.rethrowUnchecked(ex);
            }
        });
        log(GENERATION, "Generated %s", name);
    }
}
