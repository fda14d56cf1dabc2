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
import uk.co.real_logic.nifgen.schema.SchemaParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Set;

import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.GENERATION;

public final class CodeGenerator
{
    public static void generate(final GeneratorConfiguration configuration) throws IOException
    {
        configuration.conclude();

        final SchemaContext context = parse(configuration);
        for (final String[] manualUpdate : configuration.manualUpdateFields())
        {
            context.markManualUpdate(manualUpdate[0], manualUpdate[1]);
        }

        final OutputManager outputManager = configuration.outputManagerFactory().apply(configuration.outputPath());
        final CustomCodeSource customCodeSource = customCodeSource(configuration, outputManager);
        final Set<String> typeNames = configuration.typeNames();
        final StreamEmitter emitter = new StreamEmitter(
            context, configuration.rootCompounds(), configuration.allowUnresolvedReferences());

        log(GENERATION, "Generating %s into %s", context, configuration.outputPath());

        new CompoundGenerator(
            context, emitter, outputManager, customCodeSource, typeNames, configuration.rootCompounds()).generate();
        new BlockGenerator(
            context, emitter, outputManager, customCodeSource, typeNames, configuration.accessorsEnabled()).generate();

        if (typeNames.isEmpty())
        {
            new EnumGenerator(context, emitter, outputManager, customCodeSource).generate();
            new RegistrationGenerator(context, emitter, outputManager, customCodeSource).generate();
        }
    }

    private static SchemaContext parse(final GeneratorConfiguration configuration) throws IOException
    {
        final SchemaParser parser = new SchemaParser(configuration.excludedFields());
        final String schemaFile = configuration.schemaFile();
        if (schemaFile != null)
        {
            return parser.parse(Paths.get(schemaFile));
        }

        try (InputStream in = configuration.schemaStream())
        {
            return parser.parse(in);
        }
    }

    private static CustomCodeSource customCodeSource(
        final GeneratorConfiguration configuration, final OutputManager outputManager)
    {
        if (configuration.customCodeSource() != null)
        {
            return configuration.customCodeSource();
        }

        if (outputManager instanceof CustomCodeSource)
        {
            return (CustomCodeSource)outputManager;
        }

        return (name) -> null;
    }
}
