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

import uk.co.real_logic.nifgen.schema.generation.CodeGenerator;
import uk.co.real_logic.nifgen.schema.generation.GeneratorConfiguration;

public final class CodeGenerationTool
{
    public static void main(final String[] args)
    {
        if (args.length < 1)
        {
            printUsageAndExit();
        }

        try
        {
            CodeGenerator.generate(parseArguments(args));
        }
        catch (final Throwable e)
        {
            e.printStackTrace();
            printUsageAndExit();
        }
    }

    static GeneratorConfiguration parseArguments(final String[] args)
    {
        final GeneratorConfiguration config = new GeneratorConfiguration()
            .schemaFile(args[0])
            .outputPath(".");

        for (int i = 1; i < args.length; i++)
        {
            final String arg = args[i];
            switch (arg)
            {
                case "-p":
                    config.outputPath(value(args, ++i, arg));
                    break;

                case "-n":
                    config.typeNames(value(args, ++i, arg));
                    break;

                case "-a":
                    config.accessorsEnabled(true);
                    break;

                case "-m":
                {
                    final String value = value(args, ++i, arg);
                    final int separator = value.indexOf(':');
                    if (separator <= 0 || separator == value.length() - 1)
                    {
                        throw new IllegalArgumentException("Expected Type:Field after -m but was " + value);
                    }
                    config.manualUpdateField(value.substring(0, separator), value.substring(separator + 1));
                    break;
                }

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        return config;
    }

    private static String value(final String[] args, final int index, final String option)
    {
        if (index >= args.length)
        {
            throw new IllegalArgumentException("Missing value after " + option);
        }

        return args[index];
    }

    private static void printUsageAndExit()
    {
        System.err.println("Usage: CodeGenerationTool </path/to/schema.xml> [-p </path/to/output-root>] " +
            "[-n TypeName]... [-a] [-m TypeName:Field Name]...");
        System.exit(-1);
    }
}
