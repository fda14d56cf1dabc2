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

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

public final class GeneratorConfiguration
{
    /**
     * Boolean system property that turns expression symbols which resolve to no field into a logged warning
     * rather than an {@link uk.co.real_logic.nifgen.schema.UnresolvedReferenceException}. Defaults to false.
     * <p>
     * The symbol is then emitted as a bare member name, which is what older versions of the generator did and
     * usually produces code that doesn't compile.
     */
    public static final String ALLOW_UNRESOLVED_REFERENCES_PROPERTY = "nifgen.allow_unresolved_references";

    /**
     * Boolean system property to generate the example accessor implementations of blocks.
     */
    public static final String ACCESSORS_ENABLED_PROPERTY = "nifgen.accessors";

    /**
     * Compound that holds a field recursively through its own union type and so can't be laid out.
     */
    public static final String DEFAULT_EXCLUDED_FIELD = "BoundingVolume:Union";

    public static final List<String> DEFAULT_ROOT_COMPOUNDS = Collections.unmodifiableList(
        Arrays.asList(CompoundGenerator.HEADER, "Footer"));

    private boolean allowUnresolvedReferences = Boolean.getBoolean(ALLOW_UNRESOLVED_REFERENCES_PROPERTY);
    private boolean accessorsEnabled = Boolean.getBoolean(ACCESSORS_ENABLED_PROPERTY);
    private final Set<String> typeNames = new LinkedHashSet<>();
    private final Set<String> excludedFields = new LinkedHashSet<>(Collections.singleton(DEFAULT_EXCLUDED_FIELD));
    private final List<String[]> manualUpdateFields = new ArrayList<>();
    private final Set<String> rootCompounds = new LinkedHashSet<>(DEFAULT_ROOT_COMPOUNDS);

    private String outputPath;
    private String schemaFile;
    private InputStream schemaStream;
    private Function<String, OutputManager> outputManagerFactory = FileTreeOutputManager::new;
    private CustomCodeSource customCodeSource;

    public GeneratorConfiguration()
    {
    }

    /**
     * Sets the root directory of the generated tree. Files go into its <code>include</code> and <code>src</code>
     * sub directories, which are created as needed. Required.
     *
     * @param outputPath the root directory of the generated tree.
     * @return this
     */
    public GeneratorConfiguration outputPath(final String outputPath)
    {
        this.outputPath = outputPath;
        return this;
    }

    /**
     * Provide the schema as a file. Either this or {@link #schemaStream(InputStream)} is required.
     *
     * @param schemaFile path to the XML schema document.
     * @return this
     */
    public GeneratorConfiguration schemaFile(final String schemaFile)
    {
        this.schemaFile = schemaFile;
        return this;
    }

    /**
     * Provide the schema as a stream. The stream is closed once it has been parsed.
     *
     * @param schemaStream the XML schema document.
     * @return this
     */
    public GeneratorConfiguration schemaStream(final InputStream schemaStream)
    {
        this.schemaStream = schemaStream;
        return this;
    }

    /**
     * Restrict generation to the compounds and blocks with these class names. The enumeration and
     * registration files are only generated when no type is named.
     *
     * @param typeNames class names of the types to generate.
     * @return this
     */
    public GeneratorConfiguration typeNames(final String... typeNames)
    {
        this.typeNames.addAll(Arrays.asList(typeNames));
        return this;
    }

    public GeneratorConfiguration accessorsEnabled(final boolean accessorsEnabled)
    {
        this.accessorsEnabled = accessorsEnabled;
        return this;
    }

    /**
     * Defaults to the value of the {@link #ALLOW_UNRESOLVED_REFERENCES_PROPERTY} system property.
     *
     * @param allowUnresolvedReferences true to log unresolved symbols, false to fail the run (default).
     * @return this
     */
    public GeneratorConfiguration allowUnresolvedReferences(final boolean allowUnresolvedReferences)
    {
        this.allowUnresolvedReferences = allowUnresolvedReferences;
        return this;
    }

    /**
     * Mark a field whose value is maintained by hand written code, so it is never recomputed from array sizes
     * before writing.
     *
     * @param typeName the compound or block declaring the field.
     * @param fieldName the schema name of the field.
     * @return this
     */
    public GeneratorConfiguration manualUpdateField(final String typeName, final String fieldName)
    {
        manualUpdateFields.add(new String[]{ typeName, fieldName });
        return this;
    }

    /**
     * Leave a field out of the loaded schema. {@link #DEFAULT_EXCLUDED_FIELD} is excluded unless
     * {@link #clearExcludedFields()} is called.
     *
     * @param typeName the compound or block declaring the field.
     * @param fieldName the schema name of the field.
     * @return this
     */
    public GeneratorConfiguration excludedField(final String typeName, final String fieldName)
    {
        excludedFields.add(typeName + ":" + fieldName);
        return this;
    }

    public GeneratorConfiguration clearExcludedFields()
    {
        excludedFields.clear();
        return this;
    }

    /**
     * Compounds that are streamed on their own rather than as part of a block, so they get their own locals and
     * Read, Write and asString functions. Optional, defaults to {@link #DEFAULT_ROOT_COMPOUNDS}.
     *
     * @param rootCompounds schema names of the compounds.
     * @return this
     */
    public GeneratorConfiguration rootCompounds(final String... rootCompounds)
    {
        this.rootCompounds.clear();
        this.rootCompounds.addAll(Arrays.asList(rootCompounds));
        return this;
    }

    /**
     * Where existing files are read from in order to keep their custom code. Optional, defaults to the output
     * manager when it is a {@link CustomCodeSource}, otherwise every file is treated as new.
     *
     * @param customCodeSource the source of existing file contents.
     * @return this
     */
    public GeneratorConfiguration customCodeSource(final CustomCodeSource customCodeSource)
    {
        this.customCodeSource = customCodeSource;
        return this;
    }

    GeneratorConfiguration outputManagerFactory(final Function<String, OutputManager> outputManagerFactory)
    {
        this.outputManagerFactory = outputManagerFactory;
        return this;
    }

    String outputPath()
    {
        return outputPath;
    }

    String schemaFile()
    {
        return schemaFile;
    }

    InputStream schemaStream()
    {
        return schemaStream;
    }

    Set<String> typeNames()
    {
        return typeNames;
    }

    boolean accessorsEnabled()
    {
        return accessorsEnabled;
    }

    boolean allowUnresolvedReferences()
    {
        return allowUnresolvedReferences;
    }

    List<String[]> manualUpdateFields()
    {
        return manualUpdateFields;
    }

    Set<String> excludedFields()
    {
        return excludedFields;
    }

    Set<String> rootCompounds()
    {
        return rootCompounds;
    }

    Function<String, OutputManager> outputManagerFactory()
    {
        return outputManagerFactory;
    }

    CustomCodeSource customCodeSource()
    {
        return customCodeSource;
    }

    void conclude()
    {
        if (outputPath == null)
        {
            throw new IllegalArgumentException("Missing outputPath() configuration property");
        }

        if (schemaFile == null && schemaStream == null)
        {
            throw new IllegalArgumentException(
                "Please provide the XML schema either through the schemaFile() or schemaStream() option.");
        }

        if (schemaFile != null && schemaStream != null)
        {
            throw new IllegalArgumentException("Cannot provide both schemaFile() and schemaStream()");
        }
    }
}
