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

import uk.co.real_logic.nifgen.schema.ir.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.SCHEMA;

/**
 * Every entity loaded from one schema document. Names are unique across all type categories and each category
 * keeps document order.
 * <p>
 * Built once by the {@link SchemaParser}, the only changes after loading are the explicit patches such as
 * {@link #markManualUpdate(String, String)}.
 */
public final class SchemaContext
{
    private final List<Version> versions = new ArrayList<>();
    private final Map<String, TypeEntity> typesByName = new LinkedHashMap<>();
    private final List<BasicType> basics = new ArrayList<>();
    private final List<EnumType> enums = new ArrayList<>();
    private final List<CompoundType> compounds = new ArrayList<>();
    private final List<BlockType> blocks = new ArrayList<>();

    void addVersion(final Version version)
    {
        versions.add(version);
    }

    void add(final TypeEntity type)
    {
        final TypeEntity existing = typesByName.putIfAbsent(type.name(), type);
        if (existing != null)
        {
            throw new SchemaLoadException(String.format(
                "Cannot define the same type name twice. Details to follow:\n" +
                "Type : %1$s (%2$s)\n" +
                "Type : %3$s (%4$s)",
                type.name(),
                type.kind(),
                existing.name(),
                existing.kind()));
        }

        type.match(
            basics::add,
            enums::add,
            compounds::add,
            blocks::add);
    }

    public List<Version> versions()
    {
        return Collections.unmodifiableList(versions);
    }

    public List<BasicType> basics()
    {
        return Collections.unmodifiableList(basics);
    }

    /**
     * @return enums and flags in document order.
     */
    public List<EnumType> enums()
    {
        return Collections.unmodifiableList(enums);
    }

    /**
     * @return compounds in document order, excluding blocks.
     */
    public List<CompoundType> compounds()
    {
        return Collections.unmodifiableList(compounds);
    }

    public List<BlockType> blocks()
    {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return compounds followed by blocks: every type that has fields.
     */
    public List<CompoundType> structures()
    {
        final List<CompoundType> structures = new ArrayList<>(compounds);
        structures.addAll(blocks);
        return structures;
    }

    /**
     * @param name a type name.
     * @return the type with that name in any category, or null.
     */
    public TypeEntity type(final String name)
    {
        return name == null ? null : typesByName.get(name);
    }

    public boolean isBlock(final String name)
    {
        return type(name) instanceof BlockType;
    }

    public BlockType block(final String name)
    {
        final TypeEntity type = type(name);
        return type instanceof BlockType ? (BlockType)type : null;
    }

    /**
     * The target class name for a schema type: the native name of natively implemented types, otherwise the
     * schema name with spaces and colons replaced.
     *
     * @param name a type name.
     * @return the class name or null for a null name.
     */
    public String className(final String name)
    {
        if (name == null)
        {
            return null;
        }

        final TypeEntity type = type(name);
        if (type != null && type.nativeName() != null)
        {
            return type.nativeName();
        }

        final String nativeName = NativeTypes.nativeName(name);
        return nativeName != null ? nativeName : Names.className(name);
    }

    /**
     * Mark a field whose value hand written code maintains, so it is never recomputed from array sizes before
     * writing.
     *
     * @param typeName the compound or block declaring the field.
     * @param fieldName the schema name of the field.
     * @throws IllegalArgumentException if either name is unknown.
     */
    public void markManualUpdate(final String typeName, final String fieldName)
    {
        final CompoundType structure = structure(typeName);
        final Field field = structure.field(fieldName);
        if (field == null)
        {
            throw new IllegalArgumentException("Unknown field " + fieldName + " in type " + typeName);
        }

        field.isManualUpdate(true);
        log(SCHEMA, "Marked %s.%s as manually updated", typeName, fieldName);
    }

    /**
     * @param typeName a compound or block name.
     * @return the compound or block.
     * @throws IllegalArgumentException if there is no compound or block with that name.
     */
    public CompoundType structure(final String typeName)
    {
        final TypeEntity type = type(typeName);
        if (!(type instanceof CompoundType))
        {
            throw new IllegalArgumentException("Unknown compound or block: " + typeName);
        }

        return (CompoundType)type;
    }

    public String toString()
    {
        return "SchemaContext{" +
            "versions=" + versions.size() +
            ", basics=" + basics.size() +
            ", enums=" + enums.size() +
            ", compounds=" + compounds.size() +
            ", blocks=" + blocks.size() +
            '}';
    }
}
