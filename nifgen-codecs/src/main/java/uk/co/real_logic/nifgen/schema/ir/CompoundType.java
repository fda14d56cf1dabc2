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
package uk.co.real_logic.nifgen.schema.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A structure made of an ordered list of fields. Field order is the wire order.
 */
public class CompoundType extends TypeEntity
{
    private final String nativeName;
    private final boolean isTemplate;
    private final List<Field> fields = new ArrayList<>();

    private boolean usesArgument;

    public CompoundType(
        final String name, final String description, final String nativeName, final boolean isTemplate)
    {
        super(name, description);
        this.nativeName = nativeName;
        this.isTemplate = isTemplate;
    }

    public Kind kind()
    {
        return Kind.COMPOUND;
    }

    public String nativeName()
    {
        return nativeName;
    }

    public boolean isTemplate()
    {
        return isTemplate;
    }

    public List<Field> fields()
    {
        return Collections.unmodifiableList(fields);
    }

    public CompoundType addField(final Field field)
    {
        field.owner(this);
        fields.add(field);
        return this;
    }

    /**
     * @return true if any field references the compound's external argument.
     */
    public boolean usesArgument()
    {
        return usesArgument;
    }

    public void usesArgument(final boolean usesArgument)
    {
        this.usesArgument = usesArgument;
    }

    /**
     * @param name the schema name of the field.
     * @return the first own field with that name, or null.
     */
    public Field field(final String name)
    {
        for (final Field field : fields)
        {
            if (field.name().equals(name))
            {
                return field;
            }
        }

        return null;
    }

    /**
     * @param name the schema name of the field.
     * @param inherit whether ancestor types are searched when the field isn't declared here.
     * @return the field or null.
     */
    public Field findField(final String name, final boolean inherit)
    {
        return field(name);
    }

    /**
     * @return true if this type, or any compound it contains, has an array field.
     */
    public boolean hasArrays()
    {
        return hasArrays(new IdentityHashMap<>());
    }

    private boolean hasArrays(final Map<CompoundType, Boolean> visited)
    {
        if (visited.put(this, Boolean.TRUE) != null)
        {
            return false;
        }

        for (final Field field : fields)
        {
            if (field.isArray())
            {
                return true;
            }

            final TypeEntity type = field.type();
            if (type instanceof CompoundType && ((CompoundType)type).hasArrays(visited))
            {
                return true;
            }
        }

        return false;
    }
}
