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
import java.util.List;

/**
 * An enumeration stored on the wire as one of the integer basic types.
 */
public class EnumType extends TypeEntity
{
    private final BasicType storage;
    private final String prefix;
    private final List<Option> options = new ArrayList<>();

    public EnumType(final String name, final String description, final BasicType storage, final String prefix)
    {
        super(name, description);
        this.storage = storage;
        this.prefix = prefix;
    }

    public Kind kind()
    {
        return Kind.ENUM;
    }

    /**
     * Enums are generated as named C++ enumerations so their native name is their own class name.
     *
     * @return the class name of the enumeration.
     */
    public String nativeName()
    {
        return name().replace(' ', '_').replace(':', '_');
    }

    public boolean isNative()
    {
        return true;
    }

    public BasicType storage()
    {
        return storage;
    }

    public String prefix()
    {
        return prefix;
    }

    public List<Option> options()
    {
        return Collections.unmodifiableList(options);
    }

    public EnumType addOption(final Option option)
    {
        options.add(option);
        return this;
    }

    /**
     * Apply the enum's prefix to an option name as declared in the schema.
     *
     * @param optionName the declared option name.
     * @return the prefixed option name.
     */
    public String prefixed(final String optionName)
    {
        return prefix == null || prefix.isEmpty() ? optionName : prefix + "_" + optionName;
    }
}
