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

/**
 * A named value of an enum, or a named bit of a flags type.
 */
public final class Option
{
    private final String name;
    private final long value;
    private final int bit;
    private final String description;

    /**
     * @param name the option name, already carrying the enum's prefix if it declares one.
     * @param value the effective numeric value.
     * @param bit the declared bit position for flags, -1 for plain enum options.
     * @param description the description, defaults to the name when blank.
     */
    public Option(final String name, final long value, final int bit, final String description)
    {
        this.name = name;
        this.value = value;
        this.bit = bit;
        this.description = description == null || description.isEmpty() ? name : description;
    }

    public static Option enumOption(final String name, final long value, final String description)
    {
        return new Option(name, value, -1, description);
    }

    public static Option flagOption(final String name, final int bit, final String description)
    {
        return new Option(name, 1L << bit, bit, description);
    }

    public String name()
    {
        return name;
    }

    public long value()
    {
        return value;
    }

    public int bit()
    {
        return bit;
    }

    public String description()
    {
        return description;
    }

    /**
     * @return the upper case constant name used in generated code.
     */
    public String constantName()
    {
        return name.toUpperCase()
            .replace(' ', '_')
            .replace('-', '_')
            .replace('/', '_')
            .replace('=', '_')
            .replace(':', '_');
    }

    public String toString()
    {
        return "Option{" +
            "name='" + name + '\'' +
            ", value=" + value +
            '}';
    }
}
