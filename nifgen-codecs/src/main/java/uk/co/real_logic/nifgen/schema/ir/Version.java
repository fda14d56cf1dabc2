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
 * A file format version declared by the schema.
 */
public final class Version
{
    private final String number;
    private final long packed;
    private final String description;

    public Version(final String number, final String description)
    {
        this.number = number;
        this.packed = pack(number);
        this.description = description;
    }

    public String number()
    {
        return number;
    }

    public long packed()
    {
        return packed;
    }

    public String description()
    {
        return description;
    }

    /**
     * Pack a dotted version into its 32-bit identifier, one byte per part, most significant first:
     * <code>10.0.1.0</code> is <code>0x0A000100</code>. A two part version such as <code>4.21</code> takes
     * its minor digits one at a time, <code>0x04020100</code>.
     *
     * @param version the dotted version.
     * @return the packed identifier.
     * @throws IllegalArgumentException if the version has more than four parts or a part isn't numeric.
     */
    public static long pack(final String version)
    {
        final String[] parts = version.trim().split("\\.");
        if (parts.length > 4)
        {
            throw new IllegalArgumentException("Version has more than four parts: " + version);
        }

        try
        {
            long packed = 0;
            if (parts.length == 2)
            {
                final String minor = parts[1];
                packed += Long.parseLong(parts[0]) << 24;
                if (minor.length() >= 1)
                {
                    packed += (long)Character.digit(minor.charAt(0), 10) << 16;
                }
                if (minor.length() >= 2)
                {
                    packed += (long)Character.digit(minor.charAt(1), 10) << 8;
                }
                if (minor.length() >= 3)
                {
                    packed += Long.parseLong(minor.substring(2));
                }
            }
            else
            {
                for (int i = 0; i < parts.length; i++)
                {
                    packed += Long.parseLong(parts[i]) << ((3 - i) * 8);
                }
            }

            return packed;
        }
        catch (final NumberFormatException ex)
        {
            throw new IllegalArgumentException("Invalid version: " + version, ex);
        }
    }

    public static String toHex(final long packed)
    {
        return String.format("0x%08X", packed);
    }

    public String toString()
    {
        return "Version{" +
            "number='" + number + '\'' +
            ", packed=" + toHex(packed) +
            '}';
    }
}
