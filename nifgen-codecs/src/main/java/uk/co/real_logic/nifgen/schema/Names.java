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

import uk.co.real_logic.nifgen.schema.expression.SymbolRef;

/**
 * Conversion of schema names into target language identifiers.
 */
public final class Names
{
    private Names()
    {
    }

    /**
     * Format a schema name as a member variable: words after the first are capitalised, every other letter is
     * lower case, a backslash becomes member access and other punctuation becomes an underscore.
     * <code>Num Vertices</code> becomes <code>numVertices</code>. The argument placeholder is kept as is.
     *
     * @param name the schema name.
     * @return the member name, or null for a null name.
     */
    public static String memberName(final String name)
    {
        if (name == null || SymbolRef.ARGUMENT.equals(name))
        {
            return name;
        }

        final StringBuilder builder = new StringBuilder(name.length());
        boolean lower = true;
        for (int i = 0; i < name.length(); i++)
        {
            final char ch = name.charAt(i);
            if (ch == ' ')
            {
                lower = false;
            }
            else if (Character.isLetterOrDigit(ch))
            {
                if (lower)
                {
                    builder.append(Character.toLowerCase(ch));
                }
                else
                {
                    builder.append(Character.toUpperCase(ch));
                    lower = true;
                }
            }
            else if (ch == '\\')
            {
                builder.append('.');
            }
            else
            {
                builder.append('_');
                lower = true;
            }
        }

        return builder.toString();
    }

    /**
     * Format a schema name as a class name when the type isn't natively implemented.
     *
     * @param name the schema name.
     * @return the class name, or null for a null name.
     */
    public static String className(final String name)
    {
        if (name == null)
        {
            return null;
        }

        return name.replace(' ', '_').replace(':', '_');
    }
}
