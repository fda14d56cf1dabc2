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
package uk.co.real_logic.nifgen.schema.expression;

import uk.co.real_logic.nifgen.schema.UnresolvedReferenceException;

import java.util.Map;

/**
 * Supplies the values of symbolic names when an {@link Expression} is evaluated.
 */
@FunctionalInterface
public interface EvaluationContext
{
    /**
     * Value of a symbolic name.
     *
     * @param name the name as written in the schema.
     * @return the value of the name.
     * @throws UnresolvedReferenceException if the name isn't defined.
     */
    long valueOf(String name);

    /**
     * Whether the object being evaluated is, or derives from, the named block type.
     *
     * @param blockName the name of a block type.
     * @return true if the object is of that type.
     */
    default boolean isDerivedType(final String blockName)
    {
        return false;
    }

    static EvaluationContext of(final Map<String, Long> values)
    {
        return (name) ->
        {
            final Long value = values.get(name);
            if (value == null)
            {
                throw new UnresolvedReferenceException(null, null, name);
            }
            return value;
        };
    }
}
