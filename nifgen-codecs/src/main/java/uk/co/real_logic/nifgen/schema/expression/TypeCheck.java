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

import java.util.Set;

/**
 * A terminal naming a block type: true when the object being processed is of, or derives from, that type.
 */
public final class TypeCheck extends Expression
{
    private final String blockName;

    TypeCheck(final String blockName)
    {
        this.blockName = blockName;
    }

    public String blockName()
    {
        return blockName;
    }

    public long evaluate(final EvaluationContext context)
    {
        return Operator.toLong(context.isDerivedType(blockName));
    }

    public String render(final SymbolRenderer renderer, final boolean brackets)
    {
        return "IsDerivedType(" + blockName + "::TYPE)";
    }

    void collectSymbols(final Set<String> symbols)
    {
    }

    void collectTypeChecks(final Set<String> typeNames)
    {
        typeNames.add(blockName);
    }

    public String toString()
    {
        return blockName;
    }
}
