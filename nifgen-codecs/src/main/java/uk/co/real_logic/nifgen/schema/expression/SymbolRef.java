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
 * A symbolic name: a sibling field, the <code>ARG</code> parameter or a property of the file being processed.
 */
public final class SymbolRef extends Expression
{
    public static final String ARGUMENT = "ARG";

    private final String name;

    SymbolRef(final String name)
    {
        this.name = name;
    }

    public String name()
    {
        return name;
    }

    public long evaluate(final EvaluationContext context)
    {
        return context.valueOf(name);
    }

    public String render(final SymbolRenderer renderer, final boolean brackets)
    {
        return renderer.render(name);
    }

    void collectSymbols(final Set<String> symbols)
    {
        symbols.add(name);
    }

    public String toString()
    {
        return name;
    }
}
