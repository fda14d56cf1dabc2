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
 * An integer literal, decimal or hexadecimal. Hexadecimal literals render as written.
 */
public final class Literal extends Expression
{
    private final long value;
    private final String text;

    Literal(final long value, final String text)
    {
        this.value = value;
        this.text = text;
    }

    public long value()
    {
        return value;
    }

    public long evaluate(final EvaluationContext context)
    {
        return value;
    }

    public String render(final SymbolRenderer renderer, final boolean brackets)
    {
        return text;
    }

    void collectSymbols(final Set<String> symbols)
    {
    }

    public String toString()
    {
        return text;
    }
}
