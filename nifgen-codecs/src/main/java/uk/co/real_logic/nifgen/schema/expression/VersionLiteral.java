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

import uk.co.real_logic.nifgen.schema.ir.Version;

import java.util.Set;

/**
 * A dotted four part version, eg: <code>20.0.0.5</code>, packed into its 32-bit identifier.
 */
public final class VersionLiteral extends Expression
{
    private final String version;
    private final long packed;

    VersionLiteral(final String version)
    {
        this.version = version;
        this.packed = Version.pack(version);
    }

    public String version()
    {
        return version;
    }

    public long packed()
    {
        return packed;
    }

    public long evaluate(final EvaluationContext context)
    {
        return packed;
    }

    public String render(final SymbolRenderer renderer, final boolean brackets)
    {
        return Version.toHex(packed);
    }

    void collectSymbols(final Set<String> symbols)
    {
    }

    public String toString()
    {
        return version;
    }
}
