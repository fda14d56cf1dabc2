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
package uk.co.real_logic.nifgen;

public enum LogTag
{
    /**
     * Loading of the schema document: counts of versions, basics, enums, compounds and blocks, and the
     * post-load patches applied to fields.
     */
    SCHEMA,

    /**
     * Symbol resolution while emitting stream bodies. Unresolved references are reported here when they are
     * allowed through {@link uk.co.real_logic.nifgen.schema.generation.GeneratorConfiguration}.
     */
    RESOLUTION,

    /**
     * Files written, or skipped because their content is unchanged.
     */
    GENERATION,

    /**
     * Extraction of hand-written custom code regions from previously generated files.
     */
    CUSTOM_CODE;

    private final char[] logStr;

    LogTag()
    {
        logStr = ("[" + name() + "]").toCharArray();
    }

    public char[] logStr()
    {
        return logStr;
    }
}
