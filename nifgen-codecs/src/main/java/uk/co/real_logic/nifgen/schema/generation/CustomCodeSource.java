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
package uk.co.real_logic.nifgen.schema.generation;

import java.util.List;

/**
 * Supplies the previous content of a generated file so that its custom code regions can be preserved.
 */
@FunctionalInterface
public interface CustomCodeSource
{
    /**
     * @param name the name of the generated file, relative to the output root.
     * @return the lines of the existing file with their terminators, or null if there is no such file.
     */
    List<String> existingLines(String name);

    /**
     * @param name the name of the generated file, relative to the output root.
     * @return the custom code of the existing file, or the defaults if there is none.
     */
    default CustomCode customCode(final String name)
    {
        final List<String> lines = existingLines(name);
        return lines == null ? CustomCode.defaults() : CustomCode.extract(lines);
    }
}
