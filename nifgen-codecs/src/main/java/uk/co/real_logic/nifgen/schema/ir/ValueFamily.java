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
 * The broad category of a basic type's values, which decides its synthesized default and whether it carries
 * object references.
 */
public enum ValueFamily
{
    INTEGER,
    BOOLEAN,
    FLOAT,
    STRING,
    STRING_OFFSET,
    /** An owning reference to another object, resolved after reading. */
    LINK,
    /** A non-owning pointer to another object. */
    CROSS_REF,
    OTHER;
}
