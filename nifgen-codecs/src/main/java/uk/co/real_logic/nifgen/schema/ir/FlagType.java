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
 * An enum whose options are bit positions, combined with bitwise or.
 */
public final class FlagType extends EnumType
{
    public FlagType(final String name, final String description, final BasicType storage, final String prefix)
    {
        super(name, description, storage, prefix);
    }

    public Kind kind()
    {
        return Kind.FLAGS;
    }
}
