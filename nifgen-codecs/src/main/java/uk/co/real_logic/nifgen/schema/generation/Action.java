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

/**
 * The member functions whose bodies are generated by streaming over a type's fields.
 */
public enum Action
{
    READ("in")
    {
        String parentCall(final String parent)
        {
            return parent + "::Read( in, link_stack, info );";
        }
    },
    WRITE("out")
    {
        String parentCall(final String parent)
        {
            return parent + "::Write( out, link_map, missing_link_stack, info );";
        }
    },
    /** The <code>asString</code> function, a human readable description of the object. */
    DESCRIBE("out")
    {
        String parentCall(final String parent)
        {
            return "out << " + parent + "::asString();";
        }
    },
    FIX_LINKS("out")
    {
        String parentCall(final String parent)
        {
            return parent + "::FixLinks( objects, link_stack, missing_link_stack, info );";
        }
    },
    GET_REFS("out")
    {
        String parentCall(final String parent)
        {
            return "refs = " + parent + "::GetRefs();";
        }
    },
    GET_PTRS("out")
    {
        String parentCall(final String parent)
        {
            return "ptrs = " + parent + "::GetPtrs();";
        }
    };

    private final String stream;

    Action(final String stream)
    {
        this.stream = stream;
    }

    /**
     * @return the name of the stream variable in the generated function.
     */
    String stream()
    {
        return stream;
    }

    abstract String parentCall(String parent);

    boolean hasVersionGuards()
    {
        return this == READ || this == WRITE || this == FIX_LINKS;
    }

    boolean hasConditionGuards()
    {
        return hasVersionGuards() || this == DESCRIBE;
    }

    /**
     * @return true if fields that hold no object references are skipped.
     */
    boolean visitsReferencesOnly()
    {
        return this == FIX_LINKS || this == GET_REFS || this == GET_PTRS;
    }

    /**
     * @return true if sizes and function values are recomputed from the data before streaming.
     */
    boolean updatesDerivedValues()
    {
        return this == WRITE || this == DESCRIBE;
    }

    boolean streamsValues()
    {
        return this == READ || this == WRITE;
    }
}
