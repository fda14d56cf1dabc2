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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A top level object of the file format. Blocks form a single inheritance hierarchy and refer to each other
 * through link and cross reference fields.
 */
public final class BlockType extends CompoundType
{
    private final BlockType parent;
    private final boolean isAbstract;
    private final boolean hasInterface;

    public BlockType(
        final String name,
        final String description,
        final BlockType parent,
        final boolean isAbstract,
        final boolean hasInterface)
    {
        super(name, description, null, false);
        this.parent = parent;
        this.isAbstract = isAbstract;
        this.hasInterface = hasInterface;
    }

    public Kind kind()
    {
        return Kind.BLOCK;
    }

    /**
     * @return the block this one inherits from, or null for a root of the hierarchy.
     */
    public BlockType parent()
    {
        return parent;
    }

    public boolean isAbstract()
    {
        return isAbstract;
    }

    public boolean hasInterface()
    {
        return hasInterface;
    }

    /**
     * @return ancestors from the root of the hierarchy down to, but excluding, this block.
     */
    public List<BlockType> ancestors()
    {
        final List<BlockType> ancestors = new ArrayList<>();
        for (BlockType ancestor = parent; ancestor != null; ancestor = ancestor.parent())
        {
            ancestors.add(ancestor);
        }
        Collections.reverse(ancestors);
        return ancestors;
    }

    public Field findField(final String name, final boolean inherit)
    {
        final Field field = field(name);
        if (field == null && inherit && parent != null)
        {
            return parent.findField(name, true);
        }

        return field;
    }
}
