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

import java.util.function.Function;

/**
 * A named type declared by the schema. The family is closed: {@link BasicType}, {@link EnumType} (and its
 * {@link FlagType} refinement), {@link CompoundType} and its {@link BlockType} refinement.
 */
public abstract class TypeEntity
{
    public enum Kind
    {
        BASIC,
        ENUM,
        FLAGS,
        COMPOUND,
        BLOCK
    }

    private final String name;
    private final String description;

    private boolean hasLinks;
    private boolean hasCrossRefs;

    TypeEntity(final String name, final String description)
    {
        this.name = name;
        this.description = description;
    }

    public abstract Kind kind();

    public <T> T match(
        final Function<BasicType, ? extends T> withBasic,
        final Function<EnumType, ? extends T> withEnum,
        final Function<CompoundType, ? extends T> withCompound,
        final Function<BlockType, ? extends T> withBlock)
    {
        if (this instanceof BasicType)
        {
            return withBasic.apply((BasicType)this);
        }
        else if (this instanceof EnumType)
        {
            return withEnum.apply((EnumType)this);
        }
        else if (this instanceof BlockType)
        {
            return withBlock.apply((BlockType)this);
        }
        else if (this instanceof CompoundType)
        {
            return withCompound.apply((CompoundType)this);
        }

        throw new IllegalStateException("Unknown type entity: " + this);
    }

    public String name()
    {
        return name;
    }

    public String description()
    {
        return description;
    }

    /**
     * @return the name of the runtime's hand written implementation of this type, or null if the generator
     * produces it.
     */
    public String nativeName()
    {
        return null;
    }

    /**
     * @return true if values of this type are streamed by the runtime rather than field by field.
     */
    public boolean isNative()
    {
        return nativeName() != null;
    }

    public boolean isTemplate()
    {
        return false;
    }

    /**
     * @return true if the type is itself an owning object reference.
     */
    public boolean isLink()
    {
        return false;
    }

    /**
     * @return true if the type is itself a non-owning object pointer.
     */
    public boolean isCrossRef()
    {
        return false;
    }

    /**
     * @return true if the type, or anything it transitively contains, is an owning reference.
     */
    public boolean hasLinks()
    {
        return hasLinks;
    }

    public void hasLinks(final boolean hasLinks)
    {
        this.hasLinks = hasLinks;
    }

    /**
     * @return true if the type, or anything it transitively contains, is a non-owning pointer.
     */
    public boolean hasCrossRefs()
    {
        return hasCrossRefs;
    }

    public void hasCrossRefs(final boolean hasCrossRefs)
    {
        this.hasCrossRefs = hasCrossRefs;
    }

    public boolean hasReferences()
    {
        return hasLinks || hasCrossRefs;
    }

    public String toString()
    {
        return getClass().getSimpleName() + "{" +
            "name='" + name + '\'' +
            '}';
    }
}
