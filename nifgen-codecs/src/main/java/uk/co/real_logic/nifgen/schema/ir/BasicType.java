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
 * A type implemented natively by the runtime, eg: integers, strings, object references.
 */
public final class BasicType extends TypeEntity
{
    /** Placeholder type for the parameter of template compounds. */
    public static final String TEMPLATE = "TEMPLATE";

    private final String nativeName;
    private final ValueFamily family;
    private final String count;
    private final boolean isTemplate;

    public BasicType(
        final String name,
        final String description,
        final String nativeName,
        final ValueFamily family,
        final String count,
        final boolean isTemplate)
    {
        super(name, description);
        this.nativeName = nativeName;
        this.family = family;
        this.count = count;
        this.isTemplate = isTemplate;

        hasLinks(family == ValueFamily.LINK);
        hasCrossRefs(family == ValueFamily.CROSS_REF);
    }

    public Kind kind()
    {
        return Kind.BASIC;
    }

    public String nativeName()
    {
        return nativeName;
    }

    public boolean isNative()
    {
        return true;
    }

    public ValueFamily family()
    {
        return family;
    }

    public String count()
    {
        return count;
    }

    public boolean isTemplate()
    {
        return isTemplate;
    }

    public boolean isLink()
    {
        return family == ValueFamily.LINK;
    }

    public boolean isCrossRef()
    {
        return family == ValueFamily.CROSS_REF;
    }

    public boolean isTemplateParameter()
    {
        return TEMPLATE.equals(name());
    }
}
