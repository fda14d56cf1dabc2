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

import uk.co.real_logic.nifgen.schema.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A member of a compound or block, declared by an <code>add</code> element of the schema.
 * <p>
 * Attributes come from the schema document. Type handles and parsed expressions are attached once every type
 * has been registered, the derived facts (duplicate status, back references, default value) are computed by
 * the field resolver after that.
 */
public final class Field
{
    private final String name;
    private final String typeName;

    private String suffix = "";
    private String templateName;
    private String argument;
    private String arr1Text;
    private String arr2Text;
    private String condText;
    private String vercondText;
    private String function;
    private String declaredDefault;
    private String ver1Text;
    private String ver2Text;
    private Long ver1;
    private Long ver2;
    private Long userVersion;
    private Long userVersion2;
    private boolean isPublic;
    private boolean isAbstract;
    private boolean isCalculated;
    private String description = "";

    private CompoundType owner;
    private TypeEntity type;
    private TypeEntity template;
    private Expression arr1 = Expression.EMPTY;
    private Expression arr2 = Expression.EMPTY;
    private Expression cond = Expression.EMPTY;
    private Expression vercond = Expression.EMPTY;

    private boolean isDuplicate;
    private boolean isArr2Dynamic;
    private boolean usesArgument;
    private boolean isManualUpdate;
    private String defaultValue;
    private final List<String> arr1References = new ArrayList<>();
    private final List<String> arr2References = new ArrayList<>();
    private final List<String> condReferences = new ArrayList<>();

    public Field(final String name, final String typeName)
    {
        this.name = name;
        this.typeName = typeName;
    }

    public String name()
    {
        return name;
    }

    /**
     * @return the name qualified by the suffix, which distinguishes otherwise identically named fields.
     */
    public String uniqueName()
    {
        return suffix.isEmpty() ? name : name + "_" + suffix;
    }

    public String typeName()
    {
        return typeName;
    }

    public String suffix()
    {
        return suffix;
    }

    public Field suffix(final String suffix)
    {
        this.suffix = suffix == null ? "" : suffix;
        return this;
    }

    public String templateName()
    {
        return templateName;
    }

    public Field templateName(final String templateName)
    {
        this.templateName = emptyToNull(templateName);
        return this;
    }

    /**
     * @return the name of the sibling field passed as argument to this field's compound type, or null.
     */
    public String argument()
    {
        return argument;
    }

    public Field argument(final String argument)
    {
        this.argument = emptyToNull(argument);
        return this;
    }

    public String arr1Text()
    {
        return arr1Text;
    }

    public Field arr1Text(final String arr1Text)
    {
        this.arr1Text = emptyToNull(arr1Text);
        return this;
    }

    public String arr2Text()
    {
        return arr2Text;
    }

    public Field arr2Text(final String arr2Text)
    {
        this.arr2Text = emptyToNull(arr2Text);
        return this;
    }

    public String condText()
    {
        return condText;
    }

    public Field condText(final String condText)
    {
        this.condText = emptyToNull(condText);
        return this;
    }

    public String vercondText()
    {
        return vercondText;
    }

    public Field vercondText(final String vercondText)
    {
        this.vercondText = emptyToNull(vercondText);
        return this;
    }

    /**
     * @return the name of an accessor whose result is streamed in place of the stored value, or null.
     */
    public String function()
    {
        return function;
    }

    public Field function(final String function)
    {
        this.function = emptyToNull(function);
        return this;
    }

    public String declaredDefault()
    {
        return declaredDefault;
    }

    public Field declaredDefault(final String declaredDefault)
    {
        this.declaredDefault = emptyToNull(declaredDefault);
        return this;
    }

    public String ver1Text()
    {
        return ver1Text;
    }

    public String ver2Text()
    {
        return ver2Text;
    }

    /**
     * @return the first version, packed, in which the field is present or null if unbounded.
     */
    public Long ver1()
    {
        return ver1;
    }

    public Field ver1(final String ver1Text)
    {
        this.ver1Text = emptyToNull(ver1Text);
        this.ver1 = this.ver1Text == null ? null : Version.pack(this.ver1Text);
        return this;
    }

    /**
     * @return the last version, packed, in which the field is present or null if unbounded.
     */
    public Long ver2()
    {
        return ver2;
    }

    public Field ver2(final String ver2Text)
    {
        this.ver2Text = emptyToNull(ver2Text);
        this.ver2 = this.ver2Text == null ? null : Version.pack(this.ver2Text);
        return this;
    }

    public Long userVersion()
    {
        return userVersion;
    }

    public Field userVersion(final Long userVersion)
    {
        this.userVersion = userVersion;
        return this;
    }

    public Long userVersion2()
    {
        return userVersion2;
    }

    public Field userVersion2(final Long userVersion2)
    {
        this.userVersion2 = userVersion2;
        return this;
    }

    public boolean isPublic()
    {
        return isPublic;
    }

    public Field isPublic(final boolean isPublic)
    {
        this.isPublic = isPublic;
        return this;
    }

    /**
     * @return true if the field is declared but never read or written.
     */
    public boolean isAbstract()
    {
        return isAbstract;
    }

    public Field isAbstract(final boolean isAbstract)
    {
        this.isAbstract = isAbstract;
        return this;
    }

    /**
     * @return true if the value is computed by a hand written function before writing.
     */
    public boolean isCalculated()
    {
        return isCalculated;
    }

    public Field isCalculated(final boolean isCalculated)
    {
        this.isCalculated = isCalculated;
        return this;
    }

    public String description()
    {
        return description;
    }

    public Field description(final String description)
    {
        this.description = description == null ? "" : description;
        return this;
    }

    public CompoundType owner()
    {
        return owner;
    }

    void owner(final CompoundType owner)
    {
        this.owner = owner;
    }

    public TypeEntity type()
    {
        return type;
    }

    public Field type(final TypeEntity type)
    {
        this.type = type;
        return this;
    }

    public TypeEntity template()
    {
        return template;
    }

    public Field template(final TypeEntity template)
    {
        this.template = template;
        return this;
    }

    public Expression arr1()
    {
        return arr1;
    }

    public Field arr1(final Expression arr1)
    {
        this.arr1 = arr1;
        return this;
    }

    public Expression arr2()
    {
        return arr2;
    }

    public Field arr2(final Expression arr2)
    {
        this.arr2 = arr2;
        return this;
    }

    public Expression cond()
    {
        return cond;
    }

    public Field cond(final Expression cond)
    {
        this.cond = cond;
        return this;
    }

    public Expression vercond()
    {
        return vercond;
    }

    public Field vercond(final Expression vercond)
    {
        this.vercond = vercond;
        return this;
    }

    public boolean isArray()
    {
        return !arr1.isEmpty();
    }

    /**
     * @return true if an earlier sibling has the same name: the field shares the storage of that sibling.
     */
    public boolean isDuplicate()
    {
        return isDuplicate;
    }

    public void isDuplicate(final boolean isDuplicate)
    {
        this.isDuplicate = isDuplicate;
    }

    /**
     * @return true if the second dimension names an earlier array, giving a distinct length per row.
     */
    public boolean isArr2Dynamic()
    {
        return isArr2Dynamic;
    }

    public void isArr2Dynamic(final boolean isArr2Dynamic)
    {
        this.isArr2Dynamic = isArr2Dynamic;
    }

    public boolean usesArgument()
    {
        return usesArgument;
    }

    public void usesArgument(final boolean usesArgument)
    {
        this.usesArgument = usesArgument;
    }

    /**
     * @return true if hand written code maintains the value, so it is never synthesized from array sizes.
     */
    public boolean isManualUpdate()
    {
        return isManualUpdate;
    }

    public void isManualUpdate(final boolean isManualUpdate)
    {
        this.isManualUpdate = isManualUpdate;
    }

    /**
     * @return the default formatted for a constructor initializer list, or null if the field has none.
     */
    public String defaultValue()
    {
        return defaultValue;
    }

    public void defaultValue(final String defaultValue)
    {
        this.defaultValue = defaultValue;
    }

    /**
     * @return names of later siblings whose first dimension is this field's value.
     */
    public List<String> arr1References()
    {
        return Collections.unmodifiableList(arr1References);
    }

    /**
     * @return names of later siblings whose second dimension is this field's value.
     */
    public List<String> arr2References()
    {
        return Collections.unmodifiableList(arr2References);
    }

    /**
     * @return names of later siblings whose presence condition starts with this field.
     */
    public List<String> condReferences()
    {
        return Collections.unmodifiableList(condReferences);
    }

    public void addArr1Reference(final String name)
    {
        arr1References.add(name);
    }

    public void addArr2Reference(final String name)
    {
        arr2References.add(name);
    }

    public void addCondReference(final String name)
    {
        condReferences.add(name);
    }

    private static String emptyToNull(final String value)
    {
        return value == null || value.isEmpty() ? null : value;
    }

    public String toString()
    {
        return "Field{" +
            "name='" + uniqueName() + '\'' +
            ", type='" + typeName + '\'' +
            '}';
    }
}
