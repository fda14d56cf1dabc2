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
package uk.co.real_logic.nifgen.schema;

import uk.co.real_logic.nifgen.schema.expression.Expression;
import uk.co.real_logic.nifgen.schema.expression.Literal;
import uk.co.real_logic.nifgen.schema.expression.SymbolRef;
import uk.co.real_logic.nifgen.schema.ir.*;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Derives the per field facts that code generation depends upon: duplicate status, dynamic second dimensions,
 * which later fields use a field as their size or condition, argument use and the default value. Also computes
 * whether every type transitively carries object references.
 * <p>
 * Each compound is resolved in a single pass over its fields using name indexes.
 */
public final class FieldResolver
{
    private final SchemaContext context;

    public FieldResolver(final SchemaContext context)
    {
        this.context = context;
    }

    public void resolve()
    {
        for (final CompoundType compound : context.structures())
        {
            resolve(compound);
        }

        for (final CompoundType compound : context.structures())
        {
            compound.hasLinks(reaches(compound, TypeEntity::hasLinks));
            compound.hasCrossRefs(reaches(compound, TypeEntity::hasCrossRefs));
        }
    }

    void resolve(final CompoundType compound)
    {
        final Map<String, List<Field>> earlierByName = new HashMap<>();
        final Set<String> earlierWithoutSuffix = new HashSet<>();
        final Set<String> earlierArrays = new HashSet<>();
        boolean compoundUsesArgument = false;

        for (final Field field : compound.fields())
        {
            final String name = field.name();
            final boolean hasSuffix = !field.suffix().isEmpty();

            field.isDuplicate(!hasSuffix && earlierWithoutSuffix.contains(name));

            final String arr2Name = field.arr2().leftName();
            field.isArr2Dynamic(arr2Name != null && earlierArrays.contains(arr2Name));

            addBackReferences(earlierByName, field.arr1(), field, Field::addArr1Reference);
            addBackReferences(earlierByName, field.arr2(), field, Field::addArr2Reference);
            addBackReferences(earlierByName, field.cond(), field, Field::addCondReference);

            final boolean usesArgument = field.cond().mentions(SymbolRef.ARGUMENT) ||
                field.arr1().mentions(SymbolRef.ARGUMENT) ||
                field.arr2().mentions(SymbolRef.ARGUMENT);
            field.usesArgument(usesArgument);
            compoundUsesArgument |= usesArgument;

            field.defaultValue(defaultValue(field));

            earlierByName.computeIfAbsent(name, (key) -> new ArrayList<>()).add(field);
            if (!hasSuffix)
            {
                earlierWithoutSuffix.add(name);
            }
            if (field.isArray())
            {
                earlierArrays.add(name);
            }
        }

        compound.usesArgument(compoundUsesArgument);
    }

    private interface ReferenceAdder
    {
        void add(Field referenced, String referencingName);
    }

    private static void addBackReferences(
        final Map<String, List<Field>> earlierByName,
        final Expression expression,
        final Field referencing,
        final ReferenceAdder adder)
    {
        final String leftName = expression.leftName();
        if (leftName == null || !expression.hasPlainRight())
        {
            return;
        }

        final List<Field> referenced = earlierByName.get(leftName);
        if (referenced != null)
        {
            for (final Field field : referenced)
            {
                adder.add(field, referencing.name());
            }
        }
    }

    /**
     * The default value formatted for a constructor initializer list.
     *
     * @param field the field.
     * @return the default or null if the field has none.
     */
    String defaultValue(final Field field)
    {
        String value = field.declaredDefault();
        if (value == null && !field.isArray() && field.arr2().isEmpty())
        {
            value = synthesizedDefault(field.type());
        }

        if (value == null)
        {
            return null;
        }

        if (value.length() >= 2 && value.charAt(0) == '(' && value.charAt(value.length() - 1) == ')')
        {
            value = value.substring(1, value.length() - 1);
        }

        final String className = context.className(field.typeName());
        if (field.isArray())
        {
            if (field.arr1().hasStaticSize())
            {
                final long count = ((Literal)field.arr1().left()).value();
                final String separator = ",(" + className + ")";
                final String[] elements = value.split(" ", (int)Math.min(count + 1, Integer.MAX_VALUE));
                return count + separator + String.join(separator, elements);
            }

            return value;
        }

        final ValueFamily family = family(field.type());
        if (family == ValueFamily.STRING)
        {
            return "\"" + value + "\"";
        }
        else if (family == ValueFamily.FLOAT)
        {
            return floatLiteral(value);
        }
        else if (family == ValueFamily.LINK || family == ValueFamily.CROSS_REF ||
            family == ValueFamily.BOOLEAN || "Vector3".equals(field.typeName()))
        {
            return value;
        }
        else if (value.indexOf(',') != -1)
        {
            return value;
        }

        return "(" + className + ")" + value;
    }

    private static String synthesizedDefault(final TypeEntity type)
    {
        return type.match(
            (basic) ->
            {
                switch (basic.family())
                {
                    case INTEGER:
                    case OTHER:
                        return basic.isTemplateParameter() ? null : "0";
                    case BOOLEAN:
                        return "false";
                    case LINK:
                    case CROSS_REF:
                        return "NULL";
                    case FLOAT:
                        return "0.0";
                    case STRING_OFFSET:
                        return "-1";
                    default:
                        return null;
                }
            },
            (enumType) -> "0",
            (compound) -> null,
            (block) -> null);
    }

    private static ValueFamily family(final TypeEntity type)
    {
        return type instanceof BasicType ? ((BasicType)type).family() : ValueFamily.OTHER;
    }

    /**
     * Print a floating point default with at least one decimal place and a float suffix,
     * <code>1</code> becomes <code>1.0f</code>. Symbolic defaults such as a named constant pass unchanged.
     */
    static String floatLiteral(final String value)
    {
        final BigDecimal decimal;
        try
        {
            decimal = new BigDecimal(value.trim());
        }
        catch (final NumberFormatException ex)
        {
            return value;
        }

        final BigDecimal stripped = decimal.stripTrailingZeros();
        final String text = stripped.scale() <= 0 ?
            stripped.toBigInteger().toString() + ".0" :
            stripped.toPlainString();
        return text + "f";
    }

    /**
     * Walk every compound contained by value, however deeply nested or mutually contained, looking for a
     * field whose non-compound type matches.
     */
    private static boolean reaches(final CompoundType compound, final Predicate<TypeEntity> matches)
    {
        final Set<CompoundType> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        final Deque<CompoundType> pending = new ArrayDeque<>();
        visited.add(compound);
        pending.push(compound);
        while (!pending.isEmpty())
        {
            for (final Field field : pending.pop().fields())
            {
                final TypeEntity type = field.type();
                if (type instanceof CompoundType)
                {
                    if (visited.add((CompoundType)type))
                    {
                        pending.push((CompoundType)type);
                    }
                }
                else if (matches.test(type))
                {
                    return true;
                }
            }
        }

        return false;
    }
}
