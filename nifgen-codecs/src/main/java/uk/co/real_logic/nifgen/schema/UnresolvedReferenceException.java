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

/**
 * A symbolic name in an expression that isn't a field of the enclosing type, an inherited field, the bound
 * argument or a field of an enclosing scope.
 */
public class UnresolvedReferenceException extends IllegalStateException
{
    private static final long serialVersionUID = 1L;

    private final String typeName;
    private final String fieldName;
    private final String symbol;

    public UnresolvedReferenceException(final String typeName, final String fieldName, final String symbol)
    {
        super(typeName == null ?
            String.format("Undefined name '%s'", symbol) :
            String.format("Unresolved reference '%s' in %s.%s", symbol, typeName, fieldName));
        this.typeName = typeName;
        this.fieldName = fieldName;
        this.symbol = symbol;
    }

    public String typeName()
    {
        return typeName;
    }

    public String fieldName()
    {
        return fieldName;
    }

    public String symbol()
    {
        return symbol;
    }
}
