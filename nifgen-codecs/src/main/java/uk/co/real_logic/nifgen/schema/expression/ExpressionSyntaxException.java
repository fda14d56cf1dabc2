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
package uk.co.real_logic.nifgen.schema.expression;

public class ExpressionSyntaxException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    private final String expression;

    public ExpressionSyntaxException(final String message, final String expression)
    {
        super("expression syntax error: " + message + " in '" + expression + "'");
        this.expression = expression;
    }

    public String expression()
    {
        return expression;
    }
}
