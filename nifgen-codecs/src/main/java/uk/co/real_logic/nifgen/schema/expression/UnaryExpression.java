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

import java.util.Set;

/**
 * Logical negation, the only unary operator.
 */
public final class UnaryExpression extends Expression
{
    private final Expression operand;

    UnaryExpression(final Expression operand)
    {
        this.operand = operand;
    }

    public Expression operand()
    {
        return operand;
    }

    public Expression left()
    {
        return operand;
    }

    public long evaluate(final EvaluationContext context)
    {
        return Operator.toLong(operand.evaluate(context) == 0);
    }

    public String render(final SymbolRenderer renderer, final boolean brackets)
    {
        final String text = "!" + renderOperand(operand, renderer);
        return brackets ? "(" + text + ")" : text;
    }

    void collectSymbols(final Set<String> symbols)
    {
        operand.collectSymbols(symbols);
    }

    void collectTypeChecks(final Set<String> typeNames)
    {
        operand.collectTypeChecks(typeNames);
    }

    public String toString()
    {
        return "!" + sourceOperand(operand);
    }
}
