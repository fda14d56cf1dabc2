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

public final class BinaryExpression extends Expression
{
    private final Expression left;
    private final Operator operator;
    private final Expression right;

    BinaryExpression(final Expression left, final Operator operator, final Expression right)
    {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Operator operator()
    {
        return operator;
    }

    public Expression left()
    {
        return left;
    }

    public Expression right()
    {
        return right;
    }

    public long evaluate(final EvaluationContext context)
    {
        final long leftValue = left.evaluate(context);
        switch (operator)
        {
            case LOGICAL_AND:
                return leftValue == 0 ? 0 : Operator.toLong(right.evaluate(context) != 0);
            case LOGICAL_OR:
                return leftValue != 0 ? 1 : Operator.toLong(right.evaluate(context) != 0);
            default:
                return operator.apply(leftValue, right.evaluate(context));
        }
    }

    public String render(final SymbolRenderer renderer, final boolean brackets)
    {
        final String text =
            renderOperand(left, renderer) + " " + operator.symbol() + " " + renderOperand(right, renderer);
        return brackets ? "(" + text + ")" : text;
    }

    void collectSymbols(final Set<String> symbols)
    {
        left.collectSymbols(symbols);
        right.collectSymbols(symbols);
    }

    void collectTypeChecks(final Set<String> typeNames)
    {
        left.collectTypeChecks(typeNames);
        right.collectTypeChecks(typeNames);
    }

    public String toString()
    {
        return sourceOperand(left) + " " + operator.symbol() + " " + sourceOperand(right);
    }
}
