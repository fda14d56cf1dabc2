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

import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators of the schema expression language. Comparisons and the logical operators yield 1 or 0.
 */
public enum Operator
{
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    LOGICAL_AND("&&"),
    LOGICAL_OR("||"),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    MINUS("-"),
    PLUS("+"),
    GREATER(">"),
    LESS("<"),
    DIVIDE("/"),
    MULTIPLY("*");

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

    static
    {
        for (final Operator operator : values())
        {
            BY_SYMBOL.put(operator.symbol, operator);
        }
    }

    private final String symbol;

    Operator(final String symbol)
    {
        this.symbol = symbol;
    }

    public String symbol()
    {
        return symbol;
    }

    public long apply(final long left, final long right)
    {
        switch (this)
        {
            case EQUAL:
                return toLong(left == right);
            case NOT_EQUAL:
                return toLong(left != right);
            case GREATER_OR_EQUAL:
                return toLong(left >= right);
            case LESS_OR_EQUAL:
                return toLong(left <= right);
            case LOGICAL_AND:
                return toLong(left != 0 && right != 0);
            case LOGICAL_OR:
                return toLong(left != 0 || right != 0);
            case BITWISE_AND:
                return left & right;
            case BITWISE_OR:
                return left | right;
            case MINUS:
                return left - right;
            case PLUS:
                return left + right;
            case GREATER:
                return toLong(left > right);
            case LESS:
                return toLong(left < right);
            case DIVIDE:
                if (right == 0)
                {
                    throw new ArithmeticException("Division by zero in expression operator " + symbol);
                }
                return left / right;
            case MULTIPLY:
                return left * right;
            default:
                throw new IllegalStateException("Unknown operator: " + this);
        }
    }

    /**
     * Find the operator with the given textual symbol.
     *
     * @param symbol the operator text, eg: <code>&amp;&amp;</code>.
     * @return the operator or null if the text isn't an operator.
     */
    public static Operator lookup(final String symbol)
    {
        return BY_SYMBOL.get(symbol);
    }

    static long toLong(final boolean value)
    {
        return value ? 1 : 0;
    }
}
