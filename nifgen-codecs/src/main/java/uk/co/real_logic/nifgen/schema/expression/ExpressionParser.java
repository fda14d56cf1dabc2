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

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Parses the textual expressions of a schema into {@link Expression} trees.
 * <p>
 * Partitioning follows the schema language rather than C precedence: a leading <code>!</code> negates the whole
 * remainder, a leading bracketed expression forms the left hand side of the following operator, otherwise the
 * first operator found scanning from the left splits the text and the right hand side is parsed recursively.
 * Two character operators are matched before one character operators.
 */
public final class ExpressionParser
{
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
    private static final Pattern HEX_INTEGER = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern VERSION = Pattern.compile("[0-9]+\\.[0-9]+\\.[0-9]+\\.[0-9]+");

    private final Predicate<String> isBlockName;

    public ExpressionParser()
    {
        this((name) -> false);
    }

    /**
     * @param isBlockName tests whether a terminal names a block type, such terminals become {@link TypeCheck}s.
     */
    public ExpressionParser(final Predicate<String> isBlockName)
    {
        this.isBlockName = isBlockName;
    }

    /**
     * Parse an expression.
     *
     * @param text the expression text, null or blank for an absent expression.
     * @return the parsed expression, {@link Expression#EMPTY} for null or blank text.
     * @throws ExpressionSyntaxException if brackets don't match or an operator is missing.
     */
    public Expression parse(final String text)
    {
        if (text == null)
        {
            return Expression.EMPTY;
        }

        final String trimmed = text.trim();
        if (trimmed.isEmpty())
        {
            return Expression.EMPTY;
        }

        checkBrackets(trimmed);
        return parseExpression(trimmed);
    }

    private Expression parseExpression(final String text)
    {
        if (INTEGER.matcher(text).matches())
        {
            final long value = parseNumber(text, 10, text);
            return new Literal(value, Long.toString(value));
        }

        if (text.charAt(0) == '!')
        {
            return new UnaryExpression(parseOperand(text.substring(1).trim(), text));
        }

        if (text.charAt(0) == '(')
        {
            return parseBracketed(text);
        }

        for (int i = 0; i < text.length(); i++)
        {
            final char ch = text.charAt(i);
            if (ch == ' ')
            {
                continue;
            }

            if (ch == '(' || ch == ')')
            {
                throw new ExpressionSyntaxException("expected operator before '" + text.substring(i) + "'", text);
            }

            final Operator operator = operatorAt(text, i);
            if (operator != null)
            {
                final String left = text.substring(0, i).trim();
                final String right = text.substring(i + operator.symbol().length()).trim();
                return new BinaryExpression(parseOperand(left, text), operator, parseOperand(right, text));
            }
        }

        return parseTerminal(text);
    }

    private Expression parseBracketed(final String text)
    {
        final int closing = closingBracket(text);
        final String left = text.substring(1, closing).trim();
        final int length = text.length();

        int operatorStart = closing + 1;
        while (operatorStart < length && text.charAt(operatorStart) == ' ')
        {
            operatorStart++;
        }

        if (operatorStart >= length)
        {
            if (left.isEmpty())
            {
                throw new ExpressionSyntaxException("empty brackets", text);
            }
            return parseExpression(left);
        }

        final Operator operator = operatorAt(text, operatorStart);
        if (operator == null)
        {
            throw new ExpressionSyntaxException(
                "expected operator at '" + text.substring(operatorStart) + "'", text);
        }

        final String right = text.substring(operatorStart + operator.symbol().length()).trim();
        return new BinaryExpression(parseOperand(left, text), operator, parseOperand(right, text));
    }

    private Expression parseOperand(final String operand, final String text)
    {
        if (operand.isEmpty())
        {
            throw new ExpressionSyntaxException("missing operand", text);
        }

        return parseExpression(operand);
    }

    private static long parseNumber(final String digits, final int radix, final String text)
    {
        try
        {
            return Long.parseLong(digits, radix);
        }
        catch (final NumberFormatException ex)
        {
            throw new ExpressionSyntaxException("number out of range", text);
        }
    }

    private Expression parseTerminal(final String text)
    {
        if (HEX_INTEGER.matcher(text).matches())
        {
            return new Literal(parseNumber(text.substring(2), 16, text), text);
        }

        if (VERSION.matcher(text).matches())
        {
            try
            {
                return new VersionLiteral(text);
            }
            catch (final IllegalArgumentException ex)
            {
                throw new ExpressionSyntaxException("version out of range", text);
            }
        }

        if (isBlockName.test(text))
        {
            return new TypeCheck(text);
        }

        return new SymbolRef(text);
    }

    private static Operator operatorAt(final String text, final int index)
    {
        if (index + 2 <= text.length())
        {
            final Operator twoCharacters = Operator.lookup(text.substring(index, index + 2));
            if (twoCharacters != null)
            {
                return twoCharacters;
            }
        }

        return Operator.lookup(text.substring(index, index + 1));
    }

    private static int closingBracket(final String text)
    {
        int depth = 0;
        for (int i = 0; i < text.length(); i++)
        {
            final char ch = text.charAt(i);
            if (ch == '(')
            {
                depth++;
            }
            else if (ch == ')')
            {
                depth--;
                if (depth == 0)
                {
                    return i;
                }
            }
        }

        throw new ExpressionSyntaxException("non-matching brackets", text);
    }

    private static void checkBrackets(final String text)
    {
        int depth = 0;
        for (int i = 0; i < text.length(); i++)
        {
            final char ch = text.charAt(i);
            if (ch == '(')
            {
                depth++;
            }
            else if (ch == ')')
            {
                depth--;
                if (depth < 0)
                {
                    throw new ExpressionSyntaxException("non-matching brackets", text);
                }
            }
        }

        if (depth != 0)
        {
            throw new ExpressionSyntaxException("non-matching brackets", text);
        }
    }
}
