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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Parsed form of a schema expression: array dimensions, presence conditions and version conditions.
 * <p>
 * The family is closed: {@link Literal}, {@link VersionLiteral}, {@link TypeCheck}, {@link SymbolRef},
 * {@link UnaryExpression}, {@link BinaryExpression} and the {@link #EMPTY} expression of an absent attribute.
 * Instances are immutable.
 */
public abstract class Expression
{
    public static final Expression EMPTY = new Empty();

    Expression()
    {
    }

    public abstract long evaluate(EvaluationContext context);

    /**
     * Render the expression as target language text.
     *
     * @param renderer renders the access to every symbolic terminal.
     * @param brackets whether a unary or binary expression at the top level is bracketed. Nested
     *                 sub-expressions are always bracketed.
     * @return the rendered text.
     */
    public abstract String render(SymbolRenderer renderer, boolean brackets);

    public String render(final SymbolRenderer renderer)
    {
        return render(renderer, true);
    }

    public String render(final String prefix, final UnaryOperator<String> nameFilter)
    {
        return render((name) -> prefix + nameFilter.apply(name), true);
    }

    public boolean isEmpty()
    {
        return false;
    }

    /**
     * @return the left hand side of a binary expression, the operand of a unary one, or the terminal itself.
     */
    public Expression left()
    {
        return this;
    }

    /**
     * @return the right hand side of a binary expression, otherwise null.
     */
    public Expression right()
    {
        return null;
    }

    /**
     * @return the symbolic name on the left hand side, or null if the left side isn't a plain symbol.
     */
    public String leftName()
    {
        final Expression left = left();
        return left instanceof SymbolRef ? ((SymbolRef)left).name() : null;
    }

    /**
     * An array dimension whose left side is a non-negative integer literal has a size known at generation time.
     *
     * @return true if the left side is a non-negative integer literal.
     */
    public boolean hasStaticSize()
    {
        final Expression left = left();
        return left instanceof Literal && ((Literal)left).value() >= 0;
    }

    /**
     * A reference to another field that is neither masked nor offset by a symbolic value: the right hand side is
     * absent or a numeric literal.
     *
     * @return true if the right side is absent or numeric.
     */
    public boolean hasPlainRight()
    {
        final Expression right = right();
        return right == null || right instanceof Literal;
    }

    /**
     * @return the symbolic names mentioned anywhere in the expression, in order of first appearance.
     */
    public Set<String> symbols()
    {
        final Set<String> symbols = new LinkedHashSet<>();
        collectSymbols(symbols);
        return symbols;
    }

    public boolean mentions(final String name)
    {
        return symbols().contains(name);
    }

    /**
     * @return the block names tested by type checks, in order of first appearance.
     */
    public Set<String> typeChecks()
    {
        final Set<String> typeNames = new LinkedHashSet<>();
        collectTypeChecks(typeNames);
        return typeNames.isEmpty() ? Collections.emptySet() : typeNames;
    }

    abstract void collectSymbols(Set<String> symbols);

    void collectTypeChecks(final Set<String> typeNames)
    {
    }

    static String sourceOperand(final Expression operand)
    {
        return operand instanceof BinaryExpression || operand instanceof UnaryExpression ?
            "(" + operand + ")" : operand.toString();
    }

    static String renderOperand(final Expression operand, final SymbolRenderer renderer)
    {
        return operand.render(renderer, true);
    }

    private static final class Empty extends Expression
    {
        public long evaluate(final EvaluationContext context)
        {
            throw new IllegalStateException("Cannot evaluate an empty expression");
        }

        public String render(final SymbolRenderer renderer, final boolean brackets)
        {
            return "";
        }

        public boolean isEmpty()
        {
            return true;
        }

        public Expression left()
        {
            return null;
        }

        public boolean hasStaticSize()
        {
            return false;
        }

        void collectSymbols(final Set<String> symbols)
        {
        }

        public String toString()
        {
            return "";
        }
    }
}
