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

import org.junit.Test;
import uk.co.real_logic.nifgen.schema.Names;
import uk.co.real_logic.nifgen.schema.UnresolvedReferenceException;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

public class ExpressionParserTest
{
    private final ExpressionParser parser = new ExpressionParser("NiNode"::equals);
    private final Map<String, Long> values = new HashMap<>();
    private final EvaluationContext context = EvaluationContext.of(values);

    @Test
    public void shouldParseAbsentExpressionAsEmpty()
    {
        assertSame(Expression.EMPTY, parser.parse(null));
        assertSame(Expression.EMPTY, parser.parse("   "));
        assertTrue(parser.parse("").isEmpty());
        assertEquals("", parser.parse("").render(Names::memberName));
    }

    @Test
    public void shouldParseTerminals()
    {
        final Expression decimal = parser.parse("-1");
        assertThat(decimal, instanceOf(Literal.class));
        assertEquals(-1L, decimal.evaluate(context));

        final Expression hex = parser.parse("0x0A");
        assertThat(hex, instanceOf(Literal.class));
        assertEquals(10L, hex.evaluate(context));
        assertEquals("0x0A", hex.render(Names::memberName));

        final Expression version = parser.parse("10.0.1.0");
        assertThat(version, instanceOf(VersionLiteral.class));
        assertEquals(0x0A000100L, version.evaluate(context));
        assertEquals("0x0A000100", version.render(Names::memberName));

        final Expression typeCheck = parser.parse("NiNode");
        assertThat(typeCheck, instanceOf(TypeCheck.class));
        assertEquals("IsDerivedType(NiNode::TYPE)", typeCheck.render(Names::memberName));

        final Expression symbol = parser.parse("Num Vertices");
        assertThat(symbol, instanceOf(SymbolRef.class));
        assertEquals("Num Vertices", symbol.leftName());
    }

    @Test
    public void shouldSplitOnFirstOperator()
    {
        final BinaryExpression expression = (BinaryExpression)parser.parse("Num Vertices - 1");

        assertEquals(Operator.MINUS, expression.operator());
        assertEquals("Num Vertices", expression.leftName());
        assertThat(expression.right(), instanceOf(Literal.class));
    }

    @Test
    public void shouldMatchTwoCharacterOperatorsFirst()
    {
        assertEquals(Operator.GREATER_OR_EQUAL, ((BinaryExpression)parser.parse("Count >= 2")).operator());
        assertEquals(Operator.LOGICAL_AND, ((BinaryExpression)parser.parse("A && B")).operator());
        assertEquals(Operator.BITWISE_AND, ((BinaryExpression)parser.parse("A & B")).operator());
    }

    @Test
    public void shouldNestOperatorsToTheRight()
    {
        final BinaryExpression expression = (BinaryExpression)parser.parse("A == 1 && B == 2");

        assertEquals(Operator.EQUAL, expression.operator());
        assertEquals(Operator.LOGICAL_AND, ((BinaryExpression)expression.right()).operator());
        assertEquals(4L, parser.parse("4 - 1 - 1").evaluate(context));
    }

    @Test
    public void shouldUseBracketedLeftSideAsOperand()
    {
        final BinaryExpression expression = (BinaryExpression)parser.parse("(Flags & 4) != 0");

        assertEquals(Operator.NOT_EQUAL, expression.operator());
        assertEquals(Operator.BITWISE_AND, ((BinaryExpression)expression.left()).operator());

        values.put("Flags", 6L);
        assertEquals(1L, expression.evaluate(context));
        values.put("Flags", 3L);
        assertEquals(0L, expression.evaluate(context));
    }

    @Test
    public void shouldStripBracketsAroundWholeExpression()
    {
        final Expression expression = parser.parse("(Num Strips)");

        assertThat(expression, instanceOf(SymbolRef.class));
    }

    @Test
    public void shouldNegateRemainder()
    {
        final Expression expression = parser.parse("!Has Normals");
        assertThat(expression, instanceOf(UnaryExpression.class));

        values.put("Has Normals", 0L);
        assertEquals(1L, expression.evaluate(context));
        values.put("Has Normals", 5L);
        assertEquals(0L, expression.evaluate(context));
    }

    @Test
    public void shouldEvaluateOperators()
    {
        values.put("A", 12L);
        values.put("B", 5L);

        assertEquals(17L, parser.parse("A + B").evaluate(context));
        assertEquals(60L, parser.parse("A * B").evaluate(context));
        assertEquals(2L, parser.parse("A / B").evaluate(context));
        assertEquals(4L, parser.parse("A & B").evaluate(context));
        assertEquals(13L, parser.parse("A | B").evaluate(context));
        assertEquals(1L, parser.parse("A > B").evaluate(context));
        assertEquals(0L, parser.parse("A < B").evaluate(context));
        assertEquals(1L, parser.parse("A <= 12").evaluate(context));
        assertEquals(1L, parser.parse("A || 0").evaluate(context));
        assertEquals(0L, parser.parse("(A == 12) && (B == 4)").evaluate(context));
    }

    @Test
    public void shouldEvaluateLiteralOperands()
    {
        values.put("y", 1L);

        assertEquals(3L, parser.parse("99 & 15").evaluate(context));
        assertEquals(1L, parser.parse("(99&15)&&y").evaluate(context));
        assertEquals(1L, parser.parse("1 == 1").evaluate(context));
        assertEquals(0L, parser.parse("1 != 1").evaluate(context));

        values.put("y", 0L);
        assertEquals(0L, parser.parse("(99&15)&&y").evaluate(context));
    }

    @Test
    public void shouldEvaluateTypeChecksAgainstContext()
    {
        final EvaluationContext nodeContext = new EvaluationContext()
        {
            public long valueOf(final String name)
            {
                throw new UnresolvedReferenceException(null, null, name);
            }

            public boolean isDerivedType(final String blockName)
            {
                return "NiNode".equals(blockName);
            }
        };

        assertEquals(1L, parser.parse("NiNode").evaluate(nodeContext));
        assertEquals(0L, parser.parse("NiNode").evaluate(context));
    }

    @Test(expected = ArithmeticException.class)
    public void shouldRejectDivisionByZero()
    {
        values.put("A", 1L);
        parser.parse("A / 0").evaluate(context);
    }

    @Test
    public void shouldReportUndefinedSymbols()
    {
        try
        {
            parser.parse("Missing + 1").evaluate(context);
            fail("Expected an undefined name to be reported");
        }
        catch (final UnresolvedReferenceException ex)
        {
            assertEquals("Missing", ex.symbol());
        }
    }

    @Test
    public void shouldRenderWithBracketsAndPrefix()
    {
        final Expression expression = parser.parse("(Flags & 4) != 0");

        assertEquals("((flags & 4) != 0)", expression.render(Names::memberName));
        assertEquals("(flags & 4) != 0", expression.render(Names::memberName, false));
        assertEquals("(info.userVersion >= 11)", parser.parse("User Version >= 11").render("info.", Names::memberName));
        assertEquals("(!hasNormals)", parser.parse("!Has Normals").render(Names::memberName));
    }

    @Test
    public void shouldDescribeStructure()
    {
        assertTrue(parser.parse("3").hasStaticSize());
        assertFalse(parser.parse("-3").hasStaticSize());
        assertFalse(parser.parse("Num Strips").hasStaticSize());

        assertTrue(parser.parse("Num Strips").hasPlainRight());
        assertTrue(parser.parse("Num Strips & 1").hasPlainRight());
        assertFalse(parser.parse("Num Strips - Num Extra").hasPlainRight());

        final Expression expression = parser.parse("A == 1 && ARG == 2 && NiNode");
        assertThat(expression.symbols(), contains("A", "ARG"));
        assertTrue(expression.mentions(SymbolRef.ARGUMENT));
        assertThat(expression.typeChecks(), contains("NiNode"));
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectIntegerOutOfRange()
    {
        parser.parse("Num Vertices + 99999999999999999999");
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectHexIntegerOutOfRange()
    {
        parser.parse("0x1FFFFFFFFFFFFFFFF");
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectVersionOutOfRange()
    {
        parser.parse("99999999999999999999.0.0.0");
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectUnclosedBracket()
    {
        parser.parse("(A == 1");
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectUnopenedBracket()
    {
        parser.parse("A == 1)");
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectMissingOperatorAfterBracket()
    {
        parser.parse("(A) B");
    }

    @Test(expected = ExpressionSyntaxException.class)
    public void shouldRejectMissingOperand()
    {
        parser.parse("A ==");
    }

    @Test
    public void shouldKeepExpressionTextInSyntaxErrors()
    {
        try
        {
            parser.parse("()");
            fail("Expected empty brackets to be rejected");
        }
        catch (final ExpressionSyntaxException ex)
        {
            assertEquals("()", ex.expression());
        }
    }
}
