package com.juanpa.spice.transpiler.parser;

import com.juanpa.spice.transpiler.ast.expressions.*;
import com.juanpa.spice.transpiler.ast.statements.ExpressionStatement;
import com.juanpa.spice.transpiler.lexer.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest
{
	private static Expression expression(String source)
	{
		return ((ExpressionStatement) SpiceParserTest.single(source)).getExpression();
	}

	/**
	 * Parses `v = SOURCE` and returns the right-hand side.
	 */
	private static Expression value(String source)
	{
		return ((AssignmentExpression) expression("v = " + source)).getValue();
	}

	private static String parseError(String source)
	{
		return assertThrows(ParseException.class, () -> SpiceParserTest.parse(source)).getMessage();
	}

	@Test
	public void andBindsTighterThanOr()
	{
		assertEquals("(a or (b and c))", value("a or b and c").toString());
	}

	@Test
	public void exponentIsRightAssociative()
	{
		assertEquals("(2 ** (3 ** 2))", value("2 ** 3 ** 2").toString());
	}

	@Test
	public void multiplicationBindsTighterThanAddition()
	{
		assertEquals("(a + (b * c))", value("a + b * c").toString());
		assertEquals("((a - b) - c)", value("a - b - c").toString());
		assertEquals("((a + b) * c)", value("(a + b) * c").toString());
	}

	@Test
	public void comparisonLevelsNestInOrder()
	{
		assertEquals("((a + 1) < b)", value("a + 1 < b").toString());
		assertEquals("((a < b) == c)", value("a < b == c").toString());
		assertEquals("((a == b) in c)", value("a == b in c").toString());
		assertEquals("((x > 0) and (y > 0))", value("x > 0 and y > 0").toString());
	}

	@Test
	public void twoWordOperatorsKeepBothWords()
	{
		BinaryExpression notIn = (BinaryExpression) value("x not in items");
		assertEquals("not in", notIn.getOperatorText());

		BinaryExpression isNot = (BinaryExpression) value("x is not None");
		assertEquals("is not", isNot.getOperatorText());
		assertEquals(LiteralKind.NONE, ((LiteralExpression) isNot.getRight()).getKind());
	}

	@Test
	public void unaryOperatorsNest()
	{
		UnaryExpression not = (UnaryExpression) value("not not ready");
		assertEquals("not", not.getOperator().getLexeme());
		assertTrue(not.getOperand() instanceof UnaryExpression);

		assertEquals("((- x) + 1)", value("-x + 1").toString());
	}

	@Test
	public void assignmentIsRightAssociative()
	{
		AssignmentExpression outer = (AssignmentExpression) expression("a = b = 1");

		assertEquals("a", ((IdentifierExpression) outer.getTarget()).getName());
		assertTrue(outer.getValue() instanceof AssignmentExpression);
	}

	@Test
	public void compoundAssignmentKeepsOperator()
	{
		AssignmentExpression assignment = (AssignmentExpression) expression("self.count += 1");

		assertEquals("+=", assignment.getOperator().getLexeme());
		assertTrue(assignment.getTarget() instanceof AttributeExpression);
	}

	@Test
	public void invalidAssignmentTargetIsRejected()
	{
		assertEquals("Invalid assignment target at line 1", parseError("f() = 1"));
	}

	@Test
	public void missingOperandIsReported()
	{
		assertEquals("Expected expression after '=' at line 1", parseError("x ="));
		assertEquals("Expected expression after '+' at line 1", parseError("x = 1 +"));
	}

	@Test
	public void sliceComponentsAreAbsentWhenElided()
	{
		SliceExpression all = slice("arr[:]");
		assertNull(all.getStart());
		assertNull(all.getStop());
		assertNull(all.getStep());

		SliceExpression from = slice("arr[1:]");
		assertEquals("1", ((LiteralExpression) from.getStart()).getValue());
		assertNull(from.getStop());
		assertNull(from.getStep());

		SliceExpression to = slice("arr[:5]");
		assertNull(to.getStart());
		assertEquals("5", ((LiteralExpression) to.getStop()).getValue());
		assertNull(to.getStep());

		SliceExpression stepped = slice("arr[::2]");
		assertNull(stepped.getStart());
		assertNull(stepped.getStop());
		assertEquals("2", ((LiteralExpression) stepped.getStep()).getValue());

		SliceExpression full = slice("arr[1:5:2]");
		assertNotNull(full.getStart());
		assertNotNull(full.getStop());
		assertNotNull(full.getStep());

		SliceExpression negative = slice("arr[:-1]");
		assertTrue(negative.getStop() instanceof UnaryExpression);
	}

	private static SliceExpression slice(String source)
	{
		SubscriptExpression subscript = (SubscriptExpression) value(source);
		return (SliceExpression) subscript.getIndex();
	}

	@Test
	public void plainIndexIsNotASlice()
	{
		SubscriptExpression subscript = (SubscriptExpression) value("matrix[i][j + 1]");

		assertTrue(subscript.getObject() instanceof SubscriptExpression);
		assertTrue(subscript.getIndex() instanceof BinaryExpression);
	}

	@Test
	public void emptySubscriptIsRejected()
	{
		assertEquals("Empty subscript not allowed at line 1", parseError("x = arr[]"));
	}

	@Test
	public void callsSeparateNamedArguments()
	{
		CallExpression call = (CallExpression) expression("print(x, \"y\", sep=\", \", end=\"\")");

		List<Expression> arguments = call.getArguments();
		assertEquals(4, arguments.size());
		assertTrue(arguments.get(0) instanceof IdentifierExpression);
		ArgumentExpression sep = (ArgumentExpression) arguments.get(2);
		assertEquals("sep", sep.getName());
		assertEquals("\", \"", ((LiteralExpression) sep.getValue()).getValue());
	}

	@Test
	public void newlinesInsideBracketsAreIgnored()
	{
		CallExpression call = (CallExpression) expression("total(\n    1,\n    2\n)");
		assertEquals(2, call.getArguments().size());

		LiteralExpression list = (LiteralExpression) value("[\n    1,\n    2,\n]");
		assertEquals(LiteralKind.LIST, list.getKind());
		assertEquals(2, list.getElements().size());
	}

	@Test
	public void logicalOperatorMayStartTheNextLine()
	{
		assertEquals("(a or b)", value("a\n    or b").toString());
	}

	@Test
	public void parsesContainerLiterals()
	{
		assertEquals(LiteralKind.DICT, ((LiteralExpression) value("{}")).getKind());
		assertEquals(LiteralKind.SET, ((LiteralExpression) value("{1, 2}")).getKind());
		assertEquals(0, ((LiteralExpression) value("()")).getElements().size());
		assertEquals(LiteralKind.TUPLE, ((LiteralExpression) value("(1,)")).getKind());
		assertEquals(1, ((LiteralExpression) value("(1,)")).getElements().size());
		assertTrue(value("(1)") instanceof LiteralExpression);
		assertEquals(LiteralKind.NUMBER, ((LiteralExpression) value("(1)")).getKind());

		LiteralExpression dict = (LiteralExpression) value("{\"a\": 1, \"b\": [2, 3],}");
		assertEquals(LiteralKind.DICT, dict.getKind());
		DictEntry second = (DictEntry) dict.getElements().get(1);
		assertEquals(LiteralKind.LIST, ((LiteralExpression) second.getValue()).getKind());
	}

	@Test
	public void parsesComprehensions()
	{
		ComprehensionExpression list = (ComprehensionExpression) value("[x * 2 for x in items if x > 0]");
		assertEquals(ComprehensionKind.LIST, list.getKind());
		assertTrue(list.getElement() instanceof BinaryExpression);
		assertNotNull(list.getCondition());

		ComprehensionExpression dict = (ComprehensionExpression) value("{k: v for k, v in pairs}");
		assertEquals(ComprehensionKind.DICT, dict.getKind());
		assertEquals("k", ((IdentifierExpression) dict.getKey()).getName());
		assertEquals(LiteralKind.TUPLE, ((LiteralExpression) dict.getTarget()).getKind());

		ComprehensionExpression set = (ComprehensionExpression) value("{x for x in xs}");
		assertEquals(ComprehensionKind.SET, set.getKind());
		assertNull(set.getCondition());

		ComprehensionExpression generator = (ComprehensionExpression) value("(f(x) for x in range(len(xs)))");
		assertEquals(ComprehensionKind.GENERATOR, generator.getKind());
		assertTrue(generator.getIterable() instanceof CallExpression);
	}

	@Test
	public void unterminatedComprehensionIsReported()
	{
		assertEquals("Unterminated comprehension at line 1", parseError("x = [y for y in items"));
	}

	@Test
	public void parsesBothLambdaForms()
	{
		LambdaExpression typed = (LambdaExpression) value("lambda(x: int, y: int): int -> { x + y }");
		assertEquals(2, typed.getParameters().size());
		assertEquals("int", typed.getParameters().get(0).getTypeAnnotation());
		assertEquals("int", typed.getReturnType());
		assertTrue(typed.getBody() instanceof BinaryExpression);

		LambdaExpression pythonStyle = (LambdaExpression) value("lambda a, b: a * b");
		assertEquals(2, pythonStyle.getParameters().size());
		assertNull(pythonStyle.getReturnType());

		LambdaExpression bare = (LambdaExpression) value("lambda() -> 42");
		assertTrue(bare.getParameters().isEmpty());
	}

	@Test
	public void literalsKeepTheirSourceText()
	{
		assertEquals("f\"{name}!\"", ((LiteralExpression) value("f\"{name}!\"")).getValue());
		assertEquals(LiteralKind.REGEX, ((LiteralExpression) value("re\"[a-z]+\"")).getKind());
		assertEquals("True", ((LiteralExpression) value("True")).getValue());
		assertEquals(LiteralKind.BOOLEAN, ((LiteralExpression) value("False")).getKind());
	}

	@Test
	public void identifierKeepsItsToken()
	{
		IdentifierExpression identifier = (IdentifierExpression) value("answer");
		Token token = identifier.getNameToken();

		assertEquals("answer", token.getLexeme());
		assertEquals(1, identifier.getLine());
	}
}
