package com.juanpa.spice.transpiler.codegen;

import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.ast.expressions.LiteralExpression;
import com.juanpa.spice.transpiler.ast.expressions.LiteralKind;
import com.juanpa.spice.transpiler.ast.expressions.SliceExpression;
import com.juanpa.spice.transpiler.ast.statements.ExpressionStatement;
import com.juanpa.spice.transpiler.lexer.LexResult;
import com.juanpa.spice.transpiler.lexer.Lexer;
import com.juanpa.spice.transpiler.parser.SpiceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PythonTransformerTest
{
	private static String transform(String source)
	{
		LexResult lexed = new Lexer(source).scanTokens();
		assertFalse(lexed.hasDiagnostics(), () -> "Follow-set diagnostics: " + lexed.getDiagnostics());
		Program program = new SpiceParser(lexed.getTokens()).parse();
		return new PythonTransformer().transform(program);
	}

	private static void assertContainsAll(String output, String... fragments)
	{
		for (String fragment : fragments)
		{
			assertTrue(output.contains(fragment), () -> "Missing '" + fragment + "' in:\n" + output);
		}
	}

	private static int count(String output, String fragment)
	{
		int count = 0;
		int index = output.indexOf(fragment);
		while (index >= 0)
		{
			count++;
			index = output.indexOf(fragment, index + fragment.length());
		}
		return count;
	}

	@Test
	public void interfaceBecomesProtocol()
	{
		String expected = "from abc import ABC, abstractmethod\n"
				+ "from typing import Protocol\n"
				+ "\n"
				+ "class Drawable(Protocol):\n"
				+ "    \"\"\"Interface for Drawable.\"\"\"\n"
				+ "\n"
				+ "    def draw(self, x: int, y: int) -> None:\n"
				+ "        \"\"\"Interface method.\"\"\"\n"
				+ "        ...\n";

		assertEquals(expected, transform("interface Drawable {\n    def draw(x: int, y: int) -> None;\n}"));
	}

	@Test
	public void interfaceBasesFollowProtocol()
	{
		assertContainsAll(transform("interface Colorable extends Drawable {\n    def set_color(color: str) -> None;\n}"),
				"class Colorable(Protocol, Drawable):",
				"def set_color(self, color: str) -> None:");
	}

	@Test
	public void emptyInterfaceGetsPass()
	{
		assertContainsAll(transform("interface Empty {\n}"),
				"class Empty(Protocol):\n    \"\"\"Interface for Empty.\"\"\"\n    pass\n");
	}

	@Test
	public void interfaceMethodsAreStubsWithoutAbstractMethod()
	{
		String output = transform("interface Shape {\n"
				+ "    def area() -> float;\n"
				+ "    def perimeter() -> float;\n"
				+ "    def draw(x: int, y: int) -> None;\n"
				+ "}");

		assertContainsAll(output, "def area(self) -> float:", "def perimeter(self) -> float:");
		assertFalse(output.contains("@abstractmethod"));
		assertEquals(3, count(output, "..."));
	}

	@Test
	public void emptySourceProducesNothing()
	{
		assertEquals("", transform(""));
		assertEquals("", transform("\n\n# only a comment\n"));
	}

	@Test
	public void importsAreOmittedWhenUnused()
	{
		assertEquals("x = 1\n", transform("x = 1;"));
	}

	@Test
	public void abstractClassDerivesFromAbc()
	{
		String expected = "from abc import ABC, abstractmethod\n"
				+ "\n"
				+ "class Animal(ABC):\n"
				+ "    \"\"\"Animal class.\"\"\"\n"
				+ "\n"
				+ "    @abstractmethod\n"
				+ "    def make_sound(self) -> str:\n"
				+ "        \"\"\"Abstract method.\"\"\"\n"
				+ "        pass\n"
				+ "\n"
				+ "    def eat(self) -> None:\n"
				+ "        \"\"\"eat method.\"\"\"\n"
				+ "        pass\n";

		assertEquals(expected, transform("abstract class Animal {\n"
				+ "    abstract def make_sound() -> str;\n"
				+ "\n"
				+ "    def eat() -> None {\n"
				+ "        pass;\n"
				+ "    }\n"
				+ "}"));
	}

	@Test
	public void abstractClassWithBaseKeepsBase()
	{
		String output = transform("abstract class Dog extends Animal {\n    abstract def fetch();\n}");

		assertContainsAll(output, "class Dog(Animal):");
		assertFalse(output.contains("(ABC)"));
	}

	@Test
	public void finalClassIsDecorated()
	{
		assertContainsAll(transform("final class Dog {\n    def bark() -> None {\n        pass;\n    }\n}"),
				"from typing import final\n",
				"@final\nclass Dog:\n",
				"def bark(self) -> None:");
	}

	@Test
	public void finalMethodImportsFinalDecorator()
	{
		assertContainsAll(transform("class Base {\n    final def id() -> int {\n        return 1;\n    }\n}"),
				"from typing import final\n",
				"    @final\n    def id(self) -> int:\n");
	}

	@Test
	public void topLevelAbstractFunctionImportsAbc()
	{
		String expected = "from abc import ABC, abstractmethod\n"
				+ "\n"
				+ "@abstractmethod\n"
				+ "def area():\n"
				+ "    \"\"\"Abstract method.\"\"\"\n"
				+ "    pass\n";

		assertEquals(expected, transform("abstract def area();"));
	}

	@Test
	public void abstractMethodOfPlainClassImportsAbc()
	{
		assertContainsAll(transform("class Shape {\n    abstract def area() -> float;\n}"),
				"from abc import ABC, abstractmethod\n\nclass Shape:\n",
				"    @abstractmethod\n    def area(self) -> float:\n");
	}

	@Test
	public void declarationsNestedInFunctionsStillImportTheirDecorators()
	{
		String output = transform("def make() {\n"
				+ "    final class Local { pass }\n"
				+ "    abstract class Base { }\n"
				+ "    if ready {\n"
				+ "        final LIMIT = 3;\n"
				+ "    }\n"
				+ "    return Local;\n"
				+ "}");

		assertTrue(output.startsWith("from abc import ABC, abstractmethod\n"
				+ "from typing import final\n"
				+ "from typing import Final\n"
				+ "\n"
				+ "def make():\n"), output);
		assertContainsAll(output, "    @final\n    class Local:\n", "    class Base(ABC):\n", "        LIMIT: Final = 3\n");
	}

	@Test
	public void staticMethodHasNoSelf()
	{
		String output = transform("class Utility {\n"
				+ "    static def helper() -> str {\n"
				+ "        pass;\n"
				+ "    }\n"
				+ "\n"
				+ "    def instance_method() -> None {\n"
				+ "        pass;\n"
				+ "    }\n"
				+ "}");

		assertContainsAll(output, "@staticmethod\n    def helper() -> str:", "def instance_method(self) -> None:");
	}

	@Test
	public void explicitSelfIsNotDuplicated()
	{
		assertContainsAll(transform("class Shape {\n    def set_color(self, color: str) -> None {\n        pass;\n    }\n}"),
				"def set_color(self, color: str) -> None:");
	}

	@Test
	public void classBasesAndInterfacesAreCombined()
	{
		String output = transform("interface Pet {\n    def name() -> str;\n}\n"
				+ "\n"
				+ "class Dog(Animal) implements Pet {\n"
				+ "    def name() -> str {\n"
				+ "        return \"Rex\";\n"
				+ "    }\n"
				+ "}");

		assertContainsAll(output, "class Dog(Animal, Pet):", "        return \"Rex\"\n");
	}

	@Test
	public void emptyClassGetsPass()
	{
		assertEquals("class Marker:\n    pass\n", transform("class Marker { }"));
	}

	@Test
	public void functionsGetDocstringAndParameters()
	{
		String expected = "def greet(name: str, times: int = 1) -> None:\n"
				+ "    \"\"\"greet function.\"\"\"\n"
				+ "    print(name * times)\n";

		assertEquals(expected, transform("def greet(name: str, times: int = 1) -> None {\n    print(name * times)\n}"));
	}

	@Test
	public void emptyFunctionBodyIsPass()
	{
		assertEquals("def noop():\n    pass\n", transform("def noop() { }"));
	}

	@Test
	public void nestedFunctionInMethodHasNoSelf()
	{
		String output = transform("class Counter {\n"
				+ "    def build() {\n"
				+ "        def step(x) {\n"
				+ "            return x + 1\n"
				+ "        }\n"
				+ "        return step\n"
				+ "    }\n"
				+ "}");

		assertContainsAll(output, "    def build(self):\n", "        def step(x):\n", "            \"\"\"step function.\"\"\"\n");
	}

	@Test
	public void statementsAreSeparatedByOneBlankLine()
	{
		assertEquals("x = 1\n\ny = 2\n", transform("x = 1\n\n\n\ny = 2"));
	}

	@Test
	public void finalVariablesAreAnnotated()
	{
		assertEquals("from typing import Final\n\nMAX: Final[int] = 10\n", transform("final MAX: int = 10;"));
		assertContainsAll(transform("final NAME = \"spice\""), "NAME: Final = \"spice\"");
	}

	@Test
	public void finalVariableInsideFunctionStillImportsFinal()
	{
		assertContainsAll(transform("def f() {\n    final y = 2\n}"), "from typing import Final\n", "    y: Final = 2\n");
	}

	@Test
	public void ifChainBecomesElif()
	{
		String expected = "if x > 0:\n"
				+ "    a()\n"
				+ "elif x < 0:\n"
				+ "    b()\n"
				+ "else:\n"
				+ "    c()\n";

		assertEquals(expected, transform("if x > 0 {\n    a()\n} elif x < 0 {\n    b()\n} else {\n    c()\n}"));
		assertEquals(expected, transform("if x > 0 {\n    a()\n}\nelse if x < 0 {\n    b()\n}\nelse {\n    c()\n}"));
	}

	@Test
	public void emptyIfBodyIsPass()
	{
		assertEquals("if ready:\n    pass\n", transform("if ready { }"));
	}

	@Test
	public void switchBecomesIfChain()
	{
		String expected = "if x == 1:\n"
				+ "    a()\n"
				+ "elif x == 2:\n"
				+ "    b()\n"
				+ "else:\n"
				+ "    c()\n";

		assertEquals(expected, transform("switch x {\n    case 1: a();\n    case 2: b();\n    default: c();\n}"));
	}

	@Test
	public void switchWithOnlyDefaultInlinesIt()
	{
		assertEquals("c()\n", transform("switch x {\n    default: c();\n}"));
		assertEquals("pass\n", transform("switch x {\n}"));
	}

	@Test
	public void switchOperandsAreParenthesizedWhenNeeded()
	{
		assertContainsAll(transform("switch a < b {\n    case True: go();\n}"), "if (a < b) == True:");
	}

	@Test
	public void loopsKeepTheirTargets()
	{
		assertEquals("for i, x in enumerate(items):\n    print(i)\n", transform("for i, x in enumerate(items) {\n    print(i)\n}"));
		assertEquals("for i in range(3):\n    pass\n", transform("for (i in range(3)) { }"));
		assertEquals("while n > 0:\n    n -= 1\n    continue\n", transform("while n > 0 {\n    n -= 1\n    continue\n}"));
		assertEquals("while True:\n    break\n", transform("while True { break; }"));
	}

	@Test
	public void binaryExpressionsKeepSourceGrouping()
	{
		assertEquals("v = (a + b) * c\n", transform("v = (a + b) * c"));
		assertEquals("v = a + b * c\n", transform("v = a + b * c"));
		assertEquals("v = a - (b - c)\n", transform("v = a - (b - c)"));
		assertEquals("v = a - b - c\n", transform("v = (a - b) - c"));
		assertEquals("v = 2 ** 3 ** 2\n", transform("v = 2 ** 3 ** 2"));
		assertEquals("v = (2 ** 3) ** 2\n", transform("v = (2 ** 3) ** 2"));
		assertEquals("v = (a < b) == c\n", transform("v = a < b == c"));
	}

	@Test
	public void postfixOperandsAreParenthesized()
	{
		assertEquals("n = (a + b).bit_length()\n", transform("n = (a + b).bit_length()"));
	}

	@Test
	public void logicalAndUnaryExpressions()
	{
		assertEquals("ok = (ready and (not failed))\n", transform("ok = ready and not failed"));
		assertEquals("ok = (a or (b and c))\n", transform("ok = a or b and c"));
		assertEquals("y = (- x) + 1\n", transform("y = -x + 1"));
		assertEquals("found = key not in seen\n", transform("found = key not in seen"));
		assertEquals("empty = value is not None\n", transform("empty = value is not None"));
	}

	@Test
	public void slicesAreWrittenInPythonForm()
	{
		assertEquals("a = items[1:3]\n", transform("a = items[1:3]"));
		assertEquals("b = items[::2]\n", transform("b = items[::2]"));
		assertEquals("c = items[2:]\n", transform("c = items[2:]"));
		assertEquals("d = grid[0][1]\n", transform("d = grid[0][1]"));
	}

	@Test
	public void containerLiterals()
	{
		assertEquals("a = [1, 2]\n", transform("a = [1, 2]"));
		assertEquals("b = {1, 2}\n", transform("b = {1, 2}"));
		assertEquals("c = {\"a\": 1, \"b\": [2, 3]}\n", transform("c = {\"a\": 1, \"b\": [2, 3],}"));
		assertEquals("d = {}\n", transform("d = {}"));
		assertEquals("e = (1,)\n", transform("e = (1,)"));
		assertEquals("f = ()\n", transform("f = ()"));
		assertEquals("g = None\n", transform("g = None"));
	}

	@Test
	public void stringsKeepTheirPrefixes()
	{
		assertEquals("pattern = r\"\\d+\"\n", transform("pattern = re\"\\d+\""));
		assertEquals("s = f\"{name}!\"\n", transform("s = f\"{name}!\""));
		assertEquals("p = r\"raw\"\n", transform("p = r\"raw\""));
	}

	@Test
	public void comprehensions()
	{
		assertEquals("a = [x * 2 for x in items if x > 0]\n", transform("a = [x * 2 for x in items if x > 0]"));
		assertEquals("b = {k: v for k, v in pairs}\n", transform("b = {k: v for k, v in pairs}"));
		assertEquals("c = {x for x in xs}\n", transform("c = {x for x in xs}"));
		assertEquals("d = (f(x) for x in xs)\n", transform("d = (f(x) for x in xs)"));
	}

	@Test
	public void callsWithNamedArguments()
	{
		assertEquals("print(a, b, sep=\", \")\n", transform("print(a, b, sep=\", \")"));
	}

	@Test
	public void lambdasDropAnnotations()
	{
		assertEquals("f = lambda x: x + 1\n", transform("f = lambda x: x + 1"));
		assertEquals("g = lambda x, y: x + y\n", transform("g = lambda(x: int, y: int): int -> { x + y }"));
		assertEquals("h = lambda: 42\n", transform("h = lambda() -> 42"));
	}

	@Test
	public void importsAreCopied()
	{
		assertEquals("import os.path as p\n\nfrom typing import List, Dict as D\n",
				transform("import os.path as p;\nfrom typing import List, Dict as D;"));
		assertEquals("import sys\n", transform("import sys"));
	}

	@Test
	public void raiseAndReturn()
	{
		assertEquals("def f():\n    \"\"\"f function.\"\"\"\n    raise ValueError(\"bad\")\n",
				transform("def f() {\n    raise ValueError(\"bad\");\n}"));
		assertEquals("def g():\n    \"\"\"g function.\"\"\"\n    return\n", transform("def g() { return; }"));
	}

	@Test
	public void misplacedNodesAreRejected()
	{
		Program program = new Program(List.of(new ExpressionStatement(
				new SliceExpression(new LiteralExpression(LiteralKind.NUMBER, "1"), null, null), false)));

		TransformException exception = assertThrows(TransformException.class, () -> new PythonTransformer().transform(program));
		assertEquals("Slice outside of a subscript", exception.getMessage());
	}
}
