package com.juanpa.spice.transpiler.semantics;

import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.lexer.LexResult;
import com.juanpa.spice.transpiler.lexer.Lexer;
import com.juanpa.spice.transpiler.parser.SpiceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeCheckerTest
{
	private static final String INCOMPLETE =
			"interface Drawable {\n"
					+ "    def draw() -> None;\n"
					+ "    def resize(factor: float) -> None;\n"
					+ "}\n"
					+ "\n"
					+ "class Box implements Drawable {\n"
					+ "    def draw() -> None {\n"
					+ "        pass;\n"
					+ "    }\n"
					+ "}\n";

	private static Program parse(String source)
	{
		LexResult lexed = new Lexer(source).scanTokens();
		assertFalse(lexed.hasDiagnostics(), () -> "Follow-set diagnostics: " + lexed.getDiagnostics());
		return new SpiceParser(lexed.getTokens()).parse();
	}

	@Test
	public void strictReportsMissingInterfaceMethodAsError()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		checker.check(parse(INCOMPLETE));

		assertEquals(List.of("Class 'Box' does not implement method 'resize' of interface 'Drawable'"), checker.getErrors());
		assertTrue(checker.getWarnings().isEmpty());
		assertTrue(checker.hasErrors());
	}

	@Test
	public void warningsLevelReportsAsWarning()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.WARNINGS);
		checker.check(parse(INCOMPLETE));

		assertFalse(checker.hasErrors());
		assertEquals(1, checker.getWarnings().size());
	}

	@Test
	public void noneLevelChecksNothing()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.NONE);
		checker.check(parse(INCOMPLETE));

		assertTrue(checker.getErrors().isEmpty());
		assertTrue(checker.getWarnings().isEmpty());
		assertNull(checker.lookup("Box"));
	}

	@Test
	public void registersDeclaredTypes()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		checker.check(parse(INCOMPLETE));

		assertEquals(TypeKind.PROTOCOL, checker.lookup("Drawable").getKind());
		assertEquals(TypeKind.CLASS, checker.lookup("Box").getKind());
		assertNotNull(checker.lookup("Box").getMethod("draw"));
	}

	@Test
	public void inheritedMethodsSatisfyInterfaces()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		checker.check(parse(
				"interface Named extends Labeled {\n"
						+ "    def name() -> str;\n"
						+ "}\n"
						+ "interface Labeled {\n"
						+ "    def label() -> str;\n"
						+ "}\n"
						+ "class Base {\n"
						+ "    def name() -> str { return \"base\"; }\n"
						+ "}\n"
						+ "class Child extends Base implements Named {\n"
						+ "    def label() -> str { return \"child\"; }\n"
						+ "}\n"));

		assertTrue(checker.getErrors().isEmpty(), () -> checker.getErrors().toString());
	}

	@Test
	public void baseInterfaceMethodsAreRequired()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		checker.check(parse(
				"interface Labeled {\n"
						+ "    def label() -> str;\n"
						+ "}\n"
						+ "interface Named extends Labeled {\n"
						+ "    def name() -> str;\n"
						+ "}\n"
						+ "class Thing implements Named {\n"
						+ "    def name() -> str { return \"thing\"; }\n"
						+ "}\n"));

		assertEquals(List.of("Class 'Thing' does not implement method 'label' of interface 'Named'"), checker.getErrors());
	}

	@Test
	public void unknownInterfacesAreSkipped()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		checker.check(parse("class Handler implements Imported {\n}"));

		assertFalse(checker.hasErrors());
	}

	@Test
	public void checkAssignmentReportsMismatch()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		SpiceType intType = new SpiceType(TypeKind.INT, "int");
		SpiceType strType = new SpiceType(TypeKind.STR, "str");

		checker.checkAssignment(intType, strType, "line 3");
		checker.checkAssignment(intType, SpiceType.ANY, "line 4");
		checker.checkAssignment(intType, new SpiceType(TypeKind.INT, "int"), "");

		assertEquals(List.of("Type mismatch at line 3: Cannot assign str to int"), checker.getErrors());
	}

	@Test
	public void inferenceReturnsAny()
	{
		assertSame(SpiceType.ANY, new TypeChecker(TypeEnforcement.STRICT).inferType(null));
	}

	@Test
	public void resolvesFieldsBeforeMethods()
	{
		TypeChecker checker = new TypeChecker(TypeEnforcement.STRICT);
		SpiceType point = new SpiceType(TypeKind.CLASS, "Point");
		SpiceType floatType = new SpiceType(TypeKind.FLOAT, "float");
		point.addField("x", floatType);
		point.addMethod("norm", new SpiceType(TypeKind.CALLABLE, "norm"));

		assertSame(floatType, checker.resolveAttribute(point, "x", ""));
		assertEquals(TypeKind.CALLABLE, checker.resolveAttribute(point, "norm", "").getKind());
		assertNull(checker.resolveAttribute(point, "z", "line 1"));
		assertEquals(List.of("Attribute 'z' not found on type Point at line 1"), checker.getErrors());
	}

	@Test
	public void genericTypesPrintTheirParameters()
	{
		SpiceType dict = new SpiceType(TypeKind.DICT, "Dict",
				List.of(new SpiceType(TypeKind.STR, "str"), new SpiceType(TypeKind.INT, "int")));

		assertEquals("Dict[str, int]", dict.toString());
		assertFalse(dict.isAssignableTo(new SpiceType(TypeKind.DICT, "Mapping")));
		assertTrue(dict.isAssignableTo(SpiceType.ANY));
	}

	@Test
	public void enforcementParsesCaseInsensitively()
	{
		assertEquals(TypeEnforcement.STRICT, TypeEnforcement.fromString("STRICT"));
		assertEquals(TypeEnforcement.WARNINGS, TypeEnforcement.fromString(" warnings "));
		assertEquals(TypeEnforcement.NONE, TypeEnforcement.fromString("None"));
		assertThrows(IllegalArgumentException.class, () -> TypeEnforcement.fromString("loud"));
	}
}
