package com.juanpa.spice.transpiler;

import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.spice.transpiler.parser.ParseException;
import com.juanpa.spice.transpiler.semantics.TypeEnforcement;
import com.juanpa.spice.transpiler.util.CompilationException;
import com.juanpa.spice.transpiler.util.CompilerConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SpiceCompilerTest
{
	private static final String INCOMPLETE_SHAPE =
			"interface Drawable {\n"
					+ "    def draw() -> None;\n"
					+ "}\n"
					+ "class Box implements Drawable {\n"
					+ "}\n";

	@Test
	public void compilesToPython()
	{
		String output = new SpiceCompiler().compile("def square(x: int) -> int {\n    return x * x;\n}");

		assertEquals("def square(x: int) -> int:\n    \"\"\"square function.\"\"\"\n    return x * x\n", output);
	}

	@Test
	public void illegalTokenSequenceStopsStrictCompilation()
	{
		CompilationException exception = assertThrows(CompilationException.class,
				() -> new SpiceCompiler().compile("x = 1(2)"));

		assertEquals("Illegal token sequence", exception.getMessage());
		assertEquals(1, exception.getDiagnostics().size());
		assertTrue(exception.getDiagnostics().get(0).startsWith("Illegal follow: NUMBER followed by LPAREN at line 1"));
	}

	@Test
	public void illegalTokenSequenceIsAWarningWhenLenient()
	{
		SpiceCompiler compiler = new SpiceCompiler(new SpiceCompiler.Options().setFollowSetStrict(false));

		CompilationResult result = compiler.build("x = 1(2)");

		assertEquals("x = 1(2)\n", result.getOutput());
		assertEquals(1, result.getWarnings().size());
		assertTrue(result.getWarnings().get(0).startsWith("Illegal follow: NUMBER followed by LPAREN"));
	}

	@Test
	public void strictModeAcceptsTypedLambdasChainedCallsAndComprehensions()
	{
		String source = "f = lambda(x): int -> x\n"
				+ "g = lambda(x) -> f\"{x}\"\n"
				+ "h = lambda(): None -> re\"\\d+\"\n"
				+ "f(1)(2)\n"
				+ "y = opts or {}\n"
				+ "z = opts and {\"k\": 1}\n"
				+ "blanks = [None for _ in xs]\n"
				+ "flags = [False for _ in xs]\n"
				+ "rows = [{\"k\": v} for v in xs]\n";

		String output = new SpiceCompiler().compile(source);

		assertTrue(output.contains("f = lambda x: x\n"), output);
		assertTrue(output.contains("g = lambda x: f\"{x}\"\n"), output);
		assertTrue(output.contains("h = lambda: r\"\\d+\"\n"), output);
		assertTrue(output.contains("f(1)(2)\n"), output);
		assertTrue(output.contains("blanks = [None for _ in xs]\n"), output);
		assertTrue(output.contains("rows = [{\"k\": v} for v in xs]\n"), output);
	}

	@Test
	public void finalReassignmentIsFatal()
	{
		CompilationException exception = assertThrows(CompilationException.class,
				() -> new SpiceCompiler().compile("final x = 1;\nx = 2;"));

		assertEquals("Final variable reassigned", exception.getMessage());
		assertEquals(List.of("Line 2: Cannot reassign final variable 'x'"), exception.getDiagnostics());
	}

	@Test
	public void finalCheckCanBeDisabled()
	{
		SpiceCompiler compiler = new SpiceCompiler(new SpiceCompiler.Options().setFinalCheckEnabled(false));

		assertEquals("from typing import Final\n\nx: Final = 1\n\nx = 2\n", compiler.compile("final x = 1;\nx = 2;"));
	}

	@Test
	public void strictTypeErrorsAreFatal()
	{
		SpiceCompiler compiler = new SpiceCompiler(new SpiceCompiler.Options().setTypeEnforcement(TypeEnforcement.STRICT));

		CompilationException exception = assertThrows(CompilationException.class, () -> compiler.compile(INCOMPLETE_SHAPE));

		assertEquals("Type check failed", exception.getMessage());
		assertEquals(List.of("Class 'Box' does not implement method 'draw' of interface 'Drawable'"), exception.getDiagnostics());
	}

	@Test
	public void typeWarningsAreReturnedWithTheOutput()
	{
		SpiceCompiler compiler = new SpiceCompiler(new SpiceCompiler.Options().setTypeEnforcement(TypeEnforcement.WARNINGS));

		CompilationResult result = compiler.build(INCOMPLETE_SHAPE);

		assertTrue(result.getOutput().contains("class Box(Drawable):"));
		assertEquals(List.of("Type warning: Class 'Box' does not implement method 'draw' of interface 'Drawable'"), result.getWarnings());
	}

	@Test
	public void typeCheckingIsOffByDefault()
	{
		CompilationResult result = new SpiceCompiler().build(INCOMPLETE_SHAPE);

		assertTrue(result.getWarnings().isEmpty());
	}

	@Test
	public void syntaxErrorsPropagate()
	{
		ParseException exception = assertThrows(ParseException.class, () -> new SpiceCompiler().compile("class Dog:\n    pass"));

		assertTrue(exception.getMessage().contains("at line 1"));
	}

	@Test
	public void checkSyntaxSkipsLaterPhases()
	{
		Program program = new SpiceCompiler().checkSyntax("final x = 1\nx = 2\ndef f() { pass }");

		assertEquals(3, program.getBody().size());
		assertTrue(program.getBody().get(2) instanceof FunctionDeclaration);
	}

	@Test
	public void optionsFollowConfiguration()
	{
		Properties props = new Properties();
		props.setProperty(CompilerConfig.TYPECHECK_LEVEL, "strict");
		props.setProperty(CompilerConfig.FINALCHECK_ENABLED, "false");
		props.setProperty(CompilerConfig.FOLLOWSET_STRICT, "false");

		SpiceCompiler.Options options = SpiceCompiler.Options.fromConfig(new CompilerConfig(props));

		assertEquals(TypeEnforcement.STRICT, options.getTypeEnforcement());
		assertFalse(options.isFinalCheckEnabled());
		assertFalse(options.isFollowSetStrict());

		SpiceCompiler.Options defaults = SpiceCompiler.Options.fromConfig(new CompilerConfig());
		assertEquals(TypeEnforcement.NONE, defaults.getTypeEnforcement());
		assertTrue(defaults.isFinalCheckEnabled());
		assertTrue(defaults.isFollowSetStrict());
	}
}
