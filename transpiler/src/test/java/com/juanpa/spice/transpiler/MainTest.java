package com.juanpa.spice.transpiler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest
{
	@TempDir
	Path workDir;

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;
	private Path configPath;

	@BeforeEach
	public void setUp()
	{
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
		configPath = workDir.resolve("spice.conf");
	}

	private int run(String... args)
	{
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8), configPath);
	}

	private String out()
	{
		return out.toString(StandardCharsets.UTF_8);
	}

	private String err()
	{
		return err.toString(StandardCharsets.UTF_8);
	}

	private Path source(String name, String text) throws IOException
	{
		Path file = workDir.resolve(name);
		Files.write(file, text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private static String read(Path file) throws IOException
	{
		return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
	}

	@Test
	public void helpPrintsUsage()
	{
		assertEquals(0, run("--help"));
		assertTrue(out().startsWith("Usage: spicec"));
	}

	@Test
	public void missingInputIsAUsageError()
	{
		assertEquals(1, run());
		assertTrue(err().startsWith("Error: Missing input file"));
		assertTrue(err().contains("Usage: spicec"));
	}

	@Test
	public void rejectsOtherExtensions() throws IOException
	{
		Path file = source("script.py", "x = 1");

		assertEquals(1, run(file.toString()));
		assertTrue(err().contains("Expected a .spc or .spy file"));
	}

	@Test
	public void rejectsMissingFile()
	{
		assertEquals(1, run(workDir.resolve("absent.spc").toString()));
		assertTrue(err().contains("Input file not found"));
	}

	@Test
	public void rejectsUnknownOptionsAndSecondInput()
	{
		assertEquals(1, run("--fast", "a.spc"));
		assertTrue(err().contains("Unknown option: --fast"));

		assertEquals(1, run("a.spc", "b.spc"));
		assertTrue(err().contains("Only one input file may be given"));

		assertEquals(1, run("a.spc", "-o"));
		assertTrue(err().contains("Missing value for -o"));
	}

	@Test
	public void watchModeIsNotSupported() throws IOException
	{
		Path file = source("app.spc", "x = 1");

		assertEquals(1, run(file.toString(), "--watch"));
		assertTrue(err().contains("Watch mode is not supported"));
	}

	@Test
	public void writesPythonNextToTheSource() throws IOException
	{
		Path file = source("hello.spc", "def greet() {\n    print(\"hi\");\n}");

		assertEquals(0, run(file.toString()));

		Path generated = workDir.resolve("hello.py");
		assertEquals("def greet():\n    \"\"\"greet function.\"\"\"\n    print(\"hi\")\n", read(generated));
		assertTrue(out().contains("Generated " + generated));
	}

	@Test
	public void acceptsSpyFilesAndExplicitOutput() throws IOException
	{
		Path file = source("module.spy", "x = 1");
		Path target = workDir.resolve("out.py");

		assertEquals(0, run(file.toString(), "-o", target.toString()));
		assertEquals("x = 1\n", read(target));
		assertFalse(Files.exists(workDir.resolve("module.py")));
	}

	@Test
	public void checkModeWritesNothing() throws IOException
	{
		Path file = source("valid.spc", "final x = 1\nx = 2");

		assertEquals(0, run(file.toString(), "--check"));
		assertTrue(out().contains("Syntax check passed"));
		assertFalse(Files.exists(workDir.resolve("valid.py")));
	}

	@Test
	public void finalViolationFailsTheBuild() throws IOException
	{
		Path file = source("consts.spc", "final x = 1;\nx = 2;");

		assertEquals(1, run(file.toString()));
		assertTrue(err().contains("[Error] Line 2: Cannot reassign final variable 'x'"));
		assertTrue(err().contains("Compilation failed: Final variable reassigned"));
		assertFalse(Files.exists(workDir.resolve("consts.py")));
	}

	@Test
	public void finalCheckCanBeSwitchedOff() throws IOException
	{
		Path file = source("consts.spc", "final x = 1;\nx = 2;");

		assertEquals(0, run(file.toString(), "--no-final-check"));
		assertTrue(Files.exists(workDir.resolve("consts.py")));
	}

	@Test
	public void syntaxErrorsAreReported() throws IOException
	{
		Path file = source("broken.spc", "class Dog:\n    pass");

		assertEquals(1, run(file.toString()));
		assertTrue(err().startsWith("[Error] Line 1: Expected '{' before class body"), err());
		assertFalse(err().contains("at line"), err());
	}

	@Test
	public void lexicalErrorsReportLineAndColumn() throws IOException
	{
		Path file = source("stray.spc", "x = 1\ny = 2 @ 3");

		assertEquals(1, run(file.toString()));
		assertTrue(err().startsWith("[Error] Line 2, Column 6: Invalid character '@'"), err());
	}

	@Test
	public void strictTypeCheckFromCommandLine() throws IOException
	{
		Path file = source("shapes.spc", "interface Drawable {\n    def draw() -> None;\n}\nclass Box implements Drawable {\n}");

		assertEquals(1, run(file.toString(), "-t", "strict"));
		assertTrue(err().contains("[Error] Class 'Box' does not implement method 'draw' of interface 'Drawable'"));
		assertTrue(err().contains("Compilation failed: Type check failed"));
	}

	@Test
	public void unknownTypeCheckLevelIsAUsageError() throws IOException
	{
		Path file = source("app.spc", "x = 1");

		assertEquals(1, run(file.toString(), "--type-check", "loud"));
		assertTrue(err().contains("Unknown type-check level 'loud'"));
	}

	@Test
	public void configurationFileIsApplied() throws IOException
	{
		Files.write(configPath, ("typecheck.level = warnings\n"
				+ "output.extension = txt\n").getBytes(StandardCharsets.UTF_8));
		Path file = source("shapes.spc", "interface Drawable {\n    def draw() -> None;\n}\nclass Box implements Drawable {\n}");

		assertEquals(0, run(file.toString()));
		assertTrue(Files.exists(workDir.resolve("shapes.txt")));
		assertTrue(err().contains("Type warning: Class 'Box' does not implement method 'draw' of interface 'Drawable'"));
	}

	@Test
	public void commandLineOverridesConfiguration() throws IOException
	{
		Files.write(configPath, "typecheck.level = strict\n".getBytes(StandardCharsets.UTF_8));
		Path file = source("shapes.spc", "interface Drawable {\n    def draw() -> None;\n}\nclass Box implements Drawable {\n}");

		assertEquals(0, run(file.toString(), "-t", "none"));
		assertEquals("", err());
	}

	@Test
	public void defaultOutputPathReplacesExtension()
	{
		assertEquals(Path.of("src", "app.py"), Main.defaultOutputPath(Path.of("src", "app.spc"), ".py"));
		assertEquals(Path.of("noext.py"), Main.defaultOutputPath(Path.of("noext"), ".py"));
	}
}
