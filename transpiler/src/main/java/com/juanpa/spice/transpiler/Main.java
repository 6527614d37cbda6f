// File: src/main/java/com/juanpa/spice/transpiler/Main.java

package com.juanpa.spice.transpiler;

import ch.qos.logback.classic.Level;
import com.juanpa.spice.transpiler.lexer.LexerException;
import com.juanpa.spice.transpiler.parser.ParseException;
import com.juanpa.spice.transpiler.semantics.TypeEnforcement;
import com.juanpa.spice.transpiler.util.CompilationException;
import com.juanpa.spice.transpiler.util.CompilerConfig;
import com.juanpa.spice.transpiler.util.ErrorReporter;
import com.juanpa.spice.transpiler.util.SpiceException;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Entry point for the Spice compiler ({@code spicec}).
 * Reads one .spc or .spy file and writes the generated Python next to it, or to the path given with -o.
 */
public class Main
{
	static final String USAGE =
			"Usage: spicec <input.spc|input.spy> [-o OUT] [-c|--check] [-v|--verbose]\n"
					+ "               [-t|--type-check none|warnings|strict] [--no-final-check] [-w|--watch] [-h|--help]";

	public static void main(String[] args)
	{
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "spice", "spice.conf");
		System.exit(run(args, System.out, System.err, configPath));
	}

	/**
	 * Runs the compiler command line.
	 *
	 * @return The process exit status: 0 on success, 1 on any failure.
	 */
	static int run(String[] args, PrintStream out, PrintStream err, Path configPath)
	{
		String input = null;
		String output = null;
		String typeCheck = null;
		boolean checkOnly = false;
		boolean verbose = false;
		boolean noFinalCheck = false;
		boolean watch = false;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "-h":
				case "--help":
					out.println(USAGE);
					return 0;
				case "-o":
				case "--output":
					if (i + 1 >= args.length)
					{
						return usageError(err, "Missing value for " + arg);
					}
					output = args[++i];
					break;
				case "-t":
				case "--type-check":
					if (i + 1 >= args.length)
					{
						return usageError(err, "Missing value for " + arg);
					}
					typeCheck = args[++i];
					break;
				case "-c":
				case "--check":
					checkOnly = true;
					break;
				case "-v":
				case "--verbose":
					verbose = true;
					break;
				case "--no-final-check":
					noFinalCheck = true;
					break;
				case "-w":
				case "--watch":
					watch = true;
					break;
				default:
					if (arg.startsWith("-"))
					{
						return usageError(err, "Unknown option: " + arg);
					}
					if (input != null)
					{
						return usageError(err, "Only one input file may be given");
					}
					input = arg;
					break;
			}
		}

		if (watch)
		{
			err.println("Watch mode is not supported");
			return 1;
		}
		if (input == null)
		{
			return usageError(err, "Missing input file");
		}
		if (!input.endsWith(".spc") && !input.endsWith(".spy"))
		{
			return usageError(err, "Expected a .spc or .spy file, got " + input);
		}
		Path inputPath = Paths.get(input);
		if (!Files.isRegularFile(inputPath))
		{
			return usageError(err, "Input file not found: " + inputPath);
		}

		if (verbose)
		{
			((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.juanpa.spice")).setLevel(Level.DEBUG);
		}

		CompilerConfig config = loadConfiguration(configPath, out, err, verbose);
		SpiceCompiler.Options options;
		try
		{
			options = SpiceCompiler.Options.fromConfig(config);
			if (typeCheck != null)
			{
				options.setTypeEnforcement(TypeEnforcement.fromString(typeCheck));
			}
		}
		catch (IllegalArgumentException e)
		{
			return usageError(err, e.getMessage());
		}
		if (noFinalCheck)
		{
			options.setFinalCheckEnabled(false);
		}

		Path outputPath = output != null ? Paths.get(output) : defaultOutputPath(inputPath, config.getOutputExtension());
		return compileFile(inputPath, outputPath, checkOnly, verbose, new SpiceCompiler(options), out, err);
	}

	private static int compileFile(Path inputPath, Path outputPath, boolean checkOnly, boolean verbose,
								   SpiceCompiler compiler, PrintStream out, PrintStream err)
	{
		ErrorReporter errorReporter = new ErrorReporter(err);
		String source;
		try
		{
			source = new String(Files.readAllBytes(inputPath), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			err.println("Error: Could not read " + inputPath + ": " + e.getMessage());
			return 1;
		}

		try
		{
			if (verbose)
			{
				out.println("--- Compiling " + inputPath + " ---");
			}
			if (checkOnly)
			{
				compiler.checkSyntax(source);
				out.println("Syntax check passed");
				return 0;
			}

			CompilationResult result = compiler.build(source);
			for (String warning : result.getWarnings())
			{
				err.println(warning);
			}
			Files.write(outputPath, result.getOutput().getBytes(StandardCharsets.UTF_8));
			out.println("Generated " + outputPath);
			return 0;
		}
		catch (CompilationException e)
		{
			for (String diagnostic : e.getDiagnostics())
			{
				errorReporter.report(diagnostic);
			}
			err.println("Compilation failed: " + e.getMessage());
		}
		catch (LexerException e)
		{
			errorReporter.report(e.getLine(), e.getColumn(), e.getDetail());
		}
		catch (ParseException e)
		{
			// Parse errors know their line only.
			errorReporter.report(e.getLine(), -1, e.getDetail());
		}
		catch (SpiceException e)
		{
			errorReporter.report(e.getMessage());
		}
		catch (IOException e)
		{
			err.println("Error: Could not write " + outputPath + ": " + e.getMessage());
		}
		return 1;
	}

	static Path defaultOutputPath(Path inputPath, String extension)
	{
		String fileName = inputPath.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
		return inputPath.resolveSibling(stem + extension);
	}

	private static int usageError(PrintStream err, String message)
	{
		err.println("Error: " + message);
		err.println(USAGE);
		return 1;
	}

	private static CompilerConfig loadConfiguration(Path configPath, PrintStream out, PrintStream err, boolean verbose)
	{
		Properties props = new Properties();
		if (configPath != null && Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				if (verbose)
				{
					out.println("--- Loaded configuration from: " + configPath + " ---");
				}
			}
			catch (IOException e)
			{
				err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}
}
