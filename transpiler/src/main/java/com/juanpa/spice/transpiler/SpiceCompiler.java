// File: src/main/java/com/juanpa/spice/transpiler/SpiceCompiler.java

package com.juanpa.spice.transpiler;

import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.codegen.PythonTransformer;
import com.juanpa.spice.transpiler.lexer.IllegalFollow;
import com.juanpa.spice.transpiler.lexer.LexResult;
import com.juanpa.spice.transpiler.lexer.Lexer;
import com.juanpa.spice.transpiler.parser.SpiceParser;
import com.juanpa.spice.transpiler.semantics.FinalChecker;
import com.juanpa.spice.transpiler.semantics.FinalViolation;
import com.juanpa.spice.transpiler.semantics.TypeChecker;
import com.juanpa.spice.transpiler.semantics.TypeEnforcement;
import com.juanpa.spice.transpiler.util.CompilationException;
import com.juanpa.spice.transpiler.util.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Library entry point: runs the whole pipeline on one compilation unit.
 * Every call builds its own lexer, parser, checkers and transformer, so one instance may be
 * shared between threads.
 */
public class SpiceCompiler
{
	private static final Logger logger = LoggerFactory.getLogger(SpiceCompiler.class);

	private final Options options;

	public SpiceCompiler()
	{
		this(new Options());
	}

	public SpiceCompiler(Options options)
	{
		this.options = options;
	}

	public Options getOptions()
	{
		return options;
	}

	/**
	 * Compiles Spice source to Python source.
	 *
	 * @param source The Spice source text.
	 * @return The generated Python text.
	 * @throws com.juanpa.spice.transpiler.lexer.LexerException    on an invalid character or unterminated string.
	 * @throws com.juanpa.spice.transpiler.parser.ParseException   on the first syntax error.
	 * @throws CompilationException                                when collected diagnostics stop the compilation.
	 * @throws com.juanpa.spice.transpiler.codegen.TransformException if a node cannot be expressed in Python.
	 */
	public String compile(String source)
	{
		return build(source).getOutput();
	}

	/**
	 * Same as {@link #compile(String)} but also returns the warnings that did not stop compilation.
	 */
	public CompilationResult build(String source)
	{
		List<String> warnings = new ArrayList<>();

		logger.debug("--- Lexical Analysis ---");
		LexResult lexResult = new Lexer(source).scanTokens();
		if (lexResult.hasDiagnostics())
		{
			List<String> messages = lexResult.getDiagnostics().stream()
					.map(IllegalFollow::toString)
					.collect(Collectors.toList());
			if (options.isFollowSetStrict())
			{
				throw new CompilationException("Illegal token sequence", messages);
			}
			for (String message : messages)
			{
				logger.warn(message);
				warnings.add(message);
			}
		}

		logger.debug("--- Parsing ---");
		Program program = new SpiceParser(lexResult.getTokens()).parse();

		if (options.isFinalCheckEnabled())
		{
			logger.debug("--- Final Variable Check ---");
			List<FinalViolation> violations = new FinalChecker().check(program);
			if (!violations.isEmpty())
			{
				throw new CompilationException("Final variable reassigned",
						violations.stream().map(FinalViolation::getMessage).collect(Collectors.toList()));
			}
		}

		if (options.getTypeEnforcement() != TypeEnforcement.NONE)
		{
			logger.debug("--- Type Check ({}) ---", options.getTypeEnforcement());
			TypeChecker typeChecker = new TypeChecker(options.getTypeEnforcement());
			typeChecker.check(program);
			if (typeChecker.hasErrors())
			{
				throw new CompilationException("Type check failed", typeChecker.getErrors());
			}
			for (String warning : typeChecker.getWarnings())
			{
				logger.warn("Type warning: {}", warning);
				warnings.add("Type warning: " + warning);
			}
		}

		logger.debug("--- Code Generation ---");
		String output = new PythonTransformer().transform(program);
		return new CompilationResult(output, warnings);
	}

	/**
	 * Lexes and parses only.
	 *
	 * @param source The Spice source text.
	 * @return The parsed program.
	 */
	public Program checkSyntax(String source)
	{
		LexResult lexResult = new Lexer(source).scanTokens();
		if (lexResult.hasDiagnostics() && options.isFollowSetStrict())
		{
			throw new CompilationException("Illegal token sequence", lexResult.getDiagnostics().stream()
					.map(IllegalFollow::toString)
					.collect(Collectors.toList()));
		}
		return new SpiceParser(lexResult.getTokens()).parse();
	}

	/**
	 * Pipeline switches. Defaults match an empty {@link CompilerConfig}.
	 */
	public static class Options
	{
		private TypeEnforcement typeEnforcement = TypeEnforcement.NONE;
		private boolean finalCheckEnabled = true;
		private boolean followSetStrict = true;

		public static Options fromConfig(CompilerConfig config)
		{
			return new Options()
					.setTypeEnforcement(TypeEnforcement.fromString(config.getTypeCheckLevel()))
					.setFinalCheckEnabled(config.isFinalCheckEnabled())
					.setFollowSetStrict(config.isFollowSetStrict());
		}

		public TypeEnforcement getTypeEnforcement()
		{
			return typeEnforcement;
		}

		public Options setTypeEnforcement(TypeEnforcement typeEnforcement)
		{
			this.typeEnforcement = typeEnforcement;
			return this;
		}

		public boolean isFinalCheckEnabled()
		{
			return finalCheckEnabled;
		}

		public Options setFinalCheckEnabled(boolean finalCheckEnabled)
		{
			this.finalCheckEnabled = finalCheckEnabled;
			return this;
		}

		public boolean isFollowSetStrict()
		{
			return followSetStrict;
		}

		public Options setFollowSetStrict(boolean followSetStrict)
		{
			this.followSetStrict = followSetStrict;
			return this;
		}
	}
}
