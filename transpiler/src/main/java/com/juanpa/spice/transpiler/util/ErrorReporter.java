package com.juanpa.spice.transpiler.util;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Driver-side sink for compiler errors. Prints each error with its position and
 * remembers what was reported so the caller can decide whether to continue.
 */
public class ErrorReporter
{
	private final PrintStream out;
	private final List<String> errors = new ArrayList<>();

	public ErrorReporter()
	{
		this(System.err);
	}

	public ErrorReporter(PrintStream out)
	{
		this.out = out;
	}

	/**
	 * Reports a positioned error.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred, or a negative value if unknown.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		String formatted = column < 0
				? "[Error] Line " + line + ": " + message
				: "[Error] Line " + line + ", Column " + column + ": " + message;
		errors.add(formatted);
		out.println(formatted);
	}

	/**
	 * Reports an error that already carries its own position text.
	 *
	 * @param message The error message.
	 */
	public void report(String message)
	{
		String formatted = "[Error] " + message;
		errors.add(formatted);
		out.println(formatted);
	}

	/**
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	/**
	 * Forgets every reported error.
	 */
	public void reset()
	{
		errors.clear();
	}
}
