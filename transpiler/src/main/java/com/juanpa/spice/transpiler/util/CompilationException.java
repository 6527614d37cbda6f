package com.juanpa.spice.transpiler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised by the driver when collected diagnostics (follow-set advisories, final-variable
 * violations, strict type errors) stop a compilation.
 */
public class CompilationException extends SpiceException
{
	private final List<String> diagnostics;

	public CompilationException(String message, List<String> diagnostics)
	{
		super(message);
		this.diagnostics = new ArrayList<>(diagnostics);
	}

	public List<String> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
