package com.juanpa.spice.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generated Python source plus the non-fatal warnings produced on the way.
 */
public class CompilationResult
{
	private final String output;
	private final List<String> warnings;

	public CompilationResult(String output, List<String> warnings)
	{
		this.output = output;
		this.warnings = new ArrayList<>(warnings);
	}

	public String getOutput()
	{
		return output;
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
