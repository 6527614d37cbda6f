package com.juanpa.spice.transpiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of one lexer run: the token stream (terminated by EOF) plus the
 * advisory follow-set diagnostics collected along the way.
 */
public class LexResult
{
	private final List<Token> tokens;
	private final List<IllegalFollow> diagnostics;

	public LexResult(List<Token> tokens, List<IllegalFollow> diagnostics)
	{
		this.tokens = new ArrayList<>(tokens);
		this.diagnostics = new ArrayList<>(diagnostics);
	}

	public List<Token> getTokens()
	{
		return Collections.unmodifiableList(tokens);
	}

	public List<IllegalFollow> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public boolean hasDiagnostics()
	{
		return !diagnostics.isEmpty();
	}
}
