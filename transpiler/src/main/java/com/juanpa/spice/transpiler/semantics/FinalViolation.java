package com.juanpa.spice.transpiler.semantics;

import java.util.Objects;

/**
 * One reassignment of a final variable, found by the {@link FinalChecker}.
 */
public class FinalViolation
{
	private final int line;
	private final String message;

	public FinalViolation(int line, String message)
	{
		this.line = line;
		this.message = message;
	}

	public int getLine()
	{
		return line;
	}

	public String getMessage()
	{
		return message;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		FinalViolation that = (FinalViolation) o;
		return line == that.line && message.equals(that.message);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(line, message);
	}

	@Override
	public String toString()
	{
		return message;
	}
}
