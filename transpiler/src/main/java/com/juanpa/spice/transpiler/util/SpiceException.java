package com.juanpa.spice.transpiler.util;

/**
 * Base class for every failure raised by the Spice compiler pipeline.
 * Unchecked, so that the recursive-descent parser and the visitors can unwind freely.
 */
public class SpiceException extends RuntimeException
{
	public SpiceException(String message)
	{
		super(message);
	}

	public SpiceException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
