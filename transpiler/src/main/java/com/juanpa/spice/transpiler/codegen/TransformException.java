package com.juanpa.spice.transpiler.codegen;

import com.juanpa.spice.transpiler.util.SpiceException;

/**
 * Raised when a tree contains a node the transformer cannot express at that position,
 * such as a slice outside a subscript.
 */
public class TransformException extends SpiceException
{
	public TransformException(String message)
	{
		super(message);
	}
}
