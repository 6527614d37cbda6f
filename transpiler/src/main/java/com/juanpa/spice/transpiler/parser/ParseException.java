package com.juanpa.spice.transpiler.parser;

import com.juanpa.spice.transpiler.util.SpiceException;

/**
 * First parse error of a unit. Parsing does not recover: this always aborts the whole parse.
 * The message reads {@code <detail> at line N}.
 */
public class ParseException extends SpiceException
{
	private final String detail;
	private final int line;

	public ParseException(String detail, int line)
	{
		super(detail + " at line " + line);
		this.detail = detail;
		this.line = line;
	}

	/**
	 * @return The message without its position suffix.
	 */
	public String getDetail()
	{
		return detail;
	}

	public int getLine()
	{
		return line;
	}
}
