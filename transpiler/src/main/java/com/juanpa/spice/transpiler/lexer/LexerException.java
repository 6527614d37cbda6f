package com.juanpa.spice.transpiler.lexer;

import com.juanpa.spice.transpiler.util.SpiceException;

/**
 * Fatal lexical error. Tokenization stops at the first one; there is no recovery.
 * The message reads {@code <detail> at line N, column C}.
 */
public class LexerException extends SpiceException
{
	private final String detail;
	private final int line;
	private final int column;

	public LexerException(String detail, int line, int column)
	{
		super(detail + " at line " + line + ", column " + column);
		this.detail = detail;
		this.line = line;
		this.column = column;
	}

	public String getDetail()
	{
		return detail;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
