package com.juanpa.spice.transpiler.lexer;

/**
 * Advisory diagnostic recorded by the lexer when a token kind is followed by a kind
 * that the follow-set table does not allow. Never fatal on its own.
 */
public class IllegalFollow
{
	private final TokenType token;
	private final TokenType nextToken;
	private final int line;
	private final int column;

	public IllegalFollow(TokenType token, TokenType nextToken, int line, int column)
	{
		this.token = token;
		this.nextToken = nextToken;
		this.line = line;
		this.column = column;
	}

	public TokenType getToken()
	{
		return token;
	}

	public TokenType getNextToken()
	{
		return nextToken;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public String toString()
	{
		return "Illegal follow: " + token + " followed by " + nextToken + " at line " + line + ", column " + column;
	}
}
