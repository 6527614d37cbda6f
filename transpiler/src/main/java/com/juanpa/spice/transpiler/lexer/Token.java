package com.juanpa.spice.transpiler.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the Spice Lexer.
 * Each token encapsulates its type, the raw source text (lexeme),
 * and its position in the source for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, NUMBER, PLUS)
	private final String lexeme;     // The raw text of the token, null for EOF
	private final int line;          // 1-based line number
	private final int column;        // 0-based column within the line

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type   The TokenType of this token.
	 * @param lexeme The raw string value of the token from the source code (may be null).
	 * @param line   The 1-based line number where this token begins.
	 * @param column The 0-based column where this token begins.
	 */
	public Token(TokenType type, String lexeme, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Format: "TYPE 'lexeme' (Line:L, Col:C)".
	 */
	@Override
	public String toString()
	{
		return type + " '" + (lexeme == null ? "" : lexeme) + "' (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Tokens compare by type and lexeme only; two tokens from different
	 * positions are still "the same" token for testing purposes.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && Objects.equals(lexeme, token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + (lexeme != null ? lexeme.hashCode() : 0);
	}
}
