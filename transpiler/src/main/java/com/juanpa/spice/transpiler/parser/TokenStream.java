// File: src/main/java/com/juanpa/spice/transpiler/parser/TokenStream.java

package com.juanpa.spice.transpiler.parser;

import com.juanpa.spice.transpiler.lexer.Token;
import com.juanpa.spice.transpiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor over the token list, shared by the statement parser and the expression parser.
 * <p>
 * While at least one bracket group is open (see {@link #enterGroup()}), NEWLINE tokens are
 * insignificant and are stepped over transparently by every lookahead method.
 */
public class TokenStream
{
	private final List<Token> tokens;
	private int current = 0;
	private int groupDepth = 0;

	/**
	 * @param tokens Tokens produced by the lexer. An EOF token is appended if missing.
	 */
	public TokenStream(List<Token> tokens)
	{
		this.tokens = new ArrayList<>(tokens);
		if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).getType() != TokenType.EOF)
		{
			int line = this.tokens.isEmpty() ? 1 : this.tokens.get(this.tokens.size() - 1).getLine();
			this.tokens.add(new Token(TokenType.EOF, null, line, 0));
		}
	}

	/**
	 * Opens a bracket group: newlines stop mattering until the matching {@link #exitGroup()}.
	 */
	public void enterGroup()
	{
		groupDepth++;
	}

	public void exitGroup()
	{
		groupDepth--;
	}

	public boolean isGrouped()
	{
		return groupDepth > 0;
	}

	/**
	 * @return Index of the current token; moves past ignorable newlines first.
	 */
	public int position()
	{
		skipGroupedNewlines();
		return current;
	}

	/**
	 * @param index An absolute index into the token list.
	 * @return The token there, or EOF past the end.
	 */
	public Token tokenAt(int index)
	{
		return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
	}

	/**
	 * Looks at the token at a given offset from the current position without consuming it.
	 * Inside a group the offset counts significant tokens only.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.).
	 * @return The Token at the specified offset, or EOF if past the end of the token list.
	 */
	public Token peek(int offset)
	{
		skipGroupedNewlines();
		if (!isGrouped())
		{
			return tokenAt(current + offset);
		}
		int index = current;
		int remaining = offset;
		while (index < tokens.size() - 1)
		{
			if (tokens.get(index).getType() != TokenType.NEWLINE)
			{
				if (remaining == 0)
				{
					break;
				}
				remaining--;
			}
			index++;
		}
		return tokenAt(index);
	}

	public Token peek()
	{
		return peek(0);
	}

	/**
	 * @return The token just consumed.
	 */
	public Token previous()
	{
		return tokens.get(Math.max(current - 1, 0));
	}

	/**
	 * Looks backward from the cursor, skipping line breaks and comments.
	 *
	 * @return The last significant token before the cursor, or null at the start of input.
	 */
	public Token previousSignificant()
	{
		for (int i = current - 1; i >= 0; i--)
		{
			TokenType type = tokens.get(i).getType();
			if (type != TokenType.NEWLINE && type != TokenType.COMMENT)
			{
				return tokens.get(i);
			}
		}
		return null;
	}

	/**
	 * Consumes the current token and returns it.
	 *
	 * @return The consumed Token.
	 */
	public Token advance()
	{
		skipGroupedNewlines();
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	public boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Checks if the current token's type matches any of the given types. Always false at EOF.
	 *
	 * @param types The TokenType(s) to check against.
	 * @return True if the current token matches any of the types, false otherwise.
	 */
	public boolean check(TokenType... types)
	{
		if (isAtEnd())
		{
			return false;
		}
		TokenType currentType = peek().getType();
		for (TokenType type : types)
		{
			if (currentType == type)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * @param offset The offset from the current token.
	 * @param type   The TokenType to check for.
	 * @return True if the token at the offset matches the type.
	 */
	public boolean check(int offset, TokenType type)
	{
		return peek(offset).getType() == type;
	}

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	public boolean match(TokenType... types)
	{
		if (check(types))
		{
			advance();
			return true;
		}
		return false;
	}

	/**
	 * Consumes any run of NEWLINE tokens at the cursor.
	 */
	public void skipNewlines()
	{
		while (tokens.get(current).getType() == TokenType.NEWLINE)
		{
			current++;
		}
	}

	/**
	 * Tests whether the first token after any run of newlines is one of the given types.
	 * Nothing is consumed.
	 *
	 * @param types The TokenType(s) to look for.
	 * @return True on a match.
	 */
	public boolean checkAfterNewlines(TokenType... types)
	{
		int index = current;
		while (tokens.get(index).getType() == TokenType.NEWLINE)
		{
			index++;
		}
		TokenType found = tokens.get(index).getType();
		for (TokenType type : types)
		{
			if (found == type)
			{
				return true;
			}
		}
		return false;
	}

	private void skipGroupedNewlines()
	{
		if (isGrouped())
		{
			skipNewlines();
		}
	}
}
