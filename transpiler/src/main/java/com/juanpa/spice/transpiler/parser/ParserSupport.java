package com.juanpa.spice.transpiler.parser;

import com.juanpa.spice.transpiler.ast.declarations.Parameter;
import com.juanpa.spice.transpiler.lexer.Token;
import com.juanpa.spice.transpiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Token-level helpers shared by {@link SpiceParser} and {@link ExpressionParser}, plus the
 * small grammar pieces both of them need: type annotations and parameter lists.
 */
abstract class ParserSupport
{
	protected final TokenStream stream;

	protected ParserSupport(TokenStream stream)
	{
		this.stream = stream;
	}

	protected boolean match(TokenType... types)
	{
		return stream.match(types);
	}

	protected boolean check(TokenType... types)
	{
		return stream.check(types);
	}

	protected boolean check(int offset, TokenType type)
	{
		return stream.check(offset, type);
	}

	protected Token advance()
	{
		return stream.advance();
	}

	protected Token peek()
	{
		return stream.peek();
	}

	protected Token peek(int offset)
	{
		return stream.peek(offset);
	}

	protected Token previous()
	{
		return stream.previous();
	}

	protected boolean isAtEnd()
	{
		return stream.isAtEnd();
	}

	/**
	 * Consumes the current token if it is of the expected type, otherwise fails.
	 *
	 * @param type    The expected TokenType.
	 * @param message What was expected, used as the error message.
	 * @return The consumed Token.
	 * @throws ParseException if the current token's type does not match the expected type.
	 */
	protected Token consume(TokenType type, String message)
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	/**
	 * Creates the parse error for a token. Callers throw the result.
	 *
	 * @param token   The token where the error occurred.
	 * @param message What was expected.
	 * @return A new ParseException tagged with the token's line.
	 */
	protected ParseException error(Token token, String message)
	{
		return new ParseException(message, token.getLine());
	}

	/**
	 * Parses a type annotation and returns it as normalised text.
	 * Grammar: `(None | NAME('.' NAME)* | STRING | '[' TYPE (',' TYPE)* ']') ('[' TYPE (',' TYPE)* ']')?`
	 *
	 * @return The annotation text, e.g. "Dict[str, int]".
	 * @throws ParseException if no type is present.
	 */
	protected String typeAnnotation()
	{
		String base;
		if (match(TokenType.NONE))
		{
			base = "None";
		}
		else if (match(TokenType.STRING))
		{
			base = previous().getLexeme(); // forward reference
		}
		else if (match(TokenType.LBRACKET))
		{
			return "[" + typeArguments() + "]";
		}
		else
		{
			StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected type name").getLexeme());
			while (match(TokenType.DOT))
			{
				name.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.' in type").getLexeme());
			}
			base = name.toString();
		}

		if (match(TokenType.LBRACKET))
		{
			return base + "[" + typeArguments() + "]";
		}
		return base;
	}

	/**
	 * Parses `TYPE (',' TYPE)* ']'` after an opening bracket has been consumed.
	 */
	private String typeArguments()
	{
		stream.enterGroup();
		try
		{
			List<String> arguments = new ArrayList<>();
			if (!check(TokenType.RBRACKET))
			{
				do
				{
					arguments.add(typeAnnotation());
				}
				while (match(TokenType.COMMA) && !check(TokenType.RBRACKET));
			}
			consume(TokenType.RBRACKET, "Expected ']' after type arguments");
			return String.join(", ", arguments);
		}
		finally
		{
			stream.exitGroup();
		}
	}

	/**
	 * Parses a parenthesised parameter list; the opening '(' must already be consumed.
	 * Grammar: `(PARAM (',' PARAM)* ','?)? ')'`
	 *
	 * @return The parameters in source order.
	 */
	protected List<Parameter> parameterList()
	{
		stream.enterGroup();
		try
		{
			List<Parameter> parameters = new ArrayList<>();
			while (!check(TokenType.RPAREN))
			{
				parameters.add(parameter());
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RPAREN, "Expected ')' after parameters");
			return parameters;
		}
		finally
		{
			stream.exitGroup();
		}
	}

	/**
	 * Parses a single parameter.
	 * Grammar: `NAME (':' TYPE)? ('=' DEFAULT)?` where DEFAULT is one literal or identifier
	 * token, optionally preceded by '-' for negative numbers.
	 *
	 * @return A Parameter AST node.
	 */
	protected Parameter parameter()
	{
		String name = consume(TokenType.IDENTIFIER, "Expected parameter name").getLexeme();
		String type = null;
		if (match(TokenType.COLON))
		{
			type = typeAnnotation();
		}
		String defaultValue = null;
		if (match(TokenType.ASSIGN))
		{
			defaultValue = defaultValue();
		}
		return new Parameter(name, type, defaultValue);
	}

	private String defaultValue()
	{
		if (match(TokenType.MINUS))
		{
			return "-" + consume(TokenType.NUMBER, "Expected number after '-' in default value").getLexeme();
		}
		if (match(TokenType.NUMBER, TokenType.STRING, TokenType.FSTRING, TokenType.RSTRING, TokenType.FRSTRING,
				TokenType.TRUE, TokenType.FALSE, TokenType.NONE, TokenType.IDENTIFIER))
		{
			return previous().getLexeme();
		}
		if (match(TokenType.REGEX))
		{
			return "r" + previous().getLexeme().substring(2); // re"x" is a raw string in Python
		}
		throw error(peek(), "Expected default value");
	}
}
