// File: src/main/java/com/juanpa/spice/transpiler/parser/ExpressionParser.java

package com.juanpa.spice.transpiler.parser;

import com.juanpa.spice.transpiler.ast.declarations.Parameter;
import com.juanpa.spice.transpiler.ast.expressions.*;
import com.juanpa.spice.transpiler.lexer.Token;
import com.juanpa.spice.transpiler.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Precedence-climbing parser for Spice expressions. Levels, lowest binding first:
 * assignment, or, and, membership/identity, equality, relational, additive,
 * multiplicative, exponentiation, unary, postfix, primary.
 * <p>
 * Assignment and exponentiation are right-associative, every other binary level is
 * left-associative. Inside any bracket pair newlines are insignificant and the context
 * falls back to {@link ExpressionContext#GENERAL}.
 * <p>
 * Operand positions return null when no expression starts there (including a '{' that
 * opens the statement block of a condition); callers decide whether that is an error.
 */
public class ExpressionParser extends ParserSupport
{
	private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);

	private ExpressionContext context = ExpressionContext.GENERAL;

	public ExpressionParser(TokenStream stream)
	{
		super(stream);
	}

	/**
	 * Parses one expression starting at the cursor.
	 *
	 * @param context GENERAL, or CONDITION for the head of a compound statement.
	 * @return The expression, or null if none starts at the cursor.
	 * @throws ParseException on malformed input.
	 */
	public Expression parse(ExpressionContext context)
	{
		ExpressionContext saved = this.context;
		this.context = context;
		try
		{
			return assignment();
		}
		finally
		{
			this.context = saved;
		}
	}

	/**
	 * Parses a loop target: one or more comma-separated postfix expressions.
	 * Several targets become a tuple literal.
	 *
	 * @return The target expression.
	 * @throws ParseException if no target is present.
	 */
	public Expression parseTarget()
	{
		Expression first = require(postfix(), "Expected loop target");
		if (!check(TokenType.COMMA))
		{
			return first;
		}
		List<Expression> targets = new ArrayList<>();
		targets.add(first);
		while (match(TokenType.COMMA))
		{
			targets.add(require(postfix(), "Expected loop target after ','"));
		}
		return new LiteralExpression(LiteralKind.TUPLE, targets);
	}

	// --- Precedence levels ---

	private Expression assignment()
	{
		Expression target = or();
		if (target == null)
		{
			return null;
		}

		if (match(TokenType.ASSIGN, TokenType.PLUSASSIGN, TokenType.MINUSASSIGN, TokenType.STARASSIGN,
				TokenType.SLASHASSIGN, TokenType.PERCENTASSIGN, TokenType.DOUBLESTARASSIGN, TokenType.DOUBLESLASHASSIGN))
		{
			Token operator = previous();
			if (!isAssignable(target))
			{
				throw error(operator, "Invalid assignment target");
			}
			Expression value = require(assignment(), operator); // Right-associative
			return new AssignmentExpression(target, operator, value);
		}
		return target;
	}

	private Expression or()
	{
		Expression expr = and();
		if (expr == null)
		{
			return null;
		}
		while (matchContinuation(TokenType.OR))
		{
			Token operator = previous();
			Expression right = require(and(), operator);
			expr = new LogicalExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression and()
	{
		Expression expr = membership();
		if (expr == null)
		{
			return null;
		}
		while (matchContinuation(TokenType.AND))
		{
			Token operator = previous();
			Expression right = require(membership(), operator);
			expr = new LogicalExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Grammar: `EQUALITY (('in' | 'not' 'in' | 'is' | 'is' 'not') EQUALITY)*`
	 */
	private Expression membership()
	{
		Expression expr = equality();
		if (expr == null)
		{
			return null;
		}
		while (true)
		{
			Token operator;
			if (match(TokenType.IN))
			{
				operator = previous();
			}
			else if (check(TokenType.NOT) && check(1, TokenType.IN))
			{
				Token not = advance();
				advance();
				operator = new Token(TokenType.IN, "not in", not.getLine(), not.getColumn());
			}
			else if (match(TokenType.IS))
			{
				Token is = previous();
				operator = match(TokenType.NOT) ? new Token(TokenType.IS, "is not", is.getLine(), is.getColumn()) : is;
			}
			else
			{
				break;
			}
			Expression right = require(equality(), operator);
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression equality()
	{
		Expression expr = relational();
		if (expr == null)
		{
			return null;
		}
		while (match(TokenType.EQUAL, TokenType.NOTEQUAL))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, require(relational(), operator));
		}
		return expr;
	}

	private Expression relational()
	{
		Expression expr = additive();
		if (expr == null)
		{
			return null;
		}
		while (match(TokenType.LESS, TokenType.GREATER, TokenType.LESSEQUAL, TokenType.GREATEREQUAL))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, require(additive(), operator));
		}
		return expr;
	}

	private Expression additive()
	{
		Expression expr = multiplicative();
		if (expr == null)
		{
			return null;
		}
		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, require(multiplicative(), operator));
		}
		return expr;
	}

	private Expression multiplicative()
	{
		Expression expr = exponent();
		if (expr == null)
		{
			return null;
		}
		while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT, TokenType.DOUBLESLASH))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, require(exponent(), operator));
		}
		return expr;
	}

	/**
	 * Right-associative: 2 ** 3 ** 2 is 2 ** (3 ** 2).
	 */
	private Expression exponent()
	{
		Expression base = unary();
		if (base == null)
		{
			return null;
		}
		if (match(TokenType.DOUBLESTAR))
		{
			Token operator = previous();
			return new BinaryExpression(base, operator, require(exponent(), operator));
		}
		return base;
	}

	private Expression unary()
	{
		if (match(TokenType.NOT, TokenType.MINUS))
		{
			Token operator = previous();
			return new UnaryExpression(operator, require(unary(), operator));
		}
		return postfix();
	}

	/**
	 * Grammar: `PRIMARY ('.' NAME | '(' ARGUMENTS ')' | '[' SUBSCRIPT ']')*`
	 */
	private Expression postfix()
	{
		Expression expr = primary();
		if (expr == null)
		{
			return null;
		}

		while (true)
		{
			if (match(TokenType.DOT))
			{
				String name = consume(TokenType.IDENTIFIER, "Expected attribute name after '.'").getLexeme();
				expr = new AttributeExpression(expr, name);
			}
			else if (match(TokenType.LPAREN))
			{
				expr = new CallExpression(expr, grouped(this::arguments));
			}
			else if (match(TokenType.LBRACKET))
			{
				Expression object = expr;
				expr = grouped(() -> subscript(object));
			}
			else
			{
				break;
			}
		}
		return expr;
	}

	private Expression primary()
	{
		Token token = peek();
		switch (token.getType())
		{
			case NUMBER:
				advance();
				return new LiteralExpression(LiteralKind.NUMBER, token.getLexeme());
			case STRING:
				advance();
				return new LiteralExpression(LiteralKind.STRING, token.getLexeme());
			case FSTRING:
				advance();
				return new LiteralExpression(LiteralKind.FSTRING, token.getLexeme());
			case RSTRING:
				advance();
				return new LiteralExpression(LiteralKind.RSTRING, token.getLexeme());
			case FRSTRING:
				advance();
				return new LiteralExpression(LiteralKind.FRSTRING, token.getLexeme());
			case REGEX:
				advance();
				return new LiteralExpression(LiteralKind.REGEX, token.getLexeme());
			case TRUE:
			case FALSE:
				advance();
				return new LiteralExpression(LiteralKind.BOOLEAN, token.getLexeme());
			case NONE:
				advance();
				return new LiteralExpression(LiteralKind.NONE, token.getLexeme());
			case IDENTIFIER:
				advance();
				return new IdentifierExpression(token);
			case LAMBDA:
				advance();
				return lambda();
			case LPAREN:
				advance();
				return grouped(this::parenthesized);
			case LBRACKET:
				advance();
				return grouped(this::listLiteral);
			case LBRACE:
				if (context == ExpressionContext.CONDITION && !followsArrow())
				{
					logger.debug("'{' at line {} ends the condition", token.getLine());
					return null; // Left for the statement parser as the block start
				}
				advance();
				return grouped(this::braceLiteral);
			default:
				return null;
		}
	}

	// --- Primary forms ---

	/**
	 * After '(': empty tuple, generator expression, tuple, or a parenthesised expression.
	 */
	private Expression parenthesized()
	{
		if (match(TokenType.RPAREN))
		{
			return new LiteralExpression(LiteralKind.TUPLE, new ArrayList<>());
		}

		Expression first = require(or(), "Expected expression after '('");
		if (check(TokenType.FOR))
		{
			return comprehension(ComprehensionKind.GENERATOR, null, first, TokenType.RPAREN);
		}
		if (match(TokenType.COMMA))
		{
			List<Expression> elements = new ArrayList<>();
			elements.add(first);
			while (!check(TokenType.RPAREN))
			{
				elements.add(require(or(), "Expected tuple element"));
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RPAREN, "Expected ')' after tuple elements");
			return new LiteralExpression(LiteralKind.TUPLE, elements);
		}
		consume(TokenType.RPAREN, "Expected ')' after expression");
		return first;
	}

	/**
	 * After '[': empty list, list comprehension, or list literal (trailing comma allowed).
	 */
	private Expression listLiteral()
	{
		if (match(TokenType.RBRACKET))
		{
			return new LiteralExpression(LiteralKind.LIST, new ArrayList<>());
		}

		Expression first = require(or(), "Expected list element");
		if (check(TokenType.FOR))
		{
			return comprehension(ComprehensionKind.LIST, null, first, TokenType.RBRACKET);
		}
		List<Expression> elements = new ArrayList<>();
		elements.add(first);
		while (match(TokenType.COMMA) && !check(TokenType.RBRACKET))
		{
			elements.add(require(or(), "Expected list element"));
		}
		consume(TokenType.RBRACKET, "Expected ']' after list elements");
		return new LiteralExpression(LiteralKind.LIST, elements);
	}

	/**
	 * After '{': empty dict, dict literal or comprehension, set literal or comprehension.
	 */
	private Expression braceLiteral()
	{
		if (match(TokenType.RBRACE))
		{
			return new LiteralExpression(LiteralKind.DICT, new ArrayList<>());
		}

		Expression first = require(or(), "Expected expression after '{'");
		if (match(TokenType.COLON))
		{
			Expression value = require(or(), "Expected dict value after ':'");
			if (check(TokenType.FOR))
			{
				return comprehension(ComprehensionKind.DICT, first, value, TokenType.RBRACE);
			}
			List<Expression> entries = new ArrayList<>();
			entries.add(new DictEntry(first, value));
			while (match(TokenType.COMMA) && !check(TokenType.RBRACE))
			{
				Expression key = require(or(), "Expected dict key");
				consume(TokenType.COLON, "Expected ':' after dict key");
				entries.add(new DictEntry(key, require(or(), "Expected dict value after ':'")));
			}
			consume(TokenType.RBRACE, "Expected '}' after dict entries");
			return new LiteralExpression(LiteralKind.DICT, entries);
		}

		if (check(TokenType.FOR))
		{
			return comprehension(ComprehensionKind.SET, null, first, TokenType.RBRACE);
		}
		List<Expression> elements = new ArrayList<>();
		elements.add(first);
		while (match(TokenType.COMMA) && !check(TokenType.RBRACE))
		{
			elements.add(require(or(), "Expected set element"));
		}
		consume(TokenType.RBRACE, "Expected '}' after set elements");
		return new LiteralExpression(LiteralKind.SET, elements);
	}

	/**
	 * Parses `for TARGET in ITER ('if' COND)?` followed by the closing delimiter.
	 * The iterable and the condition must end exactly where a depth-counting scan says
	 * they end, so nested brackets inside them cannot cut the clause short.
	 */
	private Expression comprehension(ComprehensionKind kind, Expression key, Expression element, TokenType closer)
	{
		consume(TokenType.FOR, "Expected 'for' in comprehension");
		Expression target = parseTarget();
		consume(TokenType.IN, "Expected 'in' in comprehension");

		int end = clauseEnd(true);
		Expression iterable = require(or(), "Expected iterable in comprehension");
		expectBoundary(end, "Unexpected token in comprehension iterable");

		Expression condition = null;
		if (match(TokenType.IF))
		{
			end = clauseEnd(false);
			condition = require(or(), "Expected condition after 'if' in comprehension");
			expectBoundary(end, "Unexpected token in comprehension condition");
		}

		consume(closer, "Expected '" + closerText(closer) + "' after comprehension");
		return new ComprehensionExpression(kind, key, element, target, iterable, condition);
	}

	/**
	 * Scans forward from the cursor for the end of a comprehension clause.
	 *
	 * @param stopAtIf Whether an 'if' at depth 0 also ends the clause.
	 * @return Token index of the closing delimiter (or 'if') at nesting depth 0.
	 */
	private int clauseEnd(boolean stopAtIf)
	{
		int depth = 0;
		for (int i = stream.position(); ; i++)
		{
			Token token = stream.tokenAt(i);
			switch (token.getType())
			{
				case LPAREN:
				case LBRACKET:
				case LBRACE:
					depth++;
					break;
				case RPAREN:
				case RBRACKET:
				case RBRACE:
					if (depth == 0)
					{
						return i;
					}
					depth--;
					break;
				case IF:
					if (depth == 0 && stopAtIf)
					{
						return i;
					}
					break;
				case EOF:
					throw error(token, "Unterminated comprehension");
				default:
					break;
			}
		}
	}

	private void expectBoundary(int end, String message)
	{
		if (stream.position() != end)
		{
			throw error(peek(), message);
		}
	}

	/**
	 * After 'lambda'. Two forms:
	 * `lambda(PARAMS) (':' TYPE)? '->' BODY` and `lambda NAME (',' NAME)* ':' BODY`,
	 * where BODY is `'{' EXPRESSION '}'` or an expression.
	 */
	private Expression lambda()
	{
		List<Parameter> parameters;
		String returnType = null;

		if (match(TokenType.LPAREN))
		{
			parameters = parameterList();
			if (match(TokenType.COLON))
			{
				returnType = typeAnnotation();
			}
			consume(TokenType.ARROW, "Expected '->' after lambda parameters");
		}
		else
		{
			// Bare names only: the ':' ends the parameter list here
			parameters = new ArrayList<>();
			while (check(TokenType.IDENTIFIER))
			{
				parameters.add(new Parameter(advance().getLexeme()));
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.COLON, "Expected ':' after lambda parameters");
		}

		Expression body;
		if (match(TokenType.LBRACE))
		{
			body = grouped(() -> {
				Expression inner = require(or(), "Expected expression in lambda body");
				consume(TokenType.RBRACE, "Expected '}' after lambda body");
				return inner;
			});
		}
		else
		{
			body = require(or(), "Expected lambda body");
		}
		return new LambdaExpression(parameters, body, returnType);
	}

	/**
	 * After '(' of a call. Named arguments are detected with two tokens of lookahead.
	 */
	private List<Expression> arguments()
	{
		List<Expression> arguments = new ArrayList<>();
		while (!check(TokenType.RPAREN))
		{
			if (check(TokenType.IDENTIFIER) && check(1, TokenType.ASSIGN))
			{
				String name = advance().getLexeme();
				Token assign = advance();
				arguments.add(new ArgumentExpression(name, require(or(), assign)));
			}
			else
			{
				arguments.add(require(or(), "Expected argument"));
			}
			if (!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RPAREN, "Expected ')' after arguments");
		return arguments;
	}

	/**
	 * After '[' of a subscript: a plain index, or a slice START? ':' STOP? (':' STEP?)?.
	 */
	private Expression subscript(Expression object)
	{
		if (check(TokenType.RBRACKET))
		{
			throw error(peek(), "Empty subscript not allowed");
		}

		Expression start = null;
		if (!check(TokenType.COLON))
		{
			start = require(or(), "Expected index expression");
			if (!check(TokenType.COLON))
			{
				consume(TokenType.RBRACKET, "Expected ']' after index");
				return new SubscriptExpression(object, start);
			}
		}

		consume(TokenType.COLON, "Expected ':' in slice");
		Expression stop = null;
		Expression step = null;
		if (!check(TokenType.COLON, TokenType.RBRACKET))
		{
			stop = require(or(), "Expected slice stop");
		}
		if (match(TokenType.COLON) && !check(TokenType.RBRACKET))
		{
			step = require(or(), "Expected slice step");
		}
		consume(TokenType.RBRACKET, "Expected ']' after slice");
		return new SubscriptExpression(object, new SliceExpression(start, stop, step));
	}

	// --- Helpers ---

	/**
	 * Runs a parse step inside a bracket pair: newlines are skipped and the context is
	 * GENERAL until the step returns.
	 */
	private <T> T grouped(Supplier<T> step)
	{
		ExpressionContext saved = context;
		context = ExpressionContext.GENERAL;
		stream.enterGroup();
		try
		{
			return step.get();
		}
		finally
		{
			stream.exitGroup();
			context = saved;
		}
	}

	/**
	 * Matches 'and'/'or', also when the operator starts the next line.
	 */
	private boolean matchContinuation(TokenType type)
	{
		if (match(type))
		{
			return true;
		}
		if (!stream.isGrouped() && stream.checkAfterNewlines(type))
		{
			stream.skipNewlines();
			advance();
			return true;
		}
		return false;
	}

	private boolean followsArrow()
	{
		Token before = stream.previousSignificant();
		return before != null && before.getType() == TokenType.ARROW;
	}

	private static boolean isAssignable(Expression target)
	{
		if (target instanceof IdentifierExpression || target instanceof AttributeExpression
				|| target instanceof SubscriptExpression)
		{
			return true;
		}
		if (target instanceof LiteralExpression)
		{
			LiteralExpression literal = (LiteralExpression) target;
			return literal.getKind() == LiteralKind.TUPLE || literal.getKind() == LiteralKind.LIST;
		}
		return false;
	}

	private Expression require(Expression expression, Token operator)
	{
		return require(expression, "Expected expression after '" + operator.getLexeme() + "'");
	}

	private Expression require(Expression expression, String message)
	{
		if (expression == null)
		{
			throw error(peek(), message);
		}
		return expression;
	}

	private static String closerText(TokenType closer)
	{
		switch (closer)
		{
			case RPAREN:
				return ")";
			case RBRACKET:
				return "]";
			default:
				return "}";
		}
	}
}
