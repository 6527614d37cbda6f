package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.lexer.Token;

/**
 * AST node representing a binary operation: arithmetic, comparison, membership (in, not in)
 * or identity (is, is not).
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator;
	private final Expression right;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	/**
	 * The operator as written in the output. 'not in' and 'is not' span two tokens,
	 * so the parser hands in a synthetic token whose lexeme already holds both words.
	 */
	public String getOperatorText()
	{
		return operator.getLexeme();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + getOperatorText() + " " + right + ")";
	}
}
