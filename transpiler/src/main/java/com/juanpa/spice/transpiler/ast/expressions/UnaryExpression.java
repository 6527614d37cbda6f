package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.lexer.Token;

/**
 * AST node representing a prefix operation: 'not x' or '-x'.
 */
public class UnaryExpression implements Expression
{
	private final Token operator;
	private final Expression operand;

	public UnaryExpression(Token operator, Expression operand)
	{
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + operator.getLexeme() + " " + operand + ")";
	}
}
