package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * AST node representing object[index], where the index is an expression or a {@link SliceExpression}.
 */
public class SubscriptExpression implements Expression
{
	private final Expression object;
	private final Expression index;

	public SubscriptExpression(Expression object, Expression index)
	{
		this.object = object;
		this.index = index;
	}

	public Expression getObject()
	{
		return object;
	}

	public Expression getIndex()
	{
		return index;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSubscriptExpression(this);
	}

	@Override
	public String toString()
	{
		return object + "[" + index + "]";
	}
}
