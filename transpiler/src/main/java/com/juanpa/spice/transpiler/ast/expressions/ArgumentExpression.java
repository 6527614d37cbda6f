package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * A named call argument: name=value. Only valid directly inside a call's argument list.
 */
public class ArgumentExpression implements Expression
{
	private final String name;
	private final Expression value;

	public ArgumentExpression(String name, Expression value)
	{
		this.name = name;
		this.value = value;
	}

	public String getName()
	{
		return name;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArgumentExpression(this);
	}

	@Override
	public String toString()
	{
		return name + "=" + value;
	}
}
