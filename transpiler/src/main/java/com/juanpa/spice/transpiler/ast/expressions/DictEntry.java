package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * One key: value pair of a dict literal. Only valid as an element of a DICT literal.
 */
public class DictEntry implements Expression
{
	private final Expression key;
	private final Expression value;

	public DictEntry(Expression key, Expression value)
	{
		this.key = key;
		this.value = value;
	}

	public Expression getKey()
	{
		return key;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDictEntry(this);
	}

	@Override
	public String toString()
	{
		return key + ": " + value;
	}
}
