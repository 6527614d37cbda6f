package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * AST node representing attribute access: object.attribute.
 */
public class AttributeExpression implements Expression
{
	private final Expression object;
	private final String attribute;

	public AttributeExpression(Expression object, String attribute)
	{
		this.object = object;
		this.attribute = attribute;
	}

	public Expression getObject()
	{
		return object;
	}

	public String getAttribute()
	{
		return attribute;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAttributeExpression(this);
	}

	@Override
	public String toString()
	{
		return object + "." + attribute;
	}
}
