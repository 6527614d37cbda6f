package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTNode;
import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

/**
 * One 'case VALUE' clause of a switch statement.
 */
public class SwitchCase implements ASTNode
{
	private final Expression value;
	private final BlockStatement body;

	public SwitchCase(Expression value, BlockStatement body)
	{
		this.value = value;
		this.body = body;
	}

	public Expression getValue()
	{
		return value;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSwitchCase(this);
	}

	@Override
	public String toString()
	{
		return "case " + value + " " + body;
	}
}
