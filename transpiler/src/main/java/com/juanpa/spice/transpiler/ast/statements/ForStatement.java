package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

/**
 * AST node representing 'for TARGET in ITERABLE { body }'.
 * Several comma-separated targets arrive as a single tuple literal.
 */
public class ForStatement implements Statement
{
	private final Expression target;
	private final Expression iterable;
	private final BlockStatement body;

	public ForStatement(Expression target, Expression iterable, BlockStatement body)
	{
		this.target = target;
		this.iterable = iterable;
		this.body = body;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Expression getIterable()
	{
		return iterable;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public String toString()
	{
		return "for " + target + " in " + iterable + " " + body;
	}
}
