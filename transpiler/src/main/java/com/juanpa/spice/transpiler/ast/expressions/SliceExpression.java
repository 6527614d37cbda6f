package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * AST node representing start:stop:step inside a subscript.
 * Elided components are null, never a placeholder value.
 */
public class SliceExpression implements Expression
{
	private final Expression start;
	private final Expression stop;
	private final Expression step;

	public SliceExpression(Expression start, Expression stop, Expression step)
	{
		this.start = start;
		this.stop = stop;
		this.step = step;
	}

	public Expression getStart()
	{
		return start;
	}

	public Expression getStop()
	{
		return stop;
	}

	public Expression getStep()
	{
		return step;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSliceExpression(this);
	}

	@Override
	public String toString()
	{
		return (start != null ? start.toString() : "") + ":" + (stop != null ? stop.toString() : "")
				+ (step != null ? ":" + step : "");
	}
}
