package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

/**
 * AST node representing an expression used as a statement (calls, assignments).
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;
	private final boolean hasSemicolon;

	public ExpressionStatement(Expression expression, boolean hasSemicolon)
	{
		this.expression = expression;
		this.hasSemicolon = hasSemicolon;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public boolean hasSemicolon()
	{
		return hasSemicolon;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression + (hasSemicolon ? ";" : "");
	}
}
