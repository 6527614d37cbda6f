package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

/**
 * AST node representing 'raise' or 'raise EXPR'. A bare raise re-raises the active exception.
 */
public class RaiseStatement implements Statement
{
	private final Expression exception; // null for a bare re-raise
	private final boolean hasSemicolon;

	public RaiseStatement(Expression exception, boolean hasSemicolon)
	{
		this.exception = exception;
		this.hasSemicolon = hasSemicolon;
	}

	public Expression getException()
	{
		return exception;
	}

	public boolean hasSemicolon()
	{
		return hasSemicolon;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRaiseStatement(this);
	}

	@Override
	public String toString()
	{
		return exception == null ? "raise" : "raise " + exception;
	}
}
