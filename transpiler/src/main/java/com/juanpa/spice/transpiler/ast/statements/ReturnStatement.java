package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

/**
 * AST node representing a 'return' statement, with or without a value.
 */
public class ReturnStatement implements Statement
{
	private final Expression value; // null for a bare 'return'
	private final boolean hasSemicolon;

	public ReturnStatement(Expression value, boolean hasSemicolon)
	{
		this.value = value;
		this.hasSemicolon = hasSemicolon;
	}

	public Expression getValue()
	{
		return value;
	}

	public boolean hasSemicolon()
	{
		return hasSemicolon;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return value == null ? "return" : "return " + value;
	}
}
