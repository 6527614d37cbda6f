package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

public class BreakStatement implements Statement
{
	private final boolean hasSemicolon;

	public BreakStatement(boolean hasSemicolon)
	{
		this.hasSemicolon = hasSemicolon;
	}

	public boolean hasSemicolon()
	{
		return hasSemicolon;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBreakStatement(this);
	}

	@Override
	public String toString()
	{
		return "break";
	}
}
