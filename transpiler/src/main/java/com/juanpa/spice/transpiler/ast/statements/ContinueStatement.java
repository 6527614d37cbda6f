package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

public class ContinueStatement implements Statement
{
	private final boolean hasSemicolon;

	public ContinueStatement(boolean hasSemicolon)
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
		return visitor.visitContinueStatement(this);
	}

	@Override
	public String toString()
	{
		return "continue";
	}
}
