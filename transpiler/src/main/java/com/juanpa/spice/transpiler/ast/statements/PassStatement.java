package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

public class PassStatement implements Statement
{
	private final boolean hasSemicolon;

	public PassStatement(boolean hasSemicolon)
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
		return visitor.visitPassStatement(this);
	}

	@Override
	public String toString()
	{
		return "pass";
	}
}
