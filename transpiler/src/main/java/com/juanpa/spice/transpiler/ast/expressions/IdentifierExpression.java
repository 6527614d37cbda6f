package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.lexer.Token;

/**
 * AST node representing a bare name (variable, function, class, 'self').
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public int getLine()
	{
		return name.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
