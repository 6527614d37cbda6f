package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;
import com.juanpa.spice.transpiler.ast.statements.Statement;

/**
 * AST node representing 'final NAME [: TYPE] = VALUE', an immutable variable binding.
 */
public class FinalDeclaration implements Statement
{
	private final Expression target;
	private final Expression value;
	private final String typeAnnotation; // may be null
	private final int line;
	private final boolean hasSemicolon;

	public FinalDeclaration(Expression target, Expression value, String typeAnnotation, int line, boolean hasSemicolon)
	{
		this.target = target;
		this.value = value;
		this.typeAnnotation = typeAnnotation;
		this.line = line;
		this.hasSemicolon = hasSemicolon;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Expression getValue()
	{
		return value;
	}

	public String getTypeAnnotation()
	{
		return typeAnnotation;
	}

	public int getLine()
	{
		return line;
	}

	public boolean hasSemicolon()
	{
		return hasSemicolon;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFinalDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "final " + target + (typeAnnotation != null ? ": " + typeAnnotation : "") + " = " + value;
	}
}
