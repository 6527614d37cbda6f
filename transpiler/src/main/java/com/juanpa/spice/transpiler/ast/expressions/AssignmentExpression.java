package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.lexer.Token;

/**
 * AST node representing an assignment (e.g., x = 5, total += n, a.b = c).
 * The operator token distinguishes plain from compound assignment.
 */
public class AssignmentExpression implements Expression
{
	private final Expression target;
	private final Token operator;
	private final Expression value;

	public AssignmentExpression(Expression target, Token operator, Expression value)
	{
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	/**
	 * @return The line of the assignment operator.
	 */
	public int getLine()
	{
		return operator.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}

	@Override
	public String toString()
	{
		return target + " " + operator.getLexeme() + " " + value;
	}
}
