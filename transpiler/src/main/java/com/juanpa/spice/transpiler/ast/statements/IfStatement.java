package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

/**
 * AST node representing an 'if' statement.
 * The else branch is either a block, a nested IfStatement (for 'else if' / 'elif'), or null.
 */
public class IfStatement implements Statement
{
	private final Expression condition;
	private final BlockStatement thenBranch;
	private final Statement elseBranch;

	/**
	 * Constructs an IfStatement.
	 *
	 * @param condition  The expression for the condition.
	 * @param thenBranch The block to execute if the condition is true.
	 * @param elseBranch The optional block or chained if statement, may be null.
	 */
	public IfStatement(Expression condition, BlockStatement thenBranch, Statement elseBranch)
	{
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("if ").append(condition).append(" ").append(thenBranch);
		if (elseBranch != null)
		{
			sb.append(" else ").append(elseBranch);
		}
		return sb.toString();
	}
}
