package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.expressions.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a 'switch' statement: a scrutinee, its case clauses in source
 * order and an optional default body.
 */
public class SwitchStatement implements Statement
{
	private final Expression scrutinee;
	private final List<SwitchCase> cases;
	private final BlockStatement defaultBody; // null when there is no default clause

	public SwitchStatement(Expression scrutinee, List<SwitchCase> cases, BlockStatement defaultBody)
	{
		this.scrutinee = scrutinee;
		this.cases = new ArrayList<>(cases);
		this.defaultBody = defaultBody;
	}

	public Expression getScrutinee()
	{
		return scrutinee;
	}

	public List<SwitchCase> getCases()
	{
		return Collections.unmodifiableList(cases);
	}

	public BlockStatement getDefaultBody()
	{
		return defaultBody;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSwitchStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("switch ").append(scrutinee).append(" {\n");
		for (SwitchCase switchCase : cases)
		{
			sb.append("  ").append(switchCase).append("\n");
		}
		if (defaultBody != null)
		{
			sb.append("  default ").append(defaultBody).append("\n");
		}
		return sb.append("}").toString();
	}
}
