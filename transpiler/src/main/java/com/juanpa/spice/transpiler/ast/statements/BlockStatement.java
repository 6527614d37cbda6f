package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a brace-delimited block: { statement* }.
 */
public class BlockStatement implements Statement
{
	private final List<Statement> statements;

	public BlockStatement(List<Statement> statements)
	{
		this.statements = new ArrayList<>(statements);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement statement : statements)
		{
			sb.append("  ").append(statement).append("\n");
		}
		return sb.append("}").toString();
	}
}
