// File: src/main/java/com/juanpa/spice/transpiler/ast/Program.java

package com.juanpa.spice.transpiler.ast;

import com.juanpa.spice.transpiler.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing one Spice compilation unit:
 * its top-level declarations and statements in source order.
 */
public class Program implements ASTNode
{
	private final List<Statement> body;

	public Program(List<Statement> body)
	{
		this.body = new ArrayList<>(body);
	}

	public List<Statement> getBody()
	{
		return Collections.unmodifiableList(body);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : body)
		{
			sb.append(statement).append("\n");
		}
		return sb.toString();
	}
}
