// File: src/main/java/com/juanpa/spice/transpiler/ast/declarations/ClassDeclaration.java

package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a class declaration.
 * Bases come from either the call-style list or 'extends'; interfaces from 'implements'.
 * Members are methods, final fields, nested classes or plain statements.
 */
public class ClassDeclaration implements Statement
{
	private final String name;
	private final List<Statement> members;
	private final List<String> bases;
	private final List<String> interfaces;
	private final boolean isAbstract;
	private final boolean isFinal;

	public ClassDeclaration(String name, List<Statement> members, List<String> bases, List<String> interfaces,
							boolean isAbstract, boolean isFinal)
	{
		this.name = name;
		this.members = new ArrayList<>(members);
		this.bases = new ArrayList<>(bases);
		this.interfaces = new ArrayList<>(interfaces);
		this.isAbstract = isAbstract;
		this.isFinal = isFinal;
	}

	public String getName()
	{
		return name;
	}

	public List<Statement> getMembers()
	{
		return Collections.unmodifiableList(members);
	}

	public List<String> getBases()
	{
		return Collections.unmodifiableList(bases);
	}

	public List<String> getInterfaces()
	{
		return Collections.unmodifiableList(interfaces);
	}

	public boolean isAbstract()
	{
		return isAbstract;
	}

	public boolean isFinal()
	{
		return isFinal;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitClassDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (isAbstract)
		{
			sb.append("abstract ");
		}
		if (isFinal)
		{
			sb.append("final ");
		}
		sb.append("class ").append(name);
		if (!bases.isEmpty())
		{
			sb.append(" extends ").append(String.join(", ", bases));
		}
		if (!interfaces.isEmpty())
		{
			sb.append(" implements ").append(String.join(", ", interfaces));
		}
		sb.append(" {\n");
		for (Statement member : members)
		{
			sb.append("  ").append(member).append("\n");
		}
		return sb.append("}").toString();
	}
}
