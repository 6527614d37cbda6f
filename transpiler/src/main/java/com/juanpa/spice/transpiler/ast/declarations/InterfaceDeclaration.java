package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing 'interface NAME [extends BASE, ...] { signature* }'.
 */
public class InterfaceDeclaration implements Statement
{
	private final String name;
	private final List<MethodSignature> methods;
	private final List<String> baseInterfaces;

	public InterfaceDeclaration(String name, List<MethodSignature> methods, List<String> baseInterfaces)
	{
		this.name = name;
		this.methods = new ArrayList<>(methods);
		this.baseInterfaces = new ArrayList<>(baseInterfaces);
	}

	public String getName()
	{
		return name;
	}

	public List<MethodSignature> getMethods()
	{
		return Collections.unmodifiableList(methods);
	}

	public List<String> getBaseInterfaces()
	{
		return Collections.unmodifiableList(baseInterfaces);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInterfaceDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("interface ").append(name);
		if (!baseInterfaces.isEmpty())
		{
			sb.append(" extends ").append(String.join(", ", baseInterfaces));
		}
		sb.append(" {\n");
		for (MethodSignature method : methods)
		{
			sb.append("  ").append(method).append(";\n");
		}
		return sb.append("}").toString();
	}
}
