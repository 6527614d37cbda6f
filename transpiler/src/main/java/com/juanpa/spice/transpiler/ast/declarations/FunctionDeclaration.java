// File: src/main/java/com/juanpa/spice/transpiler/ast/declarations/FunctionDeclaration.java

package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.statements.BlockStatement;
import com.juanpa.spice.transpiler.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a function, or a method when it appears inside a class body.
 * Abstract methods have no body.
 */
public class FunctionDeclaration implements Statement
{
	private final String name;
	private final List<Parameter> parameters;
	private final BlockStatement body; // null for abstract methods
	private final String returnType;   // may be null
	private final boolean isStatic;
	private final boolean isAbstract;
	private final boolean isFinal;
	private final List<String> decorators;

	public FunctionDeclaration(String name, List<Parameter> parameters, BlockStatement body, String returnType,
							   boolean isStatic, boolean isAbstract, boolean isFinal, List<String> decorators)
	{
		this.name = name;
		this.parameters = new ArrayList<>(parameters);
		this.body = body;
		this.returnType = returnType;
		this.isStatic = isStatic;
		this.isAbstract = isAbstract;
		this.isFinal = isFinal;
		this.decorators = new ArrayList<>(decorators);
	}

	public String getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public String getReturnType()
	{
		return returnType;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	public boolean isAbstract()
	{
		return isAbstract;
	}

	public boolean isFinal()
	{
		return isFinal;
	}

	public List<String> getDecorators()
	{
		return Collections.unmodifiableList(decorators);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (isStatic)
		{
			sb.append("static ");
		}
		if (isAbstract)
		{
			sb.append("abstract ");
		}
		if (isFinal)
		{
			sb.append("final ");
		}
		sb.append("def ").append(name).append("(")
				.append(parameters.stream().map(Parameter::toString).collect(Collectors.joining(", ")))
				.append(")");
		if (returnType != null)
		{
			sb.append(" -> ").append(returnType);
		}
		sb.append(body == null ? ";" : " " + body);
		return sb.toString();
	}
}
