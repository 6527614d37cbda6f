package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTNode;
import com.juanpa.spice.transpiler.ast.ASTVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A body-less method declared inside an interface.
 */
public class MethodSignature implements ASTNode
{
	private final String name;
	private final List<Parameter> parameters;
	private final String returnType; // may be null

	public MethodSignature(String name, List<Parameter> parameters, String returnType)
	{
		this.name = name;
		this.parameters = new ArrayList<>(parameters);
		this.returnType = returnType;
	}

	public String getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public String getReturnType()
	{
		return returnType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMethodSignature(this);
	}

	@Override
	public String toString()
	{
		String params = parameters.stream().map(Parameter::toString).collect(Collectors.joining(", "));
		return "def " + name + "(" + params + ")" + (returnType != null ? " -> " + returnType : "");
	}
}
