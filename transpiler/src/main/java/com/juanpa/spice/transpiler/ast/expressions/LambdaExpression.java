package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.declarations.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing an anonymous function with a single expression body.
 */
public class LambdaExpression implements Expression
{
	private final List<Parameter> parameters;
	private final Expression body;
	private final String returnType; // may be null

	public LambdaExpression(List<Parameter> parameters, Expression body, String returnType)
	{
		this.parameters = new ArrayList<>(parameters);
		this.body = body;
		this.returnType = returnType;
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public Expression getBody()
	{
		return body;
	}

	public String getReturnType()
	{
		return returnType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLambdaExpression(this);
	}

	@Override
	public String toString()
	{
		String params = parameters.stream().map(Parameter::getName).collect(Collectors.joining(", "));
		return "lambda(" + params + ") -> { " + body + " }";
	}
}
