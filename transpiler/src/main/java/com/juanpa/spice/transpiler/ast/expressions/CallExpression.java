package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a call: callee(arg, name=value, ...).
 * Named arguments are {@link ArgumentExpression} nodes; positional ones are plain expressions.
 */
public class CallExpression implements Expression
{
	private final Expression callee;
	private final List<Expression> arguments;

	public CallExpression(Expression callee, List<Expression> arguments)
	{
		this.callee = callee;
		this.arguments = new ArrayList<>(arguments);
	}

	public Expression getCallee()
	{
		return callee;
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
	}
}
