package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTNode;
import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * AST node representing a parameter: NAME [: TYPE] [= DEFAULT].
 * The default value is kept as source text (a single literal or identifier token).
 */
public class Parameter implements ASTNode
{
	private final String name;
	private final String typeAnnotation; // may be null
	private final String defaultValue;   // may be null

	public Parameter(String name, String typeAnnotation, String defaultValue)
	{
		this.name = name;
		this.typeAnnotation = typeAnnotation;
		this.defaultValue = defaultValue;
	}

	public Parameter(String name)
	{
		this(name, null, null);
	}

	public String getName()
	{
		return name;
	}

	public String getTypeAnnotation()
	{
		return typeAnnotation;
	}

	public String getDefaultValue()
	{
		return defaultValue;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitParameter(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(name);
		if (typeAnnotation != null)
		{
			sb.append(": ").append(typeAnnotation);
		}
		if (defaultValue != null)
		{
			sb.append(" = ").append(defaultValue);
		}
		return sb.toString();
	}
}
