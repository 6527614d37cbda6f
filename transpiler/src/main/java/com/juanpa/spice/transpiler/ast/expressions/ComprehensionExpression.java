package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

/**
 * AST node representing a list, set, dict or generator comprehension:
 * [element for target in iterable if condition].
 * For dict comprehensions the key is separate and the element is the value.
 */
public class ComprehensionExpression implements Expression
{
	private final ComprehensionKind kind;
	private final Expression key;       // DICT only
	private final Expression element;
	private final Expression target;
	private final Expression iterable;
	private final Expression condition; // may be null

	public ComprehensionExpression(ComprehensionKind kind, Expression key, Expression element, Expression target,
								   Expression iterable, Expression condition)
	{
		this.kind = kind;
		this.key = key;
		this.element = element;
		this.target = target;
		this.iterable = iterable;
		this.condition = condition;
	}

	public ComprehensionKind getKind()
	{
		return kind;
	}

	public Expression getKey()
	{
		return key;
	}

	public Expression getElement()
	{
		return element;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Expression getIterable()
	{
		return iterable;
	}

	public Expression getCondition()
	{
		return condition;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitComprehensionExpression(this);
	}

	@Override
	public String toString()
	{
		String head = kind == ComprehensionKind.DICT ? key + ": " + element : element.toString();
		String clause = head + " for " + target + " in " + iterable + (condition != null ? " if " + condition : "");
		switch (kind)
		{
			case LIST:
				return "[" + clause + "]";
			case GENERATOR:
				return "(" + clause + ")";
			default:
				return "{" + clause + "}";
		}
	}
}
