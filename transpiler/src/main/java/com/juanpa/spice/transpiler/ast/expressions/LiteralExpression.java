// File: src/main/java/com/juanpa/spice/transpiler/ast/expressions/LiteralExpression.java

package com.juanpa.spice.transpiler.ast.expressions;

import com.juanpa.spice.transpiler.ast.ASTVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a literal value.
 * Scalars keep their raw source text ("42", "3.14", "'hi'", f"{x}", "True", "None");
 * containers (list, set, dict, tuple) keep their element expressions instead, dict
 * elements being {@link DictEntry} nodes.
 */
public class LiteralExpression implements Expression
{
	private final LiteralKind kind;
	private final String value;              // null for containers
	private final List<Expression> elements; // empty for scalars

	/**
	 * Constructs a scalar literal.
	 *
	 * @param kind  The literal kind.
	 * @param value The raw source text of the literal.
	 */
	public LiteralExpression(LiteralKind kind, String value)
	{
		this.kind = kind;
		this.value = value;
		this.elements = Collections.emptyList();
	}

	/**
	 * Constructs a container literal.
	 *
	 * @param kind     LIST, SET, DICT or TUPLE.
	 * @param elements The element expressions in source order.
	 */
	public LiteralExpression(LiteralKind kind, List<Expression> elements)
	{
		this.kind = kind;
		this.value = null;
		this.elements = new ArrayList<>(elements);
	}

	public LiteralKind getKind()
	{
		return kind;
	}

	public String getValue()
	{
		return value;
	}

	public List<Expression> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		if (!kind.isContainer())
		{
			return value;
		}
		String inner = elements.stream().map(Expression::toString).collect(Collectors.joining(", "));
		switch (kind)
		{
			case LIST:
				return "[" + inner + "]";
			case TUPLE:
				return "(" + inner + (elements.size() == 1 ? ",)" : ")");
			default:
				return "{" + inner + "}";
		}
	}
}
