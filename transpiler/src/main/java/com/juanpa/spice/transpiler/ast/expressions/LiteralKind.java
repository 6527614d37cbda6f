package com.juanpa.spice.transpiler.ast.expressions;

/**
 * Classification of a {@link LiteralExpression}. The last four are containers whose
 * value is carried by their element expressions.
 */
public enum LiteralKind
{
	NUMBER,
	STRING,
	FSTRING,
	RSTRING,
	FRSTRING,
	REGEX,
	BOOLEAN,
	NONE,
	LIST,
	SET,
	DICT,
	TUPLE;

	public boolean isContainer()
	{
		return this == LIST || this == SET || this == DICT || this == TUPLE;
	}
}
