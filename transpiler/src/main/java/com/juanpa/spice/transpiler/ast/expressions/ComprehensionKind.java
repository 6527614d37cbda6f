package com.juanpa.spice.transpiler.ast.expressions;

public enum ComprehensionKind
{
	LIST,
	SET,
	DICT,
	GENERATOR
}
