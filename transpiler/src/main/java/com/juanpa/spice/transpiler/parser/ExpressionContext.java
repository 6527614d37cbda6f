package com.juanpa.spice.transpiler.parser;

/**
 * Where an expression is being parsed. In a CONDITION (the head of if, while, for,
 * switch) a '{' at operand position starts the statement block instead of a literal.
 */
public enum ExpressionContext
{
	GENERAL,
	CONDITION
}
