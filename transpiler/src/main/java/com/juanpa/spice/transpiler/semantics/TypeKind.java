package com.juanpa.spice.transpiler.semantics;

/**
 * Built-in type kinds of the Spice type system.
 */
public enum TypeKind
{
	ANY("any"),
	NONE("None"),
	BOOL("bool"),
	INT("int"),
	FLOAT("float"),
	STR("str"),
	LIST("list"),
	DICT("dict"),
	TUPLE("tuple"),
	CALLABLE("callable"),
	PROTOCOL("protocol"),
	CLASS("class");

	private final String displayName;

	TypeKind(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}
}
