package com.juanpa.spice.transpiler.semantics;

import java.util.Locale;

/**
 * How type problems are treated: ignored, reported as warnings, or reported as errors.
 */
public enum TypeEnforcement
{
	NONE,
	WARNINGS,
	STRICT;

	/**
	 * @param level "none", "warnings" or "strict", in any case.
	 * @return The matching level.
	 * @throws IllegalArgumentException for any other text.
	 */
	public static TypeEnforcement fromString(String level)
	{
		if (level == null)
		{
			return NONE;
		}
		switch (level.trim().toLowerCase(Locale.ROOT))
		{
			case "none":
				return NONE;
			case "warnings":
				return WARNINGS;
			case "strict":
				return STRICT;
			default:
				throw new IllegalArgumentException("Unknown type-check level '" + level + "' (expected none, warnings or strict)");
		}
	}
}
