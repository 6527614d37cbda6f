package com.juanpa.spice.transpiler.util;

import java.util.Properties;

/**
 * Holds configuration settings for the Spice compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String TYPECHECK_LEVEL = "typecheck.level";
	public static final String FINALCHECK_ENABLED = "finalcheck.enabled";
	public static final String OUTPUT_EXTENSION = "output.extension";
	public static final String FOLLOWSET_STRICT = "followset.strict";

	private final String typeCheckLevel;
	private final boolean finalCheckEnabled;
	private final String outputExtension;
	private final boolean followSetStrict;

	public CompilerConfig()
	{
		this(new Properties());
	}

	public CompilerConfig(Properties props)
	{
		this.typeCheckLevel = props.getProperty(TYPECHECK_LEVEL, "none").trim();
		this.finalCheckEnabled = Boolean.parseBoolean(props.getProperty(FINALCHECK_ENABLED, "true").trim());
		String extension = props.getProperty(OUTPUT_EXTENSION, ".py").trim();
		// Accept "py" as well as ".py"
		this.outputExtension = extension.startsWith(".") ? extension : "." + extension;
		this.followSetStrict = Boolean.parseBoolean(props.getProperty(FOLLOWSET_STRICT, "true").trim());
	}

	public String getTypeCheckLevel()
	{
		return typeCheckLevel;
	}

	public boolean isFinalCheckEnabled()
	{
		return finalCheckEnabled;
	}

	public String getOutputExtension()
	{
		return outputExtension;
	}

	public boolean isFollowSetStrict()
	{
		return followSetStrict;
	}
}
