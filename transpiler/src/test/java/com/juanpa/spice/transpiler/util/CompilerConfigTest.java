package com.juanpa.spice.transpiler.util;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerConfigTest
{
	@Test
	public void emptyPropertiesGiveDefaults()
	{
		CompilerConfig config = new CompilerConfig();

		assertEquals("none", config.getTypeCheckLevel());
		assertTrue(config.isFinalCheckEnabled());
		assertEquals(".py", config.getOutputExtension());
		assertTrue(config.isFollowSetStrict());
	}

	@Test
	public void readsAndTrimsValues()
	{
		Properties props = new Properties();
		props.setProperty(CompilerConfig.TYPECHECK_LEVEL, " strict ");
		props.setProperty(CompilerConfig.FINALCHECK_ENABLED, "false");
		props.setProperty(CompilerConfig.OUTPUT_EXTENSION, "pyi");
		props.setProperty(CompilerConfig.FOLLOWSET_STRICT, "FALSE");

		CompilerConfig config = new CompilerConfig(props);

		assertEquals("strict", config.getTypeCheckLevel());
		assertFalse(config.isFinalCheckEnabled());
		assertEquals(".pyi", config.getOutputExtension());
		assertFalse(config.isFollowSetStrict());
	}
}
