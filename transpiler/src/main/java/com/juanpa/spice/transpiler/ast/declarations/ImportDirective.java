// File: src/main/java/com/juanpa/spice/transpiler/ast/declarations/ImportDirective.java

package com.juanpa.spice.transpiler.ast.declarations;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents an import in Spice source code.
 * Examples:
 * import os.path
 * import numpy as np
 * from typing import List, Dict as D
 * <p>
 * For a plain import the alias list holds at most the module alias; for a from-import it
 * runs parallel to the imported names, with null where no alias was given.
 */
public class ImportDirective implements Statement
{
	private final String module;
	private final List<String> names;
	private final List<String> aliases;
	private final boolean isFromImport;
	private final boolean hasSemicolon;

	public ImportDirective(String module, List<String> names, List<String> aliases, boolean isFromImport,
						   boolean hasSemicolon)
	{
		this.module = module;
		this.names = new ArrayList<>(names);
		this.aliases = new ArrayList<>(aliases);
		this.isFromImport = isFromImport;
		this.hasSemicolon = hasSemicolon;
	}

	public String getModule()
	{
		return module;
	}

	public List<String> getNames()
	{
		return Collections.unmodifiableList(names);
	}

	public List<String> getAliases()
	{
		return Collections.unmodifiableList(aliases);
	}

	public boolean isFromImport()
	{
		return isFromImport;
	}

	public boolean hasSemicolon()
	{
		return hasSemicolon;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitImportDirective(this);
	}

	@Override
	public String toString()
	{
		if (!isFromImport)
		{
			String alias = aliases.isEmpty() ? null : aliases.get(0);
			return "import " + module + (alias != null ? " as " + alias : "");
		}
		StringBuilder sb = new StringBuilder("from ").append(module).append(" import ");
		for (int i = 0; i < names.size(); i++)
		{
			if (i > 0)
			{
				sb.append(", ");
			}
			sb.append(names.get(i));
			String alias = i < aliases.size() ? aliases.get(i) : null;
			if (alias != null)
			{
				sb.append(" as ").append(alias);
			}
		}
		return sb.toString();
	}
}
