package com.juanpa.spice.transpiler.ast.statements;

import com.juanpa.spice.transpiler.ast.ASTNode;

/**
 * Marker interface for anything that can stand in a statement position:
 * plain statements as well as declarations, which Spice allows at any level.
 */
public interface Statement extends ASTNode
{
}
