package com.juanpa.spice.transpiler.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable once constructed and own their children exclusively.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
