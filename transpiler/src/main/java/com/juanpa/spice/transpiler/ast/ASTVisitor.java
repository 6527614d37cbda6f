// File: src/main/java/com/juanpa/spice/transpiler/ast/ASTVisitor.java

package com.juanpa.spice.transpiler.ast;

import com.juanpa.spice.transpiler.ast.declarations.*;
import com.juanpa.spice.transpiler.ast.expressions.*;
import com.juanpa.spice.transpiler.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type, so adding a node
 * type breaks every visitor at compile time until it handles the new node.
 *
 * @param <R> The return value type of the `visit` methods.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Declarations ---
	R visitInterfaceDeclaration(InterfaceDeclaration declaration);

	R visitMethodSignature(MethodSignature signature);

	R visitClassDeclaration(ClassDeclaration declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitParameter(Parameter parameter);

	R visitImportDirective(ImportDirective directive);

	R visitFinalDeclaration(FinalDeclaration declaration);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitPassStatement(PassStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitForStatement(ForStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitSwitchStatement(SwitchStatement statement);

	R visitSwitchCase(SwitchCase switchCase);

	R visitRaiseStatement(RaiseStatement statement);

	R visitBreakStatement(BreakStatement statement);

	R visitContinueStatement(ContinueStatement statement);

	// --- Expressions ---
	R visitIdentifierExpression(IdentifierExpression expression);

	R visitAttributeExpression(AttributeExpression expression);

	R visitLiteralExpression(LiteralExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitArgumentExpression(ArgumentExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitLogicalExpression(LogicalExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitLambdaExpression(LambdaExpression expression);

	R visitSubscriptExpression(SubscriptExpression expression);

	R visitSliceExpression(SliceExpression expression);

	R visitComprehensionExpression(ComprehensionExpression expression);

	R visitDictEntry(DictEntry entry);
}
