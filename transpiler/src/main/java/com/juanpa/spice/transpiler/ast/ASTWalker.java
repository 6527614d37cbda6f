package com.juanpa.spice.transpiler.ast;

import com.juanpa.spice.transpiler.ast.declarations.*;
import com.juanpa.spice.transpiler.ast.expressions.*;
import com.juanpa.spice.transpiler.ast.statements.*;

import java.util.List;

/**
 * Visitor that walks every node of the tree and does nothing else.
 * Analysis passes extend it and override only the nodes they care about, calling
 * {@code super} to keep descending.
 */
public abstract class ASTWalker implements ASTVisitor<Void>
{
	protected void walk(ASTNode node)
	{
		if (node != null)
		{
			node.accept(this);
		}
	}

	protected void walkAll(List<? extends ASTNode> nodes)
	{
		for (ASTNode node : nodes)
		{
			walk(node);
		}
	}

	@Override
	public Void visitProgram(Program program)
	{
		walkAll(program.getBody());
		return null;
	}

	@Override
	public Void visitInterfaceDeclaration(InterfaceDeclaration declaration)
	{
		walkAll(declaration.getMethods());
		return null;
	}

	@Override
	public Void visitMethodSignature(MethodSignature signature)
	{
		walkAll(signature.getParameters());
		return null;
	}

	@Override
	public Void visitClassDeclaration(ClassDeclaration declaration)
	{
		walkAll(declaration.getMembers());
		return null;
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		walkAll(declaration.getParameters());
		walk(declaration.getBody());
		return null;
	}

	@Override
	public Void visitParameter(Parameter parameter)
	{
		return null;
	}

	@Override
	public Void visitImportDirective(ImportDirective directive)
	{
		return null;
	}

	@Override
	public Void visitFinalDeclaration(FinalDeclaration declaration)
	{
		walk(declaration.getTarget());
		walk(declaration.getValue());
		return null;
	}

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		walkAll(statement.getStatements());
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		walk(statement.getExpression());
		return null;
	}

	@Override
	public Void visitPassStatement(PassStatement statement)
	{
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		walk(statement.getValue());
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		walk(statement.getCondition());
		walk(statement.getThenBranch());
		walk(statement.getElseBranch());
		return null;
	}

	@Override
	public Void visitForStatement(ForStatement statement)
	{
		walk(statement.getTarget());
		walk(statement.getIterable());
		walk(statement.getBody());
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		walk(statement.getCondition());
		walk(statement.getBody());
		return null;
	}

	@Override
	public Void visitSwitchStatement(SwitchStatement statement)
	{
		walk(statement.getScrutinee());
		walkAll(statement.getCases());
		walk(statement.getDefaultBody());
		return null;
	}

	@Override
	public Void visitSwitchCase(SwitchCase switchCase)
	{
		walk(switchCase.getValue());
		walk(switchCase.getBody());
		return null;
	}

	@Override
	public Void visitRaiseStatement(RaiseStatement statement)
	{
		walk(statement.getException());
		return null;
	}

	@Override
	public Void visitBreakStatement(BreakStatement statement)
	{
		return null;
	}

	@Override
	public Void visitContinueStatement(ContinueStatement statement)
	{
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		return null;
	}

	@Override
	public Void visitAttributeExpression(AttributeExpression expression)
	{
		walk(expression.getObject());
		return null;
	}

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		walkAll(expression.getElements());
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		walk(expression.getCallee());
		walkAll(expression.getArguments());
		return null;
	}

	@Override
	public Void visitArgumentExpression(ArgumentExpression expression)
	{
		walk(expression.getValue());
		return null;
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		walk(expression.getTarget());
		walk(expression.getValue());
		return null;
	}

	@Override
	public Void visitLogicalExpression(LogicalExpression expression)
	{
		walk(expression.getLeft());
		walk(expression.getRight());
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		walk(expression.getOperand());
		return null;
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		walk(expression.getLeft());
		walk(expression.getRight());
		return null;
	}

	@Override
	public Void visitLambdaExpression(LambdaExpression expression)
	{
		walkAll(expression.getParameters());
		walk(expression.getBody());
		return null;
	}

	@Override
	public Void visitSubscriptExpression(SubscriptExpression expression)
	{
		walk(expression.getObject());
		walk(expression.getIndex());
		return null;
	}

	@Override
	public Void visitSliceExpression(SliceExpression expression)
	{
		walk(expression.getStart());
		walk(expression.getStop());
		walk(expression.getStep());
		return null;
	}

	@Override
	public Void visitComprehensionExpression(ComprehensionExpression expression)
	{
		walk(expression.getKey());
		walk(expression.getElement());
		walk(expression.getTarget());
		walk(expression.getIterable());
		walk(expression.getCondition());
		return null;
	}

	@Override
	public Void visitDictEntry(DictEntry entry)
	{
		walk(entry.getKey());
		walk(entry.getValue());
		return null;
	}
}
