// File: src/main/java/com/juanpa/spice/transpiler/semantics/FinalChecker.java

package com.juanpa.spice.transpiler.semantics;

import com.juanpa.spice.transpiler.ast.ASTWalker;
import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.ast.declarations.ClassDeclaration;
import com.juanpa.spice.transpiler.ast.declarations.FinalDeclaration;
import com.juanpa.spice.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.spice.transpiler.ast.expressions.AssignmentExpression;
import com.juanpa.spice.transpiler.ast.expressions.IdentifierExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compile-time check that variables declared {@code final} are never reassigned.
 * <p>
 * Scopes are tracked one level deep: entering a function or class switches the current
 * scope to its name and leaving restores the previous one. An assignment is a violation
 * when its bare-identifier target is final in the current scope or in the global scope.
 * Attribute and subscript targets are not checked.
 */
public class FinalChecker extends ASTWalker
{
	private static final Logger logger = LoggerFactory.getLogger(FinalChecker.class);

	static final String GLOBAL_SCOPE = "global";

	private final Map<String, Set<String>> finalsByScope = new HashMap<>();
	private final List<FinalViolation> violations = new ArrayList<>();
	private String currentScope = GLOBAL_SCOPE;

	/**
	 * Walks the program and collects every reassignment of a final variable.
	 * All state is reset first, so repeated runs on the same tree return equal lists.
	 *
	 * @param program The parsed program.
	 * @return Violations in traversal order.
	 */
	public List<FinalViolation> check(Program program)
	{
		finalsByScope.clear();
		violations.clear();
		currentScope = GLOBAL_SCOPE;

		program.accept(this);
		logger.debug("Final check found {} violation(s)", violations.size());
		return Collections.unmodifiableList(new ArrayList<>(violations));
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		String saved = enterScope(declaration.getName());
		super.visitFunctionDeclaration(declaration);
		currentScope = saved;
		return null;
	}

	@Override
	public Void visitClassDeclaration(ClassDeclaration declaration)
	{
		String saved = enterScope(declaration.getName());
		super.visitClassDeclaration(declaration);
		currentScope = saved;
		return null;
	}

	@Override
	public Void visitFinalDeclaration(FinalDeclaration declaration)
	{
		walk(declaration.getValue());
		if (declaration.getTarget() instanceof IdentifierExpression)
		{
			String name = ((IdentifierExpression) declaration.getTarget()).getName();
			finalsByScope.computeIfAbsent(currentScope, k -> new HashSet<>()).add(name);
			logger.debug("Registered final '{}' in scope '{}'", name, currentScope);
		}
		return null;
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		if (expression.getTarget() instanceof IdentifierExpression)
		{
			String name = ((IdentifierExpression) expression.getTarget()).getName();
			if (isFinal(currentScope, name) || isFinal(GLOBAL_SCOPE, name))
			{
				violations.add(new FinalViolation(expression.getLine(),
						"Line " + expression.getLine() + ": Cannot reassign final variable '" + name + "'"));
			}
		}
		return super.visitAssignmentExpression(expression);
	}

	private String enterScope(String name)
	{
		String saved = currentScope;
		currentScope = name;
		finalsByScope.computeIfAbsent(name, k -> new HashSet<>());
		return saved;
	}

	private boolean isFinal(String scope, String name)
	{
		Set<String> finals = finalsByScope.get(scope);
		return finals != null && finals.contains(name);
	}
}
