// File: src/main/java/com/juanpa/spice/transpiler/codegen/PythonTransformer.java

package com.juanpa.spice.transpiler.codegen;

import com.juanpa.spice.transpiler.ast.ASTVisitor;
import com.juanpa.spice.transpiler.ast.ASTWalker;
import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.ast.declarations.*;
import com.juanpa.spice.transpiler.ast.expressions.*;
import com.juanpa.spice.transpiler.ast.statements.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * PythonTransformer traverses the AST and generates the equivalent Python source.
 * Statements append whole lines to the output buffer at the current indentation level;
 * expressions return their text to the enclosing statement.
 * <p>
 * Interfaces become {@code typing.Protocol} classes, abstract classes derive from
 * {@code abc.ABC}, final classes and methods get {@code @final}, final variables are
 * annotated with {@code Final} and switch statements are rewritten as if/elif chains.
 */
public class PythonTransformer implements ASTVisitor<String>
{
	private static final Logger logger = LoggerFactory.getLogger(PythonTransformer.class);

	private static final String INDENT = "    ";

	private StringBuilder output;
	private int indentLevel = 0;
	// True only while visiting the direct members of a class body.
	private boolean inClass = false;

	/**
	 * Generates Python source for a whole program.
	 *
	 * @param program The root node.
	 * @return The generated source, one line per statement, ending with a newline unless empty.
	 * @throws TransformException if the tree contains a node that cannot be placed where it is.
	 */
	public String transform(Program program)
	{
		output = new StringBuilder();
		indentLevel = 0;
		inClass = false;
		program.accept(this);
		logger.debug("Transformation complete: generated {} characters of Python", output.length());
		return output.toString();
	}

	// --- Output helpers ---

	private void appendLine(String line)
	{
		if (line.isEmpty())
		{
			output.append("\n");
			return;
		}
		for (int i = 0; i < indentLevel; i++)
		{
			output.append(INDENT);
		}
		output.append(line).append("\n");
	}

	private void indent()
	{
		indentLevel++;
	}

	private void dedent()
	{
		if (indentLevel > 0)
		{
			indentLevel--;
		}
	}

	private String expr(Expression expression)
	{
		return expression.accept(this);
	}

	/**
	 * Emits the statements of a block one level deeper, or 'pass' when there are none.
	 */
	private void body(List<Statement> statements)
	{
		indent();
		if (statements.isEmpty())
		{
			appendLine("pass");
		}
		for (Statement statement : statements)
		{
			statement.accept(this);
		}
		dedent();
	}

	// --- Program and imports ---

	@Override
	public String visitProgram(Program program)
	{
		List<Statement> statements = program.getBody();

		// Declarations may sit anywhere, e.g. an abstract class inside a function body.
		ImportScanner used = ImportScanner.scan(program);

		if (used.interfaces || used.abstractMembers)
		{
			appendLine("from abc import ABC, abstractmethod");
		}
		if (used.interfaces)
		{
			appendLine("from typing import Protocol");
		}
		if (used.finalDecorators)
		{
			appendLine("from typing import final");
		}
		if (used.finalVariables)
		{
			appendLine("from typing import Final");
		}
		if (used.interfaces || used.abstractMembers || used.finalDecorators || used.finalVariables)
		{
			appendLine("");
		}

		for (int i = 0; i < statements.size(); i++)
		{
			logger.debug("Transforming {}", statements.get(i).getClass().getSimpleName());
			statements.get(i).accept(this);
			if (i < statements.size() - 1)
			{
				appendLine("");
			}
		}
		return null;
	}

	// --- Declarations ---

	@Override
	public String visitInterfaceDeclaration(InterfaceDeclaration declaration)
	{
		List<String> bases = new ArrayList<>();
		bases.add("Protocol");
		bases.addAll(declaration.getBaseInterfaces());
		appendLine("class " + declaration.getName() + "(" + String.join(", ", bases) + "):");
		indent();
		appendLine("\"\"\"Interface for " + declaration.getName() + ".\"\"\"");
		List<MethodSignature> methods = declaration.getMethods();
		if (methods.isEmpty())
		{
			appendLine("pass");
		}
		else
		{
			appendLine("");
			for (int i = 0; i < methods.size(); i++)
			{
				methods.get(i).accept(this);
				if (i < methods.size() - 1)
				{
					appendLine("");
				}
			}
		}
		dedent();
		return null;
	}

	@Override
	public String visitMethodSignature(MethodSignature signature)
	{
		appendLine("def " + signature.getName() + "(" + parameters(signature.getParameters(), true) + ")"
				+ returnAnnotation(signature.getReturnType()) + ":");
		indent();
		appendLine("\"\"\"Interface method.\"\"\"");
		appendLine("...");
		dedent();
		return null;
	}

	@Override
	public String visitClassDeclaration(ClassDeclaration declaration)
	{
		List<String> bases = new ArrayList<>(declaration.getBases());
		bases.addAll(declaration.getInterfaces());
		if (declaration.isAbstract() && bases.isEmpty())
		{
			bases.add("ABC");
		}

		if (declaration.isFinal())
		{
			appendLine("@final");
		}
		appendLine("class " + declaration.getName() + (bases.isEmpty() ? "" : "(" + String.join(", ", bases) + ")") + ":");

		boolean savedInClass = inClass;
		inClass = true;
		indent();
		List<Statement> members = declaration.getMembers();
		if (members.isEmpty())
		{
			appendLine("pass");
		}
		else
		{
			appendLine("\"\"\"" + declaration.getName() + " class.\"\"\"");
			appendLine("");
			for (int i = 0; i < members.size(); i++)
			{
				members.get(i).accept(this);
				if (i < members.size() - 1)
				{
					appendLine("");
				}
			}
		}
		dedent();
		inClass = savedInClass;
		return null;
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		boolean isMethod = inClass;

		if (declaration.isStatic())
		{
			appendLine("@staticmethod");
		}
		if (declaration.isAbstract())
		{
			appendLine("@abstractmethod");
		}
		if (declaration.isFinal())
		{
			appendLine("@final");
		}
		for (String decorator : declaration.getDecorators())
		{
			appendLine("@" + decorator);
		}

		boolean needsSelf = isMethod && !declaration.isStatic();
		appendLine("def " + declaration.getName() + "(" + parameters(declaration.getParameters(), needsSelf) + ")"
				+ returnAnnotation(declaration.getReturnType()) + ":");

		inClass = false;
		indent();
		if (declaration.isAbstract() || declaration.getBody() == null)
		{
			appendLine("\"\"\"Abstract method.\"\"\"");
			appendLine("pass");
		}
		else if (declaration.getBody().isEmpty())
		{
			appendLine("pass");
		}
		else
		{
			appendLine("\"\"\"" + declaration.getName() + (isMethod ? " method" : " function") + ".\"\"\"");
			for (Statement statement : declaration.getBody().getStatements())
			{
				statement.accept(this);
			}
		}
		dedent();
		inClass = isMethod;
		return null;
	}

	private String parameters(List<Parameter> parameters, boolean withSelf)
	{
		List<String> formatted = new ArrayList<>();
		if (withSelf && (parameters.isEmpty() || !parameters.get(0).getName().equals("self")))
		{
			formatted.add("self");
		}
		for (Parameter parameter : parameters)
		{
			formatted.add(parameter.accept(this));
		}
		return String.join(", ", formatted);
	}

	private static String returnAnnotation(String returnType)
	{
		return returnType == null ? "" : " -> " + returnType;
	}

	@Override
	public String visitParameter(Parameter parameter)
	{
		StringBuilder text = new StringBuilder(parameter.getName());
		if (parameter.getTypeAnnotation() != null)
		{
			text.append(": ").append(parameter.getTypeAnnotation());
		}
		if (parameter.getDefaultValue() != null)
		{
			text.append(" = ").append(parameter.getDefaultValue());
		}
		return text.toString();
	}

	@Override
	public String visitImportDirective(ImportDirective directive)
	{
		if (directive.isFromImport())
		{
			List<String> items = new ArrayList<>();
			List<String> names = directive.getNames();
			List<String> aliases = directive.getAliases();
			for (int i = 0; i < names.size(); i++)
			{
				String alias = i < aliases.size() ? aliases.get(i) : null;
				items.add(alias == null ? names.get(i) : names.get(i) + " as " + alias);
			}
			appendLine("from " + directive.getModule() + " import " + String.join(", ", items));
		}
		else if (!directive.getAliases().isEmpty() && directive.getAliases().get(0) != null)
		{
			appendLine("import " + directive.getModule() + " as " + directive.getAliases().get(0));
		}
		else
		{
			appendLine("import " + directive.getModule());
		}
		return null;
	}

	@Override
	public String visitFinalDeclaration(FinalDeclaration declaration)
	{
		String annotation = declaration.getTypeAnnotation() == null ? "Final" : "Final[" + declaration.getTypeAnnotation() + "]";
		appendLine(expr(declaration.getTarget()) + ": " + annotation + " = " + expr(declaration.getValue()));
		return null;
	}

	// --- Statements ---

	@Override
	public String visitBlockStatement(BlockStatement block)
	{
		for (Statement statement : block.getStatements())
		{
			statement.accept(this);
		}
		return null;
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		appendLine(expr(statement.getExpression()));
		return null;
	}

	@Override
	public String visitPassStatement(PassStatement statement)
	{
		appendLine("pass");
		return null;
	}

	@Override
	public String visitBreakStatement(BreakStatement statement)
	{
		appendLine("break");
		return null;
	}

	@Override
	public String visitContinueStatement(ContinueStatement statement)
	{
		appendLine("continue");
		return null;
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		appendLine(statement.getValue() == null ? "return" : "return " + expr(statement.getValue()));
		return null;
	}

	@Override
	public String visitRaiseStatement(RaiseStatement statement)
	{
		// A bare raise re-raises the exception being handled.
		appendLine(statement.getException() == null ? "raise" : "raise " + expr(statement.getException()));
		return null;
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		emitIf("if", statement);
		return null;
	}

	private void emitIf(String keyword, IfStatement statement)
	{
		appendLine(keyword + " " + expr(statement.getCondition()) + ":");
		body(statement.getThenBranch().getStatements());

		Statement elseBranch = statement.getElseBranch();
		if (elseBranch instanceof IfStatement)
		{
			emitIf("elif", (IfStatement) elseBranch);
		}
		else if (elseBranch instanceof BlockStatement)
		{
			appendLine("else:");
			body(((BlockStatement) elseBranch).getStatements());
		}
		else if (elseBranch != null)
		{
			appendLine("else:");
			indent();
			elseBranch.accept(this);
			dedent();
		}
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		appendLine("while " + expr(statement.getCondition()) + ":");
		body(statement.getBody().getStatements());
		return null;
	}

	@Override
	public String visitForStatement(ForStatement statement)
	{
		appendLine("for " + target(statement.getTarget()) + " in " + expr(statement.getIterable()) + ":");
		body(statement.getBody().getStatements());
		return null;
	}

	@Override
	public String visitSwitchStatement(SwitchStatement statement)
	{
		List<SwitchCase> cases = statement.getCases();
		BlockStatement defaultBody = statement.getDefaultBody();
		if (cases.isEmpty())
		{
			if (defaultBody == null || defaultBody.isEmpty())
			{
				appendLine("pass");
			}
			else
			{
				defaultBody.accept(this);
			}
			return null;
		}

		String scrutinee = comparisonOperand(statement.getScrutinee());
		for (int i = 0; i < cases.size(); i++)
		{
			SwitchCase switchCase = cases.get(i);
			appendLine((i == 0 ? "if " : "elif ") + scrutinee + " == " + comparisonOperand(switchCase.getValue()) + ":");
			body(switchCase.getBody().getStatements());
		}
		if (defaultBody != null)
		{
			appendLine("else:");
			body(defaultBody.getStatements());
		}
		return null;
	}

	@Override
	public String visitSwitchCase(SwitchCase switchCase)
	{
		throw new TransformException("Case clause outside of a switch statement");
	}

	// --- Expressions ---

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getName();
	}

	@Override
	public String visitAttributeExpression(AttributeExpression expression)
	{
		return postfixOperand(expression.getObject()) + "." + expression.getAttribute();
	}

	@Override
	public String visitLiteralExpression(LiteralExpression literal)
	{
		switch (literal.getKind())
		{
			case REGEX:
				// re"..." becomes the raw string r"..."
				return "r" + literal.getValue().substring(2);
			case NONE:
				return "None";
			case LIST:
				return "[" + joined(literal.getElements()) + "]";
			case SET:
				return literal.getElements().isEmpty() ? "set()" : "{" + joined(literal.getElements()) + "}";
			case DICT:
				return "{" + literal.getElements().stream().map(this::dictEntry).collect(Collectors.joining(", ")) + "}";
			case TUPLE:
				if (literal.getElements().size() == 1)
				{
					return "(" + expr(literal.getElements().get(0)) + ",)";
				}
				return "(" + joined(literal.getElements()) + ")";
			default:
				return literal.getValue();
		}
	}

	private String joined(List<Expression> expressions)
	{
		return expressions.stream().map(this::expr).collect(Collectors.joining(", "));
	}

	private String dictEntry(Expression element)
	{
		if (!(element instanceof DictEntry))
		{
			throw new TransformException("Dict literal element is not a key/value entry: " + element);
		}
		DictEntry entry = (DictEntry) element;
		return expr(entry.getKey()) + ": " + expr(entry.getValue());
	}

	@Override
	public String visitDictEntry(DictEntry entry)
	{
		throw new TransformException("Dict entry outside of a dict literal: " + entry);
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		List<String> arguments = new ArrayList<>();
		for (Expression argument : expression.getArguments())
		{
			if (argument instanceof ArgumentExpression)
			{
				ArgumentExpression named = (ArgumentExpression) argument;
				arguments.add(named.getName() + "=" + expr(named.getValue()));
			}
			else
			{
				arguments.add(expr(argument));
			}
		}
		return postfixOperand(expression.getCallee()) + "(" + String.join(", ", arguments) + ")";
	}

	@Override
	public String visitArgumentExpression(ArgumentExpression expression)
	{
		throw new TransformException("Named argument '" + expression.getName() + "' outside of a call");
	}

	@Override
	public String visitAssignmentExpression(AssignmentExpression expression)
	{
		return target(expression.getTarget()) + " " + expression.getOperator().getLexeme() + " " + expr(expression.getValue());
	}

	@Override
	public String visitLogicalExpression(LogicalExpression expression)
	{
		return "(" + expr(expression.getLeft()) + " " + expression.getOperator().getLexeme() + " " + expr(expression.getRight()) + ")";
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		return "(" + expression.getOperator().getLexeme() + " " + expr(expression.getOperand()) + ")";
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		int precedence = precedenceOf(expression);
		return binaryOperand(expression.getLeft(), precedence, false) + " " + expression.getOperatorText() + " "
				+ binaryOperand(expression.getRight(), precedence, true);
	}

	@Override
	public String visitLambdaExpression(LambdaExpression expression)
	{
		// Python lambdas take no annotations, so parameter and return types are dropped.
		String parameters = expression.getParameters().stream()
				.map(p -> p.getDefaultValue() == null ? p.getName() : p.getName() + "=" + p.getDefaultValue())
				.collect(Collectors.joining(", "));
		return "lambda" + (parameters.isEmpty() ? "" : " " + parameters) + ": " + expr(expression.getBody());
	}

	@Override
	public String visitSubscriptExpression(SubscriptExpression expression)
	{
		String index;
		if (expression.getIndex() instanceof SliceExpression)
		{
			index = slice((SliceExpression) expression.getIndex());
		}
		else
		{
			index = expr(expression.getIndex());
		}
		return postfixOperand(expression.getObject()) + "[" + index + "]";
	}

	private String slice(SliceExpression slice)
	{
		StringBuilder text = new StringBuilder();
		if (slice.getStart() != null)
		{
			text.append(expr(slice.getStart()));
		}
		text.append(":");
		if (slice.getStop() != null)
		{
			text.append(expr(slice.getStop()));
		}
		if (slice.getStep() != null)
		{
			text.append(":").append(expr(slice.getStep()));
		}
		return text.toString();
	}

	@Override
	public String visitSliceExpression(SliceExpression expression)
	{
		throw new TransformException("Slice outside of a subscript");
	}

	@Override
	public String visitComprehensionExpression(ComprehensionExpression expression)
	{
		String head = expression.getKind() == ComprehensionKind.DICT
				? expr(expression.getKey()) + ": " + expr(expression.getElement())
				: expr(expression.getElement());
		String clause = head + " for " + target(expression.getTarget()) + " in " + expr(expression.getIterable());
		if (expression.getCondition() != null)
		{
			clause += " if " + expr(expression.getCondition());
		}
		switch (expression.getKind())
		{
			case LIST:
				return "[" + clause + "]";
			case GENERATOR:
				return "(" + clause + ")";
			default:
				return "{" + clause + "}";
		}
	}

	// --- Operator precedence ---

	/**
	 * Binding strength of a binary operator in Python. All comparisons, membership and
	 * identity tests share one level.
	 */
	private static int precedenceOf(BinaryExpression expression)
	{
		switch (expression.getOperator().getType())
		{
			case DOUBLESTAR:
				return 9;
			case STAR:
			case SLASH:
			case PERCENT:
			case DOUBLESLASH:
				return 8;
			case PLUS:
			case MINUS:
				return 7;
			default:
				return 4;
		}
	}

	/**
	 * Parenthesizes a binary operand when Python would otherwise regroup it. Comparisons are
	 * never left unparenthesized under another comparison, since Python would chain them.
	 */
	private String binaryOperand(Expression operand, int parentPrecedence, boolean isRight)
	{
		String text = expr(operand);
		if (operand instanceof LambdaExpression || operand instanceof AssignmentExpression)
		{
			return "(" + text + ")";
		}
		if (!(operand instanceof BinaryExpression))
		{
			return text;
		}
		int precedence = precedenceOf((BinaryExpression) operand);
		boolean wrap;
		if (precedence != parentPrecedence)
		{
			wrap = precedence < parentPrecedence;
		}
		else if (precedence == 4)
		{
			wrap = true;
		}
		else if (precedence == 9)
		{
			// ** is right-associative
			wrap = !isRight;
		}
		else
		{
			wrap = isRight;
		}
		return wrap ? "(" + text + ")" : text;
	}

	private String comparisonOperand(Expression operand)
	{
		return binaryOperand(operand, 4, false);
	}

	private String postfixOperand(Expression operand)
	{
		String text = expr(operand);
		if (operand instanceof BinaryExpression || operand instanceof LambdaExpression || operand instanceof AssignmentExpression)
		{
			return "(" + text + ")";
		}
		return text;
	}

	/**
	 * Assignment and loop targets: a tuple of names is written without parentheses.
	 */
	private String target(Expression target)
	{
		if (target instanceof LiteralExpression && ((LiteralExpression) target).getKind() == LiteralKind.TUPLE
				&& !((LiteralExpression) target).getElements().isEmpty())
		{
			List<Expression> elements = ((LiteralExpression) target).getElements();
			return elements.size() == 1 ? expr(elements.get(0)) + "," : joined(elements);
		}
		return expr(target);
	}

	/**
	 * Looks for a final variable declaration anywhere in the tree.
	 */
	/**
	 * Records which generated constructs need a typing or abc import.
	 */
	private static final class ImportScanner extends ASTWalker
	{
		private boolean interfaces = false;
		private boolean abstractMembers = false;
		private boolean finalDecorators = false;
		private boolean finalVariables = false;

		static ImportScanner scan(Program program)
		{
			ImportScanner scanner = new ImportScanner();
			program.accept(scanner);
			return scanner;
		}

		@Override
		public Void visitInterfaceDeclaration(InterfaceDeclaration declaration)
		{
			interfaces = true;
			return super.visitInterfaceDeclaration(declaration);
		}

		@Override
		public Void visitClassDeclaration(ClassDeclaration declaration)
		{
			abstractMembers |= declaration.isAbstract();
			finalDecorators |= declaration.isFinal();
			return super.visitClassDeclaration(declaration);
		}

		@Override
		public Void visitFunctionDeclaration(FunctionDeclaration declaration)
		{
			abstractMembers |= declaration.isAbstract();
			finalDecorators |= declaration.isFinal();
			return super.visitFunctionDeclaration(declaration);
		}

		@Override
		public Void visitFinalDeclaration(FinalDeclaration declaration)
		{
			finalVariables = true;
			return super.visitFinalDeclaration(declaration);
		}
	}
}
