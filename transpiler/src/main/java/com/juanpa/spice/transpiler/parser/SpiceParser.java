// File: src/main/java/com/juanpa/spice/transpiler/parser/SpiceParser.java

package com.juanpa.spice.transpiler.parser;

import com.juanpa.spice.transpiler.ast.Program;
import com.juanpa.spice.transpiler.ast.declarations.*;
import com.juanpa.spice.transpiler.ast.expressions.Expression;
import com.juanpa.spice.transpiler.ast.expressions.IdentifierExpression;
import com.juanpa.spice.transpiler.ast.statements.*;
import com.juanpa.spice.transpiler.lexer.Token;
import com.juanpa.spice.transpiler.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The SpiceParser is responsible for performing syntactic analysis.
 * It takes the token list from the lexer and builds the Abstract Syntax Tree (AST)
 * using recursive descent, delegating expressions to an {@link ExpressionParser} that
 * shares its token cursor.
 * <p>
 * Blocks are brace-delimited. A statement ends at ';', at a line break, or right before
 * a closing '}' or the end of input. The first error aborts the parse.
 */
public class SpiceParser extends ParserSupport
{
	private static final Logger logger = LoggerFactory.getLogger(SpiceParser.class);

	private final ExpressionParser expressions;

	/**
	 * Constructs a SpiceParser.
	 *
	 * @param tokens The list of tokens produced by the lexer.
	 */
	public SpiceParser(List<Token> tokens)
	{
		super(new TokenStream(tokens));
		this.expressions = new ExpressionParser(stream);
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return The root of the AST.
	 * @throws ParseException at the first syntax error.
	 */
	public Program parse()
	{
		List<Statement> body = new ArrayList<>();
		skipSeparators();
		while (!isAtEnd())
		{
			body.add(statement());
			skipSeparators();
		}
		logger.debug("Parsed {} top-level statements", body.size());
		return new Program(body);
	}

	/**
	 * Parses a single statement or declaration.
	 * This method acts as a dispatcher for the different statement types.
	 *
	 * @return A Statement AST node.
	 */
	private Statement statement()
	{
		if (check(TokenType.ABSTRACT, TokenType.FINAL, TokenType.STATIC))
		{
			return modifiedDeclaration();
		}
		if (match(TokenType.INTERFACE))
		{
			return interfaceDeclaration();
		}
		if (match(TokenType.CLASS))
		{
			return classDeclaration(false, false);
		}
		if (match(TokenType.DEF))
		{
			return functionDeclaration(false, false, false);
		}
		if (match(TokenType.IF))
		{
			return ifStatement();
		}
		if (match(TokenType.WHILE))
		{
			return whileStatement();
		}
		if (match(TokenType.FOR))
		{
			return forStatement();
		}
		if (match(TokenType.SWITCH))
		{
			return switchStatement();
		}
		if (match(TokenType.RETURN))
		{
			Expression value = atTerminator() ? null : expressions.parse(ExpressionContext.GENERAL);
			return new ReturnStatement(value, terminator("return"));
		}
		if (match(TokenType.RAISE))
		{
			Expression exception = atTerminator() ? null : expressions.parse(ExpressionContext.GENERAL);
			return new RaiseStatement(exception, terminator("raise"));
		}
		if (match(TokenType.PASS))
		{
			return new PassStatement(terminator("pass"));
		}
		if (match(TokenType.BREAK))
		{
			return new BreakStatement(terminator("break"));
		}
		if (match(TokenType.CONTINUE))
		{
			return new ContinueStatement(terminator("continue"));
		}
		if (match(TokenType.IMPORT))
		{
			return importDirective();
		}
		if (match(TokenType.FROM))
		{
			return fromImportDirective();
		}
		if (check(TokenType.WITH, TokenType.TRY, TokenType.EXCEPT, TokenType.FINALLY))
		{
			throw error(peek(), "Unsupported statement '" + peek().getLexeme() + "'");
		}
		return expressionStatement();
	}

	/**
	 * Parses a declaration that starts with modifiers.
	 * Grammar: `(abstract | final | static)+ (CLASS_DECL | FUNCTION_DECL)` or `final FINAL_DECL`.
	 */
	private Statement modifiedDeclaration()
	{
		boolean isAbstract = false;
		boolean isFinal = false;
		boolean isStatic = false;
		while (check(TokenType.ABSTRACT, TokenType.FINAL, TokenType.STATIC))
		{
			Token modifier = advance();
			switch (modifier.getType())
			{
				case ABSTRACT:
					isAbstract = true;
					break;
				case FINAL:
					isFinal = true;
					break;
				default:
					isStatic = true;
					break;
			}
		}

		if (match(TokenType.CLASS))
		{
			if (isStatic)
			{
				throw error(previous(), "Modifier 'static' is not allowed on a class");
			}
			return classDeclaration(isAbstract, isFinal);
		}
		if (match(TokenType.DEF))
		{
			return functionDeclaration(isStatic, isAbstract, isFinal);
		}
		if (isFinal && !isAbstract && !isStatic && check(TokenType.IDENTIFIER))
		{
			return finalDeclaration();
		}
		throw error(peek(), "Expected 'class' or 'def' after modifiers");
	}

	/**
	 * Parses an interface after the 'interface' keyword.
	 * Grammar: `NAME (extends NAME (',' NAME)* | '(' NAME (',' NAME)* ')')? '{' SIGNATURE* '}'`
	 */
	private InterfaceDeclaration interfaceDeclaration()
	{
		String name = consume(TokenType.IDENTIFIER, "Expected interface name").getLexeme();
		List<String> bases = new ArrayList<>();
		if (match(TokenType.EXTENDS))
		{
			bases.addAll(nameList());
		}
		else if (match(TokenType.LPAREN))
		{
			bases.addAll(parenthesizedNames());
		}

		openBrace("interface body");
		List<MethodSignature> methods = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd())
		{
			consume(TokenType.DEF, "Expected 'def' in interface body");
			String methodName = consume(TokenType.IDENTIFIER, "Expected method name").getLexeme();
			consume(TokenType.LPAREN, "Expected '(' after method name");
			List<Parameter> parameters = parameterList();
			String returnType = returnType();
			terminator("method signature");
			methods.add(new MethodSignature(methodName, parameters, returnType));
			skipSeparators();
		}
		consume(TokenType.RBRACE, "Expected '}' after interface body");
		return new InterfaceDeclaration(name, methods, bases);
	}

	/**
	 * Parses a class after the 'class' keyword.
	 * Grammar: `NAME ('(' BASES? ')')? (extends NAME (',' NAME)*)? (implements NAME (',' NAME)*)? '{' MEMBER* '}'`
	 */
	private ClassDeclaration classDeclaration(boolean isAbstract, boolean isFinal)
	{
		String name = consume(TokenType.IDENTIFIER, "Expected class name").getLexeme();
		List<String> bases = new ArrayList<>();
		List<String> interfaces = new ArrayList<>();

		if (match(TokenType.LPAREN))
		{
			bases.addAll(parenthesizedNames());
		}
		if (match(TokenType.EXTENDS))
		{
			bases.addAll(nameList());
		}
		if (match(TokenType.IMPLEMENTS))
		{
			interfaces.addAll(nameList());
		}

		openBrace("class body");
		List<Statement> members = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd())
		{
			members.add(statement());
			skipSeparators();
		}
		consume(TokenType.RBRACE, "Expected '}' after class body");
		return new ClassDeclaration(name, members, bases, interfaces, isAbstract, isFinal);
	}

	/**
	 * Parses a function or method after the 'def' keyword.
	 * Grammar: `NAME '(' PARAMS ')' ('->' TYPE | ':' TYPE)? (BLOCK | TERMINATOR)`.
	 * Only abstract methods may omit the body.
	 */
	private FunctionDeclaration functionDeclaration(boolean isStatic, boolean isAbstract, boolean isFinal)
	{
		String name = consume(TokenType.IDENTIFIER, "Expected function name").getLexeme();
		consume(TokenType.LPAREN, "Expected '(' after function name");
		List<Parameter> parameters = parameterList();
		String returnType = returnType();

		BlockStatement body = null;
		if (isAbstract)
		{
			terminator("abstract method");
		}
		else
		{
			body = block("function body");
		}
		return new FunctionDeclaration(name, parameters, body, returnType, isStatic, isAbstract, isFinal,
				new ArrayList<>());
	}

	/**
	 * Parses `NAME (':' TYPE)? '=' EXPRESSION TERMINATOR` after 'final'.
	 */
	private FinalDeclaration finalDeclaration()
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected variable name after 'final'");
		String type = null;
		if (match(TokenType.COLON))
		{
			type = typeAnnotation();
		}
		Token assign = consume(TokenType.ASSIGN, "Expected '=' in final declaration");
		Expression value = expressions.parse(ExpressionContext.GENERAL);
		if (value == null)
		{
			throw error(assign, "Expected value in final declaration");
		}
		boolean hasSemicolon = terminator("final declaration");
		return new FinalDeclaration(new IdentifierExpression(name), value, type, name.getLine(), hasSemicolon);
	}

	/**
	 * Parses the rest of an if statement after 'if' (or 'elif', or 'else if').
	 * 'else' and 'elif' may start on the line after the closing brace.
	 */
	private IfStatement ifStatement()
	{
		Expression condition = condition("if");
		BlockStatement thenBranch = block("if body");

		Statement elseBranch = null;
		if (stream.checkAfterNewlines(TokenType.ELSE, TokenType.ELIF))
		{
			stream.skipNewlines();
			if (match(TokenType.ELIF))
			{
				elseBranch = ifStatement();
			}
			else
			{
				advance(); // else
				elseBranch = match(TokenType.IF) ? ifStatement() : block("else body");
			}
		}
		return new IfStatement(condition, thenBranch, elseBranch);
	}

	private WhileStatement whileStatement()
	{
		Expression condition = condition("while");
		return new WhileStatement(condition, block("while body"));
	}

	/**
	 * Parses `TARGET in ITER BLOCK` or `'(' TARGET in ITER ')' BLOCK` after 'for'.
	 */
	private ForStatement forStatement()
	{
		Expression target;
		Expression iterable;
		if (check(TokenType.LPAREN) && isParenthesizedLoopHeader())
		{
			advance();
			stream.enterGroup();
			try
			{
				target = expressions.parseTarget();
				consume(TokenType.IN, "Expected 'in' after for target");
				iterable = expressions.parse(ExpressionContext.GENERAL);
				if (iterable == null)
				{
					throw error(peek(), "Expected iterable after 'in'");
				}
				consume(TokenType.RPAREN, "Expected ')' after for header");
			}
			finally
			{
				stream.exitGroup();
			}
		}
		else
		{
			target = expressions.parseTarget();
			consume(TokenType.IN, "Expected 'in' after for target");
			iterable = condition("in");
		}
		return new ForStatement(target, iterable, block("for body"));
	}

	/**
	 * A '(' after 'for' wraps the whole header when its matching ')' is followed by '{'.
	 * Otherwise it belongs to the target, as in `for (a, b) in pairs { }`.
	 */
	private boolean isParenthesizedLoopHeader()
	{
		int depth = 0;
		for (int i = stream.position(); ; i++)
		{
			Token token = stream.tokenAt(i);
			TokenType type = token.getType();
			if (type == TokenType.EOF)
			{
				return false;
			}
			if (type == TokenType.LPAREN || type == TokenType.LBRACKET || type == TokenType.LBRACE)
			{
				depth++;
			}
			else if (type == TokenType.RPAREN || type == TokenType.RBRACKET || type == TokenType.RBRACE)
			{
				depth--;
				if (depth == 0)
				{
					int next = i + 1;
					while (stream.tokenAt(next).getType() == TokenType.NEWLINE)
					{
						next++;
					}
					return stream.tokenAt(next).getType() == TokenType.LBRACE;
				}
			}
		}
	}

	/**
	 * Parses a switch statement after 'switch'.
	 * Grammar: `EXPR '{' (case VALUE (':' STATEMENT* | BLOCK))* (default (':' STATEMENT* | BLOCK))? '}'`
	 */
	private SwitchStatement switchStatement()
	{
		Expression scrutinee = condition("switch");
		openBrace("switch body");

		List<SwitchCase> cases = new ArrayList<>();
		BlockStatement defaultBody = null;
		while (!check(TokenType.RBRACE) && !isAtEnd())
		{
			if (match(TokenType.CASE))
			{
				Expression value = condition("case");
				cases.add(new SwitchCase(value, caseBody("case body")));
			}
			else if (match(TokenType.DEFAULT))
			{
				if (defaultBody != null)
				{
					throw error(previous(), "Duplicate 'default' in switch");
				}
				defaultBody = caseBody("default body");
			}
			else
			{
				throw error(peek(), "Expected 'case' or 'default' in switch body");
			}
			skipSeparators();
		}
		consume(TokenType.RBRACE, "Expected '}' after switch body");
		return new SwitchStatement(scrutinee, cases, defaultBody);
	}

	/**
	 * A case body is either a block or, after ':', the statements up to the next
	 * 'case', 'default' or '}'.
	 */
	private BlockStatement caseBody(String what)
	{
		if (!match(TokenType.COLON))
		{
			return block(what);
		}
		List<Statement> statements = new ArrayList<>();
		skipSeparators();
		while (!check(TokenType.CASE, TokenType.DEFAULT, TokenType.RBRACE) && !isAtEnd())
		{
			statements.add(statement());
			skipSeparators();
		}
		return new BlockStatement(statements);
	}

	/**
	 * Parses `DOTTED_NAME (as NAME)? TERMINATOR` after 'import'.
	 */
	private ImportDirective importDirective()
	{
		String module = dottedName("Expected module name after 'import'");
		List<String> aliases = new ArrayList<>();
		if (match(TokenType.AS))
		{
			aliases.add(consume(TokenType.IDENTIFIER, "Expected alias after 'as'").getLexeme());
		}
		boolean hasSemicolon = terminator("import");
		return new ImportDirective(module, new ArrayList<>(), aliases, false, hasSemicolon);
	}

	/**
	 * Parses `DOTTED_NAME import NAME (as NAME)? (',' NAME (as NAME)?)* TERMINATOR` after 'from'.
	 * The imported names may be wrapped in parentheses.
	 */
	private ImportDirective fromImportDirective()
	{
		String module = dottedName("Expected module name after 'from'");
		consume(TokenType.IMPORT, "Expected 'import' after module name");

		boolean parenthesized = match(TokenType.LPAREN);
		if (parenthesized)
		{
			stream.enterGroup();
		}
		List<String> names = new ArrayList<>();
		List<String> aliases = new ArrayList<>();
		try
		{
			do
			{
				if (parenthesized && check(TokenType.RPAREN))
				{
					break;
				}
				names.add(consume(TokenType.IDENTIFIER, "Expected name to import").getLexeme());
				aliases.add(match(TokenType.AS) ? consume(TokenType.IDENTIFIER, "Expected alias after 'as'").getLexeme() : null);
			}
			while (match(TokenType.COMMA));
			if (parenthesized)
			{
				consume(TokenType.RPAREN, "Expected ')' after imported names");
			}
		}
		finally
		{
			if (parenthesized)
			{
				stream.exitGroup();
			}
		}
		boolean hasSemicolon = terminator("import");
		return new ImportDirective(module, names, aliases, true, hasSemicolon);
	}

	private ExpressionStatement expressionStatement()
	{
		Token start = peek();
		Expression expression = expressions.parse(ExpressionContext.GENERAL);
		if (expression == null)
		{
			throw error(start, "Unexpected token '" + describe(start) + "'");
		}
		return new ExpressionStatement(expression, terminator("expression"));
	}

	// --- Helpers ---

	/**
	 * Parses the head of a compound statement in condition context.
	 */
	private Expression condition(String keyword)
	{
		Expression condition = expressions.parse(ExpressionContext.CONDITION);
		if (condition == null)
		{
			throw error(peek(), "Expected expression after '" + keyword + "'");
		}
		return condition;
	}

	/**
	 * Parses a brace-delimited block. The '{' may sit on the next line.
	 * Grammar: `'{' STATEMENT* '}'`
	 *
	 * @param what Description used in error messages.
	 * @return A BlockStatement AST node.
	 */
	private BlockStatement block(String what)
	{
		openBrace(what);
		List<Statement> statements = new ArrayList<>();
		while (!check(TokenType.RBRACE) && !isAtEnd())
		{
			statements.add(statement());
			skipSeparators();
		}
		consume(TokenType.RBRACE, "Expected '}' after " + what);
		return new BlockStatement(statements);
	}

	private void openBrace(String what)
	{
		stream.skipNewlines();
		consume(TokenType.LBRACE, "Expected '{' before " + what);
		skipSeparators();
	}

	/**
	 * Consumes a statement terminator: ';' or a line break. A following '}' or the end of
	 * input also ends the statement but is left in place.
	 *
	 * @param what Description used in error messages.
	 * @return True if the statement ended with a semicolon.
	 */
	private boolean terminator(String what)
	{
		if (match(TokenType.SEMICOLON))
		{
			return true;
		}
		if (match(TokenType.NEWLINE) || check(TokenType.RBRACE) || isAtEnd())
		{
			return false;
		}
		throw error(peek(), "Expected ';' or newline after " + what);
	}

	private boolean atTerminator()
	{
		return isAtEnd() || check(TokenType.SEMICOLON, TokenType.NEWLINE, TokenType.RBRACE);
	}

	/**
	 * Skips blank lines and stray semicolons between statements.
	 */
	private void skipSeparators()
	{
		while (match(TokenType.NEWLINE, TokenType.SEMICOLON))
		{
			// nothing to keep
		}
	}

	/**
	 * Return type after a parameter list: `-> TYPE` or `: TYPE`, or nothing.
	 */
	private String returnType()
	{
		if (match(TokenType.ARROW, TokenType.COLON))
		{
			return typeAnnotation();
		}
		return null;
	}

	private String dottedName(String message)
	{
		StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, message).getLexeme());
		while (match(TokenType.DOT))
		{
			name.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.'").getLexeme());
		}
		return name.toString();
	}

	/**
	 * `DOTTED_NAME (',' DOTTED_NAME)*`
	 */
	private List<String> nameList()
	{
		List<String> names = new ArrayList<>();
		do
		{
			names.add(dottedName("Expected type name"));
		}
		while (match(TokenType.COMMA));
		return names;
	}

	/**
	 * Base list after '(' of a class or interface header; allows `()`.
	 */
	private List<String> parenthesizedNames()
	{
		stream.enterGroup();
		try
		{
			List<String> names = new ArrayList<>();
			while (!check(TokenType.RPAREN))
			{
				names.add(dottedName("Expected base name"));
				if (!match(TokenType.COMMA))
				{
					break;
				}
			}
			consume(TokenType.RPAREN, "Expected ')' after base list");
			return names;
		}
		finally
		{
			stream.exitGroup();
		}
	}

	private static String describe(Token token)
	{
		if (token.getType() == TokenType.NEWLINE)
		{
			return "newline";
		}
		return token.getLexeme() == null ? token.getType().name() : token.getLexeme();
	}
}
