package com.juanpa.spice.transpiler.lexer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.juanpa.spice.transpiler.lexer.TokenType.*;

/**
 * Static adjacency table: for a token kind, the kinds allowed to follow it.
 * <p>
 * This is a broad filter consulted by the lexer, not a grammar: every adjacency the
 * parser accepts on one line is listed, and it must be extended whenever the grammar
 * grows. What it rejects is token pairs no production can build, such as {@code def 42},
 * {@code class (} or a call on a number literal. Kinds without an entry are unconstrained.
 * A line break (or the end of input) may follow anything, and since brackets allow
 * line continuations anything may follow a line break.
 */
public final class FollowSet
{
	private static final Map<TokenType, Set<TokenType>> FOLLOW = new EnumMap<>(TokenType.class);

	private static final TokenType[] OPERAND_START = {IDENTIFIER, NUMBER, STRING, FSTRING, RSTRING, FRSTRING, REGEX,
			TRUE, FALSE, NONE, LPAREN, LBRACKET, LBRACE, MINUS, NOT, LAMBDA};

	private static final TokenType[] STATEMENT_KEYWORDS = {ABSTRACT, FINAL, STATIC, INTERFACE, CLASS, DEF,
			IF, WHILE, FOR, SWITCH, RETURN, RAISE, PASS, BREAK, CONTINUE, IMPORT, FROM};

	private static final TokenType[] BINARY_OPERATORS = {PLUS, MINUS, STAR, SLASH, PERCENT, DOUBLESTAR, DOUBLESLASH,
			LESS, GREATER, LESSEQUAL, GREATEREQUAL, EQUAL, NOTEQUAL, AND, OR, IN, NOT, IS};

	private static final TokenType[] ASSIGNMENTS = {ASSIGN, PLUSASSIGN, MINUSASSIGN, STARASSIGN, SLASHASSIGN,
			PERCENTASSIGN, DOUBLESTARASSIGN, DOUBLESLASHASSIGN};

	// may follow any value: a + b; f(a); [a]; {a}; a, b; {"k": a}; a;
	// [a for a in b if a]; while a {
	private static final TokenType[] VALUE_END = {RPAREN, RBRACKET, RBRACE, COMMA, COLON, SEMICOLON, FOR, IF, LBRACE};

	// a.b; a(b); a[b]
	private static final TokenType[] POSTFIX = {DOT, LPAREN, LBRACKET};

	static
	{
		// alpha = beta; alpha.beta(gamma)[0]; lambda(x): int -> x; class alpha extends beta implements gamma
		// import alpha as beta, from alpha import beta
		allow(IDENTIFIER, BINARY_OPERATORS);
		allow(IDENTIFIER, VALUE_END);
		allow(IDENTIFIER, POSTFIX);
		allow(IDENTIFIER, ASSIGNMENTS);
		allow(IDENTIFIER, ARROW, EXTENDS, IMPLEMENTS, AS, IMPORT);

		// f(1)(2); f(x)[0] = y; def alpha() -> None; class Dog(Animal) implements Pet {
		allow(RPAREN, BINARY_OPERATORS);
		allow(RPAREN, VALUE_END);
		allow(RPAREN, POSTFIX);
		allow(RPAREN, ASSIGNMENTS);
		allow(RPAREN, ARROW, EXTENDS, IMPLEMENTS);

		// items[0] = x; [1, 2].count(1); matrix[0][1]; def alpha() -> List[int] {
		allow(RBRACKET, BINARY_OPERATORS);
		allow(RBRACKET, VALUE_END);
		allow(RBRACKET, POSTFIX);
		allow(RBRACKET, ASSIGNMENTS);
		allow(RBRACKET, ARROW);

		// "".join(items); "abc"[0]; "%s" % alpha; def alpha() -> "Forward" {
		allow(STRING, BINARY_OPERATORS);
		allow(STRING, VALUE_END);
		allow(STRING, DOT, LBRACKET, ARROW, ASSIGN);

		// x is None; lambda(x): None -> x; def alpha(x: None = None)
		allow(NONE, BINARY_OPERATORS);
		allow(NONE, VALUE_END);
		allow(NONE, ARROW, ASSIGN);

		// Literals are never called, subscripted or assigned to.
		allow(NUMBER, BINARY_OPERATORS);
		allow(NUMBER, VALUE_END);
		allow(TRUE, BINARY_OPERATORS);
		allow(TRUE, VALUE_END);

		// A closing brace ends a block or a dict/set literal, so statements, chained
		// branches and value continuations may all follow it.
		allow(RBRACE, BINARY_OPERATORS);
		allow(RBRACE, VALUE_END);
		allow(RBRACE, POSTFIX);
		allow(RBRACE, OPERAND_START);
		allow(RBRACE, STATEMENT_KEYWORDS);
		allow(RBRACE, ELSE, ELIF, CASE, DEFAULT);

		for (TokenType operator : BINARY_OPERATORS)
		{
			allow(operator, OPERAND_START);
		}
		allow(NOT, IN);
		allow(ASSIGN, OPERAND_START);
		allow(ARROW, OPERAND_START);

		// alpha, beta; f(a, ); [1, 2, ]
		allow(COMMA, OPERAND_START);
		allow(COMMA, RPAREN, RBRACKET, RBRACE);

		allow(LPAREN, OPERAND_START);
		allow(LPAREN, RPAREN);
		// a[:]; a[::2]; []
		allow(LBRACKET, OPERAND_START);
		allow(LBRACKET, RBRACKET, COLON);
		allow(LBRACE, OPERAND_START);
		allow(LBRACE, STATEMENT_KEYWORDS);
		allow(LBRACE, RBRACE, CASE, DEFAULT);

		// "key": value; a[1:]; a[::2]; lambda x: x; def f(): int; case 1: return x
		allow(COLON, OPERAND_START);
		allow(COLON, STATEMENT_KEYWORDS);
		allow(COLON, COLON, RBRACKET, RBRACE, CASE, DEFAULT);

		allow(SEMICOLON, OPERAND_START);
		allow(SEMICOLON, STATEMENT_KEYWORDS);
		allow(SEMICOLON, SEMICOLON, RBRACE, CASE, DEFAULT);

		allow(ABSTRACT, ABSTRACT, FINAL, STATIC, CLASS, DEF);
		allow(STATIC, ABSTRACT, FINAL, STATIC, CLASS, DEF);
		allow(FINAL, ABSTRACT, FINAL, STATIC, CLASS, DEF, IDENTIFIER);

		allow(INTERFACE, IDENTIFIER);
		allow(CLASS, IDENTIFIER);
		allow(DEF, IDENTIFIER);
		allow(EXTENDS, IDENTIFIER);
		allow(IMPLEMENTS, IDENTIFIER);
		allow(DOT, IDENTIFIER);
		allow(AS, IDENTIFIER);
		allow(FROM, IDENTIFIER);
		// from alpha import (beta, gamma)
		allow(IMPORT, IDENTIFIER, LPAREN);

		allow(RETURN, OPERAND_START);
		allow(RETURN, SEMICOLON, RBRACE);
		allow(RAISE, OPERAND_START);
		allow(RAISE, SEMICOLON, RBRACE);
		allow(PASS, SEMICOLON, RBRACE);
		allow(BREAK, SEMICOLON, RBRACE);
		allow(CONTINUE, SEMICOLON, RBRACE);

		allow(IF, OPERAND_START);
		allow(ELIF, OPERAND_START);
		allow(WHILE, OPERAND_START);
		allow(SWITCH, OPERAND_START);
		allow(CASE, OPERAND_START);
		allow(DEFAULT, COLON, LBRACE);
		allow(ELSE, LBRACE, IF);
		// for x in; for (a, b) in; for (x in xs) {; for [a, b] in
		allow(FOR, IDENTIFIER, LPAREN, LBRACKET);
		// lambda x: x; lambda(x) -> x; lambda: 0
		allow(LAMBDA, IDENTIFIER, LPAREN, COLON);
	}

	private FollowSet()
	{
	}

	private static void allow(TokenType kind, TokenType... followers)
	{
		Set<TokenType> set = FOLLOW.computeIfAbsent(kind, k -> EnumSet.noneOf(TokenType.class));
		Collections.addAll(set, followers);
	}

	/**
	 * Maps a kind onto the table entry that governs it: every string flavour checks as
	 * STRING, every compound assignment as ASSIGN, and FALSE shares TRUE's entry.
	 *
	 * @param kind The token kind to normalize.
	 * @return The kind used as the lookup key.
	 */
	static TokenType normalize(TokenType kind)
	{
		if (kind.isString())
		{
			return STRING;
		}
		if (kind.isAssignment())
		{
			return ASSIGN;
		}
		if (kind == FALSE)
		{
			return TRUE;
		}
		return kind;
	}

	/**
	 * Returns the set of kinds permitted after the given kind.
	 *
	 * @param kind The preceding token kind.
	 * @return The permitted followers, or an empty set when the kind has no entry.
	 */
	public static Set<TokenType> followersOf(TokenType kind)
	{
		Set<TokenType> followers = FOLLOW.get(normalize(kind));
		return followers == null ? Collections.emptySet() : Collections.unmodifiableSet(followers);
	}

	/**
	 * @param kind The preceding token kind.
	 * @return True if the table constrains what may follow this kind.
	 */
	public static boolean isConstrained(TokenType kind)
	{
		return FOLLOW.containsKey(normalize(kind));
	}

	/**
	 * Checks one adjacency.
	 *
	 * @param token     Kind of the earlier token.
	 * @param nextToken Kind of the token right after it.
	 * @param line      Line of the later token.
	 * @param column    Column of the later token.
	 * @return An {@link IllegalFollow} when the pair is disallowed, otherwise null.
	 */
	public static IllegalFollow check(TokenType token, TokenType nextToken, int line, int column)
	{
		if (nextToken == NEWLINE || nextToken == EOF || !isConstrained(token))
		{
			return null;
		}
		if (followersOf(token).contains(nextToken))
		{
			return null;
		}
		return new IllegalFollow(token, nextToken, line, column);
	}
}
