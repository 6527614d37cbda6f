// File: src/main/java/com/juanpa/spice/transpiler/lexer/TokenType.java
package com.juanpa.spice.transpiler.lexer;

/**
 * Defines the types of tokens recognized by the Spice Lexer.
 * This enum covers literals, keywords, operators, delimiters, and structural markers.
 */
public enum TokenType
{
	// --- Literals ---
	NUMBER,
	STRING,
	FSTRING,   // f"..."
	RSTRING,   // r"..."
	FRSTRING,  // rf"..." / fr"..."
	REGEX,     // re"..."
	IDENTIFIER,

	// --- Keywords (Python) ---
	DEF, CLASS, IF, ELIF, ELSE, FOR, WHILE, RETURN, IMPORT, FROM, AS, WITH,
	TRY, EXCEPT, FINALLY, RAISE, PASS, BREAK, CONTINUE,
	TRUE, FALSE, NONE,
	AND, OR, NOT, IN, IS, LAMBDA,

	// --- Keywords (Spice) ---
	INTERFACE, ABSTRACT, FINAL, STATIC, EXTENDS, IMPLEMENTS, SWITCH, CASE, DEFAULT,

	// --- Operators ---
	PLUS, MINUS, STAR, SLASH, PERCENT, DOUBLESTAR, DOUBLESLASH,
	EQUAL, NOTEQUAL, LESS, GREATER, LESSEQUAL, GREATEREQUAL,
	ASSIGN, PLUSASSIGN, MINUSASSIGN, STARASSIGN, SLASHASSIGN,
	PERCENTASSIGN, DOUBLESTARASSIGN, DOUBLESLASHASSIGN,

	// --- Delimiters ---
	LPAREN, RPAREN,       // ( )
	LBRACKET, RBRACKET,   // [ ]
	LBRACE, RBRACE,       // { }
	COMMA, COLON, SEMICOLON, DOT,
	ARROW,                // ->

	// --- Structural ---
	NEWLINE,
	INDENT,   // reserved, never emitted: blocks are brace-delimited
	DEDENT,   // reserved, never emitted
	EOF,
	COMMENT;  // recognized by the lexer but dropped from the stream

	/**
	 * @return True for every string literal flavour (plain, f-, raw, raw f-, regex).
	 */
	public boolean isString()
	{
		return this == STRING || this == FSTRING || this == RSTRING || this == FRSTRING || this == REGEX;
	}

	/**
	 * @return True for '=' and every compound assignment operator.
	 */
	public boolean isAssignment()
	{
		switch (this)
		{
			case ASSIGN:
			case PLUSASSIGN:
			case MINUSASSIGN:
			case STARASSIGN:
			case SLASHASSIGN:
			case PERCENTASSIGN:
			case DOUBLESTARASSIGN:
			case DOUBLESLASHASSIGN:
				return true;
			default:
				return false;
		}
	}
}
