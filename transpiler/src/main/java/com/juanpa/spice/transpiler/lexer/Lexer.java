// File: src/main/java/com/juanpa/spice/transpiler/lexer/Lexer.java

package com.juanpa.spice.transpiler.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw Spice source one line at a time and converts it into a stream of Tokens,
 * ending every non-empty line with a NEWLINE and the whole stream with EOF.
 * <p>
 * After each token is appended the previous token kind is checked against the
 * {@link FollowSet}; violations are collected as advisory {@link IllegalFollow}s.
 * Invalid characters and unterminated strings are fatal.
 */
public class Lexer
{
	private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

	private static final String NEWLINE_TEXT = "\\n";

	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>();
	private final List<IllegalFollow> diagnostics = new ArrayList<>();

	private String text = ""; // The line being scanned
	private int line = 0; // Current 1-based line number
	private int current = 0; // Current 0-based column in the line
	private int start = 0; // Start column of the token being scanned

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		// Python keywords
		keywords.put("def", TokenType.DEF);
		keywords.put("class", TokenType.CLASS);
		keywords.put("if", TokenType.IF);
		keywords.put("elif", TokenType.ELIF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("for", TokenType.FOR);
		keywords.put("while", TokenType.WHILE);
		keywords.put("return", TokenType.RETURN);
		keywords.put("import", TokenType.IMPORT);
		keywords.put("from", TokenType.FROM);
		keywords.put("as", TokenType.AS);
		keywords.put("with", TokenType.WITH);
		keywords.put("try", TokenType.TRY);
		keywords.put("except", TokenType.EXCEPT);
		keywords.put("finally", TokenType.FINALLY);
		keywords.put("raise", TokenType.RAISE);
		keywords.put("pass", TokenType.PASS);
		keywords.put("break", TokenType.BREAK);
		keywords.put("continue", TokenType.CONTINUE);
		keywords.put("True", TokenType.TRUE);
		keywords.put("False", TokenType.FALSE);
		keywords.put("None", TokenType.NONE);
		keywords.put("and", TokenType.AND);
		keywords.put("or", TokenType.OR);
		keywords.put("not", TokenType.NOT);
		keywords.put("in", TokenType.IN);
		keywords.put("is", TokenType.IS);
		keywords.put("lambda", TokenType.LAMBDA);

		// Spice keywords
		keywords.put("interface", TokenType.INTERFACE);
		keywords.put("abstract", TokenType.ABSTRACT);
		keywords.put("final", TokenType.FINAL);
		keywords.put("static", TokenType.STATIC);
		keywords.put("extends", TokenType.EXTENDS);
		keywords.put("implements", TokenType.IMPLEMENTS);
		keywords.put("switch", TokenType.SWITCH);
		keywords.put("case", TokenType.CASE);
		keywords.put("default", TokenType.DEFAULT);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source == null ? "" : source;
	}

	/**
	 * @param word A candidate identifier.
	 * @return True if the word is reserved.
	 */
	public static boolean isKeyword(String word)
	{
		return keywords.containsKey(word);
	}

	/**
	 * Scans the entire source code.
	 *
	 * @return The token stream and the follow-set diagnostics.
	 * @throws LexerException on an invalid character or an unterminated string.
	 */
	public LexResult scanTokens()
	{
		String[] lines = source.split("\n", -1);
		for (int i = 0; i < lines.length; i++)
		{
			line = i + 1;
			text = lines[i].endsWith("\r") ? lines[i].substring(0, lines[i].length() - 1) : lines[i];
			scanLine();
		}

		addToken(TokenType.EOF, null, lines.length, 0);
		logger.debug("Scanned {} tokens, {} follow-set diagnostics", tokens.size(), diagnostics.size());
		return new LexResult(tokens, diagnostics);
	}

	/**
	 * Scans one physical line, appending its tokens and the closing NEWLINE.
	 */
	private void scanLine()
	{
		current = 0;
		while (current < text.length() && Character.isWhitespace(text.charAt(current)))
		{
			current++;
		}

		// Blank lines still produce a NEWLINE, positioned at the indentation width.
		if (current == text.length())
		{
			addToken(TokenType.NEWLINE, NEWLINE_TEXT, line, current);
			return;
		}

		while (current < text.length())
		{
			start = current;
			char c = advance();
			if (Character.isWhitespace(c))
			{
				continue;
			}
			if (c == '#')
			{
				// Comment runs to end of line and is dropped.
				current = text.length();
				continue;
			}
			scanToken(c);
		}

		addToken(TokenType.NEWLINE, NEWLINE_TEXT, line, text.length());
	}

	/**
	 * Scans a single token whose first character has already been consumed.
	 *
	 * @param c The first character of the token.
	 */
	private void scanToken(char c)
	{
		if (Character.isDigit(c))
		{
			scanNumber();
			return;
		}

		TokenType stringType = stringPrefix(c);
		if (stringType != null)
		{
			scanString(stringType);
			return;
		}

		if (Character.isLetter(c) || c == '_')
		{
			scanIdentifier();
			return;
		}

		switch (c)
		{
			case '(':
				addToken(TokenType.LPAREN);
				break;
			case ')':
				addToken(TokenType.RPAREN);
				break;
			case '[':
				addToken(TokenType.LBRACKET);
				break;
			case ']':
				addToken(TokenType.RBRACKET);
				break;
			case '{':
				addToken(TokenType.LBRACE);
				break;
			case '}':
				addToken(TokenType.RBRACE);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ':':
				addToken(TokenType.COLON);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;
			case '+':
				addToken(match('=') ? TokenType.PLUSASSIGN : TokenType.PLUS);
				break;
			case '-':
				if (match('>'))
				{
					addToken(TokenType.ARROW);
				}
				else
				{
					addToken(match('=') ? TokenType.MINUSASSIGN : TokenType.MINUS);
				}
				break;
			case '*':
				if (match('*'))
				{
					addToken(match('=') ? TokenType.DOUBLESTARASSIGN : TokenType.DOUBLESTAR);
				}
				else
				{
					addToken(match('=') ? TokenType.STARASSIGN : TokenType.STAR);
				}
				break;
			case '/':
				if (match('/'))
				{
					addToken(match('=') ? TokenType.DOUBLESLASHASSIGN : TokenType.DOUBLESLASH);
				}
				else
				{
					addToken(match('=') ? TokenType.SLASHASSIGN : TokenType.SLASH);
				}
				break;
			case '%':
				addToken(match('=') ? TokenType.PERCENTASSIGN : TokenType.PERCENT);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL : TokenType.ASSIGN);
				break;
			case '<':
				addToken(match('=') ? TokenType.LESSEQUAL : TokenType.LESS);
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATEREQUAL : TokenType.GREATER);
				break;
			case '!':
				if (match('='))
				{
					addToken(TokenType.NOTEQUAL);
					break;
				}
				throw invalidCharacter(c);
			default:
				throw invalidCharacter(c);
		}
	}

	/**
	 * Decides whether the current position starts a string literal, consuming any prefix.
	 * A prefix only counts when a quote follows it immediately; {@code rex} or {@code f(x)}
	 * stay identifiers.
	 *
	 * @param c The first character, already consumed.
	 * @return The string kind, or null if this is not a string literal.
	 */
	private TokenType stringPrefix(char c)
	{
		if (isQuote(c))
		{
			current--; // let scanString see the opening quote
			return TokenType.STRING;
		}
		if (c == 'r' && peek() == 'e' && isQuote(peek(1)))
		{
			advance();
			return TokenType.REGEX;
		}
		if ((c == 'r' && peek() == 'f' || c == 'f' && peek() == 'r') && isQuote(peek(1)))
		{
			advance();
			return TokenType.FRSTRING;
		}
		if (c == 'f' && isQuote(peek()))
		{
			return TokenType.FSTRING;
		}
		if (c == 'r' && isQuote(peek()))
		{
			return TokenType.RSTRING;
		}
		return null;
	}

	/**
	 * Scans a quoted literal starting at the current quote. Triple quotes are tried before
	 * single ones; a backslash skips the following character. Literals stay on one line.
	 *
	 * @param type The string kind decided by the prefix.
	 */
	private void scanString(TokenType type)
	{
		char quote = advance();
		boolean triple = peek() == quote && peek(1) == quote;
		if (triple)
		{
			advance();
			advance();
		}

		while (current < text.length())
		{
			char c = advance();
			if (c == '\\')
			{
				if (current < text.length())
				{
					advance();
				}
				continue;
			}
			if (c == quote)
			{
				if (!triple)
				{
					addToken(type);
					return;
				}
				if (peek() == quote && peek(1) == quote)
				{
					advance();
					advance();
					addToken(type);
					return;
				}
			}
		}

		throw new LexerException("Unterminated string literal", line, start);
	}

	/**
	 * Scans an integer or a decimal number ({@code \d+\.\d+} is preferred over {@code \d+}).
	 */
	private void scanNumber()
	{
		while (Character.isDigit(peek()))
		{
			advance();
		}
		if (peek() == '.' && Character.isDigit(peek(1)))
		{
			advance();
			while (Character.isDigit(peek()))
			{
				advance();
			}
		}
		addToken(TokenType.NUMBER);
	}

	/**
	 * Scans an identifier or a keyword.
	 */
	private void scanIdentifier()
	{
		while (Character.isLetterOrDigit(peek()) || peek() == '_')
		{
			advance();
		}
		String word = text.substring(start, current);
		addToken(keywords.getOrDefault(word, TokenType.IDENTIFIER));
	}

	private char advance()
	{
		return text.charAt(current++);
	}

	/**
	 * Consumes the current character if it matches.
	 *
	 * @param expected The expected character.
	 * @return True if the character matched and was consumed.
	 */
	private boolean match(char expected)
	{
		if (current >= text.length() || text.charAt(current) != expected)
		{
			return false;
		}
		current++;
		return true;
	}

	private char peek()
	{
		return peek(0);
	}

	/**
	 * @param offset Distance ahead of the current position.
	 * @return The character there, or '\0' past the end of the line.
	 */
	private char peek(int offset)
	{
		int index = current + offset;
		return index < text.length() ? text.charAt(index) : '\0';
	}

	private static boolean isQuote(char c)
	{
		return c == '"' || c == '\'';
	}

	private LexerException invalidCharacter(char c)
	{
		return new LexerException("Invalid character '" + c + "'", line, start);
	}

	private void addToken(TokenType type)
	{
		addToken(type, text.substring(start, current), line, start);
	}

	/**
	 * Appends a token and checks it against the kind of the token before it.
	 */
	private void addToken(TokenType type, String lexeme, int tokenLine, int column)
	{
		if (!tokens.isEmpty())
		{
			TokenType previous = tokens.get(tokens.size() - 1).getType();
			IllegalFollow violation = FollowSet.check(previous, type, tokenLine, column);
			if (violation != null)
			{
				logger.debug("{}", violation);
				diagnostics.add(violation);
			}
		}
		tokens.add(new Token(type, lexeme, tokenLine, column));
	}
}
