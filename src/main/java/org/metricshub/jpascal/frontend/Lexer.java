package org.metricshub.jpascal.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpascal
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.metricshub.jpascal.ErrorKind;
import org.metricshub.jpascal.util.ScriptSource;

/**
 * Splits the text of a program into {@link Token}s, one per call to
 * {@link #nextToken()}.
 * <p>
 * The whole source text is held in memory. Identifiers and keywords are
 * uppercased here, which makes the language case-insensitive for all later
 * stages. Once the end of the input is reached, every further call returns
 * an {@link TokenType#EOF} token.
 */
public class Lexer {

	/**
	 * Contains a mapping of reserved words to their token values.
	 * Keys are uppercase, as identifiers are uppercased before the lookup.
	 */
	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();

	static {
		KEYWORDS.put("PROGRAM", TokenType.PROGRAM);
		KEYWORDS.put("VAR", TokenType.VAR);
		KEYWORDS.put("DIV", TokenType.INTEGER_DIV);
		KEYWORDS.put("INTEGER", TokenType.INTEGER);
		KEYWORDS.put("REAL", TokenType.REAL);
		KEYWORDS.put("BEGIN", TokenType.BEGIN);
		KEYWORDS.put("END", TokenType.END);
		KEYWORDS.put("PROCEDURE", TokenType.PROCEDURE);
	}

	private final String text;
	private final String sourceDescription;

	private int pos;
	private int c;
	private int lineNo = 1;
	private int column = 1;

	// position of the token being lexed
	private int tokenLine;
	private int tokenColumn;

	private final StringBuilder lexeme = new StringBuilder();

	/**
	 * Creates a lexer over a program given on the command line or in code.
	 *
	 * @param text the program text
	 */
	public Lexer(String text) {
		this(text, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT);
	}

	/**
	 * @param text the program text
	 * @param sourceDescription where the text comes from, used in error messages
	 */
	public Lexer(String text, String sourceDescription) {
		if (text == null) {
			throw new IllegalArgumentException("Source text must not be null");
		}
		this.text = text;
		this.sourceDescription = sourceDescription;
		this.pos = 0;
		this.c = text.isEmpty() ? -1 : text.charAt(0);
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	private void read() {
		if (c == '\n') {
			lineNo++;
			column = 1;
		} else {
			column++;
		}
		pos++;
		c = pos < text.length() ? text.charAt(pos) : -1;
	}

	private int peek() {
		return pos + 1 < text.length() ? text.charAt(pos + 1) : -1;
	}

	private void skipWhitespaces() {
		while (c >= 0 && isSpace(c)) {
			read();
		}
	}

	/**
	 * Skips a comment, the opening brace included, up to and including the
	 * next closing brace. Comments do not nest.
	 */
	private void skipComment() {
		int startLine = lineNo;
		int startColumn = column;
		read();
		while (c != '}') {
			if (c < 0) {
				throw new LexerException(
						ErrorKind.UNTERMINATED_COMMENT,
						"Comment opened with '{' is never closed",
						sourceDescription,
						startLine,
						startColumn);
			}
			read();
		}
		read();
	}

	/**
	 * Returns the next token of the input.
	 *
	 * @return the next token, {@link TokenType#EOF} at the end of the input
	 * @throws LexerException upon a character no lexical rule accepts, or an unclosed comment
	 */
	public Token nextToken() {
		while (c >= 0) {
			if (isSpace(c)) {
				skipWhitespaces();
				continue;
			}
			if (c == '{') {
				skipComment();
				continue;
			}

			tokenLine = lineNo;
			tokenColumn = column;
			lexeme.setLength(0);

			if (Character.isLetter(c) || c == '_') {
				return identifier();
			}
			if (isDigit(c)) {
				return number();
			}
			if (c == ':' && peek() == '=') {
				read();
				read();
				return token(TokenType.ASSIGN, ":=");
			}

			TokenType single = singleCharacterToken(c);
			if (single != null) {
				String value = String.valueOf((char) c);
				read();
				return token(single, value);
			}

			throw new LexerException(
					ErrorKind.INVALID_CHARACTER,
					"Invalid character (" + c + "): " + ((char) c),
					sourceDescription,
					lineNo,
					column);
		}
		return new Token(TokenType.EOF, null, lineNo, column);
	}

	private static TokenType singleCharacterToken(int ch) {
		switch (ch) {
		case ';':
			return TokenType.SEMI;
		case ':':
			return TokenType.COLON;
		case ',':
			return TokenType.COMMA;
		case '+':
			return TokenType.PLUS;
		case '-':
			return TokenType.MINUS;
		case '*':
			return TokenType.MUL;
		case '/':
			return TokenType.FLOAT_DIV;
		case '(':
			return TokenType.LPAREN;
		case ')':
			return TokenType.RPAREN;
		case '.':
			return TokenType.DOT;
		default:
			return null;
		}
	}

	// no-break spaces included
	private static boolean isSpace(int ch) {
		return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private Token identifier() {
		while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_')) {
			lexeme.append((char) c);
			read();
		}
		String id = lexeme.toString().toUpperCase(Locale.ROOT);
		TokenType kwToken = KEYWORDS.get(id);
		if (kwToken != null) {
			return token(kwToken, id);
		}
		return token(TokenType.ID, id);
	}

	private Token number() {
		while (isDigit(c)) {
			lexeme.append((char) c);
			read();
		}
		if (c == '.') {
			// real constant, the fraction digits may be empty
			lexeme.append('.');
			read();
			while (isDigit(c)) {
				lexeme.append((char) c);
				read();
			}
			return token(TokenType.REAL_CONST, Double.valueOf(lexeme.toString()));
		}
		try {
			return token(TokenType.INTEGER_CONST, Long.valueOf(lexeme.toString()));
		} catch (NumberFormatException e) {
			throw new LexerException(
					ErrorKind.NUMBER_OUT_OF_RANGE,
					"Integer constant out of range: " + lexeme,
					sourceDescription,
					tokenLine,
					tokenColumn);
		}
	}

	private Token token(TokenType type, Object value) {
		return new Token(type, value, tokenLine, tokenColumn);
	}
}
