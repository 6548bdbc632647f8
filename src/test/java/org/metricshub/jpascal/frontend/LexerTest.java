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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jpascal.ErrorKind;

public class LexerTest {

	private static List<TokenType> types(String text) {
		Lexer lexer = new Lexer(text);
		List<TokenType> types = new ArrayList<TokenType>();
		Token token;
		do {
			token = lexer.nextToken();
			types.add(token.getType());
		} while (token.getType() != TokenType.EOF);
		return types;
	}

	@Test
	public void testAssignmentStatement() {
		Lexer lexer = new Lexer("x := 2 + 3.5;");

		Token id = lexer.nextToken();
		assertEquals(TokenType.ID, id.getType());
		assertEquals("X", id.getValue());

		assertEquals(TokenType.ASSIGN, lexer.nextToken().getType());

		Token two = lexer.nextToken();
		assertEquals(TokenType.INTEGER_CONST, two.getType());
		assertEquals(2L, two.getValue());

		assertEquals(TokenType.PLUS, lexer.nextToken().getType());

		Token real = lexer.nextToken();
		assertEquals(TokenType.REAL_CONST, real.getType());
		assertEquals(3.5, real.getValue());

		assertEquals(TokenType.SEMI, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
	}

	@Test
	public void testNoBreakSpaceSeparatesTokens() {
		assertEquals(
				Arrays.asList(TokenType.ID, TokenType.ASSIGN, TokenType.INTEGER_CONST, TokenType.EOF),
				types("x\u00A0:=\u00A01\u00A0"));
	}

	@Test
	public void testKeywordsAreCaseInsensitive() {
		assertEquals(
				Arrays.asList(
						TokenType.PROGRAM,
						TokenType.VAR,
						TokenType.INTEGER_DIV,
						TokenType.INTEGER,
						TokenType.REAL,
						TokenType.BEGIN,
						TokenType.END,
						TokenType.PROCEDURE,
						TokenType.EOF),
				types("program Var dIv INTEGER real Begin end PROCEDURE"));
	}

	@Test
	public void testIdentifiersAreUppercased() {
		Lexer lexer = new Lexer("_foo1 Bar_2");
		assertEquals("_FOO1", lexer.nextToken().getValue());
		assertEquals("BAR_2", lexer.nextToken().getValue());
	}

	@Test
	public void testKeywordPrefixIsAnIdentifier() {
		Token token = new Lexer("BEGINNING").nextToken();
		assertEquals(TokenType.ID, token.getType());
		assertEquals("BEGINNING", token.getValue());
	}

	@Test
	public void testSingleCharacterTokens() {
		assertEquals(
				Arrays.asList(
						TokenType.SEMI,
						TokenType.COLON,
						TokenType.COMMA,
						TokenType.PLUS,
						TokenType.MINUS,
						TokenType.MUL,
						TokenType.FLOAT_DIV,
						TokenType.LPAREN,
						TokenType.RPAREN,
						TokenType.DOT,
						TokenType.EOF),
				types("; : , + - * / ( ) ."));
	}

	@Test
	public void testColonWithoutEqualsIsColon() {
		assertEquals(Arrays.asList(TokenType.ID, TokenType.COLON, TokenType.INTEGER, TokenType.EOF), types("a: INTEGER"));
	}

	@Test
	public void testRealConstantWithoutFraction() {
		Token token = new Lexer("3.").nextToken();
		assertEquals(TokenType.REAL_CONST, token.getType());
		assertEquals(3.0, token.getValue());
	}

	@Test
	public void testCommentsAreSkipped() {
		assertEquals(
				Arrays.asList(TokenType.BEGIN, TokenType.END, TokenType.EOF),
				types("{ leading\ncomment } BEGIN {inner}END{trailing}"));
	}

	@Test
	public void testEofIsRepeated() {
		Lexer lexer = new Lexer("  ");
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
	}

	@Test
	public void testLineAndColumnTracking() {
		Lexer lexer = new Lexer("a\n  b");
		Token a = lexer.nextToken();
		assertEquals(1, a.getLineNumber());
		assertEquals(1, a.getColumn());
		Token b = lexer.nextToken();
		assertEquals(2, b.getLineNumber());
		assertEquals(3, b.getColumn());
	}

	@Test
	public void testInvalidCharacter() {
		Lexer lexer = new Lexer("x := 1;\ny := @");
		LexerException e = assertThrows(LexerException.class, () -> {
			while (lexer.nextToken().getType() != TokenType.EOF) {
				// consume
			}
		});
		assertEquals(ErrorKind.INVALID_CHARACTER, e.getKind());
		assertEquals(2, e.getLineNumber());
		assertEquals(6, e.getColumn());
	}

	@Test
	public void testUnterminatedComment() {
		Lexer lexer = new Lexer("BEGIN\n{ never closed");
		assertEquals(TokenType.BEGIN, lexer.nextToken().getType());
		LexerException e = assertThrows(LexerException.class, lexer::nextToken);
		assertEquals(ErrorKind.UNTERMINATED_COMMENT, e.getKind());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testIntegerOutOfRange() {
		LexerException e = assertThrows(LexerException.class, () -> new Lexer("99999999999999999999").nextToken());
		assertEquals(ErrorKind.NUMBER_OUT_OF_RANGE, e.getKind());
	}

	@Test
	public void testSourceDescriptionInMessage() {
		LexerException e = assertThrows(LexerException.class, () -> new Lexer("#", "prog.pas").nextToken());
		assertEquals("prog.pas", e.getSourceDescription());
		assertEquals("Invalid character (35): # (prog.pas, line 1, column 1)", e.getMessage());
	}
}
