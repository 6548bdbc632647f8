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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jpascal.frontend.ast.AssignmentAst;
import org.metricshub.jpascal.frontend.ast.AstNode;
import org.metricshub.jpascal.frontend.ast.BinaryExpressionAst;
import org.metricshub.jpascal.frontend.ast.BlockAst;
import org.metricshub.jpascal.frontend.ast.CompoundStatementAst;
import org.metricshub.jpascal.frontend.ast.EmptyStatementAst;
import org.metricshub.jpascal.frontend.ast.NumberAst;
import org.metricshub.jpascal.frontend.ast.ProcedureDeclAst;
import org.metricshub.jpascal.frontend.ast.ProgramAst;
import org.metricshub.jpascal.frontend.ast.UnaryExpressionAst;
import org.metricshub.jpascal.frontend.ast.VarDeclAst;
import org.metricshub.jpascal.frontend.ast.VariableAst;

/**
 * Converts the token stream of a {@link Lexer} into a syntax tree.
 * <p>
 * This is a recursive descent parser with a single token of lookahead.
 * Each grammar rule is one method, named after the rule, and the rule
 * itself is given in the comment above the method. There is no error
 * recovery: the first unexpected token aborts with a {@link ParserException}.
 * <p>
 * A parser instance is meant to be used once.
 */
public class PascalParser {

	private final Lexer lexer;
	private Token token;

	/**
	 * <p>
	 * Constructor for PascalParser.
	 * </p>
	 *
	 * @param lexer the lexer the tokens are pulled from
	 */
	public PascalParser(Lexer lexer) {
		this.lexer = lexer;
	}

	/**
	 * Parse the whole program. Build and return the
	 * root of the abstract syntax tree.
	 *
	 * @return the program node
	 * @throws ParserException upon a syntax error, including trailing input
	 * @throws LexerException upon a lexical error
	 */
	public ProgramAst parse() {
		token = lexer.nextToken();
		ProgramAst program = PROGRAM();
		if (token.getType() != TokenType.EOF) {
			throw parserException("Expecting end of input. Found: " + token.getType() + " (" + token.getValue() + ")");
		}
		return program;
	}

	/**
	 * Parse a single expression, which must span the whole input.
	 *
	 * @return the expression tree
	 * @throws ParserException upon a syntax error
	 * @throws LexerException upon a lexical error
	 */
	public AstNode parseExpression() {
		token = lexer.nextToken();
		AstNode expression = EXPRESSION();
		expect(TokenType.EOF);
		return expression;
	}

	private Token expect(TokenType expectedToken) {
		if (token.getType() != expectedToken) {
			throw parserException(
					"Expecting " + expectedToken.name() + ". Found: " + token.getType() + " (" + token.getValue() + ")");
		}
		Token consumed = token;
		if (expectedToken != TokenType.EOF) {
			token = lexer.nextToken();
		}
		return consumed;
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, lexer.getSourceDescription(), token);
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : PROGRAM VARIABLE SEMI BLOCK DOT
	ProgramAst PROGRAM() {
		int lineNo = expect(TokenType.PROGRAM).getLineNumber();
		String name = VARIABLE().getName();
		expect(TokenType.SEMI);
		BlockAst block = BLOCK();
		expect(TokenType.DOT);
		return new ProgramAst(lineNo, name, block, lexer.getSourceDescription());
	}

	// BLOCK : DECLARATIONS COMPOUND_STATEMENT
	BlockAst BLOCK() {
		int lineNo = token.getLineNumber();
		List<AstNode> declarations = DECLARATIONS();
		return new BlockAst(lineNo, declarations, COMPOUND_STATEMENT());
	}

	// DECLARATIONS : ( VAR (VAR_DECLARATION SEMI)+ | PROCEDURE ID SEMI BLOCK SEMI )*
	List<AstNode> DECLARATIONS() {
		List<AstNode> declarations = new ArrayList<AstNode>();
		while (token.getType() == TokenType.VAR || token.getType() == TokenType.PROCEDURE) {
			if (token.getType() == TokenType.VAR) {
				expect(TokenType.VAR);
				do {
					declarations.addAll(VAR_DECLARATION());
					expect(TokenType.SEMI);
				} while (token.getType() == TokenType.ID);
			} else {
				int lineNo = expect(TokenType.PROCEDURE).getLineNumber();
				String procedureName = expect(TokenType.ID).getText();
				expect(TokenType.SEMI);
				BlockAst block = BLOCK();
				expect(TokenType.SEMI);
				declarations.add(new ProcedureDeclAst(lineNo, procedureName, block));
			}
		}
		return declarations;
	}

	// VAR_DECLARATION : ID (COMMA ID)* COLON TYPE_SPEC
	List<VarDeclAst> VAR_DECLARATION() {
		List<Token> ids = new ArrayList<Token>();
		ids.add(expect(TokenType.ID));
		while (token.getType() == TokenType.COMMA) {
			expect(TokenType.COMMA);
			ids.add(expect(TokenType.ID));
		}
		expect(TokenType.COLON);
		String typeName = TYPE_SPEC();

		List<VarDeclAst> varDeclarations = new ArrayList<VarDeclAst>(ids.size());
		for (Token id : ids) {
			varDeclarations.add(new VarDeclAst(id.getLineNumber(), id.getText(), typeName));
		}
		return varDeclarations;
	}

	// TYPE_SPEC : INTEGER | REAL
	String TYPE_SPEC() {
		if (token.getType() == TokenType.INTEGER) {
			return expect(TokenType.INTEGER).getText();
		}
		return expect(TokenType.REAL).getText();
	}

	// COMPOUND_STATEMENT : BEGIN STATEMENT_LIST END
	CompoundStatementAst COMPOUND_STATEMENT() {
		int lineNo = expect(TokenType.BEGIN).getLineNumber();
		List<AstNode> statements = STATEMENT_LIST();
		expect(TokenType.END);
		return new CompoundStatementAst(lineNo, statements);
	}

	// STATEMENT_LIST : STATEMENT (SEMI STATEMENT)*
	List<AstNode> STATEMENT_LIST() {
		List<AstNode> statements = new ArrayList<AstNode>();
		statements.add(STATEMENT());
		while (token.getType() == TokenType.SEMI) {
			expect(TokenType.SEMI);
			statements.add(STATEMENT());
		}
		return statements;
	}

	// STATEMENT : COMPOUND_STATEMENT | ASSIGNMENT | empty
	AstNode STATEMENT() {
		if (token.getType() == TokenType.BEGIN) {
			return COMPOUND_STATEMENT();
		} else if (token.getType() == TokenType.ID) {
			return ASSIGNMENT();
		} else {
			return new EmptyStatementAst(token.getLineNumber());
		}
	}

	// ASSIGNMENT : VARIABLE ASSIGN EXPRESSION
	AssignmentAst ASSIGNMENT() {
		VariableAst target = VARIABLE();
		expect(TokenType.ASSIGN);
		return new AssignmentAst(target.getLineNumber(), target, EXPRESSION());
	}

	// EXPRESSION : TERM ((PLUS | MINUS) TERM)*
	AstNode EXPRESSION() {
		AstNode term = TERM();
		while (token.getType() == TokenType.PLUS || token.getType() == TokenType.MINUS) {
			Token op = token;
			expect(op.getType());
			AstNode nextTerm = TERM();

			// Build the tree in left-associative manner
			term = new BinaryExpressionAst(op.getLineNumber(), term, op.getType(), nextTerm);
		}
		return term;
	}

	// TERM : FACTOR ((MUL | INTEGER_DIV | FLOAT_DIV) FACTOR)*
	AstNode TERM() {
		AstNode factor = FACTOR();
		while (token.getType() == TokenType.MUL
				|| token.getType() == TokenType.INTEGER_DIV
				|| token.getType() == TokenType.FLOAT_DIV) {
			Token op = token;
			expect(op.getType());
			AstNode nextFactor = FACTOR();

			// Build the tree in left-associative manner
			factor = new BinaryExpressionAst(op.getLineNumber(), factor, op.getType(), nextFactor);
		}
		return factor;
	}

	// FACTOR : (PLUS | MINUS) FACTOR | INTEGER_CONST | REAL_CONST | LPAREN EXPRESSION RPAREN | VARIABLE
	AstNode FACTOR() {
		Token current = token;
		switch (current.getType()) {
		case PLUS:
		case MINUS:
			expect(current.getType());
			return new UnaryExpressionAst(current.getLineNumber(), current.getType(), FACTOR());
		case INTEGER_CONST:
		case REAL_CONST:
			expect(current.getType());
			return new NumberAst(current.getLineNumber(), (Number) current.getValue());
		case LPAREN:
			expect(TokenType.LPAREN);
			AstNode expression = EXPRESSION();
			expect(TokenType.RPAREN);
			return expression;
		default:
			return VARIABLE();
		}
	}

	// VARIABLE : ID
	VariableAst VARIABLE() {
		Token id = expect(TokenType.ID);
		return new VariableAst(id.getLineNumber(), id.getText());
	}
	// CHECKSTYLE.ON: MethodName
}
