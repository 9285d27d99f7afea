/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.ambit.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.ast.Pos;
import net.hydromatic.ambit.ast.Stmt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser for the script language.
 *
 * <p>Grammar:
 *
 * <pre>
 * stmt     ::= 'type' id typeParams? ('extends' typeExp (',' typeExp)*)? ';'
 *            | 'fun' ('ordered' | 'unordered')? typeParams? id
 *                '(' (typeExp (',' typeExp)*)? ')' ';'
 *            | 'global' typeExp id ';'
 *            | 'with' typeExp id ';'
 *            | 'end' ';'
 *            | 'call' id ('on' typeExp id)? ';'
 *            | 'set' id id ';'
 *            | 'show' id ';'
 * typeParams ::= '&lt;' id (',' id)* '&gt;'
 * typeExp  ::= id ('&lt;' typeExp (',' typeExp)* '&gt;')?
 * </pre>
 *
 * <p>A {@code #} starts a comment that runs to the end of the line.
 */
public class ScriptParser {
  private final String text;
  private final String file;
  private final int firstLine;
  private final List<Token> tokens;
  private int i;

  /**
   * Creates a ScriptParser.
   *
   * @param text Text to parse
   * @param file Name of the file, for positions
   * @param firstLine Line number of the first line of {@code text}
   */
  public ScriptParser(String text, String file, int firstLine) {
    this.text = requireNonNull(text);
    this.file = requireNonNull(file);
    this.firstLine = firstLine;
    this.tokens = tokenize();
  }

  /** Creates a ScriptParser for text that is not from a file. */
  public static ScriptParser of(String text) {
    return new ScriptParser(text, "", 1);
  }

  /** Parses zero or more statements, up to the end of the text. */
  public List<Stmt> parseStatements() {
    final ImmutableList.Builder<Stmt> list = ImmutableList.builder();
    while (peek().kind != TokenKind.EOF) {
      list.add(parseStatement());
    }
    return list.build();
  }

  /** Parses one statement. */
  public Stmt parseStatement() {
    final Token start = expect(TokenKind.ID, "statement");
    final Stmt stmt;
    switch (start.text) {
    case "type":
      stmt = parseTypeDecl(start);
      break;
    case "fun":
      stmt = parseFunDecl(start);
      break;
    case "global":
      stmt = parsePush(start, Stmt.Op.GLOBAL);
      break;
    case "with":
      stmt = parsePush(start, Stmt.Op.WITH);
      break;
    case "end":
      stmt = new Stmt.End(pos(start, expectSemicolon()));
      break;
    case "call":
      stmt = parseCall(start);
      break;
    case "set":
      final String propName = expect(TokenKind.ID, "property name").text;
      final String value = expect(TokenKind.ID, "property value").text;
      stmt = new Stmt.Set(pos(start, expectSemicolon()), propName, value);
      break;
    case "show":
      final String what = expect(TokenKind.ID, "what to show").text;
      stmt = new Stmt.Show(pos(start, expectSemicolon()), what);
      break;
    default:
      throw new ParseException("unknown statement '" + start.text + "'",
          pos(start, start));
    }
    return stmt;
  }

  private Stmt parseTypeDecl(Token start) {
    final String name = expect(TokenKind.ID, "type name").text;
    final List<String> parameters = parseTypeParams();
    final List<Stmt.TypeExp> superTypes = new ArrayList<>();
    if (peekKeyword("extends")) {
      next();
      superTypes.add(parseTypeExp());
      while (peek().kind == TokenKind.COMMA) {
        next();
        superTypes.add(parseTypeExp());
      }
    }
    return new Stmt.TypeDecl(pos(start, expectSemicolon()), name, parameters,
        superTypes);
  }

  private Stmt parseFunDecl(Token start) {
    Declaration.@Nullable Mode mode = null;
    if ((peekKeyword("ordered") || peekKeyword("unordered"))
        && peek(1).kind != TokenKind.LPAREN) {
      mode = next().text.equals("ordered")
          ? Declaration.Mode.ORDERED
          : Declaration.Mode.UNORDERED;
    }
    final List<String> typeParameters = parseTypeParams();
    final String name = expect(TokenKind.ID, "function name").text;
    expect(TokenKind.LPAREN, "'('");
    final List<Stmt.TypeExp> receiverTypes = new ArrayList<>();
    if (peek().kind != TokenKind.RPAREN) {
      receiverTypes.add(parseTypeExp());
      while (peek().kind == TokenKind.COMMA) {
        next();
        receiverTypes.add(parseTypeExp());
      }
    }
    expect(TokenKind.RPAREN, "')'");
    return new Stmt.FunDecl(pos(start, expectSemicolon()), mode,
        typeParameters, name, receiverTypes);
  }

  private Stmt parsePush(Token start, Stmt.Op op) {
    final Stmt.TypeExp type = parseTypeExp();
    final String label = expect(TokenKind.ID, "label").text;
    return new Stmt.Push(pos(start, expectSemicolon()), op, type, label);
  }

  private Stmt parseCall(Token start) {
    final String name = expect(TokenKind.ID, "function name").text;
    Stmt.@Nullable TypeExp receiverType = null;
    @Nullable String receiverLabel = null;
    if (peekKeyword("on")) {
      next();
      receiverType = parseTypeExp();
      receiverLabel = expect(TokenKind.ID, "label").text;
    }
    return new Stmt.Call(pos(start, expectSemicolon()), name, receiverType,
        receiverLabel);
  }

  /** Parses an optional list of type parameters, "{@code <T, U>}". */
  private List<String> parseTypeParams() {
    final List<String> list = new ArrayList<>();
    if (peek().kind == TokenKind.LT) {
      next();
      list.add(expect(TokenKind.ID, "type parameter").text);
      while (peek().kind == TokenKind.COMMA) {
        next();
        list.add(expect(TokenKind.ID, "type parameter").text);
      }
      expect(TokenKind.GT, "'>'");
    }
    return list;
  }

  Stmt.TypeExp parseTypeExp() {
    final String name = expect(TokenKind.ID, "type").text;
    final List<Stmt.TypeExp> args = new ArrayList<>();
    if (peek().kind == TokenKind.LT) {
      next();
      args.add(parseTypeExp());
      while (peek().kind == TokenKind.COMMA) {
        next();
        args.add(parseTypeExp());
      }
      expect(TokenKind.GT, "'>'");
    }
    return new Stmt.TypeExp(name, args);
  }

  private Token expectSemicolon() {
    return expect(TokenKind.SEMICOLON, "';'");
  }

  private Token expect(TokenKind kind, String description) {
    final Token token = peek();
    if (token.kind != kind) {
      throw new ParseException("expected " + description + ", got "
          + token.describe(), pos(token, token));
    }
    return next();
  }

  private boolean peekKeyword(String keyword) {
    final Token token = peek();
    return token.kind == TokenKind.ID && token.text.equals(keyword);
  }

  private Token peek() {
    return peek(0);
  }

  private Token peek(int offset) {
    return tokens.get(Math.min(i + offset, tokens.size() - 1));
  }

  private Token next() {
    final Token token = peek();
    if (token.kind != TokenKind.EOF) {
      ++i;
    }
    return token;
  }

  private Pos pos(Token first, Token last) {
    return Pos.of(text, file, firstLine, first.start,
        Math.max(first.start, last.end - 1));
  }

  private List<Token> tokenize() {
    final List<Token> list = new ArrayList<>();
    int p = 0;
    final int n = text.length();
    while (p < n) {
      final char c = text.charAt(p);
      if (Character.isWhitespace(c)) {
        ++p;
      } else if (c == '#') {
        while (p < n && text.charAt(p) != '\n') {
          ++p;
        }
      } else if (Character.isJavaIdentifierStart(c)) {
        final int start = p;
        while (p < n && Character.isJavaIdentifierPart(text.charAt(p))) {
          ++p;
        }
        list.add(new Token(TokenKind.ID, text.substring(start, p), start, p));
      } else {
        final TokenKind kind = TokenKind.of(c);
        if (kind == null) {
          throw new ParseException("unexpected character '" + c + "'",
              Pos.of(text, file, firstLine, p, p));
        }
        list.add(new Token(kind, String.valueOf(c), p, p + 1));
        ++p;
      }
    }
    list.add(new Token(TokenKind.EOF, "", n, n));
    return list;
  }

  /** Kind of token. */
  private enum TokenKind {
    ID,
    LT,
    GT,
    LPAREN,
    RPAREN,
    COMMA,
    SEMICOLON,
    EOF;

    static @Nullable TokenKind of(char c) {
      switch (c) {
      case '<':
        return LT;
      case '>':
        return GT;
      case '(':
        return LPAREN;
      case ')':
        return RPAREN;
      case ',':
        return COMMA;
      case ';':
        return SEMICOLON;
      default:
        return null;
      }
    }
  }

  /** Token. */
  private static class Token {
    final TokenKind kind;
    final String text;
    final int start;
    final int end;

    Token(TokenKind kind, String text, int start, int end) {
      this.kind = kind;
      this.text = text;
      this.start = start;
      this.end = end;
    }

    String describe() {
      return kind == TokenKind.EOF ? "end of input" : "'" + text + "'";
    }
  }
}

// End ScriptParser.java
