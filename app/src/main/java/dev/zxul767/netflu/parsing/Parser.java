package dev.zxul767.netflu.parsing;

import static dev.zxul767.netflu.parsing.TokenType.*;

import java.util.ArrayList;
import java.util.List;

// Recursive descent with a single token of lookahead and no backtracking.
// There is no error recovery: the first malformed construct throws a
// `ParseError` and no partial AST is returned.
public class Parser {
  private final List<Token> tokens;
  // indexes the token currently being looked at
  private int current = 0;

  public Parser(List<Token> tokens) { this.tokens = tokens; }

  // program -> statement*
  public List<Stmt> parse() {
    List<Stmt> statements = new ArrayList<>();
    while (!isAtEnd()) {
      statements.add(statement());
    }
    return statements;
  }

  // statement -> letStatement
  //            | printStatement
  //            | methodDeclaration
  //            | funDeclaration
  //            | backStatement
  //            | assignment
  //            | callStatement
  //
  // pre-condition: there is at least one token left
  private Stmt statement() {
    if (match(LET))
      return letStatement();
    if (match(PRINT))
      return printStatement();
    if (match(METHOD))
      return methodDeclaration();
    if (match(FUN))
      return funDeclaration();
    if (match(BACK))
      return backStatement();

    if (check(IDENTIFIER)) {
      if (checkNext(EQUAL))
        return assignment();
      return callStatement();
    }
    throw error(peek(), String.format("unexpected token %s", peek().type));
  }

  // letStatement -> "let" IDENTIFIER "=" expression ";"
  private Stmt letStatement() {
    Token name = consume(IDENTIFIER);
    consume(EQUAL);
    Expr value = expression();
    consume(SEMICOLON);
    return new Stmt.Let(name, value);
  }

  // printStatement -> "print" "(" expression ")" ";"
  private Stmt printStatement() {
    Token keyword = previous();
    consume(LEFT_PAREN);
    Expr value = expression();
    consume(RIGHT_PAREN);
    consume(SEMICOLON);
    return new Stmt.Print(keyword, value);
  }

  // methodDeclaration -> "method" IDENTIFIER ( "(" ")" )? body
  private Stmt methodDeclaration() {
    Token name = declarationHeader();
    return new Stmt.Method(name, body());
  }

  // funDeclaration -> "fun" IDENTIFIER ( "(" ")" )? body
  private Stmt funDeclaration() {
    Token name = declarationHeader();
    return new Stmt.Fun(name, body());
  }

  // Callables take no parameters, but an empty pair of parentheses may
  // still follow the name.
  private Token declarationHeader() {
    Token name = consume(IDENTIFIER);
    if (match(LEFT_PAREN)) {
      consume(RIGHT_PAREN);
    }
    return name;
  }

  // body -> "{" ( statement | ";" )* "}" ";"?
  private List<Stmt> body() {
    consume(LEFT_BRACE);
    List<Stmt> statements = new ArrayList<>();
    while (!isAtEnd() && !check(RIGHT_BRACE)) {
      // stray semicolons between statements are fine
      if (match(SEMICOLON))
        continue;
      statements.add(statement());
    }
    consume(RIGHT_BRACE);
    match(SEMICOLON);
    return statements;
  }

  // backStatement -> "back" expression ";"
  //
  // Only an identifier or a number literal can be returned, and we keep
  // just its text.
  private Stmt backStatement() {
    Token keyword = previous();
    Expr value = expression();
    consume(SEMICOLON);

    if (value instanceof Expr.Identifier) {
      return new Stmt.Back(keyword, ((Expr.Identifier)value).name.lexeme);
    }
    if (value instanceof Expr.Number) {
      return new Stmt.Back(keyword, ((Expr.Number)value).literal.lexeme);
    }
    throw error(keyword, "invalid expression in return statement");
  }

  // assignment -> IDENTIFIER "=" expression ";"
  private Stmt assignment() {
    Token name = consume(IDENTIFIER);
    consume(EQUAL);
    Expr value = expression();
    consume(SEMICOLON);
    return new Stmt.Assign(name, value);
  }

  // callStatement -> IDENTIFIER "(" arguments ")" ";"
  private Stmt callStatement() {
    Token name = consume(IDENTIFIER);
    Expr.Call call = finishCall(name);
    consume(SEMICOLON);
    return new Stmt.Call(call);
  }

  // expression -> IDENTIFIER ( "(" arguments ")" )?
  //             | NUMBER
  //             | STRING
  private Expr expression() {
    if (isAtEnd())
      throw endOfInput("an expression");

    if (match(IDENTIFIER)) {
      Token name = previous();
      if (check(LEFT_PAREN))
        return finishCall(name);
      return new Expr.Identifier(name);
    }
    if (match(NUMBER))
      return new Expr.Number(previous());
    if (match(STRING))
      return new Expr.StringLiteral(previous());

    throw error(
        peek(), String.format("unexpected token %s in expression", peek().type)
    );
  }

  // arguments -> ( expression ( ";" | "+" )? )*
  //
  // `+` is only a separator here; it is never evaluated as addition.
  //
  // pre-condition: the callee's name has just been consumed
  // post-condition: a RIGHT_PAREN is the last consumed token
  private Expr.Call finishCall(Token name) {
    consume(LEFT_PAREN);
    List<Expr> arguments = new ArrayList<>();
    while (!isAtEnd() && !check(RIGHT_PAREN)) {
      if (match(SEMICOLON))
        continue;

      arguments.add(expression());
      if (!isAtEnd() && !match(SEMICOLON) && !check(RIGHT_PAREN)) {
        consume(PLUS);
      }
    }
    consume(RIGHT_PAREN);
    return new Expr.Call(name, arguments);
  }

  // returns true if it was able to consume the next token
  // consumes the next token if it matches one of `expectedTypes`
  private boolean match(TokenType... expectedTypes) {
    for (TokenType type : expectedTypes) {
      if (check(type)) {
        advance();
        return true;
      }
    }
    return false;
  }

  private Token consume(TokenType type) {
    if (check(type))
      return advance();
    if (isAtEnd())
      throw endOfInput(type.toString());
    throw error(
        peek(), String.format("expected %s, found %s", type, peek().type)
    );
  }

  private boolean check(TokenType expectedType) {
    if (isAtEnd())
      return false;
    return peek().type == expectedType;
  }

  private boolean checkNext(TokenType expectedType) {
    if (current + 1 >= tokens.size())
      return false;
    return tokens.get(current + 1).type == expectedType;
  }

  private Token advance() {
    if (!isAtEnd())
      current++;
    return previous();
  }

  private boolean isAtEnd() { return current >= tokens.size(); }

  private Token peek() { return tokens.get(current); }

  private Token previous() { return tokens.get(current - 1); }

  private ParseError error(Token token, String message) {
    return new ParseError(token, token.line, message);
  }

  private ParseError endOfInput(String expected) {
    int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line;
    return new ParseError(
        /* token: */ null, line,
        String.format("unexpected end of input, expected %s", expected)
    );
  }
}
