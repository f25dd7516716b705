package dev.zxul767.netflu.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

// Renders the AST as s-expressions, one top-level statement per line:
//
//   method answer { let x = 42; back x; }   =>   (method answer (let x 42) (back x))
public class AstPrinter
    implements Expr.Visitor<String>, Stmt.Visitor<String> {

  public String print(List<Stmt> statements) {
    return statements.stream()
        .map(stmt -> print(stmt))
        .collect(Collectors.joining("\n"));
  }

  public String print(Stmt stmt) { return stmt.accept(this); }

  public String print(Expr expr) { return expr.accept(this); }

  @Override
  public String visitLetStmt(Stmt.Let stmt) {
    return parenthesize("let " + stmt.name.lexeme, stmt.value);
  }

  @Override
  public String visitAssignStmt(Stmt.Assign stmt) {
    return parenthesize("assign " + stmt.name.lexeme, stmt.value);
  }

  @Override
  public String visitPrintStmt(Stmt.Print stmt) {
    return parenthesize("print", stmt.value);
  }

  @Override
  public String visitMethodStmt(Stmt.Method stmt) {
    return parenthesizeBody("method " + stmt.name.lexeme, stmt.body);
  }

  @Override
  public String visitFunStmt(Stmt.Fun stmt) {
    return parenthesizeBody("fun " + stmt.name.lexeme, stmt.body);
  }

  @Override
  public String visitBackStmt(Stmt.Back stmt) {
    return "(back " + stmt.value + ")";
  }

  @Override
  public String visitCallStmt(Stmt.Call stmt) {
    return print(stmt.call);
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    return parenthesize(
        "call " + expr.name.lexeme, expr.arguments.toArray(new Expr[0])
    );
  }

  @Override
  public String visitIdentifierExpr(Expr.Identifier expr) {
    return expr.name.lexeme;
  }

  @Override
  public String visitNumberExpr(Expr.Number expr) {
    return expr.literal.lexeme;
  }

  @Override
  public String visitStringLiteralExpr(Expr.StringLiteral expr) {
    return expr.literal.lexeme;
  }

  private String parenthesize(String name, Expr... exprs) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (Expr expr : exprs) {
      builder.append(" ");
      builder.append(expr.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }

  private String parenthesizeBody(String name, List<Stmt> body) {
    List<String> parts = new ArrayList<>();
    parts.add(name);
    for (Stmt stmt : body) {
      parts.add(stmt.accept(this));
    }
    return "(" + String.join(" ", parts) + ")";
  }
}
