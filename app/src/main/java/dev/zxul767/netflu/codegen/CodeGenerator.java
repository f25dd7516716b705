package dev.zxul767.netflu.codegen;

import dev.zxul767.netflu.parsing.Expr;
import dev.zxul767.netflu.parsing.Stmt;
import dev.zxul767.netflu.parsing.Token;
import java.util.List;
import java.util.stream.Collectors;

// Renders an analyzed program as Rust source. Every node maps to a fixed
// textual template; nothing is evaluated, and literal text is copied
// verbatim (string literals keep their quotes).
//
// Statements are written line by line through an `IndentingWriter`, while
// expressions are rendered to strings that statements embed.
public class CodeGenerator implements Stmt.Visitor<Void>, Expr.Visitor<String> {
  public static final String ENTRY_POINT = "main";

  private IndentingWriter writer;

  public String generate(List<Stmt> statements) {
    writer = new IndentingWriter();
    boolean hasEntryPoint = false;

    for (Stmt statement : statements) {
      if (isEntryPoint(statement))
        hasEntryPoint = true;
      generate(statement);
    }

    // the Rust toolchain needs a `main` even if the program doesn't have one
    if (!hasEntryPoint) {
      writer.newline();
      writer.openBlock(String.format("fn %s()", ENTRY_POINT));
      writer.closeBlock();
    }
    return writer.contents();
  }

  private static boolean isEntryPoint(Stmt statement) {
    return statement instanceof Stmt.Fun &&
        ((Stmt.Fun)statement).name.lexeme.equals(ENTRY_POINT);
  }

  private void generate(Stmt stmt) { stmt.accept(this); }

  private String render(Expr expr) { return expr.accept(this); }

  @Override
  public Void visitLetStmt(Stmt.Let stmt) {
    writer.println("let %s = %s;", name(stmt.name), render(stmt.value));
    return null;
  }

  @Override
  public Void visitAssignStmt(Stmt.Assign stmt) {
    writer.println("%s = %s;", name(stmt.name), render(stmt.value));
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print stmt) {
    String value = render(stmt.value);
    if (stmt.value instanceof Expr.StringLiteral) {
      writer.println("print!(%s);", value);
    } else {
      writer.println("print!(\"{}\", %s);", value);
    }
    return null;
  }

  @Override
  public Void visitMethodStmt(Stmt.Method stmt) {
    String name = name(stmt.name);
    writer.openBlock(String.format("fn %s() -> i32", name));
    generateBody("method", stmt.name, stmt.body);

    // methods always return an int; only direct children are looked at
    boolean hasBack =
        stmt.body.stream().anyMatch(statement -> statement instanceof Stmt.Back);
    if (!hasBack) {
      writer.println("return 0;");
    }
    writer.closeBlock();
    return null;
  }

  @Override
  public Void visitFunStmt(Stmt.Fun stmt) {
    String name = name(stmt.name);
    writer.openBlock(String.format("fn %s()", name));
    generateBody("procedure", stmt.name, stmt.body);
    writer.closeBlock();
    return null;
  }

  private void generateBody(String kind, Token name, List<Stmt> body) {
    try {
      for (Stmt statement : body) {
        generate(statement);
      }
    } catch (GenError error) {
      throw new GenError(
          name.line,
          String.format(
              "in %s '%s': %s", kind, name.lexeme, error.getMessage()
          ),
          error
      );
    }
  }

  @Override
  public Void visitBackStmt(Stmt.Back stmt) {
    // the payload is re-emitted as is, not rendered as an expression
    if (stmt.value == null || stmt.value.isEmpty()) {
      throw new GenError(stmt.keyword.line, "return statement has no value");
    }
    writer.println("return %s;", stmt.value);
    return null;
  }

  @Override
  public Void visitCallStmt(Stmt.Call stmt) {
    writer.println("%s;", render(stmt.call));
    return null;
  }

  @Override
  public String visitCallExpr(Expr.Call expr) {
    String arguments = expr.arguments.stream()
                           .map(this::render)
                           .collect(Collectors.joining(", "));
    return String.format("%s(%s)", name(expr.name), arguments);
  }

  @Override
  public String visitIdentifierExpr(Expr.Identifier expr) {
    return name(expr.name);
  }

  @Override
  public String visitNumberExpr(Expr.Number expr) {
    return expr.literal.lexeme;
  }

  @Override
  public String visitStringLiteralExpr(Expr.StringLiteral expr) {
    return expr.literal.lexeme;
  }

  private static String name(Token name) {
    if (name.lexeme.isEmpty()) {
      throw new GenError(name.line, "cannot generate code for an empty name");
    }
    return name.lexeme;
  }
}
