package dev.zxul767.netflu.analysis;

import dev.zxul767.netflu.analysis.SemanticError.Kind;
import dev.zxul767.netflu.parsing.Expr;
import dev.zxul767.netflu.parsing.Stmt;
import dev.zxul767.netflu.parsing.Token;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// `SemanticAnalyzer` walks the AST once, top-down and left to right, making
// sure every call targets a method that yields a value and every identifier
// is bound before it's used.
//
// There is a single flat symbol table: bindings made inside a method or a
// procedure body are visible to everything that comes after them, just as
// if they had been made at the top level.
//
// An instance owns its symbol table, so it must be used for one
// compilation only.
public class SemanticAnalyzer implements Expr.Visitor<Void>, Stmt.Visitor<Void> {
  private final Map<String, Symbol> symbols = new HashMap<>();
  private final Annotations annotations = new Annotations();
  private boolean used = false;

  public Annotations analyze(List<Stmt> statements) {
    if (used) {
      throw new IllegalStateException(
          "a SemanticAnalyzer can only analyze a single program"
      );
    }
    used = true;

    for (Stmt statement : statements) {
      resolve(statement);
    }
    return annotations;
  }

  private void resolve(Stmt stmt) { stmt.accept(this); }
  private void resolve(Expr expr) { expr.accept(this); }

  private void bindVariable(Token name) {
    symbols.put(name.lexeme, new Symbol.Variable());
  }

  @Override
  public Void visitMethodStmt(Stmt.Method stmt) {
    MethodInfo info = new MethodInfo();
    for (Stmt statement : stmt.body) {
      resolve(statement);
      collect(info, statement);
    }
    annotations.record(stmt, info);

    // registered only after its body has been analyzed, which means a method
    // can't call itself (unless an earlier method had the same name)
    symbols.put(stmt.name.lexeme, new Symbol.Method(stmt, info));
    return null;
  }

  // records what a statement found directly in a method's body tells us about
  // that method
  private void collect(MethodInfo info, Stmt statement) {
    if (statement instanceof Stmt.Let) {
      Stmt.Let let = (Stmt.Let)statement;
      if (let.value instanceof Expr.Number) {
        Token literal = ((Expr.Number)let.value).literal;
        info.defineLocal(let.name.lexeme, parseInt(literal));
      }
    } else if (statement instanceof Stmt.Back) {
      info.offerReturnValue(((Stmt.Back)statement).value);
    }
  }

  private static int parseInt(Token literal) {
    try {
      return Integer.parseInt(literal.lexeme);
    } catch (NumberFormatException e) {
      throw new SemanticError(
          Kind.INVALID_NUMBER, literal,
          String.format("Invalid number: %s", literal.lexeme)
      );
    }
  }

  @Override
  public Void visitFunStmt(Stmt.Fun stmt) {
    // procedures are never registered, so they can't be called
    for (Stmt statement : stmt.body) {
      resolve(statement);
    }
    return null;
  }

  @Override
  public Void visitLetStmt(Stmt.Let stmt) {
    resolve(stmt.value);
    bindVariable(stmt.name);
    return null;
  }

  @Override
  public Void visitAssignStmt(Stmt.Assign stmt) {
    resolve(stmt.value);

    if (stmt.value instanceof Expr.Identifier) {
      Token source = ((Expr.Identifier)stmt.value).name;
      if (!symbols.containsKey(source.lexeme)) {
        throw new SemanticError(
            Kind.UNDEFINED_VARIABLE, source,
            String.format("Undefined variable: %s", source.lexeme)
        );
      }
    }
    // assigning to an unknown name defines it
    bindVariable(stmt.name);
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print stmt) {
    resolve(stmt.value);
    return null;
  }

  @Override
  public Void visitBackStmt(Stmt.Back stmt) {
    // the payload was already validated by the parser
    return null;
  }

  @Override
  public Void visitCallStmt(Stmt.Call stmt) {
    resolve(stmt.call);
    return null;
  }

  @Override
  public Void visitCallExpr(Expr.Call expr) {
    Token name = expr.name;
    Symbol symbol = symbols.get(name.lexeme);
    if (symbol == null) {
      throw new SemanticError(
          Kind.UNDEFINED_FUNCTION, name,
          String.format("Undefined function: %s", name.lexeme)
      );
    }
    if (!(symbol instanceof Symbol.Method)) {
      throw new SemanticError(
          Kind.NOT_CALLABLE, name,
          String.format("%s is not a function", name.lexeme)
      );
    }
    if (!((Symbol.Method)symbol).info.hasReturnValue()) {
      throw new SemanticError(
          Kind.NO_RETURN_VALUE, name,
          String.format("Function %s has no return value", name.lexeme)
      );
    }

    for (Expr argument : expr.arguments) {
      resolve(argument);
    }
    return null;
  }

  @Override
  public Void visitIdentifierExpr(Expr.Identifier expr) {
    if (!symbols.containsKey(expr.name.lexeme)) {
      throw new SemanticError(
          Kind.UNDEFINED_IDENTIFIER, expr.name,
          String.format("Undefined identifier: %s", expr.name.lexeme)
      );
    }
    return null;
  }

  @Override
  public Void visitNumberExpr(Expr.Number expr) {
    return null;
  }

  @Override
  public Void visitStringLiteralExpr(Expr.StringLiteral expr) {
    return null;
  }
}
