package dev.zxul767.netflu.parsing;

import java.util.List;

// All AST classes are simple immutable data structures with no real
// behavior, so it's okay for them (and their fields) to be public.
//
// Literal values stay as the raw lexeme text: the code generator re-emits
// them verbatim, so "007" is never turned into 7.
public abstract class Expr {
  public interface Visitor<R> {
    public R visitCallExpr(Call expr);
    public R visitIdentifierExpr(Identifier expr);
    public R visitNumberExpr(Number expr);
    public R visitStringLiteralExpr(StringLiteral expr);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static class Call extends Expr {
    public Call(Token name, List<Expr> arguments) {
      this.name = name;
      this.arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallExpr(this);
    }

    public final Token name;
    public final List<Expr> arguments;
  }

  public static class Identifier extends Expr {
    public Identifier(Token name) { this.name = name; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIdentifierExpr(this);
    }

    public final Token name;
  }

  public static class Number extends Expr {
    public Number(Token literal) { this.literal = literal; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumberExpr(this);
    }

    public final Token literal;
  }

  // `literal.lexeme` keeps its surrounding double quotes
  public static class StringLiteral extends Expr {
    public StringLiteral(Token literal) { this.literal = literal; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStringLiteralExpr(this);
    }

    public final Token literal;
  }
}
