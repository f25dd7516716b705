package dev.zxul767.netflu.parsing;

import java.util.List;

public abstract class Stmt {
  public interface Visitor<R> {
    public R visitLetStmt(Let stmt);
    public R visitAssignStmt(Assign stmt);
    public R visitPrintStmt(Print stmt);
    public R visitMethodStmt(Method stmt);
    public R visitFunStmt(Fun stmt);
    public R visitBackStmt(Back stmt);
    public R visitCallStmt(Call stmt);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static class Let extends Stmt {
    public Let(Token name, Expr value) {
      this.name = name;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLetStmt(this);
    }

    public final Token name;
    public final Expr value;
  }

  public static class Assign extends Stmt {
    public Assign(Token name, Expr value) {
      this.name = name;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignStmt(this);
    }

    public final Token name;
    public final Expr value;
  }

  public static class Print extends Stmt {
    public Print(Token keyword, Expr value) {
      this.keyword = keyword;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPrintStmt(this);
    }

    public final Token keyword;
    public final Expr value;
  }

  // A callable that always yields an int. Its locals and return value are
  // computed by the semantic analyzer and kept outside the node (see
  // `analysis.Annotations`).
  public static class Method extends Stmt {
    public Method(Token name, List<Stmt> body) {
      this.name = name;
      this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMethodStmt(this);
    }

    public final Token name;
    public final List<Stmt> body;
  }

  // A procedure: callable in the generated code, but never a valid call
  // target inside Netflu programs.
  public static class Fun extends Stmt {
    public Fun(Token name, List<Stmt> body) {
      this.name = name;
      this.body = List.copyOf(body);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunStmt(this);
    }

    public final Token name;
    public final List<Stmt> body;
  }

  // `value` is either an identifier name or the text of a number literal
  public static class Back extends Stmt {
    public Back(Token keyword, String value) {
      this.keyword = keyword;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBackStmt(this);
    }

    public final Token keyword;
    public final String value;
  }

  // a call used as a statement (i.e., `f(a);`)
  public static class Call extends Stmt {
    public Call(Expr.Call call) { this.call = call; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallStmt(this);
    }

    public final Expr.Call call;
  }
}
