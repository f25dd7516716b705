package dev.zxul767.netflu.analysis;

import dev.zxul767.netflu.CompileError;
import dev.zxul767.netflu.parsing.Token;

public class SemanticError extends CompileError {
  public enum Kind {
    UNDEFINED_FUNCTION,
    NOT_CALLABLE,
    NO_RETURN_VALUE,
    UNDEFINED_VARIABLE,
    UNDEFINED_IDENTIFIER,
    INVALID_NUMBER
  }

  public final Kind kind;
  // the name (or literal text) the error is about
  public final String name;

  SemanticError(Kind kind, Token token, String message) {
    super(Stage.ANALYZE, token.line, message);
    this.kind = kind;
    this.name = token.lexeme;
  }
}
