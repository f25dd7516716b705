package dev.zxul767.netflu.parsing;

import dev.zxul767.netflu.CompileError;

public class ParseError extends CompileError {
  // null when the input ended in the middle of a construct
  public final Token token;

  ParseError(Token token, int line, String message) {
    super(Stage.PARSE, line, message);
    this.token = token;
  }

  public boolean atEndOfInput() { return token == null; }
}
