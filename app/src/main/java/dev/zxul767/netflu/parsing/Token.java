package dev.zxul767.netflu.parsing;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final TokenType type;
  public final String lexeme;
  public final int line;
  // UTF-8 byte offset of the lexeme's first character in the source
  public final int offset;

  public Token(TokenType type, String lexeme, int line, int offset) {
    this.type = type;
    this.lexeme = lexeme;
    this.line = line;
    this.offset = offset;
  }

  public Token(TokenType type, String lexeme) {
    this(type, lexeme, /*line:*/ 1, /*offset:*/ 0);
  }

  public String toString() {
    return String.format("%s %s [line %d, byte %d]", type, lexeme, line, offset);
  }
}
