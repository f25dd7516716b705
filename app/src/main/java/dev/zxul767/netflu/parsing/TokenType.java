package dev.zxul767.netflu.parsing;

public enum TokenType {
  // keywords
  LET,
  PRINT,
  METHOD,
  FUN,
  BACK,

  // literals
  IDENTIFIER,
  NUMBER,
  STRING,

  // single-character tokens
  PLUS,
  MINUS,
  EQUAL,
  SEMICOLON,
  LEFT_PAREN,
  RIGHT_PAREN,
  LEFT_BRACE,
  RIGHT_BRACE,
  STAR,
  SLASH,

  // matched by the scanner's catch-all rule; never ends up in a token list
  MISMATCH
}
