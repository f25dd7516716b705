package dev.zxul767.netflu.parsing;

import static dev.zxul767.netflu.parsing.TokenType.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// The scanner tries an ordered list of rules at the cursor and commits to
// the first one that matches, even when a later rule would match a longer
// lexeme. Keywords come before identifiers and are not word-bounded, so
// "letter" scans as LET("let") followed by IDENTIFIER("ter").
public class Scanner {
  public static final Map<String, TokenType> keywords;
  static {
    Map<String, TokenType> map = new LinkedHashMap<>();
    map.put("let", LET);
    map.put("print", PRINT);
    map.put("method", METHOD);
    map.put("fun", FUN);
    map.put("back", BACK);
    keywords = Collections.unmodifiableMap(map);
  }

  private static class Rule {
    final TokenType type;
    final Pattern pattern;

    Rule(TokenType type, String regex) {
      this(type, Pattern.compile(regex));
    }

    Rule(TokenType type, Pattern pattern) {
      this.type = type;
      this.pattern = pattern;
    }
  }

  // NOTE: order matters here (see the comment at the top of the class)
  private static final List<Rule> rules;
  static {
    List<Rule> list = new ArrayList<>();
    for (Map.Entry<String, TokenType> keyword : keywords.entrySet()) {
      list.add(new Rule(keyword.getValue(), Pattern.quote(keyword.getKey())));
    }
    list.add(new Rule(IDENTIFIER, "[a-zA-Z_][a-zA-Z0-9_]*"));
    list.add(new Rule(NUMBER, "[0-9]+"));
    // no escape sequences: a string ends at the next double quote
    list.add(new Rule(STRING, "\"[^\"]*\""));
    list.add(new Rule(PLUS, "\\+"));
    list.add(new Rule(MINUS, "-"));
    list.add(new Rule(EQUAL, "="));
    list.add(new Rule(SEMICOLON, ";"));
    list.add(new Rule(LEFT_PAREN, "\\("));
    list.add(new Rule(RIGHT_PAREN, "\\)"));
    list.add(new Rule(LEFT_BRACE, "\\{"));
    list.add(new Rule(RIGHT_BRACE, "\\}"));
    list.add(new Rule(STAR, "\\*"));
    list.add(new Rule(SLASH, "/"));
    // catch-all: any single code point (line terminators included)
    list.add(new Rule(MISMATCH, Pattern.compile(".", Pattern.DOTALL)));
    rules = Collections.unmodifiableList(list);
  }

  private final String sourceCode;
  private final List<Token> tokens = new ArrayList<>();
  // indexes `sourceCode` (in chars) at the start of the next token
  private int current = 0;
  // the same position as `current`, but counted in UTF-8 bytes
  private int byteOffset = 0;
  // `line` starts at 1 (and not 0) to be user friendly
  private int line = 1;

  public Scanner(String sourceCode) { this.sourceCode = sourceCode; }

  public List<Token> scanTokens() {
    while (!isAtEnd()) {
      char c = peek();
      if (Character.isWhitespace(c)) {
        if (c == '\n')
          line++;
        advance(String.valueOf(c));
        continue;
      }
      scanToken();
    }
    return tokens;
  }

  private void scanToken() {
    for (Rule rule : rules) {
      Matcher matcher = rule.pattern.matcher(sourceCode);
      matcher.region(current, sourceCode.length());
      if (!matcher.lookingAt())
        continue;

      String lexeme = matcher.group();
      if (rule.type == MISMATCH) {
        throw new LexError(lexeme, line, byteOffset);
      }
      tokens.add(new Token(rule.type, lexeme, line, byteOffset));
      // strings may span lines
      line += countNewlines(lexeme);
      advance(lexeme);
      return;
    }
    // the catch-all rule matches any character, so this is a bug
    throw new IllegalStateException(
        String.format("no scanning rule matched at char %d", current)
    );
  }

  private static int countNewlines(String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n')
        count++;
    }
    return count;
  }

  private char peek() { return sourceCode.charAt(current); }

  private boolean isAtEnd() { return current >= sourceCode.length(); }

  // moves the cursor past `text`, which must be what comes next in the source
  private void advance(String text) {
    current += text.length();
    byteOffset += text.getBytes(StandardCharsets.UTF_8).length;
  }
}
