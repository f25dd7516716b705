package dev.zxul767.netflu.parsing;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class ScannerTest {
  private static List<Token> scan(String source) {
    return new Scanner(source).scanTokens();
  }

  private static List<TokenType> types(String source) {
    return scan(source).stream().map(token -> token.type).collect(Collectors.toList());
  }

  @Test
  void canTokenizeSimpleProgram() {
    List<String> expectedLexemes = Arrays.asList(
        "fun", "main", "(", ")", "{", "let", "x", "=", "\"5\"", ";", "print",
        "(", "x", ")", ";", "}");

    List<Token> tokens = scan("fun main() { let x = \"5\"; print(x); }");

    assertThatLexemesMatch(tokens, expectedLexemes);
    assertThat(tokens.get(0).type, is(TokenType.FUN));
    assertThat(tokens.get(1).type, is(TokenType.IDENTIFIER));
    assertThat(tokens.get(8).type, is(TokenType.STRING));
    assertThat(tokens.get(10).type, is(TokenType.PRINT));
  }

  @Test
  void canTokenizeKeywords() {
    assertThat(
        types("let print method fun back"),
        contains(
            TokenType.LET, TokenType.PRINT, TokenType.METHOD, TokenType.FUN,
            TokenType.BACK
        )
    );
  }

  @Test
  void canTokenizeOperatorsAndPunctuation() {
    assertThat(
        types("+-=;(){}*/"),
        contains(
            TokenType.PLUS, TokenType.MINUS, TokenType.EQUAL, TokenType.SEMICOLON,
            TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE,
            TokenType.RIGHT_BRACE, TokenType.STAR, TokenType.SLASH
        )
    );
  }

  @Test
  void shouldKeepLiteralsAsRawText() {
    List<Token> tokens = scan("007 \"a  b\"");

    assertThat(tokens.get(0).type, is(TokenType.NUMBER));
    assertThat(tokens.get(0).lexeme, is("007"));
    assertThat(tokens.get(1).type, is(TokenType.STRING));
    assertThat(tokens.get(1).lexeme, is("\"a  b\""));
  }

  static Stream<Arguments> identifiersStartingWithKeywords() {
    return Stream.of(
        Arguments.of("letter", TokenType.LET, "let", "ter"),
        Arguments.of("printer", TokenType.PRINT, "print", "er"),
        Arguments.of("methodical", TokenType.METHOD, "method", "ical"),
        Arguments.of("funny", TokenType.FUN, "fun", "ny"),
        Arguments.of("backup", TokenType.BACK, "back", "up")
    );
  }

  @ParameterizedTest
  @MethodSource("identifiersStartingWithKeywords")
  void shouldSplitIdentifiersThatStartWithAKeyword(
      String source, TokenType keyword, String keywordLexeme, String rest
  ) {
    List<Token> tokens = scan(source);

    assertThat(tokens, hasSize(2));
    assertThat(tokens.get(0).type, is(keyword));
    assertThat(tokens.get(0).lexeme, is(keywordLexeme));
    assertThat(tokens.get(1).type, is(TokenType.IDENTIFIER));
    assertThat(tokens.get(1).lexeme, is(rest));
  }

  @Test
  void shouldNotSplitIdentifiersThatContainAKeywordLater() {
    List<Token> tokens = scan("xlet _print");

    assertThatLexemesMatch(tokens, Arrays.asList("xlet", "_print"));
    assertThat(tokens.get(0).type, is(TokenType.IDENTIFIER));
    assertThat(tokens.get(1).type, is(TokenType.IDENTIFIER));
  }

  @Test
  void shouldScanDigitsAfterAKeywordAsANumber() {
    assertThat(types("let1"), contains(TokenType.LET, TokenType.NUMBER));
  }

  @Test
  void shouldIgnoreWhitespace() {
    assertThat(scan(" \t\r\n  "), is(empty()));
    assertThat(scan(""), is(empty()));
  }

  @Test
  void shouldTrackLineNumbers() {
    List<Token> tokens = scan("let\n\nx =\n5;");

    assertThat(tokens.get(0).line, is(1));
    assertThat(tokens.get(1).line, is(3));
    assertThat(tokens.get(2).line, is(3));
    assertThat(tokens.get(3).line, is(4));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "let x = 5;\nprint(x);\n",
    "\n\n\nmethod m {\n  back 1;\n}\n",
    "let s = \"multi\nline\nstring\";\nprint(s);",
    "fun main() {\r\n\tprint(\"a\");\r\n}",
  })
  void lineShouldMatchTheNewlinesBeforeEachToken(String source) {
    // all sources are ASCII, so byte offsets are also char offsets
    for (Token token : scan(source)) {
      long newlines = source.substring(0, token.offset).chars().filter(c -> c == '\n').count();
      assertEquals(newlines + 1, token.line, token.toString());
    }
  }

  @Test
  void shouldRecordByteOffsets() {
    List<Token> tokens = scan("let x = \"é\"; x");

    assertThat(tokens.get(0).offset, is(0));
    assertThat(tokens.get(1).offset, is(4));
    assertThat(tokens.get(3).offset, is(8));
    // "é" takes two bytes in UTF-8
    assertThat(tokens.get(4).offset, is(12));
    assertThat(tokens.get(5).offset, is(14));
  }

  @Test
  void shouldErrorOnUnexpectedCharacter() {
    LexError error = assertThrows(LexError.class, () -> scan("let x = 5 % 2;"));

    assertThat(error.character, is("%"));
    assertThat(error.offset, is(10));
    assertThat(error.line, is(1));
    assertThat(error.getMessage(), containsString("<%>"));
  }

  @Test
  void shouldReportTheByteOffsetOfUnexpectedCharacters() {
    LexError error = assertThrows(LexError.class, () -> scan("\"ü\"\n@"));

    assertThat(error.character, is("@"));
    assertThat(error.offset, is(5));
    assertThat(error.line, is(2));
  }

  @Test
  void shouldErrorOnUnterminatedString() {
    // without a closing quote the string rule can't match, so the opening
    // quote itself is what's unexpected
    LexError error = assertThrows(LexError.class, () -> scan("let x = \"abc"));

    assertThat(error.character, is("\""));
    assertThat(error.offset, is(8));
  }

  private static void assertThatLexemesMatch(List<Token> tokens,
                                             List<String> expectedLexemes) {
    List<String> lexemes =
        tokens.stream().map(token -> token.lexeme).collect(Collectors.toList());

    assertThat(lexemes, is(expectedLexemes));
  }
}
