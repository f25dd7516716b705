package dev.zxul767.netflu;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetfluTest {
  @TempDir
  Path directory;

  private final StringWriter errors = new StringWriter();
  private final ErrorReporter reporter = new ErrorReporter(new PrintWriter(errors));

  @Test
  void shouldEmitRustByDefault() {
    Netflu.Options options = Netflu.Options.parse(new String[] {"hello.ntf"});

    assertThat(options.emit, is(Netflu.Emit.RUST));
    assertThat(options.script, is("hello.ntf"));
    assertNull(options.output);
  }

  @Test
  void canParseAllOptions() {
    Netflu.Options options = Netflu.Options.parse(
        new String[] {"--emit=ast", "-o", "out.txt", "hello.ntf"}
    );

    assertThat(options.emit, is(Netflu.Emit.AST));
    assertThat(options.output, is("out.txt"));
    assertThat(options.script, is("hello.ntf"));
  }

  @Test
  void shouldRejectInvalidUsage() {
    assertThrows(IllegalArgumentException.class, () -> Netflu.Options.parse(new String[] {"--emit=bytecode", "a.ntf"}));
    assertThrows(IllegalArgumentException.class, () -> Netflu.Options.parse(new String[] {"a.ntf", "b.ntf"}));
    assertThrows(IllegalArgumentException.class, () -> Netflu.Options.parse(new String[] {"a.ntf", "-o"}));
    assertThrows(IllegalArgumentException.class, () -> Netflu.Options.parse(new String[] {"-o", "out.rs"}));
    assertThrows(IllegalArgumentException.class, () -> Netflu.Options.parse(new String[] {"--verbose"}));
  }

  @Test
  void canEmitTokens() {
    String result = Netflu.run("let x = 5;", Netflu.Emit.TOKENS, reporter);

    assertEquals(
        "LET let [line 1, byte 0]\n"
            + "IDENTIFIER x [line 1, byte 4]\n"
            + "EQUAL = [line 1, byte 6]\n"
            + "NUMBER 5 [line 1, byte 8]\n"
            + "SEMICOLON ; [line 1, byte 9]\n",
        result
    );
  }

  @Test
  void canEmitTheAst() {
    assertEquals(
        "(let x 5)\n(print x)\n",
        Netflu.run("let x = 5; print(x);", Netflu.Emit.AST, reporter)
    );
  }

  @Test
  void shouldReportCompileErrors() {
    assertNull(Netflu.run("print(x);", Netflu.Emit.RUST, reporter));

    assertTrue(reporter.hadError());
    assertThat(errors.toString(), containsString("Semantic Error: Undefined identifier: x"));
  }

  @Test
  void canCompileScriptToFile() throws IOException {
    Path script = directory.resolve("hello.ntf");
    Path output = directory.resolve("hello.rs");
    Files.writeString(script, "fun main() { print(\"héllo\"); }", StandardCharsets.UTF_8);

    Netflu.Options options = Netflu.Options.parse(
        new String[] {script.toString(), "-o", output.toString()}
    );

    assertEquals(0, Netflu.runFile(options));
    assertEquals(
        "fn main() {\n    print!(\"héllo\");\n}\n",
        Files.readString(output, StandardCharsets.UTF_8)
    );
  }

  @Test
  void shouldFailOnScriptsThatDoNotCompile() throws IOException {
    Path script = directory.resolve("broken.ntf");
    Files.writeString(script, "let x = f();", StandardCharsets.UTF_8);

    Netflu.Options options = Netflu.Options.parse(new String[] {script.toString()});

    assertEquals(Netflu.EXIT_COMPILE_ERROR, Netflu.runFile(options));
  }

  @Test
  void shouldFailOnMissingScripts() {
    Netflu.Options options = Netflu.Options.parse(
        new String[] {directory.resolve("missing.ntf").toString()}
    );

    assertEquals(Netflu.EXIT_IO_ERROR, Netflu.runFile(options));
  }
}
