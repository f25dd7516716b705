package dev.zxul767.netflu;

// Root of every error the pipeline can produce. Each stage throws its own
// subclass at the point of failure and nothing downstream catches it, so the
// first error aborts the whole compilation.
public class CompileError extends RuntimeException {
  public enum Stage {
    LEX("Lex"),
    PARSE("Parse"),
    ANALYZE("Semantic"),
    GENERATE("Codegen");

    public final String displayName;

    Stage(String displayName) { this.displayName = displayName; }
  }

  // used for `line` when the error can't be tied to a source position
  public static final int NO_LINE = -1;

  public final Stage stage;
  public final int line;

  public CompileError(Stage stage, int line, String message) {
    super(message);
    this.stage = stage;
    this.line = line;
  }

  public CompileError(Stage stage, int line, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.line = line;
  }

  public boolean hasLine() { return line != NO_LINE; }
}
