package dev.zxul767.netflu;

import java.io.PrintWriter;

// Reports compile errors to the user, tagged with the stage that produced
// them:
//
//   [line 3] Semantic Error: Undefined function: f
//
// One reporter belongs to one front end (a script run or a REPL session);
// pipelines never see it.
public class ErrorReporter {
  private final PrintWriter out;
  private boolean hadError = false;

  public ErrorReporter(PrintWriter out) { this.out = out; }

  public void report(CompileError error) {
    out.println(format(error));
    out.flush();
    hadError = true;
  }

  public boolean hadError() { return hadError; }

  public void reset() { hadError = false; }

  public static String format(CompileError error) {
    String where = error.hasLine() ? String.format("[line %d] ", error.line) : "";
    return String.format(
        "%s%s Error: %s", where, error.stage.displayName, error.getMessage()
    );
  }
}
