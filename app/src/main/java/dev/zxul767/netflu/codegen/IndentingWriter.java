package dev.zxul767.netflu.codegen;

// Accumulates generated source one line at a time, prefixing each line with
// the indentation of the block it belongs to.
class IndentingWriter {
  private static final int INDENT_SIZE = 4;

  private final StringBuilder output = new StringBuilder();
  private int indentation = 0;

  void openBlock(String header) {
    println(header + " {");
    indent();
  }

  void closeBlock() {
    dedent();
    println("}");
  }

  void newline() { output.append('\n'); }

  void println(String s) {
    printIndentation();
    output.append(s);
    newline();
  }

  void println(String format, Object... args) {
    println(String.format(format, args));
  }

  String contents() { return output.toString(); }

  private void indent() { this.indentation += INDENT_SIZE; }

  private void dedent() { this.indentation -= INDENT_SIZE; }

  private void printIndentation() { output.append(" ".repeat(indentation)); }
}
