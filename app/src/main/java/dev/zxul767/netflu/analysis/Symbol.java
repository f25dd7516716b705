package dev.zxul767.netflu.analysis;

import dev.zxul767.netflu.parsing.Stmt;

// An entry in the analyzer's symbol table: the most recent definition of a
// name.
abstract class Symbol {
  // placeholder left by `let` and assignments
  static class Variable extends Symbol {}

  static class Method extends Symbol {
    final Stmt.Method declaration;
    final MethodInfo info;

    Method(Stmt.Method declaration, MethodInfo info) {
      this.declaration = declaration;
      this.info = info;
    }
  }
}
