package dev.zxul767.netflu.codegen;

import dev.zxul767.netflu.CompileError;

public class GenError extends CompileError {
  GenError(int line, String message) { super(Stage.GENERATE, line, message); }

  GenError(int line, String message, GenError cause) {
    super(Stage.GENERATE, line, message, cause);
  }
}
