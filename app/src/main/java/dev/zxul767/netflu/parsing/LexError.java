package dev.zxul767.netflu.parsing;

import dev.zxul767.netflu.CompileError;

public class LexError extends CompileError {
  // the offending character (a full code point, so it may be two chars long)
  public final String character;
  public final int offset;

  LexError(String character, int line, int offset) {
    super(
        Stage.LEX, line,
        String.format(
            "Unexpected character <%s> at byte %d.", character, offset
        )
    );
    this.character = character;
    this.offset = offset;
  }
}
