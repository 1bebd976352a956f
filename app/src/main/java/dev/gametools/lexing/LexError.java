package dev.gametools.lexing;

import java.util.Objects;

// The last error raised by a `Lexer` run: what went wrong and where the
// cursor was when it was detected.
public class LexError {
  public final LexErrorCode code;
  public final String description;
  private final Position position;

  public LexError(LexErrorCode code, String description, Position position) {
    this.code = Objects.requireNonNull(code, "code");
    this.description = description;
    this.position = position.copy();
  }

  public Position position() { return position.copy(); }

  @Override
  public String toString() {
    return String.format("%s (%s) %s", position, code, description);
  }
}
