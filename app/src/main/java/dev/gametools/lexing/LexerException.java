package dev.gametools.lexing;

public class LexerException extends RuntimeException {
  public final LexError error;

  public LexerException(LexError error) {
    super(error.toString());
    this.error = error;
  }
}
