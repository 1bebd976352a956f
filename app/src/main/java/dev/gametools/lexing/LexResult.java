package dev.gametools.lexing;

import java.util.Collections;
import java.util.List;

// Outcome of `Lexer.tokenize`: either the produced tokens or the error that
// stopped the run. Exactly one of `tokens()` and `error()` is non-null.
public final class LexResult {
  private final List<Token> tokens;
  private final LexError error;

  private LexResult(List<Token> tokens, LexError error) {
    this.tokens = tokens;
    this.error = error;
  }

  public static LexResult success(List<Token> tokens) {
    return new LexResult(Collections.unmodifiableList(tokens), null);
  }

  public static LexResult failure(LexError error) {
    return new LexResult(null, error);
  }

  public boolean isSuccess() { return error == null; }

  public List<Token> tokens() { return tokens; }

  public LexError error() { return error; }
}
