package dev.gametools.reading;

import dev.gametools.lexing.Token;

// Thrown when the next token doesn't match what a read asked for. The
// mismatching token is left unconsumed.
public class TokenReadException extends RuntimeException {
  public final Token token;

  public TokenReadException(String message, Token token) {
    super(message);
    this.token = token;
  }

  public TokenReadException(String message, Token token, Throwable cause) {
    super(message, cause);
    this.token = token;
  }
}
