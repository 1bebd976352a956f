package dev.gametools.reading;

// Thrown when a read or skip needs a token and the reader has none left.
public class EndOfTokensException extends RuntimeException {
  public EndOfTokensException(String message) { super(message); }
}
