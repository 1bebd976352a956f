package dev.gametools.lexing;

public enum LexErrorCode {
  DUPLICATE_EXPONENT,
  MALFORMED_EXPONENT,
  UNTERMINATED_STRING,
  MALFORMED_UNICODE_ESCAPE,
  UNTERMINATED_BLOCK_COMMENT,
  // a character no token can start with
  INVALID_TOKEN
}
