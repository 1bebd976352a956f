package dev.gametools.reading;

import dev.gametools.lexing.Token;
import dev.gametools.lexing.TokenKind;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

// Criteria for `TokenReader.readToken`: the next token is only read if it
// satisfies every criterion that was set. Also decides what happens when it
// doesn't.
//
//   reader.readToken(TokenQuery.kind(ID).withValue("material")
//                        .orFail("Expected 'material'"));
//
// A query is a mutable builder meant to be created per read.
public final class TokenQuery {
  static final String DEFAULT_FAILURE = "Failed to read token.";

  private TokenKind kind;
  private Set<TokenKind> kinds;
  private Integer valueHash;
  private String value;
  private Boolean skipWhitespace;
  private String failMessage = DEFAULT_FAILURE;
  private Supplier<? extends RuntimeException> failure;
  private boolean optional = false;

  private TokenQuery() {}

  // matches any token
  public static TokenQuery any() { return new TokenQuery(); }

  public static TokenQuery kind(TokenKind kind) {
    TokenQuery query = new TokenQuery();
    query.kind = kind;
    return query;
  }

  public static TokenQuery kinds(TokenKind... kinds) {
    return kinds(Arrays.asList(kinds));
  }

  public static TokenQuery kinds(Collection<TokenKind> kinds) {
    TokenQuery query = new TokenQuery();
    query.kinds = kinds.isEmpty() ? EnumSet.noneOf(TokenKind.class)
                                  : EnumSet.copyOf(kinds);
    return query;
  }

  // Kind criteria can be combined with each other: a token has to satisfy
  // both the single kind and the kind set when both are given.
  public TokenQuery withKind(TokenKind kind) {
    this.kind = kind;
    return this;
  }

  public TokenQuery withKinds(TokenKind... kinds) {
    this.kinds = kinds.length == 0 ? EnumSet.noneOf(TokenKind.class)
                                   : EnumSet.copyOf(Arrays.asList(kinds));
    return this;
  }

  // the token's value must have this `hashCode()`
  public TokenQuery withValueHash(int valueHash) {
    this.valueHash = valueHash;
    return this;
  }

  public TokenQuery withValue(String value) {
    this.value = value;
    return this;
  }

  // overrides the reader's skip-whitespace-on-read setting for this read
  public TokenQuery skipWhitespace(boolean skipWhitespace) {
    this.skipWhitespace = skipWhitespace;
    return this;
  }

  // on mismatch, throw a TokenReadException with this message
  public TokenQuery orFail(String message) {
    this.failMessage = message;
    this.failure = null;
    this.optional = false;
    return this;
  }

  // on mismatch, throw the exception made by `failure`
  public TokenQuery orThrow(Supplier<? extends RuntimeException> failure) {
    this.failure = failure;
    this.optional = false;
    return this;
  }

  // on mismatch, return null instead of throwing; running out of tokens
  // still throws
  public TokenQuery optional() {
    this.optional = true;
    return this;
  }

  boolean matches(Token token) {
    if (kind != null && token.kind != kind)
      return false;
    if (kinds != null && !kinds.contains(token.kind))
      return false;
    if (valueHash != null && token.value.hashCode() != valueHash)
      return false;
    if (value != null && !token.value.equals(value))
      return false;
    return true;
  }

  boolean skipsWhitespace(boolean readerDefault) {
    return skipWhitespace == null ? readerDefault : skipWhitespace;
  }

  boolean isOptional() { return optional; }

  RuntimeException failure(Token token) {
    if (failure != null)
      return failure.get();
    return new TokenReadException(failMessage, token);
  }
}
