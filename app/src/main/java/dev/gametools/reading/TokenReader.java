package dev.gametools.reading;

import static dev.gametools.lexing.TokenKind.*;

import dev.gametools.lexing.Token;
import dev.gametools.lexing.TokenKind;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// A forward-only cursor over a sequence of tokens, for writing simple
// parsers on top of `Lexer` output.
//
// The reader pulls from its iterator lazily and never holds more than one
// token of lookahead, so it works just as well over a token producer that
// lexes on demand as over a finished list.
public class TokenReader {
  private static final Logger logger = LoggerFactory.getLogger(TokenReader.class);

  // comments aren't whitespace, but they take up just as little meaning
  public static final Set<TokenKind> WHITESPACE_KINDS =
      Collections.unmodifiableSet(EnumSet.of(NEWLINE, LINE_COMMENT, BLOCK_COMMENT));

  private static final Set<TokenKind> FLOAT_KINDS = EnumSet.of(
      FLOAT_LIT, FLOAT_EXP_LIT, INTEGER_LIT, INTEGER_EXP_LIT, HEX_LIT, BIN_LIT
  );
  private static final Set<TokenKind> INTEGER_KINDS =
      EnumSet.of(INTEGER_LIT, INTEGER_EXP_LIT, HEX_LIT, BIN_LIT);
  private static final Set<TokenKind> BOOLEAN_KINDS = EnumSet.of(TRUE_KW, FALSE_KW);
  private static final Set<TokenKind> STRING_KINDS =
      EnumSet.of(SINGLE_STRING_LIT, DOUBLE_STRING_LIT);

  private final Iterator<Token> tokens;
  // the next token, once it has been pulled from `tokens`
  private Token lookahead;
  private Token current;
  private boolean skipWhitespaceOnRead = true;

  public TokenReader(Iterable<Token> tokens) { this(tokens.iterator()); }

  public TokenReader(Iterator<Token> tokens) {
    this.tokens = Objects.requireNonNull(tokens, "tokens");
  }

  // Whether reads skip newline and comment tokens before matching. Only
  // `readToken` can override it per call.
  public boolean skipsWhitespaceOnRead() { return skipWhitespaceOnRead; }

  public void setSkipWhitespaceOnRead(boolean skipWhitespaceOnRead) {
    this.skipWhitespaceOnRead = skipWhitespaceOnRead;
  }

  // the token last consumed by a read or skip, or null if there is none yet
  public Token current() { return current; }

  // returns the next token without consuming it, or null at the end
  public Token peek() {
    if (lookahead == null && tokens.hasNext())
      lookahead = Objects.requireNonNull(tokens.next(), "null token in stream");
    return lookahead;
  }

  // returns the kind of the next token, or null at the end
  public TokenKind peekKind() {
    Token next = peek();
    return next == null ? null : next.kind;
  }

  // whether the next token is of one of `kinds`; false at the end
  public boolean nextIs(TokenKind... kinds) {
    return nextIs((String)null, kinds);
  }

  // whether the next token is of one of `kinds` and, unless `value` is null,
  // has exactly that value; false at the end
  public boolean nextIs(String value, TokenKind... kinds) {
    Token next = peek();
    if (next == null || !Arrays.asList(kinds).contains(next.kind))
      return false;
    return value == null || value.equals(next.value);
  }

  public boolean isEof() { return peek() == null; }

  public Token readToken() { return readToken(TokenQuery.any()); }

  public Token readToken(TokenKind kind) {
    return readToken(TokenQuery.kind(kind));
  }

  // Reads the next token if it matches `query`, skipping whitespace tokens
  // first unless told otherwise.
  //
  // On a mismatch the token is left in place and the query's failure is
  // thrown (a TokenReadException by default), or null is returned for an
  // optional query. Running out of tokens always throws
  // EndOfTokensException.
  public Token readToken(TokenQuery query) {
    Token next = peekMatching(query);
    if (next == null)
      return null;
    current = take();
    return current;
  }

  public double readFloat() { return readFloat("Expected float literal"); }

  public double readFloat(String failMessage) {
    return readConverted(
        TokenQuery.kinds(FLOAT_KINDS), failMessage, Token::toFloat
    );
  }

  public double readFloat(int valueHash, String failMessage) {
    return readConverted(
        TokenQuery.kinds(FLOAT_KINDS).withValueHash(valueHash), failMessage,
        Token::toFloat
    );
  }

  public BigInteger readInteger() {
    return readInteger("Expected integer literal");
  }

  public BigInteger readInteger(String failMessage) {
    return readConverted(
        TokenQuery.kinds(INTEGER_KINDS), failMessage, Token::toInteger
    );
  }

  public BigInteger readInteger(int valueHash, String failMessage) {
    return readConverted(
        TokenQuery.kinds(INTEGER_KINDS).withValueHash(valueHash), failMessage,
        Token::toInteger
    );
  }

  public boolean readBoolean() {
    return readBoolean("Expected boolean literal");
  }

  public boolean readBoolean(String failMessage) {
    Token token = readTyped(TokenQuery.kinds(BOOLEAN_KINDS), failMessage);
    return token.kind == TRUE_KW;
  }

  public boolean readBoolean(int valueHash, String failMessage) {
    Token token = readTyped(
        TokenQuery.kinds(BOOLEAN_KINDS).withValueHash(valueHash), failMessage
    );
    return token.kind == TRUE_KW;
  }

  public String readString() { return readString("Expected string literal"); }

  public String readString(String failMessage) {
    return readTyped(TokenQuery.kinds(STRING_KINDS), failMessage).value;
  }

  public String readString(int valueHash, String failMessage) {
    Token token = readTyped(
        TokenQuery.kinds(STRING_KINDS).withValueHash(valueHash), failMessage
    );
    return token.value;
  }

  // consumes the next token whatever it is
  public TokenReader skipToken() {
    if (peek() == null)
      throw new EndOfTokensException("Attempt to skip token with no more tokens");
    current = take();
    return this;
  }

  // skips up to `count` tokens, stopping early at the end
  public TokenReader skipTokens(int count) {
    if (count < 0)
      throw new IllegalArgumentException("count must not be negative");
    return skip(count, /* kinds: */ null);
  }

  // skips tokens for as long as they are of one of `kinds`
  public TokenReader skipTokens(TokenKind... kinds) {
    return skip(/* count: */ -1, requireKinds(kinds));
  }

  // skips up to `count` tokens for as long as they are of one of `kinds`
  public TokenReader skipTokens(int count, TokenKind... kinds) {
    if (count < 0)
      throw new IllegalArgumentException("count must not be negative");
    return skip(count, requireKinds(kinds));
  }

  public TokenReader skipToToken(TokenKind... kinds) {
    return skipToToken(/* through: */ false, kinds);
  }

  // Skips tokens until the next one is of one of `kinds` (or there are none
  // left). With `through`, the matching token is skipped as well.
  public TokenReader skipToToken(boolean through, TokenKind... kinds) {
    Set<TokenKind> targets = requireKinds(kinds);
    while (!isEof() && !targets.contains(peekKind()))
      skipToken();
    if (through && !isEof())
      skipToken();
    return this;
  }

  // skips newline and comment tokens
  public TokenReader skipWhitespaceTokens() {
    return skip(/* count: */ -1, WHITESPACE_KINDS);
  }

  private Token readTyped(TokenQuery query, String failMessage) {
    return readToken(query.orFail(failMessage));
  }

  // Like `readTyped`, but the token is only consumed once `convert` has
  // succeeded. A value that can't be converted fails like a mismatch.
  private <T> T readConverted(TokenQuery query, String failMessage,
                              Function<Token, T> convert) {
    Token next = peekMatching(query.orFail(failMessage));
    T converted;
    try {
      converted = convert.apply(next);
    } catch (NumberFormatException e) {
      throw new TokenReadException(failMessage, next, e);
    }
    current = take();
    return converted;
  }

  // Returns the next token if it matches `query`, without consuming it.
  // Applies the query's whitespace and failure policies.
  private Token peekMatching(TokenQuery query) {
    if (query.skipsWhitespace(skipWhitespaceOnRead))
      skipWhitespaceTokens();

    Token next = peek();
    if (next == null)
      throw new EndOfTokensException("Attempt to read past end of tokens");

    if (!query.matches(next)) {
      logger.debug("Token {} doesn't match read", next.describe());
      if (query.isOptional())
        return null;
      throw query.failure(next);
    }
    return next;
  }

  // `count` < 0 means no bound, null `kinds` means any kind
  private TokenReader skip(int count, Set<TokenKind> kinds) {
    int remaining = count;
    while (remaining != 0 && !isEof()) {
      if (kinds != null && !kinds.contains(peekKind()))
        break;
      skipToken();
      if (remaining > 0)
        remaining--;
    }
    return this;
  }

  private Token take() {
    Token next = peek();
    lookahead = null;
    return next;
  }

  private static Set<TokenKind> requireKinds(TokenKind... kinds) {
    if (kinds == null || kinds.length == 0)
      throw new IllegalArgumentException("No token kinds provided");
    return EnumSet.copyOf(Arrays.asList(kinds));
  }
}
