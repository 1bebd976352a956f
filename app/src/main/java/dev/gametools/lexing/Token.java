package dev.gametools.lexing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Token {
  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*[+-]?\\d+");
  private static final Pattern LEADING_DECIMAL =
      Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private static final Token INVALID =
      new Token(TokenKind.INVALID, new Position(-1, -1), -1, -1, "");

  // tokens are immutable, so these are safe to expose
  public final TokenKind kind;
  // `from` and `to` index the first and last characters of the token
  public final int from;
  public final int to;
  public final String value;
  // the position is kept unpacked so nobody can mutate it through us
  private final int line;
  private final int column;

  public Token(TokenKind kind, Position position, int from, int to,
               String value) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.line = position.line;
    this.column = position.column;
    this.from = from;
    this.to = to;
    this.value = value == null ? "" : value;
  }

  public static Token invalid() { return INVALID; }

  public Position position() { return new Position(line, column); }

  public int line() { return line; }

  public int column() { return column; }

  public String descriptor() { return kind.descriptor(); }

  public boolean isIdentifier() { return kind == TokenKind.ID; }

  public boolean isBoolean() {
    return kind == TokenKind.TRUE_KW || kind == TokenKind.FALSE_KW;
  }

  public boolean isNull() { return kind == TokenKind.NULL_KW; }

  public boolean isLiteral() { return kind.isLiteral(); }

  public boolean isInteger() {
    switch (kind) {
    case INTEGER_LIT:
    case INTEGER_EXP_LIT:
    case HEX_LIT:
    case BIN_LIT:
      return true;
    default:
      return false;
    }
  }

  public boolean isFloat() {
    return kind == TokenKind.FLOAT_LIT || kind == TokenKind.FLOAT_EXP_LIT;
  }

  public boolean isString() {
    return kind == TokenKind.SINGLE_STRING_LIT ||
        kind == TokenKind.DOUBLE_STRING_LIT;
  }

  public boolean isComment() {
    return kind == TokenKind.LINE_COMMENT || kind == TokenKind.BLOCK_COMMENT;
  }

  public boolean isPunctuation() { return kind.isPunctuation(); }

  public boolean isNewline() { return kind == TokenKind.NEWLINE; }

  // Integer value of the token, at any size. Strings are read like decimal
  // integer literals (leading digits only, 0 if there are none). Exponent
  // and float forms are truncated toward zero, so `15e2` is 1500.
  //
  // throws NumberFormatException for an exponent outside the int range
  public BigInteger toInteger() {
    switch (kind) {
    case INTEGER_LIT:
    case SINGLE_STRING_LIT:
    case DOUBLE_STRING_LIT:
      return leadingInteger(value);
    case INTEGER_EXP_LIT:
    case FLOAT_LIT:
    case FLOAT_EXP_LIT:
      return leadingDecimal(value).toBigInteger();
    case HEX_LIT:
      return withoutPrefix(value, 16);
    case BIN_LIT:
      return withoutPrefix(value, 2);
    default:
      throw new IllegalStateException(String.format(
          "Cannot convert this token to an integer: %s", describe()
      ));
    }
  }

  // same NumberFormatException as `toInteger` for out-of-range exponents
  public double toFloat() {
    switch (kind) {
    case FLOAT_LIT:
    case FLOAT_EXP_LIT:
    case INTEGER_LIT:
    case INTEGER_EXP_LIT:
    case SINGLE_STRING_LIT:
    case DOUBLE_STRING_LIT:
      return leadingDecimal(value).doubleValue();
    default:
      return toInteger().doubleValue();
    }
  }

  // the token's fields by name, in declaration order, for dumping tokens
  // into structured output
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("kind", kind);
    map.put("value", value);
    map.put("from", from);
    map.put("to", to);
    map.put("line", line);
    map.put("column", column);
    return map;
  }

  // renders the token for diagnostics, e.g. `identifier 'foo' [1:3] 2..4`
  public String describe() {
    return String.format(
        "%s '%s' [%d:%d] %d..%d", kind.descriptor(), value, line, column, from,
        to
    );
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Token))
      return false;
    Token that = (Token)other;
    return kind == that.kind && from == that.from && to == that.to &&
        line == that.line && column == that.column && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, from, to, line, column, value);
  }

  @Override
  public String toString() {
    return value;
  }

  private static BigInteger leadingInteger(String text) {
    Matcher matcher = LEADING_INTEGER.matcher(text);
    if (!matcher.find())
      return BigInteger.ZERO;
    String digits = matcher.group().trim();
    if (digits.startsWith("+"))
      digits = digits.substring(1);
    return new BigInteger(digits);
  }

  private static BigDecimal leadingDecimal(String text) {
    Matcher matcher = LEADING_DECIMAL.matcher(text);
    if (!matcher.find())
      return BigDecimal.ZERO;
    return new BigDecimal(matcher.group().trim());
  }

  // hex and binary literals keep their `0x`/`0b` prefix in `value`
  private static BigInteger withoutPrefix(String text, int radix) {
    String digits = text.length() > 2 ? text.substring(2) : "";
    if (digits.isEmpty())
      return BigInteger.ZERO;
    return new BigInteger(digits, radix);
  }
}
