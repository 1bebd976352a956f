package dev.gametools.lexing;

import static dev.gametools.lexing.TokenKind.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// A hand-written lexer that turns a source string into a list of positioned
// tokens.
//
// The lexer walks the source with a single cursor (`index`, `character`,
// `position`) and one character of lookahead (`peekNext`). Every
// sub-recognizer starts with the cursor on the first character of its token
// and leaves it on the last one; `run` then steps past it.
//
// A lexer can be reused for sequential runs, but not from several threads at
// once.
public class Lexer {
  private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

  // sentinel for "no character": before the first read and past the end
  private static final int END = -1;

  // `maxTokens` value for runs without a token bound
  public static final int NO_LIMIT = -1;

  private final List<Token> tokens = new ArrayList<>();
  private LexError error;
  private boolean skipComments = false;
  private boolean skipNewlines = false;

  // cursor state, only meaningful during `run`
  private String source;
  private int index;
  private int character;
  private boolean atEnd;
  private Position position;

  // the token currently being recognized
  private TokenKind tokenKind;
  private String tokenValue;
  private int tokenFrom;
  private Position tokenPosition;

  public Lexer() { reset(); }

  // Clears the produced tokens, the last error and the cursor. The skip
  // flags are kept.
  public void reset() {
    error = null;
    tokens.clear();
    resetCursor();
  }

  public List<Token> tokens() { return Collections.unmodifiableList(tokens); }

  // the error that stopped the last run, or null if it completed
  public LexError error() { return error; }

  public boolean skipsComments() { return skipComments; }

  public void setSkipComments(boolean skipComments) {
    this.skipComments = skipComments;
  }

  public boolean skipsNewlines() { return skipNewlines; }

  public void setSkipNewlines(boolean skipNewlines) {
    this.skipNewlines = skipNewlines;
  }

  public Lexer run(String source) {
    return run(source, INVALID, NO_LIMIT, /* listener: */ null);
  }

  public Lexer run(String source, Consumer<Token> listener) {
    return run(source, INVALID, NO_LIMIT, listener);
  }

  public Lexer run(String source, TokenKind untilKind) {
    return run(source, untilKind, NO_LIMIT, /* listener: */ null);
  }

  public Lexer run(String source, TokenKind untilKind, int maxTokens) {
    return run(source, untilKind, maxTokens, /* listener: */ null);
  }

  // Lexes `source`, appending the tokens that aren't filtered out by the skip
  // flags to `tokens()` and handing each of them to `listener` (if any).
  //
  // The run stops at the end of the source, right after producing a token of
  // kind `untilKind` (that token included), or once `maxTokens` tokens have
  // been appended (`NO_LIMIT` for no bound).
  //
  // throws LexerException on the first lexical error; the error is also kept
  // in `error()`.
  public Lexer run(String source, TokenKind untilKind, int maxTokens,
                   Consumer<Token> listener) {
    if (maxTokens < NO_LIMIT)
      throw new IllegalArgumentException(
          "maxTokens must be NO_LIMIT or not negative, got " + maxTokens
      );
    error = null;
    resetCursor();
    this.source = source;
    logger.debug("Lexing {} characters", source.length());

    int produced = tokens.size();
    int appended = 0;
    try {
      readNext();
      while (maxTokens == NO_LIMIT || appended < maxTokens) {
        skipWhitespace();
        if (character == END)
          break;

        Token token = scanToken();
        if (!isFiltered(token)) {
          tokens.add(token);
          appended++;
          if (listener != null)
            listener.accept(token);
        }

        if (token.kind == untilKind)
          break;

        readNext();
      }
    } finally {
      this.source = null;
    }

    logger.debug("Lexed {} tokens", tokens.size() - produced);
    return this;
  }

  // Same as `run(source)`, but reports a lexical error as a failed result
  // instead of throwing. The result only holds the tokens of this run.
  public LexResult tokenize(String source) {
    int first = tokens.size();
    try {
      run(source);
    } catch (LexerException e) {
      return LexResult.failure(e.error);
    }
    return LexResult.success(new ArrayList<>(tokens.subList(first, tokens.size())));
  }

  private boolean isFiltered(Token token) {
    return (skipComments && token.isComment()) ||
        (skipNewlines && token.isNewline());
  }

  private Token scanToken() {
    tokenKind = INVALID;
    tokenValue = null;
    tokenFrom = index;
    tokenPosition = position.copy();

    int c = character;
    switch (c) {
    case '"':
    case '\'':
      readString();
      break;

    case '0': {
      int next = peekNext();
      if (next == 'x' || next == 'X' || next == 'b' || next == 'B')
        readBaseNumber();
      else
        readNumber();
      break;
    }
    case '1':
    case '2':
    case '3':
    case '4':
    case '5':
    case '6':
    case '7':
    case '8':
    case '9':
      readNumber();
      break;

    // dot, double dot, triple dot, and floats beginning with a dot
    case '.':
      if (isDigit(peekNext())) {
        readNumber();
        break;
      }
      tokenKind = DOT;
      if (peekNext() == '.') {
        readNext();
        tokenKind = DOUBLE_DOT;
        if (peekNext() == '.') {
          readNext();
          tokenKind = TRIPLE_DOT;
        }
      }
      tokenValue = tokenKind.descriptor();
      break;

    case '\n':
      tokenKind = NEWLINE;
      tokenValue = "\n";
      break;

    case '?':
    case '#':
    case '@':
    case '$':
    case '%':
    case '(':
    case ')':
    case '[':
    case ']':
    case '{':
    case '}':
    case '^':
    case '~':
    case '`':
    case '\\':
    case ',':
    case ';':
      punctuation(String.valueOf((char)c));
      break;

    case '=':
    case '|':
    case '&':
    case ':':
    case '+':
    case '*':
      punctuation(extendIf(c, c));
      break;

    case '!':
      punctuation(extendIf(c, '='));
      break;

    case '>':
    case '<':
      punctuation(extendIf(c, '=', c));
      break;

    case '-':
      punctuation(extendIf(c, '>', c));
      break;

    case '/':
      if (peekNext() == '/') {
        readLineComment();
      } else if (peekNext() == '*') {
        readBlockComment();
      } else {
        tokenKind = SLASH;
        tokenValue = SLASH.descriptor();
      }
      break;

    default:
      if (isAlpha(c))
        readWord();
      break;
    }

    if (tokenKind == INVALID) {
      tokenValue = String.valueOf((char)c);
      Token invalid = new Token(INVALID, tokenPosition, tokenFrom, index, tokenValue);
      fail(
          LexErrorCode.INVALID_TOKEN, "Invalid token: " + invalid.describe(),
          tokenPosition
      );
    }
    return new Token(tokenKind, tokenPosition, tokenFrom, index, tokenValue);
  }

  private void punctuation(String text) {
    tokenKind = TokenKind.punctuation(text);
    tokenValue = text;
  }

  // returns the text of the operator starting at `first`, consuming the next
  // character too if it is one of `followers`
  private String extendIf(int first, int... followers) {
    int next = peekNext();
    for (int follower : followers) {
      if (next == follower) {
        readNext();
        return new String(new char[] {(char)first, (char)next});
      }
    }
    return String.valueOf((char)first);
  }

  // pre-condition: the cursor is on the leading `0`
  private void readBaseNumber() {
    int marker = readNext();
    if (marker == 'b' || marker == 'B') {
      tokenKind = BIN_LIT;
      while (peekNext() == '0' || peekNext() == '1')
        readNext();
    } else {
      tokenKind = HEX_LIT;
      while (isHexDigit(peekNext()))
        readNext();
    }
    tokenValue = slice();
  }

  // pre-condition: the cursor is on the first digit, or on a `.` followed by
  // a digit
  private void readNumber() {
    boolean isFloat = character == '.';
    boolean isExponent = false;
    tokenKind = isFloat ? FLOAT_LIT : INTEGER_LIT;

    int next;
    while ((next = peekNext()) != END) {
      if (next == '.') {
        // a second point, or one after the exponent, ends the number
        if (isFloat || isExponent)
          break;
        isFloat = true;
        tokenKind = FLOAT_LIT;
        readNext();
      } else if (isDigit(next)) {
        readNext();
      } else if (next == 'e' || next == 'E') {
        if (isExponent) {
          fail(
              LexErrorCode.DUPLICATE_EXPONENT,
              "Malformed number literal: exponent already provided"
          );
        }
        isExponent = true;
        tokenKind = isFloat ? FLOAT_EXP_LIT : INTEGER_EXP_LIT;

        readNext();
        int c = readNext();
        if (c == '-' || c == '+')
          c = readNext();
        if (!isDigit(c)) {
          fail(
              LexErrorCode.MALFORMED_EXPONENT,
              "Malformed number literal: exponent expected but not provided"
          );
        }
      } else {
        break;
      }
    }
    tokenValue = slice();
  }

  private void readWord() {
    while (isAlphaNumeric(peekNext()))
      readNext();
    tokenValue = slice();
    tokenKind = TokenKind.word(tokenValue);
  }

  // pre-condition: the cursor is on the opening quote
  // post-condition: the cursor is on the closing quote
  private void readString() {
    int quote = character;
    tokenKind = quote == '\'' ? SINGLE_STRING_LIT : DOUBLE_STRING_LIT;

    StringBuilder text = new StringBuilder();
    boolean escape = false;
    int c;
    while ((c = readNext()) != END) {
      if (escape) {
        escape = false;
        appendEscape(text, c);
      } else if (c == quote) {
        break;
      } else if (c == '\\') {
        escape = true;
      } else {
        text.append((char)c);
      }
    }

    if (c == END)
      fail(LexErrorCode.UNTERMINATED_STRING, "Unterminated string");

    tokenValue = text.toString();
  }

  private void appendEscape(StringBuilder text, int c) {
    switch (c) {
    case 'x':
      text.appendCodePoint(readUnicodeEscape(4));
      break;
    case 'X':
      text.appendCodePoint(readUnicodeEscape(8));
      break;
    case 'r':
      text.append('\r');
      break;
    case 'n':
      text.append('\n');
      break;
    case 't':
      text.append('\t');
      break;
    case '0':
      text.append('\0');
      break;
    case 'b':
      text.append('\b');
      break;
    case 'a':
      text.append('\u0007');
      break;
    case 'f':
      text.append('\f');
      break;
    case 'v':
      text.append('\u000B');
      break;
    default:
      // quotes, backslashes and anything else stand for themselves
      text.append((char)c);
      break;
    }
  }

  // Reads up to `maxDigits` hex digits following an `x`/`X` escape marker
  // and returns the code point they spell.
  private int readUnicodeEscape(int maxDigits) {
    int peeked = peekNext();
    if (!isHexDigit(peeked)) {
      fail(
          LexErrorCode.MALFORMED_UNICODE_ESCAPE,
          "Malformed unicode literal in string - no hex code provided."
      );
    }

    long codePoint = 0;
    int remaining = maxDigits;
    do {
      codePoint = codePoint << 4 | Character.digit(peeked, 16);
      readNext();
      peeked = peekNext();
      remaining--;
    } while (isHexDigit(peeked) && remaining > 0);

    if (codePoint > Character.MAX_CODE_POINT) {
      fail(
          LexErrorCode.MALFORMED_UNICODE_ESCAPE,
          String.format(
              "Malformed unicode literal in string - 0x%X is not a code point.",
              codePoint
          )
      );
    }
    return (int)codePoint;
  }

  // pre-condition: the cursor is on the first `/`
  // post-condition: the cursor is on the last character before the newline
  //    (or the end of the source)
  private void readLineComment() {
    tokenKind = LINE_COMMENT;
    while (peekNext() != END && peekNext() != '\n')
      readNext();
    if (!skipComments)
      tokenValue = slice();
  }

  // pre-condition: the cursor is on the opening `/`
  // post-condition: the cursor is on the closing `/`
  private void readBlockComment() {
    tokenKind = BLOCK_COMMENT;

    // the opening `*` can't double as the start of the closing `*/`
    readNext();
    boolean closed = false;
    int c;
    while ((c = readNext()) != END) {
      if (c == '*' && peekNext() == '/') {
        readNext();
        closed = true;
        break;
      }
    }

    if (!closed)
      fail(LexErrorCode.UNTERMINATED_BLOCK_COMMENT, "Unterminated block comment");
    if (!skipComments)
      tokenValue = slice();
  }

  private void skipWhitespace() {
    while (character == ' ' || character == '\t' || character == '\r')
      readNext();
  }

  private void resetCursor() {
    source = null;
    index = -1;
    character = '\0';
    atEnd = false;
    position = new Position(1, 0);
  }

  // returns the character after the cursor without consuming it
  private int peekNext() {
    if (atEnd || index + 1 >= source.length())
      return END;
    return source.charAt(index + 1);
  }

  // moves the cursor one character forward and returns the new character
  private int readNext() {
    if (atEnd)
      return END;

    if (character == '\n')
      position.newLine();

    if (index + 1 >= source.length()) {
      atEnd = true;
      character = END;
      return END;
    }

    character = source.charAt(++index);
    position.column++;
    return character;
  }

  // the source text of the current token, up to and including the cursor
  private String slice() { return source.substring(tokenFrom, index + 1); }

  private void fail(LexErrorCode code, String description) {
    fail(code, description, position);
  }

  private void fail(LexErrorCode code, String description, Position at) {
    error = new LexError(code, description, at);
    logger.debug("Lexing failed: {}", error);
    throw new LexerException(error);
  }

  private static boolean isDigit(int c) { return c >= '0' && c <= '9'; }

  private static boolean isHexDigit(int c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isAlpha(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isAlphaNumeric(int c) {
    return isAlpha(c) || isDigit(c);
  }
}
