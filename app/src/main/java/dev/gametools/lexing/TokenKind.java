package dev.gametools.lexing;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public enum TokenKind {
  INVALID("invalid", Category.OTHER),
  NEWLINE("\\n", Category.OTHER),
  ID("identifier", Category.OTHER),
  LINE_COMMENT("// comment", Category.OTHER),
  BLOCK_COMMENT("/* comment */", Category.OTHER),

  // literal keywords
  TRUE_KW("true", Category.LITERAL_KEYWORD),
  FALSE_KW("false", Category.LITERAL_KEYWORD),
  NULL_KW("null", Category.LITERAL_KEYWORD),

  // literals
  INTEGER_LIT("integer", Category.LITERAL),
  FLOAT_LIT("float", Category.LITERAL),
  INTEGER_EXP_LIT("integer exp", Category.LITERAL),
  FLOAT_EXP_LIT("float exp", Category.LITERAL),
  HEX_LIT("hexnum lit", Category.LITERAL),
  BIN_LIT("binary lit", Category.LITERAL),
  SINGLE_STRING_LIT("'...' string", Category.LITERAL),
  DOUBLE_STRING_LIT("\"...\" string", Category.LITERAL),

  // punctuation: the descriptor is the literal text
  DOT(".", Category.PUNCTUATION),
  DOUBLE_DOT("..", Category.PUNCTUATION),
  TRIPLE_DOT("...", Category.PUNCTUATION),
  BANG("!", Category.PUNCTUATION),
  NOT_EQUAL("!=", Category.PUNCTUATION),
  QUESTION("?", Category.PUNCTUATION),
  HASH("#", Category.PUNCTUATION),
  AT("@", Category.PUNCTUATION),
  DOLLAR("$", Category.PUNCTUATION),
  PERCENT("%", Category.PUNCTUATION),
  PAREN_OPEN("(", Category.PUNCTUATION),
  PAREN_CLOSE(")", Category.PUNCTUATION),
  BRACKET_OPEN("[", Category.PUNCTUATION),
  BRACKET_CLOSE("]", Category.PUNCTUATION),
  CURL_OPEN("{", Category.PUNCTUATION),
  CURL_CLOSE("}", Category.PUNCTUATION),
  CARET("^", Category.PUNCTUATION),
  TILDE("~", Category.PUNCTUATION),
  GRAVE("`", Category.PUNCTUATION),
  BACKSLASH("\\", Category.PUNCTUATION),
  SLASH("/", Category.PUNCTUATION),
  COMMA(",", Category.PUNCTUATION),
  SEMICOLON(";", Category.PUNCTUATION),
  GREATER_THAN(">", Category.PUNCTUATION),
  SHIFT_RIGHT(">>", Category.PUNCTUATION),
  GREATER_EQUAL(">=", Category.PUNCTUATION),
  LESS_THAN("<", Category.PUNCTUATION),
  SHIFT_LEFT("<<", Category.PUNCTUATION),
  LESSER_EQUAL("<=", Category.PUNCTUATION),
  EQUALS("=", Category.PUNCTUATION),
  EQUALITY("==", Category.PUNCTUATION),
  PIPE("|", Category.PUNCTUATION),
  OR("||", Category.PUNCTUATION),
  AMPERSAND("&", Category.PUNCTUATION),
  AND("&&", Category.PUNCTUATION),
  COLON(":", Category.PUNCTUATION),
  DOUBLE_COLON("::", Category.PUNCTUATION),
  MINUS("-", Category.PUNCTUATION),
  DOUBLE_MINUS("--", Category.PUNCTUATION),
  ARROW("->", Category.PUNCTUATION),
  PLUS("+", Category.PUNCTUATION),
  DOUBLE_PLUS("++", Category.PUNCTUATION),
  ASTERISK("*", Category.PUNCTUATION),
  DOUBLE_ASTERISK("**", Category.PUNCTUATION);

  enum Category { OTHER, LITERAL_KEYWORD, LITERAL, PUNCTUATION }

  private static final Map<String, TokenKind> punctuationByText;
  static {
    Map<String, TokenKind> byText = new HashMap<>();
    for (TokenKind kind : values()) {
      if (kind.category == Category.PUNCTUATION)
        byText.put(kind.descriptor, kind);
    }
    punctuationByText = Collections.unmodifiableMap(byText);
  }

  private final String descriptor;
  private final Category category;

  TokenKind(String descriptor, Category category) {
    this.descriptor = descriptor;
    this.category = category;
  }

  // human readable name used in diagnostics; for punctuation this is the
  // literal text of the symbol
  public String descriptor() { return descriptor; }

  public boolean isPunctuation() { return category == Category.PUNCTUATION; }

  // literal keywords (true, false, null) count as literals
  public boolean isLiteral() {
    return category == Category.LITERAL ||
        category == Category.LITERAL_KEYWORD;
  }

  public boolean isLiteralKeyword() {
    return category == Category.LITERAL_KEYWORD;
  }

  // returns the punctuation kind spelled `text`, or null if there is none
  public static TokenKind punctuation(String text) {
    return punctuationByText.get(text);
  }

  // returns the kind of the keyword spelled `word`, or ID for any other word
  public static TokenKind word(String word) {
    switch (word) {
    case "true":
      return TRUE_KW;
    case "false":
      return FALSE_KW;
    case "null":
      return NULL_KW;
    default:
      return ID;
    }
  }
}
