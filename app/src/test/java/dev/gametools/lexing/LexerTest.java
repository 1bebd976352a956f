package dev.gametools.lexing;

import static dev.gametools.lexing.TokenKind.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LexerTest {
  private static List<Token> lex(String source) {
    return new Lexer().run(source).tokens();
  }

  private static Token lexSingle(String source) {
    List<Token> tokens = lex(source);
    assertEquals(1, tokens.size(), "expected a single token for: " + source);
    return tokens.get(0);
  }

  private static LexErrorCode failureOf(String source) {
    Lexer lexer = new Lexer();
    LexerException e =
        assertThrows(LexerException.class, () -> lexer.run(source));
    assertSame(e.error, lexer.error());
    return e.error.code;
  }

  private static List<TokenKind> kindsOf(List<Token> tokens) {
    return tokens.stream().map(token -> token.kind).collect(Collectors.toList());
  }

  private static List<String> valuesOf(List<Token> tokens) {
    return tokens.stream().map(token -> token.value).collect(Collectors.toList());
  }

  @Test
  void canLexDecimalIntegers() {
    String[] numerals = {
        "0", "7", "42", "1234567890", "9000000000", "99999999999999999999"
    };
    for (String n : numerals) {
      Token token = lexSingle(n);
      assertEquals(INTEGER_LIT, token.kind);
      assertEquals(new BigInteger(n), token.toInteger());
    }
  }

  @Test
  void canLexHexAndBinaryLiterals() {
    Token hex = lexSingle("0x1A");
    assertEquals(HEX_LIT, hex.kind);
    assertEquals("0x1A", hex.value);
    assertEquals(BigInteger.valueOf(26), hex.toInteger());

    Token bin = lexSingle("0b101");
    assertEquals(BIN_LIT, bin.kind);
    assertEquals(BigInteger.valueOf(5), bin.toInteger());

    assertEquals(BigInteger.valueOf(255), lexSingle("0XfF").toInteger());
    assertEquals(BigInteger.valueOf(2), lexSingle("0B10").toInteger());
  }

  @Test
  void binaryLiteralStopsAtFirstNonBinaryDigit() {
    List<Token> tokens = lex("0b12");
    assertThat(kindsOf(tokens), is(Arrays.asList(BIN_LIT, INTEGER_LIT)));
    assertThat(valuesOf(tokens), is(Arrays.asList("0b1", "2")));
  }

  @Test
  void canLexFloatsAndExponents() {
    Token token = lexSingle("1.5e-3");
    assertEquals(FLOAT_EXP_LIT, token.kind);
    assertEquals("1.5e-3", token.value);
    assertEquals(0.0015, token.toFloat(), 1e-12);

    Token exp = lexSingle("12E+3");
    assertEquals(INTEGER_EXP_LIT, exp.kind);
    assertEquals(BigInteger.valueOf(12000), exp.toInteger());

    Token leadingDot = lexSingle(".5");
    assertEquals(FLOAT_LIT, leadingDot.kind);
    assertEquals(0.5, leadingDot.toFloat());

    Token trailingDot = lexSingle("3.");
    assertEquals(FLOAT_LIT, trailingDot.kind);
    assertEquals("3.", trailingDot.value);
  }

  @Test
  void secondDecimalPointStartsAnotherNumber() {
    List<Token> tokens = lex("1.2.3");
    assertThat(kindsOf(tokens), is(Arrays.asList(FLOAT_LIT, FLOAT_LIT)));
    assertThat(valuesOf(tokens), is(Arrays.asList("1.2", ".3")));
  }

  @Test
  void shouldFailOnExponentWithoutDigits() {
    assertEquals(LexErrorCode.MALFORMED_EXPONENT, failureOf("1e"));
    assertEquals(LexErrorCode.MALFORMED_EXPONENT, failureOf("1e+"));
    assertEquals(LexErrorCode.MALFORMED_EXPONENT, failureOf("2.5ex"));
  }

  @Test
  void shouldFailOnDuplicateExponent() {
    assertEquals(LexErrorCode.DUPLICATE_EXPONENT, failureOf("1e1e1"));
    assertEquals(LexErrorCode.DUPLICATE_EXPONENT, failureOf("1.0E5e2"));
  }

  @Test
  void canDecodeStringEscapes() {
    Token token = lexSingle("'a\\nb'");
    assertEquals(SINGLE_STRING_LIT, token.kind);
    assertEquals("a\nb", token.value);
    assertEquals(0, token.from);
    assertEquals(5, token.to);

    Token quoted = lexSingle("\"say \\\"hi\\\" \\\\ \\t\\0\"");
    assertEquals(DOUBLE_STRING_LIT, quoted.kind);
    assertEquals("say \"hi\" \\ \t\0", quoted.value);

    assertEquals("\u0007\b\f\u000B\r", lexSingle("'\\a\\b\\f\\v\\r'").value);
    assertEquals("q", lexSingle("'\\q'").value);
  }

  @Test
  void stringsMayContainTheOtherQuote() {
    assertEquals("it's", lexSingle("\"it's\"").value);
    assertEquals("a \"b\"", lexSingle("'a \"b\"'").value);
  }

  @Test
  void canDecodeUnicodeEscapes() {
    assertEquals("é", lexSingle("'\\x00e9'").value);
    assertEquals(
        new String(Character.toChars(0x1F600)), lexSingle("'\\X0001F600'").value
    );
    // short escapes end at the first non-hex character
    assertEquals("Az", lexSingle("'\\x41z'").value);
    // lowercase x only takes four digits
    assertEquals("é" + "5", lexSingle("'\\x00e95'").value);
  }

  @Test
  void shouldFailOnMalformedUnicodeEscape() {
    assertEquals(LexErrorCode.MALFORMED_UNICODE_ESCAPE, failureOf("'\\xg'"));
    assertEquals(LexErrorCode.MALFORMED_UNICODE_ESCAPE, failureOf("'\\X'"));
    assertEquals(
        LexErrorCode.MALFORMED_UNICODE_ESCAPE, failureOf("'\\XFFFFFFFF'")
    );
  }

  @Test
  void shouldFailOnUnterminatedString() {
    assertEquals(LexErrorCode.UNTERMINATED_STRING, failureOf("'abc"));
    assertEquals(LexErrorCode.UNTERMINATED_STRING, failureOf("\"abc'"));
    assertEquals(LexErrorCode.UNTERMINATED_STRING, failureOf("'abc\\'"));
  }

  @Test
  void everyPunctuationSymbolIsASingleToken() {
    for (TokenKind kind : TokenKind.values()) {
      if (!kind.isPunctuation())
        continue;
      Token token = lexSingle(kind.descriptor());
      assertEquals(kind, token.kind, "lexing " + kind.descriptor());
      assertEquals(kind.descriptor(), token.value);
    }
  }

  @Test
  void shouldPreferLongestOperator() {
    List<Token> tokens = lex(">>= -> - -- ... .. <<<");
    assertThat(
        kindsOf(tokens),
        is(Arrays.asList(
            SHIFT_RIGHT, EQUALS, ARROW, MINUS, DOUBLE_MINUS, TRIPLE_DOT,
            DOUBLE_DOT, SHIFT_LEFT, LESS_THAN
        ))
    );
  }

  @Test
  void singleSlashDoesNotSwallowNextCharacter() {
    List<Token> tokens = lex("a/b");
    assertThat(kindsOf(tokens), is(Arrays.asList(ID, SLASH, ID)));
    assertThat(valuesOf(tokens), is(Arrays.asList("a", "/", "b")));
  }

  @Test
  void canClassifyWords() {
    List<Token> tokens = lex("true false null truthy _x9");
    assertThat(
        kindsOf(tokens), is(Arrays.asList(TRUE_KW, FALSE_KW, NULL_KW, ID, ID))
    );
    assertEquals("_x9", tokens.get(4).value);
  }

  @Test
  void canLexComments() {
    List<Token> tokens = lex("a // c\nb /* x\n y */");
    assertThat(
        kindsOf(tokens),
        is(Arrays.asList(ID, LINE_COMMENT, NEWLINE, ID, BLOCK_COMMENT))
    );
    assertEquals("// c", tokens.get(1).value);
    assertEquals("/* x\n y */", tokens.get(4).value);
    assertEquals(new Position(2, 3), tokens.get(4).position());
  }

  @Test
  void shouldFailOnUnterminatedBlockComment() {
    assertEquals(LexErrorCode.UNTERMINATED_BLOCK_COMMENT, failureOf("/* x"));
    assertEquals(LexErrorCode.UNTERMINATED_BLOCK_COMMENT, failureOf("/*/"));
  }

  @Test
  void canSkipCommentsAndNewlines() {
    Lexer lexer = new Lexer();
    lexer.setSkipComments(true);
    lexer.setSkipNewlines(true);

    List<Token> tokens = lexer.run("a // c\nb").tokens();

    assertThat(kindsOf(tokens), is(Arrays.asList(ID, ID)));
    assertThat(valuesOf(tokens), is(Arrays.asList("a", "b")));
    assertEquals(new Position(2, 1), tokens.get(1).position());
  }

  @Test
  void shouldTrackPositionsAndOffsets() {
    List<Token> tokens = lex("a\n  bc");

    assertEquals(new Position(1, 1), tokens.get(0).position());
    assertEquals(0, tokens.get(0).from);
    assertEquals(0, tokens.get(0).to);

    assertEquals(NEWLINE, tokens.get(1).kind);
    assertEquals(new Position(1, 2), tokens.get(1).position());

    assertEquals(new Position(2, 3), tokens.get(2).position());
    assertEquals(4, tokens.get(2).from);
    assertEquals(5, tokens.get(2).to);
  }

  @Test
  void shouldIgnoreSpacesTabsAndCarriageReturns() {
    List<Token> tokens = lex("\t a \r\n");
    assertThat(kindsOf(tokens), is(Arrays.asList(ID, NEWLINE)));
  }

  @Test
  void shouldFailOnInvalidCharacter() {
    Lexer lexer = new Lexer();
    LexerException e =
        assertThrows(LexerException.class, () -> lexer.run("a é"));

    assertEquals(LexErrorCode.INVALID_TOKEN, e.error.code);
    assertEquals(new Position(1, 3), e.error.position());
    assertThat(e.error.description, containsString("invalid"));
    // tokens before the error are kept
    assertEquals(1, lexer.tokens().size());
  }

  @Test
  void canStopAtGivenKind() {
    Lexer lexer = new Lexer();
    lexer.run("a ; b ; c", SEMICOLON);
    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a", ";")));
  }

  @Test
  void canStopAtFilteredKind() {
    Lexer lexer = new Lexer();
    lexer.setSkipNewlines(true);
    lexer.run("a\nb", NEWLINE);
    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a")));

    lexer.reset();
    lexer.setSkipComments(true);
    lexer.run("a /* c */ b // d\ne", BLOCK_COMMENT);
    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a")));
  }

  @Test
  void canStopAfterMaxTokens() {
    Lexer lexer = new Lexer();
    lexer.run("a b c d", INVALID, 2);
    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a", "b")));

    lexer.reset();
    lexer.run("a", INVALID, 0);
    assertThat(lexer.tokens(), is(empty()));

    lexer.reset();
    lexer.run("a b c", INVALID, Lexer.NO_LIMIT);
    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a", "b", "c")));

    assertThrows(
        IllegalArgumentException.class, () -> lexer.run("a", INVALID, -2)
    );
  }

  @Test
  void maxTokensOnlyCountsEmittedTokens() {
    Lexer lexer = new Lexer();
    lexer.setSkipNewlines(true);
    lexer.run("a\n\nb\nc", INVALID, 2);
    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a", "b")));
  }

  @Test
  void shouldHandEachTokenToListener() {
    Lexer lexer = new Lexer();
    List<Token> seen = new ArrayList<>();

    lexer.run("x = 1 // one", seen::add);

    assertThat(seen, is(lexer.tokens()));
    assertEquals(4, seen.size());
  }

  @Test
  void listenerOnlySeesEmittedTokens() {
    Lexer lexer = new Lexer();
    lexer.setSkipComments(true);
    lexer.setSkipNewlines(true);
    List<Token> seen = new ArrayList<>();

    lexer.run("x = 1 // one\n/* two */ y\n", seen::add);

    assertThat(seen, is(lexer.tokens()));
    assertThat(valuesOf(seen), is(Arrays.asList("x", "=", "1", "y")));
  }

  @Test
  void rerunningAfterResetIsIdempotent() {
    String source = "let x = 'y' + 0x2 /* c */\n";
    Lexer lexer = new Lexer();

    List<Token> first = new ArrayList<>(lexer.run(source).tokens());
    lexer.reset();
    List<Token> second = new ArrayList<>(lexer.run(source).tokens());

    assertThat(second, is(first));
  }

  @Test
  void runsAccumulateTokensUntilReset() {
    Lexer lexer = new Lexer();
    lexer.run("a");
    lexer.run("b");

    assertThat(valuesOf(lexer.tokens()), is(Arrays.asList("a", "b")));
    assertEquals(0, lexer.tokens().get(1).from);
    assertEquals(new Position(1, 1), lexer.tokens().get(1).position());

    lexer.reset();
    assertThat(lexer.tokens(), is(empty()));
  }

  @Test
  void resetKeepsSkipFlags() {
    Lexer lexer = new Lexer();
    lexer.setSkipComments(true);
    lexer.reset();
    assertTrue(lexer.skipsComments());
    assertFalse(lexer.skipsNewlines());
  }

  @Test
  void nextRunClearsPreviousError() {
    Lexer lexer = new Lexer();
    assertThrows(LexerException.class, () -> lexer.run("'open"));
    assertNotNull(lexer.error());

    lexer.run("closed");
    assertNull(lexer.error());
  }

  @Test
  void canReportErrorsAsResults() {
    Lexer lexer = new Lexer();

    LexResult ok = lexer.tokenize("a b");
    assertTrue(ok.isSuccess());
    assertNull(ok.error());
    assertEquals(2, ok.tokens().size());

    LexResult failed = lexer.tokenize("'abc");
    assertFalse(failed.isSuccess());
    assertNull(failed.tokens());
    assertEquals(LexErrorCode.UNTERMINATED_STRING, failed.error().code);
  }
}
