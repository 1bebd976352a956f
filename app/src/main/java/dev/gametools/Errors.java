package dev.gametools;

import dev.gametools.lexing.LexError;

// Reports lexing errors to the user of the command-line tool.
public class Errors {
  static boolean hadError = false;

  public static void error(LexError error) {
    report(
        error.position().toString(),
        String.format(" (%s)", error.code.name().toLowerCase()),
        error.description
    );
  }

  public static void reset() { hadError = false; }

  private static void report(String where, String code, String message) {
    System.err.println("Lexing Error: " + where + " Error" + code + ": " + message);
    System.err.flush();
    hadError = true;
  }
}
