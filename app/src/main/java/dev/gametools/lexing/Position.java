package dev.gametools.lexing;

// A (line, column) location in source text. Lines start at 1; the cursor
// starts at column 0 and moves to column 1 when it reads the first character
// of a line.
//
// Positions are mutable so the lexer can advance its cursor in place. Tokens
// never share the cursor's instance: they keep a copy taken when the token
// starts.
public class Position {
  public int line;
  public int column;

  public Position(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public Position copy() { return new Position(line, column); }

  // moves to the start of the next line (before its first character)
  void newLine() {
    line++;
    column = 0;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Position))
      return false;
    Position that = (Position)other;
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return String.format("[%d:%d]", line, column);
  }
}
