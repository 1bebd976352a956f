package dev.gametools;

import dev.gametools.lexing.LexResult;
import dev.gametools.lexing.Lexer;
import dev.gametools.lexing.LexerException;
import dev.gametools.lexing.Token;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Command-line front end for the lexer: dumps the tokens of a file, or of
// each line typed at an interactive prompt.
public class GtLex {
  static final String USAGE =
      "Usage: gtlex [--skip-comments] [--skip-newlines] [script]";

  private static final Logger logger = LoggerFactory.getLogger(GtLex.class);

  public static void main(String[] args) throws IOException {
    Lexer lexer = new Lexer();
    String script = null;
    for (String arg : args) {
      switch (arg) {
      case "--skip-comments":
        lexer.setSkipComments(true);
        break;
      case "--skip-newlines":
        lexer.setSkipNewlines(true);
        break;
      default:
        if (arg.startsWith("-") || script != null) {
          System.out.println(USAGE);
          System.exit(64);
        }
        script = arg;
      }
    }

    if (script != null) {
      runFile(lexer, script);
    } else {
      runPrompt(lexer);
    }
  }

  private static void runFile(Lexer lexer, String path) throws IOException {
    byte[] bytes = Files.readAllBytes(Paths.get(path));
    run(lexer, new String(bytes, StandardCharsets.UTF_8), System.out);
    if (Errors.hadError)
      System.exit(65);
  }

  private static void runPrompt(Lexer lexer) throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    PrintWriter writer = terminal.writer();
    showBanner(terminal);

    // keep errors and tokens in the same stream so they interleave correctly
    System.setErr(System.out);

    LineReader reader = createReplReader(terminal);
    while (true) {
      try {
        String line = reader.readLine("lex> ");
        if (line == null || line.trim().equals("quit"))
          break;

        lexer.reset();
        lexer.run(line, token -> writer.println(format(token)));
        writer.flush();
      } catch (LexerException e) {
        // a bad line doesn't end the session
        Errors.error(e.error);
        Errors.reset();
      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      } catch (RuntimeException e) {
        logger.error("Unexpected failure while lexing input", e);
      }
    }
  }

  // Lexes `source` as a whole and prints one line per token to `out`.
  // Errors are reported through `Errors`.
  static void run(Lexer lexer, String source, PrintStream out) {
    lexer.reset();
    LexResult result = lexer.tokenize(source);
    if (!result.isSuccess()) {
      Errors.error(result.error());
      return;
    }
    for (Token token : result.tokens())
      out.println(format(token));
  }

  // e.g. `[1:5] identifier 'foo' 4..6`
  static String format(Token token) {
    return String.format(
        "%s %s '%s' %d..%d", token.position(), token.descriptor(),
        printable(token.value), token.from, token.to
    );
  }

  private static String printable(String value) {
    return value.replace("\\", "\\\\")
        .replace("\n", "\\n")
        .replace("\r", "\\r")
        .replace("\t", "\\t");
  }

  private static void showBanner(Terminal terminal) {
    String banner = new AttributedStringBuilder()
                        .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
                        .style(AttributedStyle.BOLD)
                        .append("gtlex")
                        .style(AttributedStyle.DEFAULT)
                        .append(" - type a line to see its tokens")
                        .toAnsi();
    terminal.writer().println(banner);
    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();
    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter("true", "false", "null")
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }
}
