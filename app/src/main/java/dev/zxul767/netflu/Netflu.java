package dev.zxul767.netflu;

import dev.zxul767.netflu.parsing.AstPrinter;
import dev.zxul767.netflu.parsing.Scanner;
import dev.zxul767.netflu.parsing.Token;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.stream.Collectors;
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

public class Netflu {
  static final int EXIT_USAGE = 64;
  static final int EXIT_COMPILE_ERROR = 65;
  static final int EXIT_IO_ERROR = 74;

  static final String USAGE =
      "Usage: netflu [--emit=tokens|ast|rust] [-o <output file>] [script]";

  // what gets printed for a successfully processed program
  enum Emit { TOKENS, AST, RUST }

  static class Options {
    Emit emit = Emit.RUST;
    String output = null;
    String script = null;

    static Options parse(String[] args) {
      Options options = new Options();
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if (arg.startsWith("--emit=")) {
          options.emit = parseEmit(arg.substring("--emit=".length()));
        } else if (arg.equals("-o")) {
          if (i + 1 >= args.length)
            throw new IllegalArgumentException("-o needs a file name");
          options.output = args[++i];
        } else if (arg.startsWith("-")) {
          throw new IllegalArgumentException("Unknown option: " + arg);
        } else if (options.script == null) {
          options.script = arg;
        } else {
          throw new IllegalArgumentException("Only one script can be compiled");
        }
      }
      if (options.output != null && options.script == null) {
        throw new IllegalArgumentException("-o needs a script to compile");
      }
      return options;
    }

    private static Emit parseEmit(String value) {
      switch (value) {
      case "tokens":
        return Emit.TOKENS;
      case "ast":
        return Emit.AST;
      case "rust":
        return Emit.RUST;
      default:
        throw new IllegalArgumentException("Unknown --emit value: " + value);
      }
    }
  }

  public static void main(String[] args) throws IOException {
    Options options;
    try {
      options = Options.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      System.exit(EXIT_USAGE);
      return;
    }

    if (options.script != null) {
      System.exit(runFile(options));
    } else {
      runPrompt(options.emit);
    }
  }

  static int runFile(Options options) {
    PrintWriter err = new PrintWriter(System.err, /* autoFlush: */ true);
    String source;
    try {
      source = Files.readString(Paths.get(options.script), StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println(String.format("Could not read '%s': %s", options.script, e));
      return EXIT_IO_ERROR;
    }

    ErrorReporter reporter = new ErrorReporter(err);
    String result = run(source, options.emit, reporter);
    if (reporter.hadError())
      return EXIT_COMPILE_ERROR;

    if (options.output == null) {
      System.out.print(result);
      System.out.flush();
      return 0;
    }
    try {
      Files.writeString(Paths.get(options.output), result, StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println(String.format("Could not write '%s': %s", options.output, e));
      return EXIT_IO_ERROR;
    }
    return 0;
  }

  // returns null (after reporting the error) if `source` doesn't compile
  static String run(String source, Emit emit, ErrorReporter reporter) {
    Compiler compiler = new Compiler();
    try {
      switch (emit) {
      case TOKENS:
        return compiler.tokenize(source)
            .stream()
            .map(Token::toString)
            .collect(Collectors.joining("\n", "", "\n"));
      case AST:
        return new AstPrinter().print(compiler.parse(source)) + "\n";
      default:
        return compiler.compile(source);
      }
    } catch (CompileError error) {
      reporter.report(error);
      return null;
    }
  }

  private static void runPrompt(Emit emit) throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    showBannerAndHelp(terminal);

    // errors and output share the terminal so they can't interleave badly
    ErrorReporter reporter = new ErrorReporter(terminal.writer());
    LineReader reader = createReplReader(terminal);

    // every accepted line is kept, so later lines can use earlier bindings
    StringBuilder session = new StringBuilder();
    while (true) {
      try {
        String line = reader.readLine(">>> ");
        if (line == null || line.trim().equals("quit"))
          break;
        if (line.trim().isEmpty())
          continue;
        if (line.trim().equals("reset")) {
          session.setLength(0);
          continue;
        }

        String candidate = session + line + "\n";
        String result = run(candidate, emit, reporter);
        if (result != null) {
          session.append(line).append("\n");
          terminal.writer().print(result);
          terminal.writer().flush();
        }

        // if the user makes a mistake, we don't kill the session
        reporter.reset();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String logo =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("Welcome to the Netflu REPL.")
            .style(AttributedStyle.DEFAULT)
            .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Each line is compiled together with the lines accepted before it.");
    terminal.writer().println("- Type \"reset\" to start over, \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for word completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit", "reset"),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }
}
