/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.ambit;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Runnables;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.ambit.eval.Interpreter;
import net.hydromatic.ambit.eval.Prop;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.MaskingCallback;
import org.jline.reader.ParsedLine;
import org.jline.reader.Parser;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Interactive command shell for resolution scripts, powered by JLine3. */
public class Shell {
  private final ConfigImpl config;
  private final Terminal terminal;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    try {
      final Config config =
          parse(ConfigImpl.DEFAULT, ImmutableList.copyOf(args));
      final Shell main = create(config, System.in, System.out);
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Shell. */
  public static Shell create(List<String> args, InputStream in,
      OutputStream out) throws IOException {
    final Config config = parse(ConfigImpl.DEFAULT, args);
    return create(config, in, out);
  }

  /** Creates a Shell. */
  public static Shell create(Config config, InputStream in,
      OutputStream out) throws IOException {
    final TerminalBuilder builder = TerminalBuilder.builder();
    builder.streams(in, out);
    final ConfigImpl configImpl = (ConfigImpl) config;
    builder.system(configImpl.system);
    builder.dumb(configImpl.dumb);
    if (configImpl.dumb) {
      builder.type("dumb");
    }
    final Terminal terminal = builder.build();
    return new Shell(config, terminal);
  }

  /** Creates a Shell. */
  public Shell(Config config, Terminal terminal) {
    this.config = (ConfigImpl) config;
    this.terminal = terminal;
  }

  /** Parses an argument list to an equivalent Config.
   *
   * <p>Arguments that name a {@link Prop}, such as {@code --verbose=true},
   * set that property; unrecognized arguments are ignored. */
  public static Config parse(Config config, List<String> argList) {
    ConfigImpl c = (ConfigImpl) config;
    final Map<Prop, Object> propMap = new LinkedHashMap<>(c.propMap);
    for (String arg : argList) {
      if (arg.equals("--banner=false")) {
        c = c.withBanner(false);
      }
      if (arg.equals("--terminal=dumb")) {
        c = c.withDumb(true);
      }
      if (arg.equals("--echo")) {
        c = c.withEcho(true);
      }
      if (arg.equals("--help")) {
        c = c.withHelp(true);
      }
      if (arg.equals("--system=false")) {
        c = c.withSystem(false);
      }
      final int i = arg.indexOf('=');
      if (arg.startsWith("--") && i > 0) {
        final Prop prop = Prop.BY_NAME.get(arg.substring(2, i));
        if (prop != null) {
          prop.setLenient(propMap, arg.substring(i + 1));
        }
      }
    }
    return c.withPropMap(propMap);
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
        "Usage: java " + Shell.class.getName()
            + " [--banner=false] [--terminal=dumb] [--echo] [--help]"
            + " [--<property>=<value>]",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  static void help(Consumer<String> outLines) {
    String[] helpLines = {
        "List of available commands:",
        "    help   Print this help",
        "    quit   Quit shell",
        "Statements:",
        "    type Name [<T, ...>] [extends Super, ...];",
        "    fun [ordered|unordered] [<T, ...>] name(Type, ...);",
        "    global Type label;",
        "    with Type label;",
        "    end;",
        "    call name [on Type label];",
        "    set property value;",
        "    show stack|decls|props;",
    };
    Arrays.asList(helpLines).forEach(outLines);
  }

  /** Pauses after creating the terminal.
   *
   * <p>Calls the value set by {@link Config#withPauseFn(Runnable)} which,
   * for the default config, does nothing; the instance used in testing
   * pauses for a few milliseconds, which makes the test deterministic. */
  protected final void pause() {
    config.pauseFn.run();
  }

  /** Returns whether we can ignore a line. We can ignore a line if it
   * consists only of comments, spaces, and optionally semicolon, and if we
   * are not on a continuation line. */
  private static boolean canIgnoreLine(StringBuilder buf, String line) {
    final String trimmedLine = Main.stripComment(line).trim();
    return buf.length() == 0
        && (trimmedLine.isEmpty() || trimmedLine.equals(";"));
  }

  /** Generates a banner to be shown on startup. */
  private String banner() {
    return "ambit version 0.1"
        + " (java version \"" + System.getProperty("java.version")
        + "\", JRE " + System.getProperty("java.vendor.version")
        + " (build " + System.getProperty("java.vm.version")
        + "), " + terminal.getName()
        + ", " + terminal.getType() + ")";
  }

  public void run() {
    if (config.help) {
      usage(terminal.writer()::println);
      return;
    }

    final Parser parser = new DefaultParser() {
      {
        setEofOnUnclosedQuote(true);
        setEofOnUnclosedBracket(DefaultParser.Bracket.ROUND);
      }

      @Override public ParsedLine parse(String line, int cursor,
          ParseContext context) {
        // Remove from "#" to end of line
        return super.parse(Main.stripComment(line), cursor, context);
      }
    };

    final String equalsPrompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("=")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);
    final String minusPrompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("-")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);

    if (config.banner) {
      terminal.writer().println(banner());
    }
    final LineReader lineReader = LineReaderBuilder.builder()
        .appName("ambit")
        .terminal(terminal)
        .parser(parser)
        .variable(LineReader.SECONDARY_PROMPT_PATTERN, equalsPrompt)
        .build();

    pause();
    final Consumer<String> outLines = terminal.writer()::println;
    final Interpreter interpreter =
        new Interpreter(config.propMap, outLines);
    final LineFn lineFn =
        new TerminalLineFn(minusPrompt, equalsPrompt, lineReader);
    final StringBuilder buf = new StringBuilder();
    for (;;) {
      final Line line = lineFn.read(buf);
      switch (line.type) {
      case EOF:
      case QUIT:
        terminal.writer().flush();
        return;

      case INTERRUPT:
        buf.setLength(0);
        continue;

      case IGNORE:
        continue;

      case HELP:
        help(outLines);
        continue;

      case REGULAR:
        buf.append(line.text);
        if (Main.stripComment(line.text).trim().endsWith(";")) {
          final String code = buf.toString();
          buf.setLength(0);
          if (config.echo) {
            outLines.accept(code);
          }
          Main.execute(interpreter, code, 1);
        } else {
          buf.append("\n");
        }
        break;

      default:
        throw new AssertionError(line.type);
      }
    }
  }

  /** Shell configuration. */
  @SuppressWarnings("unused")
  public interface Config {
    Config DEFAULT =
        new ConfigImpl(true, false, true, false, false, ImmutableMap.of(),
            Runnables.doNothing());

    Config withBanner(boolean banner);
    Config withDumb(boolean dumb);
    Config withSystem(boolean system);
    Config withEcho(boolean echo);
    Config withHelp(boolean help);
    Config withPropMap(Map<Prop, Object> propMap);
    Config withPauseFn(Runnable runnable);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final boolean banner;
    private final boolean dumb;
    private final boolean echo;
    private final boolean help;
    private final boolean system;
    private final ImmutableMap<Prop, Object> propMap;
    private final Runnable pauseFn;

    private ConfigImpl(boolean banner, boolean dumb, boolean system,
        boolean echo, boolean help, ImmutableMap<Prop, Object> propMap,
        Runnable pauseFn) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.echo = echo;
      this.help = help;
      this.propMap = requireNonNull(propMap, "propMap");
      this.pauseFn = requireNonNull(pauseFn, "pauseFn");
    }

    @Override public ConfigImpl withBanner(boolean banner) {
      if (this.banner == banner) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withDumb(boolean dumb) {
      if (this.dumb == dumb) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withSystem(boolean system) {
      if (this.system == system) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withEcho(boolean echo) {
      if (this.echo == echo) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }

    @Override public ConfigImpl withPropMap(Map<Prop, Object> propMap) {
      if (this.propMap.equals(propMap)) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help,
          ImmutableMap.copyOf(propMap), pauseFn);
    }

    @Override public Config withPauseFn(Runnable pauseFn) {
      if (this.pauseFn.equals(pauseFn)) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, propMap,
          pauseFn);
    }
  }

  /** Abstraction of a terminal's line reader. Can read lines from an input
   * and categorize the lines. */
  interface LineFn {
    Line read(StringBuilder buf);
  }

  /** Type of line from {@link LineFn}. */
  enum LineType {
    QUIT,
    EOF,
    INTERRUPT,
    IGNORE,
    HELP,
    REGULAR
  }

  /** Line read by a {@link LineFn}, and its type. */
  static class Line {
    final LineType type;
    final String text;

    Line(LineType type, String text) {
      this.type = requireNonNull(type);
      this.text = requireNonNull(text);
    }

    static Line of(LineType type) {
      return new Line(type, "");
    }
  }

  /** Implementation of {@link LineFn} that reads from JLine's terminal.
   * It is used for interactive sessions. */
  private static class TerminalLineFn implements LineFn {
    private final String minusPrompt;
    private final String equalsPrompt;
    private final LineReader lineReader;

    TerminalLineFn(String minusPrompt, String equalsPrompt,
        LineReader lineReader) {
      this.minusPrompt = minusPrompt;
      this.equalsPrompt = equalsPrompt;
      this.lineReader = lineReader;
    }

    @Override public Line read(StringBuilder buf) {
      final String line;
      try {
        final String prompt = buf.length() == 0 ? minusPrompt : equalsPrompt;
        final String rightPrompt = null;
        line = lineReader.readLine(prompt, rightPrompt, (MaskingCallback) null,
            null);
      } catch (UserInterruptException e) {
        return Line.of(LineType.INTERRUPT);
      } catch (EndOfFileException e) {
        return Line.of(LineType.EOF);
      }

      if (canIgnoreLine(buf, line)) {
        return Line.of(LineType.IGNORE);
      }

      if (line.equalsIgnoreCase("quit")
          || line.equalsIgnoreCase("exit")) {
        return Line.of(LineType.QUIT);
      }

      final ParsedLine pl = lineReader.getParser().parse(line, 0);
      if ("help".equals(pl.word()) || "?".equals(pl.word())) {
        return Line.of(LineType.HELP);
      }
      return new Line(LineType.REGULAR, line);
    }
  }
}

// End Shell.java
