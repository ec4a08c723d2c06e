// This file is part of PointZilla.
// Copyright (C) 2026  The PointZilla Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pointzilla.tools;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Arrays.asList;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.primitives.Doubles;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValueFactory;

import joptsimple.ArgumentAcceptingOptionSpec;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import net.pointzilla.append.CommandType;
import net.pointzilla.exceptions.ConfigurationException;

/**
 * Parses the command line of {@link PointZillaMain}. Options are
 * {@code --name=value} pairs that override keys under {@code pointzilla.}
 * in the configuration. Positional arguments are classified in order: a
 * command keyword, a number, the {@code gap} keyword, an existing file and
 * finally the target time series.
 */
public final class CliOptions {
  /** The root of every key this tool reads. */
  public static final String ROOT = "pointzilla";

  /** The manual point keyword for a gap. */
  public static final String GAP_KEYWORD = "gap";

  private static final ConfigParseOptions PARSE_OPTIONS =
      ConfigParseOptions.defaults().setAllowMissing(false);

  /** How an option maps onto its key. */
  private static enum Kind {
    /** One string value. */
    VALUE,
    /** A boolean that may be given bare. */
    FLAG,
    /** Repeatable, collected into a list. */
    LIST
  }

  /** An option bound to a configuration key. */
  private static final class Setting {
    private final String name;
    private final String path;
    private final Kind kind;
    private final String description;

    private Setting(final String name,
                    final String path,
                    final Kind kind,
                    final String description) {
      this.name = name;
      this.path = ROOT + "." + path;
      this.kind = kind;
      this.description = description;
    }
  }

  private static final List<Setting> SETTINGS = ImmutableList.of(
      new Setting("server", "server", Kind.VALUE, "Store server name or URL"),
      new Setting("username", "username", Kind.VALUE, "Store username"),
      new Setting("password", "password", Kind.VALUE, "Store password"),
      new Setting("wait", "wait", Kind.FLAG,
          "Wait for the append requests to complete"),
      new Setting("append-timeout", "append_timeout", Kind.VALUE,
          "How long to wait for completion, e.g. 5m or 00:05:00"),
      new Setting("poll-interval", "poll_interval", Kind.VALUE,
          "Delay between append status polls"),
      new Setting("request-timeout", "request_timeout", Kind.VALUE,
          "Timeout of a single store call"),
      new Setting("batch-size", "batch_size", Kind.VALUE,
          "Maximum number of points in a single append request"),

      new Setting("time-series", "time_series", Kind.VALUE,
          "Target time series identifier or unique ID"),
      new Setting("time-range", "time_range", Kind.VALUE,
          "Overwrite range as <start>/<end> (defaults to the points' extent)"),
      new Setting("command", "command", Kind.VALUE,
          "Append operation to perform. One of Append or Overwrite"),
      new Setting("grade-code", "grade_code", Kind.VALUE,
          "Grade code for manual and generated points"),
      new Setting("qualifiers", "qualifiers", Kind.VALUE,
          "Comma separated qualifiers for manual and generated points"),

      new Setting("ignore-grades", "ignore_grades", Kind.FLAG,
          "Drop the grade codes of all points"),
      new Setting("ignore-qualifiers", "ignore_qualifiers", Kind.FLAG,
          "Drop the qualifiers of all points"),
      new Setting("mapped-grades", "mapped_grades", Kind.LIST,
          "Grade mapping as low[,high]:mapped or :default. Repeatable"),
      new Setting("mapped-qualifiers", "mapped_qualifiers", Kind.LIST,
          "Qualifier mapping as source:mapped or :defaults. Repeatable"),

      new Setting("source-time-series", "source.time_series", Kind.VALUE,
          "Series to copy. Prefix with [server] or [server:username:password]"
          + " to copy from another server"),
      new Setting("source-query-from", "source.query_from", Kind.VALUE,
          "Start of the copied points"),
      new Setting("source-query-to", "source.query_to", Kind.VALUE,
          "End of the copied points"),

      new Setting("start-time", "generator.start_time", Kind.VALUE,
          "Time of the first generated point [default: now]"),
      new Setting("point-interval", "generator.point_interval", Kind.VALUE,
          "Interval between generated points"),
      new Setting("number-of-points", "generator.number_of_points", Kind.VALUE,
          "Number of points to generate. If 0, use number-of-periods"),
      new Setting("number-of-periods", "generator.number_of_periods",
          Kind.VALUE, "Number of waveform periods to generate"),
      new Setting("waveform-type", "generator.waveform_type", Kind.VALUE,
          "One of SineWave, SquareWave or SawTooth"),
      new Setting("waveform-offset", "generator.offset", Kind.VALUE,
          "Add this constant to the waveform"),
      new Setting("waveform-phase", "generator.phase", Kind.VALUE,
          "Phase within one period, as a fraction of the period"),
      new Setting("waveform-scalar", "generator.scalar", Kind.VALUE,
          "Scale the waveform by this amount"),
      new Setting("waveform-period", "generator.period", Kind.VALUE,
          "Points per waveform period"),
      new Setting("waveform-text-x", "generator.text_x", Kind.VALUE,
          "Emit the X values of the vectorized text"),
      new Setting("waveform-text-y", "generator.text_y", Kind.VALUE,
          "Emit the Y values of the vectorized text"),

      new Setting("csv", "csv.files", Kind.LIST, "Load points from the file"),
      new Setting("csv-format", "csv.format", Kind.VALUE,
          "Known CSV layout. One of NG, 3X or PointZilla"),
      new Setting("csv-date-time-field", "csv.date_time_field", Kind.VALUE,
          "Column of combined date and time timestamps"),
      new Setting("csv-date-time-format", "csv.date_time_format", Kind.VALUE,
          "Pattern of the date and time column [default: ISO 8601]"),
      new Setting("csv-date-only-field", "csv.date_only_field", Kind.VALUE,
          "Column of date-only timestamps"),
      new Setting("csv-date-only-format", "csv.date_only_format", Kind.VALUE,
          "Pattern of the date-only column"),
      new Setting("csv-time-only-field", "csv.time_only_field", Kind.VALUE,
          "Column of time-only timestamps"),
      new Setting("csv-time-only-format", "csv.time_only_format", Kind.VALUE,
          "Pattern of the time-only column"),
      new Setting("csv-default-time-of-day", "csv.default_time_of_day",
          Kind.VALUE, "Time of day when there is no time column"),
      new Setting("csv-value-field", "csv.value_field", Kind.VALUE,
          "Column of values"),
      new Setting("csv-grade-field", "csv.grade_field", Kind.VALUE,
          "Column of grade codes"),
      new Setting("csv-qualifiers-field", "csv.qualifiers_field", Kind.VALUE,
          "Column of qualifiers"),
      new Setting("csv-comment", "csv.comment", Kind.VALUE,
          "Prefix of comment lines"),
      new Setting("csv-skip-rows", "csv.skip_rows", Kind.VALUE,
          "Number of leading lines to skip"),
      new Setting("csv-ignore-invalid-rows", "csv.ignore_invalid_rows",
          Kind.FLAG, "Skip rows that can't be parsed"),
      new Setting("csv-realign", "csv.realign", Kind.FLAG,
          "Shift the points so the first one is at start-time"),
      new Setting("csv-remove-duplicate-points", "csv.remove_duplicate_points",
          Kind.FLAG, "Drop points with the time of the previous point"),
      new Setting("csv-delimiter", "csv.delimiter", Kind.VALUE,
          "Delimiter between fields"),
      new Setting("csv-qualifier-delimiter", "csv.qualifier_delimiter",
          Kind.VALUE, "Delimiter between qualifiers within their column"),
      new Setting("csv-nan-value", "csv.nan_value", Kind.VALUE,
          "Value text that marks a gap"),
      new Setting("csv-timezone", "csv.timezone", Kind.VALUE,
          "Zone of timestamps without an offset [default: UTC]"),

      new Setting("save-csv-path", "save_csv_path", Kind.VALUE,
          "Save the points to this file, or a generated file name when it is "
          + "a directory"),
      new Setting("stop-after-saving-csv", "stop_after_saving_csv", Kind.FLAG,
          "Stop after saving the CSV, before appending any points"),

      new Setting("http-scheme", "http.scheme", Kind.VALUE,
          "Scheme used for bare server names"),
      new Setting("http-base-path", "http.base_path", Kind.VALUE,
          "Path of the store API on the server"));

  private final OptionParser parser;
  private final OptionSpec<Void> help_spec;
  private final OptionSpec<Void> verbose_spec;
  private final ArgumentAcceptingOptionSpec<File> config_spec;
  private final Map<Setting, ArgumentAcceptingOptionSpec<String>> specs;

  private OptionSet options;
  private List<String> positionals;

  public CliOptions() {
    parser = new OptionParser(false);
    help_spec = parser.acceptsAll(asList("help", "h"),
        "Display this help and exit").forHelp();
    verbose_spec = parser.acceptsAll(asList("verbose", "v"),
        "Print debug logging messages.");
    config_spec = parser.accepts("config",
        "Path to a configuration file.")
        .withRequiredArg()
        .ofType(File.class);
    specs = Maps.newLinkedHashMap();
    for (final Setting setting : SETTINGS) {
      final ArgumentAcceptingOptionSpec<String> spec;
      if (setting.kind == Kind.FLAG) {
        spec = parser.accepts(setting.name, setting.description)
            .withOptionalArg()
            .describedAs("true|false");
      } else {
        spec = parser.accepts(setting.name, setting.description)
            .withRequiredArg();
      }
      specs.put(setting, spec);
    }
  }

  /**
   * Parses the arguments after expanding {@code @file} references.
   * @param args The raw command line.
   * @throws ConfigurationException if an option is unknown or malformed or
   * an options file is missing.
   * @throws IllegalStateException if already parsed.
   */
  public void parse(final String[] args) {
    checkState(options == null, "Options have already been parsed");
    final List<String> option_args = Lists.newArrayList();
    final List<String> others = Lists.newArrayList();
    for (final String arg : expandArgumentFiles(asList(args))) {
      if (isOption(arg)) {
        option_args.add(arg);
      } else {
        others.add(arg);
      }
    }
    try {
      options = parser.parse(option_args.toArray(new String[0]));
    } catch (OptionException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
    positionals = Collections.unmodifiableList(others);
  }

  /** @return Whether help was requested. */
  public boolean shouldPrintHelp() {
    checkState(options != null, "Arguments have not been parsed yet.");
    return options.has(help_spec);
  }

  /** @return Whether debug logging was requested. */
  public boolean isVerbose() {
    checkState(options != null, "Arguments have not been parsed yet.");
    return options.has(verbose_spec);
  }

  /** @return The configuration file or null to use the defaults. */
  public File configFile() {
    checkState(options != null, "Arguments have not been parsed yet.");
    return options.valueOf(config_spec);
  }

  /** @return The arguments that were not options, in order. */
  public List<String> positionals() {
    checkState(options != null, "Arguments have not been parsed yet.");
    return positionals;
  }

  /**
   * Loads the configuration file, or {@code application.conf} when none was
   * given, over the bundled defaults and applies the command line on top.
   * @return The resolved configuration.
   * @throws ConfigurationException if the file is missing or invalid.
   */
  public Config loadConfig() {
    final File file = configFile();
    final Config base;
    try {
      if (file != null) {
        base = ConfigFactory.load(ConfigFactory.parseFile(file, PARSE_OPTIONS));
      } else {
        base = ConfigFactory.load();
      }
    } catch (ConfigException e) {
      throw new ConfigurationException("Unable to load configuration"
          + (file != null ? " from " + file : "") + ": " + e.getMessage(), e);
    }
    return overloadConfig(base);
  }

  /**
   * Copies the parsed options and positional arguments onto the config.
   * @param config The config to override.
   * @return The overridden config.
   * @throws ConfigurationException if a value is malformed.
   */
  Config overloadConfig(Config config) {
    checkState(options != null, "Arguments have not been parsed yet.");
    for (final Map.Entry<Setting, ArgumentAcceptingOptionSpec<String>> entry :
        specs.entrySet()) {
      final Setting setting = entry.getKey();
      if (!options.has(entry.getValue())) {
        continue;
      }
      final Object value;
      switch (setting.kind) {
      case FLAG:
        value = parseFlag(setting.name, options.valueOf(entry.getValue()));
        break;
      case LIST:
        value = options.valuesOf(entry.getValue());
        break;
      default:
        value = options.valueOf(entry.getValue());
      }
      config = config.withValue(setting.path, ConfigValueFactory.fromAnyRef(
          value, "pointzilla --" + setting.name));
    }

    final List<String> manual_points = Lists.newArrayList();
    final List<String> csv_files = Lists.newArrayList();
    for (final String arg : positionals) {
      if (CommandType.isCommand(arg)) {
        config = config.withValue(ROOT + ".command",
            ConfigValueFactory.fromAnyRef(arg, "pointzilla command"));
      } else if (Doubles.tryParse(arg) != null) {
        manual_points.add(arg);
      } else if (GAP_KEYWORD.equalsIgnoreCase(arg)) {
        manual_points.add(GAP_KEYWORD);
      } else if (Files.isRegularFile(Paths.get(arg))) {
        csv_files.add(arg);
      } else {
        config = config.withValue(ROOT + ".time_series",
            ConfigValueFactory.fromAnyRef(arg, "pointzilla identifier"));
      }
    }
    if (!manual_points.isEmpty()) {
      config = config.withValue(ROOT + ".manual_points",
          ConfigValueFactory.fromAnyRef(manual_points, "pointzilla values"));
    }
    if (!csv_files.isEmpty()) {
      // files given with --csv follow the positional ones
      if (config.hasPath(ROOT + ".csv.files")) {
        csv_files.addAll(config.getStringList(ROOT + ".csv.files"));
      }
      config = config.withValue(ROOT + ".csv.files",
          ConfigValueFactory.fromAnyRef(csv_files, "pointzilla files"));
    }
    return config;
  }

  /**
   * Prints the usage and option descriptions.
   * @param out Where to print.
   */
  public void printHelp(final PrintStream out) {
    out.println("Append points to a remote time series.");
    out.println();
    out.println("usage: pointzilla [--option=value] [@optionsFile] [command] "
        + "[identifierOrUniqueId] [value] [csvFile] ...");
    out.println();
    try {
      parser.printHelpOn(out);
    } catch (IOException e) {
      throw new AssertionError("PrintStream never throws");
    }
    out.println();
    out.println("Use the @optionsFile syntax to read more arguments from a file.");
    out.println("  Each line in the file is treated as a command line argument.");
    out.println("  Blank lines and leading/trailing whitespace are ignored.");
    out.println("  Comment lines begin with a # or // marker.");
  }

  /** Raises our loggers to DEBUG when --verbose was given. */
  public void honorVerboseFlag() {
    if (!isVerbose()) {
      return;
    }
    // SLF4J has no API to change levels so go through logback.
    ((Logger) LoggerFactory.getLogger("net.pointzilla")).setLevel(Level.DEBUG);
  }

  /**
   * Replaces each {@code @path} argument with the non-blank, non-comment
   * lines of that file. Lines are trimmed and comments start with {@code #}
   * or {@code //}. Files are not expanded recursively.
   * @param args The raw arguments.
   * @return The expanded arguments.
   * @throws ConfigurationException if a file is missing or unreadable.
   */
  static List<String> expandArgumentFiles(final List<String> args) {
    final List<String> expanded = Lists.newArrayList();
    for (final String arg : args) {
      if (!arg.startsWith("@")) {
        expanded.add(arg);
        continue;
      }
      final Path path = Paths.get(arg.substring(1));
      if (!Files.exists(path)) {
        throw new ConfigurationException("Options file '" + path
            + "' does not exist.");
      }
      final List<String> lines;
      try {
        lines = Files.readAllLines(path, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new ConfigurationException("Unable to read options file '"
            + path + "': " + e.getMessage(), e);
      }
      for (final String line : lines) {
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")
            || trimmed.startsWith("//")) {
          continue;
        }
        expanded.add(trimmed);
      }
    }
    return expanded;
  }

  /** Negative numbers are values, not options. */
  static boolean isOption(final String arg) {
    return arg.length() > 1 && arg.startsWith("-")
        && Doubles.tryParse(arg) == null;
  }

  private static boolean parseFlag(final String name, final String value) {
    if (value == null || value.trim().isEmpty()) {
      return true;
    }
    if (value.trim().equalsIgnoreCase("true")) {
      return true;
    }
    if (value.trim().equalsIgnoreCase("false")) {
      return false;
    }
    throw new ConfigurationException("--" + name + " must be true or false: "
        + value);
  }
}
