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

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import net.pointzilla.append.AppendBatchPolicy;
import net.pointzilla.append.CommandType;
import net.pointzilla.core.AppendContext;
import net.pointzilla.csv.CsvFormat;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.data.TimeRange;
import net.pointzilla.data.TimeSeriesIdentifier;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.sources.SourceCopySpec;
import net.pointzilla.sources.WaveformSpec;
import net.pointzilla.sources.WaveformType;
import net.pointzilla.storage.http.HttpTimeSeriesStoreFactory;
import net.pointzilla.transform.GradeMapping;
import net.pointzilla.transform.QualifierMapping;
import net.pointzilla.transform.TransformOptions;
import net.pointzilla.utils.DateTime;

/**
 * Turns a resolved configuration into the immutable {@link AppendContext} of
 * a run. Keys live under {@code pointzilla.}, see {@code reference.conf} for
 * the full list and defaults. Malformed values of any kind surface as a
 * {@link ConfigurationException}.
 */
public class ContextLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ContextLoader.class);

  private static final Splitter LIST = Splitter.on(',')
      .trimResults()
      .omitEmptyStrings();

  private final Config config;

  /**
   * Default ctor.
   * @param config The non-null resolved configuration.
   */
  public ContextLoader(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.config = config;
  }

  /**
   * @return The validated run context.
   * @throws ConfigurationException if a value is missing or malformed.
   */
  public AppendContext load() {
    try {
      final AppendContext context = build();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Loaded " + context);
      }
      return context;
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid configuration: "
          + e.getMessage(), e);
    } catch (IllegalArgumentException | DateTimeParseException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  /**
   * @return A factory for the HTTP store client configured under
   * {@code pointzilla.http}.
   * @throws ConfigurationException if a value is malformed.
   */
  public HttpTimeSeriesStoreFactory storeFactory() {
    try {
      return new HttpTimeSeriesStoreFactory(
          config.getString(key("http.scheme")),
          config.getString(key("http.base_path")),
          config.getInt(key("http.io_threads")),
          millis("http.connect_timeout"),
          millis("http.socket_timeout"));
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid configuration: "
          + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  private AppendContext build() {
    final AppendContext.Builder builder = AppendContext.newBuilder()
        .setTargetSeries(string("time_series"))
        .setCommand(CommandType.fromName(config.getString(key("command"))))
        .setBatchPolicy(batchPolicy())
        .setPointInterval(duration("generator.point_interval"))
        .setCsvFormat(csvFormat())
        .setStopAfterSavingCsv(config.getBoolean(key("stop_after_saving_csv")));

    final String server = string("server");
    if (server != null) {
      builder.setServer(new ServerConnection(server, string("username"),
          string("password")));
    }

    final String time_range = string("time_range");
    if (time_range != null) {
      builder.setTimeRange(TimeRange.parse(time_range));
    }

    final String start = string("generator.start_time");
    final Instant start_time = start != null ? DateTime.parseInstant(start, null)
        : Instant.ofEpochMilli(DateTime.currentTimeMillis())
            .truncatedTo(ChronoUnit.SECONDS);
    builder.setStartTime(start_time);

    if (string("grade_code") != null) {
      builder.setDefaultGrade(config.getInt(key("grade_code")));
    }
    final String qualifiers = string("qualifiers");
    if (qualifiers != null) {
      builder.setDefaultQualifiers(LIST.splitToList(qualifiers));
    }

    boolean has_sources = false;
    for (final String value : config.getStringList(key("manual_points"))) {
      if (CliOptions.GAP_KEYWORD.equalsIgnoreCase(value.trim())) {
        builder.addManualGap();
      } else {
        final double parsed;
        try {
          parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
          throw new ConfigurationException("Manual point '" + value
              + "' is neither a number nor '" + CliOptions.GAP_KEYWORD + "'", e);
        }
        if (Double.isNaN(parsed)) {
          builder.addManualGap();
        } else if (Double.isInfinite(parsed)) {
          throw new ConfigurationException("Manual point '" + value
              + "' must be a finite number");
        } else {
          builder.addManualValue(parsed);
        }
      }
      has_sources = true;
    }

    for (final String file : config.getStringList(key("csv.files"))) {
      builder.addCsvFile(Paths.get(file));
      has_sources = true;
    }

    final String source = string("source.time_series");
    if (source != null) {
      builder.setSourceCopy(new SourceCopySpec(
          TimeSeriesIdentifier.parse(source),
          instant("source.query_from"),
          instant("source.query_to")));
      has_sources = true;
    }

    // a waveform only when nothing else provides points
    if (!has_sources) {
      builder.setWaveform(waveform(start_time));
    }

    builder.setTransform(transform(start_time));

    final String save_path = string("save_csv_path");
    if (save_path != null) {
      builder.setSaveCsvPath(Paths.get(save_path));
    }
    final String version = ContextLoader.class.getPackage()
        .getImplementationVersion();
    builder.setGenerator(version == null ? "PointZilla" : "PointZilla " + version);
    return builder.build();
  }

  private AppendBatchPolicy batchPolicy() {
    return AppendBatchPolicy.newBuilder()
        .setBatchSize(config.getInt(key("batch_size")))
        .setWait(config.getBoolean(key("wait")))
        .setWaitTimeout(duration("append_timeout"))
        .setPollInterval(duration("poll_interval"))
        .setRequestTimeout(duration("request_timeout"))
        .build();
  }

  private WaveformSpec waveform(final Instant start_time) {
    final WaveformSpec.Builder builder = WaveformSpec.newBuilder()
        .setType(WaveformType.fromName(
            config.getString(key("generator.waveform_type"))))
        .setStartTime(start_time)
        .setInterval(duration("generator.point_interval"))
        .setNumberOfPoints(config.getInt(key("generator.number_of_points")))
        .setNumberOfPeriods(config.getDouble(key("generator.number_of_periods")))
        .setSamplesPerPeriod(config.getDouble(key("generator.period")))
        .setScalar(config.getDouble(key("generator.scalar")))
        .setOffset(config.getDouble(key("generator.offset")))
        .setPhase(config.getDouble(key("generator.phase")));
    final String text_x = string("generator.text_x");
    final String text_y = string("generator.text_y");
    if (text_x != null && text_y != null) {
      throw new ConfigurationException("Only one of the X or Y text of a "
          + "waveform can be set.");
    }
    if (text_x != null) {
      builder.setText(text_x, WaveformSpec.TextChannel.X);
    } else if (text_y != null) {
      builder.setText(text_y, WaveformSpec.TextChannel.Y);
    }
    return builder.build();
  }

  private TransformOptions transform(final Instant start_time) {
    final GradeMapping.Builder grades = GradeMapping.newBuilder();
    for (final String rule : config.getStringList(key("mapped_grades"))) {
      grades.addRule(rule);
    }
    final QualifierMapping.Builder qualifiers = QualifierMapping.newBuilder();
    for (final String rule : config.getStringList(key("mapped_qualifiers"))) {
      qualifiers.addRule(rule);
    }
    return TransformOptions.newBuilder()
        .setIgnoreGrades(config.getBoolean(key("ignore_grades")))
        .setIgnoreQualifiers(config.getBoolean(key("ignore_qualifiers")))
        .setGradeMapping(grades.build())
        .setQualifierMapping(qualifiers.build())
        .setRealignTo(config.getBoolean(key("csv.realign")) ? start_time : null)
        .setRemoveDuplicates(
            config.getBoolean(key("csv.remove_duplicate_points")))
        .build();
  }

  private CsvFormat csvFormat() {
    final CsvFormat.Builder builder = CsvFormat.newBuilder(
        CsvFormat.Preset.fromName(config.getString(key("csv.format"))));
    if (config.hasPath(key("csv.date_time_field"))) {
      builder.setDateTimeField(config.getInt(key("csv.date_time_field")));
    }
    if (config.hasPath(key("csv.date_time_format"))) {
      builder.setDateTimeFormat(config.getString(key("csv.date_time_format")));
    }
    if (config.hasPath(key("csv.date_only_field"))) {
      // a date column replaces the combined one unless both were given
      builder.setDateOnlyField(config.getInt(key("csv.date_only_field")));
      if (!config.hasPath(key("csv.date_time_field"))) {
        builder.setDateTimeField(0);
      }
    }
    if (config.hasPath(key("csv.date_only_format"))) {
      builder.setDateOnlyFormat(config.getString(key("csv.date_only_format")));
    }
    if (config.hasPath(key("csv.time_only_field"))) {
      builder.setTimeOnlyField(config.getInt(key("csv.time_only_field")));
    }
    if (config.hasPath(key("csv.time_only_format"))) {
      builder.setTimeOnlyFormat(config.getString(key("csv.time_only_format")));
    }
    final String time_of_day = string("csv.default_time_of_day");
    if (time_of_day != null) {
      builder.setDefaultTimeOfDay(LocalTime.parse(time_of_day));
    }
    if (config.hasPath(key("csv.value_field"))) {
      builder.setValueField(config.getInt(key("csv.value_field")));
    }
    if (config.hasPath(key("csv.grade_field"))) {
      builder.setGradeField(config.getInt(key("csv.grade_field")));
    }
    if (config.hasPath(key("csv.qualifiers_field"))) {
      builder.setQualifiersField(config.getInt(key("csv.qualifiers_field")));
    }
    if (config.hasPath(key("csv.comment"))) {
      builder.setComment(config.getString(key("csv.comment")));
    }
    if (config.hasPath(key("csv.skip_rows"))) {
      builder.setSkipRows(config.getInt(key("csv.skip_rows")));
    }
    if (config.hasPath(key("csv.ignore_invalid_rows"))) {
      builder.setIgnoreInvalidRows(
          config.getBoolean(key("csv.ignore_invalid_rows")));
    }
    if (config.hasPath(key("csv.delimiter"))) {
      builder.setDelimiter(config.getString(key("csv.delimiter")));
    }
    if (config.hasPath(key("csv.qualifier_delimiter"))) {
      builder.setQualifierDelimiter(
          config.getString(key("csv.qualifier_delimiter")));
    }
    if (config.hasPath(key("csv.nan_value"))) {
      builder.setNanValue(config.getString(key("csv.nan_value")));
    }
    final String zone = string("csv.timezone");
    if (zone != null) {
      builder.setZone(DateTime.parseZone(zone));
    }
    return builder.build();
  }

  private static String key(final String path) {
    return CliOptions.ROOT + "." + path;
  }

  /** @return The trimmed value or null when missing or empty. */
  private String string(final String path) {
    if (!config.hasPath(key(path))) {
      return null;
    }
    return Strings.emptyToNull(config.getString(key(path)).trim());
  }

  private Instant instant(final String path) {
    final String value = string(path);
    return value == null ? null : DateTime.parseInstant(value, null);
  }

  /** Accepts {@code 5m}, {@code 00:05:00} or {@code PT5M}. */
  private Duration duration(final String path) {
    return DateTime.parseDuration(config.getString(key(path)));
  }

  private int millis(final String path) {
    final long ms = duration(path).toMillis();
    if (ms > Integer.MAX_VALUE) {
      throw new ConfigurationException(key(path) + " is too long: "
          + config.getString(key(path)));
    }
    return (int) ms;
  }
}
