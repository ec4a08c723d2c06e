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
package net.pointzilla.core;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalDouble;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.pointzilla.append.AppendBatchPolicy;
import net.pointzilla.append.CommandType;
import net.pointzilla.csv.CsvFormat;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.data.TimeRange;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.sources.SourceCopySpec;
import net.pointzilla.sources.WaveformSpec;
import net.pointzilla.transform.TransformOptions;
import net.pointzilla.utils.DateTime;

/**
 * Everything one run of {@link PointsAppender} needs. Built once, validated
 * on {@link Builder#build()} and never modified afterwards.
 * <p>
 * Sources are optional and combined in the order manual, waveform, CSV files
 * and source copy.
 *
 * @since 1.0
 */
public final class AppendContext {
  public static final Duration DEFAULT_POINT_INTERVAL = Duration.ofMinutes(1);

  private final String target_series;
  private final ServerConnection server;
  private final CommandType command;
  private final AppendBatchPolicy batch_policy;
  private final TimeRange time_range;
  private final Instant start_time;
  private final Duration point_interval;
  private final ImmutableList<OptionalDouble> manual_points;
  private final WaveformSpec waveform;
  private final ImmutableList<Path> csv_files;
  private final CsvFormat csv_format;
  private final SourceCopySpec source_copy;
  private final TransformOptions transform;
  private final Integer default_grade;
  private final ImmutableList<String> default_qualifiers;
  private final Path save_csv_path;
  private final boolean stop_after_saving_csv;
  private final String generator;

  private AppendContext(final Builder builder) {
    target_series = Strings.emptyToNull(builder.target_series);
    server = builder.server;
    command = builder.command == null ? CommandType.OVERWRITE : builder.command;
    batch_policy = builder.batch_policy == null ?
        AppendBatchPolicy.newBuilder().build() : builder.batch_policy;
    time_range = builder.time_range;
    start_time = builder.start_time == null ?
        Instant.ofEpochMilli(DateTime.currentTimeMillis())
          .truncatedTo(ChronoUnit.SECONDS)
        : builder.start_time;
    point_interval = builder.point_interval == null ?
        DEFAULT_POINT_INTERVAL : builder.point_interval;
    manual_points = ImmutableList.copyOf(builder.manual_points);
    waveform = builder.waveform;
    csv_files = ImmutableList.copyOf(builder.csv_files);
    csv_format = builder.csv_format == null ?
        CsvFormat.newBuilder().build() : builder.csv_format;
    source_copy = builder.source_copy;
    transform = builder.transform == null ?
        TransformOptions.none() : builder.transform;
    default_grade = builder.default_grade;
    default_qualifiers = builder.default_qualifiers == null ?
        ImmutableList.of() : ImmutableList.copyOf(builder.default_qualifiers);
    save_csv_path = builder.save_csv_path;
    stop_after_saving_csv = builder.stop_after_saving_csv
        || (server == null && target_series == null && save_csv_path != null);
    generator = Strings.isNullOrEmpty(builder.generator) ?
        "PointZilla" : builder.generator;
    validate();
  }

  private void validate() {
    if (stop_after_saving_csv && save_csv_path == null) {
      throw new ConfigurationException("Stopping after saving a CSV requires "
          + "a CSV save path.");
    }
    if (!stop_after_saving_csv) {
      if (server == null) {
        throw new ConfigurationException("A server is required.");
      }
      if (target_series == null) {
        throw new ConfigurationException("A target time series is required.");
      }
    }
    if (source_copy != null && source_copy.source().server() == null
        && server == null) {
      throw new ConfigurationException("A server is required to copy "
          + source_copy.source());
    }
    if (point_interval.isNegative()) {
      throw new ConfigurationException("Point interval cannot be negative: "
          + point_interval);
    }
  }

  /** @return The target series name or unique ID, null when only saving. */
  public String targetSeries() {
    return target_series;
  }

  /** @return The primary server, null when only saving. */
  public ServerConnection server() {
    return server;
  }

  public CommandType command() {
    return command;
  }

  public AppendBatchPolicy batchPolicy() {
    return batch_policy;
  }

  /** @return An explicit overall overwrite range or null. */
  public TimeRange timeRange() {
    return time_range;
  }

  /** @return The time of the first manual point and waveform sample. */
  public Instant startTime() {
    return start_time;
  }

  /** @return The clock advance between manual points. */
  public Duration pointInterval() {
    return point_interval;
  }

  /** @return Manual literals, an empty optional for each gap. */
  public ImmutableList<OptionalDouble> manualPoints() {
    return manual_points;
  }

  /** @return The waveform to generate or null. */
  public WaveformSpec waveform() {
    return waveform;
  }

  public ImmutableList<Path> csvFiles() {
    return csv_files;
  }

  public CsvFormat csvFormat() {
    return csv_format;
  }

  /** @return The series to copy or null. */
  public SourceCopySpec sourceCopy() {
    return source_copy;
  }

  public TransformOptions transform() {
    return transform;
  }

  /** @return The grade of manual and generated points or null. */
  public Integer defaultGrade() {
    return default_grade;
  }

  /** @return The qualifiers of manual and generated points. */
  public ImmutableList<String> defaultQualifiers() {
    return default_qualifiers;
  }

  /** @return Where to save the final points or null. */
  public Path saveCsvPath() {
    return save_csv_path;
  }

  /** @return Whether the run ends once the CSV is written. */
  public boolean stopAfterSavingCsv() {
    return stop_after_saving_csv;
  }

  /** @return The program description written into saved CSVs. */
  public String generator() {
    return generator;
  }

  /** @return True if the run needs the primary store. */
  public boolean needsPrimaryStore() {
    if (!stop_after_saving_csv) {
      return true;
    }
    return source_copy != null && (source_copy.source().server() == null
        || source_copy.source().server().sameServer(server));
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("target=").append(target_series)
        .append(", server=").append(server)
        .append(", command=").append(command)
        .append(", policy={").append(batch_policy).append("}")
        .append(", timeRange=").append(time_range)
        .append(", manualPoints=").append(manual_points.size())
        .append(", waveform=").append(waveform)
        .append(", csvFiles=").append(csv_files)
        .append(", sourceCopy=").append(source_copy)
        .append(", transform={").append(transform).append("}")
        .append(", saveCsvPath=").append(save_csv_path)
        .append(", stopAfterSavingCsv=").append(stop_after_saving_csv)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private String target_series;
    private ServerConnection server;
    private CommandType command;
    private AppendBatchPolicy batch_policy;
    private TimeRange time_range;
    private Instant start_time;
    private Duration point_interval;
    private final List<OptionalDouble> manual_points = Lists.newArrayList();
    private WaveformSpec waveform;
    private final List<Path> csv_files = Lists.newArrayList();
    private CsvFormat csv_format;
    private SourceCopySpec source_copy;
    private TransformOptions transform;
    private Integer default_grade;
    private List<String> default_qualifiers;
    private Path save_csv_path;
    private boolean stop_after_saving_csv;
    private String generator;

    private Builder() { }

    public Builder setTargetSeries(final String target_series) {
      this.target_series = target_series;
      return this;
    }

    public Builder setServer(final ServerConnection server) {
      this.server = server;
      return this;
    }

    public Builder setCommand(final CommandType command) {
      this.command = command;
      return this;
    }

    public Builder setBatchPolicy(final AppendBatchPolicy batch_policy) {
      this.batch_policy = batch_policy;
      return this;
    }

    public Builder setTimeRange(final TimeRange time_range) {
      this.time_range = time_range;
      return this;
    }

    public Builder setStartTime(final Instant start_time) {
      this.start_time = start_time;
      return this;
    }

    public Builder setPointInterval(final Duration point_interval) {
      this.point_interval = point_interval;
      return this;
    }

    public Builder addManualValue(final double value) {
      manual_points.add(OptionalDouble.of(value));
      return this;
    }

    public Builder addManualGap() {
      manual_points.add(OptionalDouble.empty());
      return this;
    }

    public Builder setWaveform(final WaveformSpec waveform) {
      this.waveform = waveform;
      return this;
    }

    public Builder addCsvFile(final Path csv_file) {
      csv_files.add(csv_file);
      return this;
    }

    public Builder setCsvFormat(final CsvFormat csv_format) {
      this.csv_format = csv_format;
      return this;
    }

    public Builder setSourceCopy(final SourceCopySpec source_copy) {
      this.source_copy = source_copy;
      return this;
    }

    public Builder setTransform(final TransformOptions transform) {
      this.transform = transform;
      return this;
    }

    public Builder setDefaultGrade(final Integer default_grade) {
      this.default_grade = default_grade;
      return this;
    }

    public Builder setDefaultQualifiers(final List<String> default_qualifiers) {
      this.default_qualifiers = default_qualifiers;
      return this;
    }

    public Builder setSaveCsvPath(final Path save_csv_path) {
      this.save_csv_path = save_csv_path;
      return this;
    }

    public Builder setStopAfterSavingCsv(final boolean stop_after_saving_csv) {
      this.stop_after_saving_csv = stop_after_saving_csv;
      return this;
    }

    public Builder setGenerator(final String generator) {
      this.generator = generator;
      return this;
    }

    /**
     * @return The validated context.
     * @throws ConfigurationException if required settings are missing.
     */
    public AppendContext build() {
      return new AppendContext(this);
    }
  }
}
