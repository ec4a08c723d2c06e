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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.stumbleupon.async.Deferred;

import net.pointzilla.append.AppendBatchPolicy;
import net.pointzilla.append.AppendBatcher;
import net.pointzilla.append.AppendResult;
import net.pointzilla.csv.CsvFormat;
import net.pointzilla.csv.CsvPointSource;
import net.pointzilla.data.Point;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.sources.WaveformSpec;
import net.pointzilla.storage.AppendStatus;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.storage.TimeSeriesStoreFactory;
import net.pointzilla.transform.GradeMapping;
import net.pointzilla.transform.TransformOptions;

public class TestPointsAppender {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final ServerConnection SERVER =
      new ServerConnection("primary", "admin", "secret");
  private static final String TARGET = "Stage.Working@Loc1";

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private TimeSeriesStoreFactory factory;
  private TimeSeriesStore store;
  private PointsAppender appender;

  @Before
  public void before() throws Exception {
    factory = mock(TimeSeriesStoreFactory.class);
    store = mock(TimeSeriesStore.class);
    when(factory.connect(SERVER)).thenReturn(store);
    when(store.resolveSeriesIdentifier(TARGET))
        .thenReturn(Deferred.fromResult("uid"));
    when(store.appendPoints(anyString(), anyList(), any()))
        .thenReturn(Deferred.fromResult("append1"));
    when(store.getAppendStatus("append1"))
        .thenReturn(Deferred.fromResult(AppendStatus.completed(3)));
    when(store.shutdown()).thenReturn(Deferred.fromResult(null));

    final Ticker ticker = Ticker.systemTicker();
    final AppendBatcher.Sleeper sleeper = new AppendBatcher.Sleeper() {
      @Override
      public void sleep(final Duration duration) { }
    };
    appender = new PointsAppender(factory, ticker, sleeper);
  }

  @Test
  public void sourcesInOrder() throws Exception {
    final AppendContext context = base()
        .setWaveform(WaveformSpec.newBuilder()
            .setStartTime(T0.plusSeconds(3600))
            .setNumberOfPoints(2)
            .build())
        .addManualValue(42)
        .setDefaultGrade(9)
        .build();

    final AppendResult result = appender.run(context);
    assertEquals(AppendResult.Status.COMPLETED, result.status());
    assertEquals(3, result.pointsDelivered());
    assertEquals(3, result.pointsAppended());

    final List<Point> sent = captureSent();
    assertEquals(Point.newBuilder()
        .setTime(T0)
        .setValue(42)
        .setGradeCode(9)
        .build(), sent.get(0));
    assertEquals(T0.plusSeconds(3600), sent.get(1).time());
    assertEquals(9, (int) sent.get(2).gradeCode());
    verify(store).shutdown();
  }

  @Test
  public void csvFilesAfterGeneratedPoints() throws Exception {
    final Path csv = folder.newFile("in.csv").toPath();
    Files.write(csv, "2020-01-01T00:00:00Z,,7\n".getBytes(StandardCharsets.UTF_8));
    final AppendContext context = base()
        .addManualValue(1)
        .addCsvFile(csv)
        .build();
    appender.run(context);
    final List<Point> sent = captureSent();
    assertEquals(2, sent.size());
    assertEquals(7, sent.get(1).value(), 0.0);
  }

  @Test
  public void transformApplied() throws Exception {
    final AppendContext context = base()
        .addManualValue(1)
        .addManualValue(2)
        .setTransform(TransformOptions.newBuilder()
            .setGradeMapping(GradeMapping.newBuilder().addRule(":3").build())
            .setRealignTo(T0.plusSeconds(600))
            .build())
        .build();
    appender.run(context);
    final List<Point> sent = captureSent();
    assertEquals(3, (int) sent.get(0).gradeCode());
    assertEquals(T0.plusSeconds(600), sent.get(0).time());
    assertEquals(T0.plusSeconds(660), sent.get(1).time());
  }

  @Test
  public void stopAfterSavingCsv() throws Exception {
    final AppendContext context = AppendContext.newBuilder()
        .setStartTime(T0)
        .setSaveCsvPath(folder.getRoot().toPath())
        .addManualValue(1)
        .addManualGap()
        .addManualValue(3)
        .build();
    final AppendResult result = appender.run(context);
    assertEquals(AppendResult.Status.NOT_SENT, result.status());
    verifyNoInteractions(factory);

    final Path saved = folder.getRoot().toPath()
        .resolve("PointZilla.20240101T000000Z.csv");
    final List<Point> read = new CsvPointSource(saved,
        CsvFormat.newBuilder(CsvFormat.Preset.POINTZILLA).build()).load();
    assertEquals(3, read.size());
    assertTrue(read.get(1).isGap());
  }

  @Test
  public void saveAndAppend() throws Exception {
    final Path target = folder.getRoot().toPath().resolve("copy.csv");
    final AppendContext context = base()
        .addManualValue(1)
        .setSaveCsvPath(target)
        .build();
    assertEquals(1, appender.run(context).pointsDelivered());
    assertTrue(Files.exists(target));
  }

  @Test
  public void noPoints() throws Exception {
    final AppendResult result = appender.run(base().build());
    assertEquals(AppendResult.Status.NOT_SENT, result.status());
    assertEquals(0, result.pointsDelivered());
    verify(store, never()).appendPoints(anyString(), anyList(), any());
    verify(store).shutdown();
  }

  @Test
  public void unknownTarget() throws Exception {
    when(store.resolveSeriesIdentifier(TARGET))
        .thenReturn(Deferred.<String>fromError(
            new RemoteStoreException("Not found", "resolve", 404)));
    try {
      appender.run(base().addManualValue(1).build());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    verify(store, never()).appendPoints(anyString(), anyList(), any());
    verify(store).shutdown();
  }

  @Test
  public void remoteFailurePropagates() throws Exception {
    when(store.resolveSeriesIdentifier(TARGET))
        .thenReturn(Deferred.<String>fromError(
            new RemoteStoreException("Unavailable", "resolve", 503)));
    try {
      appender.run(base().addManualValue(1).build());
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals(503, e.statusCode());
    }
  }

  @Test
  public void unreachableServer() throws Exception {
    when(factory.connect(SERVER)).thenThrow(new IllegalStateException("Boom"));
    try {
      appender.run(base().addManualValue(1).build());
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  private AppendContext.Builder base() {
    return AppendContext.newBuilder()
        .setServer(SERVER)
        .setTargetSeries(TARGET)
        .setStartTime(T0)
        .setBatchPolicy(AppendBatchPolicy.newBuilder()
            .setBatchSize(1000)
            .setWait(true)
            .build());
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private List<Point> captureSent() {
    final ArgumentCaptor<List> captor = ArgumentCaptor.forClass(List.class);
    verify(store).appendPoints(eq("uid"), captor.capture(), any());
    return ImmutableList.copyOf((List<Point>) captor.getValue());
  }
}
