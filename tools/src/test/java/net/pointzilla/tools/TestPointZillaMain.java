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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;

import com.stumbleupon.async.Deferred;
import com.typesafe.config.Config;

import net.pointzilla.data.Point;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.storage.AppendStatus;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.storage.TimeSeriesStoreFactory;

public class TestPointZillaMain {
  private static final String TARGET = "Stage.Working@Loc1";

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private TimeSeriesStoreFactory factory;
  private TimeSeriesStore store;
  private ByteArrayOutputStream output;
  private PointZillaMain main;

  @Before
  public void before() throws Exception {
    factory = mock(TimeSeriesStoreFactory.class);
    store = mock(TimeSeriesStore.class);
    when(factory.connect(new ServerConnection("example.com", null, null)))
      .thenReturn(store);
    when(factory.shutdown()).thenReturn(Deferred.fromResult(null));
    when(store.shutdown()).thenReturn(Deferred.fromResult(null));
    when(store.resolveSeriesIdentifier(TARGET))
      .thenReturn(Deferred.fromResult("abc123"));

    output = new ByteArrayOutputStream();
    main = new PointZillaMain(new PrintStream(output, true, "UTF-8")) {
      @Override
      protected TimeSeriesStoreFactory storeFactory(final Config config) {
        return factory;
      }
    };
  }

  @Test
  public void help() throws Exception {
    assertEquals(PointZillaMain.EXIT_OK, main.execute(new String[] { "--help" }));
    assertTrue(output().contains("usage: pointzilla"));
    verifyNoInteractions(factory);
  }

  @Test
  public void unknownOption() throws Exception {
    assertEquals(PointZillaMain.EXIT_USAGE,
        main.execute(new String[] { "--bogus=1" }));
    assertTrue(output().contains("pointzilla --help"));
  }

  @Test
  public void missingServer() throws Exception {
    assertEquals(PointZillaMain.EXIT_USAGE,
        main.execute(new String[] { TARGET, "1" }));
    verifyNoInteractions(factory);
  }

  @SuppressWarnings("unchecked")
  @Test
  public void appendManualPoints() throws Exception {
    when(store.appendPoints(eq("abc123"), anyList(), any()))
      .thenReturn(Deferred.fromResult("42"));
    when(store.getAppendStatus("42"))
      .thenReturn(Deferred.fromResult(AppendStatus.completed(3)));

    assertEquals(PointZillaMain.EXIT_OK, main.execute(new String[] {
        "--server=example.com", "append", TARGET, "1", "gap", "-2.5",
        "--start-time=2024-01-01T00:00:00Z", "--poll-interval=1ms" }));

    final ArgumentCaptor<List<Point>> points = ArgumentCaptor.forClass(List.class);
    verify(store).appendPoints(eq("abc123"), points.capture(), eq(null));
    assertEquals(3, points.getValue().size());
    assertTrue(points.getValue().get(1).isGap());
    assertEquals(-2.5, points.getValue().get(2).value(), 0.0001);
    verify(store).getAppendStatus("42");
    verify(store, times(1)).shutdown();
    verify(factory, times(1)).shutdown();
  }

  @Test
  public void argumentFile() throws Exception {
    final File file = folder.newFile("args.txt");
    Files.write(file.toPath(), ("# run settings\n--server=example.com\n"
        + "--wait=false\n" + TARGET + "\n5\n").getBytes(StandardCharsets.UTF_8));
    when(store.appendPoints(eq("abc123"), anyList(), any()))
      .thenReturn(Deferred.fromResult("42"));

    assertEquals(PointZillaMain.EXIT_OK,
        main.execute(new String[] { "@" + file.getPath() }));
    verify(store, never()).getAppendStatus(anyString());
  }

  @Test
  public void saveCsvOnly() throws Exception {
    final File out = new File(folder.getRoot(), "saved.csv");
    assertEquals(PointZillaMain.EXIT_OK, main.execute(new String[] {
        "--save-csv-path=" + out.getPath(), "1", "2" }));
    assertTrue(out.exists());
    verify(factory, never()).connect(any());
  }

  @Test
  public void appendFails() throws Exception {
    when(store.appendPoints(eq("abc123"), anyList(), any()))
      .thenReturn(Deferred.<String>fromError(
          new RemoteStoreException("Boo!", "POST append", 500)));
    assertEquals(PointZillaMain.EXIT_FAILED, main.execute(new String[] {
        "--server=example.com", TARGET, "1" }));
    verify(factory, times(1)).shutdown();
  }

  @Test
  public void targetNotFound() throws Exception {
    when(store.resolveSeriesIdentifier("Stage.Missing@Loc1"))
      .thenReturn(Deferred.<String>fromError(
          new RemoteStoreException("Not found", "GET resolve", 404)));
    assertEquals(PointZillaMain.EXIT_USAGE, main.execute(new String[] {
        "--server=example.com", "Stage.Missing@Loc1", "1" }));
    verify(store, never()).appendPoints(anyString(), anyList(), any());
  }

  @Test
  public void invalidCsvData() throws Exception {
    final File csv = folder.newFile("bad.csv");
    Files.write(csv.toPath(), "2024-01-01T00:00:00Z,,oops\n"
        .getBytes(StandardCharsets.UTF_8));
    assertEquals(PointZillaMain.EXIT_FAILED, main.execute(new String[] {
        "--server=example.com", "--csv-ignore-invalid-rows=false", TARGET,
        csv.getPath() }));
    verify(store, never()).appendPoints(anyString(), anyList(), any());
  }

  @Test
  public void infiniteManualValue() throws Exception {
    final File out = new File(folder.getRoot(), "out.csv");
    assertEquals(PointZillaMain.EXIT_USAGE, main.execute(new String[] {
        "1", "Infinity", "--start-time=2024-01-01T00:00:00Z",
        "--save-csv-path=" + out.getPath() }));
    assertTrue(output().contains("Infinity"));
    assertFalse(out.exists());
    verifyNoInteractions(factory);
  }

  @Test
  public void unexpectedException() throws Exception {
    when(store.resolveSeriesIdentifier(TARGET))
      .thenThrow(new IllegalArgumentException("Boo!"));
    assertEquals(PointZillaMain.EXIT_FAILED, main.execute(new String[] {
        "--server=example.com", TARGET, "1" }));
    verify(store, never()).appendPoints(anyString(), anyList(), any());
    verify(factory, times(1)).shutdown();
  }

  private String output() {
    return new String(output.toByteArray(), StandardCharsets.UTF_8);
  }
}
