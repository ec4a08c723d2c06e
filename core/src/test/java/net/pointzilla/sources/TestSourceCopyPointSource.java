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
package net.pointzilla.sources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.stumbleupon.async.Deferred;

import net.pointzilla.data.Point;
import net.pointzilla.data.ServerConnection;
import net.pointzilla.data.TimeSeriesIdentifier;
import net.pointzilla.exceptions.ConfigurationException;
import net.pointzilla.exceptions.RemoteStoreException;
import net.pointzilla.storage.TimeSeriesStore;
import net.pointzilla.storage.TimeSeriesStoreFactory;

public class TestSourceCopyPointSource {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final Duration TIMEOUT = Duration.ofSeconds(5);
  private static final ServerConnection PRIMARY =
      new ServerConnection("primary", "admin", "secret");
  private static final List<Point> POINTS = ImmutableList.of(
      Point.value(T0, 1), Point.value(T0.plusSeconds(60), 2));

  private TimeSeriesStore primary_store;
  private TimeSeriesStore other_store;
  private TimeSeriesStoreFactory factory;

  @Before
  public void before() throws Exception {
    primary_store = mock(TimeSeriesStore.class);
    other_store = mock(TimeSeriesStore.class);
    factory = mock(TimeSeriesStoreFactory.class);
    when(factory.connect(any(ServerConnection.class))).thenReturn(other_store);
    when(other_store.shutdown()).thenReturn(Deferred.fromResult(null));
  }

  @Test
  public void copyFromPrimary() throws Exception {
    when(primary_store.resolveSeriesIdentifier("Stage.Working@Loc1"))
        .thenReturn(Deferred.fromResult("abc"));
    when(primary_store.getSeriesPoints("abc", T0, null))
        .thenReturn(Deferred.fromResult(POINTS));

    final SourceCopyPointSource source = new SourceCopyPointSource(
        new SourceCopySpec(TimeSeriesIdentifier.parse("Stage.Working@Loc1"),
            T0, null),
        primary_store, PRIMARY, factory, TIMEOUT);
    assertSame(POINTS, source.load());
    verify(factory, never()).connect(any(ServerConnection.class));
    verify(primary_store, never()).shutdown();
  }

  @Test
  public void sameServerUsesPrimary() throws Exception {
    when(primary_store.resolveSeriesIdentifier("ts"))
        .thenReturn(Deferred.fromResult("abc"));
    when(primary_store.getSeriesPoints("abc", null, null))
        .thenReturn(Deferred.fromResult(POINTS));

    final SourceCopyPointSource source = new SourceCopyPointSource(
        new SourceCopySpec(TimeSeriesIdentifier.parse("[PRIMARY]ts"), null, null),
        primary_store, PRIMARY, factory, TIMEOUT);
    assertEquals(2, source.load().size());
    verify(factory, never()).connect(any(ServerConnection.class));
  }

  @Test
  public void otherServerInheritsCredentialsAndShutsDown() throws Exception {
    when(other_store.resolveSeriesIdentifier("ts"))
        .thenReturn(Deferred.fromResult("xyz"));
    when(other_store.getSeriesPoints("xyz", null, null))
        .thenReturn(Deferred.fromResult(POINTS));

    final SourceCopyPointSource source = new SourceCopyPointSource(
        new SourceCopySpec(TimeSeriesIdentifier.parse("[other]ts"), null, null),
        primary_store, PRIMARY, factory, TIMEOUT);
    assertEquals(POINTS, source.load());
    verify(factory).connect(new ServerConnection("other", "admin", "secret"));
    verify(other_store).shutdown();
  }

  @Test
  public void unresolvedIsConfigurationError() throws Exception {
    when(other_store.resolveSeriesIdentifier(anyString()))
        .thenReturn(Deferred.<String>fromError(
            new RemoteStoreException("Not found", "resolve", 404)));

    final SourceCopyPointSource source = new SourceCopyPointSource(
        new SourceCopySpec(TimeSeriesIdentifier.parse("[other:u:p]ts"), null, null),
        primary_store, PRIMARY, factory, TIMEOUT);
    try {
      source.load();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) {
      assertTrue(e.getMessage().contains("ts"));
    }
    verify(factory).connect(new ServerConnection("other", "u", "p"));
    verify(other_store).shutdown();
  }

  @Test
  public void unreachableIsConfigurationError() throws Exception {
    when(factory.connect(any(ServerConnection.class)))
        .thenThrow(new IllegalStateException("Boom"));
    final SourceCopyPointSource source = new SourceCopyPointSource(
        new SourceCopySpec(TimeSeriesIdentifier.parse("[other]ts"), null, null),
        primary_store, PRIMARY, factory, TIMEOUT);
    try {
      source.load();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void noPrimaryStore() throws Exception {
    final SourceCopyPointSource source = new SourceCopyPointSource(
        new SourceCopySpec(TimeSeriesIdentifier.parse("ts"), null, null),
        null, null, factory, TIMEOUT);
    try {
      source.load();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void reversedQueryBounds() throws Exception {
    try {
      new SourceCopySpec(TimeSeriesIdentifier.parse("ts"), T0, T0.minusSeconds(1));
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
}
