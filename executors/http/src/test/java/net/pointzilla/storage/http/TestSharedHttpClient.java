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
package net.pointzilla.storage.http;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import org.apache.http.HttpResponse;
import org.apache.http.StatusLine;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.junit.Before;
import org.junit.Test;

import net.pointzilla.exceptions.RemoteStoreException;

public class TestSharedHttpClient {

  private HttpResponse response;
  private StatusLine status;

  @Before
  public void before() throws Exception {
    response = mock(HttpResponse.class);
    status = mock(StatusLine.class);
    when(response.getStatusLine()).thenReturn(status);
  }

  @Test
  public void shutdownClosesClient() throws Exception {
    final CloseableHttpAsyncClient client = mock(CloseableHttpAsyncClient.class);
    final SharedHttpClient shared = new SharedHttpClient(client);
    assertNull(shared.shutdown().join(250));
    verify(client, times(1)).close();
  }

  @Test
  public void shutdownCloseFailureIsLogged() throws Exception {
    final CloseableHttpAsyncClient client = mock(CloseableHttpAsyncClient.class);
    doThrow(new IOException("Boo!")).when(client).close();
    assertNull(new SharedHttpClient(client).shutdown().join(250));
  }

  @Test(expected = IllegalArgumentException.class)
  public void ctorNullClient() throws Exception {
    new SharedHttpClient((CloseableHttpAsyncClient) null);
  }

  @Test
  public void parseResponse() throws Exception {
    when(response.getEntity()).thenReturn(new StringEntity("Hello!"));

    when(status.getStatusCode()).thenReturn(200);
    assertEquals("Hello!", SharedHttpClient.parseResponse(response, "unknown"));

    when(status.getStatusCode()).thenReturn(202);
    assertEquals("Hello!", SharedHttpClient.parseResponse(response, "unknown"));

    // non-2xx non-json
    when(status.getStatusCode()).thenReturn(400);
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals("Hello!", e.getMessage());
      assertEquals(400, e.statusCode());
      assertEquals("unknown", e.remoteEndpoint());
    }

    // non-2xx JSON
    when(response.getEntity()).thenReturn(
        new StringEntity("{\"error\":{\"message\":\"Boo!\"}}"));
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals("Boo!", e.getMessage());
    }

    // JSON without the error object
    when(status.getStatusCode()).thenReturn(500);
    when(response.getEntity()).thenReturn(new StringEntity("{\"nope\":1}"));
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals("{\"nope\":1}", e.getMessage());
      assertEquals(500, e.statusCode());
    }

    // empty body
    when(status.getStatusCode()).thenReturn(503);
    when(response.getEntity()).thenReturn(new StringEntity(""));
    try {
      SharedHttpClient.parseResponse(response, "GET http://localhost");
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals("Status 503 from GET http://localhost", e.getMessage());
    }
  }

  @Test
  public void parseResponseNullEntity() throws Exception {
    when(response.getEntity()).thenReturn(null);
    when(status.getStatusCode()).thenReturn(204);
    assertEquals("", SharedHttpClient.parseResponse(response, "unknown"));

    when(status.getStatusCode()).thenReturn(500);
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals(500, e.statusCode());
    }
  }

  @Test
  public void parseResponseGzip() throws Exception {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (final GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
      gzip.write("{\"UniqueId\":\"abc\"}".getBytes(StandardCharsets.UTF_8));
    }
    final ByteArrayEntity entity = new ByteArrayEntity(bytes.toByteArray());
    entity.setContentEncoding("gzip");
    when(response.getEntity()).thenReturn(entity);
    when(status.getStatusCode()).thenReturn(200);
    assertEquals("{\"UniqueId\":\"abc\"}",
        SharedHttpClient.parseResponse(response, "unknown"));
  }

  @Test
  public void parseResponseUnknownEncoding() throws Exception {
    final StringEntity entity = new StringEntity("Hello!");
    entity.setContentEncoding("br");
    when(response.getEntity()).thenReturn(entity);
    when(status.getStatusCode()).thenReturn(200);
    try {
      SharedHttpClient.parseResponse(response, "unknown");
      fail("Expected RemoteStoreException");
    } catch (RemoteStoreException e) {
      assertEquals(200, e.statusCode());
    }
  }
}
