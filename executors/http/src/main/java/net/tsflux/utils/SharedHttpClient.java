// This file is part of TSFlux.
// Copyright (C) 2024  The TSFlux Authors.
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
package net.tsflux.utils;

import java.io.Closeable;
import java.io.IOException;

import org.apache.http.HttpResponse;
import org.apache.http.ParseException;
import org.apache.http.client.entity.DeflateDecompressingEntity;
import org.apache.http.client.entity.GzipDecompressingEntity;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import net.tsflux.exceptions.RemoteQueryExecutionException;
import net.tsflux.query.http.InfluxConfig;

/**
 * A started asynchronous HTTP client sized from an {@link InfluxConfig}, plus
 * the response decoding shared by the HTTP calls.
 *
 * @since 1.0
 */
public class SharedHttpClient implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      SharedHttpClient.class);

  /** The client. */
  protected final CloseableHttpAsyncClient client;

  /**
   * Builds and starts a client.
   * @param config The non-null config to size the pools from.
   */
  public SharedHttpClient(final InfluxConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    client = HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(config.getIoThreads()).build())
        .setMaxConnTotal(config.getMaxConnections())
        .setMaxConnPerRoute(config.getMaxConnectionsPerRoute())
        .build();
    client.start();
    LOG.info("Initialized shared HTTP client for " + config.getUrl());
  }

  /**
   * Wraps an existing client, e.g. one shared with other components. It is
   * closed along with this object.
   * @param client The non-null client.
   */
  public SharedHttpClient(final CloseableHttpAsyncClient client) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.client = client;
  }

  /**
   * NOTE: Do not close it.
   * @return The non-null client.
   */
  public CloseableHttpAsyncClient getClient() {
    return client;
  }

  @Override
  public void close() {
    try {
      client.close();
    } catch (IOException e) {
      LOG.error("Failed to close HTTP client", e);
    }
  }

  /**
   * Helper that handles decompressing the result and parses the entity
   * to a string. Any 2xx status is a success. Otherwise the store's JSON
   * error message, or the raw body if it isn't one, is thrown in a
   * {@link RemoteQueryExecutionException}.
   * @param response The non-null response to parse.
   * @param remote_host The remote host name.
   * @return The body, empty if the response had none and succeeded.
   * @throws RemoteQueryExecutionException if the status was not 2xx or the
   * body could not be read.
   */
  public static String parseResponse(final HttpResponse response,
                                     final String remote_host) {
    final int status = response.getStatusLine().getStatusCode();
    final String content;
    if (response.getEntity() == null) {
      if (status >= 200 && status < 300) {
        return "";
      }
      throw new RemoteQueryExecutionException("Content for http response "
          + "was null: " + response, remote_host, status);
    }

    try {
      final String encoding = (response.getEntity().getContentEncoding() != null &&
          response.getEntity().getContentEncoding().getValue() != null ?
              response.getEntity().getContentEncoding().getValue().toLowerCase() :
                "");
      if (encoding.equals("gzip") || encoding.equals("x-gzip")) {
        content = EntityUtils.toString(
            new GzipDecompressingEntity(response.getEntity()), "UTF-8");
      } else if (encoding.equals("deflate")) {
        content = EntityUtils.toString(
            new DeflateDecompressingEntity(response.getEntity()), "UTF-8");
      } else if (encoding.equals("") || encoding.equals("identity")) {
        content = EntityUtils.toString(response.getEntity(), "UTF-8");
      } else {
        throw new RemoteQueryExecutionException("Unhandled content encoding ["
            + encoding + "] : " + response, remote_host, 500);
      }
    } catch (ParseException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: "
          + response, remote_host, 500, e);
    } catch (IOException e) {
      LOG.error("Failed to parse content from HTTP response: " + response, e);
      throw new RemoteQueryExecutionException("Content parsing failure for: "
          + response, remote_host, 500, e);
    }

    if (status >= 200 && status < 300) {
      return content;
    }

    // the store answers {"code": "invalid", "message": "..."}
    if (content.trim().startsWith("{")) {
      try {
        final JsonNode root = JSON.getMapper().readTree(content);
        final JsonNode message = root.get("message");
        if (message != null && !message.isNull()) {
          throw new RemoteQueryExecutionException(message.asText(), remote_host,
              status);
        }
      } catch (IOException e) {
        LOG.warn("Failed to parse the JSON exception: " + content, e);
      }
    }
    throw new RemoteQueryExecutionException(content, remote_host, status);
  }
}
