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
package net.tsflux.query.http;

import java.io.Closeable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.concurrent.Future;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.tsflux.data.FluxTable;
import net.tsflux.data.Point;
import net.tsflux.exceptions.QueryExecutionException;
import net.tsflux.exceptions.QueryValidationException;
import net.tsflux.exceptions.RemoteQueryExecutionException;
import net.tsflux.query.QueryExecutor;
import net.tsflux.utils.DateTime;
import net.tsflux.utils.JSON;
import net.tsflux.utils.SharedHttpClient;

/**
 * A {@link QueryExecutor} talking to an InfluxDB 2.x style HTTP API. Queries
 * are POSTed to {@code /api/v2/query} and answered in annotated CSV, writes go
 * to {@code /api/v2/write} as line protocol. Each call is sent on the shared
 * asynchronous client and joined with the configured timeout, so callers see
 * a blocking call.
 * <p>
 * Failures surface as {@link RemoteQueryExecutionException}s carrying the
 * store's message and HTTP status. Nothing is retried.
 *
 * @since 1.0
 */
public class HttpFluxQueryExecutor implements QueryExecutor, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(
      HttpFluxQueryExecutor.class);

  public static final String QUERY_PATH = "/api/v2/query";
  public static final String WRITE_PATH = "/api/v2/write";

  /** The connection settings. */
  private final InfluxConfig config;

  /** The client to send requests on. */
  private final SharedHttpClient client;

  /** Whether or not we built the client and have to close it. */
  private final boolean owns_client;

  /**
   * Builds an executor with its own client.
   * @param config The non-null connection settings.
   */
  public HttpFluxQueryExecutor(final InfluxConfig config) {
    this(config, config == null ? null : new SharedHttpClient(config), true);
  }

  /**
   * Builds an executor on a client shared with other components. The client
   * is left open by {@link #close()}.
   * @param config The non-null connection settings.
   * @param client The non-null, started client.
   */
  public HttpFluxQueryExecutor(final InfluxConfig config,
                               final SharedHttpClient client) {
    this(config, client, false);
  }

  private HttpFluxQueryExecutor(final InfluxConfig config,
                                final SharedHttpClient client,
                                final boolean owns_client) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    this.config = config;
    this.client = client;
    this.owns_client = owns_client;
  }

  @Override
  public FluxTable execute(final String query, final String organisation) {
    if (Strings.isNullOrEmpty(query) || query.trim().isEmpty()) {
      throw new QueryValidationException("Query cannot be null or empty.");
    }
    final URI uri = uri(QUERY_PATH, "org", organisation(organisation));
    final HttpPost post = new HttpPost(uri);
    post.setEntity(new StringEntity(queryBody(query),
        ContentType.APPLICATION_JSON));
    post.addHeader("Accept", "application/csv");
    post.addHeader("Accept-Encoding", "gzip");
    authorize(post);

    final String body = roundTrip(post);
    return new AnnotatedCsvParser(config.getUrl()).parse(body);
  }

  @Override
  public void write(final String bucket,
                    final String organisation,
                    final Collection<Point> points) {
    if (Strings.isNullOrEmpty(bucket)) {
      throw new QueryValidationException("Bucket cannot be null or empty.");
    }
    if (points == null) {
      throw new QueryValidationException("Points cannot be null.");
    }
    if (points.isEmpty()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("No points to write to " + bucket);
      }
      return;
    }
    final String lines;
    try {
      lines = LineProtocol.encode(points);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException(e.getMessage(), e);
    }
    final URI uri = uri(WRITE_PATH, "org", organisation(organisation),
        "bucket", bucket, "precision", "ns");
    final HttpPost post = new HttpPost(uri);
    post.setEntity(new StringEntity(lines,
        ContentType.create("text/plain", "UTF-8")));
    post.addHeader("Accept", "application/json");
    authorize(post);

    roundTrip(post);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Wrote " + points.size() + " points to " + bucket);
    }
  }

  /** Closes the client if this executor built it. */
  @Override
  public void close() {
    if (owns_client) {
      client.close();
    }
  }

  /** @return The connection settings. */
  public InfluxConfig config() {
    return config;
  }

  /**
   * Renders the JSON query body asking for annotated CSV with a header.
   * @param query The pipeline text.
   * @return The JSON body.
   */
  static String queryBody(final String query) {
    final ObjectNode root = JSON.getMapper().createObjectNode();
    root.put("query", query);
    root.put("type", "flux");
    final ObjectNode dialect = root.putObject("dialect");
    dialect.put("header", true);
    dialect.put("delimiter", ",");
    dialect.putArray("annotations")
        .add("datatype")
        .add("group")
        .add("default");
    dialect.put("dateTimeFormat", "RFC3339");
    return JSON.serializeToString(root);
  }

  /**
   * Sends the request and waits for the body.
   * @param request The non-null request.
   * @return The body of a 2xx response.
   * @throws QueryExecutionException if the call failed, timed out or was
   * answered with an error.
   */
  String roundTrip(final HttpPost request) {
    final long start = DateTime.nanoTime();
    final String remote = config.getUrl();
    final Deferred<String> deferred = new Deferred<String>();

    class ResponseCallback implements FutureCallback<HttpResponse> {

      @Override
      public void completed(final HttpResponse response) {
        final String body;
        try {
          body = SharedHttpClient.parseResponse(response, remote);
        } catch (Exception e) {
          LOG.warn("Failed response from [" + request.getURI() + "]", e);
          deferred.callback(e);
          return;
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Successful response from [" + request.getURI()
              + "] after " + DateTime.msFromNanoDiff(DateTime.nanoTime(), start)
              + "ms");
        }
        deferred.callback(body);
      }

      @Override
      public void failed(final Exception ex) {
        LOG.warn("HTTP call to [" + request.getURI() + "] failed", ex);
        deferred.callback(new RemoteQueryExecutionException(
            "HTTP call failed: " + ex.getMessage(), remote, 0, ex));
      }

      @Override
      public void cancelled() {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Http call was canceled: " + request.getURI());
        }
        deferred.callback(new RemoteQueryExecutionException(
            "HTTP call was canceled: " + request.getURI(), remote, 400));
      }
    }

    final Future<HttpResponse> future =
        client.getClient().execute(request, new ResponseCallback());
    try {
      return deferred.join(config.getTimeout());
    } catch (QueryExecutionException e) {
      throw e;
    } catch (TimeoutException e) {
      if (future != null) {
        future.cancel(true);
      }
      throw new RemoteQueryExecutionException("Timed out after "
          + config.getTimeout() + "ms waiting on " + request.getURI(),
          remote, 504, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RemoteQueryExecutionException("Interrupted while waiting on "
          + request.getURI(), remote, 500, e);
    } catch (Exception e) {
      throw new RemoteQueryExecutionException("HTTP call failed: "
          + e.getMessage(), remote, 500, e);
    }
  }

  private String organisation(final String organisation) {
    return Strings.isNullOrEmpty(organisation)
        ? config.getOrganisation() : organisation;
  }

  private void authorize(final HttpPost post) {
    if (config.getToken() != null) {
      post.addHeader("Authorization", "Token " + config.getToken());
    }
  }

  private URI uri(final String path, final String... params) {
    try {
      final URIBuilder builder = new URIBuilder(config.getUrl() + path);
      for (int i = 0; i < params.length; i += 2) {
        builder.addParameter(params[i], params[i + 1]);
      }
      return builder.build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid store URL: "
          + config.getUrl(), e);
    }
  }
}
