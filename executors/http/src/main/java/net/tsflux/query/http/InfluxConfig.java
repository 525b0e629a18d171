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

import java.io.File;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Strings;

import net.tsflux.utils.YAML;

/**
 * Connection settings for an InfluxDB 2.x style HTTP API. Either give the
 * full {@code url} or an {@code ip} (host, optionally with scheme) and an
 * optional {@code port}. The keys of the older connection files ("IP",
 * "Port", "Token", "Organisation") are accepted as well, e.g.:
 * <pre>
 * ip: localhost
 * port: 8086
 * token: s3cret
 * organisation: acme
 * </pre>
 *
 * @since 1.0
 */
@JsonDeserialize(builder = InfluxConfig.Builder.class)
public class InfluxConfig {
  /** Default request timeout in milliseconds. */
  public static final long DEFAULT_TIMEOUT = 15000000;

  public static final int DEFAULT_IO_THREADS = 8;
  public static final int DEFAULT_MAX_CONNECTIONS = 200;
  public static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 25;

  /** The base URL without a trailing slash. */
  private final String url;

  /** The API token, may be null for unauthenticated stores. */
  private final String token;

  /** The organisation queries and writes run under. */
  private final String organisation;

  /** How long to wait for a response in milliseconds. */
  private final long timeout;

  private final int io_threads;
  private final int max_connections;
  private final int max_connections_per_route;

  protected InfluxConfig(final Builder builder) {
    if (!Strings.isNullOrEmpty(builder.url)) {
      url = trimSlash(builder.url.trim());
    } else if (!Strings.isNullOrEmpty(builder.ip)) {
      final String host = builder.ip.trim().contains("://")
          ? builder.ip.trim() : "http://" + builder.ip.trim();
      url = trimSlash(Strings.isNullOrEmpty(builder.port)
          ? host : trimSlash(host) + ":" + builder.port.trim());
    } else {
      throw new IllegalArgumentException("Either the URL or the IP of the "
          + "store must be set.");
    }
    if (Strings.isNullOrEmpty(builder.organisation)) {
      throw new IllegalArgumentException("Organisation cannot be null or empty.");
    }
    if (builder.timeout <= 0) {
      throw new IllegalArgumentException("Timeout must be greater than zero: "
          + builder.timeout);
    }
    if (builder.ioThreads < 1 || builder.maxConnections < 1
        || builder.maxConnectionsPerRoute < 1) {
      throw new IllegalArgumentException("Thread and connection counts must "
          + "be at least 1.");
    }
    token = Strings.emptyToNull(builder.token);
    organisation = builder.organisation;
    timeout = builder.timeout;
    io_threads = builder.ioThreads;
    max_connections = builder.maxConnections;
    max_connections_per_route = builder.maxConnectionsPerRoute;
  }

  /** @return The base URL without a trailing slash. */
  public String getUrl() {
    return url;
  }

  /** @return The API token, null if none was configured. */
  public String getToken() {
    return token;
  }

  public String getOrganisation() {
    return organisation;
  }

  /** @return The response timeout in milliseconds. */
  public long getTimeout() {
    return timeout;
  }

  public int getIoThreads() {
    return io_threads;
  }

  public int getMaxConnections() {
    return max_connections;
  }

  public int getMaxConnectionsPerRoute() {
    return max_connections_per_route;
  }

  @Override
  public String toString() {
    // never log the token
    return new StringBuilder()
        .append("{url=")
        .append(url)
        .append(", organisation=")
        .append(organisation)
        .append(", token=")
        .append(token == null ? "none" : "****")
        .append(", timeout=")
        .append(timeout)
        .append("}")
        .toString();
  }

  /**
   * Parses a YAML or JSON connection file.
   * @param file The non-null file.
   * @return The config.
   * @throws IllegalArgumentException if the file could not be parsed or the
   * settings were invalid.
   */
  public static InfluxConfig parse(final File file) {
    return YAML.parseToObject(file, InfluxConfig.class);
  }

  /**
   * Parses YAML or JSON connection settings.
   * @param yaml The non-null content.
   * @return The config.
   * @throws IllegalArgumentException if the content could not be parsed or
   * the settings were invalid.
   */
  public static InfluxConfig parse(final String yaml) {
    return YAML.parseToObject(yaml, InfluxConfig.class);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private static String trimSlash(final String url) {
    String trimmed = url;
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    @JsonAlias({ "URL", "Url" })
    private String url;
    @JsonProperty
    @JsonAlias({ "IP", "Ip", "host" })
    private String ip;
    @JsonProperty
    @JsonAlias("Port")
    private String port;
    @JsonProperty
    @JsonAlias("Token")
    private String token;
    @JsonProperty
    @JsonAlias({ "Organisation", "organization", "org" })
    private String organisation;
    @JsonProperty
    private long timeout = DEFAULT_TIMEOUT;
    @JsonProperty
    private int ioThreads = DEFAULT_IO_THREADS;
    @JsonProperty
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    @JsonProperty
    private int maxConnectionsPerRoute = DEFAULT_MAX_CONNECTIONS_PER_ROUTE;

    public Builder setUrl(final String url) {
      this.url = url;
      return this;
    }

    public Builder setIp(final String ip) {
      this.ip = ip;
      return this;
    }

    public Builder setPort(final String port) {
      this.port = port;
      return this;
    }

    public Builder setPort(final int port) {
      this.port = Integer.toString(port);
      return this;
    }

    public Builder setToken(final String token) {
      this.token = token;
      return this;
    }

    public Builder setOrganisation(final String organisation) {
      this.organisation = organisation;
      return this;
    }

    /**
     * @param timeout The response timeout in milliseconds.
     * @return The builder.
     */
    public Builder setTimeout(final long timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder setIoThreads(final int ioThreads) {
      this.ioThreads = ioThreads;
      return this;
    }

    public Builder setMaxConnections(final int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public Builder setMaxConnectionsPerRoute(final int maxConnectionsPerRoute) {
      this.maxConnectionsPerRoute = maxConnectionsPerRoute;
      return this;
    }

    public InfluxConfig build() {
      return new InfluxConfig(this);
    }
  }
}
