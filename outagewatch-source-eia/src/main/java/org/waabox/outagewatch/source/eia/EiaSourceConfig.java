package org.waabox.outagewatch.source.eia;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the {@link EiaPageSource}.
 *
 * <p>Holds the API base URL, the outages route under it, the API key, and
 * the connect and per-request timeouts. The key is required; everything
 * else has a default.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EiaSourceConfig {

  /** The public EIA v2 API. */
  public static final String DEFAULT_BASE_URL = "https://api.eia.gov/v2/";

  /** The generator-level nuclear outages dataset. */
  public static final String DEFAULT_ROUTE =
      "nuclear-outages/generator-nuclear-outages/data";

  /** The default connect timeout. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The default per-request timeout. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(30);

  /** The base URL, always ending with a slash. */
  private final String baseUrl;

  /** The route under the base URL, without a leading slash. */
  private final String route;

  /** The API key, never null or blank. */
  private final String apiKey;

  /** The connect timeout, never null. */
  private final Duration connectTimeout;

  /** The per-request timeout, never null. */
  private final Duration requestTimeout;

  /** Creates a config from the builder.
   *
   * @param builder the builder, never null
   */
  private EiaSourceConfig(final Builder builder) {
    if (builder.apiKey == null || builder.apiKey.isBlank()) {
      throw new IllegalArgumentException(
          "The EIA API key is required (EIA_API_KEY)");
    }
    final String base = builder.baseUrl == null || builder.baseUrl.isBlank()
        ? DEFAULT_BASE_URL : builder.baseUrl.trim();
    baseUrl = base.endsWith("/") ? base : base + "/";
    final String path = builder.route == null || builder.route.isBlank()
        ? DEFAULT_ROUTE : builder.route.trim();
    route = path.startsWith("/") ? path.substring(1) : path;
    apiKey = builder.apiKey.trim();
    connectTimeout = positive(builder.connectTimeout, DEFAULT_CONNECT_TIMEOUT,
        "connectTimeout");
    requestTimeout = positive(builder.requestTimeout, DEFAULT_REQUEST_TIMEOUT,
        "requestTimeout");
  }

  /** Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** @return the full endpoint, base URL plus route, never null */
  public URI endpoint() {
    return URI.create(baseUrl + route);
  }

  /** @return the API key, never null */
  public String apiKey() {
    return apiKey;
  }

  /** @return the connect timeout, never null */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  /** @return the per-request timeout, never null */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  private static Duration positive(final Duration value,
      final Duration fallback, final String name) {
    if (value == null) {
      return fallback;
    }
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got: "
          + value);
    }
    return value;
  }

  /** Builder for {@link EiaSourceConfig}. */
  public static final class Builder {

    private String baseUrl;
    private String route;
    private String apiKey;
    private Duration connectTimeout;
    private Duration requestTimeout;

    /** Private constructor, use {@link EiaSourceConfig#builder()}. */
    private Builder() {
    }

    /**
     * Sets the API base URL.
     *
     * @param theBaseUrl the base URL, null for the public API
     * @return this builder, never null
     */
    public Builder baseUrl(final String theBaseUrl) {
      baseUrl = theBaseUrl;
      return this;
    }

    /**
     * Sets the dataset route under the base URL.
     *
     * @param theRoute the route, null for the outages dataset
     * @return this builder, never null
     */
    public Builder route(final String theRoute) {
      route = theRoute;
      return this;
    }

    /**
     * Sets the API key.
     *
     * @param theApiKey the key, never null or blank
     * @return this builder, never null
     */
    public Builder apiKey(final String theApiKey) {
      apiKey = Objects.requireNonNull(theApiKey, "apiKey must not be null");
      return this;
    }

    /**
     * Sets the connect timeout.
     *
     * @param theTimeout the timeout, null for 10 seconds
     * @return this builder, never null
     */
    public Builder connectTimeout(final Duration theTimeout) {
      connectTimeout = theTimeout;
      return this;
    }

    /**
     * Sets the per-request timeout.
     *
     * @param theTimeout the timeout, null for 30 seconds
     * @return this builder, never null
     */
    public Builder requestTimeout(final Duration theTimeout) {
      requestTimeout = theTimeout;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws IllegalArgumentException if the key is missing or a timeout
     *         is not positive
     */
    public EiaSourceConfig build() {
      return new EiaSourceConfig(this);
    }
  }
}
