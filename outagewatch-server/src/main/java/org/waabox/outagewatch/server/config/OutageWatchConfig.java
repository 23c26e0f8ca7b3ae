package org.waabox.outagewatch.server.config;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import org.waabox.outagewatch.RetryPolicy;
import org.waabox.outagewatch.connector.ConnectorConfig;
import org.waabox.outagewatch.connector.OutageConnector;
import org.waabox.outagewatch.connector.OutagePageSource;
import org.waabox.outagewatch.connector.PageFetchException;
import org.waabox.outagewatch.metrics.NoopOutageWatchMetrics;
import org.waabox.outagewatch.metrics.OutageWatchMetrics;
import org.waabox.outagewatch.model.ModeledStore;
import org.waabox.outagewatch.model.StarSchemaBuilder;
import org.waabox.outagewatch.query.OutageCatalog;
import org.waabox.outagewatch.raw.RawStore;
import org.waabox.outagewatch.refresh.RefreshOrchestrator;
import org.waabox.outagewatch.server.application.BearerTokenInterceptor;
import org.waabox.outagewatch.source.eia.EiaPageSource;
import org.waabox.outagewatch.source.eia.EiaSourceConfig;
import org.waabox.outagewatch.store.fs.CsvRawStore;
import org.waabox.outagewatch.store.fs.FileSystemModeledStore;

/** Spring configuration that wires the outage pipeline from
 * {@link OutageWatchProperties}.
 *
 * <p>Defines the stores, the upstream page source, the connector, the
 * query cache and the refresh orchestrator, and registers the bearer token
 * check on {@code /data} and {@code /refresh/**}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@EnableConfigurationProperties(OutageWatchProperties.class)
public class OutageWatchConfig implements WebMvcConfigurer {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(OutageWatchConfig.class);

  /** The hex digits of the token hash logged at startup. */
  private static final int TOKEN_HASH_PREFIX = 10;

  /** The bound properties, never null. */
  private final OutageWatchProperties properties;

  /** Creates the configuration.
   *
   * @param theProperties the bound properties, never null
   */
  public OutageWatchConfig(final OutageWatchProperties theProperties) {
    properties = theProperties;
  }

  /** Creates the CSV-backed raw store.
   *
   * @return the raw store, never null
   */
  @Bean
  public RawStore rawStore() {
    final CsvRawStore store = new CsvRawStore(
        Path.of(properties.getRawPath()));
    log.info("Raw store: {}", store.file().toAbsolutePath());
    return store;
  }

  /** Creates the directory-backed modeled store.
   *
   * @return the modeled store, never null
   */
  @Bean
  public ModeledStore modeledStore() {
    final FileSystemModeledStore store = new FileSystemModeledStore(
        Path.of(properties.getModeledDir()));
    log.info("Modeled store: {}", store.liveDir());
    return store;
  }

  /** Creates the EIA page source.
   *
   * <p>Without an API key the service still starts and serves existing
   * data; every refresh then fails at extraction.
   *
   * @return the page source, never null
   */
  @Bean
  public OutagePageSource outagePageSource() {
    final OutageWatchProperties.Eia eia = properties.getEia();
    if (eia.getApiKey() == null || eia.getApiKey().isBlank()) {
      log.warn("EIA_API_KEY is not set; refreshes will fail until it is");
      return (offset, length) -> {
        throw new PageFetchException(
            "EIA_API_KEY is not set; cannot authenticate", false);
      };
    }
    return new EiaPageSource(EiaSourceConfig.builder()
        .baseUrl(eia.getBaseUrl())
        .apiKey(eia.getApiKey())
        .connectTimeout(eia.getConnectTimeout())
        .requestTimeout(eia.getRequestTimeout())
        .build());
  }

  /** Creates the metrics sink.
   *
   * @return the no-op metrics, never null
   */
  @Bean
  public OutageWatchMetrics outageWatchMetrics() {
    return NoopOutageWatchMetrics.INSTANCE;
  }

  /** Creates the connector.
   *
   * @param source the upstream page source, never null
   * @param rawStore the raw store, never null
   *
   * @return the connector, never null
   */
  @Bean
  public OutageConnector outageConnector(final OutagePageSource source,
      final RawStore rawStore) {
    final ConnectorConfig config = ConnectorConfig.builder()
        .pageSize(properties.getMaxLimit())
        .maxRecords(properties.getMaxRecords())
        .retryPolicy(RetryPolicy.of(properties.getMaxRetries(),
            properties.getRetryDelay()))
        .incremental(properties.isIncremental())
        .earlyStop(properties.isEarlyStop())
        .build();
    log.info("Connector: page_size={} max_records={} retries={}"
        + " incremental={} early_stop={}", config.pageSize(),
        config.maxRecords(), config.retryPolicy().maxAttempts(),
        config.incremental(), config.earlyStop());
    return new OutageConnector(source, rawStore, config);
  }

  /** Creates the query cache.
   *
   * @param modeledStore the modeled store, never null
   * @param metrics the metrics sink, never null
   *
   * @return the cache, never null
   */
  @Bean
  public OutageCatalog outageCatalog(final ModeledStore modeledStore,
      final OutageWatchMetrics metrics) {
    return new OutageCatalog(modeledStore, metrics);
  }

  /** Creates the refresh orchestrator.
   *
   * @param connector the connector, never null
   * @param rawStore the raw store, never null
   * @param modeledStore the modeled store, never null
   * @param catalog the query cache, never null
   * @param metrics the metrics sink, never null
   *
   * @return the orchestrator, never null
   */
  @Bean
  public RefreshOrchestrator refreshOrchestrator(
      final OutageConnector connector, final RawStore rawStore,
      final ModeledStore modeledStore, final OutageCatalog catalog,
      final OutageWatchMetrics metrics) {
    return new RefreshOrchestrator(connector, rawStore,
        new StarSchemaBuilder(), modeledStore, catalog,
        properties.getRefreshConcurrency(), metrics);
  }

  /** Creates the bearer token check.
   *
   * @return the interceptor, never null
   */
  @Bean
  public BearerTokenInterceptor bearerTokenInterceptor() {
    final String token = properties.getApiToken();
    final BearerTokenInterceptor interceptor =
        new BearerTokenInterceptor(token);
    if (interceptor.enabled()) {
      log.info("Auth enabled (API_TOKEN sha256[:{}]={}, len={})",
          TOKEN_HASH_PREFIX, sha256Prefix(token), token.length());
    } else {
      log.info("Auth disabled (API_TOKEN not set)");
    }
    return interceptor;
  }

  /** {@inheritDoc} */
  @Override
  public void addInterceptors(final InterceptorRegistry registry) {
    registry.addInterceptor(bearerTokenInterceptor())
        .addPathPatterns("/data", "/refresh", "/refresh/**");
  }

  /** Hashes a secret for logging.
   *
   * @param secret the secret, never null
   * @return the first hex digits of its SHA-256, never null
   */
  static String sha256Prefix(final String secret) {
    try {
      final byte[] hash = MessageDigest.getInstance("SHA-256")
          .digest(secret.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, TOKEN_HASH_PREFIX);
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
