package org.waabox.outagewatch.server.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.waabox.outagewatch.refresh.ConcurrencyPolicy;

/**
 * Configuration properties for the outage service, mapped from the
 * {@code outagewatch.*} prefix in application.yaml.
 *
 * <p>The shipped application.yaml binds every value to an environment
 * variable ({@code EIA_API_KEY}, {@code RAW_PATH}, {@code MODELED_DIR},
 * {@code INCREMENTAL}, {@code EARLY_STOP_ON_OLD_PERIOD}, {@code MAX_LIMIT},
 * {@code MAX_RECORDS}, {@code MAX_RETRIES}, {@code RETRY_DELAY},
 * {@code API_TOKEN}, {@code REFRESH_CONCURRENCY}).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "outagewatch")
public class OutageWatchProperties {

  /** The CSV file of the raw store. */
  private String rawPath = "data/raw/outages.csv";

  /** The live directory of the modeled store. */
  private String modeledDir = "data/modeled";

  /** Whether extraction merges into the existing raw store. */
  private boolean incremental = false;

  /** Whether incremental extraction may stop paging early. */
  private boolean earlyStop = false;

  /** The rows requested per upstream page. */
  private int maxLimit = 5000;

  /** The cap on fetched rows per extraction, 0 for none. */
  private int maxRecords = 0;

  /** The attempts per upstream page. */
  private int maxRetries = 3;

  /** The wait before the first retry, doubled on each further one. */
  @DurationUnit(ChronoUnit.SECONDS)
  private Duration retryDelay = Duration.ofSeconds(5);

  /** The bearer token required by the API, blank disables the check. */
  private String apiToken;

  /** What to do with a refresh requested while one runs. */
  private ConcurrencyPolicy refreshConcurrency = ConcurrencyPolicy.REJECT;

  /** The upstream API settings. */
  private final Eia eia = new Eia();

  public String getRawPath() {
    return rawPath;
  }

  public void setRawPath(final String theRawPath) {
    rawPath = theRawPath;
  }

  public String getModeledDir() {
    return modeledDir;
  }

  public void setModeledDir(final String theModeledDir) {
    modeledDir = theModeledDir;
  }

  public boolean isIncremental() {
    return incremental;
  }

  public void setIncremental(final boolean isIncremental) {
    incremental = isIncremental;
  }

  public boolean isEarlyStop() {
    return earlyStop;
  }

  public void setEarlyStop(final boolean isEarlyStop) {
    earlyStop = isEarlyStop;
  }

  public int getMaxLimit() {
    return maxLimit;
  }

  public void setMaxLimit(final int theMaxLimit) {
    maxLimit = theMaxLimit;
  }

  public int getMaxRecords() {
    return maxRecords;
  }

  public void setMaxRecords(final int theMaxRecords) {
    maxRecords = theMaxRecords;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(final int theMaxRetries) {
    maxRetries = theMaxRetries;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(final Duration theRetryDelay) {
    retryDelay = theRetryDelay;
  }

  /**
   * Returns the configured API token.
   *
   * @return the token, or null or blank when authentication is disabled
   */
  public String getApiToken() {
    return apiToken;
  }

  public void setApiToken(final String theApiToken) {
    apiToken = theApiToken;
  }

  public ConcurrencyPolicy getRefreshConcurrency() {
    return refreshConcurrency;
  }

  public void setRefreshConcurrency(final ConcurrencyPolicy thePolicy) {
    refreshConcurrency = thePolicy;
  }

  public Eia getEia() {
    return eia;
  }

  /** The {@code outagewatch.eia.*} settings. */
  public static class Eia {

    /** The EIA API key; refreshes fail while it is blank. */
    private String apiKey;

    /** The API base URL. */
    private String baseUrl = "https://api.eia.gov/v2/";

    /** The connect timeout. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** The per-request timeout. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(final String theApiKey) {
      apiKey = theApiKey;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String theBaseUrl) {
      baseUrl = theBaseUrl;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(final Duration theTimeout) {
      connectTimeout = theTimeout;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(final Duration theTimeout) {
      requestTimeout = theTimeout;
    }
  }
}
