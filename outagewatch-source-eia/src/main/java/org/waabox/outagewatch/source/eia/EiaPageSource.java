package org.waabox.outagewatch.source.eia;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.connector.OutagePageSource;
import org.waabox.outagewatch.connector.PageFetchException;
import org.waabox.outagewatch.raw.RawObservationCodec;

/**
 * An {@link OutagePageSource} backed by the EIA v2 REST API.
 *
 * <p>Each page is one {@code GET} on the outages route with the API key,
 * {@code offset} and {@code length} as query parameters. The numeric
 * columns are requested explicitly and the feed is sorted by
 * {@code period} descending, which is what the connector's early stop
 * expects. Rows are read from {@code response.data} of the JSON body.
 *
 * <p>Failures are classified for the connector's retry loop: 401 and 403
 * mean the key is wrong and are not retryable; other non-2xx answers,
 * network errors, timeouts and unreadable bodies are.
 *
 * <p>The API key is sent as a query parameter, as the EIA API requires, and
 * never logged.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EiaPageSource implements OutagePageSource {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(EiaPageSource.class);

  /** HTTP 401 Unauthorized. */
  private static final int HTTP_UNAUTHORIZED = 401;

  /** HTTP 403 Forbidden. */
  private static final int HTTP_FORBIDDEN = 403;

  /** The numeric columns requested from the dataset. */
  private static final List<String> DATA_COLUMNS = List.of(
      RawObservationCodec.CAPACITY,
      RawObservationCodec.OUTAGE,
      RawObservationCodec.PERCENT_OUTAGE);

  /** The configuration, never null. */
  private final EiaSourceConfig config;

  /** The HTTP client, never null. */
  private final HttpClient client;

  /** The JSON mapper, never null. */
  private final ObjectMapper mapper;

  /**
   * Creates a new page source with its own HTTP client.
   *
   * @param theConfig the configuration, never null
   */
  public EiaPageSource(final EiaSourceConfig theConfig) {
    this(theConfig, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(theConfig,
            "config must not be null").connectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), new ObjectMapper());
  }

  /**
   * Creates a new page source.
   *
   * @param theConfig the configuration, never null
   * @param theClient the HTTP client, never null
   * @param theMapper the JSON mapper, never null
   */
  public EiaPageSource(final EiaSourceConfig theConfig,
      final HttpClient theClient, final ObjectMapper theMapper) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
    mapper = Objects.requireNonNull(theMapper, "mapper must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public List<JsonNode> fetchPage(final int offset, final int length) {
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(pageUri(offset, length))
        .timeout(config.requestTimeout())
        .header("Accept", "application/json")
        .GET()
        .build();

    final HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new PageFetchException("Network failure fetching offset "
          + offset + ": " + e.getMessage(), e, true);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PageFetchException("Interrupted fetching offset " + offset,
          e, false);
    }

    final int status = response.statusCode();
    if (status == HTTP_UNAUTHORIZED || status == HTTP_FORBIDDEN) {
      throw new PageFetchException("Authentication failed (HTTP " + status
          + "); check the EIA API key", false);
    }
    if (status < 200 || status >= 300) {
      throw new PageFetchException("Unexpected HTTP " + status
          + " fetching offset " + offset, true);
    }

    final List<JsonNode> rows = parseRows(response.body(), offset);
    log.debug("Fetched {} rows at offset {} from {}", rows.size(), offset,
        config.endpoint());
    return rows;
  }

  /**
   * Reads the rows out of a response body.
   *
   * @param body   the response body, never null
   * @param offset the page offset, for messages
   * @return the rows, never null
   *
   * @throws PageFetchException if the body is not the expected JSON
   */
  private List<JsonNode> parseRows(final String body, final int offset) {
    final JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (final JsonProcessingException e) {
      throw new PageFetchException("Malformed JSON at offset " + offset, e,
          true);
    }
    final JsonNode data = root == null ? null : root.path("response")
        .get("data");
    if (data == null || !data.isArray()) {
      throw new PageFetchException("Response at offset " + offset
          + " has no response.data array", true);
    }
    final List<JsonNode> rows = new ArrayList<>(data.size());
    data.forEach(rows::add);
    return rows;
  }

  /**
   * Builds the page URI.
   *
   * @param offset the row offset
   * @param length the page length
   * @return the URI, never null
   */
  URI pageUri(final int offset, final int length) {
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("api_key", config.apiKey());
    params.put("offset", String.valueOf(offset));
    params.put("length", String.valueOf(length));
    for (int i = 0; i < DATA_COLUMNS.size(); i++) {
      params.put("data[" + i + "]", DATA_COLUMNS.get(i));
    }
    params.put("sort[0][column]", RawObservationCodec.PERIOD);
    params.put("sort[0][direction]", "desc");

    final StringBuilder query = new StringBuilder();
    for (final Map.Entry<String, String> param : params.entrySet()) {
      if (query.length() > 0) {
        query.append('&');
      }
      query.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
    }
    return URI.create(config.endpoint() + "?" + query);
  }
}
