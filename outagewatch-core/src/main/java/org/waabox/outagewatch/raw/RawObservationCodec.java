package org.waabox.outagewatch.raw;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.waabox.outagewatch.ValidationException;

/**
 * Static utility class that turns one upstream JSON row into a
 * {@link RawObservation}.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}) so the upstream schema is
 * never bound to a class: known fields are read by name and anything else
 * the feed sends is ignored. The natural key fields ({@code period},
 * {@code facility}, {@code generator}) are mandatory; the numeric fields are
 * optional and read as null when absent or unparseable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RawObservationCodec {

  /** The upstream name of the observation date. */
  public static final String PERIOD = "period";

  /** The upstream name of the facility identifier. */
  public static final String FACILITY = "facility";

  /** The upstream name of the plant name. */
  public static final String FACILITY_NAME = "facilityName";

  /** The upstream name of the generator identifier. */
  public static final String GENERATOR = "generator";

  /** The upstream name of the unit capacity. */
  public static final String CAPACITY = "capacity";

  /** The upstream name of the capacity out of service. */
  public static final String OUTAGE = "outage";

  /** The upstream name of the share of capacity out of service. */
  public static final String PERCENT_OUTAGE = "percentOutage";

  /** Length of an ISO-8601 local date, e.g. 2025-01-31. */
  private static final int ISO_DATE_LENGTH = 10;

  /** Private constructor to prevent instantiation. */
  private RawObservationCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Decodes one upstream row.
   *
   * @param node the JSON object for the row, never null.
   * @return the parsed observation, never null, always with a natural key.
   * @throws ValidationException if a natural key field is missing or the
   *     period cannot be parsed.
   */
  public static RawObservation decode(final JsonNode node) {
    Objects.requireNonNull(node, "node cannot be null");

    final String periodText = requireText(node, PERIOD);
    final String facility = requireText(node, FACILITY);
    final String generator = requireText(node, GENERATOR);

    return new RawObservation(
        parsePeriod(periodText),
        facility,
        optionalText(node, FACILITY_NAME),
        generator,
        optionalNumber(node, CAPACITY),
        optionalNumber(node, OUTAGE),
        optionalNumber(node, PERCENT_OUTAGE));
  }

  /**
   * Parses an upstream period, accepting a plain date or a date-time whose
   * time part is dropped.
   *
   * @param text the period text, never null.
   * @return the calendar date, never null.
   * @throws ValidationException if the text is not a date.
   */
  public static LocalDate parsePeriod(final String text) {
    Objects.requireNonNull(text, "text cannot be null");
    final String trimmed = text.trim();
    String datePart = trimmed;
    if (trimmed.length() > ISO_DATE_LENGTH) {
      final char separator = trimmed.charAt(ISO_DATE_LENGTH);
      if (separator == 'T' || separator == ' ') {
        datePart = trimmed.substring(0, ISO_DATE_LENGTH);
      }
    }
    try {
      return LocalDate.parse(datePart);
    } catch (final DateTimeParseException e) {
      throw new ValidationException(PERIOD,
          "Unparseable period '" + text + "'");
    }
  }

  /**
   * Reads a mandatory, non-blank text field.
   *
   * @param node the row, never null.
   * @param fieldName the field to read, never null.
   * @return the trimmed text, never null or blank.
   * @throws ValidationException if the field is absent, null or blank.
   */
  private static String requireText(final JsonNode node,
      final String fieldName) {
    final String value = optionalText(node, fieldName);
    if (value == null) {
      throw new ValidationException(fieldName,
          "Missing required field: " + fieldName);
    }
    return value;
  }

  /**
   * Reads an optional text field.
   *
   * @param node the row, never null.
   * @param fieldName the field to read, never null.
   * @return the trimmed text, or null when absent or blank.
   */
  private static String optionalText(final JsonNode node,
      final String fieldName) {
    final JsonNode field = node.get(fieldName);
    if (field == null || field.isNull() || field.isContainerNode()) {
      return null;
    }
    final String text = field.asText().trim();
    return text.isEmpty() ? null : text;
  }

  /**
   * Reads an optional numeric field that the feed may send either as a
   * number or as a string.
   *
   * @param node the row, never null.
   * @param fieldName the field to read, never null.
   * @return the value, or null when absent or not a number.
   */
  private static Double optionalNumber(final JsonNode node,
      final String fieldName) {
    final JsonNode field = node.get(fieldName);
    if (field == null || field.isNull()) {
      return null;
    }
    if (field.isNumber()) {
      return field.doubleValue();
    }
    final String text = optionalText(node, fieldName);
    if (text == null) {
      return null;
    }
    try {
      return Double.valueOf(text);
    } catch (final NumberFormatException e) {
      return null;
    }
  }
}
