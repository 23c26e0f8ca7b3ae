package org.waabox.outagewatch.query;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

import org.waabox.outagewatch.QueryException;

/**
 * The filters of a read request against the outage view.
 *
 * <p>All criteria are optional and combined with AND:
 * <ul>
 *   <li>{@code facilityId}, {@code generator}, {@code plantKey}: exact
 *       match</li>
 *   <li>{@code plantName}: case-insensitive substring match</li>
 *   <li>{@code startDate}, {@code endDate}: inclusive range on the outage
 *       start date</li>
 * </ul>
 *
 * <p>Instances are created through {@link #builder()} and are immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class OutageFilter {

  /** A filter that matches every row. */
  private static final OutageFilter NONE = builder().build();

  /** The facility to match, null for any. */
  private final String facilityId;

  /** The generator to match, null for any. */
  private final String generator;

  /** The plant key to match, null for any. */
  private final Integer plantKey;

  /** The lower-cased plant name fragment, null for any. */
  private final String plantNameFragment;

  /** The earliest start date, inclusive, null for unbounded. */
  private final LocalDate startDate;

  /** The latest start date, inclusive, null for unbounded. */
  private final LocalDate endDate;

  /** Creates a filter from the builder.
   *
   * @param builder the builder, never null
   */
  private OutageFilter(final Builder builder) {
    if (builder.plantKey != null && builder.plantKey < 1) {
      throw new QueryException("plant_key must be >= 1, got: "
          + builder.plantKey);
    }
    if (builder.startDate != null && builder.endDate != null
        && builder.startDate.isAfter(builder.endDate)) {
      throw new QueryException("start_date " + builder.startDate
          + " is after end_date " + builder.endDate);
    }
    facilityId = blankToNull(builder.facilityId);
    generator = blankToNull(builder.generator);
    plantKey = builder.plantKey;
    final String name = blankToNull(builder.plantName);
    plantNameFragment = name == null ? null : name.toLowerCase(Locale.ROOT);
    startDate = builder.startDate;
    endDate = builder.endDate;
  }

  /** Returns a filter that matches every row.
   *
   * @return the empty filter, never null
   */
  public static OutageFilter none() {
    return NONE;
  }

  /** Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses an ISO-8601 date request parameter.
   *
   * @param name  the parameter name, used in the error message
   * @param value the raw value, may be null or blank
   * @return the date, or null when the value is null or blank
   *
   * @throws QueryException if the value is not a {@code yyyy-MM-dd} date
   */
  public static LocalDate parseDate(final String name, final String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (final DateTimeParseException e) {
      throw new QueryException(name + " must be a date (YYYY-MM-DD), got: "
          + value);
    }
  }

  /**
   * Returns whether the given row satisfies every criterion.
   *
   * @param row the row to test, never null
   * @return true if the row matches
   */
  public boolean matches(final OutageView row) {
    if (facilityId != null && !facilityId.equals(row.facilityId())) {
      return false;
    }
    if (generator != null && !generator.equals(row.generator())) {
      return false;
    }
    if (plantKey != null && plantKey != row.plantKey()) {
      return false;
    }
    if (plantNameFragment != null && (row.plantName() == null
        || !row.plantName().toLowerCase(Locale.ROOT)
            .contains(plantNameFragment))) {
      return false;
    }
    final LocalDate start = row.outageStart().toLocalDate();
    if (startDate != null && start.isBefore(startDate)) {
      return false;
    }
    return endDate == null || !start.isAfter(endDate);
  }

  /** @return the facility criterion, if any */
  public Optional<String> facilityId() {
    return Optional.ofNullable(facilityId);
  }

  /** @return the plant key criterion, if any */
  public Optional<Integer> plantKey() {
    return Optional.ofNullable(plantKey);
  }

  private static String blankToNull(final String value) {
    if (value == null) {
      return null;
    }
    final String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /** Builder for {@link OutageFilter}. */
  public static final class Builder {

    private String facilityId;
    private String generator;
    private Integer plantKey;
    private String plantName;
    private LocalDate startDate;
    private LocalDate endDate;

    /** Private constructor, use {@link OutageFilter#builder()}. */
    private Builder() {
    }

    /** @param value the facility to match, may be null */
    public Builder facilityId(final String value) {
      facilityId = value;
      return this;
    }

    /** @param value the generator to match, may be null */
    public Builder generator(final String value) {
      generator = value;
      return this;
    }

    /** @param value the plant key to match, may be null */
    public Builder plantKey(final Integer value) {
      plantKey = value;
      return this;
    }

    /** @param value the plant name fragment, may be null */
    public Builder plantName(final String value) {
      plantName = value;
      return this;
    }

    /** @param value the earliest start date, may be null */
    public Builder startDate(final LocalDate value) {
      startDate = value;
      return this;
    }

    /** @param value the latest start date, may be null */
    public Builder endDate(final LocalDate value) {
      endDate = value;
      return this;
    }

    /**
     * Builds the filter.
     *
     * @return the filter, never null
     * @throws QueryException if plant key is below 1 or the date range is
     *         inverted
     */
    public OutageFilter build() {
      return new OutageFilter(this);
    }
  }
}
