package org.waabox.outagewatch.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.raw.RawObservation;

/**
 * Transforms daily raw observations into the outage star schema.
 *
 * <p>The build is a pure function of its input:
 * <ul>
 *   <li>{@link DimPlant}: one row per facility, keyed 1..n in facility
 *       order. The plant name comes from the facility's most recent row
 *       that carries one.</li>
 *   <li>{@link FactOutage}: the rows of every {@code (facility, generator)}
 *       pair are sorted by period and split into maximal runs of consecutive
 *       days; every run is one fact. A missing day starts a new run.</li>
 *   <li>{@link DimDate}: one row per distinct fact start date.</li>
 * </ul>
 *
 * <p>Rows without a complete natural key are skipped and counted. Repeated
 * keys collapse into one day, so a duplicate can never stretch an event.
 *
 * <p>This class is stateless and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StarSchemaBuilder {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(StarSchemaBuilder.class);

  /** Orders generator groups by facility, then generator. */
  private static final Comparator<UnitKey> UNIT_ORDER =
      Comparator.comparing(UnitKey::facility, IdentifierOrder.NATURAL)
          .thenComparing(UnitKey::generator, IdentifierOrder.NATURAL);

  /**
   * Builds the star schema.
   *
   * @param rows the raw observations, never null
   *
   * @return the tables and the number of skipped rows, never null
   */
  public StarSchema build(final List<RawObservation> rows) {
    Objects.requireNonNull(rows, "rows must not be null");

    final Map<String, RawObservation> latestByFacility =
        new TreeMap<>(IdentifierOrder.NATURAL);
    final Map<UnitKey, TreeMap<LocalDate, Double>> days =
        new TreeMap<>(UNIT_ORDER);
    int skipped = 0;

    for (final RawObservation row : rows) {
      if (!row.hasNaturalKey()) {
        skipped++;
        continue;
      }
      latestByFacility.merge(row.facility(), row,
          StarSchemaBuilder::preferNamedLatest);

      final TreeMap<LocalDate, Double> unitDays = days.computeIfAbsent(
          new UnitKey(row.facility(), row.generator()),
          k -> new TreeMap<>());
      // TreeMap.merge rejects null values, and outage MW is optional.
      if (unitDays.containsKey(row.period())) {
        unitDays.put(row.period(), max(unitDays.get(row.period()),
            row.outage()));
      } else {
        unitDays.put(row.period(), row.outage());
      }
    }

    final List<DimPlant> plants = new ArrayList<>();
    final Map<String, Integer> plantKeys = new TreeMap<>(
        IdentifierOrder.NATURAL);
    int nextPlantKey = 1;
    for (final RawObservation latest : latestByFacility.values()) {
      plants.add(new DimPlant(nextPlantKey, latest.facility(),
          latest.facilityName()));
      plantKeys.put(latest.facility(), nextPlantKey);
      nextPlantKey++;
    }

    final List<FactOutage> facts = new ArrayList<>();
    final SortedSet<LocalDate> startDates = new TreeSet<>();
    for (final Map.Entry<UnitKey, TreeMap<LocalDate, Double>> unit
        : days.entrySet()) {
      final int plantKey = plantKeys.get(unit.getKey().facility());
      collapse(unit.getKey(), plantKey, unit.getValue(), facts, startDates);
    }

    final List<DimDate> dates = new ArrayList<>();
    for (final LocalDate date : startDates) {
      dates.add(DimDate.of(date));
    }

    if (skipped > 0) {
      log.warn("Skipped {} raw rows without a complete natural key",
          skipped);
    }
    log.info("Built star schema: dim_plant={} dim_date={} fact_outage={}",
        plants.size(), dates.size(), facts.size());

    return new StarSchema(new ModeledTables(plants, dates, facts), skipped);
  }

  /**
   * Splits the observed days of one generator into events.
   *
   * @param unit       the generator, never null
   * @param plantKey   the plant key of the generator's facility
   * @param unitDays   observed days, ascending, mapped to the outage MW
   * @param facts      receives the events, never null
   * @param startDates receives the event start dates, never null
   */
  private void collapse(final UnitKey unit, final int plantKey,
      final TreeMap<LocalDate, Double> unitDays, final List<FactOutage> facts,
      final SortedSet<LocalDate> startDates) {

    LocalDate runStart = null;
    LocalDate runLast = null;
    Double runPeak = null;

    for (final Map.Entry<LocalDate, Double> day : unitDays.entrySet()) {
      final LocalDate date = day.getKey();
      if (runStart != null && date.equals(runLast.plusDays(1))) {
        runLast = date;
        runPeak = max(runPeak, day.getValue());
        continue;
      }
      if (runStart != null) {
        facts.add(fact(facts.size() + 1, unit, plantKey, runStart, runLast,
            runPeak));
        startDates.add(runStart);
      }
      runStart = date;
      runLast = date;
      runPeak = day.getValue();
    }
    if (runStart != null) {
      facts.add(fact(facts.size() + 1, unit, plantKey, runStart, runLast,
          runPeak));
      startDates.add(runStart);
    }
  }

  /**
   * Creates the fact for one run.
   *
   * @param outageKey the surrogate key
   * @param unit      the generator, never null
   * @param plantKey  the plant key
   * @param first     the first day of the run, never null
   * @param last      the last day of the run, never null
   * @param peak      the largest outage MW, may be null
   *
   * @return the fact, never null
   */
  private static FactOutage fact(final int outageKey, final UnitKey unit,
      final int plantKey, final LocalDate first, final LocalDate last,
      final Double peak) {
    final LocalDateTime start = first.atStartOfDay();
    final LocalDateTime end = last.plusDays(1).atStartOfDay();
    final int dateKey = DimDate.keyOf(first);
    return new FactOutage(outageKey, plantKey, dateKey, unit.generator(),
        start, end, Duration.between(start, end).toHours(), peak,
        unit.facility() + "-" + unit.generator() + "-" + dateKey);
  }

  /**
   * Keeps the most recent row, preferring rows that carry a plant name.
   *
   * @param current the row kept so far, never null
   * @param candidate the new row, never null
   *
   * @return the row to keep, never null
   */
  private static RawObservation preferNamedLatest(
      final RawObservation current, final RawObservation candidate) {
    if (candidate.facilityName() == null) {
      return current;
    }
    if (current.facilityName() == null
        || candidate.period().isAfter(current.period())) {
      return candidate;
    }
    return current;
  }

  /** Null-tolerant maximum; null means "not reported". */
  private static Double max(final Double a, final Double b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return Math.max(a, b);
  }

  /** The grouping key of the event collapse. */
  private record UnitKey(String facility, String generator) {
  }
}
