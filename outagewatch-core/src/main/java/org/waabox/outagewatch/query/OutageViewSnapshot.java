package org.waabox.outagewatch.query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.waabox.outagewatch.OutageWatchException;
import org.waabox.outagewatch.model.DimDate;
import org.waabox.outagewatch.model.DimPlant;
import org.waabox.outagewatch.model.FactOutage;
import org.waabox.outagewatch.model.IdentifierOrder;
import org.waabox.outagewatch.model.ModeledTables;

/**
 * An immutable point-in-time join of the modeled tables.
 *
 * <p>Rows are held in serving order: newest start first, then facility,
 * generator and outage key ascending. Two hash indices, by facility and by
 * plant key, narrow the scan for the exact-match filters; every index entry
 * preserves serving order, so filtering an index bucket gives the same
 * sequence as filtering the full list.
 *
 * <p>Snapshots are designed to be held via an
 * {@link java.util.concurrent.atomic.AtomicReference} and read without
 * locks. All collections are unmodifiable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class OutageViewSnapshot {

  /** The serving order of the joined rows. */
  static final Comparator<OutageView> SERVING_ORDER =
      Comparator.comparing(OutageView::outageStart).reversed()
          .thenComparing(OutageView::facilityId, IdentifierOrder.NATURAL)
          .thenComparing(OutageView::generator, IdentifierOrder.NATURAL)
          .thenComparingInt(OutageView::outageKey);

  /** The joined rows in serving order. */
  private final List<OutageView> rows;

  /** Rows by facility id, each bucket in serving order. */
  private final Map<String, List<OutageView>> byFacility;

  /** Rows by plant key, each bucket in serving order. */
  private final Map<Integer, List<OutageView>> byPlantKey;

  /** The version of this snapshot. */
  private final long version;

  /** The instant when this snapshot was created. */
  private final Instant createdAt;

  /**
   * Creates a new snapshot.
   *
   * @param theRows      the rows in serving order, never null
   * @param theVersion   the version number
   */
  private OutageViewSnapshot(final List<OutageView> theRows,
      final long theVersion) {
    rows = Collections.unmodifiableList(theRows);
    byFacility = index(theRows, OutageView::facilityId);
    byPlantKey = index(theRows, OutageView::plantKey);
    version = theVersion;
    createdAt = Instant.now();
  }

  /**
   * Joins the fact table with both dimensions.
   *
   * @param tables  the modeled tables, never null
   * @param version the version number to assign
   *
   * @return the snapshot, never null
   *
   * @throws OutageWatchException if a fact references a plant or date that
   *                              does not exist
   */
  public static OutageViewSnapshot join(final ModeledTables tables,
      final long version) {
    Objects.requireNonNull(tables, "tables must not be null");

    final Map<Integer, DimPlant> plants = new HashMap<>();
    for (final DimPlant plant : tables.plants()) {
      plants.put(plant.plantKey(), plant);
    }
    final Map<Integer, DimDate> dates = new HashMap<>();
    for (final DimDate date : tables.dates()) {
      dates.put(date.dateKey(), date);
    }

    final List<OutageView> joined = new ArrayList<>(tables.facts().size());
    for (final FactOutage fact : tables.facts()) {
      final DimPlant plant = plants.get(fact.plantKey());
      final DimDate date = dates.get(fact.dateKey());
      if (plant == null || date == null) {
        throw new OutageWatchException("Modeled store is inconsistent:"
            + " fact " + fact.outageKey() + " references plant "
            + fact.plantKey() + " and date " + fact.dateKey());
      }
      joined.add(new OutageView(fact.outageKey(), fact.eiaOutageId(),
          plant.plantKey(), plant.facilityId(), plant.plantName(),
          fact.generator(), "Unit " + fact.generator(), date.dateKey(),
          date.date(), fact.outageStart(), fact.outageEnd(),
          fact.durationHours(), fact.capacityAffectedMw()));
    }
    joined.sort(SERVING_ORDER);
    return new OutageViewSnapshot(joined, version);
  }

  /**
   * Returns the smallest list of rows that can contain every match of the
   * given filter, in serving order.
   *
   * @param filter the filter, never null
   * @return the candidate rows, never null
   */
  List<OutageView> candidates(final OutageFilter filter) {
    if (filter.plantKey().isPresent()) {
      return byPlantKey.getOrDefault(filter.plantKey().get(), List.of());
    }
    if (filter.facilityId().isPresent()) {
      return byFacility.getOrDefault(filter.facilityId().get(), List.of());
    }
    return rows;
  }

  /** @return every joined row in serving order, never null */
  public List<OutageView> rows() {
    return rows;
  }

  /** @return the version of this snapshot */
  public long version() {
    return version;
  }

  /** @return when this snapshot was built, never null */
  public Instant createdAt() {
    return createdAt;
  }

  private static <K> Map<K, List<OutageView>> index(
      final List<OutageView> rows,
      final Function<OutageView, K> keyFn) {
    final Map<K, List<OutageView>> index = new HashMap<>();
    for (final OutageView row : rows) {
      index.computeIfAbsent(keyFn.apply(row), k -> new ArrayList<>()).add(row);
    }
    index.replaceAll((k, v) -> Collections.unmodifiableList(v));
    return Collections.unmodifiableMap(index);
  }
}
