package org.waabox.outagewatch.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.outagewatch.raw.RawObservation;

/**
 * Tests for {@link StarSchemaBuilder}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StarSchemaBuilderTest {

  private final StarSchemaBuilder builder = new StarSchemaBuilder();

  @Test
  void whenBuilding_givenGapInDays_shouldSplitIntoTwoEvents() {
    final StarSchema schema = builder.build(List.of(
        row("2025-01-05", "1715", "1", "Palo Verde", 1311.0),
        row("2025-01-03", "1715", "1", "Palo Verde", 1311.0),
        row("2025-01-02", "1715", "1", "Palo Verde", 900.0),
        row("2025-01-01", "1715", "1", "Palo Verde", 600.0)));

    final List<FactOutage> facts = schema.tables().facts();
    assertEquals(2, facts.size());

    final FactOutage first = facts.get(0);
    assertEquals(1, first.outageKey());
    assertEquals(LocalDateTime.of(2025, 1, 1, 0, 0), first.outageStart());
    assertEquals(LocalDateTime.of(2025, 1, 4, 0, 0), first.outageEnd());
    assertEquals(72.0, first.durationHours());
    assertEquals(1311.0, first.capacityAffectedMw());
    assertEquals(20250101, first.dateKey());
    assertEquals("1715-1-20250101", first.eiaOutageId());

    final FactOutage second = facts.get(1);
    assertEquals(LocalDateTime.of(2025, 1, 5, 0, 0), second.outageStart());
    assertEquals(LocalDateTime.of(2025, 1, 6, 0, 0), second.outageEnd());
    assertEquals(24.0, second.durationHours());

    assertEquals(List.of(DimDate.of(LocalDate.of(2025, 1, 1)),
        DimDate.of(LocalDate.of(2025, 1, 5))), schema.tables().dates());
    assertEquals(List.of(new DimPlant(1, "1715", "Palo Verde")),
        schema.tables().plants());
  }

  @Test
  void whenBuilding_givenEvents_shouldCoverExactlyTheObservedDays() {
    final List<RawObservation> rows = new ArrayList<>();
    final int[] days = {1, 2, 3, 7, 8, 15, 20, 21, 22, 23};
    for (final int day : days) {
      rows.add(row(LocalDate.of(2025, 3, day).toString(), "46", "2",
          "Browns Ferry", null));
    }

    final List<FactOutage> facts = builder.build(rows).tables().facts();

    final List<LocalDate> covered = new ArrayList<>();
    for (final FactOutage fact : facts) {
      LocalDate day = fact.outageStart().toLocalDate();
      while (day.isBefore(fact.outageEnd().toLocalDate())) {
        covered.add(day);
        day = day.plusDays(1);
      }
      assertEquals(Duration.between(fact.outageStart(), fact.outageEnd())
          .toHours(), (long) fact.durationHours());
      assertNull(fact.capacityAffectedMw());
    }
    final List<LocalDate> expected = new ArrayList<>();
    for (final int day : days) {
      expected.add(LocalDate.of(2025, 3, day));
    }
    assertEquals(4, facts.size());
    assertEquals(expected, covered);
  }

  @Test
  void whenBuilding_givenDuplicateDays_shouldNotStretchEvents() {
    final StarSchema schema = builder.build(List.of(
        row("2025-01-02", "1715", "1", "Palo Verde", 100.0),
        row("2025-01-02", "1715", "1", "Palo Verde", 400.0),
        row("2025-01-01", "1715", "1", "Palo Verde", null)));

    final FactOutage fact = schema.tables().facts().get(0);
    assertEquals(1, schema.tables().facts().size());
    assertEquals(48.0, fact.durationHours());
    assertEquals(400.0, fact.capacityAffectedMw());
  }

  @Test
  void whenBuilding_givenSeveralPlants_shouldKeyThemInFacilityOrder() {
    final StarSchema schema = builder.build(List.of(
        row("2025-01-01", "1715", "1", "Palo Verde", null),
        row("2025-01-01", "46", "1", "Browns Ferry", null),
        row("2025-01-01", "204", "1", null, null),
        row("2025-01-02", "46", "10", "Browns Ferry", null),
        row("2025-01-02", "46", "2", "Browns Ferry", null)));

    final List<DimPlant> plants = schema.tables().plants();
    assertEquals("46", plants.get(0).facilityId());
    assertEquals("204", plants.get(1).facilityId());
    assertNull(plants.get(1).plantName());
    assertEquals(3, plants.get(2).plantKey());
    assertEquals("1715", plants.get(2).facilityId());

    final List<FactOutage> facts = schema.tables().facts();
    assertEquals(5, facts.size());
    assertEquals("1", facts.get(0).generator());
    assertEquals("2", facts.get(1).generator());
    assertEquals("10", facts.get(2).generator());
    for (int i = 0; i < facts.size(); i++) {
      assertEquals(i + 1, facts.get(i).outageKey());
    }
  }

  @Test
  void whenBuilding_givenRenamedPlant_shouldUseTheLatestName() {
    final StarSchema schema = builder.build(List.of(
        row("2025-01-01", "1715", "1", "Old name", null),
        row("2025-02-01", "1715", "1", "Palo Verde", null),
        row("2025-03-01", "1715", "1", null, null)));

    assertEquals("Palo Verde", schema.tables().plants().get(0).plantName());
  }

  @Test
  void whenBuilding_givenRowsWithoutKey_shouldSkipAndCountThem() {
    final StarSchema schema = builder.build(List.of(
        row("2025-01-01", "1715", "1", "Palo Verde", null),
        new RawObservation(null, "1715", "Palo Verde", "1", null, null, null),
        new RawObservation(LocalDate.of(2025, 1, 2), "1715", null, " ", null,
            null, null)));

    assertEquals(2, schema.skippedRows());
    assertEquals(1, schema.tables().facts().size());
  }

  @Test
  void whenBuilding_givenSameInputTwice_shouldProduceEqualTables() {
    final List<RawObservation> rows = List.of(
        row("2025-01-02", "46", "1", "Browns Ferry", 10.0),
        row("2025-01-01", "1715", "2", "Palo Verde", 20.0),
        row("2025-01-01", "46", "1", "Browns Ferry", 30.0));

    assertEquals(builder.build(rows).tables(),
        builder.build(List.of(rows.get(2), rows.get(0), rows.get(1)))
            .tables());
  }

  @Test
  void whenBuilding_givenNoRows_shouldProduceEmptyTables() {
    final StarSchema schema = builder.build(List.of());

    assertTrue(schema.tables().plants().isEmpty());
    assertTrue(schema.tables().dates().isEmpty());
    assertTrue(schema.tables().facts().isEmpty());
  }

  @Test
  void whenCreatingDate_givenSaturday_shouldFlagWeekend() {
    final DimDate date = DimDate.of(LocalDate.of(2025, 1, 4));

    assertEquals(20250104, date.dateKey());
    assertEquals("Saturday", date.dayOfWeek());
    assertTrue(date.weekend());
  }

  private static RawObservation row(final String period,
      final String facility, final String generator, final String name,
      final Double outage) {
    return new RawObservation(LocalDate.parse(period), facility, name,
        generator, 1311.0, outage, outage == null ? null : 100.0);
  }
}
