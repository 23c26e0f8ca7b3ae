package org.waabox.outagewatch.store.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.BuildException;
import org.waabox.outagewatch.ModeledDataNotFoundException;
import org.waabox.outagewatch.SwapException;
import org.waabox.outagewatch.model.DimDate;
import org.waabox.outagewatch.model.DimPlant;
import org.waabox.outagewatch.model.FactOutage;
import org.waabox.outagewatch.model.ModeledStore;
import org.waabox.outagewatch.model.ModeledTables;
import org.waabox.outagewatch.model.StagedTables;

/**
 * A {@link ModeledStore} that keeps the three tables as CSV files in one
 * directory.
 *
 * <p>Storage layout:
 * <pre>
 * {parent}/
 *   {name}/                     live tables
 *     dim_plant.csv
 *     dim_date.csv
 *     fact_outage.csv
 *   .{name}.tmp-{uuid}/         a staged build
 *   .{name}.bak-{uuid}/         the previous live tables, during a swap
 * </pre>
 *
 * <p>Staging directories are siblings of the live one, so a swap is two
 * renames on the same filesystem: live to backup, then staging to live. If
 * the second rename fails the backup is renamed back. The backup is deleted
 * once the new tables are in place.
 *
 * <p>The store does not lock. Readers must not load while a swap runs; the
 * query cache guarantees this by swapping under its load lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemModeledStore implements ModeledStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemModeledStore.class);

  /** The plant dimension file name. */
  static final String PLANT_FILE = "dim_plant.csv";

  /** The date dimension file name. */
  static final String DATE_FILE = "dim_date.csv";

  /** The fact table file name. */
  static final String FACT_FILE = "fact_outage.csv";

  /** The plant dimension layout. */
  private static final CsvTable PLANTS = new CsvTable(
      "PlantKey", "EIA_FacilityID", "PlantName");

  /** The date dimension layout. */
  private static final CsvTable DATES = new CsvTable(
      "DateKey", "Date", "Year", "Month", "Day", "DayOfWeek", "IsWeekend");

  /** The fact table layout. */
  private static final CsvTable FACTS = new CsvTable(
      "OutageKey", "PlantKey", "DateKey", "Generator",
      "OutageStartTimestamp", "OutageEndTimestamp", "OutageDurationHours",
      "CapacityAffectedMW", "EIA_OutageID");

  /** The live directory. */
  private final Path liveDir;

  /**
   * Creates a new store whose live tables are in the given directory.
   *
   * <p>The parent directory is created if missing.
   *
   * @param theLiveDir the live directory, never null
   *
   * @throws UncheckedIOException if the parent cannot be created
   */
  public FileSystemModeledStore(final Path theLiveDir) {
    liveDir = Objects.requireNonNull(theLiveDir, "liveDir must not be null")
        .toAbsolutePath();
    try {
      Files.createDirectories(liveDir.getParent());
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to create directory: "
          + liveDir.getParent(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean exists() {
    return Files.isRegularFile(liveDir.resolve(PLANT_FILE))
        && Files.isRegularFile(liveDir.resolve(DATE_FILE))
        && Files.isRegularFile(liveDir.resolve(FACT_FILE));
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if a table cannot be read
   */
  @Override
  public ModeledTables load() {
    if (!exists()) {
      throw new ModeledDataNotFoundException("No modeled tables in "
          + liveDir + "; run POST /refresh to build them");
    }
    try {
      return readTables(liveDir);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read modeled tables from "
          + liveDir, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public StagedTables stage(final ModeledTables tables) {
    Objects.requireNonNull(tables, "tables must not be null");
    final Path staging = sibling("tmp");
    try {
      Files.createDirectory(staging);
      PLANTS.write(staging.resolve(PLANT_FILE), plantCells(tables));
      DATES.write(staging.resolve(DATE_FILE), dateCells(tables));
      FACTS.write(staging.resolve(FACT_FILE), factCells(tables));
    } catch (final IOException | RuntimeException e) {
      deleteTree(staging);
      throw new BuildException("Failed to stage modeled tables in "
          + staging, e);
    }
    log.info("Staged modeled tables in {}", staging);
    return new StagedTables(staging.toString(), tables.plants().size(),
        tables.dates().size(), tables.facts().size());
  }

  /** {@inheritDoc} */
  @Override
  public void swap(final StagedTables staged) {
    Objects.requireNonNull(staged, "staged must not be null");
    final Path staging = Path.of(staged.location());
    if (!Files.isDirectory(staging)
        || !staging.getParent().equals(liveDir.getParent())) {
      throw new SwapException("Not a staging directory of this store: "
          + staging);
    }

    Path backup = null;
    try {
      if (Files.exists(liveDir)) {
        backup = sibling("bak");
        Files.move(liveDir, backup, StandardCopyOption.ATOMIC_MOVE);
      }
      Files.move(staging, liveDir, StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      restore(backup);
      throw new SwapException("Failed to swap " + staging + " into "
          + liveDir, e);
    }

    log.info("Swapped modeled tables into {}", liveDir);
    if (backup != null) {
      deleteTree(backup);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void discard(final StagedTables staged) {
    Objects.requireNonNull(staged, "staged must not be null");
    final Path staging = Path.of(staged.location());
    if (staging.equals(liveDir)) {
      log.warn("Refusing to discard the live directory {}", liveDir);
      return;
    }
    deleteTree(staging);
    log.debug("Discarded staged tables in {}", staging);
  }

  /** @return the live directory, never null */
  public Path liveDir() {
    return liveDir;
  }

  /**
   * Puts the backup back after a failed swap.
   *
   * @param backup the backup directory, null when there was no live one
   */
  private void restore(final Path backup) {
    if (backup == null || Files.exists(liveDir)) {
      return;
    }
    try {
      Files.move(backup, liveDir, StandardCopyOption.ATOMIC_MOVE);
      log.warn("Swap failed; previous tables restored into {}", liveDir);
    } catch (final IOException e) {
      log.error("Swap failed and the previous tables could not be restored;"
          + " they remain in {}", backup, e);
    }
  }

  private Path sibling(final String kind) {
    return liveDir.resolveSibling("." + liveDir.getFileName() + "." + kind
        + "-" + UUID.randomUUID());
  }

  private static ModeledTables readTables(final Path dir) throws IOException {
    final List<DimPlant> plants = new ArrayList<>();
    for (final Map<String, String> row : PLANTS.read(
        dir.resolve(PLANT_FILE))) {
      plants.add(new DimPlant(Integer.parseInt(row.get("PlantKey")),
          row.get("EIA_FacilityID"), row.get("PlantName")));
    }

    final List<DimDate> dates = new ArrayList<>();
    for (final Map<String, String> row : DATES.read(dir.resolve(DATE_FILE))) {
      dates.add(new DimDate(Integer.parseInt(row.get("DateKey")),
          LocalDate.parse(row.get("Date")),
          Integer.parseInt(row.get("Year")),
          Integer.parseInt(row.get("Month")),
          Integer.parseInt(row.get("Day")),
          row.get("DayOfWeek"),
          Boolean.parseBoolean(row.get("IsWeekend"))));
    }

    final List<FactOutage> facts = new ArrayList<>();
    for (final Map<String, String> row : FACTS.read(dir.resolve(FACT_FILE))) {
      final String capacity = row.get("CapacityAffectedMW");
      facts.add(new FactOutage(Integer.parseInt(row.get("OutageKey")),
          Integer.parseInt(row.get("PlantKey")),
          Integer.parseInt(row.get("DateKey")),
          row.get("Generator"),
          LocalDateTime.parse(row.get("OutageStartTimestamp")),
          LocalDateTime.parse(row.get("OutageEndTimestamp")),
          Double.parseDouble(row.get("OutageDurationHours")),
          capacity == null ? null : Double.valueOf(capacity),
          row.get("EIA_OutageID")));
    }
    return new ModeledTables(plants, dates, facts);
  }

  private static List<String[]> plantCells(final ModeledTables tables) {
    final List<String[]> cells = new ArrayList<>(tables.plants().size());
    for (final DimPlant plant : tables.plants()) {
      cells.add(new String[] {
          String.valueOf(plant.plantKey()), plant.facilityId(),
          plant.plantName()});
    }
    return cells;
  }

  private static List<String[]> dateCells(final ModeledTables tables) {
    final List<String[]> cells = new ArrayList<>(tables.dates().size());
    for (final DimDate date : tables.dates()) {
      cells.add(new String[] {
          String.valueOf(date.dateKey()), date.date().toString(),
          String.valueOf(date.year()), String.valueOf(date.month()),
          String.valueOf(date.day()), date.dayOfWeek(),
          String.valueOf(date.weekend())});
    }
    return cells;
  }

  private static List<String[]> factCells(final ModeledTables tables) {
    final List<String[]> cells = new ArrayList<>(tables.facts().size());
    for (final FactOutage fact : tables.facts()) {
      cells.add(new String[] {
          String.valueOf(fact.outageKey()), String.valueOf(fact.plantKey()),
          String.valueOf(fact.dateKey()), fact.generator(),
          fact.outageStart().toString(), fact.outageEnd().toString(),
          String.valueOf(fact.durationHours()),
          fact.capacityAffectedMw() == null
              ? null : fact.capacityAffectedMw().toString(),
          fact.eiaOutageId()});
    }
    return cells;
  }

  /**
   * Deletes a directory tree, logging instead of throwing.
   *
   * @param root the directory to delete, never null
   */
  private static void deleteTree(final Path root) {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> {
        try {
          Files.delete(path);
        } catch (final IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (final IOException | UncheckedIOException e) {
      log.warn("Could not fully remove {}", root, e);
    }
  }
}
