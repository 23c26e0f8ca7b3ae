package org.waabox.outagewatch.store.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.outagewatch.ValidationException;
import org.waabox.outagewatch.raw.RawObservation;
import org.waabox.outagewatch.raw.RawObservationCodec;
import org.waabox.outagewatch.raw.RawStore;

/**
 * A {@link RawStore} kept in a single CSV file on the local filesystem.
 *
 * <p>Columns use the upstream field names: {@code period}, {@code facility},
 * {@code facilityName}, {@code generator}, {@code capacity}, {@code outage},
 * {@code percentOutage}.
 *
 * <p>Writes use an atomic pattern: rows are written to a temporary file next
 * to the target and then renamed over it. If the process dies mid-write the
 * previous file remains intact.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CsvRawStore implements RawStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(CsvRawStore.class);

  /** The table layout. */
  private static final CsvTable TABLE = new CsvTable(
      RawObservationCodec.PERIOD,
      RawObservationCodec.FACILITY,
      RawObservationCodec.FACILITY_NAME,
      RawObservationCodec.GENERATOR,
      RawObservationCodec.CAPACITY,
      RawObservationCodec.OUTAGE,
      RawObservationCodec.PERCENT_OUTAGE);

  /** The CSV file. */
  private final Path file;

  /**
   * Creates a new store backed by the given file.
   *
   * <p>The parent directory is created if missing; the file itself is only
   * created by the first {@link #save(List)}.
   *
   * @param theFile the CSV file, never null
   *
   * @throws UncheckedIOException if the parent directory cannot be created
   */
  public CsvRawStore(final Path theFile) {
    file = Objects.requireNonNull(theFile, "file must not be null")
        .toAbsolutePath();
    try {
      Files.createDirectories(file.getParent());
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create raw store directory: " + file.getParent(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean exists() {
    return Files.isRegularFile(file);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Empty cells read as null. A row whose period cannot be parsed is
   * kept with a null period, so it counts as a row without a key.
   *
   * @throws UncheckedIOException if the file cannot be read
   */
  @Override
  public List<RawObservation> load() {
    if (!exists()) {
      return List.of();
    }
    try {
      final List<Map<String, String>> rows = TABLE.read(file);
      final List<RawObservation> result = new ArrayList<>(rows.size());
      for (final Map<String, String> row : rows) {
        result.add(toObservation(row));
      }
      log.debug("Loaded {} raw rows from {}", result.size(), file);
      return result;
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read raw store: " + file, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if writing to the filesystem fails; the
   *                              previous file is left in place
   */
  @Override
  public void save(final List<RawObservation> rows) {
    Objects.requireNonNull(rows, "rows must not be null");

    final List<String[]> cells = new ArrayList<>(rows.size());
    for (final RawObservation row : rows) {
      cells.add(new String[] {
          row.period() == null ? null : row.period().toString(),
          row.facility(),
          row.facilityName(),
          row.generator(),
          format(row.capacity()),
          format(row.outage()),
          format(row.percentOutage())
      });
    }

    final Path temp = file.resolveSibling(file.getFileName() + ".tmp-"
        + UUID.randomUUID());
    try {
      TABLE.write(temp, cells);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      log.info("Saved {} raw rows to {}", rows.size(), file);
    } catch (final IOException e) {
      deleteQuietly(temp);
      throw new UncheckedIOException("Failed to save raw store: " + file, e);
    }
  }

  /** @return the CSV file backing this store, never null */
  public Path file() {
    return file;
  }

  private static RawObservation toObservation(final Map<String, String> row) {
    LocalDate period = null;
    final String periodText = row.get(RawObservationCodec.PERIOD);
    if (periodText != null) {
      try {
        period = RawObservationCodec.parsePeriod(periodText);
      } catch (final ValidationException e) {
        log.warn("Raw store row with unreadable period '{}'", periodText);
      }
    }
    return new RawObservation(period,
        row.get(RawObservationCodec.FACILITY),
        row.get(RawObservationCodec.FACILITY_NAME),
        row.get(RawObservationCodec.GENERATOR),
        parseNumber(row.get(RawObservationCodec.CAPACITY)),
        parseNumber(row.get(RawObservationCodec.OUTAGE)),
        parseNumber(row.get(RawObservationCodec.PERCENT_OUTAGE)));
  }

  private static String format(final Double value) {
    return value == null ? null : value.toString();
  }

  private static Double parseNumber(final String value) {
    if (value == null) {
      return null;
    }
    try {
      return Double.valueOf(value);
    } catch (final NumberFormatException e) {
      log.warn("Raw store cell '{}' is not a number, read as empty", value);
      return null;
    }
  }

  private static void deleteQuietly(final Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (final IOException e) {
      log.warn("Could not remove temporary file {}", path, e);
    }
  }
}
