package org.waabox.outagewatch.store.fs;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Reads and writes one CSV table with a header line.
 *
 * <p>Cells are text; a null cell is written empty and an empty cell is read
 * back as null. Column order on disk follows the table's declared columns,
 * and reading resolves columns by header name.
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class CsvTable {

  /** The shared mapper, thread-safe once configured. */
  private static final CsvMapper MAPPER = new CsvMapper();

  /** The schema used for reading, taking columns from the header. */
  private static final CsvSchema READ_SCHEMA =
      CsvSchema.emptySchema().withHeader();

  /** The declared columns, in file order. */
  private final List<String> columns;

  /** The schema used for writing. */
  private final CsvSchema writeSchema;

  /**
   * Creates a table definition.
   *
   * @param theColumns the column names, in file order, never empty
   */
  CsvTable(final String... theColumns) {
    if (theColumns.length == 0) {
      throw new IllegalArgumentException("a table needs at least one column");
    }
    columns = List.of(theColumns);
    final CsvSchema.Builder builder = CsvSchema.builder();
    for (final String column : theColumns) {
      builder.addColumn(column);
    }
    writeSchema = builder.build().withHeader();
  }

  /**
   * Writes the rows to the given file, replacing it.
   *
   * @param file the target file, never null
   * @param rows the rows, each with one cell per column, never null
   *
   * @throws IOException if the file cannot be written
   */
  void write(final Path file, final List<String[]> rows) throws IOException {
    Objects.requireNonNull(file, "file must not be null");
    Objects.requireNonNull(rows, "rows must not be null");
    // The header is emitted with the first row; an empty table writes the
    // header alone as a plain row.
    final CsvSchema schema = rows.isEmpty()
        ? writeSchema.withoutHeader() : writeSchema;
    try (Writer writer = Files.newBufferedWriter(file,
            StandardCharsets.UTF_8);
        SequenceWriter out = MAPPER.writer(schema).writeValues(writer)) {
      if (rows.isEmpty()) {
        out.write(columns.toArray(new String[0]));
        return;
      }
      for (final String[] row : rows) {
        if (row.length != columns.size()) {
          throw new IllegalArgumentException("row has " + row.length
              + " cells, table has " + columns.size() + " columns");
        }
        out.write(row);
      }
    }
  }

  /**
   * Reads all rows of the given file.
   *
   * <p>Columns missing from the file read as null.
   *
   * @param file the file, never null
   * @return the rows keyed by column name, in file order, never null
   *
   * @throws IOException if the file cannot be read
   */
  List<Map<String, String>> read(final Path file) throws IOException {
    Objects.requireNonNull(file, "file must not be null");
    final List<Map<String, String>> rows = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(file,
            StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> it = MAPPER
            .readerFor(Map.class).with(READ_SCHEMA).readValues(reader)) {
      while (it.hasNextValue()) {
        final Map<String, String> raw = it.nextValue();
        final Map<String, String> row = new HashMap<>();
        for (final String column : columns) {
          row.put(column, blankToNull(raw.get(column)));
        }
        rows.add(row);
      }
    }
    return rows;
  }

  private static String blankToNull(final String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    return value;
  }
}
