package org.waabox.outagewatch.connector;

/**
 * The outcome of one successful extraction run.
 *
 * @param incremental       whether the run merged into an existing store
 * @param pagesFetched      the number of pages requested from the source
 * @param rowsFetched       the number of rows the source returned
 * @param rowsAdded         the number of rows with a key not seen before
 * @param rowsSkipped       the number of rows rejected by validation
 * @param duplicatesDropped the number of rows whose key was already known
 * @param earlyStopped      whether paging ended on the early-stop rule
 * @param totalRows         the number of rows in the raw store afterwards
 * @param storeWritten      whether the raw store was rewritten
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ExtractionResult(
    boolean incremental,
    int pagesFetched,
    int rowsFetched,
    int rowsAdded,
    int rowsSkipped,
    int duplicatesDropped,
    boolean earlyStopped,
    int totalRows,
    boolean storeWritten
) {
}
