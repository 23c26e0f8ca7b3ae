package org.waabox.outagewatch.model;

/**
 * The persistent home of the star-schema tables.
 *
 * <p>The three tables are replaced as one unit. A build is first written to
 * a staging location with {@link #stage(ModeledTables)}; it becomes visible
 * only through {@link #swap(StagedTables)}, which must be all-or-nothing:
 * a reader loading concurrently sees either the previous tables or the new
 * ones, and a failed swap leaves the previous tables in place.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ModeledStore {

  /**
   * Returns whether live tables exist.
   *
   * @return true if a build has been swapped in at least once
   */
  boolean exists();

  /**
   * Loads the live tables.
   *
   * @return the live tables, never null
   *
   * @throws org.waabox.outagewatch.ModeledDataNotFoundException if no
   *         build has been swapped in yet
   */
  ModeledTables load();

  /**
   * Writes tables to a fresh staging location, distinct from the live one
   * and from any other staging location.
   *
   * @param tables the tables to stage, never null
   *
   * @return the handle of the staged tables, never null
   *
   * @throws org.waabox.outagewatch.BuildException if writing fails; the
   *         partial staging location is removed
   */
  StagedTables stage(ModeledTables tables);

  /**
   * Makes staged tables live, replacing the current live tables as a unit.
   *
   * @param staged the handle returned by {@link #stage}, never null
   *
   * @throws org.waabox.outagewatch.SwapException if the replacement fails;
   *         the previous live tables are left in place
   */
  void swap(StagedTables staged);

  /**
   * Removes staged tables that will not be swapped in.
   *
   * <p>Never throws; failures are logged.
   *
   * @param staged the handle returned by {@link #stage}, never null
   */
  void discard(StagedTables staged);
}
