package org.waabox.outagewatch.raw;

import java.util.List;

/**
 * The persistent home of the raw observations extracted from the upstream
 * feed.
 *
 * <p>Implementations define where the rows live (a local file, an object
 * store) and in which format. Callers rely only on two guarantees:
 * {@link #load()} returns the rows in the order they were saved, and
 * {@link #save(List)} replaces the stored rows as a unit, so a failed save
 * leaves the previous content readable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RawStore {

  /**
   * Returns whether any rows have ever been saved.
   *
   * @return true if the store holds a saved result
   */
  boolean exists();

  /**
   * Loads all stored rows.
   *
   * @return the stored rows in saved order, empty if the store does not
   *         exist yet, never null
   */
  List<RawObservation> load();

  /**
   * Replaces the stored rows with the given ones.
   *
   * @param rows the rows to persist, never null
   */
  void save(List<RawObservation> rows);
}
