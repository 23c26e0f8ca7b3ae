package org.waabox.outagewatch.model;

import java.util.Comparator;

/**
 * Orders upstream identifiers (facility ids, generator ids) the way a
 * reader expects: numerically when both sides are plain digit strings,
 * lexicographically otherwise, with numbers first.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class IdentifierOrder {

  /** The comparator, null-hostile. */
  public static final Comparator<String> NATURAL = IdentifierOrder::compare;

  /** Private constructor to prevent instantiation. */
  private IdentifierOrder() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Compares two identifiers.
   *
   * @param a the first identifier, never null
   * @param b the second identifier, never null
   * @return a negative, zero or positive number as a sorts before, equal to
   *         or after b
   */
  private static int compare(final String a, final String b) {
    final boolean aNumeric = isDigits(a);
    final boolean bNumeric = isDigits(b);
    if (aNumeric && bNumeric) {
      final String ta = stripLeadingZeros(a);
      final String tb = stripLeadingZeros(b);
      if (ta.length() != tb.length()) {
        return Integer.compare(ta.length(), tb.length());
      }
      final int cmp = ta.compareTo(tb);
      return cmp != 0 ? cmp : a.compareTo(b);
    }
    if (aNumeric != bNumeric) {
      return aNumeric ? -1 : 1;
    }
    return a.compareTo(b);
  }

  private static boolean isDigits(final String value) {
    if (value.isEmpty()) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isDigit(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static String stripLeadingZeros(final String value) {
    int i = 0;
    while (i < value.length() - 1 && value.charAt(i) == '0') {
      i++;
    }
    return value.substring(i);
  }
}
