package org.waabox.outagewatch.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link IdentifierOrder}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class IdentifierOrderTest {

  @Test
  void whenSorting_givenMixedIdentifiers_shouldPutNumbersFirstByValue() {
    final List<String> ids = new ArrayList<>(
        List.of("1715", "A1", "46", "0046", "204", "B", "2"));

    ids.sort(IdentifierOrder.NATURAL);

    assertEquals(List.of("2", "0046", "46", "204", "1715", "A1", "B"), ids);
  }
}
