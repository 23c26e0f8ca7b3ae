package org.waabox.outagewatch.raw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.waabox.outagewatch.ValidationException;

/**
 * Tests for {@link RawObservationCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RawObservationCodecTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void whenDecoding_givenCompleteRow_shouldReadEveryField() throws Exception {
    final RawObservation row = RawObservationCodec.decode(json(
        "{\"period\":\"2025-01-03\",\"facility\":\"1715\","
        + "\"facilityName\":\"Palo Verde\",\"generator\":\"1\","
        + "\"capacity\":\"1311.0\",\"outage\":655.5,\"percentOutage\":\"50\","
        + "\"facility-name\":\"ignored\"}"));

    assertEquals(LocalDate.of(2025, 1, 3), row.period());
    assertEquals("1715", row.facility());
    assertEquals("Palo Verde", row.facilityName());
    assertEquals("1", row.generator());
    assertEquals(1311.0, row.capacity());
    assertEquals(655.5, row.outage());
    assertEquals(50.0, row.percentOutage());
    assertTrue(row.hasNaturalKey());
  }

  @Test
  void whenDecoding_givenMissingOptionalFields_shouldReadNulls()
      throws Exception {
    final RawObservation row = RawObservationCodec.decode(json(
        "{\"period\":\"2025-01-03\",\"facility\":\"46\",\"generator\":\"2\","
        + "\"outage\":\"n/a\",\"capacity\":null}"));

    assertNull(row.facilityName());
    assertNull(row.capacity());
    assertNull(row.outage());
    assertNull(row.percentOutage());
  }

  @Test
  void whenDecoding_givenBlankGenerator_shouldRejectRow() throws Exception {
    final ValidationException e = assertThrows(ValidationException.class,
        () -> RawObservationCodec.decode(json(
            "{\"period\":\"2025-01-03\",\"facility\":\"46\","
            + "\"generator\":\"  \"}")));

    assertEquals(RawObservationCodec.GENERATOR, e.field());
  }

  @Test
  void whenDecoding_givenMissingPeriod_shouldRejectRow() throws Exception {
    assertThrows(ValidationException.class,
        () -> RawObservationCodec.decode(json(
            "{\"facility\":\"46\",\"generator\":\"1\"}")));
  }

  @Test
  void whenParsingPeriod_givenDateTime_shouldKeepTheDate() {
    assertEquals(LocalDate.of(2025, 1, 3),
        RawObservationCodec.parsePeriod("2025-01-03T00:00:00"));
    assertEquals(LocalDate.of(2025, 1, 3),
        RawObservationCodec.parsePeriod(" 2025-01-03 12:00 "));
  }

  @Test
  void whenParsingPeriod_givenGarbage_shouldThrow() {
    assertThrows(ValidationException.class,
        () -> RawObservationCodec.parsePeriod("2025-13-45"));
    assertThrows(ValidationException.class,
        () -> RawObservationCodec.parsePeriod("yesterday"));
  }

  private static JsonNode json(final String text) throws Exception {
    return MAPPER.readTree(text);
  }
}
