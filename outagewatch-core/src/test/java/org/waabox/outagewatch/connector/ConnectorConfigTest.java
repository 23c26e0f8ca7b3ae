package org.waabox.outagewatch.connector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConnectorConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConnectorConfigTest {

  @Test
  void whenUsingDefaults_shouldPageFullAndNeverStopEarly() {
    final ConnectorConfig config = ConnectorConfig.defaults();

    assertEquals(5000, config.pageSize());
    assertEquals(0, config.maxRecords());
    assertEquals(3, config.retryPolicy().maxAttempts());
    assertFalse(config.incremental());
    assertFalse(config.earlyStop());
  }

  @Test
  void whenBuilding_givenZeroPageSize_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> ConnectorConfig.builder().pageSize(0).build());
  }

  @Test
  void whenBuilding_givenNegativeCap_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> ConnectorConfig.builder().maxRecords(-1).build());
  }
}
