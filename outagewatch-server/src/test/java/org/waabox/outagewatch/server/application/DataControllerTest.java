package org.waabox.outagewatch.server.application;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import org.waabox.outagewatch.metrics.NoopOutageWatchMetrics;
import org.waabox.outagewatch.model.DimDate;
import org.waabox.outagewatch.model.DimPlant;
import org.waabox.outagewatch.model.FactOutage;
import org.waabox.outagewatch.model.ModeledTables;
import org.waabox.outagewatch.query.OutageCatalog;
import org.waabox.outagewatch.store.fs.FileSystemModeledStore;

/** Tests for {@link DataController}, through MockMvc with the exception
 * handler and the token check in place.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DataControllerTest {

  @TempDir
  Path dir;

  private FileSystemModeledStore store;

  @BeforeEach
  void setUp() {
    store = new FileSystemModeledStore(dir.resolve("modeled"));
  }

  @Test
  void whenQuerying_givenNoParameters_shouldReturnNewestFirstWithDefaults()
      throws Exception {
    build();

    mvc(null).perform(get("/data"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.page").value(1))
        .andExpect(jsonPath("$.limit").value(100))
        .andExpect(jsonPath("$.total_count").value(3))
        .andExpect(jsonPath("$.data", hasSize(3)))
        .andExpect(jsonPath("$.data[0].OutageKey").value(2))
        .andExpect(jsonPath("$.data[1].OutageKey").value(3))
        .andExpect(jsonPath("$.data[2].OutageKey").value(1))
        .andExpect(jsonPath("$.data[0].UnitName").value("Unit 1"))
        .andExpect(jsonPath("$.data[0].EIA_FacilityID").value("1715"))
        .andExpect(jsonPath("$.data[0].PlantName").value("Palo Verde"))
        .andExpect(jsonPath("$.data[2].OutageDurationHours").value(72.0));
  }

  @Test
  void whenQuerying_givenFacilityWithoutRows_shouldReturnEmptyPage()
      throws Exception {
    build();

    mvc(null).perform(get("/data?facility_id=9999&page=1&limit=50"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_count").value(0))
        .andExpect(jsonPath("$.data", hasSize(0)));
  }

  @Test
  void whenQuerying_givenFacility_shouldReturnOnlyItsOutages()
      throws Exception {
    build();

    mvc(null).perform(get("/data?facility_id=1715"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_count").value(2))
        .andExpect(jsonPath("$.data[0].OutageKey").value(2))
        .andExpect(jsonPath("$.data[1].OutageKey").value(1));
  }

  @Test
  void whenQuerying_givenPlantNameFragment_shouldMatchIgnoringCase()
      throws Exception {
    build();

    mvc(null).perform(get("/data?plant_name=BROWNS"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_count").value(1))
        .andExpect(jsonPath("$.data[0].PlantName").value("Browns Ferry"));
  }

  @Test
  void whenQuerying_givenDateRange_shouldFilterOnStartDate()
      throws Exception {
    build();

    mvc(null).perform(get("/data?start_date=2025-01-02&end_date=2025-01-04"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_count").value(1))
        .andExpect(jsonPath("$.data[0].OutageKey").value(3));
  }

  @Test
  void whenQuerying_givenSecondPage_shouldReturnRemainingRows()
      throws Exception {
    build();

    mvc(null).perform(get("/data?page=2&limit=2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_count").value(3))
        .andExpect(jsonPath("$.data", hasSize(1)))
        .andExpect(jsonPath("$.data[0].OutageKey").value(1));
  }

  @Test
  void whenQuerying_givenLimitAboveMaximum_shouldClampTo1000()
      throws Exception {
    build();

    mvc(null).perform(get("/data?limit=5000"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.limit").value(1000))
        .andExpect(jsonPath("$.data", hasSize(3)));
  }

  @Test
  void whenQuerying_givenInvalidParameters_shouldReturnBadRequest()
      throws Exception {
    build();
    final MockMvc mvc = mvc(null);

    mvc.perform(get("/data?page=0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
    mvc.perform(get("/data?limit=0"))
        .andExpect(status().isBadRequest());
    mvc.perform(get("/data?plant_key=0"))
        .andExpect(status().isBadRequest());
    mvc.perform(get("/data?start_date=01-02-2025"))
        .andExpect(status().isBadRequest());
    mvc.perform(get("/data?start_date=2025-02-01&end_date=2025-01-01"))
        .andExpect(status().isBadRequest());
    mvc.perform(get("/data?page=abc"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void whenQuerying_givenNothingBuilt_shouldReturnNotFound()
      throws Exception {
    mvc(null).perform(get("/data"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void whenQuerying_givenTokenConfigured_shouldRequireIt() throws Exception {
    build();
    final MockMvc mvc = mvc("s3cret");

    mvc.perform(get("/data"))
        .andExpect(status().isUnauthorized());
    mvc.perform(get("/data").header("Authorization", "Bearer wrong"))
        .andExpect(status().isForbidden());
    mvc.perform(get("/data").header("Authorization", "Bearer s3cret"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_count").value(3));
  }

  private MockMvc mvc(final String token) {
    final OutageCatalog catalog = new OutageCatalog(store,
        NoopOutageWatchMetrics.INSTANCE);
    return MockMvcBuilders.standaloneSetup(new DataController(catalog))
        .setControllerAdvice(new ApiExceptionHandler())
        .addInterceptors(new BearerTokenInterceptor(token))
        .build();
  }

  private void build() {
    final LocalDate jan1 = LocalDate.of(2025, 1, 1);
    final LocalDate jan3 = LocalDate.of(2025, 1, 3);
    final LocalDate jan5 = LocalDate.of(2025, 1, 5);
    final ModeledTables tables = new ModeledTables(
        List.of(new DimPlant(1, "1715", "Palo Verde"),
            new DimPlant(2, "46", "Browns Ferry")),
        List.of(DimDate.of(jan1), DimDate.of(jan3), DimDate.of(jan5)),
        List.of(
            new FactOutage(1, 1, 20250101, "1", jan1.atStartOfDay(),
                jan1.plusDays(3).atStartOfDay(), 72.0, 1311.0,
                "1715-1-20250101"),
            new FactOutage(2, 1, 20250105, "1", jan5.atStartOfDay(),
                jan5.plusDays(1).atStartOfDay(), 24.0, 1311.0,
                "1715-1-20250105"),
            new FactOutage(3, 2, 20250103, "2", jan3.atStartOfDay(),
                jan3.plusDays(1).atStartOfDay(), 24.0, null,
                "46-2-20250103")));
    store.swap(store.stage(tables));
  }
}
