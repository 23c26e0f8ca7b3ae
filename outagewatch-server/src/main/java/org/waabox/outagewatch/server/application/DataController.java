package org.waabox.outagewatch.server.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.outagewatch.query.OutageCatalog;
import org.waabox.outagewatch.query.OutageFilter;
import org.waabox.outagewatch.query.PageRequest;
import org.waabox.outagewatch.query.QueryResult;

/** REST controller that serves the joined outage view.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
public class DataController {

  /** The cached outage view, never null. */
  private final OutageCatalog catalog;

  /** Creates a new DataController.
   *
   * @param theCatalog the outage view cache, never null
   */
  public DataController(final OutageCatalog theCatalog) {
    catalog = Objects.requireNonNull(theCatalog, "catalog cannot be null");
  }

  /** Returns one page of outages, newest start first.
   *
   * <p>All filters are optional and combined. Dates are {@code YYYY-MM-DD}
   * and bound the outage start date, both ends inclusive. {@code limit}
   * above 1000 is served as 1000.
   *
   * @param page the 1-based page, defaults to 1
   * @param limit the page size, defaults to 100
   * @param startDate the earliest start date, may be null
   * @param endDate the latest start date, may be null
   * @param facilityId the exact facility id, may be null
   * @param generator the exact generator id, may be null
   * @param plantKey the exact plant key, may be null
   * @param plantName a case-insensitive plant name fragment, may be null
   *
   * @return {@code page}, {@code limit}, {@code total_count} and
   *         {@code data}, never null
   */
  @GetMapping("/data")
  public Map<String, Object> data(
      @RequestParam(name = "page", required = false) final Integer page,
      @RequestParam(name = "limit", required = false) final Integer limit,
      @RequestParam(name = "start_date", required = false)
          final String startDate,
      @RequestParam(name = "end_date", required = false)
          final String endDate,
      @RequestParam(name = "facility_id", required = false)
          final String facilityId,
      @RequestParam(name = "generator", required = false)
          final String generator,
      @RequestParam(name = "plant_key", required = false)
          final Integer plantKey,
      @RequestParam(name = "plant_name", required = false)
          final String plantName) {

    final PageRequest pageRequest = PageRequest.of(page, limit);
    final OutageFilter filter = OutageFilter.builder()
        .facilityId(facilityId)
        .generator(generator)
        .plantKey(plantKey)
        .plantName(plantName)
        .startDate(OutageFilter.parseDate("start_date", startDate))
        .endDate(OutageFilter.parseDate("end_date", endDate))
        .build();

    final QueryResult result = catalog.query(filter, pageRequest);

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("page", result.page());
    body.put("limit", result.limit());
    body.put("total_count", result.totalCount());
    body.put("data", result.rows());
    return body;
  }
}
