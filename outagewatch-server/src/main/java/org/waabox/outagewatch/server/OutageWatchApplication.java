package org.waabox.outagewatch.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the outage service.
 *
 * <p>Serves the modeled nuclear outage data:
 * <ul>
 *   <li>{@code GET /data} - filtered, paginated reads of the joined
 *       outage view</li>
 *   <li>{@code POST /refresh} - extract, rebuild and swap the modeled
 *       tables</li>
 *   <li>{@code GET /refresh/status} - the refresh state and cache
 *       version</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class OutageWatchApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(OutageWatchApplication.class, args);
  }
}
