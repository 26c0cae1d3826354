package org.waabox.pullagent.server;

import java.util.Arrays;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for a pull-agent node.
 *
 * <p>Runs the relay proxy and joins the cluster as configured under
 * {@code pull-agent.*}. The short command line options are accepted as
 * plain arguments:
 * <pre>
 *   java -jar pull-agent-server.jar --port=5000 --addr=0.0.0.0 \
 *       --peer=10.0.0.2:7946
 *   java -jar pull-agent-server.jar --version
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class PullAgentApplication {

  /** The version reported when the jar carries no manifest version. */
  private static final String UNKNOWN_VERSION = "dev";

  /** Launches the application, or prints the version and exits.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    if (isVersionRequest(args)) {
      System.out.println(versionLine());
      return;
    }
    SpringApplication.run(PullAgentApplication.class, args);
  }

  /** Tells whether the arguments ask for the version only.
   *
   * @param args the command-line arguments, never null
   *
   * @return true if {@code --version} or {@code -v} is present
   */
  static boolean isVersionRequest(final String[] args) {
    return Arrays.stream(args)
        .anyMatch(arg -> "--version".equals(arg) || "-v".equals(arg));
  }

  /** Builds the line printed by {@code --version}.
   *
   * @return the version line, never null
   */
  static String versionLine() {
    final String version = PullAgentApplication.class.getPackage()
        .getImplementationVersion();
    return "pull-agent " + (version == null ? UNKNOWN_VERSION : version);
  }
}
