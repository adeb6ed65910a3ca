package dev.rosterwatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ends the process with a status code. Under a test runner the call is only
 * logged, so tests can drive the application's exit paths.
 */
@Slf4j
@Component
public class ExitManager {

  private static final List<String> TEST_RUNNER_MARKERS = List.of("junit", "surefire", "intellij");

  public void exit(int status) {
    if (runningUnderTestRunner()) {
      log.debug("Skipping System.exit({}) under test runner", status);
      return;
    }
    if (status != 0) {
      log.error("Exiting with status {}", status);
    }
    terminate(status);
  }

  protected void terminate(int status) {
    System.exit(status);
  }

  protected boolean runningUnderTestRunner() {
    String classPath = System.getProperty("java.class.path", "");
    return TEST_RUNNER_MARKERS.stream().anyMatch(classPath::contains);
  }
}
