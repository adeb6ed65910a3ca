package dev.rosterwatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExitManagerTest {

  @Test
  @DisplayName("Should only log the exit when running under a test runner")
  void shouldSkipExitUnderTestRunner() {
    RecordingExitManager exitManager = new RecordingExitManager(true);

    exitManager.exit(1);

    assertThat(exitManager.terminatedWith).isEmpty();
    assertThat(new ExitManager().runningUnderTestRunner()).isTrue();
  }

  @Test
  @DisplayName("Should terminate with the given status outside a test runner")
  void shouldTerminateOutsideTestRunner() {
    RecordingExitManager exitManager = new RecordingExitManager(false);

    exitManager.exit(0);
    exitManager.exit(1);

    assertThat(exitManager.terminatedWith).containsExactly(0, 1);
  }

  private static class RecordingExitManager extends ExitManager {

    private final boolean underTestRunner;
    private final List<Integer> terminatedWith = new ArrayList<>();

    RecordingExitManager(boolean underTestRunner) {
      this.underTestRunner = underTestRunner;
    }

    @Override
    protected boolean runningUnderTestRunner() {
      return underTestRunner;
    }

    @Override
    protected void terminate(int status) {
      terminatedWith.add(status);
    }
  }
}
