package dev.rosterwatch;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.model.CycleSummary;
import dev.rosterwatch.notify.Notifier;
import dev.rosterwatch.service.DeduplicationService;
import dev.rosterwatch.service.WatchCycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Polls the roster: one check cycle right away, then one per poll interval with a
 * blocking sleep in between. Cycles never overlap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";
  private static final List<String> DEBUG_FLAGS = List.of("-d", "--debug");

  private final WatchCycleService watchCycleService;
  private final DeduplicationService deduplicationService;
  private final Notifier notifier;
  private final WatchProperties properties;
  private final LoggingSystem loggingSystem;

  @Value("${info.app.version:dev}")
  private String version;

  /**
   * Validate configuration, load the seen state and poll until the configured
   * number of cycles has run or the thread is interrupted.
   *
   * @param args Command line arguments; -d/--debug turns on debug output
   * @return Number of cycles run
   */
  public int execute(String... args) {
    if (Arrays.stream(args).anyMatch(DEBUG_FLAGS::contains)) {
      properties.setDebug(true);
    }

    log.info(SEPARATOR);
    log.info("MCSO PAID Roster Watch v{} starting...", version);
    log.info(SEPARATOR);

    if (properties.isDebug()) {
      loggingSystem.setLogLevel("dev.rosterwatch", LogLevel.DEBUG);
      log.info("Debug mode enabled");
    }

    List<String> watchNames = properties.getEffectiveWatchNames();
    if (watchNames.isEmpty()) {
      throw new IllegalStateException("No names configured to watch. Set WATCH_NAMES in the environment");
    }

    log.info("Watching for names: {}", String.join(", ", watchNames));
    log.info("Notification sink: {}", notifier.getName());
    log.info("Poll interval: {} minutes", properties.getPollIntervalMinutes());
    log.info("Data file: {}", properties.getDataFile());

    deduplicationService.load();

    int cycles = 0;
    while (true) {
      CycleSummary summary = watchCycleService.runCycle();
      cycles++;
      log.info("Cycle {}: {} new alerts, all categories ok: {}",
          cycles, summary.notificationCount(), summary.allSucceeded());

      if (properties.getMaxCycles() > 0 && cycles >= properties.getMaxCycles()) {
        log.info("Reached {} cycles - stopping", cycles);
        return cycles;
      }
      if (!sleepUntilNextCycle()) {
        return cycles;
      }
    }
  }

  private boolean sleepUntilNextCycle() {
    int minutes = properties.getPollIntervalMinutes();
    log.info("Sleeping for {} minutes...", minutes);
    try {
      Thread.sleep(minutes * 60_000L);
      return true;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Polling interrupted - stopping");
      return false;
    }
  }
}
