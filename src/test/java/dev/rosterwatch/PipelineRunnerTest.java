package dev.rosterwatch;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.model.CategoryOutcome;
import dev.rosterwatch.model.CycleSummary;
import dev.rosterwatch.model.ScrapeCategory;
import dev.rosterwatch.notify.Notifier;
import dev.rosterwatch.service.DeduplicationService;
import dev.rosterwatch.service.WatchCycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  @Mock
  private WatchCycleService watchCycleService;

  @Mock
  private DeduplicationService deduplicationService;

  @Mock
  private Notifier notifier;

  @Mock
  private LoggingSystem loggingSystem;

  private WatchProperties properties;
  private PipelineRunner pipelineRunner;

  @BeforeEach
  @SuppressWarnings("null")
  void setUp() {
    properties = new WatchProperties();
    properties.setWatchNames(List.of("Doe", "Smith John"));
    properties.setPollIntervalMinutes(0);
    properties.setMaxCycles(1);
    pipelineRunner = new PipelineRunner(watchCycleService, deduplicationService, notifier, properties, loggingSystem);
    ReflectionTestUtils.setField(pipelineRunner, "version", "test");
  }

  private CycleSummary summary() {
    return new CycleSummary(List.of(
        CategoryOutcome.succeeded(ScrapeCategory.BOOKED, 3, List.of()),
        CategoryOutcome.succeeded(ScrapeCategory.RELEASED, 5, List.of())), true);
  }

  @Test
  void execute_singleCycle_loadsStateBeforeFirstCycle() {
    // Arrange
    when(watchCycleService.runCycle()).thenReturn(summary());

    // Act
    int cycles = pipelineRunner.execute();

    // Assert
    assertEquals(1, cycles);
    InOrder inOrder = inOrder(deduplicationService, watchCycleService);
    inOrder.verify(deduplicationService).load();
    inOrder.verify(watchCycleService).runCycle();
  }

  @Test
  void execute_maxCycles_runsThatManyCycles() {
    // Arrange
    properties.setMaxCycles(3);
    when(watchCycleService.runCycle()).thenReturn(summary());

    // Act
    int cycles = pipelineRunner.execute();

    // Assert
    assertEquals(3, cycles);
    verify(watchCycleService, times(3)).runCycle();
    verify(deduplicationService, times(1)).load();
  }

  @Test
  void execute_emptyWatchlist_throwsBeforeAnyCycle() {
    // Arrange
    properties.setWatchNames(List.of(" ", ""));

    // Act & Assert
    assertThrows(IllegalStateException.class, () -> pipelineRunner.execute());
    verifyNoInteractions(watchCycleService, deduplicationService);
  }

  @Test
  void execute_debugFlag_raisesLogLevel() {
    // Arrange
    when(watchCycleService.runCycle()).thenReturn(summary());

    // Act
    pipelineRunner.execute("--debug");

    // Assert
    assertTrue(properties.isDebug());
    verify(loggingSystem).setLogLevel("dev.rosterwatch", LogLevel.DEBUG);
  }

  @Test
  void execute_withoutDebugFlag_keepsLogLevel() {
    // Arrange
    when(watchCycleService.runCycle()).thenReturn(summary());

    // Act
    pipelineRunner.execute("--other");

    // Assert
    assertFalse(properties.isDebug());
    verifyNoInteractions(loggingSystem);
  }

  @Test
  void execute_interrupted_stopsAfterCurrentCycle() {
    // Arrange
    properties.setMaxCycles(0);
    properties.setPollIntervalMinutes(1);
    when(watchCycleService.runCycle()).thenAnswer(invocation -> {
      Thread.currentThread().interrupt();
      return summary();
    });

    // Act
    int cycles = pipelineRunner.execute();

    // Assert
    assertEquals(1, cycles);
    assertTrue(Thread.interrupted());
  }
}
