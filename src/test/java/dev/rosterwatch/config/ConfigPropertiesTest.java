package dev.rosterwatch.config;

import dev.rosterwatch.ExitManager;
import dev.rosterwatch.PipelineRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private WatchProperties watchProperties;

  @Test
  void shouldSplitCommaSeparatedWatchNames() {
    assertThat(watchProperties.getEffectiveWatchNames()).containsExactly("Doe", "Smith John");
  }

  @Test
  void shouldLoadDefaultsAndOverrides() {
    assertThat(watchProperties.getPollIntervalMinutes()).isEqualTo(1);
    assertThat(watchProperties.getErrorReportIntervalHours()).isEqualTo(4);
    assertThat(watchProperties.getDataFile()).endsWith("seen_bookings.json");
    assertThat(watchProperties.isWebhookConfigured()).isFalse();
    assertThat(watchProperties.getSource().getSearchUrl()).startsWith("https://apps.mcso.us/PAID/");
    assertThat(watchProperties.getSource().isInsecureTls()).isTrue();
  }
}
