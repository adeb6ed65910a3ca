package dev.rosterwatch.notify;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.metrics.WatchMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotifierConfigTest {

  @Mock
  private WatchMetrics metrics;

  private final NotifierConfig config = new NotifierConfig();

  @Test
  void shouldUseLogNotifierWithoutWebhook() {
    WatchProperties properties = new WatchProperties();
    properties.setWebhookUrl("   ");

    Notifier notifier = config.notifier(properties, WebClient.builder(), metrics);

    assertThat(notifier).isInstanceOf(LogNotifier.class);
    assertThat(notifier.send("hello")).isTrue();
    verify(metrics).recordNotification("log", true);
  }

  @Test
  void shouldUseWebhookNotifierWhenConfigured() {
    WatchProperties properties = new WatchProperties();
    properties.setWebhookUrl("https://hooks.slack.com/services/T000/B000/XXXX");

    Notifier notifier = config.notifier(properties, WebClient.builder(), metrics);

    assertThat(notifier).isInstanceOf(SlackWebhookNotifier.class);
    assertThat(notifier.getName()).isEqualTo("slack");
  }
}
