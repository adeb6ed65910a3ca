package dev.rosterwatch.notify;

import dev.rosterwatch.metrics.WatchMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Posts {@code {"text": message}} to a Slack incoming webhook.
 */
@Slf4j
public class SlackWebhookNotifier implements Notifier {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final String webhookUrl;
    private final WatchMetrics metrics;

    public SlackWebhookNotifier(WebClient.Builder webClientBuilder, String webhookUrl, WatchMetrics metrics) {
        this.webClient = webClientBuilder.build();
        this.webhookUrl = Objects.requireNonNull(webhookUrl);
        this.metrics = metrics;
        log.info("Slack webhook configured");
    }

    @Override
    public String getName() {
        return "slack";
    }

    @Override
    @SuppressWarnings("null")
    public boolean send(String message) {
        try {
            webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("text", message))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(TIMEOUT)
                    .block();
            log.info("Slack message sent successfully");
            metrics.recordNotification(getName(), true);
            return true;
        } catch (WebClientResponseException e) {
            log.error("Slack webhook returned status {}", e.getStatusCode().value());
        } catch (RuntimeException e) {
            log.error("Error sending Slack message: {}", e.getMessage());
        }
        metrics.recordNotification(getName(), false);
        return false;
    }
}
