package dev.rosterwatch.notify;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.metrics.WatchMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Picks the notification sink once at startup: the webhook when a URL is set,
 * the log otherwise.
 */
@Configuration
public class NotifierConfig {

    @Bean
    public Notifier notifier(WatchProperties properties, WebClient.Builder webClientBuilder, WatchMetrics metrics) {
        if (properties.isWebhookConfigured()) {
            return new SlackWebhookNotifier(webClientBuilder, properties.getWebhookUrl().trim(), metrics);
        }
        return new LogNotifier(metrics);
    }
}
