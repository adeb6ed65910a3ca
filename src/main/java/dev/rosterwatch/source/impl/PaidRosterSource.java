package dev.rosterwatch.source.impl;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.model.SearchType;
import dev.rosterwatch.source.RosterFetchException;
import dev.rosterwatch.source.RosterSource;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.time.Duration;
import java.util.Objects;

/**
 * Client for the MCSO Public Access Inmate Data search form.
 * <p>
 * The site serves a broken certificate chain, so certificate and hostname checks
 * are turned off when {@code roster.source.insecure-tls} is set.
 */
@Slf4j
@Component
public class PaidRosterSource implements RosterSource {

    private final WebClient webClient;
    private final WatchProperties.Source config;

    public PaidRosterSource(WebClient.Builder webClientBuilder, WatchProperties properties) {
        this.config = properties.getSource();

        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));
        if (config.isInsecureTls()) {
            httpClient = withLegacyTls(httpClient);
        }

        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", config.getUserAgent())
                .build();
    }

    @Override
    public String getName() {
        return "MCSO PAID";
    }

    @Override
    @SuppressWarnings("null")
    public Mono<String> search(SearchType searchType) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("FirstName", "");
        form.add("LastName", "");
        form.add("SearchType", searchType.getCode());

        log.debug("Submitting search: SearchType={} ({})", searchType.getCode(), searchType);

        return webClient.post()
                .uri(config.getSearchUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .doOnNext(body -> log.debug("Response length: {}", body.length()))
                .onErrorMap(e -> !(e instanceof RosterFetchException), this::toFetchException);
    }

    private RosterFetchException toFetchException(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return new RosterFetchException("HTTP " + status + " from " + config.getSearchUrl(), status, e);
        }
        return new RosterFetchException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }

    private static HttpClient withLegacyTls(HttpClient httpClient) {
        SslContext sslContext;
        try {
            sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Could not build TLS context for roster source", e);
        }

        return httpClient.secure(spec -> spec.sslContext(sslContext)
                .handlerConfigurator(handler -> {
                    SSLEngine engine = handler.engine();
                    SSLParameters parameters = engine.getSSLParameters();
                    parameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(parameters);
                }));
    }
}
