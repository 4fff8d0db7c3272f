package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.exception.NotificationException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Posts JSON payloads to notification webhooks.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff
 * - WebClient for HTTP calls
 */
@Slf4j
@Component
public class WebhookClient {

    private static final String CHANNEL = "webhook";

    private final WebClient webClient;
    private final Duration timeout;

    public WebhookClient(@Qualifier("webhookWebClient") WebClient webClient, NotificationProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getWebhook().getTimeoutSeconds());
    }

    /**
     * @throws NotificationException if the call fails or the webhook answers with an error status
     */
    @CircuitBreaker(name = "webhook", fallbackMethod = "postFallback")
    @Retry(name = "webhook")
    public void post(String url, Object payload) {
        log.debug("Posting webhook notification");

        try {
            webClient.post()
                    .uri(url)
                    .bodyValue(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(new NotificationException(CHANNEL,
                                            "HTTP " + response.statusCode().value() + ": " + body))))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (NotificationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Webhook call failed: {}", e.getMessage());
            throw new NotificationException(CHANNEL, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private void postFallback(String url, Object payload, Exception e) {
        log.warn("Circuit breaker open for webhook, error: {}", e.getMessage());
        throw new NotificationException(CHANNEL, "webhook temporarily unavailable (circuit breaker open): " + e.getMessage());
    }
}
