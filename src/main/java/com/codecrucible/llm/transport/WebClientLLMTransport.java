package com.codecrucible.llm.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Production transport backed by Spring's {@link WebClient}. Blocks the calling
 * thread for at most {@code timeout}.
 */
@Component
@Profile("!mock")
public class WebClientLLMTransport implements LLMTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientLLMTransport.class);

    private final WebClient webClient;

    public WebClientLLMTransport(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public TransportResponse post(String endpoint, Map<String, String> headers, String jsonBody, Duration timeout)
            throws TransportException {

        log.debug("[Transport] POST {} bodyLen={}", endpoint, jsonBody.length());

        try {
            TransportResponse response = webClient
                    .post()
                    .uri(endpoint)
                    .headers(h -> headers.forEach(h::set))
                    .bodyValue(jsonBody)
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new TransportResponse(r.statusCode().value(), body)))
                    .timeout(timeout)
                    .block();

            if (response == null) {
                throw new TransportException("Empty response from " + endpoint);
            }

            log.debug("[Transport] {} -> {}", endpoint, response);
            return response;

        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            throw new TransportException(rootMessage(e), e);
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
