package com.phishguard.analysis.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for a self-hosted scoring model.
 *
 * <p>Request:  {@code POST /v1/score  {"text": "..."}}
 * <br>Response: {@code {"probability": 0.0-1.0, "explanation": "..."}}
 *
 * <p>Fully non-blocking; the call is bounded by {@code phishguard.remote-model.timeout-ms}.
 * A response without a numeric probability in [0, 1] is rejected with
 * {@link RemoteModelException}.
 */
@Component
public class HttpRemoteRiskModel implements RemoteRiskModel {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteRiskModel.class);

    static final String DEFAULT_EXPLANATION =
        "The remote model analyzed the text's semantic context and structure to determine its risk profile.";

    private final WebClient remoteModelClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final long timeoutMs;

    public HttpRemoteRiskModel(WebClient remoteModelClient,
                               ObjectMapper objectMapper,
                               @Value("${phishguard.remote-model.enabled:false}") boolean enabled,
                               @Value("${phishguard.remote-model.timeout-ms:3000}") long timeoutMs) {
        this.remoteModelClient = remoteModelClient;
        this.objectMapper      = objectMapper;
        this.enabled           = enabled;
        this.timeoutMs         = timeoutMs;
        log.info("[RemoteModel] enabled={} timeoutMs={}", enabled, timeoutMs);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<RemoteVerdict> evaluate(String text) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(Map.of("text", text)))
            .flatMap(body ->
                remoteModelClient.post()
                    .uri("/v1/score")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs)))
            .map(this::parseVerdict);
    }

    RemoteVerdict parseVerdict(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteModelException("Response is not valid JSON", e);
        }
        if (root == null || !root.path("probability").isNumber()) {
            throw new RemoteModelException("Response has no numeric 'probability'");
        }
        double probability = root.path("probability").asDouble();
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new RemoteModelException("Probability out of range: " + probability);
        }
        String explanation = root.path("explanation").asText("");
        return new RemoteVerdict(probability, explanation.isBlank() ? DEFAULT_EXPLANATION : explanation);
    }
}
