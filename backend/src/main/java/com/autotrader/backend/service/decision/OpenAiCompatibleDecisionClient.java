package com.autotrader.backend.service.decision;

import com.autotrader.backend.config.DecisionServiceProperties;
import com.autotrader.backend.exception.DecisionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * Talks to any OpenAI-compatible {@code /chat/completions} endpoint. Transport errors and 5xx
 * responses are retried through the {@code decisionRetry} policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompatibleDecisionClient implements DecisionClient {

    private final RestTemplate decisionRestTemplate;
    private final Retry decisionRetry;
    private final DecisionServiceProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public String complete(String model, String systemPrompt, String userContent, int maxTokens) {
        String body = requestBody(model, systemPrompt, userContent, maxTokens);
        Supplier<String> call = Retry.decorateSupplier(decisionRetry, () -> post(body));
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            String response = call.get();
            outcome = "success";
            return extractContent(response);
        } catch (HttpClientErrorException e) {
            throw new DecisionException("Decision service rejected request: HTTP " + e.getStatusCode().value(), e);
        } catch (HttpServerErrorException e) {
            throw new DecisionException("Decision service error: HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new DecisionException("Decision service unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("decision_call_latency")
                    .tag("model", model == null ? "unknown" : model)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private String post(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey().trim());
        }
        String url = stripTrailingSlash(properties.getBaseUrl()) + "/chat/completions";
        return decisionRestTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
    }

    private String requestBody(String model, String systemPrompt, String userContent, int maxTokens) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", 0);
        root.put("max_tokens", maxTokens);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userContent);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new DecisionException("Cannot serialise decision request", e);
        }
    }

    private String extractContent(String response) {
        if (response == null || response.isBlank()) {
            throw new DecisionException("Decision service returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new DecisionException("Decision service returned non-JSON body", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new DecisionException("Decision service response has no message content");
        }
        return content.asText().trim();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
