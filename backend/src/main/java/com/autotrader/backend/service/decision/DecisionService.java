package com.autotrader.backend.service.decision;

import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.DecisionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;

/**
 * The four decision calls the trading loop makes. Payloads are serialised to snake_case JSON and
 * every response passes through {@link DecisionResponseValidator} before it reaches the caller.
 */
@Slf4j
@Service
public class DecisionService {

    private final DecisionClient decisionClient;
    private final DecisionResponseValidator validator;
    private final ObjectMapper payloadMapper;

    public DecisionService(DecisionClient decisionClient, DecisionResponseValidator validator, ObjectMapper objectMapper) {
        this.decisionClient = decisionClient;
        this.validator = validator;
        this.payloadMapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public ShortlistDecision shortlist(TraderProperties config, Map<String, Object> payload) {
        String raw = call(config, DecisionPrompts.shortlist(config.getAi()), payload, 700);
        return validator.shortlist(raw);
    }

    public BuySelection selectBuys(TraderProperties config, Map<String, Object> payload,
                                   Collection<String> candidateSymbols, int maxNew) {
        if (maxNew <= 0 || candidateSymbols.isEmpty()) {
            return BuySelection.none("No capacity or no shortlisted candidates.");
        }
        String raw = call(config, DecisionPrompts.buySelection(config.getAi()), payload, 700);
        return validator.buySelection(raw, candidateSymbols, maxNew);
    }

    public PositionReviewDecision reviewPosition(TraderProperties config, Map<String, Object> payload) {
        String raw = call(config, DecisionPrompts.positionReview(config.getAi()), payload, 600);
        return validator.positionReview(raw);
    }

    public OrderReviewDecision reviewOrder(TraderProperties config, Map<String, Object> payload) {
        String raw = call(config, DecisionPrompts.orderReview(config.getAi()), payload, 400);
        return validator.orderReview(raw);
    }

    private String call(TraderProperties config, String systemPrompt, Map<String, Object> payload, int maxTokens) {
        String user;
        try {
            user = payloadMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DecisionException("Cannot serialise decision payload", e);
        }
        String model = config.getAi().getModel();
        log.debug("Decision call model={} payloadBytes={}", model, user.length());
        return decisionClient.complete(model, systemPrompt, user, maxTokens);
    }
}
