package com.autotrader.backend.service.decision;

/**
 * Chat-completion style transport to the external decision service. Returns the raw assistant content.
 */
public interface DecisionClient {

    String complete(String model, String systemPrompt, String userContent, int maxTokens);
}
