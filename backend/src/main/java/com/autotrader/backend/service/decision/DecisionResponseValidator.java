package com.autotrader.backend.service.decision;

import com.autotrader.backend.exception.DecisionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw decision-service output into typed decisions. Anything malformed or out of range is a
 * {@link DecisionException}.
 */
@Component
@RequiredArgsConstructor
public class DecisionResponseValidator {

    private static final int MAX_SHORTLIST_ITEMS = 6;
    private static final int MAX_REVIEW_FACTORS = 5;
    private static final int MAX_SELECTION_RATIONALE = 250;

    private final ObjectMapper objectMapper;

    public ShortlistDecision shortlist(String raw) {
        JsonNode root = parseObject(raw, "trade decision");
        String decision = upper(root.get("decision"));
        if (!ShortlistDecision.SHORTLIST.equals(decision) && !ShortlistDecision.SKIP.equals(decision)) {
            throw new DecisionException("Invalid decision '" + decision + "'");
        }
        double confidence = inRange(number(root, "confidence"), 0.0, 1.0, "confidence");
        double score = inRange(number(root, "score"), 0.0, 1.0, "score");
        double sentiment = inRange(number(root, "sentiment"), -1.0, 1.0, "sentiment");
        String rationale = requiredText(root, "rationale");
        List<String> keyFactors = stringList(root.get("key_factors"), "key_factors", true);
        List<String> keyRisks = stringList(root.get("key_risks"), "key_risks", true);
        return new ShortlistDecision(decision, confidence, score, sentiment, rationale,
                head(keyFactors, MAX_SHORTLIST_ITEMS), head(keyRisks, MAX_SHORTLIST_ITEMS));
    }

    /**
     * Keeps the returned order, drops duplicates and stops at {@code maxNew}. A symbol outside the
     * candidate set is an error.
     */
    public BuySelection buySelection(String raw, Collection<String> candidateSymbols, int maxNew) {
        JsonNode root = parseObject(raw, "buy selection");
        List<String> selected = stringList(root.get("selected_symbols"), "selected_symbols", true);
        Set<String> allowed = new LinkedHashSet<>();
        for (String symbol : candidateSymbols) {
            allowed.add(symbol.trim().toUpperCase(Locale.ROOT));
        }
        Set<String> normalised = new LinkedHashSet<>();
        for (String symbol : selected) {
            String s = symbol.trim().toUpperCase(Locale.ROOT);
            if (s.isEmpty() || normalised.contains(s)) {
                continue;
            }
            if (!allowed.contains(s)) {
                throw new DecisionException("Selected unknown symbol: " + s);
            }
            normalised.add(s);
            if (normalised.size() >= maxNew) {
                break;
            }
        }
        String rationale = text(root.get("rationale"));
        if (rationale.isEmpty()) {
            rationale = "Selected from shortlist.";
        }
        if (rationale.length() > MAX_SELECTION_RATIONALE) {
            rationale = rationale.substring(0, MAX_SELECTION_RATIONALE);
        }
        return new BuySelection(new ArrayList<>(normalised), rationale);
    }

    public PositionReviewDecision positionReview(String raw) {
        JsonNode root = parseObject(raw, "position review");
        String action = upper(root.get("action"));
        if (!Set.of(PositionReviewDecision.HOLD, PositionReviewDecision.SELL,
                PositionReviewDecision.ADJUST_STOP, PositionReviewDecision.ADJUST_TP).contains(action)) {
            throw new DecisionException("Invalid action '" + action + "'");
        }
        double confidence = inRange(number(root, "confidence"), 0.0, 1.0, "confidence");
        double urgency = inRange(optionalNumber(root, "urgency", 0.5), 0.0, 1.0, "urgency");
        Double newStop = nullableNumber(root, "new_stop_loss");
        Double newTakeProfit = nullableNumber(root, "new_take_profit");
        if (PositionReviewDecision.ADJUST_STOP.equals(action) && newStop == null) {
            throw new DecisionException("ADJUST_STOP without new_stop_loss");
        }
        if (PositionReviewDecision.ADJUST_TP.equals(action) && newTakeProfit == null) {
            throw new DecisionException("ADJUST_TP without new_take_profit");
        }
        String rationale = requiredText(root, "rationale");
        List<String> keyFactors = stringList(root.get("key_factors"), "key_factors", false);
        return new PositionReviewDecision(action, newStop, newTakeProfit, confidence, urgency, rationale,
                head(keyFactors, MAX_REVIEW_FACTORS));
    }

    public OrderReviewDecision orderReview(String raw) {
        JsonNode root = parseObject(raw, "order review");
        String action = upper(root.get("action"));
        if (!Set.of(OrderReviewDecision.KEEP, OrderReviewDecision.CANCEL, OrderReviewDecision.ADJUST_PRICE)
                .contains(action)) {
            throw new DecisionException("Invalid order action '" + action + "'");
        }
        double confidence = inRange(optionalNumber(root, "confidence", 0.5), 0.0, 1.0, "confidence");
        Double newPrice = nullableNumber(root, "new_price");
        if (OrderReviewDecision.ADJUST_PRICE.equals(action) && newPrice == null) {
            throw new DecisionException("ADJUST_PRICE without new_price");
        }
        String rationale = requiredText(root, "rationale");
        return new OrderReviewDecision(action, newPrice, confidence, rationale);
    }

    private JsonNode parseObject(String raw, String kind) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            throw new DecisionException("Non-JSON response for " + kind + ": " + abbreviate(raw), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecisionException("Unexpected JSON type for " + kind);
        }
        return root;
    }

    private static double number(JsonNode root, String field) {
        Double value = nullableNumber(root, field);
        if (value == null) {
            throw new DecisionException(field + " is missing");
        }
        return value;
    }

    private static double optionalNumber(JsonNode root, String field, double fallback) {
        Double value = nullableNumber(root, field);
        return value == null ? fallback : value;
    }

    private static Double nullableNumber(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new DecisionException(field + " is not a number: " + node.asText());
            }
        }
        throw new DecisionException(field + " is not a number");
    }

    private static double inRange(double value, double min, double max, String field) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new DecisionException(field + " out of range: " + value);
        }
        return value;
    }

    private static String requiredText(JsonNode root, String field) {
        String value = text(root.get(field));
        if (value.isEmpty()) {
            throw new DecisionException(field + " is empty");
        }
        return value;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText("").trim();
    }

    private static String upper(JsonNode node) {
        return text(node).toUpperCase(Locale.ROOT);
    }

    private static List<String> stringList(JsonNode node, String field, boolean required) {
        if (node == null || node.isNull()) {
            if (required) {
                throw new DecisionException(field + " must be a list of strings");
            }
            return List.of();
        }
        if (!node.isArray()) {
            throw new DecisionException(field + " must be a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new DecisionException(field + " must be a list of strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private static List<String> head(List<String> values, int max) {
        return values.size() <= max ? List.copyOf(values) : List.copyOf(values.subList(0, max));
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return "null";
        }
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
