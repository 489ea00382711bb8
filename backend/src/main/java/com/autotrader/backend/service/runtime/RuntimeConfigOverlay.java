package com.autotrader.backend.service.runtime;

import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.InvalidRuntimeConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime config document: {@code schema_version}, global {@code overrides}, named {@code strategies}
 * each with their own overrides, and the {@code active_strategy}. Overrides patch a copy of the base
 * {@link TraderProperties}; strategy overrides win over global ones.
 */
@Component
public class RuntimeConfigOverlay {

    public static final int SCHEMA_VERSION = 1;
    public static final String DEFAULT_STRATEGY = "Default";

    private static final List<String> DEPRECATED_AI_KEYS = List.of(
            "trade_decision_enabled",
            "sentiment_threshold",
            "sentiment_analysis_enabled",
            "trade_decision_system_prompt",
            "trade_decision_prompt_addendum",
            "buy_selection_prompt_addendum",
            "position_review_prompt_addendum",
            "order_review_prompt_addendum"
    );

    private final ObjectMapper snakeCaseMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public record OverrideEntry(String path, JsonNode value) {
    }

    public ObjectNode defaultDocument() {
        ObjectNode doc = nodes.objectNode();
        doc.put("schema_version", SCHEMA_VERSION);
        doc.set("overrides", nodes.objectNode());
        ArrayNode strategies = doc.putArray("strategies");
        strategies.addObject().put("name", DEFAULT_STRATEGY).set("overrides", nodes.objectNode());
        doc.put("active_strategy", DEFAULT_STRATEGY);
        return doc;
    }

    /**
     * Fills missing fields with defaults, migrates renamed keys and drops retired ones. Never mutates the input.
     */
    public ObjectNode normalise(JsonNode doc) {
        if (doc == null || doc.isNull() || doc.isMissingNode()) {
            return defaultDocument();
        }
        if (!doc.isObject()) {
            throw new InvalidRuntimeConfigException("runtime config must be an object; got " + doc.getNodeType());
        }
        ObjectNode out = ((ObjectNode) doc).deepCopy();
        if (!out.has("schema_version")) {
            out.put("schema_version", SCHEMA_VERSION);
        }
        if (!out.hasNonNull("overrides")) {
            out.set("overrides", nodes.objectNode());
        }
        if (!out.hasNonNull("strategies")) {
            ArrayNode strategies = out.putArray("strategies");
            strategies.addObject().put("name", DEFAULT_STRATEGY).set("overrides", nodes.objectNode());
        }
        if (!out.has("active_strategy")) {
            out.put("active_strategy", DEFAULT_STRATEGY);
        }

        List<JsonNode> holders = new ArrayList<>();
        holders.add(out.get("overrides"));
        if (out.get("strategies").isArray()) {
            for (JsonNode strategy : out.get("strategies")) {
                if (strategy != null && strategy.isObject()) {
                    holders.add(strategy.get("overrides"));
                }
            }
        }
        for (JsonNode holder : holders) {
            if (holder == null || !holder.isObject()) {
                continue;
            }
            JsonNode ai = holder.get("ai");
            if (ai != null && ai.isObject()) {
                ObjectNode aiNode = (ObjectNode) ai;
                if (aiNode.has("trade_decision_system_prompt") && !aiNode.has("shortlist_system_prompt")) {
                    aiNode.set("shortlist_system_prompt", aiNode.get("trade_decision_system_prompt"));
                }
                aiNode.remove(DEPRECATED_AI_KEYS);
            }
            JsonNode positionManagement = holder.get("position_management");
            if (positionManagement != null && positionManagement.isObject()) {
                ((ObjectNode) positionManagement).remove("enabled");
            }
        }
        return out;
    }

    public void validate(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            throw new InvalidRuntimeConfigException("runtime config must be an object");
        }
        JsonNode schemaVersion = doc.get("schema_version");
        if (schemaVersion != null && !(schemaVersion.isIntegralNumber() && schemaVersion.asInt() == SCHEMA_VERSION)) {
            throw new InvalidRuntimeConfigException("Unsupported runtime config schema_version: " + schemaVersion);
        }
        JsonNode overrides = doc.get("overrides");
        if (overrides != null && !overrides.isObject()) {
            throw new InvalidRuntimeConfigException("runtime.overrides must be an object");
        }
        JsonNode strategies = doc.get("strategies");
        if (strategies == null || !strategies.isArray() || strategies.isEmpty()) {
            throw new InvalidRuntimeConfigException("runtime.strategies must be a non-empty array");
        }
        Set<String> seen = new HashSet<>();
        for (JsonNode strategy : strategies) {
            if (!strategy.isObject()) {
                throw new InvalidRuntimeConfigException("Each strategy must be an object");
            }
            JsonNode nameNode = strategy.get("name");
            if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
                throw new InvalidRuntimeConfigException("Strategy name must be a non-empty string");
            }
            String name = nameNode.asText().trim();
            if (!seen.add(name)) {
                throw new InvalidRuntimeConfigException("Duplicate strategy name: " + name);
            }
            JsonNode strategyOverrides = strategy.get("overrides");
            if (strategyOverrides != null && !strategyOverrides.isObject()) {
                throw new InvalidRuntimeConfigException("Strategy overrides for " + name + " must be an object");
            }
            validateOverrides(strategyOverrides);
        }
        JsonNode active = doc.get("active_strategy");
        if (active != null && !active.isNull()) {
            if (!active.isTextual() || active.asText().isBlank()) {
                throw new InvalidRuntimeConfigException("active_strategy must be a non-empty string or null");
            }
            if (!seen.contains(active.asText().trim())) {
                throw new InvalidRuntimeConfigException("active_strategy not found in strategies: " + active.asText().trim());
            }
        }
        validateOverrides(overrides);
    }

    private void validateOverrides(JsonNode overrides) {
        if (overrides == null) {
            return;
        }
        for (OverrideEntry override : flatten(overrides)) {
            OverrideKeys.validate(override.path(), override.value());
        }
    }

    /**
     * Nested override objects become dotted paths, except for map-valued keys which stay whole.
     */
    public List<OverrideEntry> flatten(JsonNode overrides) {
        List<OverrideEntry> out = new ArrayList<>();
        flattenInto(overrides, "", out);
        return out;
    }

    private void flattenInto(JsonNode node, String prefix, List<OverrideEntry> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode value = entry.getValue();
            if (value.isObject() && !OverrideKeys.MAP_VALUED.contains(path)) {
                flattenInto(value, path, out);
            } else {
                out.add(new OverrideEntry(path, value));
            }
        }
    }

    /**
     * Returns a new effective config: base, then global overrides, then the active strategy's overrides.
     * The document must already be normalised and validated.
     */
    public TraderProperties apply(TraderProperties base, JsonNode doc) {
        ObjectNode tree = snakeCaseMapper.valueToTree(base);
        JsonNode overrides = doc.get("overrides");
        if (overrides != null && overrides.isObject()) {
            merge(tree, overrides);
        }
        JsonNode strategy = activeStrategy(doc);
        if (strategy != null && strategy.get("overrides") != null && strategy.get("overrides").isObject()) {
            merge(tree, strategy.get("overrides"));
        }
        try {
            return snakeCaseMapper.treeToValue(tree, TraderProperties.class);
        } catch (JsonProcessingException e) {
            throw new InvalidRuntimeConfigException("Cannot apply runtime overrides: " + e.getOriginalMessage());
        }
    }

    public JsonNode toTree(TraderProperties properties) {
        return snakeCaseMapper.valueToTree(properties);
    }

    private JsonNode activeStrategy(JsonNode doc) {
        JsonNode active = doc.get("active_strategy");
        if (active == null || active.isNull()) {
            return null;
        }
        String name = active.asText().trim();
        for (JsonNode strategy : doc.path("strategies")) {
            if (name.equals(strategy.path("name").asText().trim())) {
                return strategy;
            }
        }
        return null;
    }

    private void merge(ObjectNode tree, JsonNode overrides) {
        for (OverrideEntry override : flatten(overrides)) {
            setPath(tree, override.path().split("\\."), override.value());
        }
    }

    private void setPath(ObjectNode tree, String[] segments, JsonNode value) {
        ObjectNode current = tree;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = current.get(segments[i]);
            if (child == null || !child.isObject()) {
                child = current.putObject(segments[i]);
            }
            current = (ObjectNode) child;
        }
        String leaf = segments[segments.length - 1];
        JsonNode existing = current.get(leaf);
        if (existing != null && existing.isObject() && value.isObject()) {
            ((ObjectNode) existing).setAll((ObjectNode) value.deepCopy());
        } else {
            current.set(leaf, value.deepCopy());
        }
    }
}
