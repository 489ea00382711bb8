package com.autotrader.backend.service.runtime;

import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.RuntimeConfigException;
import com.autotrader.backend.model.RuntimeConfigRecord;
import com.autotrader.backend.repository.RuntimeConfigRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Stores the runtime config document (singleton row) and derives the effective config from it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuntimeConfigService {

    private final RuntimeConfigRepository runtimeConfigRepository;
    private final RuntimeConfigOverlay overlay;
    private final TraderProperties baseProperties;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public JsonNode getStored() {
        RuntimeConfigRecord record = runtimeConfigRepository.findById(RuntimeConfigRecord.SINGLETON_ID)
                .orElseThrow(() -> new RuntimeConfigException("runtime_config row missing (id=1)"));
        JsonNode doc;
        try {
            doc = objectMapper.readTree(record.getConfigJson());
        } catch (JsonProcessingException e) {
            throw new RuntimeConfigException("runtime_config JSON is invalid: " + e.getOriginalMessage(), e);
        }
        if (doc == null || !doc.isObject()) {
            throw new RuntimeConfigException("runtime_config JSON must be an object");
        }
        return doc;
    }

    /**
     * Stored document after normalisation and validation; raises when either step fails.
     */
    public ObjectNode loadValidated() {
        ObjectNode doc = overlay.normalise(getStored());
        overlay.validate(doc);
        return doc;
    }

    @Transactional
    public ObjectNode replace(JsonNode document) {
        ObjectNode doc = overlay.normalise(document);
        overlay.validate(doc);
        String json;
        try {
            json = objectMapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new RuntimeConfigException("Cannot serialise runtime config", e);
        }
        runtimeConfigRepository.save(RuntimeConfigRecord.builder()
                .id(RuntimeConfigRecord.SINGLETON_ID)
                .configJson(json)
                .updatedAt(Instant.now())
                .build());
        log.info("Runtime config replaced (active strategy: {})", doc.path("active_strategy").asText(null));
        return doc;
    }

    /**
     * Fresh effective config for one cycle: base properties with the stored overlay applied.
     */
    public TraderProperties effectiveConfig() {
        return overlay.apply(baseProperties, loadValidated());
    }

    public JsonNode effectiveView() {
        return overlay.toTree(effectiveConfig());
    }
}
