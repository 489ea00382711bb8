package com.autotrader.backend.controller;

import com.autotrader.backend.exception.InvalidRuntimeConfigException;
import com.autotrader.backend.exception.RuntimeConfigException;
import com.autotrader.backend.service.runtime.RuntimeConfigService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/config")
@RequiredArgsConstructor
@Tag(name = "Runtime config")
public class RuntimeConfigController {

    private final RuntimeConfigService runtimeConfigService;

    @GetMapping("/runtime")
    @Operation(summary = "Stored runtime config document, normalised and validated")
    public ResponseEntity<JsonNode> getRuntime() {
        try {
            return ResponseEntity.ok(runtimeConfigService.loadValidated());
        } catch (InvalidRuntimeConfigException e) {
            throw new RuntimeConfigException("Stored runtime config is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Replaces the whole document. Takes effect at the start of the next cycle.
     */
    @PutMapping("/runtime")
    @Operation(summary = "Replace the runtime config document")
    public ResponseEntity<JsonNode> putRuntime(@RequestBody JsonNode document) {
        log.info("Runtime config update requested");
        return ResponseEntity.ok(runtimeConfigService.replace(document));
    }

    @GetMapping("/effective")
    @Operation(summary = "Base config with the runtime overlay applied")
    public ResponseEntity<JsonNode> getEffective() {
        return ResponseEntity.ok(runtimeConfigService.effectiveView());
    }
}
