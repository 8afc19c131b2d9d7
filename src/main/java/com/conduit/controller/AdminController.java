package com.conduit.controller;

import com.conduit.exception.ErrorPayloads;
import com.conduit.model.AdapterModelInfo;
import com.conduit.service.AdapterManager;
import com.conduit.service.ModelCatalogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin API for inspecting and reloading the active provider adapter.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin/provider")
public class AdminController {

    private final AdapterManager adapterManager;
    private final ModelCatalogService modelCatalog;

    public AdminController(AdapterManager adapterManager, ModelCatalogService modelCatalog) {
        this.adapterManager = adapterManager;
        this.modelCatalog = modelCatalog;
    }

    /**
     * Active adapter metadata, supported platform tags and model aliases.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getProvider() {
        log.info("Admin: Getting active provider");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", adapterManager.getModelInfo());
        body.put("supported_platforms", adapterManager.getSupportedPlatforms());
        body.put("model_mappings", modelCatalog.getMappings());
        return ResponseEntity.ok(body);
    }

    /**
     * Rebuild the adapter from the current configuration.
     */
    @PostMapping("/reload")
    public ResponseEntity<Object> reload() {
        log.info("Admin: Reloading provider adapter");

        if (!adapterManager.reload()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorPayloads.serviceUnavailable("Provider configuration is invalid, previous adapter kept"));
        }

        AdapterModelInfo info = adapterManager.getModelInfo();
        return ResponseEntity.ok(Map.of("reloaded", true, "active", info));
    }
}
