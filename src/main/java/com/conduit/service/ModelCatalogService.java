package com.conduit.service;

import com.conduit.config.ConduitProperties;
import com.conduit.exception.ValidationException;
import com.conduit.model.ModelInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model catalog: the models served by {@code GET /v1/models} and alias resolution
 * applied to inbound requests before dispatch.
 */
@Slf4j
@Service
public class ModelCatalogService {

    private final ConduitProperties properties;
    private final long createdAt = Instant.now().getEpochSecond();

    public ModelCatalogService(ConduitProperties properties) {
        this.properties = properties;
    }

    /**
     * Resolve the inbound model name to the one forwarded upstream.
     *
     * @throws ValidationException if the model is missing, or unknown while validation is on
     */
    public String resolve(String model) {
        if (!StringUtils.hasText(model)) {
            throw new ValidationException("Model must be specified", "model", "missing_model");
        }

        ConduitProperties.ModelsConfig models = properties.getModels();
        String mapped = models.getMappings().get(model);
        if (mapped != null) {
            log.debug("Mapped model '{}' to '{}'", model, mapped);
            return mapped;
        }

        if (models.isValidate() && !models.getAvailable().contains(model)) {
            if (models.isAllowUnknown()) {
                log.warn("Forwarding unknown model '{}'", model);
                return model;
            }
            throw new ValidationException("The model '" + model + "' does not exist", "model", "model_not_found");
        }
        return model;
    }

    /**
     * Catalog entries, available models first, then aliases.
     */
    public List<ModelInfo> listModels(String ownedBy) {
        Set<String> ids = new LinkedHashSet<>(properties.getModels().getAvailable());
        ids.addAll(properties.getModels().getMappings().keySet());

        List<ModelInfo> models = new ArrayList<>(ids.size());
        for (String id : ids) {
            models.add(ModelInfo.builder()
                    .id(id)
                    .created(createdAt)
                    .ownedBy(ownedBy)
                    .build());
        }
        return models;
    }

    public Map<String, String> getMappings() {
        return properties.getModels().getMappings();
    }
}
