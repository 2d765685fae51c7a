package com.example.manifestextract.schema;

import com.example.manifestextract.config.ExtractionProperties;
import com.example.manifestextract.service.TargetField;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Manifest kinds known to the service, loaded once from a classpath JSON file.
 */
@Slf4j
@Component
public class SchemaRegistry {

    private final Map<String, ManifestSchema> schemas;

    public SchemaRegistry(ObjectMapper objectMapper, ExtractionProperties properties) {
        this(loadSchemas(objectMapper, properties.getSchemaLocation()));
    }

    SchemaRegistry(List<ManifestSchema> schemas) {
        Map<String, ManifestSchema> byName = new LinkedHashMap<>();
        for (ManifestSchema schema : schemas) {
            validate(schema);
            if (byName.putIfAbsent(schema.name(), schema) != null) {
                throw new IllegalStateException("Duplicate manifest schema: " + schema.name());
            }
        }
        this.schemas = Collections.unmodifiableMap(byName);
        log.info("Loaded manifest schemas {}", this.schemas.keySet());
    }

    public ManifestSchema get(String name) {
        ManifestSchema schema = name == null ? null : schemas.get(name);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown manifest kind: " + name
                    + ". Known kinds: " + schemas.keySet());
        }
        return schema;
    }

    public List<ManifestSchema> all() {
        return new ArrayList<>(schemas.values());
    }

    static List<ManifestSchema> loadSchemas(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Manifest schema file not found on classpath: " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            SchemaConfig config = objectMapper.readValue(input, SchemaConfig.class);
            if (config == null || config.schemas() == null) {
                return List.of();
            }
            return config.schemas().stream()
                    .filter(Objects::nonNull)
                    .toList();
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Manifest schema file could not be read: " + e.getMessage(), e);
        }
    }

    private static void validate(ManifestSchema schema) {
        if (schema.name() == null || schema.name().isBlank()) {
            throw new IllegalStateException("Manifest schema without a name.");
        }
        if (schema.fields().isEmpty()) {
            throw new IllegalStateException("Manifest schema '" + schema.name() + "' declares no fields.");
        }
        if (schema.threshold() != null && !(schema.threshold() > 0 && schema.threshold() <= 1)) {
            throw new IllegalStateException("Manifest schema '" + schema.name()
                    + "' has threshold outside (0, 1]: " + schema.threshold());
        }
        if (schema.maxHeaderSearchRows() != null && schema.maxHeaderSearchRows() <= 0) {
            throw new IllegalStateException("Manifest schema '" + schema.name()
                    + "' has non-positive maxHeaderSearchRows.");
        }
        if (schema.maxRows() != null && schema.maxRows() <= 0) {
            throw new IllegalStateException("Manifest schema '" + schema.name() + "' has non-positive maxRows.");
        }
        Set<String> keys = new HashSet<>();
        for (TargetField field : schema.fields()) {
            if (!keys.add(field.key())) {
                throw new IllegalStateException("Manifest schema '" + schema.name()
                        + "' declares field '" + field.key() + "' twice.");
            }
        }
    }
}
