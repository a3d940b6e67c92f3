package com.fileflow.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads application.yml from the classpath
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    public static ApprovalEngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static ApprovalEngineConfig load(String resource) {
        return ApprovalEngineConfig.fromJson(loadJson(resource));
    }

    static JsonObject loadJson(String resource) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> yaml = YAML.readValue(is, new TypeReference<Map<String, Object>>() {});
            log.info("Loaded configuration from {}", resource);
            return yaml == null ? new JsonObject() : new JsonObject(yaml);
        } catch (IOException e) {
            log.error("Failed to load {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Configuration error: cannot read " + resource, e);
        }
    }
}
