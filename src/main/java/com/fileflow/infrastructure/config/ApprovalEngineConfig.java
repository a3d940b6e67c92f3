package com.fileflow.infrastructure.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

/**
 * Engine settings, read from the {@code storage}, {@code notifications}, {@code teams}
 * and {@code tasks} sections of application.yml
 */
@Value
@Builder(toBuilder = true)
public class ApprovalEngineConfig {

    @Builder.Default
    String dataDir = "data/new_file_approvals";

    @Builder.Default
    String usersDir = "data/uploads";

    @Builder.Default
    long lockTimeoutMs = 10_000;

    @Builder.Default
    int maxNotifications = 50;

    @Builder.Default
    String teamDirectoryFile = "data/users.json";

    @Builder.Default
    String defaultTeam = "DEFAULT";

    @Builder.Default
    int taskMaxAttempts = 3;

    @Builder.Default
    long taskRetryDelayMs = 500;

    public static ApprovalEngineConfig defaults() {
        return ApprovalEngineConfig.builder().build();
    }

    /**
     * Missing keys keep their defaults
     */
    public static ApprovalEngineConfig fromJson(JsonObject config) {
        ApprovalEngineConfig defaults = defaults();
        JsonObject storage = section(config, "storage");
        JsonObject notifications = section(config, "notifications");
        JsonObject teams = section(config, "teams");
        JsonObject tasks = section(config, "tasks");

        ApprovalEngineConfig loaded = ApprovalEngineConfig.builder()
                .dataDir(storage.getString("data-dir", defaults.getDataDir()))
                .usersDir(storage.getString("users-dir", defaults.getUsersDir()))
                .lockTimeoutMs(storage.getLong("lock-timeout-ms", defaults.getLockTimeoutMs()))
                .maxNotifications(notifications.getInteger("max-entries", defaults.getMaxNotifications()))
                .teamDirectoryFile(teams.getString("directory-file", defaults.getTeamDirectoryFile()))
                .defaultTeam(teams.getString("default-team", defaults.getDefaultTeam()))
                .taskMaxAttempts(tasks.getInteger("max-attempts", defaults.getTaskMaxAttempts()))
                .taskRetryDelayMs(tasks.getLong("retry-delay-ms", defaults.getTaskRetryDelayMs()))
                .build();
        loaded.validate();
        return loaded;
    }

    public void validate() {
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException("storage.lock-timeout-ms must be positive");
        }
        if (maxNotifications <= 0) {
            throw new IllegalArgumentException("notifications.max-entries must be positive");
        }
        if (taskMaxAttempts <= 0) {
            throw new IllegalArgumentException("tasks.max-attempts must be positive");
        }
        if (taskRetryDelayMs < 0) {
            throw new IllegalArgumentException("tasks.retry-delay-ms must not be negative");
        }
        if (defaultTeam == null || defaultTeam.isBlank()) {
            throw new IllegalArgumentException("teams.default-team is required");
        }
    }

    private static JsonObject section(JsonObject config, String name) {
        JsonObject section = config == null ? null : config.getJsonObject(name);
        return section == null ? new JsonObject() : section;
    }
}
