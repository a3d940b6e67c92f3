package com.fileflow.adapter.out.directory;

import com.fileflow.application.port.out.TeamDirectory;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Team lookup backed by the users document.
 *
 * The document maps an account key (email or username) to an object carrying
 * {@code username} and {@code team_tags}; the first tag is the user's team.
 * Any failure to consult the document answers with the default team.
 */
@Slf4j
@RequiredArgsConstructor
public class JsonTeamDirectory implements TeamDirectory {

    private final Vertx vertx;
    private final String usersFile;
    private final String defaultTeam;

    @Override
    public Future<String> teamOf(String userId) {
        return vertx.fileSystem().readFile(usersFile)
                .map(buffer -> findTeam(new JsonObject(buffer), userId))
                .recover(error -> {
                    log.warn("Team directory unavailable ({}), using default team {} for {}",
                            error.getMessage(), defaultTeam, userId);
                    return Future.succeededFuture(defaultTeam);
                });
    }

    private String findTeam(JsonObject users, String userId) {
        for (String key : users.fieldNames()) {
            Object value = users.getValue(key);
            if (!(value instanceof JsonObject)) {
                continue;
            }
            JsonObject user = (JsonObject) value;
            if (key.equals(userId) || userId.equals(user.getString("username"))) {
                JsonArray teams = user.getJsonArray("team_tags");
                if (teams != null && !teams.isEmpty() && teams.getValue(0) instanceof String) {
                    return teams.getString(0);
                }
                log.debug("User {} has no team tags, using default team {}", userId, defaultTeam);
                return defaultTeam;
            }
        }
        log.debug("User {} not found in {}, using default team {}", userId, usersFile, defaultTeam);
        return defaultTeam;
    }
}
