package com.fileflow.domain.model;

import lombok.Value;

/**
 * A team leader or administrator acting on the review queue
 */
@Value
public class Reviewer {
    String userId;
    ActorRole role;
    String team;    // only meaningful for team leaders

    public static Reviewer teamLeader(String userId, String team) {
        return new Reviewer(userId, ActorRole.TEAM_LEADER, team);
    }

    public static Reviewer admin(String userId) {
        return new Reviewer(userId, ActorRole.ADMIN, null);
    }
}
