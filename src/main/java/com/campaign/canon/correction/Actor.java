package com.campaign.canon.correction;

import java.util.Objects;

/**
 * An attributed user acting on the ledger.
 */
public record Actor(String id, ActorRole role) {

    public Actor {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(role, "role is required");
    }

    public static Actor dm(String id) {
        return new Actor(id, ActorRole.DM);
    }

    public static Actor player(String id) {
        return new Actor(id, ActorRole.PLAYER);
    }

    public boolean isDm() {
        return role == ActorRole.DM;
    }
}
