package com.campaign.canon.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Base record of a campaign entity, created the first time resolution sees an
 * unknown name. The canonical name stored here is the originally extracted value;
 * corrections never rewrite it, they are folded on top by the canonical map.
 * Entities are never physically deleted.
 */
public class CampaignEntity {
    private final String id;
    private final String campaignId;
    private final EntityType type;
    private final String canonicalName;
    private final String description;
    private final Set<String> aliases;
    private final Instant createdAt;

    private CampaignEntity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.campaignId = builder.campaignId;
        this.type = builder.type != null ? builder.type : EntityType.OTHER;
        this.canonicalName = builder.canonicalName.trim();
        this.description = builder.description;
        this.aliases = new LinkedHashSet<>(builder.aliases);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public EntityType getType() {
        return type;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Aliases learned during resolution, in insertion order.
     */
    public synchronized Set<String> getAliases() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
    }

    /**
     * Records a surface form seen for this entity.
     *
     * @return true if the alias was not known before
     */
    public synchronized boolean addAlias(String alias) {
        if (alias == null || alias.isBlank() || alias.trim().equalsIgnoreCase(canonicalName)) {
            return false;
        }
        return aliases.add(alias.trim());
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CampaignEntity that = (CampaignEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CampaignEntity{" +
                "id='" + id + '\'' +
                ", campaignId='" + campaignId + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", type=" + type +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String campaignId;
        private EntityType type;
        private String canonicalName;
        private String description;
        private final Set<String> aliases = new LinkedHashSet<>();
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CampaignEntity build() {
            Objects.requireNonNull(campaignId, "campaignId is required");
            Objects.requireNonNull(canonicalName, "canonicalName is required");
            if (canonicalName.isBlank()) {
                throw new IllegalArgumentException("canonicalName must not be blank");
            }
            return new CampaignEntity(this);
        }
    }
}
