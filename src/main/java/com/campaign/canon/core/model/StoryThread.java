package com.campaign.canon.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Base record of a campaign-level story thread (quest, mystery, arc).
 * Its identity is stable across sessions; per-session progress is recorded as
 * {@link ThreadUpdate}s. Title, status and summary shown to readers are the values
 * here with approved corrections folded on top.
 */
public class StoryThread {
    private final String id;
    private final String campaignId;
    private final String title;
    private final ThreadKind kind;
    private final ThreadStatus status;
    private final String summary;
    private final Instant createdAt;

    private StoryThread(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.campaignId = builder.campaignId;
        this.title = builder.title.trim();
        this.kind = builder.kind != null ? builder.kind : ThreadKind.OTHER;
        this.status = builder.status != null ? builder.status : ThreadStatus.PROPOSED;
        this.summary = builder.summary;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getTitle() {
        return title;
    }

    public ThreadKind getKind() {
        return kind;
    }

    public ThreadStatus getStatus() {
        return status;
    }

    public String getSummary() {
        return summary;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoryThread that = (StoryThread) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "StoryThread{id='" + id + "', title='" + title + "', status=" + status + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String campaignId;
        private String title;
        private ThreadKind kind;
        private ThreadStatus status;
        private String summary;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder kind(ThreadKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(ThreadStatus status) {
            this.status = status;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public StoryThread build() {
            Objects.requireNonNull(campaignId, "campaignId is required");
            Objects.requireNonNull(title, "title is required");
            if (title.isBlank()) {
                throw new IllegalArgumentException("title must not be blank");
            }
            return new StoryThread(this);
        }
    }
}
