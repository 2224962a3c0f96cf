package com.campaign.canon.correction;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An attributed, append-only override of canonical state.
 *
 * <p>Everything but the review state is immutable once created; state and the
 * decided fields change exactly once, through an explicit approval or rejection.
 * Reversal is a new correction (re-rename, unhide, unmerge), never an edit.</p>
 */
public class Correction {

    /**
     * Ledger order: creation time, then insertion sequence, then id.
     */
    public static final Comparator<Correction> LEDGER_ORDER = Comparator
            .comparing(Correction::getCreatedAt)
            .thenComparingLong(Correction::getSequence)
            .thenComparing(Correction::getId);

    private final String id;
    private final String campaignId;
    private final String sessionId;
    private final TargetType targetType;
    private final String targetId;
    private final CorrectionAction action;
    private final Map<String, String> payload;
    private final String createdBy;
    private final ActorRole authorRole;
    private final Instant createdAt;
    private final long sequence;
    private CorrectionState state;
    private String decidedBy;
    private Instant decidedAt;

    private Correction(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.campaignId = Objects.requireNonNull(builder.campaignId, "campaignId is required");
        this.sessionId = builder.sessionId;
        this.targetType = Objects.requireNonNull(builder.targetType, "targetType is required");
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId is required");
        this.action = Objects.requireNonNull(builder.action, "action is required");
        this.payload = builder.payload != null ? Map.copyOf(builder.payload) : Map.of();
        this.createdBy = builder.createdBy;
        this.authorRole = builder.authorRole != null ? builder.authorRole : ActorRole.PLAYER;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.sequence = builder.sequence;
        this.state = builder.state != null ? builder.state : CorrectionState.PENDING;
        this.decidedBy = builder.decidedBy;
        this.decidedAt = builder.decidedAt;
    }

    public String getId() {
        return id;
    }

    public String getCampaignId() {
        return campaignId;
    }

    /**
     * Session scope, or null for a campaign-wide correction.
     */
    public String getSessionId() {
        return sessionId;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public String getTargetId() {
        return targetId;
    }

    public CorrectionAction getAction() {
        return action;
    }

    public Map<String, String> getPayload() {
        return payload;
    }

    /**
     * The value stored under the action's payload key.
     */
    public String payloadValue() {
        String key = action.payloadKey();
        return key == null ? null : payload.get(key);
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public ActorRole getAuthorRole() {
        return authorRole;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getSequence() {
        return sequence;
    }

    public synchronized CorrectionState getState() {
        return state;
    }

    public synchronized String getDecidedBy() {
        return decidedBy;
    }

    public synchronized Instant getDecidedAt() {
        return decidedAt;
    }

    public boolean isPending() {
        return getState() == CorrectionState.PENDING;
    }

    public boolean isApproved() {
        return getState() == CorrectionState.APPROVED;
    }

    /**
     * Whether this correction applies to a map built for the given session scope.
     */
    public boolean appliesTo(String scopeSessionId) {
        return sessionId == null || sessionId.equals(scopeSessionId);
    }

    synchronized void markApproved(String reviewerId, Instant when) {
        this.state = CorrectionState.APPROVED;
        this.decidedBy = reviewerId;
        this.decidedAt = when;
    }

    synchronized void markRejected(String reviewerId, Instant when) {
        this.state = CorrectionState.REJECTED;
        this.decidedBy = reviewerId;
        this.decidedAt = when;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Correction that = (Correction) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Correction{" +
                "id='" + id + '\'' +
                ", action=" + action +
                ", targetId='" + targetId + '\'' +
                ", payload=" + payload +
                ", state=" + state +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String campaignId;
        private String sessionId;
        private TargetType targetType;
        private String targetId;
        private CorrectionAction action;
        private Map<String, String> payload;
        private String createdBy;
        private ActorRole authorRole;
        private Instant createdAt;
        private long sequence;
        private CorrectionState state;
        private String decidedBy;
        private Instant decidedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder targetType(TargetType targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        /**
         * Sets the action and, when not yet set, its target type.
         */
        public Builder action(CorrectionAction action) {
            this.action = action;
            if (this.targetType == null && action != null) {
                this.targetType = action.targetType();
            }
            return this;
        }

        public Builder payload(Map<String, String> payload) {
            this.payload = payload;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder authorRole(ActorRole authorRole) {
            this.authorRole = authorRole;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder state(CorrectionState state) {
            this.state = state;
            return this;
        }

        public Builder decidedBy(String decidedBy) {
            this.decidedBy = decidedBy;
            return this;
        }

        public Builder decidedAt(Instant decidedAt) {
            this.decidedAt = decidedAt;
            return this;
        }

        public Correction build() {
            return new Correction(this);
        }
    }
}
