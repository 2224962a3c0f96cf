package com.campaign.canon.correction;

/**
 * Tagged correction actions. Each action belongs to one target type and names the
 * payload key it requires (null when it takes no payload).
 */
public enum CorrectionAction {
    ENTITY_RENAME(TargetType.ENTITY, "name"),
    ENTITY_ALIAS_ADD(TargetType.ENTITY, "alias"),
    ENTITY_ALIAS_REMOVE(TargetType.ENTITY, "alias"),
    ENTITY_MERGE(TargetType.ENTITY, "into_id"),
    ENTITY_UNMERGE(TargetType.ENTITY, null),
    ENTITY_HIDE(TargetType.ENTITY, null),
    ENTITY_UNHIDE(TargetType.ENTITY, null),
    THREAD_STATUS(TargetType.THREAD, "status"),
    THREAD_TITLE(TargetType.THREAD, "title"),
    THREAD_SUMMARY(TargetType.THREAD, "summary"),
    THREAD_MERGE(TargetType.THREAD, "into_id"),
    THREAD_UNMERGE(TargetType.THREAD, null),
    THREAD_HIDE(TargetType.THREAD, null),
    THREAD_UNHIDE(TargetType.THREAD, null);

    public static final String MERGE_TARGET_KEY = "into_id";

    private final TargetType targetType;
    private final String payloadKey;

    CorrectionAction(TargetType targetType, String payloadKey) {
        this.targetType = targetType;
        this.payloadKey = payloadKey;
    }

    public TargetType targetType() {
        return targetType;
    }

    /**
     * The payload key this action reads, or null if it takes none.
     */
    public String payloadKey() {
        return payloadKey;
    }

    public boolean isMerge() {
        return this == ENTITY_MERGE || this == THREAD_MERGE;
    }

    /**
     * Whether an empty payload value is meaningful (clearing a thread summary).
     */
    public boolean allowsBlankValue() {
        return this == THREAD_SUMMARY;
    }
}
