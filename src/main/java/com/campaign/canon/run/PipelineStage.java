package com.campaign.canon.run;

import java.util.List;
import java.util.Locale;

/**
 * Session pipeline stages in execution order. Ingest, extract, persist and resolve
 * produce the structured canonical data; their success is what lets a later failure
 * end in {@link RunStatus#PARTIAL} instead of {@link RunStatus#FAILED}.
 */
public enum PipelineStage {
    INGEST(true),
    EXTRACT(true),
    PERSIST(true),
    RESOLVE(true),
    PLAN(false),
    WRITE(false),
    RENDER(false);

    private final boolean structural;

    PipelineStage(boolean structural) {
        this.structural = structural;
    }

    public boolean isStructural() {
        return structural;
    }

    public String stageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * All stages in execution order.
     */
    public static List<PipelineStage> ordered() {
        return List.of(values());
    }
}
