package com.campaign.canon.resolution;

/**
 * Quality counters of one thread resolution pass.
 */
public record ThreadCounters(
        int threadsResolved,
        int threadsCreated,
        int threadsDroppedHidden,
        int threadsDroppedBlank,
        int updatesAppended,
        int updatesDropped
) {
    public static ThreadCounters empty() {
        return new ThreadCounters(0, 0, 0, 0, 0, 0);
    }
}
