package com.campaign.canon.lock;

/**
 * Lock key conventions.
 */
public final class LockKeys {

    private LockKeys() {
    }

    /** Ledger mutation and entity/thread creation for a campaign. */
    public static String campaign(String campaignId) {
        return "campaign:" + campaignId;
    }

    /** Step transitions of one run. */
    public static String run(String runId) {
        return "run:" + runId;
    }

    /** Run creation for one session. */
    public static String session(String campaignId, String sessionId) {
        return "session:" + campaignId + ":" + sessionId;
    }
}
