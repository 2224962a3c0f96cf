package com.campaign.canon.canonical;

/**
 * Outcome of looking a thread id or title up in the thread canonical map.
 *
 * @param outcome  live, hidden or unknown
 * @param threadId the merge root, null if unknown
 */
public record ThreadResolution(NameResolution.Outcome outcome, String threadId) {

    private static final ThreadResolution UNKNOWN = new ThreadResolution(NameResolution.Outcome.UNKNOWN, null);

    public static ThreadResolution live(String threadId) {
        return new ThreadResolution(NameResolution.Outcome.LIVE, threadId);
    }

    public static ThreadResolution hidden(String threadId) {
        return new ThreadResolution(NameResolution.Outcome.HIDDEN, threadId);
    }

    public static ThreadResolution unknown() {
        return UNKNOWN;
    }

    public boolean isLive() {
        return outcome == NameResolution.Outcome.LIVE;
    }

    public boolean isHidden() {
        return outcome == NameResolution.Outcome.HIDDEN;
    }

    public boolean isUnknown() {
        return outcome == NameResolution.Outcome.UNKNOWN;
    }
}
