package com.campaign.canon.canonical;

/**
 * Outcome of looking a surface name up in the entity canonical map.
 *
 * @param outcome           live, hidden or unknown
 * @param entityId          the resolved entity (merge root for live names), null if unknown
 * @param canonicalName     the current canonical name, null unless live
 * @param viaNormalizedForm true when only the article/punctuation-insensitive form matched,
 *                          for live and hidden outcomes alike
 */
public record NameResolution(Outcome outcome, String entityId, String canonicalName, boolean viaNormalizedForm) {

    public enum Outcome { LIVE, HIDDEN, UNKNOWN }

    private static final NameResolution UNKNOWN = new NameResolution(Outcome.UNKNOWN, null, null, false);

    public static NameResolution live(String entityId, String canonicalName, boolean viaNormalizedForm) {
        return new NameResolution(Outcome.LIVE, entityId, canonicalName, viaNormalizedForm);
    }

    public static NameResolution hidden(String entityId, boolean viaNormalizedForm) {
        return new NameResolution(Outcome.HIDDEN, entityId, null, viaNormalizedForm);
    }

    public static NameResolution unknown() {
        return UNKNOWN;
    }

    public boolean isLive() {
        return outcome == Outcome.LIVE;
    }

    public boolean isHidden() {
        return outcome == Outcome.HIDDEN;
    }

    public boolean isUnknown() {
        return outcome == Outcome.UNKNOWN;
    }
}
