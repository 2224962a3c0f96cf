package com.campaign.canon.evidence;

import com.campaign.canon.core.model.EvidenceSpan;

/**
 * Outcome of validating one evidence span.
 *
 * @param outcome valid, repaired or dropped
 * @param span    the span to keep (the repaired one when repaired), null when dropped
 * @param reason  why the span was repaired or dropped, null when valid
 */
public record SpanValidation(Outcome outcome, EvidenceSpan span, String reason) {

    public enum Outcome { VALID, REPAIRED, DROPPED }

    public static SpanValidation valid(EvidenceSpan span) {
        return new SpanValidation(Outcome.VALID, span, null);
    }

    public static SpanValidation repaired(EvidenceSpan span, String reason) {
        return new SpanValidation(Outcome.REPAIRED, span, reason);
    }

    public static SpanValidation dropped(String reason) {
        return new SpanValidation(Outcome.DROPPED, null, reason);
    }

    public boolean isKept() {
        return outcome != Outcome.DROPPED;
    }
}
