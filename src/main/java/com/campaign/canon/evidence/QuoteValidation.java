package com.campaign.canon.evidence;

/**
 * Outcome of validating a quote candidate.
 *
 * @param outcome valid, repaired or dropped
 * @param quote   the quote to persist, null when dropped
 * @param reason  why the candidate was repaired or dropped, null when valid
 */
public record QuoteValidation(SpanValidation.Outcome outcome, Quote quote, String reason) {

    static QuoteValidation valid(Quote quote) {
        return new QuoteValidation(SpanValidation.Outcome.VALID, quote, null);
    }

    static QuoteValidation repaired(Quote quote, String reason) {
        return new QuoteValidation(SpanValidation.Outcome.REPAIRED, quote, reason);
    }

    static QuoteValidation dropped(String reason) {
        return new QuoteValidation(SpanValidation.Outcome.DROPPED, null, reason);
    }

    public boolean isKept() {
        return quote != null;
    }
}
