package com.campaign.canon.evidence;

import com.campaign.canon.core.model.EvidenceSpan;
import com.campaign.canon.core.model.Utterance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single enforcement point for evidence integrity.
 *
 * <p>Spans are repaired locally where possible (missing side filled with the
 * utterance boundary, offsets clamped into range, inverted offsets swapped,
 * surrounding whitespace trimmed) and dropped otherwise; a bad span never aborts the
 * caller. {@link Quote}s are only created here, so every displayed quote is an exact
 * substring of its utterance.</p>
 */
public class EvidenceValidator {
    private static final Logger log = LoggerFactory.getLogger(EvidenceValidator.class);

    private static final Pattern QUOTED_PASSAGE = Pattern.compile("\"([^\"]+)\"");

    private final EvidenceOptions options;

    public EvidenceValidator() {
        this(EvidenceOptions.defaults());
    }

    public EvidenceValidator(EvidenceOptions options) {
        this.options = options;
    }

    public EvidenceOptions getOptions() {
        return options;
    }

    /**
     * Validates a span against the text of the utterance it cites.
     *
     * @param utteranceText the utterance text, or null when the utterance is unknown
     */
    public SpanValidation validate(EvidenceSpan span, String utteranceText) {
        if (span == null || span.utteranceId() == null) {
            return SpanValidation.dropped("missing utterance id");
        }
        if (utteranceText == null) {
            return SpanValidation.dropped("unknown utterance " + span.utteranceId());
        }
        if (span.charStart() == null && span.charEnd() == null) {
            if (!options.fillMissingOffsets()) {
                return SpanValidation.valid(span);
            }
            return toRange(span, utteranceText, 0, utteranceText.length(), "missing offsets filled");
        }

        boolean oneSided = span.charStart() == null || span.charEnd() == null;
        int start = span.charStart() != null ? span.charStart() : 0;
        int end = span.charEnd() != null ? span.charEnd() : utteranceText.length();
        return toRange(span, utteranceText, start, end, oneSided ? "missing offset filled" : "offsets adjusted");
    }

    private SpanValidation toRange(EvidenceSpan span, String text, int start, int end, String reason) {
        int[] range = normalizeRange(text, start, end);
        if (range == null) {
            return SpanValidation.dropped("empty range in utterance " + span.utteranceId());
        }
        if (span.isRanged() && range[0] == span.charStart() && range[1] == span.charEnd()) {
            return SpanValidation.valid(span);
        }
        return SpanValidation.repaired(span.withRange(range[0], range[1]), reason);
    }

    /**
     * Clamps into {@code [0, len]}, swaps inverted offsets and trims surrounding
     * whitespace. Returns null when nothing is left.
     */
    private static int[] normalizeRange(String text, int start, int end) {
        int len = text.length();
        int s = Math.max(0, Math.min(start, len));
        int e = Math.max(0, Math.min(end, len));
        if (s > e) {
            int tmp = s;
            s = e;
            e = tmp;
        }
        while (s < e && Character.isWhitespace(text.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
            e--;
        }
        return s == e ? null : new int[]{s, e};
    }

    /**
     * Validates a quote candidate. A quote needs a range, unless it carries the text it
     * expects to quote, in which case the utterance is searched for that text (nearest
     * occurrence to the proposed start).
     *
     * @param utterance the cited utterance, or null when unknown
     * @param runId     the run persisting the quote
     */
    public QuoteValidation validateQuote(QuoteCandidate candidate, Utterance utterance, String runId) {
        if (candidate == null || candidate.utteranceId() == null) {
            return QuoteValidation.dropped("missing utterance id");
        }
        if (utterance == null) {
            return QuoteValidation.dropped("unknown utterance " + candidate.utteranceId());
        }
        String text = utterance.text();
        boolean ranged = candidate.charStart() != null && candidate.charEnd() != null;

        int[] range = ranged ? normalizeRange(text, candidate.charStart(), candidate.charEnd()) : null;
        boolean adjusted = range != null && (range[0] != candidate.charStart() || range[1] != candidate.charEnd());

        if (candidate.hasExpectedText()) {
            String expected = Utterance.normalizeNewlines(candidate.expectedText());
            if (range != null && text.substring(range[0], range[1]).equals(expected)) {
                return quote(candidate, utterance, runId, range, adjusted ? "offsets adjusted" : null);
            }
            int hint = candidate.charStart() != null ? candidate.charStart() : 0;
            int found = nearestOccurrence(text, expected, hint);
            if (found < 0) {
                return QuoteValidation.dropped("quoted text not found in utterance " + candidate.utteranceId());
            }
            return quote(candidate, utterance, runId, new int[]{found, found + expected.length()},
                    "relocated to matching text");
        }

        if (!ranged) {
            return QuoteValidation.dropped("quote without range in utterance " + candidate.utteranceId());
        }
        if (range == null) {
            return QuoteValidation.dropped("empty range in utterance " + candidate.utteranceId());
        }
        return quote(candidate, utterance, runId, range, adjusted ? "offsets adjusted" : null);
    }

    private QuoteValidation quote(QuoteCandidate candidate, Utterance utterance, String runId,
                                  int[] range, String repairReason) {
        String speaker = candidate.speaker() != null && !candidate.speaker().isBlank()
                ? candidate.speaker().trim() : utterance.speaker();
        Quote quote = new Quote(utterance.sessionId(), runId, utterance.id(), range[0], range[1],
                speaker, candidate.note(), utterance.text().substring(range[0], range[1]));
        return repairReason == null
                ? QuoteValidation.valid(quote)
                : QuoteValidation.repaired(quote, repairReason);
    }

    private static int nearestOccurrence(String text, String needle, int hint) {
        int best = -1;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            if (best < 0 || Math.abs(idx - hint) < Math.abs(best - hint)) {
                best = idx;
            }
            idx = text.indexOf(needle, idx + 1);
        }
        return best;
    }

    /**
     * Cleans the evidence list of one owner.
     *
     * @param utteranceText lookup from utterance id to text; null for unknown ids
     */
    public CleanedEvidence cleanEvidence(List<EvidenceSpan> spans, Function<String, String> utteranceText) {
        List<EvidenceSpan> kept = new ArrayList<>();
        int repaired = 0;
        int dropped = 0;
        for (EvidenceSpan span : spans) {
            String text = span != null && span.utteranceId() != null ? utteranceText.apply(span.utteranceId()) : null;
            SpanValidation result = validate(span, text);
            switch (result.outcome()) {
                case VALID -> kept.add(result.span());
                case REPAIRED -> {
                    kept.add(result.span());
                    repaired++;
                }
                case DROPPED -> {
                    dropped++;
                    log.debug("Evidence span dropped: {}", result.reason());
                }
            }
        }
        return new CleanedEvidence(kept, repaired, dropped);
    }

    /**
     * Confidence of an owner after cleaning; demoted when spans were dropped.
     */
    public Double adjustConfidence(Double confidence, CleanedEvidence cleaned) {
        if (confidence == null || cleaned.complete()) {
            return confidence;
        }
        return confidence * options.confidenceDemotion();
    }

    /**
     * Asserts that a quote is still the exact slice of its utterance.
     *
     * @throws EvidenceIntegrityViolationException if it is not
     */
    public void requireExact(Quote quote, String utteranceText) {
        if (utteranceText == null
                || quote.getCharEnd() > utteranceText.length()
                || !utteranceText.substring(quote.getCharStart(), quote.getCharEnd()).equals(quote.getText())) {
            throw new EvidenceIntegrityViolationException(
                    "Quote " + quote.getId() + " does not match utterance " + quote.getUtteranceId());
        }
    }

    /**
     * Checks a generated summary: it must not leak utterance ids, and every
     * double-quoted passage must be the text of a persisted quote.
     *
     * @throws EvidenceIntegrityViolationException on the first offending passage
     */
    public void verifySummaryQuotes(String summaryText, Collection<Quote> quotes) {
        if (summaryText == null || summaryText.isEmpty()) {
            return;
        }
        if (summaryText.contains("[") && summaryText.contains("]")) {
            throw new EvidenceIntegrityViolationException("Summary appears to contain utterance ids");
        }
        Set<String> allowed = new HashSet<>();
        for (Quote quote : quotes) {
            allowed.add(quote.getText());
        }
        Matcher matcher = QUOTED_PASSAGE.matcher(summaryText);
        while (matcher.find()) {
            String passage = Utterance.normalizeNewlines(matcher.group(1));
            if (!allowed.contains(passage)) {
                String sample = passage.length() > 120 ? passage.substring(0, 120) : passage;
                throw new EvidenceIntegrityViolationException("Summary contains quote not in quote bank: " + sample);
            }
        }
    }
}
