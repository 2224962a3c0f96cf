package com.campaign.canon.evidence;

import com.campaign.canon.core.ErrorCode;
import com.campaign.canon.core.model.EvidenceSpan;
import com.campaign.canon.core.model.Utterance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceValidatorTest {

    private static final String TEXT = "I swear by the Raven Queen.";
    private static final Utterance UTTERANCE = new Utterance("s1:0", "s1", "Alice", 0, 4000, TEXT);

    private final EvidenceValidator validator = new EvidenceValidator();

    @Nested
    @DisplayName("Span validation")
    class SpanTests {

        @Test
        @DisplayName("Should keep an in-range span unchanged")
        void testValidSpan() {
            EvidenceSpan span = EvidenceSpan.of("s1:0", 2, 7);

            SpanValidation result = validator.validate(span, TEXT);

            assertEquals(SpanValidation.Outcome.VALID, result.outcome());
            assertSame(span, result.span());
            assertNull(result.reason());
        }

        @Test
        @DisplayName("Should clamp an end offset past the text length")
        void testClampEnd() {
            SpanValidation result = validator.validate(EvidenceSpan.of("s1:0", 0, 9999), TEXT);

            assertEquals(SpanValidation.Outcome.REPAIRED, result.outcome());
            assertEquals(0, result.span().charStart());
            assertEquals(TEXT.length(), result.span().charEnd());
        }

        @Test
        @DisplayName("Should swap inverted offsets")
        void testSwap() {
            SpanValidation result = validator.validate(EvidenceSpan.of("s1:0", 14, 2), TEXT);

            assertEquals(SpanValidation.Outcome.REPAIRED, result.outcome());
            assertEquals("swear by the", TEXT.substring(result.span().charStart(), result.span().charEnd()));
        }

        @Test
        @DisplayName("Should fill a missing end with the utterance boundary")
        void testOneSided() {
            SpanValidation result = validator.validate(new EvidenceSpan("s1:0", 15, null, null, null), TEXT);

            assertEquals(SpanValidation.Outcome.REPAIRED, result.outcome());
            assertEquals(15, result.span().charStart());
            assertEquals(TEXT.length(), result.span().charEnd());
            assertEquals("missing offset filled", result.reason());
        }

        @Test
        @DisplayName("Should trim surrounding whitespace from the range")
        void testTrimWhitespace() {
            SpanValidation result = validator.validate(EvidenceSpan.of("s1:0", 1, 8), TEXT);

            assertEquals(SpanValidation.Outcome.REPAIRED, result.outcome());
            assertEquals("swear", TEXT.substring(result.span().charStart(), result.span().charEnd()));
        }

        @Test
        @DisplayName("Should drop a span that covers only whitespace")
        void testWhitespaceOnlyDropped() {
            SpanValidation result = validator.validate(EvidenceSpan.of("s1:0", 1, 2), TEXT);

            assertEquals(SpanValidation.Outcome.DROPPED, result.outcome());
            assertFalse(result.isKept());
        }

        @Test
        @DisplayName("Should drop a span citing an unknown utterance")
        void testUnknownUtterance() {
            SpanValidation result = validator.validate(EvidenceSpan.of("s1:99", 0, 3), null);

            assertEquals(SpanValidation.Outcome.DROPPED, result.outcome());
            assertTrue(result.reason().contains("s1:99"));
        }

        @Test
        @DisplayName("Unranged span should stay unranged unless filling is enabled")
        void testUnranged() {
            EvidenceSpan span = EvidenceSpan.unranged("s1:0");
            assertEquals(SpanValidation.Outcome.VALID, validator.validate(span, TEXT).outcome());

            EvidenceValidator filling = new EvidenceValidator(new EvidenceOptions(true, 0.5));
            SpanValidation filled = filling.validate(span, "  hi  ");
            assertEquals(SpanValidation.Outcome.REPAIRED, filled.outcome());
            assertEquals(2, filled.span().charStart());
            assertEquals(4, filled.span().charEnd());
        }
    }

    @Nested
    @DisplayName("Cleaning")
    class CleaningTests {

        private final Map<String, String> texts = Map.of("s1:0", TEXT);

        @Test
        @DisplayName("Should keep, repair and drop spans and count each")
        void testCleanEvidence() {
            List<EvidenceSpan> spans = Arrays.asList(
                    EvidenceSpan.of("s1:0", 2, 7),
                    EvidenceSpan.of("s1:0", 0, 9999),
                    EvidenceSpan.of("s1:42", 0, 3),
                    new EvidenceSpan(null, 0, 3, null, null));

            CleanedEvidence cleaned = validator.cleanEvidence(spans, texts::get);

            assertEquals(2, cleaned.spans().size());
            assertEquals(1, cleaned.repaired());
            assertEquals(2, cleaned.dropped());
            assertFalse(cleaned.complete());
        }

        @Test
        @DisplayName("Should demote confidence only when spans were dropped")
        void testAdjustConfidence() {
            CleanedEvidence incomplete = new CleanedEvidence(List.of(), 0, 1);
            CleanedEvidence complete = new CleanedEvidence(List.of(), 1, 0);

            assertEquals(0.4, validator.adjustConfidence(0.8, incomplete), 1e-9);
            assertEquals(0.8, validator.adjustConfidence(0.8, complete), 1e-9);
            assertNull(validator.adjustConfidence(null, incomplete));
        }
    }

    @Nested
    @DisplayName("Quotes")
    class QuoteTests {

        @Test
        @DisplayName("Quote text should be the exact utterance slice")
        void testQuoteFromRange() {
            QuoteValidation result = validator.validateQuote(QuoteCandidate.of("s1:0", 2, 7), UTTERANCE, "r1");

            assertEquals(SpanValidation.Outcome.VALID, result.outcome());
            Quote quote = result.quote();
            assertEquals("swear", quote.getText());
            assertEquals("Alice", quote.getSpeaker());
            assertEquals("s1", quote.getSessionId());
            assertEquals("r1", quote.getRunId());
        }

        @Test
        @DisplayName("Should relocate a quote to its expected text")
        void testRelocation() {
            QuoteCandidate candidate = new QuoteCandidate("s1:0", 0, 5, "Bob", null, "Raven Queen");

            QuoteValidation result = validator.validateQuote(candidate, UTTERANCE, "r1");

            assertEquals(SpanValidation.Outcome.REPAIRED, result.outcome());
            assertEquals(15, result.quote().getCharStart());
            assertEquals("Raven Queen", result.quote().getText());
            assertEquals("Bob", result.quote().getSpeaker());
        }

        @Test
        @DisplayName("Relocation should choose the occurrence nearest the proposed start")
        void testNearestOccurrence() {
            Utterance repeated = new Utterance("s1:1", "s1", "Bob", 0, 1000, "go go go");
            QuoteCandidate candidate = new QuoteCandidate("s1:1", 5, 6, null, null, "go");

            QuoteValidation result = validator.validateQuote(candidate, repeated, "r1");

            assertEquals(6, result.quote().getCharStart());
        }

        @Test
        @DisplayName("Expected text with CRLF line endings should match the normalized utterance")
        void testCrlfExpectedText() {
            Utterance multiline = new Utterance("s1:2", "s1", "DM", 0, 1000, "Hold the line!\r\nFor Vallaki!");

            QuoteValidation exact = validator.validateQuote(
                    new QuoteCandidate("s1:2", 9, 18, null, null, "line!\r\nFor"), multiline, "r1");
            QuoteValidation relocated = validator.validateQuote(
                    new QuoteCandidate("s1:2", 0, 3, null, null, "line!\r\nFor"), multiline, "r1");

            assertEquals(SpanValidation.Outcome.VALID, exact.outcome());
            assertEquals("line!\nFor", exact.quote().getText());
            assertEquals(SpanValidation.Outcome.REPAIRED, relocated.outcome());
            assertEquals(9, relocated.quote().getCharStart());
        }

        @Test
        @DisplayName("Should drop quotes that cannot be anchored")
        void testDroppedQuotes() {
            assertFalse(validator.validateQuote(
                    new QuoteCandidate("s1:0", null, null, null, null, "Lathander"), UTTERANCE, "r1").isKept());
            assertFalse(validator.validateQuote(QuoteCandidate.of("s1:0", null, null), UTTERANCE, "r1").isKept());
            assertFalse(validator.validateQuote(QuoteCandidate.of("s1:0", 1, 2), UTTERANCE, "r1").isKept());
            assertFalse(validator.validateQuote(QuoteCandidate.of("s1:9", 0, 3), null, "r1").isKept());
        }

        @Test
        @DisplayName("Every kept quote should equal its utterance slice")
        void testQuoteInvariant() {
            List<QuoteCandidate> candidates = List.of(
                    QuoteCandidate.of("s1:0", 0, 9999),
                    QuoteCandidate.of("s1:0", 20, 3),
                    QuoteCandidate.of("s1:0", -5, 1),
                    new QuoteCandidate("s1:0", 100, 200, null, null, "the Raven"));

            for (QuoteCandidate candidate : candidates) {
                Quote quote = validator.validateQuote(candidate, UTTERANCE, "r1").quote();
                assertNotNull(quote, candidate.toString());
                assertEquals(TEXT.substring(quote.getCharStart(), quote.getCharEnd()), quote.getText());
                assertDoesNotThrow(() -> validator.requireExact(quote, TEXT));
            }
        }

        @Test
        @DisplayName("Should detect a quote that no longer matches its utterance")
        void testRequireExact() {
            Quote quote = validator.validateQuote(QuoteCandidate.of("s1:0", 2, 7), UTTERANCE, "r1").quote();

            EvidenceIntegrityViolationException e = assertThrows(EvidenceIntegrityViolationException.class,
                    () -> validator.requireExact(quote, "I sweat by the Raven Queen."));
            assertEquals(ErrorCode.EVIDENCE_INTEGRITY_VIOLATION, e.getErrorCode());
            assertThrows(EvidenceIntegrityViolationException.class, () -> validator.requireExact(quote, null));
            assertThrows(EvidenceIntegrityViolationException.class, () -> validator.requireExact(quote, "I"));
        }
    }

    @Nested
    @DisplayName("Summary quotes")
    class SummaryTests {

        private final Quote bankQuote = new Quote("s1", "r1", "s1:0", 15, 26, "Alice", null, "Raven Queen");

        @Test
        @DisplayName("Should accept quoted passages from the quote bank")
        void testAcceptsBankQuotes() {
            assertDoesNotThrow(() -> validator.verifySummaryQuotes(
                    "Alice swore by the \"Raven Queen\" before the fight.", List.of(bankQuote)));
            assertDoesNotThrow(() -> validator.verifySummaryQuotes("No quotes here.", List.of()));
            assertDoesNotThrow(() -> validator.verifySummaryQuotes(null, List.of()));
        }

        @Test
        @DisplayName("Should accept a bank quote written with CRLF line endings")
        void testAcceptsCrlfPassage() {
            Quote multiline = new Quote("s1", "r1", "s1:2", 9, 18, "DM", null, "line!\nFor");

            assertDoesNotThrow(() -> validator.verifySummaryQuotes(
                    "The DM roared \"line!\r\nFor\" at the gate.", List.of(multiline)));
        }

        @Test
        @DisplayName("Should reject quoted passages outside the quote bank")
        void testRejectsUnknownQuote() {
            assertThrows(EvidenceIntegrityViolationException.class, () -> validator.verifySummaryQuotes(
                    "Alice said \"I serve the Morninglord\".", List.of(bankQuote)));
        }

        @Test
        @DisplayName("Should reject summaries leaking utterance ids")
        void testRejectsUtteranceIds() {
            assertThrows(EvidenceIntegrityViolationException.class, () -> validator.verifySummaryQuotes(
                    "Alice swore an oath [s1:0].", List.of(bankQuote)));
        }
    }

    @Test
    @DisplayName("Options should reject a demotion factor outside [0, 1]")
    void testOptionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new EvidenceOptions(false, 1.5));
        assertFalse(EvidenceOptions.defaults().fillMissingOffsets());
    }
}
