package com.campaign.canon.extract;

import com.campaign.canon.core.model.EntityType;
import com.campaign.canon.core.model.SpanKind;
import com.campaign.canon.core.model.ThreadStatus;
import com.campaign.canon.core.model.Utterance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionFactsParserTest {

    private final SessionFactsParser parser = new SessionFactsParser();

    @Test
    @DisplayName("Should parse every section of an extraction")
    void testParse() {
        String json = """
                {
                  "mentions": [
                    {"text": "The Crone", "entity_type": "character",
                     "evidence": [{"utterance_id": "s1:1", "char_start": 0, "char_end": 9, "kind": "mention"}],
                     "confidence": 0.9}
                  ],
                  "scenes": [{"title": "Arrival", "start_ms": 0, "end_ms": 5000, "participants": ["DM"]}],
                  "events": [{"event_type": "", "summary": "The party arrives.", "entities": ["The Crone"]}],
                  "threads": [{"title": "Save Vallaki", "status": "active",
                               "updates": [{"update_type": "progress", "note": "n", "related_event_indexes": [0]}]}],
                  "quotes": [{"utterance_id": "s1:1", "char_start": 0, "char_end": 3, "clean_text": "The"}],
                  "unexpected": true
                }
                """;

        SessionFacts facts = parser.parse(json);

        MentionCandidate mention = facts.mentions().get(0);
        assertEquals("The Crone", mention.text());
        assertEquals(EntityType.CHARACTER, mention.entityType());
        assertEquals(SpanKind.MENTION, mention.evidence().get(0).kind());
        assertEquals(9, mention.evidence().get(0).charEnd());
        assertEquals("Arrival", facts.scenes().get(0).title());
        assertEquals("generic", facts.events().get(0).eventType());
        assertEquals(ThreadStatus.ACTIVE, facts.threads().get(0).status());
        assertEquals(List.of(0), facts.threads().get(0).updates().get(0).relatedEventIndexes());
        assertEquals("The", facts.quotes().get(0).expectedText());
    }

    @Test
    @DisplayName("Should read unknown enum values leniently")
    void testLenientEnums() {
        SessionFacts facts = parser.parse("""
                {"mentions": [{"text": "Blinsky", "entity_type": "toymaker"}],
                 "threads": [{"title": "Toys", "status": "sort-of"}]}
                """);

        assertEquals(EntityType.OTHER, facts.mentions().get(0).entityType());
        assertEquals(ThreadStatus.PROPOSED, facts.threads().get(0).status());
        assertTrue(facts.quotes().isEmpty());
    }

    @Test
    @DisplayName("Should reject empty and malformed payloads")
    void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"mentions\": [}"));
    }

    @Test
    @DisplayName("Written facts should parse back to equal facts")
    void testWrite() {
        SessionFacts facts = parser.parse("{\"events\": [{\"event_type\": \"combat\", \"summary\": \"Wolves\"}]}");

        assertEquals(facts, parser.parse(parser.write(facts)));
    }

    @Test
    @DisplayName("Formatter should prefix ids and map speakers to characters")
    void testTranscriptFormatter() {
        List<Utterance> utterances = List.of(
                new Utterance("s1:1", "s1", "alice", 0, 1500, "I swear."),
                new Utterance("s1:2", "s1", "DM", 1500, 3000, "The mists part."));

        String text = TranscriptFormatter.format(utterances, Map.of("alice", "Ezmerelda"));

        assertEquals("[s1:1] Ezmerelda 0-1500 I swear.\n[s1:2] DM 1500-3000 The mists part.", text);
    }
}
