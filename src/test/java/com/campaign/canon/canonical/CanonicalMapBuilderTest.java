package com.campaign.canon.canonical;

import com.campaign.canon.core.model.CampaignEntity;
import com.campaign.canon.core.model.EntityType;
import com.campaign.canon.core.model.StoryThread;
import com.campaign.canon.core.model.ThreadStatus;
import com.campaign.canon.correction.Correction;
import com.campaign.canon.correction.CorrectionAction;
import com.campaign.canon.correction.CorrectionState;
import com.campaign.canon.correction.CycleDetectedException;
import com.campaign.canon.correction.InMemoryCorrectionRepository;
import com.campaign.canon.correction.InvalidCorrectionException;
import com.campaign.canon.repository.InMemoryEntityRepository;
import com.campaign.canon.repository.InMemoryThreadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalMapBuilderTest {

    private static final String CAMPAIGN = "c1";
    private static final Instant T0 = Instant.parse("2024-05-01T20:00:00Z");

    private InMemoryEntityRepository entities;
    private InMemoryThreadRepository threads;
    private InMemoryCorrectionRepository corrections;
    private CanonicalMapBuilder builder;
    private int clockTick;

    @BeforeEach
    void setUp() {
        entities = new InMemoryEntityRepository();
        threads = new InMemoryThreadRepository();
        corrections = new InMemoryCorrectionRepository();
        builder = new CanonicalMapBuilder(entities, threads, corrections);
        clockTick = 0;

        entity("e-crone", "The Crone");
        entity("e-strahd", "Strahd");
        entity("e-vampire", "The Vampire Lord");
        entity("e-ireena", "Ireena");
        thread("t-vallaki", "Save Vallaki");
        thread("t-ravenloft", "Storm Castle Ravenloft");
    }

    private void entity(String id, String name) {
        entities.save(CampaignEntity.builder()
                .id(id)
                .campaignId(CAMPAIGN)
                .canonicalName(name)
                .type(EntityType.CHARACTER)
                .build());
    }

    private void thread(String id, String title) {
        threads.save(StoryThread.builder().id(id).campaignId(CAMPAIGN).title(title).build());
    }

    private Correction approved(CorrectionAction action, String targetId, String value) {
        return approved(action, targetId, value, null);
    }

    private Correction approved(CorrectionAction action, String targetId, String value, String sessionId) {
        Map<String, String> payload = action.payloadKey() == null || value == null
                ? Map.of()
                : Map.of(action.payloadKey(), value);
        clockTick++;
        Correction c = Correction.builder()
                .campaignId(CAMPAIGN)
                .sessionId(sessionId)
                .targetId(targetId)
                .action(action)
                .payload(payload)
                .createdBy("dm")
                .createdAt(T0.plusSeconds(clockTick))
                .sequence(corrections.nextSequence())
                .state(CorrectionState.APPROVED)
                .build();
        corrections.save(c);
        return c;
    }

    @Nested
    @DisplayName("Determinism")
    class DeterminismTests {

        @Test
        @DisplayName("Should produce equal maps for the same ledger")
        void testRepeatedBuildsEqual() {
            approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Baba Yaga");
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");

            CanonicalMap first = builder.build(CAMPAIGN);
            CanonicalMap second = builder.build(CAMPAIGN);

            assertEquals(first, second);
            assertEquals(first.fingerprint(), second.fingerprint());
            assertEquals(64, first.fingerprint().length());
        }

        @Test
        @DisplayName("Should fold in ledger order regardless of input order")
        void testLedgerOrder() {
            Correction first = approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Granny");
            Correction second = approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Baba Yaga");

            CanonicalMap forward = builder.fold(CAMPAIGN, null, List.of(first, second), true);
            CanonicalMap reversed = builder.fold(CAMPAIGN, null, List.of(second, first), true);

            assertEquals(forward, reversed);
            assertEquals("Baba Yaga", forward.entities().canonicalName("e-crone").orElseThrow());
        }

        @Test
        @DisplayName("Fingerprint should change when the ledger changes")
        void testFingerprintChanges() {
            String before = builder.build(CAMPAIGN).fingerprint();
            approved(CorrectionAction.ENTITY_HIDE, "e-ireena", null);

            assertNotEquals(before, builder.build(CAMPAIGN).fingerprint());
        }

        @Test
        @DisplayName("Should ignore pending corrections")
        void testPendingIgnored() {
            corrections.save(Correction.builder()
                    .campaignId(CAMPAIGN)
                    .targetId("e-crone")
                    .action(CorrectionAction.ENTITY_HIDE)
                    .createdAt(T0)
                    .sequence(corrections.nextSequence())
                    .build());

            assertFalse(builder.build(CAMPAIGN).entities().isHidden("e-crone"));
        }
    }

    @Nested
    @DisplayName("Rename and aliases")
    class NameTests {

        @Test
        @DisplayName("Rename should keep the old name resolvable as an alias")
        void testRenameKeepsOldName() {
            approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Baba Yaga");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            NameResolution byNew = map.resolveEntityName("baba  yaga");
            assertTrue(byNew.isLive());
            assertEquals("e-crone", byNew.entityId());
            assertEquals("Baba Yaga", byNew.canonicalName());

            NameResolution byOld = map.resolveEntityName("The Crone");
            assertTrue(byOld.isLive());
            assertEquals("Baba Yaga", byOld.canonicalName());
            assertTrue(map.aliases("e-crone").contains("The Crone"));
            assertTrue(map.isCorrected("e-crone"));
        }

        @Test
        @DisplayName("Alias removal should stop the alias from resolving")
        void testAliasRemove() {
            approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Baba Yaga");
            approved(CorrectionAction.ENTITY_ALIAS_REMOVE, "e-crone", "The Crone");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertTrue(map.resolveEntityName("The Crone").isUnknown());
            assertFalse(map.aliases("e-crone").contains("The Crone"));
            assertEquals(List.of("e-crone"), List.copyOf(map.removedAliasOwners("the crone")));
        }

        @Test
        @DisplayName("Adding an alias should resolve it and clear an earlier removal")
        void testAliasAddAfterRemove() {
            approved(CorrectionAction.ENTITY_ALIAS_ADD, "e-strahd", "The Devil");
            approved(CorrectionAction.ENTITY_ALIAS_REMOVE, "e-strahd", "The Devil");
            approved(CorrectionAction.ENTITY_ALIAS_ADD, "e-strahd", "The Devil");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("e-strahd", map.resolveEntityName("the devil").entityId());
            assertTrue(map.removedAliasOwners("The Devil").isEmpty());
        }

        @Test
        @DisplayName("Adding an alias owned by another entity should move it")
        void testAliasSteal() {
            approved(CorrectionAction.ENTITY_ALIAS_ADD, "e-strahd", "The Ancient");
            approved(CorrectionAction.ENTITY_ALIAS_ADD, "e-crone", "The Ancient");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("e-crone", map.resolveEntityName("The Ancient").entityId());
            assertFalse(map.aliases("e-strahd").contains("The Ancient"));
        }

        @Test
        @DisplayName("Removing the canonical name should be invalid in a strict fold")
        void testRemoveCanonicalNameStrict() {
            Correction removal = approved(CorrectionAction.ENTITY_ALIAS_REMOVE, "e-strahd", "strahd");

            assertThrows(InvalidCorrectionException.class,
                    () -> builder.validate(CAMPAIGN, null, List.of(removal)));
        }

        @Test
        @DisplayName("Lenient build should skip a correction that no longer applies")
        void testLenientSkip() {
            String baseline = builder.build(CAMPAIGN).fingerprint();
            approved(CorrectionAction.ENTITY_ALIAS_REMOVE, "e-strahd", "Strahd");

            CanonicalMap map = builder.build(CAMPAIGN);

            assertEquals(baseline, map.fingerprint());
            assertTrue(map.entities().resolveEntityName("Strahd").isLive());
        }

        @Test
        @DisplayName("Should resolve through the normalized form")
        void testNormalizedResolution() {
            NameResolution resolution = builder.build(CAMPAIGN).entities().resolveEntityName("Crone!");

            assertTrue(resolution.isLive());
            assertTrue(resolution.viaNormalizedForm());
            assertEquals("e-crone", resolution.entityId());
        }

        @Test
        @DisplayName("Ambiguous normalized forms should not resolve")
        void testAmbiguousNormalizedForm() {
            entity("e-tower-1", "The Tower");
            entity("e-tower-2", "Tower");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("e-tower-2", map.resolveEntityName("tower").entityId());
            assertEquals("e-tower-1", map.resolveEntityName("the tower").entityId());
            assertTrue(map.resolveEntityName("Tower!").isUnknown());
        }
    }

    @Nested
    @DisplayName("Merge")
    class MergeTests {

        @Test
        @DisplayName("Should follow merge chains to the root")
        void testMergeChain() {
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");
            approved(CorrectionAction.ENTITY_MERGE, "e-strahd", "e-crone");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("e-crone", map.resolveId("e-vampire"));
            assertEquals("The Crone", map.canonicalName("e-vampire").orElseThrow());
            assertEquals("e-crone", map.resolveEntityName("The Vampire Lord").entityId());
            assertEquals("e-crone", map.mergeTarget("e-vampire").orElseThrow());
            assertFalse(map.visibleIds().contains("e-vampire"));
            assertFalse(map.visibleIds().contains("e-strahd"));
            assertTrue(map.visibleIds().contains("e-crone"));
            assertTrue(map.aliases("e-crone").containsAll(List.of("Strahd", "The Vampire Lord")));
        }

        @Test
        @DisplayName("Strict fold should reject a merge cycle")
        void testCycleStrict() {
            Correction first = approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");
            Correction second = approved(CorrectionAction.ENTITY_MERGE, "e-strahd", "e-vampire");

            assertThrows(CycleDetectedException.class,
                    () -> builder.validate(CAMPAIGN, null, List.of(first, second)));
        }

        @Test
        @DisplayName("Lenient build should skip the merge that closes a cycle")
        void testCycleLenient() {
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");
            approved(CorrectionAction.ENTITY_MERGE, "e-strahd", "e-vampire");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("e-strahd", map.resolveId("e-vampire"));
            assertEquals("e-strahd", map.resolveId("e-strahd"));
        }

        @Test
        @DisplayName("Unmerge should restore the entity")
        void testUnmerge() {
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");
            approved(CorrectionAction.ENTITY_UNMERGE, "e-vampire", null);
            approved(CorrectionAction.ENTITY_UNMERGE, "e-vampire", null);

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("e-vampire", map.resolveId("e-vampire"));
            assertTrue(map.mergeTarget("e-vampire").isEmpty());
            assertTrue(map.visibleIds().contains("e-vampire"));
        }
    }

    @Nested
    @DisplayName("Hide")
    class HideTests {

        @Test
        @DisplayName("Hidden entity names should resolve as hidden")
        void testHide() {
            approved(CorrectionAction.ENTITY_HIDE, "e-ireena", null);

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            NameResolution resolution = map.resolveEntityName("Ireena");
            assertTrue(resolution.isHidden());
            assertEquals("e-ireena", resolution.entityId());
            assertTrue(map.hiddenIds().contains("e-ireena"));
            assertTrue(map.hiddenNames().contains("ireena"));
            assertFalse(map.visibleIds().contains("e-ireena"));
        }

        @Test
        @DisplayName("Entity merged into a hidden entity should be hidden")
        void testMergedIntoHidden() {
            approved(CorrectionAction.ENTITY_HIDE, "e-strahd", null);
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertTrue(map.isHidden("e-vampire"));
            assertTrue(map.resolveEntityName("The Vampire Lord").isHidden());
        }

        @Test
        @DisplayName("Unhide should make the entity live again")
        void testUnhide() {
            approved(CorrectionAction.ENTITY_HIDE, "e-ireena", null);
            approved(CorrectionAction.ENTITY_UNHIDE, "e-ireena", null);

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertTrue(map.resolveEntityName("Ireena").isLive());
            assertTrue(map.hiddenIds().isEmpty());
        }
    }

    @Nested
    @DisplayName("Session scope")
    class ScopeTests {

        @Test
        @DisplayName("Session-scoped corrections should apply only to their session")
        void testSessionScope() {
            approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Baba Yaga", "s1");

            assertEquals("The Crone", builder.build(CAMPAIGN).entities().canonicalName("e-crone").orElseThrow());
            assertEquals("Baba Yaga",
                    builder.build(CAMPAIGN, "s1").entities().canonicalName("e-crone").orElseThrow());
            assertEquals("The Crone",
                    builder.build(CAMPAIGN, "s2").entities().canonicalName("e-crone").orElseThrow());
        }

        @Test
        @DisplayName("Maps for different scopes should have different fingerprints")
        void testScopeFingerprint() {
            assertNotEquals(builder.build(CAMPAIGN).fingerprint(), builder.build(CAMPAIGN, "s1").fingerprint());
            assertEquals("s1", builder.build(CAMPAIGN, "s1").getSessionId());
        }
    }

    @Nested
    @DisplayName("Corrected flag")
    class CorrectedFlagTests {

        @Test
        @DisplayName("Renaming back to the original name should clear the flag")
        void testRenameBack() {
            approved(CorrectionAction.ENTITY_RENAME, "e-crone", "Baba Yaga");
            approved(CorrectionAction.ENTITY_RENAME, "e-crone", "The Crone");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertEquals("The Crone", map.canonicalName("e-crone").orElseThrow());
            assertFalse(map.isCorrected("e-crone"));
        }

        @Test
        @DisplayName("Hide followed by unhide should clear the flag")
        void testHideThenUnhide() {
            approved(CorrectionAction.ENTITY_HIDE, "e-strahd", null);
            approved(CorrectionAction.ENTITY_UNHIDE, "e-strahd", null);
            approved(CorrectionAction.THREAD_HIDE, "t-vallaki", null);
            approved(CorrectionAction.THREAD_UNHIDE, "t-vallaki", null);

            CanonicalMap map = builder.build(CAMPAIGN);

            assertFalse(map.entities().isCorrected("e-strahd"));
            assertFalse(map.threads().isCorrected("t-vallaki"));
        }

        @Test
        @DisplayName("Setting a thread field to its extracted value should not flag it")
        void testUnchangedThreadFields() {
            approved(CorrectionAction.THREAD_STATUS, "t-vallaki", "proposed");
            approved(CorrectionAction.THREAD_TITLE, "t-ravenloft", "Storm Castle Ravenloft");

            ThreadCanonicalMap map = builder.build(CAMPAIGN).threads();

            assertFalse(map.isCorrected("t-vallaki"));
            assertFalse(map.isCorrected("t-ravenloft"));
        }

        @Test
        @DisplayName("Alias edits and merges should flag the entities they change")
        void testAliasAndMergeFlagged() {
            approved(CorrectionAction.ENTITY_ALIAS_ADD, "e-ireena", "Tatyana");
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertTrue(map.isCorrected("e-ireena"));
            assertTrue(map.isCorrected("e-vampire"));
            assertTrue(map.isCorrected("e-strahd"));
            assertFalse(map.isCorrected("e-crone"));
        }

        @Test
        @DisplayName("Unmerge should clear the flag on both sides")
        void testUnmergeClearsFlag() {
            approved(CorrectionAction.ENTITY_MERGE, "e-vampire", "e-strahd");
            approved(CorrectionAction.ENTITY_UNMERGE, "e-vampire", null);

            EntityCanonicalMap map = builder.build(CAMPAIGN).entities();

            assertFalse(map.isCorrected("e-vampire"));
            assertFalse(map.isCorrected("e-strahd"));
        }
    }

    @Nested
    @DisplayName("Threads")
    class ThreadTests {

        @Test
        @DisplayName("Should apply title, status and summary corrections")
        void testThreadFields() {
            approved(CorrectionAction.THREAD_TITLE, "t-vallaki", "Defend Vallaki");
            approved(CorrectionAction.THREAD_STATUS, "t-vallaki", "completed");
            approved(CorrectionAction.THREAD_SUMMARY, "t-vallaki", "  The town held.  ");

            ThreadCanonicalMap map = builder.build(CAMPAIGN).threads();

            assertEquals("Defend Vallaki", map.title("t-vallaki").orElseThrow());
            assertEquals(ThreadStatus.COMPLETED, map.status("t-vallaki").orElseThrow());
            assertEquals("The town held.", map.summary("t-vallaki").orElseThrow());
            assertEquals("t-vallaki", map.resolveThreadTitle("defend vallaki").threadId());
            assertTrue(map.resolveThreadTitle("Save Vallaki").isLive());
            assertTrue(map.isCorrected("t-vallaki"));
        }

        @Test
        @DisplayName("Blank summary correction should clear the summary")
        void testClearSummary() {
            approved(CorrectionAction.THREAD_SUMMARY, "t-vallaki", "Something");
            approved(CorrectionAction.THREAD_SUMMARY, "t-vallaki", "");

            assertTrue(builder.build(CAMPAIGN).threads().summary("t-vallaki").isEmpty());
        }

        @Test
        @DisplayName("Merged and hidden threads should resolve accordingly")
        void testMergeAndHide() {
            approved(CorrectionAction.THREAD_MERGE, "t-vallaki", "t-ravenloft");

            ThreadCanonicalMap merged = builder.build(CAMPAIGN).threads();
            assertEquals("t-ravenloft", merged.resolveThreadId("t-vallaki").threadId());
            assertEquals("Storm Castle Ravenloft", merged.title("t-vallaki").orElseThrow());
            assertEquals(List.of("t-ravenloft"), List.copyOf(merged.visibleIds()));

            approved(CorrectionAction.THREAD_HIDE, "t-ravenloft", null);

            ThreadCanonicalMap hidden = builder.build(CAMPAIGN).threads();
            assertTrue(hidden.resolveThreadId("t-vallaki").isHidden());
            assertTrue(hidden.resolveThreadTitle("storm castle ravenloft").isHidden());
            assertTrue(hidden.visibleIds().isEmpty());
        }

        @Test
        @DisplayName("Strict fold should reject a thread merge cycle")
        void testThreadCycle() {
            Correction first = approved(CorrectionAction.THREAD_MERGE, "t-vallaki", "t-ravenloft");
            Correction second = approved(CorrectionAction.THREAD_MERGE, "t-ravenloft", "t-vallaki");

            assertThrows(CycleDetectedException.class,
                    () -> builder.validate(CAMPAIGN, null, List.of(first, second)));
        }

        @Test
        @DisplayName("Unknown thread ids and titles should not resolve")
        void testUnknownThread() {
            ThreadCanonicalMap map = builder.build(CAMPAIGN).threads();

            assertTrue(map.resolveThreadId("t-missing").isUnknown());
            assertTrue(map.resolveThreadTitle("Find the Amber Temple").isUnknown());
        }
    }
}
