package com.campaign.canon.correction;

import com.campaign.canon.api.Page;
import com.campaign.canon.api.PageRequest;
import com.campaign.canon.audit.AuditAction;
import com.campaign.canon.audit.AuditService;
import com.campaign.canon.cache.LedgerListener;
import com.campaign.canon.canonical.CanonicalMapBuilder;
import com.campaign.canon.core.ErrorCode;
import com.campaign.canon.core.model.CampaignEntity;
import com.campaign.canon.core.model.EntityType;
import com.campaign.canon.core.model.StoryThread;
import com.campaign.canon.lock.LocalSerializationLock;
import com.campaign.canon.metrics.MicrometerCanonMetrics;
import com.campaign.canon.repository.InMemoryEntityRepository;
import com.campaign.canon.repository.InMemoryThreadRepository;
import com.campaign.canon.repository.RecordTargetDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CorrectionLedgerTest {

    private static final String CAMPAIGN = "c1";
    private static final Actor DM = Actor.dm("dm-1");
    private static final Actor PLAYER = Actor.player("player-1");

    private InMemoryEntityRepository entities;
    private InMemoryThreadRepository threads;
    private InMemoryCorrectionRepository corrections;
    private AuditService auditService;
    private SimpleMeterRegistry registry;
    private CorrectionLedger ledger;

    @Mock
    private LedgerListener listener;

    @BeforeEach
    void setUp() {
        entities = new InMemoryEntityRepository();
        threads = new InMemoryThreadRepository();
        corrections = new InMemoryCorrectionRepository();
        auditService = new AuditService();
        registry = new SimpleMeterRegistry();
        ledger = new CorrectionLedger(corrections,
                new RecordTargetDirectory(entities, threads),
                new CanonicalMapBuilder(entities, threads, corrections),
                new LocalSerializationLock(),
                auditService,
                new MicrometerCanonMetrics(registry),
                Clock.fixed(Instant.parse("2024-05-01T20:00:00Z"), ZoneOffset.UTC));
        ledger.addListener(listener);

        entity("e-crone", "The Crone");
        entity("e-strahd", "Strahd");
        entity("e-ireena", "Ireena");
        threads.save(StoryThread.builder().id("t-vallaki").campaignId(CAMPAIGN).title("Save Vallaki").build());
    }

    private void entity(String id, String name) {
        entities.save(CampaignEntity.builder()
                .id(id)
                .campaignId(CAMPAIGN)
                .canonicalName(name)
                .type(EntityType.CHARACTER)
                .build());
    }

    private static CorrectionRequest merge(String sourceId, String targetId) {
        return CorrectionRequest.entity(CAMPAIGN, sourceId, CorrectionAction.ENTITY_MERGE,
                Map.of(CorrectionAction.MERGE_TARGET_KEY, targetId));
    }

    @Nested
    @DisplayName("Submission")
    class SubmitTests {

        @Test
        @DisplayName("Player submission should be stored pending and audited")
        void testPlayerSubmissionPending() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_RENAME, Map.of("name", "Baba Yaga")), PLAYER);

            assertEquals(CorrectionState.PENDING, c.getState());
            assertEquals("player-1", c.getCreatedBy());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CORRECTION_SUBMITTED).size());
            assertTrue(auditService.getEntriesByAction(AuditAction.CORRECTION_APPROVED).isEmpty());
            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("DM submission should be approved immediately and notify listeners")
        void testDmSubmissionApproved() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_HIDE, Map.of()), DM);

            assertEquals(CorrectionState.APPROVED, c.getState());
            assertEquals("dm-1", c.getDecidedBy());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CORRECTION_APPROVED).size());
            verify(listener).onLedgerChanged(CAMPAIGN);
            assertEquals(1.0, registry.get("canon.correction.decided").tag("state", "APPROVED").counter().count());
        }

        @Test
        @DisplayName("Should reject an action that does not match the target type")
        void testActionTargetMismatch() {
            CorrectionRequest request = new CorrectionRequest(CAMPAIGN, null, TargetType.THREAD, "t-vallaki",
                    CorrectionAction.ENTITY_HIDE, Map.of());

            InvalidCorrectionException e = assertThrows(InvalidCorrectionException.class,
                    () -> ledger.submit(request, PLAYER));
            assertEquals(ErrorCode.INVALID_CORRECTION, e.getErrorCode());
        }

        @Test
        @DisplayName("Should reject a correction against an unknown target")
        void testUnknownTarget() {
            assertThrows(InvalidCorrectionException.class, () -> ledger.submit(
                    CorrectionRequest.entity(CAMPAIGN, "missing", CorrectionAction.ENTITY_HIDE, Map.of()), PLAYER));
            assertThrows(InvalidCorrectionException.class, () -> ledger.submit(
                    CorrectionRequest.entity("other-campaign", "e-crone", CorrectionAction.ENTITY_HIDE, Map.of()),
                    PLAYER));
        }

        @Test
        @DisplayName("Should require the payload value of the action")
        void testMissingPayload() {
            assertThrows(InvalidCorrectionException.class, () -> ledger.submit(
                    CorrectionRequest.entity(CAMPAIGN, "e-crone", CorrectionAction.ENTITY_RENAME, Map.of()), PLAYER));
            assertThrows(InvalidCorrectionException.class, () -> ledger.submit(
                    CorrectionRequest.entity(CAMPAIGN, "e-crone", CorrectionAction.ENTITY_ALIAS_ADD,
                            Map.of("alias", "  ")), PLAYER));
        }

        @Test
        @DisplayName("Should accept a blank thread summary as clearing it")
        void testBlankSummaryAllowed() {
            Correction c = ledger.submit(CorrectionRequest.thread(CAMPAIGN, "t-vallaki",
                    CorrectionAction.THREAD_SUMMARY, Map.of("summary", "")), DM);
            assertTrue(c.isApproved());
        }

        @Test
        @DisplayName("Should reject an unknown thread status")
        void testUnknownThreadStatus() {
            assertThrows(InvalidCorrectionException.class, () -> ledger.submit(
                    CorrectionRequest.thread(CAMPAIGN, "t-vallaki", CorrectionAction.THREAD_STATUS,
                            Map.of("status", "sort-of-done")), PLAYER));
        }

        @Test
        @DisplayName("Should reject merging an entity into itself")
        void testSelfMerge() {
            CycleDetectedException e = assertThrows(CycleDetectedException.class,
                    () -> ledger.submit(merge("e-crone", "e-crone"), PLAYER));
            assertEquals(ErrorCode.CYCLE_DETECTED, e.getErrorCode());
        }

        @Test
        @DisplayName("Should reject a merge into an unknown entity")
        void testMergeIntoUnknown() {
            assertThrows(InvalidCorrectionException.class,
                    () -> ledger.submit(merge("e-crone", "nobody"), PLAYER));
        }

        @Test
        @DisplayName("DM merge closing a cycle should be rejected and not stored")
        void testDmCycleNotStored() {
            ledger.submit(merge("e-crone", "e-strahd"), DM);

            assertThrows(CycleDetectedException.class, () -> ledger.submit(merge("e-strahd", "e-crone"), DM));
            assertEquals(1, ledger.history(CAMPAIGN).size());
        }

        @Test
        @DisplayName("Campaign-wide merge should be checked against session-scoped merges")
        void testCampaignWideCheckedAgainstSessionScope() {
            ledger.submit(merge("e-strahd", "e-crone").forSession("s1"), DM);

            assertThrows(CycleDetectedException.class, () -> ledger.submit(merge("e-crone", "e-strahd"), DM));
        }

        @Test
        @DisplayName("Session-scoped merges in different sessions should not conflict")
        void testDifferentSessionsIndependent() {
            ledger.submit(merge("e-strahd", "e-crone").forSession("s1"), DM);

            Correction c = ledger.submit(merge("e-crone", "e-strahd").forSession("s2"), DM);
            assertTrue(c.isApproved());
        }
    }

    @Nested
    @DisplayName("Decisions")
    class DecisionTests {

        @Test
        @DisplayName("DM approval should approve, audit and notify")
        void testApprove() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_RENAME, Map.of("name", "Baba Yaga")), PLAYER);

            Correction approved = ledger.approve(c.getId(), DM);

            assertEquals(CorrectionState.APPROVED, approved.getState());
            assertEquals("dm-1", approved.getDecidedBy());
            assertNotNull(approved.getDecidedAt());
            verify(listener).onLedgerChanged(CAMPAIGN);
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CORRECTION_APPROVED).size());
        }

        @Test
        @DisplayName("Player should not be able to approve")
        void testPlayerCannotApprove() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_HIDE, Map.of()), PLAYER);

            NotAuthorizedException e = assertThrows(NotAuthorizedException.class,
                    () -> ledger.approve(c.getId(), PLAYER));
            assertEquals(ErrorCode.NOT_AUTHORIZED, e.getErrorCode());
            assertTrue(ledger.get(c.getId()).isPending());
        }

        @Test
        @DisplayName("Player should not be able to reject")
        void testPlayerCannotReject() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_HIDE, Map.of()), PLAYER);

            assertThrows(NotAuthorizedException.class, () -> ledger.reject(c.getId(), PLAYER));
        }

        @Test
        @DisplayName("Approving twice should fail with already decided")
        void testDoubleApproval() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_HIDE, Map.of()), PLAYER);
            ledger.approve(c.getId(), DM);

            AlreadyDecidedException e = assertThrows(AlreadyDecidedException.class,
                    () -> ledger.approve(c.getId(), DM));
            assertEquals(ErrorCode.ALREADY_DECIDED, e.getErrorCode());
        }

        @Test
        @DisplayName("Rejected correction cannot be approved later")
        void testRejectThenApprove() {
            Correction c = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_HIDE, Map.of()), PLAYER);
            ledger.reject(c.getId(), DM);

            assertEquals(CorrectionState.REJECTED, ledger.get(c.getId()).getState());
            assertThrows(AlreadyDecidedException.class, () -> ledger.approve(c.getId(), DM));
            verifyNoInteractions(listener);
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CORRECTION_REJECTED).size());
        }

        @Test
        @DisplayName("Approving a merge that became cyclic should fail and keep it pending")
        void testApproveCyclicMerge() {
            Correction pending = ledger.submit(merge("e-strahd", "e-crone"), PLAYER);
            ledger.submit(merge("e-crone", "e-strahd"), DM);

            assertThrows(CycleDetectedException.class, () -> ledger.approve(pending.getId(), DM));
            assertTrue(ledger.get(pending.getId()).isPending());
        }

        @Test
        @DisplayName("Should throw for an unknown correction id")
        void testUnknownCorrection() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> ledger.approve("nope", DM));
            assertTrue(e.getMessage().contains("Correction not found"));
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("History should be in ledger order")
        void testHistoryOrder() {
            Correction first = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_ALIAS_ADD, Map.of("alias", "Granny")), PLAYER);
            Correction second = ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_ALIAS_ADD, Map.of("alias", "Old Mother")), PLAYER);

            List<Correction> history = ledger.history(CAMPAIGN);
            assertEquals(List.of(first, second), history);
            assertTrue(first.getSequence() < second.getSequence());
        }

        @Test
        @DisplayName("Pending should page through undecided corrections only")
        void testPendingPaging() {
            for (int i = 0; i < 5; i++) {
                ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                        CorrectionAction.ENTITY_ALIAS_ADD, Map.of("alias", "alias-" + i)), PLAYER);
            }
            ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-strahd",
                    CorrectionAction.ENTITY_ALIAS_ADD, Map.of("alias", "The Devil")), DM);

            Page<Correction> page = ledger.pending(CAMPAIGN, PageRequest.of(0, 3));
            assertEquals(3, page.numberOfElements());
            assertEquals(5, page.totalElements());
            assertTrue(page.hasNext());
        }

        @Test
        @DisplayName("Approved should include campaign-wide and matching session corrections")
        void testApprovedScope() {
            ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-crone",
                    CorrectionAction.ENTITY_HIDE, Map.of()), DM);
            ledger.submit(CorrectionRequest.entity(CAMPAIGN, "e-strahd",
                    CorrectionAction.ENTITY_HIDE, Map.of()).forSession("s1"), DM);

            assertEquals(1, ledger.approved(CAMPAIGN, null).size());
            assertEquals(2, ledger.approved(CAMPAIGN, "s1").size());
            assertEquals(1, ledger.approved(CAMPAIGN, "s2").size());
        }
    }
}
