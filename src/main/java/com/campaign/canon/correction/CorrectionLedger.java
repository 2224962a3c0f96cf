package com.campaign.canon.correction;

import com.campaign.canon.api.Page;
import com.campaign.canon.api.PageRequest;
import com.campaign.canon.audit.AuditAction;
import com.campaign.canon.audit.AuditService;
import com.campaign.canon.cache.LedgerListener;
import com.campaign.canon.core.model.ThreadStatus;
import com.campaign.canon.lock.LockKeys;
import com.campaign.canon.lock.SerializationLock;
import com.campaign.canon.logging.LogContext;
import com.campaign.canon.metrics.CanonMetrics;
import com.campaign.canon.metrics.NoOpCanonMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, attributed, approval-gated store of corrections.
 *
 * <p>DM-authored corrections are approved on submission; everything else waits
 * for a DM decision. Before a correction becomes effective the approved ledger plus
 * the candidate is folded strictly, so merge cycles and invalid alias removals never
 * reach the canonical map. Every mutation runs under the campaign lock, which keeps
 * the chronological fold deterministic under concurrent approvals.</p>
 */
public class CorrectionLedger {
    private static final Logger log = LoggerFactory.getLogger(CorrectionLedger.class);

    private final CorrectionRepository repository;
    private final TargetDirectory targets;
    private final LedgerValidator validator;
    private final SerializationLock lock;
    private final AuditService auditService;
    private final CanonMetrics metrics;
    private final Clock clock;
    private final List<LedgerListener> listeners = new CopyOnWriteArrayList<>();

    public CorrectionLedger(CorrectionRepository repository, TargetDirectory targets,
                            LedgerValidator validator, SerializationLock lock, AuditService auditService) {
        this(repository, targets, validator, lock, auditService, new NoOpCanonMetrics(), Clock.systemUTC());
    }

    public CorrectionLedger(CorrectionRepository repository, TargetDirectory targets,
                            LedgerValidator validator, SerializationLock lock, AuditService auditService,
                            CanonMetrics metrics, Clock clock) {
        this.repository = repository;
        this.targets = targets;
        this.validator = validator;
        this.lock = lock;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a listener notified whenever the approved ledger changes.
     */
    public void addListener(LedgerListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Submits a correction. DM-authored corrections are validated against the fold and
     * stored approved; others are stored pending.
     *
     * @throws InvalidCorrectionException if the request is malformed or cannot apply
     * @throws CycleDetectedException     if a DM-authored merge would create a cycle
     */
    public Correction submit(CorrectionRequest request, Actor author) {
        Objects.requireNonNull(author, "author is required");
        return lock.withLock(LockKeys.campaign(request.campaignId()), () -> {
            validateStructure(request);

            Instant now = clock.instant();
            Correction.Builder builder = Correction.builder()
                    .campaignId(request.campaignId())
                    .sessionId(request.sessionId())
                    .targetType(request.targetType())
                    .targetId(request.targetId())
                    .action(request.action())
                    .payload(request.payload())
                    .createdBy(author.id())
                    .authorRole(author.role())
                    .createdAt(now)
                    .sequence(repository.nextSequence());
            if (author.isDm()) {
                builder.state(CorrectionState.APPROVED).decidedBy(author.id()).decidedAt(now);
            }
            Correction correction = builder.build();

            try (LogContext ctx = LogContext.forCorrection(request.campaignId(), correction.getId())) {
                if (correction.isApproved()) {
                    validateAgainstLedger(correction);
                }
                repository.save(correction);
                auditService.record(AuditAction.CORRECTION_SUBMITTED, correction.getCampaignId(),
                        correction.getId(), author.id(), auditDetails(correction));
                log.info("correction.submitted correctionId={} action={} targetId={} state={}",
                        correction.getId(), correction.getAction(), correction.getTargetId(),
                        correction.getState());

                if (correction.isApproved()) {
                    auditService.record(AuditAction.CORRECTION_APPROVED, correction.getCampaignId(),
                            correction.getId(), author.id(), auditDetails(correction));
                    metrics.recordCorrectionDecided(CorrectionState.APPROVED);
                    notifyListeners(correction.getCampaignId());
                }
            }
            return correction;
        });
    }

    /**
     * Approves a pending correction.
     *
     * @throws NotAuthorizedException     if the reviewer is not a DM
     * @throws AlreadyDecidedException    if the correction is not pending
     * @throws CycleDetectedException     if approval would create a merge cycle
     * @throws InvalidCorrectionException if the correction no longer applies
     */
    public Correction approve(String correctionId, Actor reviewer) {
        requireDm(reviewer, "approve");
        Correction correction = get(correctionId);
        return lock.withLock(LockKeys.campaign(correction.getCampaignId()), () -> {
            try (LogContext ctx = LogContext.forCorrection(correction.getCampaignId(), correctionId)) {
                requirePending(correction);
                validateAgainstLedger(correction);

                correction.markApproved(reviewer.id(), clock.instant());
                auditService.record(AuditAction.CORRECTION_APPROVED, correction.getCampaignId(),
                        correctionId, reviewer.id(), auditDetails(correction));
                metrics.recordCorrectionDecided(CorrectionState.APPROVED);
                log.info("correction.approved correctionId={} reviewer={}", correctionId, reviewer.id());

                notifyListeners(correction.getCampaignId());
                return correction;
            }
        });
    }

    /**
     * Rejects a pending correction. Rejected corrections never affect the canonical map.
     *
     * @throws NotAuthorizedException  if the reviewer is not a DM
     * @throws AlreadyDecidedException if the correction is not pending
     */
    public Correction reject(String correctionId, Actor reviewer) {
        requireDm(reviewer, "reject");
        Correction correction = get(correctionId);
        return lock.withLock(LockKeys.campaign(correction.getCampaignId()), () -> {
            try (LogContext ctx = LogContext.forCorrection(correction.getCampaignId(), correctionId)) {
                requirePending(correction);
                correction.markRejected(reviewer.id(), clock.instant());
                auditService.record(AuditAction.CORRECTION_REJECTED, correction.getCampaignId(),
                        correctionId, reviewer.id(), auditDetails(correction));
                metrics.recordCorrectionDecided(CorrectionState.REJECTED);
                log.info("correction.rejected correctionId={} reviewer={}", correctionId, reviewer.id());
                return correction;
            }
        });
    }

    /**
     * Gets a correction by id.
     *
     * @throws IllegalArgumentException if no such correction exists
     */
    public Correction get(String correctionId) {
        return repository.findById(correctionId)
                .orElseThrow(() -> new IllegalArgumentException("Correction not found: " + correctionId));
    }

    /**
     * The full ledger of a campaign, in ledger order.
     */
    public List<Correction> history(String campaignId) {
        return repository.findByCampaign(campaignId);
    }

    /**
     * Pending corrections of a campaign, oldest first.
     */
    public Page<Correction> pending(String campaignId, PageRequest page) {
        return Page.slice(repository.findByCampaignAndState(campaignId, CorrectionState.PENDING), page);
    }

    /**
     * Approved corrections visible to the given scope, in ledger order.
     *
     * @param sessionId session scope, or null for campaign-wide corrections only
     */
    public List<Correction> approved(String campaignId, String sessionId) {
        return repository.findByCampaignAndState(campaignId, CorrectionState.APPROVED).stream()
                .filter(c -> c.appliesTo(sessionId))
                .toList();
    }

    private void validateStructure(CorrectionRequest request) {
        CorrectionAction action = request.action();
        if (action.targetType() != request.targetType()) {
            throw new InvalidCorrectionException(
                    "Action " + action + " does not apply to target type " + request.targetType());
        }
        if (!targetExists(request.targetType(), request.campaignId(), request.targetId())) {
            throw new InvalidCorrectionException(
                    request.targetType() + " not found in campaign: " + request.targetId());
        }

        String key = action.payloadKey();
        if (key != null) {
            String value = request.payload().get(key);
            if (value == null || (!action.allowsBlankValue() && value.isBlank())) {
                throw new InvalidCorrectionException("Action " + action + " requires payload '" + key + "'");
            }
            if (action == CorrectionAction.THREAD_STATUS) {
                try {
                    ThreadStatus.parse(value);
                } catch (IllegalArgumentException e) {
                    throw new InvalidCorrectionException("Unknown thread status: " + value);
                }
            }
        }

        if (action.isMerge()) {
            String intoId = request.payload().get(CorrectionAction.MERGE_TARGET_KEY);
            if (intoId.equals(request.targetId())) {
                throw new CycleDetectedException("Cannot merge " + request.targetId() + " into itself");
            }
            if (!targetExists(request.targetType(), request.campaignId(), intoId)) {
                throw new InvalidCorrectionException("Merge target not found in campaign: " + intoId);
            }
        }
    }

    private boolean targetExists(TargetType type, String campaignId, String targetId) {
        return type == TargetType.ENTITY
                ? targets.entityExists(campaignId, targetId)
                : targets.threadExists(campaignId, targetId);
    }

    /**
     * Folds the approved ledger plus the candidate for every scope the candidate can
     * affect: its own scope and, for a campaign-wide candidate, every session that has
     * session-scoped approved corrections.
     */
    private void validateAgainstLedger(Correction candidate) {
        String campaignId = candidate.getCampaignId();
        List<Correction> approved = repository.findByCampaignAndState(campaignId, CorrectionState.APPROVED);

        TreeSet<String> scopes = new TreeSet<>();
        if (candidate.getSessionId() != null) {
            scopes.add(candidate.getSessionId());
        } else {
            approved.stream()
                    .map(Correction::getSessionId)
                    .filter(Objects::nonNull)
                    .forEach(scopes::add);
        }

        validateScope(campaignId, null, approved, candidate);
        for (String scope : scopes) {
            validateScope(campaignId, scope, approved, candidate);
        }
    }

    private void validateScope(String campaignId, String scope, List<Correction> approved, Correction candidate) {
        if (scope == null && candidate.getSessionId() != null) {
            return;
        }
        List<Correction> tentative = new ArrayList<>();
        for (Correction c : approved) {
            if (c.appliesTo(scope) && !c.getId().equals(candidate.getId())) {
                tentative.add(c);
            }
        }
        tentative.add(candidate);
        validator.validate(campaignId, scope, tentative);
    }

    private void requireDm(Actor reviewer, String operation) {
        if (reviewer == null || !reviewer.isDm()) {
            throw new NotAuthorizedException(
                    "Only the DM may " + operation + " corrections" + (reviewer != null ? ": " + reviewer.id() : ""));
        }
    }

    private void requirePending(Correction correction) {
        if (!correction.isPending()) {
            throw new AlreadyDecidedException(
                    "Correction " + correction.getId() + " is already " + correction.getState());
        }
    }

    private void notifyListeners(String campaignId) {
        for (LedgerListener listener : listeners) {
            listener.onLedgerChanged(campaignId);
        }
    }

    private Map<String, Object> auditDetails(Correction correction) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", correction.getAction().name());
        details.put("targetId", correction.getTargetId());
        details.put("payload", correction.getPayload());
        if (correction.getSessionId() != null) {
            details.put("sessionId", correction.getSessionId());
        }
        return details;
    }
}
