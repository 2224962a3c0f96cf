package com.campaign.canon.correction;

import java.util.List;
import java.util.Optional;

/**
 * Storage for correction events. Corrections are never deleted.
 */
public interface CorrectionRepository {

    /**
     * Next insertion sequence, used to break {@code createdAt} ties.
     */
    long nextSequence();

    Correction save(Correction correction);

    Optional<Correction> findById(String correctionId);

    /**
     * All corrections of a campaign in ledger order.
     */
    List<Correction> findByCampaign(String campaignId);

    /**
     * Corrections of a campaign in the given state, in ledger order.
     */
    List<Correction> findByCampaignAndState(String campaignId, CorrectionState state);
}
