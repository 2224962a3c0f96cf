package com.campaign.canon.cache;

/**
 * Listener for changes to the inputs of a campaign's canonical map: approved
 * corrections and newly created base entities or threads.
 */
public interface LedgerListener {

    /**
     * Called after the approved ledger or the base records of a campaign changed.
     *
     * @param campaignId the affected campaign
     */
    void onLedgerChanged(String campaignId);
}
