package com.campaign.canon.correction;

/**
 * Existence checks for correction targets.
 */
public interface TargetDirectory {

    boolean entityExists(String campaignId, String entityId);

    boolean threadExists(String campaignId, String threadId);
}
