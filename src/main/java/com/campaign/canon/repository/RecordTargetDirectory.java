package com.campaign.canon.repository;

import com.campaign.canon.correction.TargetDirectory;

/**
 * {@link TargetDirectory} backed by the entity and thread repositories.
 */
public class RecordTargetDirectory implements TargetDirectory {

    private final EntityRepository entities;
    private final ThreadRepository threads;

    public RecordTargetDirectory(EntityRepository entities, ThreadRepository threads) {
        this.entities = entities;
        this.threads = threads;
    }

    @Override
    public boolean entityExists(String campaignId, String entityId) {
        return entities.findById(entityId)
                .map(e -> e.getCampaignId().equals(campaignId))
                .orElse(false);
    }

    @Override
    public boolean threadExists(String campaignId, String threadId) {
        return threads.findById(threadId)
                .map(t -> t.getCampaignId().equals(campaignId))
                .orElse(false);
    }
}
