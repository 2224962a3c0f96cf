package com.campaign.canon.repository;

import com.campaign.canon.core.model.StoryThread;

import java.util.List;
import java.util.Optional;

/**
 * Store of base thread records, stable across sessions.
 */
public interface ThreadRepository {

    StoryThread save(StoryThread thread);

    Optional<StoryThread> findById(String id);

    /**
     * All threads of a campaign ordered by creation time, then id.
     */
    List<StoryThread> findByCampaign(String campaignId);
}
