package com.campaign.canon.repository;

import com.campaign.canon.core.model.CampaignEntity;

import java.util.List;
import java.util.Optional;

/**
 * Store of base entity records. Records are never deleted; corrections change how
 * they are presented, not the records themselves.
 */
public interface EntityRepository {

    CampaignEntity save(CampaignEntity entity);

    Optional<CampaignEntity> findById(String id);

    /**
     * All entities of a campaign ordered by creation time, then id.
     */
    List<CampaignEntity> findByCampaign(String campaignId);

    /**
     * Adds a learned alias to an entity.
     *
     * @return true if the alias was new
     * @throws IllegalArgumentException if the entity does not exist
     */
    boolean addAlias(String entityId, String alias);
}
