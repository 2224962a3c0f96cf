package com.campaign.canon.repository;

import com.campaign.canon.core.model.CampaignEntity;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link EntityRepository}.
 */
public class InMemoryEntityRepository implements EntityRepository {

    static final Comparator<CampaignEntity> CREATION_ORDER = Comparator
            .comparing(CampaignEntity::getCreatedAt)
            .thenComparing(CampaignEntity::getId);

    private final ConcurrentMap<String, CampaignEntity> entities = new ConcurrentHashMap<>();

    @Override
    public CampaignEntity save(CampaignEntity entity) {
        entities.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public Optional<CampaignEntity> findById(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    @Override
    public List<CampaignEntity> findByCampaign(String campaignId) {
        return entities.values().stream()
                .filter(e -> e.getCampaignId().equals(campaignId))
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public boolean addAlias(String entityId, String alias) {
        CampaignEntity entity = findById(entityId)
                .orElseThrow(() -> new IllegalArgumentException("Entity not found: " + entityId));
        return entity.addAlias(alias);
    }

    public int size() {
        return entities.size();
    }
}
