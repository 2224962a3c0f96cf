package com.campaign.canon.repository;

import com.campaign.canon.core.model.StoryThread;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ThreadRepository}.
 */
public class InMemoryThreadRepository implements ThreadRepository {

    private static final Comparator<StoryThread> CREATION_ORDER = Comparator
            .comparing(StoryThread::getCreatedAt)
            .thenComparing(StoryThread::getId);

    private final ConcurrentMap<String, StoryThread> threads = new ConcurrentHashMap<>();

    @Override
    public StoryThread save(StoryThread thread) {
        threads.put(thread.getId(), thread);
        return thread;
    }

    @Override
    public Optional<StoryThread> findById(String id) {
        return Optional.ofNullable(threads.get(id));
    }

    @Override
    public List<StoryThread> findByCampaign(String campaignId) {
        return threads.values().stream()
                .filter(t -> t.getCampaignId().equals(campaignId))
                .sorted(CREATION_ORDER)
                .toList();
    }
}
