package com.campaign.canon.pipeline;

import com.campaign.canon.core.model.Event;
import com.campaign.canon.resolution.ResolvedMentions;
import com.campaign.canon.resolution.ResolvedThreads;

import java.util.List;

/**
 * Output of the resolve stage.
 *
 * @param mentions resolved mentions with counters and issues
 * @param events   events with canonical entity names and ids
 * @param threads  resolved threads and their updates
 */
public record ResolvedSession(ResolvedMentions mentions, List<Event> events, ResolvedThreads threads) {

    public ResolvedSession {
        events = List.copyOf(events);
    }
}
