package com.campaign.canon.resolution;

import com.campaign.canon.core.model.StoryThread;
import com.campaign.canon.core.model.ThreadUpdate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of resolving a session's thread candidates.
 *
 * @param threadIdsByTitle resolved thread id per candidate title, in input order
 * @param createdThreads   threads created by this pass
 * @param updates          thread updates to append
 * @param counters         quality counters
 * @param issues           reported problems
 */
public record ResolvedThreads(
        Map<String, String> threadIdsByTitle,
        List<StoryThread> createdThreads,
        List<ThreadUpdate> updates,
        ThreadCounters counters,
        List<ResolutionIssue> issues
) {
    public ResolvedThreads {
        threadIdsByTitle = Collections.unmodifiableMap(new LinkedHashMap<>(threadIdsByTitle));
        createdThreads = List.copyOf(createdThreads);
        updates = List.copyOf(updates);
        issues = List.copyOf(issues);
    }
}
