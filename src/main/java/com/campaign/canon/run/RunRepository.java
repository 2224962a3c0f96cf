package com.campaign.canon.run;

import java.util.List;
import java.util.Optional;

public interface RunRepository {

    Run save(Run run);

    Optional<Run> findById(String runId);

    /**
     * Runs of a session, oldest first.
     */
    List<Run> findBySession(String campaignId, String sessionId);
}
