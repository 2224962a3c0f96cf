package com.campaign.canon.narrative;

/**
 * Plans the beats of a session summary. External collaborator.
 */
public interface SummaryPlanner {

    SummaryPlan plan(NarrativeInput input);
}
