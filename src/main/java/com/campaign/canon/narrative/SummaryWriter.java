package com.campaign.canon.narrative;

/**
 * Writes summary prose from a plan. External collaborator; its output is checked
 * against the quote bank before it is stored.
 */
public interface SummaryWriter {

    String write(NarrativeInput input, SummaryPlan plan);
}
