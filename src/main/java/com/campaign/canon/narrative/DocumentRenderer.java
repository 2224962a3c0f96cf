package com.campaign.canon.narrative;

/**
 * Renders summary text into a document. External collaborator.
 */
public interface DocumentRenderer {

    RenderedDocument render(NarrativeInput input, String summaryText);
}
