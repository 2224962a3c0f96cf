package com.campaign.canon.evidence;

import com.campaign.canon.core.model.EvidenceSpan;

import java.util.List;

/**
 * Evidence list of one owner (mention, event, thread update) after cleaning.
 *
 * @param spans    the kept spans, repaired where needed
 * @param repaired number of spans that were repaired
 * @param dropped  number of spans that were dropped
 */
public record CleanedEvidence(List<EvidenceSpan> spans, int repaired, int dropped) {

    public CleanedEvidence {
        spans = List.copyOf(spans);
    }

    /**
     * False once any span of the owner was dropped.
     */
    public boolean complete() {
        return dropped == 0;
    }
}
