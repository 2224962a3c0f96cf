package com.campaign.canon.narrative;

import java.util.List;

public record SummaryPlan(List<SummaryBeat> beats) {

    public SummaryPlan {
        beats = beats != null ? List.copyOf(beats) : List.of();
    }
}
