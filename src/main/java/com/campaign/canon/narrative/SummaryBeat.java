package com.campaign.canon.narrative;

import java.util.List;

/**
 * One beat of a session summary plan.
 *
 * @param title    beat title
 * @param summary  what happens in the beat
 * @param quoteIds quotes the writer may use for this beat
 */
public record SummaryBeat(String title, String summary, List<String> quoteIds) {

    public SummaryBeat {
        quoteIds = quoteIds != null ? List.copyOf(quoteIds) : List.of();
    }
}
