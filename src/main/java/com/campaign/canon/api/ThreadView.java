package com.campaign.canon.api;

import com.campaign.canon.core.model.ThreadKind;
import com.campaign.canon.core.model.ThreadStatus;

/**
 * Read view of a story thread with every approved correction applied.
 *
 * @param corrected true when the thread's current canonical state differs from its extracted record
 */
public record ThreadView(
        String id,
        String campaignId,
        String title,
        ThreadKind kind,
        ThreadStatus status,
        String summary,
        boolean corrected
) {
}
