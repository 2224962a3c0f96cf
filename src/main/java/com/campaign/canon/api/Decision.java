package com.campaign.canon.api;

/**
 * A reviewer's decision on a pending correction.
 */
public enum Decision {
    APPROVE,
    REJECT
}
