package com.campaign.canon.correction;

/**
 * Kind of record a correction targets.
 */
public enum TargetType {
    ENTITY,
    THREAD
}
