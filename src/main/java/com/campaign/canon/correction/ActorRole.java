package com.campaign.canon.correction;

/**
 * Campaign role of whoever submits or reviews a correction.
 * Only the dungeon master may approve, and DM-authored corrections are approved on submission.
 */
public enum ActorRole {
    DM,
    PLAYER
}
