package com.campaign.canon.api;

import com.campaign.canon.core.model.EntityType;

import java.util.List;

/**
 * Read view of an entity with every approved correction applied.
 *
 * @param id            entity id, always the merge root
 * @param campaignId    owning campaign
 * @param type          entity type
 * @param canonicalName canonical name after renames
 * @param aliases       live aliases, sorted
 * @param description   description of the base record
 * @param corrected     true when the entity's current canonical state differs from its extracted record
 */
public record EntityView(
        String id,
        String campaignId,
        EntityType type,
        String canonicalName,
        List<String> aliases,
        String description,
        boolean corrected
) {
    public EntityView {
        aliases = List.copyOf(aliases);
    }
}
