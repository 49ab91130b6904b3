package io.storyforge.core.state;

import io.storyforge.core.GameEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical in-memory snapshot of a campaign.
 *
 * @param inventory       owner id to item name to holding
 * @param unhandledEvents events whose type was not recognized, kept for audit
 */
public record GameState(
        CampaignState campaign,
        Map<String, CharacterState> characters,
        Map<String, Map<String, InventoryItem>> inventory,
        int turnNumber,
        List<GameEvent> unhandledEvents
) {
    public GameState {
        campaign = campaign == null ? CampaignState.empty() : campaign;
        characters = Immutables.map(characters);
        var inv = new LinkedHashMap<String, Map<String, InventoryItem>>();
        if (inventory != null) inventory.forEach((owner, items) -> inv.put(owner, Immutables.map(items)));
        inventory = Immutables.map(inv);
        unhandledEvents = Immutables.list(unhandledEvents);
    }

    public Optional<CharacterState> character(String id) {
        return Optional.ofNullable(characters.get(id));
    }

    public int quantity(String ownerId, String itemName) {
        var item = inventory.getOrDefault(ownerId, Map.of()).get(itemName);
        return item == null ? 0 : item.quantity();
    }
}
