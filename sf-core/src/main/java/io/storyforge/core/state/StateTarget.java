package io.storyforge.core.state;

import io.storyforge.core.GameEvent;

import java.util.List;
import java.util.Optional;

/**
 * Storage the event handlers write through. The in-memory reducer and the database projection each
 * provide one, so both interpret the vocabulary with the same {@link EventSemantics}.
 */
public interface StateTarget {

    Optional<CharacterState> character(String characterId);

    void insertCharacter(CharacterState character);

    void updateCharacter(CharacterState character);

    Optional<InventoryItem> item(String ownerId, String itemName);

    /** Insert or replace the holding. */
    void putItem(String ownerId, String itemName, InventoryItem item);

    void removeItem(String ownerId, String itemName);

    void putWorldFlag(String key, Object value);

    long worldTimeMinutes();

    void setWorldTimeMinutes(long minutes);

    List<WorldSimEntry> worldSimEvents();

    void setWorldSimEvents(List<WorldSimEntry> entries);

    /** Called for event types outside the vocabulary. */
    void unhandled(GameEvent event);
}
