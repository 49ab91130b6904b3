package io.storyforge.core;

import java.util.Locale;
import java.util.Optional;

/** Event vocabulary understood by the reducer and the projection. */
public enum EventType {
    MOVE,
    DAMAGE,
    HEAL,
    ITEM_GET,
    ITEM_LOSE,
    FLAG_SET,
    RELATIONSHIP,
    WORLD_TIME_ADVANCE,
    PLAYER_PSYCH_UPDATE,
    NPC_SPAWN,
    NPC_DEPART,
    FACTION_MOVE,
    NPC_ACTION,
    PLOT_TICK,
    RUMOR_SPREAD,
    TURN,
    DIALOGUE,
    ROLL;

    /** Case-insensitive lookup; empty for unknown or blank names. */
    public static Optional<EventType> lookup(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException unknown) {
            return Optional.empty();
        }
    }

    public boolean isWorldSimulation() {
        return switch (this) {
            case FACTION_MOVE, NPC_ACTION, PLOT_TICK, RUMOR_SPREAD -> true;
            default -> false;
        };
    }
}
