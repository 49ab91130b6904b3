package io.storyforge.core;

import java.util.Locale;
import java.util.Map;

import static io.storyforge.core.PayloadValues.integer;
import static io.storyforge.core.PayloadValues.longValue;
import static io.storyforge.core.PayloadValues.magnitude;
import static io.storyforge.core.PayloadValues.map;
import static io.storyforge.core.PayloadValues.nullableInteger;
import static io.storyforge.core.PayloadValues.string;

/**
 * Typed view of an event payload, one variant per known {@link EventType}.
 * Types outside the vocabulary decode to {@link Unknown} with the raw map intact.
 */
public sealed interface EventPayload {

    record Move(String characterId, String toLocation, String toRegion) implements EventPayload {}

    record Damage(String characterId, int amount) implements EventPayload {}

    record Heal(String characterId, int amount) implements EventPayload {}

    /** Signed quantity change: negative for {@code ITEM_LOSE}, positive for {@code ITEM_GET}. */
    record ItemDelta(String ownerId, String itemName, int quantityDelta, Map<String, Object> attributes)
            implements EventPayload {}

    record FlagSet(String key, Object value) implements EventPayload {}

    record Relationship(String npcId, int delta) implements EventPayload {}

    record WorldTimeAdvance(TimeMode mode, long minutes) implements EventPayload {}

    record PsychUpdate(String characterId, int stressDelta) implements EventPayload {}

    record Spawn(String characterId, String name, String role, String locationId, int hpCurrent,
                 Map<String, Object> stats, Integer relationshipScore, int credits) implements EventPayload {
        public boolean complete() {
            return characterId != null && !characterId.isBlank() && name != null && locationId != null;
        }
    }

    record Depart(String characterId) implements EventPayload {}

    record WorldSim(String eventType, Map<String, Object> payload, boolean hidden) implements EventPayload {}

    /** Narrative record with no state effect ({@code TURN}, {@code DIALOGUE}, {@code ROLL}). */
    record LogOnly(String eventType) implements EventPayload {}

    record Unknown(String eventType, Map<String, Object> raw) implements EventPayload {}

    enum TimeMode { SET, ADD }

    static EventPayload decode(GameEvent event) {
        var p = event.payload();
        var type = event.knownType().orElse(null);
        if (type == null) return new Unknown(event.type(), p);
        return switch (type) {
            case MOVE -> new Move(string(p, "character_id"), string(p, "to_location"), string(p, "to_region"));
            case DAMAGE -> new Damage(string(p, "character_id"), integer(p, "amount", 0));
            case HEAL -> new Heal(string(p, "character_id"), integer(p, "amount", 0));
            case ITEM_GET -> new ItemDelta(string(p, "owner_id"), string(p, "item_name"),
                    magnitude(p, "quantity_delta"), map(p, "attributes"));
            case ITEM_LOSE -> new ItemDelta(string(p, "owner_id"), string(p, "item_name"),
                    -magnitude(p, "quantity_delta"), map(p, "attributes"));
            case FLAG_SET -> new FlagSet(string(p, "key"), p.get("value"));
            case RELATIONSHIP -> new Relationship(string(p, "npc_id"), integer(p, "delta", 0));
            case WORLD_TIME_ADVANCE -> "set".equals(String.valueOf(p.get("mode")).toLowerCase(Locale.ROOT))
                    ? new WorldTimeAdvance(TimeMode.SET, longValue(p.get("world_time_minutes"), 0))
                    : new WorldTimeAdvance(TimeMode.ADD, longValue(p.get("minutes"), 0));
            case PLAYER_PSYCH_UPDATE -> new PsychUpdate(string(p, "character_id"), integer(p, "stress_delta", 0));
            case NPC_SPAWN -> spawn(p);
            case NPC_DEPART -> new Depart(string(p, "character_id"));
            case FACTION_MOVE, NPC_ACTION, PLOT_TICK, RUMOR_SPREAD -> new WorldSim(type.name(), p, event.hidden());
            case TURN, DIALOGUE, ROLL -> new LogOnly(type.name());
        };
    }

    private static Spawn spawn(Map<String, Object> p) {
        var stats = p.containsKey("stats") ? map(p, "stats") : map(p, "stats_json");
        Integer relationship = nullableInteger(p, "relationship_score");
        // zero and absent both mean "no relationship yet"
        if (relationship != null && relationship == 0) relationship = null;
        var role = string(p, "role");
        return new Spawn(
                string(p, "character_id"),
                string(p, "name"),
                role == null ? "NPC" : role,
                string(p, "location_id"),
                integer(p, "hp_current", 10),
                stats,
                relationship,
                integer(p, "credits", 0));
    }
}
