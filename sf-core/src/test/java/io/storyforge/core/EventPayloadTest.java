package io.storyforge.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventPayloadTest {

    @Test
    void decode_itemLoseIsAlwaysNegative() {
        var p = GameEvent.of("item_lose", Map.of("owner_id", "hero", "item_name", "rope", "quantity_delta", 3)).typedPayload();

        assertThat(p).isEqualTo(new EventPayload.ItemDelta("hero", "rope", -3, Map.of()));
    }

    @Test
    void decode_coercesNumericStringsAndFallsBackToZero() {
        assertThat(GameEvent.of(EventType.DAMAGE, Map.of("character_id", "a", "amount", "7")).typedPayload())
                .isEqualTo(new EventPayload.Damage("a", 7));
        assertThat(GameEvent.of(EventType.DAMAGE, Map.of("character_id", "a", "amount", "lots")).typedPayload())
                .isEqualTo(new EventPayload.Damage("a", 0));
    }

    @Test
    void decode_outOfRangeNumbersSaturate() {
        assertThat(GameEvent.of(EventType.DAMAGE, Map.of("character_id", "a", "amount", 4_294_967_301L)).typedPayload())
                .isEqualTo(new EventPayload.Damage("a", Integer.MAX_VALUE));
        assertThat(GameEvent.of(EventType.ITEM_GET, Map.of("owner_id", "a", "item_name", "x", "quantity_delta", Integer.MIN_VALUE))
                .typedPayload()).isEqualTo(new EventPayload.ItemDelta("a", "x", Integer.MAX_VALUE, Map.of()));
        assertThat(GameEvent.of(EventType.ITEM_LOSE, Map.of("owner_id", "a", "item_name", "x", "quantity_delta", Long.MIN_VALUE))
                .typedPayload()).isEqualTo(new EventPayload.ItemDelta("a", "x", -Integer.MAX_VALUE, Map.of()));
    }

    @Test
    void decode_spawnStatsWithNonStringKeysAreStringified() {
        var p = (EventPayload.Spawn) GameEvent.of(EventType.NPC_SPAWN, Map.of(
                "character_id", "vex", "name", "Vex", "stats", Map.of(1, "quick"))).typedPayload();

        assertThat(p.stats()).containsExactly(Map.entry("1", "quick"));
    }

    @Test
    void decode_worldTimeModes() {
        assertThat(GameEvent.of(EventType.WORLD_TIME_ADVANCE, Map.of("mode", "set", "world_time_minutes", 90)).typedPayload())
                .isEqualTo(new EventPayload.WorldTimeAdvance(EventPayload.TimeMode.SET, 90));
        assertThat(GameEvent.of(EventType.WORLD_TIME_ADVANCE, Map.of("minutes", 15)).typedPayload())
                .isEqualTo(new EventPayload.WorldTimeAdvance(EventPayload.TimeMode.ADD, 15));
    }

    @Test
    void decode_spawnDefaultsAndZeroRelationshipMeansNone() {
        var p = (EventPayload.Spawn) GameEvent.of(EventType.NPC_SPAWN, Map.of(
                "character_id", "vex", "name", "Vex", "location_id", "docks", "relationship_score", 0)).typedPayload();

        assertThat(p.role()).isEqualTo("NPC");
        assertThat(p.hpCurrent()).isEqualTo(10);
        assertThat(p.relationshipScore()).isNull();
        assertThat(p.complete()).isTrue();
    }

    @Test
    void decode_unknownTypeKeepsRawMap() {
        var raw = Map.<String, Object>of("ship_type", "freighter");
        assertThat(GameEvent.of("STARSHIP_ACQUIRED", raw).typedPayload())
                .isEqualTo(new EventPayload.Unknown("STARSHIP_ACQUIRED", raw));
    }

    @Test
    void worldSimPayloadCarriesHiddenFlag() {
        var e = new GameEvent("faction_move", Map.of("faction", "guild"), true, false);
        assertThat(e.typedPayload()).isEqualTo(new EventPayload.WorldSim("FACTION_MOVE", Map.of("faction", "guild"), true));
    }

    @Test
    void gameEvent_copiesPayloadAndRejectsBlankType() {
        var source = new HashMap<String, Object>();
        source.put("key", "a");
        var e = GameEvent.of(EventType.FLAG_SET, source);
        source.put("key", "b");

        assertThat(e.payload()).containsEntry("key", "a");
        assertThatThrownBy(() -> GameEvent.of("  ", Map.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
