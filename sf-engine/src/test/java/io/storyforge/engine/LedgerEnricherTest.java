package io.storyforge.engine;

import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.engine.pipeline.Narration;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerEnricherTest {

    private static final TurnBatch BATCH = new TurnBatch("c1", "hero", List.of(), 0, 0, null, false, Narration.text(""));

    @SuppressWarnings("unchecked")
    private static List<String> list(Map<String, Object> doc, String key) {
        return (List<String>) ((Map<String, Object>) doc.get(LedgerEnricher.LEDGER)).get(key);
    }

    @Test
    void visibleEvents_becomeFactsThreadsAndGoals() {
        var doc = new HashMap<String, Object>();
        new LedgerEnricher().enrich(doc, 1, List.of(
                GameEvent.of(EventType.MOVE, Map.of("character_id", "hero", "to_location", "docks")),
                GameEvent.of(EventType.ITEM_LOSE, Map.of("owner_id", "hero", "item_name", "key", "quantity_delta", 1)),
                GameEvent.of(EventType.RELATIONSHIP, Map.of("npc_id", "vex", "delta", -2)),
                GameEvent.of(EventType.FLAG_SET, Map.of("key", "quest_gate", "value", "open")),
                GameEvent.of(EventType.RUMOR_SPREAD, Map.of("text", "ships vanish")),
                GameEvent.hidden(EventType.DAMAGE, Map.of("character_id", "hero", "amount", 3))), BATCH);

        assertThat(list(doc, LedgerEnricher.FACTS)).containsExactly(
                "Location: docks", "Lost item: key x1.", "Relationship change with vex: -2.", "Flag set: quest_gate=open.");
        assertThat(list(doc, LedgerEnricher.THREADS)).containsExactly("Rumor: ships vanish");
        assertThat(list(doc, LedgerEnricher.GOALS)).containsExactly("Advance quest_gate.");
    }

    @Test
    void location_isReplacedAndListsAreCapped() {
        var enricher = new LedgerEnricher(3);
        var doc = new HashMap<String, Object>();
        enricher.enrich(doc, 1, List.of(GameEvent.of(EventType.MOVE, Map.of("character_id", "h", "to_location", "a"))), BATCH);
        enricher.enrich(doc, 2, List.of(
                GameEvent.of(EventType.HEAL, Map.of("character_id", "h", "amount", 1)),
                GameEvent.of(EventType.HEAL, Map.of("character_id", "h", "amount", 1)),
                GameEvent.of(EventType.HEAL, Map.of("character_id", "h", "amount", 2)),
                GameEvent.of(EventType.MOVE, Map.of("character_id", "h", "to_location", "b"))), BATCH);

        assertThat(list(doc, LedgerEnricher.FACTS)).containsExactly("Healed for 1.", "Healed for 2.", "Location: b");
    }
}
