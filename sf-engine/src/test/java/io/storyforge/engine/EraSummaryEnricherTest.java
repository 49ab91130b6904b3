package io.storyforge.engine;

import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;
import io.storyforge.engine.pipeline.MechanicResult;
import io.storyforge.engine.pipeline.Narration;
import io.storyforge.engine.pipeline.TurnRequest;
import io.storyforge.store.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EraSummaryEnricherTest {

    private static final TurnBatch BATCH = new TurnBatch("c1", "hero", List.of(), 0, 0, null, false, Narration.text(""));

    private EngineFixture db;

    @BeforeEach
    void setUp() {
        db = new EngineFixture();
        new CampaignBootstrap().create(db.storage, "c1", "Docks",
                List.of(CampaignBootstrap.character("hero", "Hero", "Player", "cantina", 40)));
    }

    private PipelineOrchestrator orchestrator(CommitEnricher enricher) {
        var walkAndBruise = new MechanicResult(List.of(
                GameEvent.of(EventType.MOVE, Map.of("character_id", "hero", "to_location", "docks")),
                GameEvent.of(EventType.DAMAGE, Map.of("character_id", "hero", "amount", 1)),
                GameEvent.hidden(EventType.HEAL, Map.of("character_id", "hero", "amount", 50))), 5, 0);
        return PipelineOrchestrator.builder()
                .mechanic(ctx -> walkAndBruise)
                .coordinator(new TurnCommitCoordinator(List.of(enricher), 10, Clock.systemUTC()))
                .build();
    }

    private static StoredEvent stored(int turn, GameEvent event) {
        return new StoredEvent(turn, turn, event, Instant.EPOCH);
    }

    @Test
    void chunkIsSummarizedOnceItLeavesTheRecentWindow() {
        var orchestrator = orchestrator(new EraSummaryEnricher(db.storage.events()));

        for (int i = 1; i <= 19; i++) {
            orchestrator.runTurn(db.storage, TurnRequest.of("c1", "hero", "walk " + i)).orElseThrow();
        }
        assertThat(db.storage.campaigns().loadWorldState("c1")).doesNotContainKey(EraSummaryEnricher.ERA_SUMMARIES);

        var twentieth = orchestrator.runTurn(db.storage, TurnRequest.of("c1", "hero", "walk 20")).orElseThrow();

        assertThat(twentieth.turnNumber()).isEqualTo(20);
        var doc = db.storage.campaigns().loadWorldState("c1");
        assertThat(doc.get(EraSummaryEnricher.ERA_SUMMARIES)).asList()
                .containsExactly("Turns 1-10: visited docks; took 10 total damage.");
        assertThat(doc).containsEntry(EraSummaryEnricher.SUMMARIZED_THROUGH, 10);
    }

    @Test
    void failingEventRead_isSkippedAndTheTurnCommits() {
        var events = mock(EventStore.class);
        when(events.getEvents(anyString(), anyInt(), anyBoolean())).thenThrow(new IllegalStateException("log offline"));

        var outcome = orchestrator(new EraSummaryEnricher(events, 1, 0, 5))
                .runTurn(db.storage, TurnRequest.of("c1", "hero", "walk"));

        assertThat(outcome.isCommitted()).isTrue();
        assertThat(db.storage.events().getCurrentTurnNumber("c1")).isEqualTo(1);
        assertThat(db.storage.campaigns().loadWorldState("c1")).doesNotContainKey(EraSummaryEnricher.ERA_SUMMARIES);
    }

    @Test
    void trimmedListDoesNotResummarizeOldChunks() {
        var events = mock(EventStore.class);
        when(events.getEvents("c1", 6, false)).thenReturn(List.of(
                stored(6, GameEvent.of(EventType.NPC_SPAWN, Map.of("character_id", "vex", "name", "Vex")))));
        var doc = new HashMap<String, Object>();
        doc.put(EraSummaryEnricher.ERA_SUMMARIES, new ArrayList<>(List.of("Turns 4-4: uneventful.", "Turns 5-5: uneventful.")));
        doc.put(EraSummaryEnricher.SUMMARIZED_THROUGH, 5);

        new EraSummaryEnricher(events, 1, 0, 2).enrich(doc, 6, List.of(), BATCH);

        assertThat(doc.get(EraSummaryEnricher.ERA_SUMMARIES)).asList()
                .containsExactly("Turns 5-5: uneventful.", "Turns 6-6: met Vex.");
        assertThat(doc).containsEntry(EraSummaryEnricher.SUMMARIZED_THROUGH, 6);
    }

    @Test
    void nothingToCompress_doesNotReadTheLog() {
        var events = mock(EventStore.class);
        var doc = new HashMap<String, Object>();

        new EraSummaryEnricher(events).enrich(doc, 15, List.of(), BATCH);

        verify(events, never()).getEvents(anyString(), anyInt(), anyBoolean());
        assertThat(doc).isEmpty();
    }

    @Test
    void summary_listsItemsFlagsAndHealing() {
        var summary = EraSummaryEnricher.summarize(List.of(
                GameEvent.of(EventType.ITEM_GET, Map.of("owner_id", "hero", "item_name", "lamp", "quantity_delta", 1)),
                GameEvent.of(EventType.ITEM_LOSE, Map.of("owner_id", "hero", "item_name", "coin", "quantity_delta", 1)),
                GameEvent.of(EventType.HEAL, Map.of("character_id", "hero", "amount", 4)),
                GameEvent.of(EventType.FLAG_SET, Map.of("key", "gate", "value", "open"))), 11, 20);

        assertThat(summary).isEqualTo("Turns 11-20: acquired lamp; healed 4 total; flags: gate=open.");
        assertThat(EraSummaryEnricher.summarize(List.of(), 1, 10)).isEqualTo("Turns 1-10: uneventful.");
    }
}
