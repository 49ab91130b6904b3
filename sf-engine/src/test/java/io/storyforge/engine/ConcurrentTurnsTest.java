package io.storyforge.engine;

import io.storyforge.core.state.StateReducer;
import io.storyforge.engine.pipeline.TurnRequest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentTurnsTest {

    @Test
    void parallelTurnsOnOneCampaign_commitAsOneToN() throws Exception {
        var db = new EngineFixture();
        new CampaignBootstrap().create(db.storage, "c1", "Crowded",
                List.of(CampaignBootstrap.character("hero", "Hero", "Player", "cantina", 50)));
        var orchestrator = PipelineOrchestrator.builder().build();

        int players = 4;
        var barrier = new CyclicBarrier(players);
        var pool = Executors.newFixedThreadPool(players);
        var futures = new ArrayList<Future<TurnOutcome>>();
        try {
            for (int i = 0; i < players; i++) {
                var input = "I search crate " + i;
                futures.add(pool.submit(() -> {
                    barrier.await();
                    return orchestrator.runTurn(db.storage, TurnRequest.of("c1", "hero", input));
                }));
            }
            var turns = new ArrayList<Integer>();
            for (var f : futures) turns.add(f.get().orElseThrow().turnNumber());

            assertThat(turns).containsExactlyInAnyOrder(1, 2, 3, 4);
        } finally {
            pool.shutdownNow();
        }

        assertThat(db.count("rendered_turns")).isEqualTo(players);
        assertThat(db.storage.events().getCurrentTurnNumber("c1")).isEqualTo(players);
        assertThat(new ProjectionVerifier(new StateReducer(db.semantics)).verify(db.storage, "c1")).isEmpty();
    }
}
