package io.storyforge.engine;

import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.store.RenderedTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Writes one planned turn atomically:
 * reserve turn number, add implied events, update the world-state document, append, project,
 * write the rendered turn, commit. Any failure rolls the whole turn back, including the turn number.
 */
public final class TurnCommitCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TurnCommitCoordinator.class);

    public static final int DEFAULT_HISTORY_LIMIT = 10;

    private final List<CommitEnricher> enrichers;
    private final int historyLimit;
    private final Clock clock;

    public TurnCommitCoordinator(List<CommitEnricher> enrichers, int historyLimit, Clock clock) {
        if (historyLimit < 0) throw new IllegalArgumentException("historyLimit must be >= 0");
        this.enrichers = List.copyOf(enrichers);
        this.historyLimit = historyLimit;
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Failures inside the transaction come back as {@link TurnOutcome.Failed}. Reloading the snapshot after a
     * successful commit happens outside the transaction; errors there propagate since the turn is already durable.
     */
    public TurnOutcome commit(TurnStorage storage, TurnBatch batch) {
        var campaignId = batch.campaignId();
        long started = System.nanoTime();
        int turn = 0;
        List<GameEvent> events = List.of();
        RenderedTurn rendered = null;

        try (var tx = TurnTransaction.begin(storage.transactions())) {
            turn = storage.events().reserveNextTurnNumber(campaignId);
            events = withImpliedEvents(batch);

            var worldState = storage.campaigns().loadWorldState(campaignId);
            storage.campaigns().saveWorldState(campaignId, enrich(worldState, turn, events, batch));

            storage.events().appendEvents(campaignId, turn, events);
            storage.projection().apply(campaignId, events);

            var narration = batch.narration();
            rendered = new RenderedTurn(turn, narration.text(), narration.citations(), narration.choices(), clock.instant());
            storage.renderedTurns().write(campaignId, rendered);

            tx.commit();
        } catch (RuntimeException e) {
            log.error("Turn rolled back (campaign={}, turn={}): {}", campaignId, turn == 0 ? "unallocated" : turn,
                    e.toString(), e);
            return new TurnOutcome.Failed(campaignId, e);
        }

        log.info("Committed turn {} (campaign={}, events={}, {} ms)", turn, campaignId, events.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

        var snapshot = storage.campaigns().loadSnapshot(campaignId);
        var history = storage.renderedTurns().recent(campaignId, historyLimit);
        return new TurnOutcome.Committed(campaignId, turn, events, snapshot, rendered, history);
    }

    static List<GameEvent> withImpliedEvents(TurnBatch batch) {
        var out = new ArrayList<>(batch.events());
        if (!batch.meta()) {
            if (batch.pendingWorldTimeMinutes() != null) {
                out.add(GameEvent.hidden(EventType.WORLD_TIME_ADVANCE,
                        Map.of("mode", "set", "world_time_minutes", batch.pendingWorldTimeMinutes())));
            } else if (batch.timeCostMinutes() > 0) {
                out.add(GameEvent.hidden(EventType.WORLD_TIME_ADVANCE,
                        Map.of("mode", "add", "minutes", batch.timeCostMinutes())));
            }
        }
        if (batch.stressDelta() != 0) {
            out.add(GameEvent.hidden(EventType.PLAYER_PSYCH_UPDATE,
                    Map.of("character_id", batch.playerId(), "stress_delta", batch.stressDelta())));
        }
        return out;
    }

    private Map<String, Object> enrich(Map<String, Object> worldState, int turn, List<GameEvent> events, TurnBatch batch) {
        var current = worldState;
        for (var enricher : enrichers) {
            var copy = new LinkedHashMap<>(current);
            try {
                enricher.enrich(copy, turn, events, batch);
                current = copy;
            } catch (RuntimeException e) {
                log.warn("Commit enricher {} failed, continuing without it (campaign={}, turn={})",
                        enricher.getClass().getSimpleName(), batch.campaignId(), turn, e);
            }
        }
        return current;
    }
}
