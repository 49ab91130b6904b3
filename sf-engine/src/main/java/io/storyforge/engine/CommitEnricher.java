package io.storyforge.engine;

import io.storyforge.core.GameEvent;

import java.util.List;
import java.util.Map;

/**
 * Best-effort update of the campaign's world-state document during commit. A failing enricher is logged
 * and skipped; it never aborts the turn.
 */
@FunctionalInterface
public interface CommitEnricher {

    /**
     * @param worldState mutable copy of the document; changes are kept only if this returns normally
     * @param events     the batch being appended, implied events included
     */
    void enrich(Map<String, Object> worldState, int turnNumber, List<GameEvent> events, TurnBatch batch);
}
