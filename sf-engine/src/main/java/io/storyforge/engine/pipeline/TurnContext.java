package io.storyforge.engine.pipeline;

import io.storyforge.core.GameEvent;
import io.storyforge.core.state.GameState;
import io.storyforge.engine.router.RouterDecision;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable state threaded through the turn graph. Stages return a modified copy; nothing in here
 * can reach storage.
 *
 * @param snapshot  campaign state the turn was planned against
 * @param seed      RNG seed for every random draw in the turn
 * @param decision  router output, null until the router ran
 * @param mechanic  mechanic output, null when the mechanic was skipped
 * @param path      names of the stages visited so far
 */
public record TurnContext(
        TurnRequest request,
        GameState snapshot,
        long seed,
        RouterDecision decision,
        MechanicResult mechanic,
        List<GameEvent> encounterEvents,
        List<GameEvent> worldEvents,
        Narration narration,
        List<String> path
) {
    public TurnContext {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(snapshot, "snapshot");
        encounterEvents = encounterEvents == null ? List.of() : List.copyOf(encounterEvents);
        worldEvents = worldEvents == null ? List.of() : List.copyOf(worldEvents);
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static TurnContext start(TurnRequest request, GameState snapshot, long seed) {
        return new TurnContext(request, snapshot, seed, null, null, List.of(), List.of(), null, List.of());
    }

    /** Turn number this plan expects to commit as; the coordinator may allocate a later one. */
    public int expectedTurn() {
        return snapshot.turnNumber() + 1;
    }

    public TurnContext withDecision(RouterDecision d) {
        return new TurnContext(request, snapshot, seed, d, mechanic, encounterEvents, worldEvents, narration, path);
    }

    public TurnContext withMechanic(MechanicResult m) {
        return new TurnContext(request, snapshot, seed, decision, m, encounterEvents, worldEvents, narration, path);
    }

    public TurnContext withEncounterEvents(List<GameEvent> events) {
        return new TurnContext(request, snapshot, seed, decision, mechanic, events, worldEvents, narration, path);
    }

    public TurnContext withWorldEvents(List<GameEvent> events) {
        return new TurnContext(request, snapshot, seed, decision, mechanic, encounterEvents, events, narration, path);
    }

    public TurnContext withNarration(Narration n) {
        return new TurnContext(request, snapshot, seed, decision, mechanic, encounterEvents, worldEvents, n, path);
    }

    TurnContext visited(String stage) {
        var p = new ArrayList<>(path);
        p.add(stage);
        return new TurnContext(request, snapshot, seed, decision, mechanic, encounterEvents, worldEvents, narration, p);
    }
}
