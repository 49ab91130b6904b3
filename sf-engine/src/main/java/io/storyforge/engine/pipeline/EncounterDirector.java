package io.storyforge.engine.pipeline;

import io.storyforge.core.GameEvent;

import java.util.List;

/** Produces spawn and lifecycle events ({@code NPC_SPAWN}, {@code NPC_DEPART}) for the scene. */
@FunctionalInterface
public interface EncounterDirector {
    EncounterDirector NONE = context -> List.of();

    List<GameEvent> direct(TurnContext context);
}
