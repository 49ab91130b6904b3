package io.storyforge.engine.pipeline;

import io.storyforge.core.GameEvent;

import java.util.List;

/** Off-screen world simulation: faction moves, rumors, plot ticks. */
@FunctionalInterface
public interface WorldReaction {
    WorldReaction NONE = context -> List.of();

    List<GameEvent> react(TurnContext context);
}
