package io.storyforge.engine.pipeline;

import io.storyforge.core.GameEvent;

import java.util.List;

/** What resolving an action produced. The coordinator turns time cost and stress delta into events. */
public record MechanicResult(List<GameEvent> events, int timeCostMinutes, int stressDelta) {
    public static final MechanicResult NONE = new MechanicResult(List.of(), 0, 0);

    public MechanicResult {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
