package io.storyforge.store;

import io.storyforge.core.GameEvent;

import java.util.List;

/** Applies events, in append order, to the queryable current-state tables. */
public interface ProjectionEngine {
    void apply(String campaignId, List<GameEvent> events);
}
