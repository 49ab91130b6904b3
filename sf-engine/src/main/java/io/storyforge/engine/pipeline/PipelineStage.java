package io.storyforge.engine.pipeline;

/** A pure step of the turn graph. */
@FunctionalInterface
public interface PipelineStage {
    TurnContext apply(TurnContext context);
}
