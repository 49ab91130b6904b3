package io.storyforge.engine.pipeline;

@FunctionalInterface
public interface Narrator {
    Narration narrate(TurnContext context);
}
