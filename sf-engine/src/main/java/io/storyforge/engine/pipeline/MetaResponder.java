package io.storyforge.engine.pipeline;

/** Answers out-of-fiction commands (help, save, load, quit). */
@FunctionalInterface
public interface MetaResponder {
    Narration respond(TurnContext context);
}
