package io.storyforge.engine.pipeline;

@FunctionalInterface
public interface MechanicResolver {
    MechanicResult resolve(TurnContext context);
}
