package io.storyforge.engine.router;

/** Deterministic {@code text -> decision}. Implementations must not call out to anything non-deterministic. */
@FunctionalInterface
public interface IntentClassifier {
    RouterDecision classify(String userInput);
}
