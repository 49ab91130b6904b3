package io.storyforge.engine.pipeline;

import java.util.Map;

public final class StaticMetaResponder implements MetaResponder {
    private static final Map<String, String> ANSWERS = Map.of(
            "help", "Describe what your character does or says. Quote speech, or use [DIALOGUE] and [ACTION].",
            "save", "Progress is saved after every turn.",
            "load", "Pick a campaign from the campaign list to continue it.",
            "quit", "Your campaign is saved; come back any time.");

    @Override
    public Narration respond(TurnContext context) {
        var intent = context.decision() == null ? "help" : context.decision().intentText();
        return Narration.text(ANSWERS.getOrDefault(intent, ANSWERS.get("help")));
    }
}
