package io.storyforge.engine.pipeline;

import io.storyforge.engine.router.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Plain-text narration built from the router decision and the mechanic roll. */
public final class TemplateNarrator implements Narrator {

    @Override
    public Narration narrate(TurnContext context) {
        var decision = context.decision();
        var intent = decision == null ? context.request().userInput() : decision.intentText();
        var text = new StringBuilder();
        if (decision != null && decision.route() == Route.TALK) {
            text.append("You speak: ").append(intent);
        } else {
            text.append("You attempt to ").append(intent.isEmpty() ? "wait" : intent);
            var outcome = rollOutcome(context.mechanic());
            if (outcome != null) text.append(". ").append(outcome);
        }
        if (!text.toString().endsWith(".")) text.append('.');

        var choices = new ArrayList<Map<String, Object>>();
        choices.add(Map.of("label", "Look around", "intent", "look around"));
        choices.add(Map.of("label", "Talk", "intent", "say: hello"));
        choices.add(Map.of("label", "Move on", "intent", "leave"));
        return new Narration(text.toString(), List.of(), choices);
    }

    private static String rollOutcome(MechanicResult mechanic) {
        if (mechanic == null) return null;
        for (var e : mechanic.events()) {
            if (!"ROLL".equals(e.type())) continue;
            return Boolean.TRUE.equals(e.payload().get("success")) ? "It works." : "It does not go your way.";
        }
        return null;
    }
}
