package io.storyforge.engine;

import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.engine.pipeline.MechanicResult;
import io.storyforge.engine.pipeline.TurnContext;
import io.storyforge.engine.router.Route;

import java.util.ArrayList;
import java.util.Map;

/**
 * Orders a planned turn's events: the hidden {@code TURN} record, encounter events, the player's line on
 * the talk route, mechanic events, then world reaction. A turn that skipped mechanic resolution still
 * costs the time of its action class.
 */
public final class TurnBatchAssembler {

    public TurnBatch assemble(TurnContext ctx) {
        var request = ctx.request();
        var route = ctx.decision() == null ? Route.MECHANIC : ctx.decision().route();
        var mechanic = ctx.mechanic() == null ? MechanicResult.NONE : ctx.mechanic();
        int timeCost = ctx.mechanic() == null && ctx.decision() != null
                ? ctx.decision().actionClass().minutes()
                : mechanic.timeCostMinutes();

        var events = new ArrayList<GameEvent>();
        events.add(GameEvent.hidden(EventType.TURN, Map.of("user_input", request.userInput())));
        events.addAll(ctx.encounterEvents());
        if (route == Route.TALK) {
            events.add(GameEvent.of(EventType.DIALOGUE, Map.of("speaker", "Player", "text", request.userInput())));
        }
        events.addAll(mechanic.events());
        events.addAll(ctx.worldEvents());

        return new TurnBatch(request.campaignId(), request.playerId(), events,
                timeCost, mechanic.stressDelta(), request.pendingWorldTimeMinutes(),
                route == Route.META, ctx.narration());
    }
}
