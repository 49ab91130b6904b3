package io.storyforge.engine.pipeline;

import io.storyforge.core.Determinism;
import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.engine.router.ActionClass;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Default resolver: one d20 check drawn from the turn seed, recorded as a hidden {@code ROLL}.
 * Time cost follows the action class; a natural 1 adds a point of stress.
 */
public final class SeededMechanicResolver implements MechanicResolver {
    static final int DIFFICULTY = 10;

    @Override
    public MechanicResult resolve(TurnContext context) {
        var decision = context.decision();
        var actionClass = decision == null ? ActionClass.PHYSICAL_ACTION : decision.actionClass();
        int roll = Determinism.rng(context.seed()).nextInt(1, 21);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("die", "d20");
        payload.put("roll", roll);
        payload.put("dc", DIFFICULTY);
        payload.put("success", roll >= DIFFICULTY);
        payload.put("action_class", actionClass.name());
        payload.put("intent", decision == null ? context.request().userInput() : decision.intentText());

        return new MechanicResult(List.of(GameEvent.hidden(EventType.ROLL, payload)),
                actionClass.minutes(), roll == 1 ? 1 : 0);
    }
}
