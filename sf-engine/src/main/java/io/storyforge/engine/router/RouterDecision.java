package io.storyforge.engine.router;

import java.util.Objects;

/**
 * Classification of one player input.
 *
 * @param intentText normalized text the rest of the pipeline works from
 * @param rationale  short reason, for logs
 */
public record RouterDecision(
        String intentText,
        Route route,
        ActionClass actionClass,
        boolean requiresResolution,
        double confidence,
        String rationale
) {
    public RouterDecision {
        intentText = intentText == null ? "" : intentText;
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(actionClass, "actionClass");
    }

    /** Only pure dialogue may bypass mechanic resolution. */
    public boolean skipsMechanic() {
        return route == Route.TALK && actionClass == ActionClass.DIALOGUE_ONLY;
    }
}
