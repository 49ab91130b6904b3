package io.storyforge.engine;

import io.storyforge.core.GameEvent;
import io.storyforge.engine.pipeline.Narration;

import java.util.List;
import java.util.Objects;

/**
 * Everything a planned turn wants to write, before a turn number is known.
 *
 * @param events                  producer events in append order; implied events are added at commit
 * @param pendingWorldTimeMinutes absolute world time to set, overrides {@code timeCostMinutes}
 * @param meta                    out-of-fiction turn; no world time passes
 */
public record TurnBatch(
        String campaignId,
        String playerId,
        List<GameEvent> events,
        int timeCostMinutes,
        int stressDelta,
        Long pendingWorldTimeMinutes,
        boolean meta,
        Narration narration
) {
    public TurnBatch {
        Objects.requireNonNull(campaignId, "campaignId");
        playerId = playerId == null ? "" : playerId;
        events = events == null ? List.of() : List.copyOf(events);
        narration = narration == null ? Narration.text("") : narration;
    }
}
