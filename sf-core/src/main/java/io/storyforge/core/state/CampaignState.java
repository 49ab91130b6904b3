package io.storyforge.core.state;

import java.util.List;
import java.util.Map;

/**
 * Campaign-level slice of the game state.
 *
 * @param worldFlags     flags set through {@code FLAG_SET}
 * @param worldSimEvents rolling buffer of low-priority world simulation events, oldest first
 */
public record CampaignState(
        String id,
        String title,
        long worldTimeMinutes,
        Map<String, Object> worldFlags,
        List<WorldSimEntry> worldSimEvents
) {
    public CampaignState {
        worldFlags = Immutables.map(worldFlags);
        worldSimEvents = Immutables.list(worldSimEvents);
    }

    public static CampaignState empty() {
        return new CampaignState("", "", 0, Map.of(), List.of());
    }
}
