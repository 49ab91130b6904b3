package io.storyforge.engine.pipeline;

import java.util.Objects;

/**
 * One player input against one campaign.
 *
 * @param seed                    explicit RNG seed; derived from the campaign, turn and input when null
 * @param pendingWorldTimeMinutes absolute world time to jump to at commit, or null
 */
public record TurnRequest(
        String campaignId,
        String playerId,
        String userInput,
        Long seed,
        Long pendingWorldTimeMinutes
) {
    public TurnRequest {
        Objects.requireNonNull(campaignId, "campaignId");
        playerId = playerId == null ? "" : playerId;
        userInput = userInput == null ? "" : userInput.strip();
    }

    public static TurnRequest of(String campaignId, String playerId, String userInput) {
        return new TurnRequest(campaignId, playerId, userInput, null, null);
    }

    public TurnRequest withSeed(long s) {
        return new TurnRequest(campaignId, playerId, userInput, s, pendingWorldTimeMinutes);
    }

    public TurnRequest withPendingWorldTime(long minutes) {
        return new TurnRequest(campaignId, playerId, userInput, seed, minutes);
    }
}
