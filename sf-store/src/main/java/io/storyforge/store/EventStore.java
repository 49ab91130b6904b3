package io.storyforge.store;

import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;

import java.util.List;

/**
 * Append-only turn log. Writes join the caller's transaction when one is active.
 */
public interface EventStore {

    /**
     * Allocate the next turn number for a campaign with a compare-and-swap on the campaign version.
     *
     * @throws TurnAllocationException   if the retry budget is exhausted
     * @throws CampaignNotFoundException if the campaign does not exist
     */
    int reserveNextTurnNumber(String campaignId);

    void appendEvents(String campaignId, int turnNumber, List<GameEvent> events);

    /** Events with {@code turn_number >= sinceTurn} ordered by turn then insertion. */
    List<StoredEvent> getEvents(String campaignId, int sinceTurn, boolean includeHidden);

    /** Highest committed turn, 0 for a fresh campaign. */
    int getCurrentTurnNumber(String campaignId);

    /** Newest-first texts of events flagged as public rumors. */
    List<String> getRecentPublicRumors(String campaignId, int limit);
}
