package io.storyforge.store;

import java.util.List;
import java.util.Optional;

public interface RenderedTurnStore {

    /** Write-once: a second write for the same turn fails. */
    void write(String campaignId, RenderedTurn turn);

    Optional<RenderedTurn> find(String campaignId, int turnNumber);

    /** Most recent first. */
    List<RenderedTurn> recent(String campaignId, int limit);
}
