package io.storyforge.engine;

import io.storyforge.store.CampaignRepository;
import io.storyforge.store.EventStore;
import io.storyforge.store.ProjectionEngine;
import io.storyforge.store.RenderedTurnStore;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.Objects;

/**
 * Storage handle passed explicitly into each turn. All stores must share the data source behind
 * {@code transactions} so a turn commits or rolls back as one unit.
 */
public record TurnStorage(
        EventStore events,
        ProjectionEngine projection,
        CampaignRepository campaigns,
        RenderedTurnStore renderedTurns,
        PlatformTransactionManager transactions
) {
    public TurnStorage {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(projection, "projection");
        Objects.requireNonNull(campaigns, "campaigns");
        Objects.requireNonNull(renderedTurns, "renderedTurns");
        Objects.requireNonNull(transactions, "transactions");
    }
}
