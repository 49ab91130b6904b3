package io.storyforge.engine;

import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.core.state.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Creates a campaign and its opening cast in one transaction. Genesis events are logged at turn 0, which
 * turn allocation never hands out, so a replay of the full log reproduces the projection.
 */
public final class CampaignBootstrap {
    private static final Logger log = LoggerFactory.getLogger(CampaignBootstrap.class);

    public static final int GENESIS_TURN = 0;

    public GameState create(TurnStorage storage, String campaignId, String title, List<GameEvent> genesis) {
        try (var tx = TurnTransaction.begin(storage.transactions())) {
            storage.campaigns().create(campaignId, title);
            if (!genesis.isEmpty()) {
                storage.events().appendEvents(campaignId, GENESIS_TURN, genesis);
                storage.projection().apply(campaignId, genesis);
            }
            tx.commit();
        }
        log.info("Created campaign {} ({} genesis events)", campaignId, genesis.size());
        return storage.campaigns().loadSnapshot(campaignId);
    }

    public static GameEvent character(String id, String name, String role, String locationId, int hp) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("character_id", id);
        payload.put("name", name);
        payload.put("role", role);
        payload.put("location_id", locationId);
        payload.put("hp_current", hp);
        return GameEvent.of(EventType.NPC_SPAWN, payload);
    }
}
