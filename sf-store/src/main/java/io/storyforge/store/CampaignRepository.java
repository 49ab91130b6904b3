package io.storyforge.store;

import io.storyforge.core.state.GameState;

import java.util.Map;
import java.util.Optional;

public interface CampaignRepository {

    void create(String campaignId, String title);

    Optional<CampaignRecord> find(String campaignId);

    /** The opaque world-state document. */
    Map<String, Object> loadWorldState(String campaignId);

    void saveWorldState(String campaignId, Map<String, Object> worldState);

    /**
     * Current projection of the campaign, read from storage.
     *
     * @throws CampaignNotFoundException if the campaign does not exist
     */
    GameState loadSnapshot(String campaignId);

    record CampaignRecord(String id, String title, Map<String, Object> worldState, long worldTimeMinutes,
                          long version, int nextTurnNumber) {}
}
