package io.storyforge.store.pg;

import io.storyforge.core.GameEvent;
import io.storyforge.core.state.CharacterState;
import io.storyforge.core.state.EventSemantics;
import io.storyforge.core.state.InventoryItem;
import io.storyforge.core.state.StateTarget;
import io.storyforge.core.state.WorldSimEntry;
import io.storyforge.store.ProjectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects events onto the {@code characters}, {@code inventory} and {@code campaigns} tables through
 * the shared {@link EventSemantics}. Must be called with events in append order; the accumulator columns
 * (hp, relationship score, stress) are not order-independent.
 */
public final class PostgresProjectionEngine implements ProjectionEngine {
    private static final Logger log = LoggerFactory.getLogger(PostgresProjectionEngine.class);

    private final JdbcTemplate jdbc;
    private final CampaignSnapshotRepository campaigns;
    private final JsonColumns json;
    private final EventSemantics semantics;

    public PostgresProjectionEngine(JdbcTemplate jdbc, CampaignSnapshotRepository campaigns, JsonColumns json,
                                    EventSemantics semantics) {
        this.jdbc = jdbc;
        this.campaigns = campaigns;
        this.json = json;
        this.semantics = semantics;
    }

    @Override
    public void apply(String campaignId, List<GameEvent> events) {
        var tables = new CampaignTables(campaignId);
        for (var e : events) {
            log.debug("Projecting {} (campaign={})", e.type(), campaignId);
            semantics.apply(tables, e);
        }
    }

    /** Row-level view of one campaign's projection tables. */
    private final class CampaignTables implements StateTarget {
        private final String campaignId;

        CampaignTables(String campaignId) {
            this.campaignId = campaignId;
        }

        @Override
        public Optional<CharacterState> character(String characterId) {
            return jdbc.query("""
                      SELECT id, name, role, location_id, region_id, hp_current, stats_json,
                             relationship_score, credits, stress_level, mood
                      FROM characters WHERE campaign_id = ? AND id = ?
                      """, campaigns.characterMapper(), campaignId, characterId)
                    .stream().findFirst();
        }

        @Override
        public void insertCharacter(CharacterState c) {
            jdbc.update("""
                      INSERT INTO characters (campaign_id, id, name, role, location_id, region_id, hp_current,
                                              stats_json, relationship_score, credits, stress_level, mood)
                      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                      """,
                    campaignId, c.id(), c.name(), c.role(), c.locationId(), c.regionId(), c.hpCurrent(),
                    json.write(c.stats()), c.relationshipScore(), c.credits(), c.stressLevel(), c.mood());
        }

        @Override
        public void updateCharacter(CharacterState c) {
            jdbc.update("""
                      UPDATE characters
                      SET location_id = ?, region_id = ?, hp_current = ?, relationship_score = ?,
                          stress_level = ?, mood = ?
                      WHERE campaign_id = ? AND id = ?
                      """,
                    c.locationId(), c.regionId(), c.hpCurrent(), c.relationshipScore(),
                    c.stressLevel(), c.mood(), campaignId, c.id());
        }

        @Override
        public Optional<InventoryItem> item(String ownerId, String itemName) {
            return jdbc.query("""
                      SELECT quantity, attributes_json FROM inventory
                      WHERE campaign_id = ? AND owner_id = ? AND item_name = ?
                      """, (rs, n) -> new InventoryItem(rs.getInt(1), json.readMap(rs.getString(2))),
                    campaignId, ownerId, itemName).stream().findFirst();
        }

        @Override
        public void putItem(String ownerId, String itemName, InventoryItem item) {
            int updated = jdbc.update(
                    "UPDATE inventory SET quantity = ? WHERE campaign_id = ? AND owner_id = ? AND item_name = ?",
                    item.quantity(), campaignId, ownerId, itemName);
            if (updated == 0) {
                jdbc.update("""
                          INSERT INTO inventory (campaign_id, owner_id, item_name, quantity, attributes_json)
                          VALUES (?, ?, ?, ?, ?)
                          """, campaignId, ownerId, itemName, item.quantity(), json.write(item.attributes()));
            }
        }

        @Override
        public void removeItem(String ownerId, String itemName) {
            jdbc.update("DELETE FROM inventory WHERE campaign_id = ? AND owner_id = ? AND item_name = ?",
                    campaignId, ownerId, itemName);
        }

        @Override
        public void putWorldFlag(String key, Object value) {
            var doc = campaigns.loadWorldState(campaignId);
            var flags = CampaignSnapshotRepository.worldFlags(doc);
            flags.put(key, value);
            doc.put(CampaignSnapshotRepository.WORLD_FLAGS, flags);
            campaigns.saveWorldState(campaignId, doc);
        }

        @Override
        public long worldTimeMinutes() {
            Long minutes = jdbc.queryForObject(
                    "SELECT world_time_minutes FROM campaigns WHERE id = ?", Long.class, campaignId);
            return minutes == null ? 0 : minutes;
        }

        @Override
        public void setWorldTimeMinutes(long minutes) {
            jdbc.update("UPDATE campaigns SET world_time_minutes = ? WHERE id = ?", minutes, campaignId);
        }

        @Override
        public List<WorldSimEntry> worldSimEvents() {
            return CampaignSnapshotRepository.worldSimEvents(campaigns.loadWorldState(campaignId));
        }

        @Override
        public void setWorldSimEvents(List<WorldSimEntry> entries) {
            Map<String, Object> doc = campaigns.loadWorldState(campaignId);
            doc.put(CampaignSnapshotRepository.WORLD_SIM_EVENTS, CampaignSnapshotRepository.toDocument(entries));
            campaigns.saveWorldState(campaignId, doc);
        }

        @Override
        public void unhandled(GameEvent event) {
            log.debug("No projection for event type {} (campaign={})", event.type(), campaignId);
        }
    }
}
