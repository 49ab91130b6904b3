package io.storyforge.store.pg;

import io.storyforge.core.state.CampaignState;
import io.storyforge.core.state.CharacterState;
import io.storyforge.core.state.GameState;
import io.storyforge.core.state.InventoryItem;
import io.storyforge.core.state.WorldSimEntry;
import io.storyforge.store.CampaignNotFoundException;
import io.storyforge.store.CampaignRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Campaign aggregate rows and the read side of the projection tables.
 */
public final class CampaignSnapshotRepository implements CampaignRepository {
    static final String WORLD_FLAGS = "world_flags";
    static final String WORLD_SIM_EVENTS = "world_sim_events";

    private final JdbcTemplate jdbc;
    private final JsonColumns json;

    public CampaignSnapshotRepository(JdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc; this.json = json;
    }

    @Override
    public void create(String campaignId, String title) {
        jdbc.update("INSERT INTO campaigns (id, title, world_state_json) VALUES (?, ?, '{}')", campaignId, title);
    }

    @Override
    public Optional<CampaignRecord> find(String campaignId) {
        var sql = """
          SELECT id, title, world_state_json, world_time_minutes, version, next_turn_number
          FROM campaigns WHERE id = ?
          """;
        return jdbc.query(sql, campaignMapper(), campaignId).stream().findFirst();
    }

    @Override
    public Map<String, Object> loadWorldState(String campaignId) {
        var docs = jdbc.queryForList("SELECT world_state_json FROM campaigns WHERE id = ?", String.class, campaignId);
        if (docs.isEmpty()) throw new CampaignNotFoundException(campaignId);
        return json.readMap(docs.get(0));
    }

    @Override
    public void saveWorldState(String campaignId, Map<String, Object> worldState) {
        int updated = jdbc.update("UPDATE campaigns SET world_state_json = ? WHERE id = ?", json.write(worldState), campaignId);
        if (updated == 0) throw new CampaignNotFoundException(campaignId);
    }

    @Override
    public GameState loadSnapshot(String campaignId) {
        var campaign = find(campaignId).orElseThrow(() -> new CampaignNotFoundException(campaignId));

        var characters = new LinkedHashMap<String, CharacterState>();
        jdbc.query("""
                  SELECT id, name, role, location_id, region_id, hp_current, stats_json,
                         relationship_score, credits, stress_level, mood
                  FROM characters WHERE campaign_id = ? ORDER BY id
                  """, characterMapper(), campaignId)
                .forEach(c -> characters.put(c.id(), c));

        var inventory = new LinkedHashMap<String, Map<String, InventoryItem>>();
        jdbc.query("""
                  SELECT owner_id, item_name, quantity, attributes_json
                  FROM inventory WHERE campaign_id = ? ORDER BY owner_id, item_name
                  """, rs -> {
            inventory.computeIfAbsent(rs.getString("owner_id"), k -> new LinkedHashMap<>())
                    .put(rs.getString("item_name"),
                            new InventoryItem(rs.getInt("quantity"), json.readMap(rs.getString("attributes_json"))));
        }, campaignId);

        Integer turn = jdbc.queryForObject(
                "SELECT COALESCE(MAX(turn_number), 0) FROM turn_events WHERE campaign_id = ?", Integer.class, campaignId);

        var doc = campaign.worldState();
        var state = new CampaignState(campaign.id(), campaign.title(), campaign.worldTimeMinutes(),
                worldFlags(doc), worldSimEvents(doc));
        return new GameState(state, characters, inventory, turn == null ? 0 : turn, List.of());
    }

    static Map<String, Object> worldFlags(Map<String, Object> doc) {
        return stringKeyed(doc.get(WORLD_FLAGS));
    }

    private static Map<String, Object> stringKeyed(Object value) {
        var out = new LinkedHashMap<String, Object>();
        if (value instanceof Map<?, ?> m) m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    static List<WorldSimEntry> worldSimEvents(Map<String, Object> doc) {
        var out = new ArrayList<WorldSimEntry>();
        if (doc.get(WORLD_SIM_EVENTS) instanceof List<?> entries) {
            for (Object o : entries) {
                if (!(o instanceof Map<?, ?> entry)) continue;
                out.add(new WorldSimEntry(String.valueOf(entry.get("event_type")), stringKeyed(entry.get("payload")),
                        Boolean.TRUE.equals(entry.get("is_hidden"))));
            }
        }
        return out;
    }

    static List<Map<String, Object>> toDocument(List<WorldSimEntry> entries) {
        var out = new ArrayList<Map<String, Object>>(entries.size());
        for (var e : entries) {
            var m = new LinkedHashMap<String, Object>();
            m.put("event_type", e.eventType());
            m.put("payload", e.payload());
            m.put("is_hidden", e.hidden());
            out.add(m);
        }
        return out;
    }

    RowMapper<CharacterState> characterMapper() {
        return (rs, rn) -> new CharacterState(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("role"),
                rs.getString("location_id"),
                rs.getString("region_id"),
                rs.getInt("hp_current"),
                json.readMap(rs.getString("stats_json")),
                nullableInt(rs, "relationship_score"),
                rs.getInt("credits"),
                nullableInt(rs, "stress_level"),
                rs.getString("mood"));
    }

    private RowMapper<CampaignRecord> campaignMapper() {
        return (rs, rn) -> new CampaignRecord(
                rs.getString("id"),
                rs.getString("title"),
                json.readMap(rs.getString("world_state_json")),
                rs.getLong("world_time_minutes"),
                rs.getLong("version"),
                rs.getInt("next_turn_number"));
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }
}
