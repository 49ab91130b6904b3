package io.storyforge.store.pg;

import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;
import io.storyforge.store.CampaignNotFoundException;
import io.storyforge.store.EventStore;
import io.storyforge.store.TurnAllocationException;
import io.storyforge.store.TurnAllocationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turn log on the {@code turn_events} table.
 * <p>
 * Turn numbers are allocated lock-free: read the campaign version, compute the next number, and
 * write it back only if the version is unchanged. Inside a transaction the successful update keeps the
 * campaign row locked until commit, so concurrent turns on one campaign serialize there.
 */
public final class PostgresEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventStore.class);
    private static final int RUMOR_FALLBACK_CHARS = 300;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final TurnAllocationPolicy policy;
    private final Clock clock;

    public PostgresEventStore(JdbcTemplate jdbc, JsonColumns json, TurnAllocationPolicy policy, Clock clock) {
        this.jdbcTemplate = Objects.requireNonNull(jdbc);
        this.json = Objects.requireNonNull(json);
        this.policy = Objects.requireNonNull(policy);
        this.clock = Objects.requireNonNull(clock);
    }

    private record Allocation(long version, int hint, int maxTurn) {}

    @Override
    public int reserveNextTurnNumber(String campaignId) {
        final String read = """
      SELECT c.version, c.next_turn_number,
             (SELECT COALESCE(MAX(e.turn_number), 0) FROM turn_events e WHERE e.campaign_id = c.id) AS max_turn
      FROM campaigns c
      WHERE c.id = ?
      """;
        final String swap = """
      UPDATE campaigns SET next_turn_number = ?, version = version + 1
      WHERE id = ? AND version = ?
      """;
        for (int attempt = 1; attempt <= policy.maxRetries(); attempt++) {
            var current = jdbcTemplate.query(read,
                            (rs, n) -> new Allocation(rs.getLong(1), rs.getInt(2), rs.getInt(3)), campaignId)
                    .stream().findFirst()
                    .orElseThrow(() -> new CampaignNotFoundException(campaignId));

            int allocated = Math.max(current.hint(), current.maxTurn() + 1);
            if (jdbcTemplate.update(swap, allocated + 1, campaignId, current.version()) == 1) {
                return allocated;
            }
            log.debug("Turn allocation lost a race (campaign={}, attempt={}, version={})",
                    campaignId, attempt, current.version());
            pause(campaignId, attempt);
        }
        throw new TurnAllocationException(campaignId, policy.maxRetries());
    }

    private void pause(String campaignId, int attempt) {
        var wait = policy.backoffFor(attempt);
        if (wait.isZero()) return;
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnAllocationException(campaignId, attempt, e);
        }
    }

    @Override
    public void appendEvents(String campaignId, int turnNumber, List<GameEvent> events) {
        if (events == null || events.isEmpty()) return;
        final String sql = """
      INSERT INTO turn_events (campaign_id, turn_number, event_type, payload_json, is_hidden, is_public_rumor, created_at)
      VALUES (?, ?, ?, ?, ?, ?, ?)
      """;
        var createdAt = Timestamp.from(clock.instant());
        var rows = new ArrayList<Object[]>(events.size());
        for (GameEvent e : events) {
            rows.add(new Object[]{
                    campaignId,
                    turnNumber,
                    e.type(),
                    json.write(e.payload()),
                    e.hidden(),
                    e.publicRumor(),
                    createdAt
            });
        }
        jdbcTemplate.batchUpdate(sql, rows);
    }

    @Override
    public List<StoredEvent> getEvents(String campaignId, int sinceTurn, boolean includeHidden) {
        var sql = new StringBuilder("""
      SELECT id, turn_number, event_type, payload_json, is_hidden, is_public_rumor, created_at
      FROM turn_events
      WHERE campaign_id = ? AND turn_number >= ?
      """);
        if (!includeHidden) sql.append(" AND is_hidden = FALSE");
        sql.append(" ORDER BY turn_number ASC, id ASC");
        return jdbcTemplate.query(sql.toString(), mapper(), campaignId, sinceTurn);
    }

    @Override
    public int getCurrentTurnNumber(String campaignId) {
        Integer n = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(turn_number), 0) FROM turn_events WHERE campaign_id = ?",
                Integer.class, campaignId);
        return n == null ? 0 : n;
    }

    @Override
    public List<String> getRecentPublicRumors(String campaignId, int limit) {
        final String sql = """
      SELECT event_type, payload_json
      FROM turn_events
      WHERE campaign_id = ? AND is_public_rumor = TRUE
      ORDER BY turn_number DESC, id DESC
      LIMIT ?
      """;
        return jdbcTemplate.query(sql, (rs, n) -> rumorText(rs.getString(1), rs.getString(2)), campaignId, limit);
    }

    private String rumorText(String type, String payloadJson) {
        var payload = json.readMap(payloadJson);
        var text = payload.get("text") == null ? "" : String.valueOf(payload.get("text")).strip();
        if (text.isEmpty() && !payload.isEmpty()) {
            text = payloadJson.length() > RUMOR_FALLBACK_CHARS ? payloadJson.substring(0, RUMOR_FALLBACK_CHARS) : payloadJson;
        }
        return text.isEmpty() ? "[" + type + "]" : text;
    }

    private RowMapper<StoredEvent> mapper() {
        return (ResultSet rs, int rowNum) -> new StoredEvent(
                rs.getLong("id"),
                rs.getInt("turn_number"),
                new GameEvent(
                        rs.getString("event_type"),
                        json.readMap(rs.getString("payload_json")),
                        rs.getBoolean("is_hidden"),
                        rs.getBoolean("is_public_rumor")),
                rs.getTimestamp("created_at").toInstant());
    }
}
