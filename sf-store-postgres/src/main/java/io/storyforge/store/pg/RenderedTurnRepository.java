package io.storyforge.store.pg;

import io.storyforge.store.RenderedTurn;
import io.storyforge.store.RenderedTurnStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

public final class RenderedTurnRepository implements RenderedTurnStore {
    private final JdbcTemplate jdbc;
    private final JsonColumns json;
    private final Clock clock;

    public RenderedTurnRepository(JdbcTemplate jdbc, JsonColumns json, Clock clock) {
        this.jdbc = jdbc; this.json = json; this.clock = clock;
    }

    @Override
    public void write(String campaignId, RenderedTurn turn) {
        var sql = """
          INSERT INTO rendered_turns (campaign_id, turn_number, text, citations_json, choices_json, created_at)
          VALUES (?, ?, ?, ?, ?, ?)
          """;
        var at = turn.createdAt() == null ? clock.instant() : turn.createdAt();
        jdbc.update(sql, campaignId, turn.turnNumber(), turn.text(),
                json.write(turn.citations()), json.write(turn.choices()), Timestamp.from(at));
    }

    @Override
    public Optional<RenderedTurn> find(String campaignId, int turnNumber) {
        var sql = """
          SELECT turn_number, text, citations_json, choices_json, created_at
          FROM rendered_turns WHERE campaign_id = ? AND turn_number = ?
          """;
        return jdbc.query(sql, mapper(), campaignId, turnNumber).stream().findFirst();
    }

    @Override
    public List<RenderedTurn> recent(String campaignId, int limit) {
        var sql = """
          SELECT turn_number, text, citations_json, choices_json, created_at
          FROM rendered_turns WHERE campaign_id = ?
          ORDER BY turn_number DESC
          LIMIT ?
          """;
        return jdbc.query(sql, mapper(), campaignId, limit);
    }

    private RowMapper<RenderedTurn> mapper() {
        return (rs, rn) -> new RenderedTurn(
                rs.getInt("turn_number"),
                rs.getString("text"),
                json.readList(rs.getString("citations_json")),
                json.readList(rs.getString("choices_json")),
                rs.getTimestamp("created_at").toInstant());
    }
}
