package io.storyforge.store.pg;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;
import io.storyforge.store.TurnAllocationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PostgresEventStoreIntegrationTest {

    private PostgresEventStore store;

    @BeforeEach
    void setUp() {
        var jdbc = new JdbcTemplate(H2Databases.fresh());
        var json = new JsonColumns(new ObjectMapper());
        new CampaignSnapshotRepository(jdbc, json).create("c1", "Log");
        store = new PostgresEventStore(jdbc, json, TurnAllocationPolicy.DEFAULT, Clock.systemUTC());
    }

    @Test
    void getEvents_ordersByTurnThenInsertionAndHonoursSince() {
        store.appendEvents("c1", 2, List.of(GameEvent.of("B", Map.of()), GameEvent.of("C", Map.of())));
        store.appendEvents("c1", 1, List.of(GameEvent.of("A", Map.of("k", 1))));

        assertThat(store.getEvents("c1", 0, true)).extracting(e -> e.event().type()).containsExactly("A", "B", "C");
        assertThat(store.getEvents("c1", 2, true)).extracting(StoredEvent::turnNumber).containsExactly(2, 2);
        assertThat(store.getEvents("c1", 0, true).get(0).event().payload()).containsEntry("k", 1);
    }

    @Test
    void hiddenEvents_neverReturnedWhenExcluded() {
        store.appendEvents("c1", 1, List.of(
                GameEvent.hidden(EventType.TURN, Map.of("user_input", "x")),
                GameEvent.of(EventType.DIALOGUE, Map.of("text", "hi")),
                GameEvent.hidden(EventType.ROLL, Map.of("roll", 12))));

        var visible = store.getEvents("c1", 0, false);
        assertThat(visible).extracting(e -> e.event().type()).containsExactly("DIALOGUE");
        assertThat(visible).noneMatch(e -> e.event().hidden());
        assertThat(store.getEvents("c1", 0, true)).hasSize(3);
    }

    @Test
    void publicRumors_newestFirstWithFallbacks() {
        store.appendEvents("c1", 1, List.of(GameEvent.rumor(EventType.RUMOR_SPREAD, Map.of("text", " old news "))));
        store.appendEvents("c1", 2, List.of(
                GameEvent.rumor(EventType.NPC_ACTION, Map.of("who", "Vex")),
                GameEvent.rumor(EventType.PLOT_TICK, Map.of()),
                GameEvent.of(EventType.RUMOR_SPREAD, Map.of("text", "not public"))));

        var rumors = store.getRecentPublicRumors("c1", 10);

        assertThat(rumors).containsExactly("[PLOT_TICK]", "{\"who\":\"Vex\"}", "old news");
        assertThat(store.getRecentPublicRumors("c1", 1)).containsExactly("[PLOT_TICK]");
    }

    @Test
    void currentTurn_isMaxTurnInLog() {
        assertThat(store.getCurrentTurnNumber("c1")).isZero();
        store.appendEvents("c1", 0, List.of(GameEvent.of(EventType.NPC_SPAWN, Map.of())));
        assertThat(store.getCurrentTurnNumber("c1")).isZero();
        store.appendEvents("c1", 3, List.of(GameEvent.of(EventType.TURN, Map.of())));
        assertThat(store.getCurrentTurnNumber("c1")).isEqualTo(3);
    }
}
