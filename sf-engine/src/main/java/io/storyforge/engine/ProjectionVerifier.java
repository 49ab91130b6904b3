package io.storyforge.engine;

import io.storyforge.core.state.GameState;
import io.storyforge.core.state.StateReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replays a campaign's full log through the reducer and compares the result with the stored projection.
 * Projections remain the read model; this is a consistency check, not a recovery path.
 */
public final class ProjectionVerifier {
    private static final Logger log = LoggerFactory.getLogger(ProjectionVerifier.class);

    private final StateReducer reducer;

    public ProjectionVerifier(StateReducer reducer) {
        this.reducer = reducer;
    }

    /** @return human-readable differences, empty when projection and replay agree */
    public List<String> verify(TurnStorage storage, String campaignId) {
        var projected = storage.campaigns().loadSnapshot(campaignId);
        var replayed = reducer.replay(StateReducer.initialState(), storage.events().getEvents(campaignId, 0, true));

        var diffs = diff(projected, replayed);
        if (!diffs.isEmpty()) {
            log.warn("Projection of campaign {} diverges from its log: {}", campaignId, diffs);
        }
        return diffs;
    }

    static List<String> diff(GameState projected, GameState replayed) {
        var out = new ArrayList<String>();
        compare(out, "characters", projected.characters(), replayed.characters());
        compare(out, "inventory", projected.inventory(), replayed.inventory());
        compare(out, "world_flags", projected.campaign().worldFlags(), replayed.campaign().worldFlags());
        compare(out, "world_time_minutes", projected.campaign().worldTimeMinutes(), replayed.campaign().worldTimeMinutes());
        compare(out, "world_sim_events", projected.campaign().worldSimEvents(), replayed.campaign().worldSimEvents());
        compare(out, "turn_number", projected.turnNumber(), replayed.turnNumber());
        return out;
    }

    private static void compare(List<String> out, String what, Object projected, Object replayed) {
        if (!Objects.equals(projected, replayed)) {
            out.add(what + ": projection=" + projected + " replay=" + replayed);
        }
    }
}
