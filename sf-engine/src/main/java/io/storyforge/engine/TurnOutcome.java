package io.storyforge.engine;

import io.storyforge.core.GameEvent;
import io.storyforge.core.state.GameState;
import io.storyforge.store.RenderedTurn;

import java.util.List;
import java.util.Objects;

/** Result of one turn: either everything was written or nothing was. */
public sealed interface TurnOutcome permits TurnOutcome.Committed, TurnOutcome.Failed {

    String campaignId();

    default boolean isCommitted() {
        return this instanceof Committed;
    }

    default Committed orElseThrow() {
        if (this instanceof Committed c) return c;
        throw new TurnCommitException(campaignId(), ((Failed) this).cause());
    }

    /**
     * @param events   the appended batch, implied events included
     * @param snapshot state reloaded from storage after commit
     * @param history  most recent rendered turns, newest first
     */
    record Committed(
            String campaignId,
            int turnNumber,
            List<GameEvent> events,
            GameState snapshot,
            RenderedTurn rendered,
            List<RenderedTurn> history
    ) implements TurnOutcome {
        public Committed {
            events = List.copyOf(events);
            history = List.copyOf(history);
        }
    }

    record Failed(String campaignId, Exception cause) implements TurnOutcome {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
