package io.storyforge.core;

import java.time.Instant;
import java.util.Objects;

/** An event as read back from the log, with its position and append time. */
public record StoredEvent(long id, int turnNumber, GameEvent event, Instant createdAt) {
    public StoredEvent {
        Objects.requireNonNull(event);
    }
}
