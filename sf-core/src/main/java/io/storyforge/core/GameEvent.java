package io.storyforge.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable fact produced during a turn.
 * <p>
 * The payload is kept as a loose map so that producers can emit types the engine does not know yet;
 * {@link #typedPayload()} gives the checked view for the known vocabulary.
 */
public record GameEvent(
        String type,
        Map<String, Object> payload,
        boolean hidden,
        boolean publicRumor
) {
    public GameEvent {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) throw new IllegalArgumentException("event type must not be blank");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static GameEvent of(String type, Map<String, Object> payload) {
        return new GameEvent(type, payload, false, false);
    }

    public static GameEvent of(EventType type, Map<String, Object> payload) {
        return of(type.name(), payload);
    }

    public static GameEvent hidden(EventType type, Map<String, Object> payload) {
        return new GameEvent(type.name(), payload, true, false);
    }

    public static GameEvent rumor(EventType type, Map<String, Object> payload) {
        return new GameEvent(type.name(), payload, false, true);
    }

    /** The vocabulary entry for this event, empty for types this build does not recognize. */
    public Optional<EventType> knownType() {
        return EventType.lookup(type);
    }

    public EventPayload typedPayload() {
        return EventPayload.decode(this);
    }
}
