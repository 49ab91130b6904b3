package io.storyforge.core.state;

import java.util.Map;

public record WorldSimEntry(String eventType, Map<String, Object> payload, boolean hidden) {
    public WorldSimEntry {
        payload = Immutables.map(payload);
    }
}
