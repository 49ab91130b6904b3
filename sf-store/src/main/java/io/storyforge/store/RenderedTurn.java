package io.storyforge.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Narrative output persisted once per committed turn. */
public record RenderedTurn(
        int turnNumber,
        String text,
        List<Map<String, Object>> citations,
        List<Map<String, Object>> choices,
        Instant createdAt
) {
    public RenderedTurn {
        text = text == null ? "" : text;
        citations = citations == null ? List.of() : List.copyOf(citations);
        choices = choices == null ? List.of() : List.copyOf(choices);
    }
}
