package io.storyforge.engine.pipeline;

import java.util.List;
import java.util.Map;

public record Narration(String text, List<Map<String, Object>> citations, List<Map<String, Object>> choices) {
    public Narration {
        text = text == null ? "" : text;
        citations = citations == null ? List.of() : List.copyOf(citations);
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static Narration text(String text) {
        return new Narration(text, List.of(), List.of());
    }
}
