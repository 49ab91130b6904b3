package io.storyforge.app;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "storyforge")
public record StoryForgeProperties(
        @DefaultValue Turns turns,
        @DefaultValue Projection projection,
        @DefaultValue History history,
        @DefaultValue Ledger ledger,
        @DefaultValue Memory memory
) {
    /** Turn-number allocation: compare-and-swap retry budget and linear backoff step. */
    public record Turns(@DefaultValue("8") int maxAllocationRetries, @DefaultValue("5ms") Duration retryBackoff) {}

    /** Capacity of the rolling world-simulation buffer in the world-state document. */
    public record Projection(@DefaultValue("50") int worldSimBufferCap) {}

    /** Rendered turns returned with each committed turn. */
    public record History(@DefaultValue("10") int limit) {}

    public record Ledger(@DefaultValue("20") int maxFacts) {}

    /** Era summaries: turns per chunk, turns kept uncompressed, summaries retained. */
    public record Memory(@DefaultValue("10") int chunkTurns, @DefaultValue("10") int recentTurns,
                         @DefaultValue("5") int maxEraSummaries) {}
}
