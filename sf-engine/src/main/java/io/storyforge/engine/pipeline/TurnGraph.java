package io.storyforge.engine.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Directed graph of {@link PipelineStage}s ending at {@link #COMMIT}. Walking the graph only plans a turn;
 * the commit node is terminal and the graph itself never writes.
 */
public final class TurnGraph {
    public static final String ROUTER = "router";
    public static final String META = "meta";
    public static final String MECHANIC = "mechanic";
    public static final String ENCOUNTER = "encounter";
    public static final String WORLD_REACTION = "world_reaction";
    public static final String NARRATOR = "narrator";
    public static final String COMMIT = "commit";

    private final String entry;
    private final Map<String, PipelineStage> nodes;
    private final Map<String, Function<TurnContext, String>> edges;

    private TurnGraph(String entry, Map<String, PipelineStage> nodes, Map<String, Function<TurnContext, String>> edges) {
        this.entry = entry;
        this.nodes = Map.copyOf(nodes);
        this.edges = Map.copyOf(edges);
    }

    public static Builder builder(String entry) {
        return new Builder(entry);
    }

    /** Runs from the entry node until {@link #COMMIT} is reached; the returned context records the path taken. */
    public TurnContext run(TurnContext start) {
        var ctx = start;
        var current = entry;
        int steps = 0;
        while (!COMMIT.equals(current)) {
            if (++steps > nodes.size() + 1) {
                throw new IllegalStateException("Turn graph did not reach commit: " + ctx.path());
            }
            var stage = nodes.get(current);
            if (stage == null) throw new IllegalStateException("No stage named " + current);
            ctx = stage.apply(ctx).visited(current);
            var next = edges.get(current);
            if (next == null) throw new IllegalStateException("Stage " + current + " has no outgoing edge");
            current = next.apply(ctx);
        }
        return ctx.visited(COMMIT);
    }

    public static final class Builder {
        private final String entry;
        private final Map<String, PipelineStage> nodes = new LinkedHashMap<>();
        private final Map<String, Function<TurnContext, String>> edges = new LinkedHashMap<>();

        private Builder(String entry) {
            this.entry = Objects.requireNonNull(entry);
        }

        public Builder node(String name, PipelineStage stage) {
            if (COMMIT.equals(name)) throw new IllegalArgumentException("commit is the terminal node");
            nodes.put(name, Objects.requireNonNull(stage));
            return this;
        }

        public Builder edge(String from, String to) {
            return conditional(from, ctx -> to);
        }

        public Builder conditional(String from, Function<TurnContext, String> choose) {
            if (edges.putIfAbsent(from, Objects.requireNonNull(choose)) != null) {
                throw new IllegalArgumentException("Stage " + from + " already has an outgoing edge");
            }
            return this;
        }

        public TurnGraph build() {
            if (!nodes.containsKey(entry)) throw new IllegalStateException("Entry stage " + entry + " is not defined");
            for (var name : nodes.keySet()) {
                if (!edges.containsKey(name)) throw new IllegalStateException("Stage " + name + " has no outgoing edge");
            }
            return new TurnGraph(entry, nodes, edges);
        }
    }
}
