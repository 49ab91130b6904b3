package io.storyforge.engine;

import io.storyforge.core.Determinism;
import io.storyforge.core.state.GameState;
import io.storyforge.engine.pipeline.EncounterDirector;
import io.storyforge.engine.pipeline.MechanicResolver;
import io.storyforge.engine.pipeline.MetaResponder;
import io.storyforge.engine.pipeline.Narrator;
import io.storyforge.engine.pipeline.SeededMechanicResolver;
import io.storyforge.engine.pipeline.StaticMetaResponder;
import io.storyforge.engine.pipeline.TemplateNarrator;
import io.storyforge.engine.pipeline.TurnContext;
import io.storyforge.engine.pipeline.TurnGraph;
import io.storyforge.engine.pipeline.TurnRequest;
import io.storyforge.engine.pipeline.WorldReaction;
import io.storyforge.engine.router.IntentClassifier;
import io.storyforge.engine.router.KeywordIntentRouter;
import io.storyforge.engine.router.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Runs a turn end to end: load the snapshot, walk the turn graph, hand the batch to the
 * {@link TurnCommitCoordinator}. Holds no storage of its own; the {@link TurnStorage} comes with each call.
 */
public final class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final TurnGraph graph;
    private final TurnBatchAssembler assembler;
    private final TurnCommitCoordinator coordinator;

    private PipelineOrchestrator(Builder b) {
        this.coordinator = b.coordinator;
        this.assembler = new TurnBatchAssembler();
        var classifier = b.classifier;
        var meta = b.meta;
        var mechanic = b.mechanic;
        var encounter = b.encounter;
        var world = b.world;
        var narrator = b.narrator;
        this.graph = TurnGraph.builder(TurnGraph.ROUTER)
                .node(TurnGraph.ROUTER, ctx -> ctx.withDecision(classifier.classify(ctx.request().userInput())))
                .conditional(TurnGraph.ROUTER, ctx -> {
                    if (ctx.decision().route() == Route.META) return TurnGraph.META;
                    return ctx.decision().skipsMechanic() ? TurnGraph.ENCOUNTER : TurnGraph.MECHANIC;
                })
                .node(TurnGraph.META, ctx -> ctx.withNarration(meta.respond(ctx)))
                .edge(TurnGraph.META, TurnGraph.COMMIT)
                .node(TurnGraph.MECHANIC, ctx -> ctx.withMechanic(mechanic.resolve(ctx)))
                .edge(TurnGraph.MECHANIC, TurnGraph.ENCOUNTER)
                .node(TurnGraph.ENCOUNTER, ctx -> ctx.withEncounterEvents(encounter.direct(ctx)))
                .edge(TurnGraph.ENCOUNTER, TurnGraph.WORLD_REACTION)
                .node(TurnGraph.WORLD_REACTION, ctx -> ctx.withWorldEvents(world.react(ctx)))
                .edge(TurnGraph.WORLD_REACTION, TurnGraph.NARRATOR)
                .node(TurnGraph.NARRATOR, ctx -> ctx.withNarration(narrator.narrate(ctx)))
                .edge(TurnGraph.NARRATOR, TurnGraph.COMMIT)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The planned context for a request against a snapshot, without touching storage. */
    public TurnContext walk(GameState snapshot, TurnRequest request) {
        long seed = request.seed() != null
                ? request.seed()
                : Determinism.seedFrom(request.campaignId(), snapshot.turnNumber() + 1, request.userInput());
        return graph.run(TurnContext.start(request, snapshot, seed));
    }

    /** Pure planning: identical snapshot and request give an identical batch. */
    public TurnBatch plan(GameState snapshot, TurnRequest request) {
        return assembler.assemble(walk(snapshot, request));
    }

    public TurnOutcome runTurn(TurnStorage storage, TurnRequest request) {
        TurnBatch batch;
        try {
            var snapshot = storage.campaigns().loadSnapshot(request.campaignId());
            var ctx = walk(snapshot, request);
            log.debug("Planned turn {} for campaign {} via {}", ctx.expectedTurn(), request.campaignId(), ctx.path());
            batch = assembler.assemble(ctx);
        } catch (RuntimeException e) {
            log.error("Turn planning failed (campaign={})", request.campaignId(), e);
            return new TurnOutcome.Failed(request.campaignId(), e);
        }
        return coordinator.commit(storage, batch);
    }

    public static final class Builder {
        private IntentClassifier classifier = new KeywordIntentRouter();
        private MechanicResolver mechanic = new SeededMechanicResolver();
        private EncounterDirector encounter = EncounterDirector.NONE;
        private WorldReaction world = WorldReaction.NONE;
        private Narrator narrator = new TemplateNarrator();
        private MetaResponder meta = new StaticMetaResponder();
        private TurnCommitCoordinator coordinator;

        private Builder() {}

        public Builder classifier(IntentClassifier v) { this.classifier = Objects.requireNonNull(v); return this; }
        public Builder mechanic(MechanicResolver v) { this.mechanic = Objects.requireNonNull(v); return this; }
        public Builder encounter(EncounterDirector v) { this.encounter = Objects.requireNonNull(v); return this; }
        public Builder worldReaction(WorldReaction v) { this.world = Objects.requireNonNull(v); return this; }
        public Builder narrator(Narrator v) { this.narrator = Objects.requireNonNull(v); return this; }
        public Builder meta(MetaResponder v) { this.meta = Objects.requireNonNull(v); return this; }
        public Builder coordinator(TurnCommitCoordinator v) { this.coordinator = Objects.requireNonNull(v); return this; }

        public PipelineOrchestrator build() {
            if (coordinator == null) {
                coordinator = new TurnCommitCoordinator(List.of(new LedgerEnricher()),
                        TurnCommitCoordinator.DEFAULT_HISTORY_LIMIT, Clock.systemUTC());
            }
            return new PipelineOrchestrator(this);
        }
    }
}
