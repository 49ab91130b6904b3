package io.storyforge.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.storyforge.core.state.EventSemantics;
import io.storyforge.core.state.StateReducer;
import io.storyforge.engine.CampaignBootstrap;
import io.storyforge.engine.CommitEnricher;
import io.storyforge.engine.EraSummaryEnricher;
import io.storyforge.engine.LedgerEnricher;
import io.storyforge.engine.PipelineOrchestrator;
import io.storyforge.engine.ProjectionVerifier;
import io.storyforge.engine.TurnCommitCoordinator;
import io.storyforge.engine.TurnStorage;
import io.storyforge.engine.pipeline.EncounterDirector;
import io.storyforge.engine.pipeline.MechanicResolver;
import io.storyforge.engine.pipeline.MetaResponder;
import io.storyforge.engine.pipeline.Narrator;
import io.storyforge.engine.pipeline.WorldReaction;
import io.storyforge.engine.router.IntentClassifier;
import io.storyforge.store.TurnAllocationPolicy;
import io.storyforge.store.pg.CampaignSnapshotRepository;
import io.storyforge.store.pg.JsonColumns;
import io.storyforge.store.pg.PostgresEventStore;
import io.storyforge.store.pg.PostgresProjectionEngine;
import io.storyforge.store.pg.RenderedTurnRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.List;

@Configuration
public class Beans {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    JsonColumns jsonColumns(ObjectMapper mapper) {
        return new JsonColumns(mapper);
    }

    @Bean
    EventSemantics eventSemantics(StoryForgeProperties props) {
        return new EventSemantics(props.projection().worldSimBufferCap());
    }

    @Bean
    PostgresEventStore eventStore(JdbcTemplate jdbc, JsonColumns json, StoryForgeProperties props, Clock clock) {
        var turns = props.turns();
        return new PostgresEventStore(jdbc, json,
                new TurnAllocationPolicy(turns.maxAllocationRetries(), turns.retryBackoff()), clock);
    }

    @Bean
    CampaignSnapshotRepository campaignRepository(JdbcTemplate jdbc, JsonColumns json) {
        return new CampaignSnapshotRepository(jdbc, json);
    }

    @Bean
    PostgresProjectionEngine projectionEngine(JdbcTemplate jdbc, CampaignSnapshotRepository campaigns,
                                              JsonColumns json, EventSemantics semantics) {
        return new PostgresProjectionEngine(jdbc, campaigns, json, semantics);
    }

    @Bean
    RenderedTurnRepository renderedTurnRepository(JdbcTemplate jdbc, JsonColumns json, Clock clock) {
        return new RenderedTurnRepository(jdbc, json, clock);
    }

    @Bean
    TurnStorage turnStorage(PostgresEventStore events, PostgresProjectionEngine projection,
                            CampaignSnapshotRepository campaigns, RenderedTurnRepository renderedTurns,
                            PlatformTransactionManager transactions) {
        return new TurnStorage(events, projection, campaigns, renderedTurns, transactions);
    }

    @Bean
    LedgerEnricher ledgerEnricher(StoryForgeProperties props) {
        return new LedgerEnricher(props.ledger().maxFacts());
    }

    @Bean
    EraSummaryEnricher eraSummaryEnricher(PostgresEventStore events, StoryForgeProperties props) {
        var memory = props.memory();
        return new EraSummaryEnricher(events, memory.chunkTurns(), memory.recentTurns(), memory.maxEraSummaries());
    }

    @Bean
    TurnCommitCoordinator turnCommitCoordinator(List<CommitEnricher> enrichers, StoryForgeProperties props, Clock clock) {
        return new TurnCommitCoordinator(enrichers, props.history().limit(), clock);
    }

    @Bean
    PipelineOrchestrator pipelineOrchestrator(TurnCommitCoordinator coordinator,
                                              ObjectProvider<IntentClassifier> classifier,
                                              ObjectProvider<MechanicResolver> mechanic,
                                              ObjectProvider<EncounterDirector> encounter,
                                              ObjectProvider<WorldReaction> worldReaction,
                                              ObjectProvider<Narrator> narrator,
                                              ObjectProvider<MetaResponder> meta) {
        var builder = PipelineOrchestrator.builder().coordinator(coordinator);
        classifier.ifAvailable(builder::classifier);
        mechanic.ifAvailable(builder::mechanic);
        encounter.ifAvailable(builder::encounter);
        worldReaction.ifAvailable(builder::worldReaction);
        narrator.ifAvailable(builder::narrator);
        meta.ifAvailable(builder::meta);
        return builder.build();
    }

    @Bean
    CampaignBootstrap campaignBootstrap() {
        return new CampaignBootstrap();
    }

    @Bean
    ProjectionVerifier projectionVerifier(EventSemantics semantics) {
        return new ProjectionVerifier(new StateReducer(semantics));
    }
}
