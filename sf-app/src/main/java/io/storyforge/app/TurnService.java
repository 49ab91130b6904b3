package io.storyforge.app;

import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;
import io.storyforge.core.state.GameState;
import io.storyforge.engine.CampaignBootstrap;
import io.storyforge.engine.PipelineOrchestrator;
import io.storyforge.engine.ProjectionVerifier;
import io.storyforge.engine.TurnOutcome;
import io.storyforge.engine.TurnStorage;
import io.storyforge.engine.pipeline.TurnRequest;
import io.storyforge.store.RenderedTurn;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/** Entry point for an outer layer (HTTP, UI, CLI): campaigns, turns and read models. */
@Service
public class TurnService {
    private final TurnStorage storage;
    private final PipelineOrchestrator orchestrator;
    private final CampaignBootstrap bootstrap;
    private final ProjectionVerifier verifier;
    private final StoryForgeProperties props;

    public TurnService(TurnStorage storage, PipelineOrchestrator orchestrator, CampaignBootstrap bootstrap,
                       ProjectionVerifier verifier, StoryForgeProperties props) {
        this.storage = storage;
        this.orchestrator = orchestrator;
        this.bootstrap = bootstrap;
        this.verifier = verifier;
        this.props = props;
    }

    public GameState createCampaign(String title, List<GameEvent> genesis) {
        return bootstrap.create(storage, UUID.randomUUID().toString(), title, genesis);
    }

    public TurnOutcome runTurn(TurnRequest request) {
        return orchestrator.runTurn(storage, request);
    }

    public GameState snapshot(String campaignId) {
        return storage.campaigns().loadSnapshot(campaignId);
    }

    public List<RenderedTurn> history(String campaignId) {
        return storage.renderedTurns().recent(campaignId, props.history().limit());
    }

    /** Player-visible transcript of events; hidden events are never included. */
    public List<StoredEvent> visibleEvents(String campaignId, int sinceTurn) {
        return storage.events().getEvents(campaignId, sinceTurn, false);
    }

    public List<String> rumors(String campaignId, int limit) {
        return storage.events().getRecentPublicRumors(campaignId, limit);
    }

    public List<String> verify(String campaignId) {
        return verifier.verify(storage, campaignId);
    }
}
