package io.storyforge.app;

import io.storyforge.engine.CampaignBootstrap;
import io.storyforge.engine.EraSummaryEnricher;
import io.storyforge.engine.pipeline.MetaResponder;
import io.storyforge.engine.pipeline.Narration;
import io.storyforge.engine.pipeline.TurnRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "storyforge.history.limit=2")
class StoryForgeApplicationTest {

    @Autowired
    private TurnService turns;

    @Autowired
    private StoryForgeProperties props;

    @Autowired
    private EraSummaryEnricher eraSummaries;

    @Value("${spring.datasource.url}")
    private String datasourceUrl;

    @TestConfiguration
    static class HostOverrides {
        @Bean
        MetaResponder metaResponder() {
            return ctx -> Narration.text("Host help: " + ctx.decision().intentText());
        }
    }

    @Test
    void properties_bindWithDefaults() {
        assertThat(props.turns().maxAllocationRetries()).isEqualTo(8);
        assertThat(props.turns().retryBackoff()).isEqualTo(Duration.ofMillis(5));
        assertThat(props.projection().worldSimBufferCap()).isEqualTo(50);
        assertThat(props.history().limit()).isEqualTo(2);
        assertThat(props.memory().chunkTurns()).isEqualTo(10);
        assertThat(props.memory().maxEraSummaries()).isEqualTo(5);
        assertThat(eraSummaries).isNotNull();
    }

    @Test
    void embeddedDatabase_waitsOnRowLocksLongerThanTheDefault() {
        assertThat(datasourceUrl).contains("LOCK_TIMEOUT=10000");
    }

    @Test
    void hostMetaResponder_replacesTheDefault() {
        var id = turns.createCampaign("Meta", List.of()).campaign().id();

        var outcome = turns.runTurn(TurnRequest.of(id, "hero", "help")).orElseThrow();

        assertThat(outcome.rendered().text()).isEqualTo("Host help: help");
    }

    @Test
    void campaignAndTurns_runThroughTheWiredStack() {
        var campaign = turns.createCampaign("Wired", List.of(
                CampaignBootstrap.character("hero", "Hero", "Player", "cantina", 20)));
        var id = campaign.campaign().id();
        assertThat(campaign.character("hero")).isPresent();

        var first = turns.runTurn(TurnRequest.of(id, "hero", "\"Anyone seen my droid?\"")).orElseThrow();
        var second = turns.runTurn(TurnRequest.of(id, "hero", "I search the back room")).orElseThrow();
        turns.runTurn(TurnRequest.of(id, "hero", "help")).orElseThrow();

        assertThat(first.turnNumber()).isEqualTo(1);
        assertThat(second.turnNumber()).isEqualTo(2);
        assertThat(turns.history(id)).extracting(r -> r.turnNumber()).containsExactly(3, 2);
        assertThat(turns.visibleEvents(id, 1)).extracting(e -> e.event().type()).containsExactly("DIALOGUE");
        assertThat(turns.snapshot(id).campaign().worldTimeMinutes()).isEqualTo(26);
        assertThat(turns.verify(id)).isEmpty();
    }
}
