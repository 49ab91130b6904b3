package io.storyforge.engine.router;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordIntentRouterTest {

    private final KeywordIntentRouter router = new KeywordIntentRouter();

    @ParameterizedTest
    @ValueSource(strings = {
            "say: Hello there",
            "\"Where is the captain?\"",
            "I ask him where the ship is",
            "Tell her the cargo is late",
    })
    void plainDialogue_takesTheTalkPath(String input) {
        var d = router.classify(input);

        assertThat(d.route()).isEqualTo(Route.TALK);
        assertThat(d.actionClass()).isEqualTo(ActionClass.DIALOGUE_ONLY);
        assertThat(d.requiresResolution()).isFalse();
        assertThat(d.skipsMechanic()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "\"Nice to meet you\" I say, and stab him",
            "I tell the guard hello while I pick his pocket",
            "\"Hands up!\" I shout and draw my blaster",
    })
    void dialogueWithActionVerb_neverSkipsMechanic(String input) {
        var d = router.classify(input);

        assertThat(d.route()).isEqualTo(Route.MECHANIC);
        assertThat(d.actionClass()).isEqualTo(ActionClass.DIALOGUE_WITH_ACTION);
        assertThat(d.requiresResolution()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "\"You should let us through\" I say, trying to persuade him",
            "\"I'm a health inspector,\" I lie",
            "I ask the guard to open the gate",
            "\"Pay up or else,\" I threaten",
    })
    void persuasionAndDeception_goToMechanic(String input) {
        var d = router.classify(input);

        assertThat(d.route()).isEqualTo(Route.MECHANIC);
        assertThat(d.actionClass()).isEqualTo(ActionClass.DIALOGUE_WITH_ACTION);
    }

    @Test
    void lieInsideOtherWords_isNotDeception() {
        var d = router.classify("\"I believe you\"");

        assertThat(d.route()).isEqualTo(Route.TALK);
    }

    @Test
    void actionVerbWithoutDialogue_isPhysical() {
        var d = router.classify("I attack the droid");

        assertThat(d.route()).isEqualTo(Route.MECHANIC);
        assertThat(d.actionClass()).isEqualTo(ActionClass.PHYSICAL_ACTION);
    }

    @Test
    void metaCommands_areNormalized() {
        assertThat(router.classify("help").intentText()).isEqualTo("help");
        assertThat(router.classify("please save my game").intentText()).isEqualTo("save");
        assertThat(router.classify("open the menu").intentText()).isEqualTo("quit");
        assertThat(router.classify("help").route()).isEqualTo(Route.META);
    }

    @Test
    void metaWordWithActionVerb_isNotMeta() {
        var d = router.classify("I ask for help and stab him");

        assertThat(d.route()).isEqualTo(Route.MECHANIC);
        assertThat(d.actionClass()).isEqualTo(ActionClass.DIALOGUE_WITH_ACTION);
    }

    @Test
    void saveHim_isNotAMetaCommand() {
        assertThat(router.classify("I try to save him from the fire").route()).isEqualTo(Route.MECHANIC);
    }

    @Test
    void splitInput_dialogueAndAction() {
        var d = router.classify("[DIALOGUE] Stand down. [ACTION] I raise my hands");

        assertThat(d.actionClass()).isEqualTo(ActionClass.DIALOGUE_WITH_ACTION);
        assertThat(d.intentText()).isEqualTo("Stand down. I raise my hands");
    }

    @Test
    void splitInput_actionOnly() {
        var d = router.classify("[ACTION] climb the wall");

        assertThat(d.actionClass()).isEqualTo(ActionClass.PHYSICAL_ACTION);
        assertThat(d.intentText()).isEqualTo("climb the wall");
    }

    @Test
    void splitInput_dialogueOnlyStillHitsGuardrails() {
        assertThat(router.classify("[DIALOGUE] \"Hello friend\"").skipsMechanic()).isTrue();
        assertThat(router.classify("[DIALOGUE] \"Give me the keys or I shoot\"").skipsMechanic()).isFalse();
    }

    @Test
    void unmarkedInput_defaultsToMechanic() {
        var d = router.classify("I walk to the market");

        assertThat(d.route()).isEqualTo(Route.MECHANIC);
        assertThat(d.actionClass()).isEqualTo(ActionClass.PHYSICAL_ACTION);
        assertThat(router.classify(null).route()).isEqualTo(Route.MECHANIC);
    }
}
