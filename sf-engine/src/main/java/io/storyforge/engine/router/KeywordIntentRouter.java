package io.storyforge.engine.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword router with guardrails: inputs carrying action verbs or persuasion, deception and
 * "ask someone to" requests always go through mechanic resolution, whatever dialogue cues they have.
 * <p>
 * Also understands the split form {@code [DIALOGUE] ... [ACTION] ...}.
 */
public final class KeywordIntentRouter implements IntentClassifier {
    private static final Logger log = LoggerFactory.getLogger(KeywordIntentRouter.class);

    static final Set<String> ACTION_VERBS = words(
            "stab stabs stabbing stabbed",
            "shoot shoots shooting shot",
            "steal steals stealing stole stolen",
            "punch punches punching punched",
            "grab grabs grabbing grabbed",
            "run runs running ran",
            "sneak sneaks sneaking sneaked snuck",
            "hack hacks hacking hacked",
            "pickpocket pickpockets pickpocketing pickpocketed",
            "attack attacks attacking attacked",
            "kill kills killing killed",
            "hit hits hitting",
            "slash slashes slashing slashed",
            "strike strikes striking struck",
            "pull pulls pulling pulled",
            "draw draws drawing drew drawn",
            "throw throws throwing threw thrown",
            "take takes taking took taken",
            "push pushes pushing pushed",
            "kick kicks kicking kicked",
            "strangle strangles strangling strangled",
            "poison poisons poisoning poisoned",
            "lockpick lockpicks lockpicking lockpicked",
            "pick picks picking picked");

    static final Set<String> PERSUASION_VERBS = words(
            "persuade persuades persuading persuaded",
            "convince convinces convincing convinced",
            "intimidate intimidates intimidating intimidated",
            "deceive deceives deceiving deceived",
            "negotiate negotiates negotiating negotiated",
            "bribe bribes bribing bribed",
            "threaten threatens threatening threatened",
            "demand demands demanding demanded",
            "blackmail blackmails blackmailing blackmailed");

    private static final Pattern LIE = Pattern.compile("\\b(lie|lies|lying|lied)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASK_TO = Pattern.compile("\\bask\\s+(him|her|them|you|the\\s+\\w+)\\s+to\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPLIT_DIALOGUE = Pattern.compile("\\[DIALOGUE]\\s*(.+?)(?=\\[ACTION]|$)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern SPLIT_ACTION = Pattern.compile("\\[ACTION]\\s*(.+?)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");

    private static final Pattern SPEECH_VERB = Pattern.compile("\\bi\\s+(ask|tell|say|reply|answer|whisper|shout)\\s+(him|her|them|you|the\\s+)");
    private static final Pattern SPEAKING = Pattern.compile("\\bi('m| am)\\s+(just\\s+)?(saying|asking|telling)");
    private static final Pattern TELL_ASK = Pattern.compile("^(tell|ask)\\s+(him|her|them|you)\\b");

    private static final Pattern META_WORD = Pattern.compile("\\b(save|load|help|menu|quit)\\b");
    private static final Pattern META_FALSE_POSITIVE = Pattern.compile("\\b(save\\s+him|load\\s+the)\\b");

    @Override
    public RouterDecision classify(String userInput) {
        var decision = route(userInput);
        log.debug("Routed input to {}/{} ({})", decision.route(), decision.actionClass(), decision.rationale());
        return decision;
    }

    private RouterDecision route(String userInput) {
        var raw = userInput == null ? "" : userInput.strip();

        var dialogue = SPLIT_DIALOGUE.matcher(raw);
        var action = SPLIT_ACTION.matcher(raw);
        boolean hasDialogue = dialogue.find();
        boolean hasAction = action.find();
        if (hasDialogue && hasAction) {
            var combined = dialogue.group(1).strip() + " " + action.group(1).strip();
            return mechanic(combined, ActionClass.DIALOGUE_WITH_ACTION, 1.0, "split input: dialogue + action");
        }
        if (hasAction) {
            return mechanic(action.group(1).strip(), ActionClass.PHYSICAL_ACTION, 1.0, "split input: action only");
        }
        if (hasDialogue) {
            // dialogue alone still runs through the guardrails below
            raw = dialogue.group(1).strip();
        }

        var low = raw.toLowerCase(Locale.ROOT);
        String dialogueCue = dialogueCue(raw, low);

        if (hasActionVerb(raw)) {
            if (dialogueCue != null || low.contains("say") || low.contains("tell") || low.contains("ask")) {
                return mechanic(raw, ActionClass.DIALOGUE_WITH_ACTION, 1.0, "guardrail: action verb in dialogue");
            }
            return mechanic(raw, ActionClass.PHYSICAL_ACTION, 1.0, "guardrail: action verb");
        }
        if (isPersuasion(raw)) {
            return mechanic(raw, ActionClass.DIALOGUE_WITH_ACTION, 1.0, "guardrail: persuasion, deception or ask-to");
        }
        if (META_WORD.matcher(low).find() && !META_FALSE_POSITIVE.matcher(low).find()) {
            return new RouterDecision(metaIntent(low), Route.META, ActionClass.META, false, 0.9, "meta command");
        }
        if (dialogueCue != null) {
            return new RouterDecision(raw, Route.TALK, ActionClass.DIALOGUE_ONLY, false, 0.85, dialogueCue);
        }
        return mechanic(raw, ActionClass.PHYSICAL_ACTION, 0.8, "default to mechanic");
    }

    static boolean hasActionVerb(String text) {
        return tokens(text).stream().anyMatch(ACTION_VERBS::contains);
    }

    static boolean isPersuasion(String text) {
        if (text == null || text.isBlank()) return false;
        return tokens(text).stream().anyMatch(PERSUASION_VERBS::contains)
                || LIE.matcher(text).find()
                || ASK_TO.matcher(text).find();
    }

    private static String dialogueCue(String raw, String low) {
        if (low.startsWith("say:")) return "say: prefix";
        if (raw.indexOf('"') >= 0 || raw.indexOf('\'') >= 0) return "quoted speech";
        if (SPEECH_VERB.matcher(low).find()) return "I ask/tell/say pattern";
        if (SPEAKING.matcher(low).find()) return "I'm saying/asking/telling";
        if (TELL_ASK.matcher(low).find()) return "tell/ask him/her";
        return null;
    }

    private static String metaIntent(String low) {
        if (low.matches("(?s).*\\bhelp\\b.*")) return "help";
        if (low.matches("(?s).*\\bsave\\b.*")) return "save";
        if (low.matches("(?s).*\\bload\\b.*")) return "load";
        return "quit";
    }

    private static RouterDecision mechanic(String intent, ActionClass actionClass, double confidence, String rationale) {
        return new RouterDecision(intent, Route.MECHANIC, actionClass, true, confidence, rationale);
    }

    private static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) return Set.of();
        var cleaned = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return Arrays.stream(cleaned.split("\\s+")).filter(s -> !s.isEmpty()).collect(Collectors.toSet());
    }

    private static Set<String> words(String... groups) {
        return Arrays.stream(groups)
                .flatMap(g -> Arrays.stream(g.split(" ")))
                .collect(Collectors.toUnmodifiableSet());
    }
}
