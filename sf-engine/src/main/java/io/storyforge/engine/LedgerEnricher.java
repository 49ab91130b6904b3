package io.storyforge.engine;

import io.storyforge.core.EventPayload;
import io.storyforge.core.GameEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keeps a short ledger of established facts, open threads and goals in {@code world_state.ledger},
 * derived from the visible events of each turn. Lists are de-duplicated and keep the newest entries.
 */
public final class LedgerEnricher implements CommitEnricher {
    public static final String LEDGER = "ledger";
    public static final String FACTS = "established_facts";
    public static final String THREADS = "open_threads";
    public static final String GOALS = "active_goals";
    public static final int DEFAULT_MAX_FACTS = 20;
    private static final int MAX_ENTRY_CHARS = 200;
    private static final String LOCATION = "Location:";

    private final int maxEntries;

    public LedgerEnricher() {
        this(DEFAULT_MAX_FACTS);
    }

    public LedgerEnricher(int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.maxEntries = maxEntries;
    }

    @Override
    public void enrich(Map<String, Object> worldState, int turnNumber, List<GameEvent> events, TurnBatch batch) {
        var ledger = worldState.get(LEDGER) instanceof Map<?, ?> m ? m : Map.of();
        var facts = strings(ledger.get(FACTS));
        var threads = strings(ledger.get(THREADS));
        var goals = strings(ledger.get(GOALS));

        for (var e : events) {
            if (e.hidden()) continue;
            var p = e.typedPayload();
            if (p instanceof EventPayload.Move move && move.toLocation() != null) {
                facts.removeIf(f -> f.startsWith(LOCATION));
                facts.add(LOCATION + " " + move.toLocation());
            } else if (p instanceof EventPayload.Damage d) {
                facts.add("Damage taken: " + d.amount() + ".");
            } else if (p instanceof EventPayload.Heal h) {
                facts.add("Healed for " + h.amount() + ".");
            } else if (p instanceof EventPayload.ItemDelta item && item.itemName() != null) {
                facts.add((item.quantityDelta() >= 0 ? "Gained item: " : "Lost item: ")
                        + item.itemName() + " x" + Math.abs(item.quantityDelta()) + ".");
            } else if (p instanceof EventPayload.Relationship r && r.npcId() != null) {
                facts.add(String.format(Locale.ROOT, "Relationship change with %s: %+d.", r.npcId(), r.delta()));
            } else if (p instanceof EventPayload.FlagSet f && f.key() != null) {
                facts.add("Flag set: " + f.key() + "=" + f.value() + ".");
                var key = f.key().toLowerCase(Locale.ROOT);
                if (key.contains("quest") || key.contains("goal")) goals.add("Advance " + f.key() + ".");
            } else if (p instanceof EventPayload.Spawn s && s.name() != null) {
                facts.add("NPC introduced: " + s.name() + " (" + s.role() + ").");
            } else if (p instanceof EventPayload.WorldSim w) {
                worldSim(w, facts, threads);
            }
        }

        var updated = new LinkedHashMap<String, Object>();
        ledger.forEach((k, v) -> updated.put(String.valueOf(k), v));
        updated.put(FACTS, dedupeAndTrim(facts));
        updated.put(THREADS, dedupeAndTrim(threads));
        updated.put(GOALS, dedupeAndTrim(goals));
        worldState.put(LEDGER, updated);
    }

    private static void worldSim(EventPayload.WorldSim w, List<String> facts, List<String> threads) {
        var text = w.payload().get("text") == null ? "" : String.valueOf(w.payload().get("text")).strip();
        switch (w.eventType()) {
            case "RUMOR_SPREAD" -> { if (!text.isEmpty()) threads.add("Rumor: " + text); }
            case "PLOT_TICK" -> { if (!text.isEmpty()) threads.add("Plot: " + text); }
            case "NPC_ACTION" -> { if (!text.isEmpty()) facts.add("NPC action: " + text); }
            case "FACTION_MOVE" -> {
                var faction = w.payload().get("faction");
                if (!text.isEmpty()) facts.add("Faction move: " + text);
                else if (faction != null) facts.add("Faction updated: " + faction + ".");
            }
            default -> { }
        }
    }

    private List<String> dedupeAndTrim(List<String> items) {
        var unique = new LinkedHashSet<String>();
        for (var item : items) {
            var s = item == null ? "" : item.strip();
            if (s.isEmpty()) continue;
            unique.add(s.length() > MAX_ENTRY_CHARS ? s.substring(0, MAX_ENTRY_CHARS) : s);
        }
        var out = new ArrayList<>(unique);
        return out.size() > maxEntries ? new ArrayList<>(out.subList(out.size() - maxEntries, out.size())) : out;
    }

    private static List<String> strings(Object value) {
        var out = new ArrayList<String>();
        if (value instanceof List<?> list) {
            for (var o : list) if (o != null) out.add(String.valueOf(o));
        }
        return out;
    }
}
