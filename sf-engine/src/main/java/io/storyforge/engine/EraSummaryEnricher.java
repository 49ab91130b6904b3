package io.storyforge.engine;

import io.storyforge.core.EventPayload;
import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;
import io.storyforge.store.EventStore;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Compresses older turns into one-line era summaries kept in {@code world_state.era_summaries}.
 * <p>
 * Turns are folded in fixed-size chunks once a whole chunk has fallen out of the recent window, so the
 * turn being committed is never part of a chunk. Only visible events count. The list keeps the newest
 * {@code maxSummaries} entries; {@code era_summaries_through} records the last compressed turn so that
 * trimming the list never causes a chunk to be summarized twice.
 */
public final class EraSummaryEnricher implements CommitEnricher {
    public static final String ERA_SUMMARIES = "era_summaries";
    public static final String SUMMARIZED_THROUGH = "era_summaries_through";
    public static final int DEFAULT_CHUNK_TURNS = 10;
    public static final int DEFAULT_RECENT_TURNS = 10;
    public static final int DEFAULT_MAX_SUMMARIES = 5;
    private static final int MAX_SUMMARY_CHARS = 300;
    private static final int MAX_NAMES = 5;
    private static final int MAX_FLAGS = 3;

    private final EventStore events;
    private final int chunkTurns;
    private final int recentTurns;
    private final int maxSummaries;

    public EraSummaryEnricher(EventStore events) {
        this(events, DEFAULT_CHUNK_TURNS, DEFAULT_RECENT_TURNS, DEFAULT_MAX_SUMMARIES);
    }

    public EraSummaryEnricher(EventStore events, int chunkTurns, int recentTurns, int maxSummaries) {
        if (chunkTurns < 1) throw new IllegalArgumentException("chunkTurns must be >= 1");
        if (recentTurns < 0) throw new IllegalArgumentException("recentTurns must be >= 0");
        if (maxSummaries < 1) throw new IllegalArgumentException("maxSummaries must be >= 1");
        this.events = Objects.requireNonNull(events);
        this.chunkTurns = chunkTurns;
        this.recentTurns = recentTurns;
        this.maxSummaries = maxSummaries;
    }

    @Override
    public void enrich(Map<String, Object> worldState, int turnNumber, List<GameEvent> batchEvents, TurnBatch batch) {
        int through = worldState.get(SUMMARIZED_THROUGH) instanceof Number n ? n.intValue() : 0;
        int compressibleUpTo = Math.max(0, turnNumber - recentTurns);
        if (through + chunkTurns > compressibleUpTo) return;

        var byTurn = new TreeMap<Integer, List<GameEvent>>();
        for (StoredEvent e : events.getEvents(batch.campaignId(), through + 1, false)) {
            byTurn.computeIfAbsent(e.turnNumber(), t -> new ArrayList<>()).add(e.event());
        }

        var summaries = new ArrayList<String>();
        if (worldState.get(ERA_SUMMARIES) instanceof List<?> existing) {
            for (var o : existing) if (o != null) summaries.add(String.valueOf(o));
        }
        while (through + chunkTurns <= compressibleUpTo) {
            int start = through + 1;
            int end = through + chunkTurns;
            var chunk = new ArrayList<GameEvent>();
            byTurn.subMap(start, true, end, true).values().forEach(chunk::addAll);
            summaries.add(summarize(chunk, start, end));
            through = end;
        }
        if (summaries.size() > maxSummaries) {
            summaries = new ArrayList<>(summaries.subList(summaries.size() - maxSummaries, summaries.size()));
        }
        worldState.put(ERA_SUMMARIES, summaries);
        worldState.put(SUMMARIZED_THROUGH, through);
    }

    static String summarize(List<GameEvent> chunk, int start, int end) {
        Set<String> locations = new LinkedHashSet<>();
        Set<String> npcs = new LinkedHashSet<>();
        Set<String> items = new LinkedHashSet<>();
        var flags = new ArrayList<String>();
        long damage = 0;
        long healed = 0;

        for (var e : chunk) {
            var p = e.typedPayload();
            if (p instanceof EventPayload.Move m && m.toLocation() != null && !m.toLocation().isBlank()) {
                locations.add(m.toLocation());
            } else if (p instanceof EventPayload.Spawn s && s.name() != null && !s.name().isBlank()) {
                npcs.add(s.name());
            } else if (p instanceof EventPayload.ItemDelta i && EventType.ITEM_GET.name().equals(e.type())
                    && i.itemName() != null && !i.itemName().isBlank()) {
                items.add(i.itemName());
            } else if (p instanceof EventPayload.Damage d) {
                damage += d.amount();
            } else if (p instanceof EventPayload.Heal h) {
                healed += h.amount();
            } else if (p instanceof EventPayload.FlagSet f && f.key() != null && !f.key().isBlank()) {
                flags.add(f.key() + "=" + (f.value() == null ? "" : f.value()));
            }
        }

        var clauses = new ArrayList<String>();
        if (!locations.isEmpty()) clauses.add("visited " + first(locations, MAX_NAMES));
        if (!npcs.isEmpty()) clauses.add("met " + first(npcs, MAX_NAMES));
        if (!items.isEmpty()) clauses.add("acquired " + first(items, MAX_NAMES));
        if (damage != 0) clauses.add("took " + damage + " total damage");
        if (healed != 0) clauses.add("healed " + healed + " total");
        if (!flags.isEmpty()) clauses.add("flags: " + first(flags, MAX_FLAGS));
        if (clauses.isEmpty()) clauses.add("uneventful");

        var summary = "Turns " + start + "-" + end + ": " + String.join("; ", clauses) + ".";
        return summary.length() > MAX_SUMMARY_CHARS ? summary.substring(0, MAX_SUMMARY_CHARS) : summary;
    }

    private static String first(Iterable<String> values, int limit) {
        var out = new ArrayList<String>();
        for (var v : values) {
            if (out.size() == limit) break;
            out.add(v);
        }
        return String.join(", ", out);
    }
}
