package io.storyforge.core.state;

import io.storyforge.core.GameEvent;
import io.storyforge.core.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure fold of events into a {@link GameState}. Never touches storage and never mutates its input.
 * <p>
 * This is the executable definition of what each event means; the database projection must stay
 * equivalent to it.
 */
public final class StateReducer {
    private static final Logger log = LoggerFactory.getLogger(StateReducer.class);

    private final EventSemantics semantics;

    public StateReducer() {
        this(new EventSemantics());
    }

    public StateReducer(EventSemantics semantics) {
        this.semantics = semantics;
    }

    public static GameState initialState() {
        return new GameState(CampaignState.empty(), Map.of(), Map.of(), 0, List.of());
    }

    public GameState applyEvent(GameState state, GameEvent event) {
        var working = new Working(state);
        semantics.apply(working, event);
        return working.toState(state.turnNumber());
    }

    public GameState reduceEvents(GameState state, List<GameEvent> events) {
        var current = state;
        for (var e : events) current = applyEvent(current, e);
        return current;
    }

    /** Fold stored events, advancing the turn counter to the highest turn seen. */
    public GameState replay(GameState state, List<StoredEvent> log) {
        var working = new Working(state);
        int turn = state.turnNumber();
        for (var stored : log) {
            semantics.apply(working, stored.event());
            turn = Math.max(turn, stored.turnNumber());
        }
        return working.toState(turn);
    }

    /** Mutable scratch copy; only ever reachable from inside a single reducer call. */
    private static final class Working implements StateTarget {
        private final String campaignId;
        private final String title;
        private long worldTime;
        private final Map<String, Object> flags;
        private List<WorldSimEntry> worldSim;
        private final Map<String, CharacterState> characters;
        private final Map<String, Map<String, InventoryItem>> inventory = new LinkedHashMap<>();
        private final List<GameEvent> unhandled;

        Working(GameState s) {
            this.campaignId = s.campaign().id();
            this.title = s.campaign().title();
            this.worldTime = s.campaign().worldTimeMinutes();
            this.flags = new LinkedHashMap<>(s.campaign().worldFlags());
            this.worldSim = new ArrayList<>(s.campaign().worldSimEvents());
            this.characters = new LinkedHashMap<>(s.characters());
            s.inventory().forEach((owner, items) -> inventory.put(owner, new LinkedHashMap<>(items)));
            this.unhandled = new ArrayList<>(s.unhandledEvents());
        }

        GameState toState(int turnNumber) {
            return new GameState(new CampaignState(campaignId, title, worldTime, flags, worldSim),
                    characters, inventory, turnNumber, unhandled);
        }

        @Override public Optional<CharacterState> character(String id) { return Optional.ofNullable(characters.get(id)); }
        @Override public void insertCharacter(CharacterState c) { characters.putIfAbsent(c.id(), c); }
        @Override public void updateCharacter(CharacterState c) { characters.put(c.id(), c); }

        @Override
        public Optional<InventoryItem> item(String ownerId, String itemName) {
            return Optional.ofNullable(inventory.getOrDefault(ownerId, Map.of()).get(itemName));
        }

        @Override
        public void putItem(String ownerId, String itemName, InventoryItem item) {
            inventory.computeIfAbsent(ownerId, k -> new LinkedHashMap<>()).put(itemName, item);
        }

        @Override
        public void removeItem(String ownerId, String itemName) {
            var items = inventory.get(ownerId);
            if (items == null) return;
            items.remove(itemName);
            if (items.isEmpty()) inventory.remove(ownerId);
        }

        @Override public void putWorldFlag(String key, Object value) { flags.put(key, value); }
        @Override public long worldTimeMinutes() { return worldTime; }
        @Override public void setWorldTimeMinutes(long minutes) { worldTime = minutes; }
        @Override public List<WorldSimEntry> worldSimEvents() { return worldSim; }
        @Override public void setWorldSimEvents(List<WorldSimEntry> entries) { worldSim = new ArrayList<>(entries); }

        @Override
        public void unhandled(GameEvent event) {
            log.debug("Recording unhandled event type {}", event.type());
            unhandled.add(event);
        }
    }
}
