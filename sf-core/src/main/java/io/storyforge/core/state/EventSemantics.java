package io.storyforge.core.state;

import io.storyforge.core.EventPayload;
import io.storyforge.core.EventType;
import io.storyforge.core.GameEvent;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * The single {@code event type -> handler} table. {@link StateReducer} and the database projection both
 * dispatch through it; a handler only ever sees the {@link StateTarget} it is given.
 * <p>
 * Handlers never create characters implicitly: only {@code NPC_SPAWN} does.
 */
public final class EventSemantics {

    public static final int DEFAULT_WORLD_SIM_CAP = 50;
    public static final int DEFAULT_STRESS = 3;
    public static final int MAX_STRESS = 10;

    private final int worldSimCap;
    private final Map<EventType, BiConsumer<StateTarget, GameEvent>> handlers = new EnumMap<>(EventType.class);

    public EventSemantics() {
        this(DEFAULT_WORLD_SIM_CAP);
    }

    public EventSemantics(int worldSimCap) {
        if (worldSimCap < 1) throw new IllegalArgumentException("worldSimCap must be >= 1");
        this.worldSimCap = worldSimCap;

        on(EventType.MOVE, EventPayload.Move.class, EventSemantics::move);
        on(EventType.DAMAGE, EventPayload.Damage.class, (t, p) -> adjustHp(t, p.characterId(), -(long) p.amount()));
        on(EventType.HEAL, EventPayload.Heal.class, (t, p) -> adjustHp(t, p.characterId(), p.amount()));
        on(EventType.ITEM_GET, EventPayload.ItemDelta.class, EventSemantics::itemDelta);
        on(EventType.ITEM_LOSE, EventPayload.ItemDelta.class, EventSemantics::itemDelta);
        on(EventType.FLAG_SET, EventPayload.FlagSet.class, (t, p) -> {
            if (p.key() != null) t.putWorldFlag(p.key(), p.value());
        });
        on(EventType.RELATIONSHIP, EventPayload.Relationship.class, EventSemantics::relationship);
        on(EventType.WORLD_TIME_ADVANCE, EventPayload.WorldTimeAdvance.class, EventSemantics::worldTime);
        on(EventType.PLAYER_PSYCH_UPDATE, EventPayload.PsychUpdate.class, EventSemantics::psych);
        on(EventType.NPC_SPAWN, EventPayload.Spawn.class, EventSemantics::spawn);
        on(EventType.NPC_DEPART, EventPayload.Depart.class, (t, p) -> {
            if (p.characterId() == null) return;
            t.character(p.characterId()).ifPresent(c -> t.updateCharacter(c.withLocation(null, c.regionId())));
        });
        for (var type : EventType.values()) {
            if (type.isWorldSimulation()) on(type, EventPayload.WorldSim.class, this::worldSim);
        }
        on(EventType.TURN, EventPayload.LogOnly.class, (t, p) -> { });
        on(EventType.DIALOGUE, EventPayload.LogOnly.class, (t, p) -> { });
        on(EventType.ROLL, EventPayload.LogOnly.class, (t, p) -> { });
    }

    public int worldSimCap() {
        return worldSimCap;
    }

    public void apply(StateTarget target, GameEvent event) {
        var type = event.knownType();
        if (type.isEmpty()) {
            target.unhandled(event);
            return;
        }
        handlers.get(type.get()).accept(target, event);
    }

    /** Three-state mood rule layered on the stress accumulator. */
    public static String deriveMood(int stressLevel, String previous) {
        if (stressLevel >= 8) return "distressed";
        if (stressLevel <= 2) return "calm";
        return previous == null || previous.isBlank() ? "neutral" : previous;
    }

    private <P extends EventPayload> void on(EventType type, Class<P> kind, BiConsumer<StateTarget, P> body) {
        handlers.put(type, (target, event) -> body.accept(target, kind.cast(event.typedPayload())));
    }

    private static void move(StateTarget t, EventPayload.Move p) {
        if (p.characterId() == null || p.toLocation() == null) return;
        t.character(p.characterId()).ifPresent(c ->
                t.updateCharacter(c.withLocation(p.toLocation(), p.toRegion() != null ? p.toRegion() : c.regionId())));
    }

    private static void adjustHp(StateTarget t, String characterId, long delta) {
        if (characterId == null) return;
        t.character(characterId).ifPresent(c ->
                t.updateCharacter(c.withHp(clamp(c.hpCurrent() + delta, 0, Integer.MAX_VALUE))));
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }

    private static void itemDelta(StateTarget t, EventPayload.ItemDelta p) {
        if (p.ownerId() == null || p.itemName() == null) return;
        var existing = t.item(p.ownerId(), p.itemName());
        if (existing.isPresent()) {
            long quantity = (long) existing.get().quantity() + p.quantityDelta();
            if (quantity <= 0) {
                t.removeItem(p.ownerId(), p.itemName());
            } else {
                t.putItem(p.ownerId(), p.itemName(), existing.get().withQuantity(clamp(quantity, 1, Integer.MAX_VALUE)));
            }
        } else if (p.quantityDelta() > 0) {
            t.putItem(p.ownerId(), p.itemName(), new InventoryItem(p.quantityDelta(), p.attributes()));
        }
    }

    private static void relationship(StateTarget t, EventPayload.Relationship p) {
        if (p.npcId() == null) return;
        t.character(p.npcId()).ifPresent(c -> {
            int current = c.relationshipScore() == null ? 0 : c.relationshipScore();
            long score = (long) current + p.delta();
            t.updateCharacter(c.withRelationshipScore(clamp(score, Integer.MIN_VALUE, Integer.MAX_VALUE)));
        });
    }

    private static void worldTime(StateTarget t, EventPayload.WorldTimeAdvance p) {
        switch (p.mode()) {
            case SET -> t.setWorldTimeMinutes(Math.max(0, p.minutes()));
            case ADD -> {
                if (p.minutes() != 0) t.setWorldTimeMinutes(Math.max(0, t.worldTimeMinutes() + p.minutes()));
            }
        }
    }

    private static void psych(StateTarget t, EventPayload.PsychUpdate p) {
        if (p.characterId() == null || p.characterId().isBlank() || p.stressDelta() == 0) return;
        t.character(p.characterId()).ifPresent(c -> {
            int current = c.stressLevel() == null ? DEFAULT_STRESS : c.stressLevel();
            int stress = clamp((long) current + p.stressDelta(), 0, MAX_STRESS);
            t.updateCharacter(c.withPsych(stress, deriveMood(stress, c.mood())));
        });
    }

    private static void spawn(StateTarget t, EventPayload.Spawn p) {
        if (!p.complete()) return;
        // re-delivery of the same spawn is a no-op
        if (t.character(p.characterId()).isPresent()) return;
        t.insertCharacter(new CharacterState(p.characterId(), p.name(), p.role(), p.locationId(), null,
                p.hpCurrent(), p.stats(), p.relationshipScore(), p.credits(), null, null));
    }

    private void worldSim(StateTarget t, EventPayload.WorldSim p) {
        var buffer = new ArrayList<>(t.worldSimEvents());
        buffer.add(new WorldSimEntry(p.eventType(), p.payload(), p.hidden()));
        if (buffer.size() > worldSimCap) {
            buffer.subList(0, buffer.size() - worldSimCap).clear();
        }
        t.setWorldSimEvents(buffer);
    }
}
