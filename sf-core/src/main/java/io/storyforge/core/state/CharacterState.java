package io.storyforge.core.state;

import java.util.Map;

/**
 * Player or NPC as seen by the rest of the application.
 * A null {@code locationId} marks a character that has left the scene.
 */
public record CharacterState(
        String id,
        String name,
        String role,
        String locationId,
        String regionId,
        int hpCurrent,
        Map<String, Object> stats,
        Integer relationshipScore,
        int credits,
        Integer stressLevel,
        String mood
) {
    public CharacterState {
        stats = Immutables.map(stats);
    }

    public CharacterState withLocation(String location, String region) {
        return new CharacterState(id, name, role, location, region, hpCurrent, stats,
                relationshipScore, credits, stressLevel, mood);
    }

    public CharacterState withHp(int hp) {
        return new CharacterState(id, name, role, locationId, regionId, hp, stats,
                relationshipScore, credits, stressLevel, mood);
    }

    public CharacterState withRelationshipScore(Integer score) {
        return new CharacterState(id, name, role, locationId, regionId, hpCurrent, stats,
                score, credits, stressLevel, mood);
    }

    public CharacterState withPsych(Integer stress, String newMood) {
        return new CharacterState(id, name, role, locationId, regionId, hpCurrent, stats,
                relationshipScore, credits, stress, newMood);
    }
}
