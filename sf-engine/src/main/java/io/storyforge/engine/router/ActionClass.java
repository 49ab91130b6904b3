package io.storyforge.engine.router;

/** What kind of act the player attempts, and how much world time it costs. */
public enum ActionClass {
    DIALOGUE_ONLY(8),
    DIALOGUE_WITH_ACTION(20),
    PHYSICAL_ACTION(18),
    META(0);

    private final int minutes;

    ActionClass(int minutes) {
        this.minutes = minutes;
    }

    public int minutes() {
        return minutes;
    }
}
