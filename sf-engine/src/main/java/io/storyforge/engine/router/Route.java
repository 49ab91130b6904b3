package io.storyforge.engine.router;

public enum Route {
    TALK,
    MECHANIC,
    META
}
