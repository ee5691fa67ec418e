package com.heureca.wppsessions.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public final class Transition {

    public enum Effect {
        STORE_QR,
        MARK_INITIALIZED,
        MARK_UNINITIALIZED,
        SCHEDULE_RECONNECT
    }

    private final SessionStatus from;
    private final SessionStatus to;
    private final Set<Effect> effects;

    public Transition(SessionStatus from, SessionStatus to, Set<Effect> effects) {
        this.from = from;
        this.to = to;
        this.effects = effects.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(effects));
    }

    public SessionStatus getFrom() {
        return from;
    }

    public SessionStatus getTo() {
        return to;
    }

    public Set<Effect> getEffects() {
        return effects;
    }

    public boolean has(Effect effect) {
        return effects.contains(effect);
    }

    @Override
    public String toString() {
        return from + " -> " + to + " " + effects;
    }
}
