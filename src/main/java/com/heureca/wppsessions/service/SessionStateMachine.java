package com.heureca.wppsessions.service;

import static com.heureca.wppsessions.model.SessionStatus.AUTHENTICATED;
import static com.heureca.wppsessions.model.SessionStatus.AUTH_FAILED;
import static com.heureca.wppsessions.model.SessionStatus.DISCONNECTED;
import static com.heureca.wppsessions.model.SessionStatus.INITIALIZING;
import static com.heureca.wppsessions.model.SessionStatus.READY;
import static com.heureca.wppsessions.model.SessionStatus.WAITING_FOR_SCAN;

import java.util.EnumSet;
import java.util.Optional;

import com.heureca.wppsessions.model.SessionEvent;
import com.heureca.wppsessions.model.SessionStatus;
import com.heureca.wppsessions.model.Transition;
import com.heureca.wppsessions.model.Transition.Effect;

/**
 * Transition table of a session. Pure: (current status, event) to the next status and
 * the effects the owner has to carry out. Anything not listed is ignored.
 */
public final class SessionStateMachine {

    private SessionStateMachine() {
    }

    public static Optional<Transition> next(SessionStatus current, SessionEvent event) {
        if (current == AUTH_FAILED) {
            return Optional.empty();
        }

        return switch (event) {
            case QR -> current == INITIALIZING || current == WAITING_FOR_SCAN
                    ? to(current, WAITING_FOR_SCAN, Effect.STORE_QR)
                    : Optional.empty();
            case AUTHENTICATED -> current == INITIALIZING || current == WAITING_FOR_SCAN
                    ? to(current, AUTHENTICATED)
                    : Optional.empty();
            case READY -> to(current, READY, Effect.MARK_INITIALIZED);
            case AUTH_FAILURE -> to(current, AUTH_FAILED);
            case DISCONNECTED -> current == READY || current == AUTHENTICATED || current == WAITING_FOR_SCAN
                    ? to(current, DISCONNECTED, Effect.MARK_UNINITIALIZED, Effect.SCHEDULE_RECONNECT)
                    : Optional.empty();
            case RECONNECT -> current == DISCONNECTED
                    ? to(current, INITIALIZING)
                    : Optional.empty();
            case INITIALIZE_FAILED -> current == INITIALIZING
                    ? to(current, DISCONNECTED, Effect.MARK_UNINITIALIZED, Effect.SCHEDULE_RECONNECT)
                    : Optional.empty();
        };
    }

    private static Optional<Transition> to(SessionStatus from, SessionStatus to, Effect... effects) {
        EnumSet<Effect> set = EnumSet.noneOf(Effect.class);
        for (Effect effect : effects) {
            set.add(effect);
        }
        return Optional.of(new Transition(from, to, set));
    }
}
