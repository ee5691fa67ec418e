package com.heureca.wppsessions.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.heureca.wppsessions.model.SessionEvent;
import com.heureca.wppsessions.model.SessionStatus;
import com.heureca.wppsessions.model.Transition;
import com.heureca.wppsessions.model.Transition.Effect;

class SessionStateMachineTest {

    @Test
    void qrMovesInitializingSessionToWaitingForScan() {
        Transition t = SessionStateMachine.next(SessionStatus.INITIALIZING, SessionEvent.QR).orElseThrow();

        assertThat(t.getTo()).isEqualTo(SessionStatus.WAITING_FOR_SCAN);
        assertThat(t.getEffects()).containsExactly(Effect.STORE_QR);
    }

    @Test
    void refreshedQrKeepsWaitingForScan() {
        Transition t = SessionStateMachine.next(SessionStatus.WAITING_FOR_SCAN, SessionEvent.QR).orElseThrow();

        assertThat(t.getTo()).isEqualTo(SessionStatus.WAITING_FOR_SCAN);
    }

    @Test
    void qrIsIgnoredOnceAuthenticated() {
        assertThat(SessionStateMachine.next(SessionStatus.AUTHENTICATED, SessionEvent.QR)).isEmpty();
        assertThat(SessionStateMachine.next(SessionStatus.READY, SessionEvent.QR)).isEmpty();
    }

    @Test
    void authenticatedOnlyFromInitializingOrWaitingForScan() {
        assertThat(SessionStateMachine.next(SessionStatus.INITIALIZING, SessionEvent.AUTHENTICATED))
                .map(Transition::getTo).contains(SessionStatus.AUTHENTICATED);
        assertThat(SessionStateMachine.next(SessionStatus.WAITING_FOR_SCAN, SessionEvent.AUTHENTICATED))
                .map(Transition::getTo).contains(SessionStatus.AUTHENTICATED);
        assertThat(SessionStateMachine.next(SessionStatus.READY, SessionEvent.AUTHENTICATED)).isEmpty();
        assertThat(SessionStateMachine.next(SessionStatus.DISCONNECTED, SessionEvent.AUTHENTICATED)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = "AUTH_FAILED", mode = EnumSource.Mode.EXCLUDE)
    void readyIsReachableFromEveryNonTerminalStatus(SessionStatus from) {
        Transition t = SessionStateMachine.next(from, SessionEvent.READY).orElseThrow();

        assertThat(t.getTo()).isEqualTo(SessionStatus.READY);
        assertThat(t.has(Effect.MARK_INITIALIZED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = "AUTH_FAILED", mode = EnumSource.Mode.EXCLUDE)
    void authFailureIsReachableFromEveryNonTerminalStatus(SessionStatus from) {
        assertThat(SessionStateMachine.next(from, SessionEvent.AUTH_FAILURE))
                .map(Transition::getTo).contains(SessionStatus.AUTH_FAILED);
    }

    @ParameterizedTest
    @EnumSource(SessionEvent.class)
    void authFailedIgnoresEveryEvent(SessionEvent event) {
        assertThat(SessionStateMachine.next(SessionStatus.AUTH_FAILED, event)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = { "READY", "AUTHENTICATED", "WAITING_FOR_SCAN" })
    void disconnectSchedulesReconnect(SessionStatus from) {
        Transition t = SessionStateMachine.next(from, SessionEvent.DISCONNECTED).orElseThrow();

        assertThat(t.getTo()).isEqualTo(SessionStatus.DISCONNECTED);
        assertThat(t.getEffects()).containsExactlyInAnyOrder(Effect.MARK_UNINITIALIZED, Effect.SCHEDULE_RECONNECT);
    }

    @Test
    void disconnectIgnoredWhileInitializingOrAlreadyDisconnected() {
        assertThat(SessionStateMachine.next(SessionStatus.INITIALIZING, SessionEvent.DISCONNECTED)).isEmpty();
        assertThat(SessionStateMachine.next(SessionStatus.DISCONNECTED, SessionEvent.DISCONNECTED)).isEmpty();
    }

    @Test
    void reconnectOnlyLeavesDisconnected() {
        Optional<Transition> t = SessionStateMachine.next(SessionStatus.DISCONNECTED, SessionEvent.RECONNECT);

        assertThat(t).map(Transition::getTo).contains(SessionStatus.INITIALIZING);
        assertThat(t.orElseThrow().getEffects()).isEmpty();
        assertThat(SessionStateMachine.next(SessionStatus.READY, SessionEvent.RECONNECT)).isEmpty();
        assertThat(SessionStateMachine.next(SessionStatus.INITIALIZING, SessionEvent.RECONNECT)).isEmpty();
    }

    @Test
    void failedInitializeReturnsToDisconnectedAndRetries() {
        Transition t = SessionStateMachine.next(SessionStatus.INITIALIZING, SessionEvent.INITIALIZE_FAILED).orElseThrow();

        assertThat(t.getTo()).isEqualTo(SessionStatus.DISCONNECTED);
        assertThat(t.has(Effect.SCHEDULE_RECONNECT)).isTrue();
        assertThat(SessionStateMachine.next(SessionStatus.READY, SessionEvent.INITIALIZE_FAILED)).isEmpty();
    }
}
