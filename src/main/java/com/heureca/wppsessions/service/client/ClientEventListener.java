package com.heureca.wppsessions.service.client;

public interface ClientEventListener {

    void onQr(String code);

    void onAuthenticated();

    void onReady();

    void onAuthFailure();

    void onDisconnected();
}
