package com.heureca.wppsessions.service.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heureca.wppsessions.exception.AdapterException;

class WppConnectClientTest {

    private static final String BASE = "http://wpp:21465";

    @TempDir
    Path credentialDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private MockRestServiceServer server;
    private WppConnectClientFactory factory;
    private ClientEventListener listener;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.createServer(rest);
        factory = new WppConnectClientFactory(rest, mapper, Runnable::run, BASE, "SECRET", "http://gateway/api/provider/webhook/");
        listener = mock(ClientEventListener.class);
    }

    private void storeToken(String token) throws Exception {
        mapper.writeValue(credentialDir.resolve(WppConnectClient.TOKEN_FILE).toFile(), Map.of("token", token));
    }

    @Test
    void firstStartGeneratesTokenAndReportsQr() throws Exception {
        server.expect(requestTo(BASE + "/api/s1/SECRET/generate-token"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"status\":\"success\",\"token\":\"T1\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/s1/start-session"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer T1"))
                .andExpect(jsonPath("$.webhook").value("http://gateway/api/provider/webhook/s1"))
                .andExpect(jsonPath("$.waitQrCode").value(true))
                .andRespond(withSuccess("{\"status\":\"QRCODE\",\"qrcode\":\"data:image/png;base64,AAA\",\"urlcode\":\"2@abc\"}",
                        MediaType.APPLICATION_JSON));

        factory.create("s1", credentialDir, listener).initialize().join();

        server.verify();
        verify(listener).onQr("2@abc");
        Map<?, ?> stored = mapper.readValue(credentialDir.resolve(WppConnectClient.TOKEN_FILE).toFile(), Map.class);
        assertThat(stored.get("token")).isEqualTo("T1");
    }

    @Test
    void storedTokenIsReusedAndConnectedMeansReady() throws Exception {
        storeToken("KEPT");
        server.expect(requestTo(BASE + "/api/s1/start-session"))
                .andExpect(header("Authorization", "Bearer KEPT"))
                .andRespond(withSuccess("{\"status\":\"CONNECTED\"}", MediaType.APPLICATION_JSON));

        factory.create("s1", credentialDir, listener).initialize().join();

        server.verify();
        verify(listener).onReady();
    }

    @Test
    void rejectedTokenIsRegeneratedOnce() throws Exception {
        storeToken("EXPIRED");
        server.expect(requestTo(BASE + "/api/s1/start-session"))
                .andExpect(header("Authorization", "Bearer EXPIRED"))
                .andRespond(withUnauthorizedRequest());
        server.expect(requestTo(BASE + "/api/s1/SECRET/generate-token"))
                .andRespond(withSuccess("{\"token\":\"FRESH\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/s1/start-session"))
                .andExpect(header("Authorization", "Bearer FRESH"))
                .andRespond(withSuccess("{\"status\":\"CONNECTED\"}", MediaType.APPLICATION_JSON));

        factory.create("s1", credentialDir, listener).initialize().join();

        server.verify();
        verify(listener).onReady();
    }

    @Test
    void providerFailureFailsInitialize() throws Exception {
        storeToken("KEPT");
        server.expect(requestTo(BASE + "/api/s1/start-session")).andRespond(withServerError());

        assertThatThrownBy(() -> factory.create("s1", credentialDir, listener).initialize().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(AdapterException.class);
        verifyNoInteractions(listener);
    }

    @Test
    void webhookEventsReachTheLiveClient() {
        factory.create("s1", credentialDir, listener);

        assertThat(factory.dispatch("s1", Map.of("event", "qrcode", "urlcode", "2@next"))).isTrue();
        assertThat(factory.dispatch("s1", Map.of("event", "status-find", "status", "qrReadSuccess"))).isTrue();
        assertThat(factory.dispatch("s1", Map.of("event", "status-find", "status", "inChat"))).isTrue();
        assertThat(factory.dispatch("s1", Map.of("event", "status-find", "status", "desconnectedMobile"))).isTrue();
        assertThat(factory.dispatch("s1", Map.of("event", "status-find", "status", "autocloseCalled"))).isTrue();

        verify(listener).onQr("2@next");
        verify(listener).onAuthenticated();
        verify(listener).onReady();
        verify(listener).onDisconnected();
        verify(listener).onAuthFailure();
    }

    @Test
    void unrelatedWebhooksAreNotDispatched() {
        factory.create("s1", credentialDir, listener);

        assertThat(factory.dispatch("s1", Map.of("event", "onmessage"))).isFalse();
        assertThat(factory.dispatch("s1", Map.of("event", "status-find", "status", "notLogged"))).isFalse();
        assertThat(factory.dispatch("ghost", Map.of("event", "qrcode", "urlcode", "x"))).isFalse();
        verifyNoInteractions(listener);
    }

    @Test
    void newerClientSupersedesOlderForWebhooks() {
        ClientEventListener older = mock(ClientEventListener.class);
        factory.create("s1", credentialDir, older);
        factory.create("s1", credentialDir, listener);

        factory.dispatch("s1", Map.of("event", "status-find", "status", "isLogged"));

        verify(listener).onReady();
        verifyNoInteractions(older);
    }

    @Test
    void destroyClosesProviderSessionAndStopsDispatch() throws Exception {
        storeToken("KEPT");
        server.expect(requestTo(BASE + "/api/s1/close-session"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer KEPT"))
                .andRespond(withSuccess());

        factory.create("s1", credentialDir, listener).destroy().join();

        server.verify();
        assertThat(factory.dispatch("s1", Map.of("event", "status-find", "status", "inChat"))).isFalse();
    }

    @Test
    void destroyOfAlreadyClosedSessionSucceeds() {
        server.expect(requestTo(BASE + "/api/s1/close-session")).andRespond(withResourceNotFound());

        factory.create("s1", credentialDir, listener).destroy().join();

        server.verify();
        assertThat(Files.exists(credentialDir.resolve(WppConnectClient.TOKEN_FILE))).isFalse();
    }

    @Test
    void stateFallsBackToUnknownOnError() {
        server.expect(requestTo(BASE + "/api/s1/status-session")).andRespond(withServerError());

        assertThat(factory.create("s1", credentialDir, listener).getState()).isEqualTo("UNKNOWN");
    }
}
