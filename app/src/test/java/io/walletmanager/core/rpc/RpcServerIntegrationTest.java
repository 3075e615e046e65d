package io.walletmanager.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.walletmanager.core.Fixtures;
import io.walletmanager.core.Fixtures.CountingModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.walletmanager.core.Fixtures.addr;
import static org.junit.jupiter.api.Assertions.*;

class RpcServerIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private Fixtures fx;
    private CountingModule guardian;
    private RpcServer server;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        fx = new Fixtures();
        guardian = fx.module("guardian-manager");
        fx.manager.addFeatureSet(fx.catalogOwner, List.of(guardian.address()), List.of(guardian.address()));
        port = freePort();
        server = new RpcServer(fx.manager, "127.0.0.1", port, "rpc-secret");
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        fx.manager.close();
    }

    @Test
    void upgradeEndpointBindsAccount() throws Exception {
        HttpResponse<String> response = post("/upgrade", upgradeBody(1, fx.alice.hex()));
        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals(0, body.get("fromVersion").asLong());
        assertEquals(1, body.get("toVersion").asLong());
        assertEquals(0, body.get("queuedWrites").asInt());
        assertEquals(guardian.address().hex(), body.get("initialized").get(0).asText());
        assertEquals(1, guardian.inits(fx.aliceWallet));

        HttpResponse<String> account = get("/account?addr=" + fx.aliceWallet.hex());
        assertEquals(200, account.statusCode());
        JsonNode state = mapper.readTree(account.body());
        assertEquals(1, state.get("version").asLong());
        assertEquals("IDLE", state.get("status").asText());
        assertEquals(guardian.address().hex(), state.get("authorizedModules").get(0).asText());
    }

    @Test
    void rejectionsMapToStatusCodes() throws Exception {
        HttpResponse<String> stranger = post("/upgrade", upgradeBody(1, addr("mallory").hex()));
        assertEquals(403, stranger.statusCode());
        assertTrue(stranger.body().contains("not_owner_authority"));

        HttpResponse<String> invalid = post("/upgrade", upgradeBody(9, fx.alice.hex()));
        assertEquals(409, invalid.statusCode());
        assertTrue(invalid.body().contains("invalid_version"));

        HttpResponse<String> malformed = post("/upgrade", "{\"account\":\"0x12\",\"toVersion\":1,\"requester\":\"0x34\"}");
        assertEquals(400, malformed.statusCode());
        assertTrue(malformed.body().contains("invalid_addr"));
    }

    @Test
    void featureSetAndStatusEndpoints() throws Exception {
        HttpResponse<String> fs = get("/featureset?version=1");
        assertEquals(200, fs.statusCode());
        JsonNode body = mapper.readTree(fs.body());
        assertEquals(guardian.address().hex(), body.get("features").get(0).asText());

        assertEquals(404, get("/featureset?version=5").statusCode());
        assertEquals(400, get("/featureset").statusCode());

        HttpResponse<String> status = get("/status");
        assertEquals(200, status.statusCode());
        JsonNode statusBody = mapper.readTree(status.body());
        assertEquals(1, statusBody.get("lastVersion").asLong());
        assertEquals(fx.lockStorage.address().hex(), statusBody.get("storages").get(0).asText());

        HttpResponse<String> openApi = get("/openapi.json");
        assertEquals(200, openApi.statusCode());
        assertTrue(openApi.body().contains("\"/upgrade\""));
    }

    @Test
    void requiresToken() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + "/status"))
                .GET()
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(401, response.statusCode());

        HttpRequest withApiKey = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + "/status"))
                .header("X-API-Key", "rpc-secret")
                .GET()
                .build();
        assertEquals(200, http.send(withApiKey, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void metricsScrapeIncludesRequestTimings() throws Exception {
        get("/status");
        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("manager.rpc.requests"));
        assertTrue(metrics.body().contains("endpoint=/status"));
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        HttpResponse<String> response = post("/status", "{}");
        assertEquals(405, response.statusCode());
    }

    private String upgradeBody(long toVersion, String requester) {
        return mapper.createObjectNode()
                .put("account", fx.aliceWallet.hex())
                .put("toVersion", toVersion)
                .put("requester", requester)
                .toString();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .header("Authorization", "Bearer rpc-secret")
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String payload) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .header("Authorization", "Bearer rpc-secret")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
