package io.walletmanager.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.manager.VersionManager;
import io.walletmanager.core.metrics.HttpMetrics;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.state.AccountState;
import io.walletmanager.core.upgrade.UpgradeReport;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Wallet Version Manager RPC API",
    "version": "1.0.0"
  },
  "paths": {
    "/status": {
      "get": {
        "summary": "Catalog head and registered storages",
        "responses": { "200": { "description": "Status response" }, "401": { "description": "Auth required" } }
      }
    },
    "/featureset": {
      "get": {
        "summary": "Feature set by version",
        "parameters": [
          { "name": "version", "in": "query", "required": true, "schema": { "type": "integer", "format": "int64" } }
        ],
        "responses": {
          "200": { "description": "Feature set" },
          "400": { "description": "Missing or invalid parameters" },
          "404": { "description": "No such version" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/account": {
      "get": {
        "summary": "Bound version, lock and authorized modules of an account",
        "parameters": [
          { "name": "addr", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Account state" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/upgrade": {
      "post": {
        "summary": "Upgrade an account to another feature set version",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/UpgradeRequest" } } }
        },
        "responses": {
          "200": { "description": "Upgrade applied" },
          "400": { "description": "Invalid request" },
          "403": { "description": "Requester or account not allowed" },
          "409": { "description": "Version conflict" },
          "422": { "description": "Module initialization failed" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics in plain text" }, "401": { "description": "Auth required" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "OpenAPI description of this RPC API",
        "responses": { "200": { "description": "OpenAPI specification" }, "401": { "description": "Auth required" } }
      }
    }
  },
  "components": {
    "schemas": {
      "UpgradeRequest": {
        "type": "object",
        "required": ["account", "toVersion", "requester"],
        "properties": {
          "account": { "type": "string" },
          "toVersion": { "type": "integer", "format": "int64" },
          "requester": { "type": "string" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final VersionManager manager;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(VersionManager manager, String bindAddress, int port, String authToken) {
        this.manager = manager;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new Endpoint("GET", this::status));
        server.createContext("/featureset", new Endpoint("GET", this::featureSet));
        server.createContext("/account", new Endpoint("GET", this::account));
        server.createContext("/upgrade", new Endpoint("POST", this::upgrade));
        server.createContext("/metrics", new Endpoint("GET", this::metrics));
        server.createContext("/openapi.json", new Endpoint("GET", exchange -> sendJson(exchange, 200, OPENAPI_SPEC)));
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    @FunctionalInterface
    private interface Action {
        int handle(HttpExchange exchange) throws IOException;
    }

    /** Method check, auth, metrics and error mapping shared by every endpoint. */
    private final class Endpoint implements HttpHandler {
        private final String allowedMethod;
        private final Action action;

        Endpoint(String allowedMethod, Action action) {
            this.allowedMethod = allowedMethod;
            this.action = action;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = action.handle(exchange);
            } catch (RejectionException e) {
                status = sendError(exchange, statusFor(e), e.reason().code(), e.getMessage());
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_request", Optional.ofNullable(e.getMessage()).orElse("Invalid request"));
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Handler for " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    private int status(HttpExchange exchange) throws IOException {
        ObjectNode resp = mapper.createObjectNode();
        resp.put("lastVersion", manager.lastVersion());
        resp.put("accounts", manager.store().accountCount());
        resp.put("catalogOwner", manager.catalog().owner().hex());
        ArrayNode storages = resp.putArray("storages");
        for (Address storage : manager.catalog().storages()) {
            storages.add(storage.hex());
        }
        return sendJson(exchange, 200, resp);
    }

    private int featureSet(HttpExchange exchange) throws IOException {
        String raw = queryParam(exchange.getRequestURI(), "version");
        if (raw == null || raw.isBlank()) {
            return sendError(exchange, 400, "missing_version", "Query parameter 'version' is required");
        }
        long version;
        try {
            version = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return sendError(exchange, 400, "invalid_version", "Query parameter 'version' must be an integer");
        }
        Optional<FeatureSet> found = manager.getFeatureSet(version);
        if (found.isEmpty()) {
            return sendError(exchange, 404, "not_found", "No feature set with version " + version);
        }
        FeatureSet fs = found.get();
        ObjectNode resp = mapper.createObjectNode();
        resp.put("version", fs.version());
        ArrayNode features = resp.putArray("features");
        fs.features().forEach(a -> features.add(a.hex()));
        ArrayNode init = resp.putArray("toInitialize");
        fs.toInitialize().forEach(a -> init.add(a.hex()));
        ObjectNode routes = resp.putObject("staticCalls");
        for (Map.Entry<String, Address> route : fs.staticCallRoutes().entrySet()) {
            routes.put(route.getKey(), route.getValue().hex());
        }
        return sendJson(exchange, 200, resp);
    }

    private int account(HttpExchange exchange) throws IOException {
        String addr = queryParam(exchange.getRequestURI(), "addr");
        if (addr == null || addr.isBlank()) {
            return sendError(exchange, 400, "missing_addr", "Query parameter 'addr' is required");
        }
        if (!Address.isValid(addr)) {
            return sendError(exchange, 400, "invalid_addr", "Query parameter 'addr' must be a 20-byte hex address");
        }
        AccountState state = manager.account(Address.fromHex(addr));
        ObjectNode resp = mapper.createObjectNode();
        resp.put("address", state.account().hex());
        resp.put("version", state.currentVersion());
        resp.put("locked", state.locked());
        resp.put("status", state.status().name());
        ArrayNode modules = resp.putArray("authorizedModules");
        state.authorizedModules().forEach(a -> modules.add(a.hex()));
        return sendJson(exchange, 200, resp);
    }

    private int upgrade(HttpExchange exchange) throws IOException {
        UpgradeRequest req;
        try {
            req = mapper.readValue(exchange.getRequestBody(), UpgradeRequest.class);
        } catch (JsonProcessingException e) {
            return sendError(exchange, 400, "invalid_json", "Failed to parse upgrade request");
        }
        if (req == null || req.account == null || req.requester == null) {
            return sendError(exchange, 400, "missing_fields", "Fields 'account', 'toVersion' and 'requester' are required");
        }
        if (!Address.isValid(req.account) || !Address.isValid(req.requester)) {
            return sendError(exchange, 400, "invalid_addr", "Addresses must be 20-byte hex");
        }
        UpgradeReport report = manager.upgradeAccount(Address.fromHex(req.account), req.toVersion, Address.fromHex(req.requester));
        ObjectNode resp = mapper.createObjectNode()
                .put("account", report.account().hex())
                .put("fromVersion", report.fromVersion())
                .put("toVersion", report.toVersion())
                .put("queuedWrites", report.queuedWrites());
        ArrayNode initialized = resp.putArray("initialized");
        report.initialized().forEach(a -> initialized.add(a.hex()));
        ArrayNode deauthorized = resp.putArray("deauthorized");
        report.deauthorized().forEach(a -> deauthorized.add(a.hex()));
        return sendJson(exchange, 200, resp);
    }

    private int metrics(HttpExchange exchange) throws IOException {
        byte[] payload = ManagerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
        exchange.sendResponseHeaders(200, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return 200;
    }

    static int statusFor(RejectionException e) {
        switch (e.kind()) {
            case AUTHORIZATION:
                return 403;
            case VERSION:
                return 409;
            case INITIALIZATION:
                return 422;
            default:
                return 400;
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static class UpgradeRequest {
        public String account;
        public long toVersion;
        public String requester;
    }
}
