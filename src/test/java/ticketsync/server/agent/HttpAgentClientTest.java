package ticketsync.server.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpAgentClient against a local stub gateway.
 */
class HttpAgentClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer gateway;
    private String gatewayUrl;

    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedAuth = new AtomicReference<>();
    private final AtomicInteger requests = new AtomicInteger();
    private volatile int responseStatus = 200;
    private volatile String responseBody = """
            {"ok": true, "result": {"childSessionKey": "agent:grooming:abc"}}
            """;

    @BeforeEach
    void setUp() throws IOException {
        gateway = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        gateway.createContext("/tools/invoke", exchange -> {
            requests.incrementAndGet();
            receivedAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(responseStatus, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        gateway.start();
        gatewayUrl = "http://127.0.0.1:" + gateway.getAddress().getPort() + "/";
    }

    @AfterEach
    void tearDown() {
        gateway.stop(0);
    }

    private HttpAgentClient client(String token) {
        return new HttpAgentClient(gatewayUrl, token, MAPPER);
    }

    @Test
    void sendsSpawnRequest() throws Exception {
        AgentAck ack = client("secret").invoke(AgentRequest.groom("TICK-001", "Groom it"));

        assertEquals("agent:grooming:abc", ack.childSessionKey());
        assertEquals("Bearer secret", receivedAuth.get());

        JsonNode body = MAPPER.readTree(receivedBody.get());
        assertEquals("sessions_spawn", body.get("tool").asText());
        JsonNode args = body.get("args");
        assertEquals("grooming", args.get("agentId").asText());
        assertEquals("groom-TICK-001", args.get("label").asText());
        assertEquals("Groom it", args.get("task").asText());
        assertEquals("keep", args.get("cleanup").asText());
        assertEquals(300, args.get("runTimeoutSeconds").asInt());
    }

    @Test
    void missingChildSessionKeyIsAllowed() {
        responseBody = "{\"ok\": true}";

        assertNull(client("secret").invoke(AgentRequest.groom("TICK-001", "t")).childSessionKey());
    }

    @Test
    void missingTokenFailsBeforeAnyRequest() {
        AgentPreconditionException e = assertThrows(AgentPreconditionException.class,
                () -> client(null).invoke(AgentRequest.groom("TICK-001", "t")));

        assertEquals("Agent token not configured - cannot spawn grooming agent", e.getMessage());
        assertEquals(0, requests.get());
    }

    @Test
    void non2xxStatusIsReported() {
        responseStatus = 500;
        responseBody = "boom";

        AgentInvocationException e = assertThrows(AgentInvocationException.class,
                () -> client("secret").invoke(AgentRequest.groom("TICK-001", "t")));

        assertEquals("Gateway returned 500: boom", e.getMessage());
    }

    @Test
    void okFalseIsReportedWithGatewayMessage() {
        responseBody = """
                {"ok": false, "error": {"message": "agent busy"}}
                """;

        AgentInvocationException e = assertThrows(AgentInvocationException.class,
                () -> client("secret").invoke(AgentRequest.groom("TICK-001", "t")));

        assertEquals("Gateway error: agent busy", e.getMessage());
    }

    @Test
    void okFalseWithoutDetailsIsUnknown() {
        responseBody = "{\"ok\": false}";

        AgentInvocationException e = assertThrows(AgentInvocationException.class,
                () -> client("secret").invoke(AgentRequest.groom("TICK-001", "t")));

        assertEquals("Gateway error: unknown error", e.getMessage());
    }

    @Test
    void unreachableGatewayIsInvocationFailure() {
        gateway.stop(0);

        AgentInvocationException e = assertThrows(AgentInvocationException.class,
                () -> client("secret").invoke(AgentRequest.groom("TICK-001", "t")));

        assertTrue(e.getMessage().startsWith("Gateway request failed"));
    }
}
