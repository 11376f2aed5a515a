package ticketsync.server.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Agent client for the gateway's {@code POST /tools/invoke} endpoint.
 *
 * <p>Sends a {@code sessions_spawn} call with a Bearer token. A non-2xx status or a body with
 * {@code "ok": false} is an {@link AgentInvocationException}; a missing token fails before any
 * request is made.
 */
public class HttpAgentClient implements AgentClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentClient.class);

    private final String gatewayUrl;
    private final String token;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpAgentClient(String gatewayUrl, String token, ObjectMapper objectMapper) {
        this(gatewayUrl, token, objectMapper, Duration.ofSeconds(30));
    }

    public HttpAgentClient(String gatewayUrl, String token, ObjectMapper objectMapper, Duration requestTimeout) {
        this.gatewayUrl = stripTrailingSlash(gatewayUrl);
        this.token = token;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public AgentAck invoke(AgentRequest request) {
        if (token == null || token.isBlank()) {
            throw new AgentPreconditionException(
                    "Agent token not configured - cannot spawn grooming agent");
        }

        String url = gatewayUrl + "/tools/invoke";
        String body = buildPayload(request).toString();
        log.info("Spawning grooming agent for {} via {}", request.ticketId(), url);

        HttpResponse<String> response;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Authorization", "Bearer " + token)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AgentInvocationException("Gateway request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException("Gateway request interrupted", e);
        } catch (IllegalArgumentException e) {
            throw new AgentInvocationException("Invalid gateway URL: " + url, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new AgentInvocationException(
                    "Gateway returned %d: %s".formatted(response.statusCode(), response.body()));
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new AgentInvocationException("Gateway returned invalid JSON: " + e.getMessage(), e);
        }

        if (json == null || !json.path("ok").asBoolean(false)) {
            JsonNode error = json == null ? null : json.get("error");
            String message = error == null ? "unknown error"
                    : error.hasNonNull("message") ? error.get("message").asText() : error.toString();
            throw new AgentInvocationException("Gateway error: " + message);
        }

        JsonNode key = json.path("result").get("childSessionKey");
        String childSessionKey = key == null || key.isNull() ? null : key.asText();
        log.info("Spawned grooming agent for {} (session {})", request.ticketId(),
                childSessionKey == null ? "unknown" : childSessionKey);
        return new AgentAck(childSessionKey);
    }

    private ObjectNode buildPayload(AgentRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("tool", AgentRequest.TOOL);
        ObjectNode args = payload.putObject("args");
        args.put("agentId", AgentRequest.AGENT_ID);
        args.put("label", request.label());
        args.put("task", request.task());
        args.put("cleanup", AgentRequest.CLEANUP);
        args.put("runTimeoutSeconds", request.runTimeoutSeconds());
        return payload;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
