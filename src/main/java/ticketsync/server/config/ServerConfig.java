package ticketsync.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the ticket sync server.
 * All settings have sensible defaults.
 */
public final class ServerConfig {

    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    static final String TOKEN_POINTER = "/gateway/auth/token";

    // Server settings
    private int serverPort = 3001;
    private String serverHost = "0.0.0.0";

    // Ticket directory
    private Path vaultPath = Path.of("./tickets");
    private Duration stabilityWindow = Duration.ofMillis(300);

    // Agent gateway
    private String agentGatewayUrl = "http://localhost:18789";
    private String agentToken = null;

    // Grooming settings
    private boolean autoGroomingEnabled = true;
    private int maxGroomingAttempts = 3;
    private Duration groomingRetryDelay = Duration.ofSeconds(5);
    private Duration reconcileDelay = Duration.ofMinutes(10);
    private Duration groomingAgeWindow = Duration.ofMinutes(5);
    private Duration suppressionWindow = Duration.ofMinutes(10);

    // Auth settings (optional)
    private String internalKey = null; // If set, /internal/ callers must send X-Ticketsync-Key

    private ServerConfig() {
    }

    public static ServerConfig defaults() {
        return new ServerConfig();
    }

    public static ServerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build a config from the given environment map.
     *
     * @throws IllegalArgumentException if a numeric setting cannot be parsed
     */
    public static ServerConfig fromEnv(Map<String, String> env) {
        ServerConfig config = new ServerConfig();

        String port = env.get("TICKETSYNC_PORT");
        if (notBlank(port)) {
            config.serverPort = parseInt("TICKETSYNC_PORT", port);
        }

        String host = env.get("TICKETSYNC_HOST");
        if (notBlank(host)) {
            config.serverHost = host;
        }

        String vault = env.get("TICKETSYNC_VAULT_PATH");
        if (notBlank(vault)) {
            config.vaultPath = Path.of(vault);
        }

        String stability = env.get("TICKETSYNC_STABILITY_MS");
        if (notBlank(stability)) {
            config.stabilityWindow = Duration.ofMillis(parseInt("TICKETSYNC_STABILITY_MS", stability));
        }

        String gateway = env.get("TICKETSYNC_AGENT_GATEWAY_URL");
        if (notBlank(gateway)) {
            config.agentGatewayUrl = gateway;
        }

        String token = env.get("TICKETSYNC_AGENT_TOKEN");
        if (notBlank(token)) {
            config.agentToken = token;
        } else {
            String tokenFile = env.get("TICKETSYNC_AGENT_TOKEN_FILE");
            Path file = notBlank(tokenFile)
                    ? Path.of(tokenFile)
                    : Path.of(System.getProperty("user.home"), ".openclaw", "openclaw.json");
            config.agentToken = readTokenFile(file);
        }

        // anything but "false" keeps auto-grooming on
        String auto = env.get("TICKETSYNC_AUTO_GROOMING");
        if (auto != null) {
            config.autoGroomingEnabled = !"false".equalsIgnoreCase(auto.trim());
        }

        String internalKey = env.get("TICKETSYNC_INTERNAL_KEY");
        if (notBlank(internalKey)) {
            config.internalKey = internalKey;
        }

        return config;
    }

    /**
     * Read the gateway token from a JSON config file at {@code /gateway/auth/token}.
     *
     * @return the token, or null if the file is missing, unreadable or has no token
     */
    static String readTokenFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            JsonNode root = new ObjectMapper().readTree(file.toFile());
            JsonNode token = root == null ? null : root.at(TOKEN_POINTER);
            if (token == null || !token.isTextual() || token.asText().isBlank()) {
                log.warn("No gateway token at {} in {}", TOKEN_POINTER, file);
                return null;
            }
            log.info("Loaded gateway token from {}", file);
            return token.asText();
        } catch (IOException e) {
            log.warn("Could not read gateway token file {}: {}", file, e.getMessage());
            return null;
        }
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Path vaultPath() {
        return vaultPath;
    }

    public Duration stabilityWindow() {
        return stabilityWindow;
    }

    public String agentGatewayUrl() {
        return agentGatewayUrl;
    }

    public String agentToken() {
        return agentToken;
    }

    public boolean hasAgentToken() {
        return notBlank(agentToken);
    }

    public boolean autoGroomingEnabled() {
        return autoGroomingEnabled;
    }

    public int maxGroomingAttempts() {
        return maxGroomingAttempts;
    }

    public Duration groomingRetryDelay() {
        return groomingRetryDelay;
    }

    public Duration reconcileDelay() {
        return reconcileDelay;
    }

    public Duration groomingAgeWindow() {
        return groomingAgeWindow;
    }

    public Duration suppressionWindow() {
        return suppressionWindow;
    }

    public String internalKey() {
        return internalKey;
    }

    public boolean hasInternalKey() {
        return notBlank(internalKey);
    }

    // Fluent setters for testing/customization
    public ServerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ServerConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public ServerConfig withVaultPath(Path path) {
        this.vaultPath = path;
        return this;
    }

    public ServerConfig withStabilityWindow(Duration window) {
        this.stabilityWindow = window;
        return this;
    }

    public ServerConfig withAgentGatewayUrl(String url) {
        this.agentGatewayUrl = url;
        return this;
    }

    public ServerConfig withAgentToken(String token) {
        this.agentToken = token;
        return this;
    }

    public ServerConfig withAutoGrooming(boolean enabled) {
        this.autoGroomingEnabled = enabled;
        return this;
    }

    public ServerConfig withMaxGroomingAttempts(int attempts) {
        this.maxGroomingAttempts = attempts;
        return this;
    }

    public ServerConfig withGroomingRetryDelay(Duration delay) {
        this.groomingRetryDelay = delay;
        return this;
    }

    public ServerConfig withReconcileDelay(Duration delay) {
        this.reconcileDelay = delay;
        return this;
    }

    public ServerConfig withGroomingAgeWindow(Duration window) {
        this.groomingAgeWindow = window;
        return this;
    }

    public ServerConfig withSuppressionWindow(Duration window) {
        this.suppressionWindow = window;
        return this;
    }

    public ServerConfig withInternalKey(String key) {
        this.internalKey = key;
        return this;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "serverPort=" + serverPort +
                ", vaultPath=" + vaultPath +
                ", agentGatewayUrl='" + agentGatewayUrl + '\'' +
                ", agentTokenSet=" + hasAgentToken() +
                ", autoGrooming=" + autoGroomingEnabled +
                ", internalKeySet=" + hasInternalKey() +
                '}';
    }
}
