package ticketsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ticketsync.server.config.Dependencies;
import ticketsync.server.config.ServerConfig;
import ticketsync.server.server.TicketSyncServer;
import ticketsync.server.watch.WatchSetupException;

import java.util.concurrent.CountDownLatch;

/**
 * Server entry point. Configuration comes from {@code TICKETSYNC_*} environment variables.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config = ServerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        try {
            deps.start();
        } catch (WatchSetupException e) {
            log.error("Cannot watch ticket directory: {}", e.getMessage());
            deps.close();
            System.exit(1);
            return;
        }

        TicketSyncServer server = new TicketSyncServer(config, deps.routerHandler(), deps.broadcastHub());
        try {
            server.start();
        } catch (IllegalStateException e) {
            log.error("Server failed to start", e);
            deps.close();
            System.exit(1);
            return;
        }

        if (!config.hasAgentToken()) {
            log.warn("No agent token configured; grooming triggers will fail until one is set");
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "shutdown"));

        stopped.await();
    }
}
