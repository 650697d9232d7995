package adm.java.grpc;

import adm.core.clock.SystemClock;
import adm.java.engine.AdmissionConfig;
import adm.java.engine.AdmissionConfigLoader;
import adm.java.engine.AdmissionDecider;
import adm.java.engine.IdleClientSweeper;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for the admission service.
 *
 * <p>Features:
 * <ul>
 *   <li>Configuration from {@code admission.yml} plus system property overrides</li>
 *   <li>Port from the first argument, else {@code admission.server.port} (default: 9090)</li>
 *   <li>Idle client sweeper running alongside the server</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java -cp tiered-admission.jar adm.java.grpc.AdmissionServer [port]
 * </pre>
 */
public final class AdmissionServer {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServer.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final IdleClientSweeper sweeper;

    /**
     * Creates a server around an existing decider.
     *
     * @param port Port to listen on (0 picks a free port)
     * @param decider Admission decider
     */
    public AdmissionServer(int port, AdmissionDecider decider) {
        this.server = ServerBuilder.forPort(port)
            .addService(new AdmissionServiceImpl(decider))
            .build();
        this.sweeper = new IdleClientSweeper(decider, decider.getConfig().sweepInterval());
    }

    /**
     * Starts the server and the sweeper.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        sweeper.start();
        log.info("AdmissionServer started on port {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)");
            try {
                AdmissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        sweeper.close();
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("AdmissionServer stopped");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        AdmissionConfigLoader loader = AdmissionConfigLoader.fromClasspath();
        AdmissionConfig config = loader.admissionConfig();
        int port = loader.serverPort();

        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        log.info("Limits: {} global={} bypass={}", config.tierLimits(), config.globalLimit(), config.bypass());

        AdmissionServer server = new AdmissionServer(port, new AdmissionDecider(SystemClock.instance(), config));
        server.start();
        server.blockUntilShutdown();
    }
}
