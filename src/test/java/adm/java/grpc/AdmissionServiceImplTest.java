package adm.java.grpc;

import adm.core.clock.Clock;
import adm.core.clock.ManualClock;
import adm.core.model.Tier;
import adm.core.model.TierLimits;
import adm.java.engine.AdmissionConfig;
import adm.java.engine.AdmissionDecider;
import adm.java.http.HttpVerdicts;
import adm.proto.AdmissionServiceGrpc;
import adm.proto.DecideRequest;
import adm.proto.DecideResponse;
import adm.proto.HealthCheckRequest;
import adm.proto.HealthCheckResponse;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for AdmissionServiceImpl using InProcessServer.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Allow/deny rendering (status, headers, body)</li>
 *   <li>Client identity resolution</li>
 *   <li>Validation errors (empty path)</li>
 *   <li>Health check endpoint</li>
 *   <li>Window recovery</li>
 * </ul>
 */
class AdmissionServiceImplTest {

    private Server server;
    private ManagedChannel channel;
    private ManualClock clock;
    private AdmissionDecider decider;
    private AdmissionServiceGrpc.AdmissionServiceBlockingStub blockingStub;

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock(0L);
        AdmissionConfig config = AdmissionConfig.defaults().withTierLimits(Tier.ML, TierLimits.of(3, 3));
        decider = new AdmissionDecider(clock, config);

        String serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(new AdmissionServiceImpl(decider))
            .build()
            .start();

        channel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();

        blockingStub = AdmissionServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.shutdown();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void testDecide_allowedCarriesRateLimitHeaders() {
        DecideResponse response = blockingStub.decide(request("203.0.113.5", "/api/ml/train"));

        assertTrue(response.getAllowed());
        assertEquals("ml", response.getTier());
        assertEquals(3, response.getLimit());
        assertEquals(2, response.getRemaining());
        assertEquals(60, response.getResetAfterSeconds());
        assertEquals("", response.getReason());
        assertEquals(HttpVerdicts.OK, response.getHttpStatus());
        assertEquals("ml", response.getHeadersMap().get(HttpVerdicts.TIER));
        assertEquals("2", response.getHeadersMap().get(HttpVerdicts.REMAINING));
        assertEquals("60", response.getHeadersMap().get(HttpVerdicts.RESET));
        assertEquals("", response.getBody());
    }

    @Test
    void testDecide_deniedRenders429() {
        for (int i = 0; i < 3; i++) {
            assertTrue(blockingStub.decide(request("203.0.113.5", "/api/ml/train")).getAllowed());
        }
        clock.advanceSeconds(20);

        DecideResponse response = blockingStub.decide(request("203.0.113.5", "/api/ml/train"));

        assertFalse(response.getAllowed());
        assertEquals("sustained_exceeded", response.getReason());
        assertEquals(40, response.getRetryAfterSeconds());
        assertEquals(HttpVerdicts.TOO_MANY_REQUESTS, response.getHttpStatus());
        assertEquals("40", response.getHeadersMap().get(HttpVerdicts.RETRY_AFTER));
        assertTrue(response.getBody().contains("\"reason\":\"sustained_exceeded\""));
        assertTrue(response.getBody().contains("\"tier\":\"ml\""));
    }

    @Test
    void testDecide_windowRecovers() {
        for (int i = 0; i < 3; i++) {
            blockingStub.decide(request("203.0.113.5", "/predict"));
        }
        assertFalse(blockingStub.decide(request("203.0.113.5", "/predict")).getAllowed());

        clock.advanceSeconds(60);

        assertTrue(blockingStub.decide(request("203.0.113.5", "/predict")).getAllowed());
    }

    @Test
    void testDecide_resolvesForwardedForWhenNoClientId() {
        DecideRequest req = DecideRequest.newBuilder()
            .setForwardedFor("198.51.100.20, 10.0.0.1")
            .setPeerAddress("10.0.0.1:443")
            .setPath("/api/orders")
            .build();

        DecideResponse response = blockingStub.decide(req);

        assertTrue(response.getAllowed());
        assertEquals("198.51.100.20", response.getClientId());
        assertEquals("api", response.getTier());
        assertEquals(1, decider.getAccountant().countSince("198.51.100.20", Tier.API, 60_000_000_000L, 0L));
    }

    @Test
    void testDecide_resolvesPeerAddress() {
        DecideRequest req = DecideRequest.newBuilder()
            .setPeerAddress("192.0.2.44:52100")
            .setPath("/health")
            .build();

        DecideResponse response = blockingStub.decide(req);

        assertEquals("192.0.2.44", response.getClientId());
        assertEquals("health", response.getTier());
    }

    @Test
    void testDecide_loopbackPeerIsBypassed() {
        DecideRequest req = DecideRequest.newBuilder()
            .setPeerAddress("127.0.0.1:52100")
            .setPath("/api/ml/train")
            .build();

        for (int i = 0; i < 10; i++) {
            assertTrue(blockingStub.decide(req).getAllowed());
        }
        assertEquals(0, decider.getAccountant().trackedClients());
    }

    @Test
    void testDecide_clockFailureRendersFailClosedDenial() throws Exception {
        Clock broken = () -> {
            throw new IllegalStateException("clock source unavailable");
        };
        AdmissionDecider failing = new AdmissionDecider(broken, AdmissionConfig.defaults());

        String serverName = InProcessServerBuilder.generateName();
        Server failingServer = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(new AdmissionServiceImpl(failing))
            .build()
            .start();
        ManagedChannel failingChannel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();
        try {
            DecideResponse response = AdmissionServiceGrpc.newBlockingStub(failingChannel)
                .decide(request("203.0.113.5", "/api/orders"));

            assertFalse(response.getAllowed());
            assertEquals("internal_error", response.getReason());
            assertEquals(1, response.getRetryAfterSeconds());
            assertEquals(1, response.getResetAfterSeconds());
            assertEquals(HttpVerdicts.TOO_MANY_REQUESTS, response.getHttpStatus());
            assertEquals("1", response.getHeadersMap().get(HttpVerdicts.RETRY_AFTER));
            assertTrue(response.getBody().contains("\"reason\":\"internal_error\""));
        } finally {
            failingChannel.shutdown();
            failingChannel.awaitTermination(5, TimeUnit.SECONDS);
            failingServer.shutdown();
            failingServer.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void testDecide_emptyPathFails() {
        StatusRuntimeException exception = assertThrows(
            StatusRuntimeException.class,
            () -> blockingStub.decide(request("203.0.113.5", ""))
        );

        assertEquals(Status.Code.INVALID_ARGUMENT, exception.getStatus().getCode());
        assertTrue(exception.getStatus().getDescription().contains("path"));
    }

    @Test
    void testDecide_clientsAreIsolated() {
        for (int i = 0; i < 3; i++) {
            blockingStub.decide(request("client-a", "/api/ml/train"));
        }

        assertFalse(blockingStub.decide(request("client-a", "/api/ml/train")).getAllowed());
        assertTrue(blockingStub.decide(request("client-b", "/api/ml/train")).getAllowed());
    }

    @Test
    void testHealthCheck() {
        HealthCheckResponse response = blockingStub.healthCheck(HealthCheckRequest.newBuilder().build());

        assertEquals(HealthCheckResponse.Status.SERVING, response.getStatus());
    }

    @Test
    void testNullDecider_throws() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionServiceImpl(null));
    }

    private static DecideRequest request(String clientId, String path) {
        return DecideRequest.newBuilder()
            .setClientId(clientId)
            .setPath(path)
            .build();
    }
}
