package adm.java.grpc;

import adm.core.clock.ManualClock;
import adm.java.engine.AdmissionConfig;
import adm.java.engine.AdmissionDecider;
import adm.proto.AdmissionServiceGrpc;
import adm.proto.DecideRequest;
import adm.proto.HealthCheckRequest;
import adm.proto.HealthCheckResponse;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionServerTest {

    @Test
    void testStartServeStop_onEphemeralPort() throws Exception {
        AdmissionDecider decider = new AdmissionDecider(new ManualClock(0L), AdmissionConfig.defaults());
        AdmissionServer server = new AdmissionServer(0, decider);
        server.start();
        ManagedChannel channel = ManagedChannelBuilder.forAddress("localhost", server.getPort())
            .usePlaintext()
            .build();
        try {
            assertTrue(server.getPort() > 0);

            AdmissionServiceGrpc.AdmissionServiceBlockingStub stub = AdmissionServiceGrpc.newBlockingStub(channel);
            assertEquals(HealthCheckResponse.Status.SERVING,
                stub.healthCheck(HealthCheckRequest.newBuilder().build()).getStatus());
            assertTrue(stub.decide(DecideRequest.newBuilder()
                .setClientId("203.0.113.80")
                .setPath("/api/orders")
                .build()).getAllowed());
        } finally {
            channel.shutdownNow();
            channel.awaitTermination(5, TimeUnit.SECONDS);
            server.stop();
        }
    }
}
