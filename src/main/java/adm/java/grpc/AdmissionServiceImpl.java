package adm.java.grpc;

import adm.core.model.Decision;
import adm.java.engine.AdmissionDecider;
import adm.java.http.ClientIdentities;
import adm.java.http.HttpVerdict;
import adm.java.http.HttpVerdicts;
import adm.proto.AdmissionServiceGrpc;
import adm.proto.DecideRequest;
import adm.proto.DecideResponse;
import adm.proto.HealthCheckRequest;
import adm.proto.HealthCheckResponse;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC service implementation for admission control.
 *
 * <p>This is a thin wrapper over AdmissionDecider with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Client identity resolution (explicit id, forwarded-for, peer address)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion (Decision + HttpVerdict → DecideResponse)</li>
 * </ul>
 *
 * <p>Thread-safety: AdmissionDecider handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class AdmissionServiceImpl extends AdmissionServiceGrpc.AdmissionServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServiceImpl.class);

    private final AdmissionDecider decider;

    /**
     * Creates a new gRPC service wrapping the given decider.
     *
     * @param decider Admission decider (must be thread-safe)
     * @throws IllegalArgumentException if decider is null
     */
    public AdmissionServiceImpl(AdmissionDecider decider) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        this.decider = decider;
    }

    @Override
    public void decide(DecideRequest request, StreamObserver<DecideResponse> responseObserver) {
        try {
            // protobuf strings are never null, only empty
            if (request.getPath().isEmpty()) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT
                        .withDescription("path must not be empty")
                        .asRuntimeException()
                );
                return;
            }

            String client = request.getClientId().isBlank()
                ? ClientIdentities.resolve(request.getForwardedFor(), request.getPeerAddress())
                : request.getClientId().trim();

            Decision decision = decider.decide(client, request.getPath());
            HttpVerdict verdict = HttpVerdicts.render(decision, decider.getClock());

            DecideResponse response = DecideResponse.newBuilder()
                .setAllowed(decision.allowed())
                .setTier(decision.tier().wireName())
                .setLimit(decision.limit())
                .setRemaining(decision.remaining())
                .setRetryAfterSeconds(decision.retryAfterSeconds())
                .setResetAfterSeconds(verdict.resetAfterSeconds())
                .setReason(decision.reason() == null ? "" : decision.reason().wireName())
                .setHttpStatus(verdict.status())
                .putAllHeaders(verdict.headers())
                .setBody(verdict.body())
                .setClientId(client)
                .build();

            responseObserver.onNext(response);
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (Exception e) {
            // callers must treat this as a denial
            log.error("Decide RPC failed for path {}", request.getPath(), e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        // if we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
