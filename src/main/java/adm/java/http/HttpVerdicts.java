package adm.java.http;

import adm.core.clock.Clock;
import adm.core.model.Decision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Maps a {@link Decision} onto the HTTP contract.
 *
 * <ul>
 *   <li>denied → 429, {@code Retry-After}, JSON body with reason, tier and retry_after</li>
 *   <li>allowed → 200 with {@code X-RateLimit-Tier}, {@code X-RateLimit-Limit},
 *       {@code X-RateLimit-Remaining} and {@code X-RateLimit-Reset}</li>
 * </ul>
 * {@code X-RateLimit-Reset} is the number of seconds until the sustained window frees a slot.
 */
public final class HttpVerdicts {

    public static final int OK = 200;
    public static final int TOO_MANY_REQUESTS = 429;

    public static final String RETRY_AFTER = "Retry-After";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String TIER = "X-RateLimit-Tier";
    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpVerdicts() {
        // Utility class, no instantiation
    }

    /**
     * Renders a decision. The clock is read only for allowed decisions, to turn
     * the absolute reset time into a delta; a denial already carries its retry
     * hint, so it renders even when the clock is unavailable.
     *
     * @param decision Decision to render
     * @param clock The decider's clock
     */
    public static HttpVerdict render(Decision decision, Clock clock) {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (decision.allowed()) {
            long resetAfter = secondsUntil(decision.resetAtNanos(), clock.nowNanos());
            headers.put(TIER, decision.tier().wireName());
            headers.put(LIMIT, Integer.toString(decision.limit()));
            headers.put(REMAINING, Integer.toString(decision.remaining()));
            headers.put(RESET, Long.toString(resetAfter));
            return new HttpVerdict(OK, headers, "", resetAfter);
        }

        headers.put(RETRY_AFTER, Long.toString(decision.retryAfterSeconds()));
        headers.put(CONTENT_TYPE, "application/json;charset=utf-8");
        return new HttpVerdict(TOO_MANY_REQUESTS, headers, denialBody(decision), decision.retryAfterSeconds());
    }

    static String denialBody(Decision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limited");
        body.put("reason", decision.reason().wireName());
        body.put("tier", decision.tier().wireName());
        body.put("retry_after", decision.retryAfterSeconds());
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize denial body", e);
        }
    }

    /**
     * Whole seconds from now until the given clock time, rounded up, never negative.
     */
    static long secondsUntil(long atNanos, long nowNanos) {
        long delta = atNanos - nowNanos;
        if (delta <= 0) {
            return 0L;
        }
        long nanosPerSecond = TimeUnit.SECONDS.toNanos(1);
        return (delta + nanosPerSecond - 1) / nanosPerSecond;
    }
}
