package adm.java.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP rendering of a decision.
 *
 * @param status Status code: 200 when allowed, 429 when denied
 * @param headers Response headers, in insertion order
 * @param body JSON body for denials, empty when allowed
 * @param resetAfterSeconds Seconds until the window frees a slot (allowed) or the retry hint (denied)
 */
public record HttpVerdict(int status, Map<String, String> headers, String body, long resetAfterSeconds) {

    public HttpVerdict {
        if (resetAfterSeconds < 0) throw new IllegalArgumentException("resetAfterSeconds must be >= 0");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? "" : body;
    }

    public boolean isRejection() {
        return status == HttpVerdicts.TOO_MANY_REQUESTS;
    }
}
