package adm.java.http;

/**
 * Derives the client identity used as the admission key.
 *
 * <p>The first non-blank entry of {@code X-Forwarded-For} wins (the original
 * client as seen by the first proxy); otherwise the peer address without its
 * port. Requests with neither share the {@link #UNKNOWN} identity.
 */
public final class ClientIdentities {

    public static final String UNKNOWN = "unknown";

    private ClientIdentities() {
        // Utility class, no instantiation
    }

    public static String resolve(String forwardedFor, String peerAddress) {
        if (forwardedFor != null) {
            for (String hop : forwardedFor.split(",")) {
                String candidate = hop.trim();
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
        }
        if (peerAddress != null && !peerAddress.isBlank()) {
            return stripPort(peerAddress.trim());
        }
        return UNKNOWN;
    }

    /**
     * Strips a port from "host:port", "/host:port" and "[v6]:port" forms.
     * A bare IPv6 address (several colons, no brackets) is returned as is.
     */
    static String stripPort(String address) {
        String value = address.startsWith("/") ? address.substring(1) : address;
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            return close > 0 ? value.substring(1, close) : value;
        }
        int colon = value.indexOf(':');
        if (colon > 0 && colon == value.lastIndexOf(':')) {
            return value.substring(0, colon);
        }
        return value;
    }
}
