package adm.core.classify;

import adm.core.model.Tier;

/**
 * Maps a request path to its traffic tier.
 *
 * <p>Rules are evaluated in order, first match wins:
 * <ol>
 *   <li>{@code /health...} → HEALTH</li>
 *   <li>{@code /api/ml/...} or any path containing {@code predict} → ML</li>
 *   <li>{@code /api/data/...} or any path containing {@code stock} → DATA</li>
 *   <li>everything else, {@code /api/...} included → API</li>
 * </ol>
 *
 * <p>Pure and total: never throws, null classifies as API.
 */
public final class RequestClassifier {

    private RequestClassifier() {
        // Utility class, no instantiation
    }

    public static Tier classify(String path) {
        if (path == null) {
            return Tier.API;
        }
        if (path.startsWith("/health")) {
            return Tier.HEALTH;
        }
        if (path.startsWith("/api/ml/") || path.contains("predict")) {
            return Tier.ML;
        }
        if (path.startsWith("/api/data/") || path.contains("stock")) {
            return Tier.DATA;
        }
        return Tier.API;
    }
}
