package adm.core.classify;

import adm.core.model.Tier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestClassifierTest {

    @Test
    void testHealthPaths() {
        assertEquals(Tier.HEALTH, RequestClassifier.classify("/health"));
        assertEquals(Tier.HEALTH, RequestClassifier.classify("/health/ready"));
        assertEquals(Tier.HEALTH, RequestClassifier.classify("/healthz"));
    }

    @Test
    void testMlPaths_prefixOrPredictAnywhere() {
        assertEquals(Tier.ML, RequestClassifier.classify("/api/ml/train"));
        assertEquals(Tier.ML, RequestClassifier.classify("/api/finance/predictions/7203.T"));
        assertEquals(Tier.ML, RequestClassifier.classify("/v2/predict"));
    }

    @Test
    void testDataPaths_prefixOrStockAnywhere() {
        assertEquals(Tier.DATA, RequestClassifier.classify("/api/data/prices"));
        assertEquals(Tier.DATA, RequestClassifier.classify("/api/finance/stocks/AAPL"));
        assertEquals(Tier.DATA, RequestClassifier.classify("/stock/search"));
    }

    @Test
    void testFirstMatchWins() {
        // health beats everything that follows
        assertEquals(Tier.HEALTH, RequestClassifier.classify("/health/predict"));
        // predict is checked before stock
        assertEquals(Tier.ML, RequestClassifier.classify("/api/stock/predict"));
        assertEquals(Tier.ML, RequestClassifier.classify("/api/data/predictions"));
    }

    @Test
    void testDefaultTier() {
        assertEquals(Tier.API, RequestClassifier.classify("/api/user/profile"));
        assertEquals(Tier.API, RequestClassifier.classify("/"));
        assertEquals(Tier.API, RequestClassifier.classify(""));
        assertEquals(Tier.API, RequestClassifier.classify("/favicon.ico"));
        assertEquals(Tier.API, RequestClassifier.classify(null));
    }

    @Test
    void testCaseSensitive() {
        assertEquals(Tier.API, RequestClassifier.classify("/HEALTH"));
        assertEquals(Tier.API, RequestClassifier.classify("/api/Stock"));
    }

    @Test
    void testNeverClassifiesGlobal() {
        String[] paths = {"/health", "/api/ml/x", "/api/data/x", "/api/x", "/x", "global"};
        for (String path : paths) {
            assertNotEquals(Tier.GLOBAL, RequestClassifier.classify(path));
            assertEquals(RequestClassifier.classify(path), RequestClassifier.classify(path));
        }
    }
}
