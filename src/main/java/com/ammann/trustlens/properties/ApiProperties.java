/* (C)2026 */
package com.ammann.trustlens.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 *
 * <p>Organizes endpoints by functional area (health, data sources, alerts, metrics, ingest)
 * to ensure consistent path naming and simplify path refactoring.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Service health endpoint path. */
    public static final String HEALTH = "/health";

    /** Source key used for CSV uploads. */
    public static final String CSV_SOURCE = "csv";

    /** Source key used for the built-in demo fixture. */
    public static final String DEMO_SOURCE = "demo";

    /**
     * Data source catalog endpoints
     */
    public static final class DataSources {
        private DataSources() {}

        public static final String BASE = "/data-sources";
    }

    /**
     * Alert history and alert trigger endpoints
     */
    public static final class Alerts {
        private Alerts() {}

        public static final String BASE = "/alerts";
        public static final String TRIGGER = "/trigger";
        public static final String TEST = "/test";
    }

    /**
     * Data quality metric endpoints
     */
    public static final class Metrics {
        private Metrics() {}

        public static final String BASE = "/metrics";
        public static final String NULL_RATE = "/null-rate";
        public static final String CHECK = "/check";
    }

    /**
     * Dataset ingest endpoints
     */
    public static final class Ingest {
        private Ingest() {}

        public static final String BASE = "/ingest";
        public static final String CSV = "/csv";
        public static final String DEMO = "/demo";
        public static final String SOURCES = "/sources";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
