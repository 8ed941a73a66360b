/* (C)2026 */
package com.ammann.reflectometry.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Reduction endpoints
     */
    public static final class Reduction {
        private Reduction() {}

        public static final String BASE = "/reductions";
        public static final String SCAN_LOG = "/scan-log";
        public static final String SCAN_LOG_DOCUMENT = SCAN_LOG + "/document";
        public static final String RAW = "/raw";
        public static final String CONFIGURATION = "/configuration";
    }

    /**
     * Quarkus management endpoints
     */
    public static final class Management {
        private Management() {}

        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
