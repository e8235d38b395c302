package com.hotelbooking.common.util;

/**
 * Constants shared by the HTTP surface.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String API_V1 = "/api/v1";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
}
