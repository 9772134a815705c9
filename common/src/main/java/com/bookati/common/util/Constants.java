package com.bookati.common.util;

/**
 * Common constants used across the reservation modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:slot:";
    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String SESSION_PREFIX = "session_";

    public static final int MAX_BULK_SLOTS = 100;
}
