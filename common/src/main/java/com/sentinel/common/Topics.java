package com.sentinel.common;

/** Bus topics, in pipeline order. */
public final class Topics {
    public static final String LOGS_RAW = "logs.raw";
    public static final String LOGS_QUALIFYING = "logs.qualifying";
    public static final String LOGS_FINGERPRINTED = "logs.fingerprinted";
    public static final String ALERTS_IMMEDIATE = "alerts.immediate";
    public static final String ALERTS_SUMMARY = "alerts.summary";

    private Topics() {
    }
}
