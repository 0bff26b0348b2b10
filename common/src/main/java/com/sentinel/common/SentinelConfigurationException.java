package com.sentinel.common;

/**
 * Startup configuration is unusable (bad pattern, no targets selected or
 * resolved). The process exits with code 2 when this reaches the top.
 */
public class SentinelConfigurationException extends RuntimeException {

    public SentinelConfigurationException(String message) {
        super(message);
    }

    public SentinelConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
