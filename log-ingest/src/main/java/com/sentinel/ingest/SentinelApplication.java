package com.sentinel.ingest;

import com.sentinel.common.SentinelConfigurationException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tails container logs and raises deduplicated, rate-limited error alerts.
 *
 * Usage:
 *   java -jar log-ingest.jar --all
 *   java -jar log-ingest.jar --containers=api,worker --since=5m
 *
 * Exit codes: 2 for configuration errors, 1 for any other startup failure.
 */
@SpringBootApplication(scanBasePackages = "com.sentinel")
public class SentinelApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.run(SentinelApplication.class, args);
        } catch (Throwable t) {
            System.err.println(failureMessage(t));
            System.exit(exitCode(t));
        }
    }

    /** One line for the user: the configuration problem as stated, anything else prefixed with "Fatal:". */
    static String failureMessage(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SentinelConfigurationException) return c.getMessage();
        }
        return "Fatal: " + t.getMessage();
    }

    static int exitCode(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SentinelConfigurationException) return 2;
        }
        return 1;
    }
}
