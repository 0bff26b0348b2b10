package com.sentinel.ingest;

import com.sentinel.common.SentinelConfigurationException;
import com.sentinel.common.dto.SourceRef;
import com.sentinel.common.port.LogSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Picks the containers to follow: all running ones with {@code --all},
 * otherwise the running ones named in {@code --containers}.
 */
@Component
public class TargetResolver {
    private final LogSource logSource;
    private final boolean all;
    private final List<String> names;

    public TargetResolver(LogSource logSource,
                          @Value("${sentinel.all:false}") String all,
                          @Value("${sentinel.containers:}") String containers) {
        this.logSource = logSource;
        this.all = isSwitchedOn("all", all);
        this.names = splitNames(containers);
    }

    /** A bare switch ({@code --all}) arrives as an empty value and means on. */
    static boolean isSwitchedOn(String flag, String value) {
        if (value == null) return false;
        if (value.isBlank() || value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new SentinelConfigurationException("Invalid --" + flag + " value: " + value);
    }

    static List<String> splitNames(String csv) {
        if (csv == null) return List.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    /**
     * @throws SentinelConfigurationException if no selection was given or nothing named is running
     */
    public List<SourceRef> resolve() {
        if (!all && names.isEmpty()) {
            throw new SentinelConfigurationException("Specify --all or --containers <name1,name2>");
        }
        List<SourceRef> running = logSource.listRunningSources();
        if (all) return running;

        Set<String> wanted = Set.copyOf(names);
        List<SourceRef> matched = running.stream().filter(s -> wanted.contains(s.name())).toList();
        if (matched.isEmpty()) {
            throw new SentinelConfigurationException(
                    "No matching running containers for: " + String.join(", ", names));
        }
        return matched;
    }
}
