package com.sentinel.rules;

import com.sentinel.common.SentinelConfigurationException;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a line is worth tracking. Both patterns are case-insensitive
 * and match anywhere in the line; the ignore pattern wins over the error pattern.
 */
public class LineFilter {
    private final Pattern errorPattern;
    private final Pattern ignorePattern;

    public LineFilter(Pattern errorPattern, Pattern ignorePattern) {
        this.errorPattern = errorPattern;
        this.ignorePattern = ignorePattern;
    }

    /**
     * @param ignore may be blank to disable ignoring
     * @throws SentinelConfigurationException if either pattern does not compile
     */
    public static LineFilter compile(String error, String ignore) {
        if (error == null || error.isBlank()) {
            throw new SentinelConfigurationException("Error pattern must not be empty");
        }
        Pattern ignorePattern = ignore == null || ignore.isBlank() ? null : compileFlag("ignore", ignore);
        return new LineFilter(compileFlag("patterns", error), ignorePattern);
    }

    private static Pattern compileFlag(String flag, String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new SentinelConfigurationException("Invalid --" + flag + " regex: " + e.getDescription(), e);
        }
    }

    public Classification classify(String line) {
        if (ignorePattern != null && ignorePattern.matcher(line).find()) return Classification.IGNORED;
        if (!errorPattern.matcher(line).find()) return Classification.NOT_MATCHING;
        return Classification.QUALIFYING;
    }

    public Optional<Pattern> getIgnorePattern() {
        return Optional.ofNullable(ignorePattern);
    }

    /** Startup banner text, e.g. {@code Patterns=/(error)/i Ignore=none}. */
    public String describe() {
        String ignore = ignorePattern == null ? "none" : "/" + ignorePattern.pattern() + "/i";
        return "Patterns=/" + errorPattern.pattern() + "/i Ignore=" + ignore;
    }
}
