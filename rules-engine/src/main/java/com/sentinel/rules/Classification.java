package com.sentinel.rules;

public enum Classification {
    /** Matched the ignore pattern; the error pattern is not consulted. */
    IGNORED,
    NOT_MATCHING,
    QUALIFYING
}
