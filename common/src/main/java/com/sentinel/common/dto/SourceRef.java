package com.sentinel.common.dto;

/**
 * A monitored container. The id comes from the runtime; the name is unique
 * within a run and keys all tracking state.
 */
public record SourceRef(String id, String name) {
}
