package com.sentinel.common.dto;

public enum StreamClass {
    STDOUT,
    STDERR
}
