package com.sentinel.agg;

import com.sentinel.common.dto.Hit;

public record HitEntry(String fingerprint, Hit hit) {
}
