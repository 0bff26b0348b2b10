package com.sentinel.agg;

import org.springframework.context.annotation.*;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class AggConfig {
@Bean public Clock clock() { return Clock.systemUTC(); }
}
