package com.sentinel.rules;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;

@Configuration
public class RulesConfig {
    @Bean
    public LineFilter lineFilter(@Value("${sentinel.patterns}") String patterns,
                                 @Value("${sentinel.ignore:}") String ignore) {
        return LineFilter.compile(patterns, ignore);
    }
}
