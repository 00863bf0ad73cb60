package com.example.matrixgame.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "matrix.timeout")
public record TimeoutProperties(
        @DefaultValue("true") boolean enabled,       // start the sweep on application ready
        @DefaultValue("300s") Duration interval,     // delay between two sweeps
        @DefaultValue("60s") Duration initialDelay   // delay before the first sweep
) {}
