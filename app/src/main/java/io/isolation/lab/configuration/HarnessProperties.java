package io.isolation.lab.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param statementTimeout upper bound for any single statement of an actor
 * @param lockTimeout      how long an actor waits for a row lock before failing
 * @param scenario         scenario name, or {@code all}, to run headless; unset starts the HTTP surface only
 */
@ConfigurationProperties("isolation-lab")
public record HarnessProperties(
    @DefaultValue("5s") Duration statementTimeout,
    @DefaultValue("2s") Duration lockTimeout,
    String scenario
) {}
