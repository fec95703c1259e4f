package com.chemfetch.sds.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Scheduling and timeout settings of the auto-parse coordinator, bound from
 * the <code>auto-parse</code> prefix.
 */
@Component
@ConfigurationProperties(prefix = "auto-parse")
@Getter
@Setter
public class AutoParseProperties {

    /** Delay applied to a single trigger when the caller gives none. */
    private Duration defaultDelay = Duration.ZERO;

    /** Pause between two products of a batch run. */
    private Duration batchDelay = Duration.ofSeconds(5);

    /** Reachability check timeout. */
    private Duration healthTimeout = Duration.ofSeconds(10);

    /**
     * Deadline for one parse run, health check included. When it fires the run
     * is cancelled and placeholder metadata is written.
     */
    private Duration runTimeout = Duration.ofMinutes(3);
}
