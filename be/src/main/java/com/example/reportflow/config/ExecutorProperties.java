package com.example.reportflow.config;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configures workflow execution.
 */
@ConfigurationProperties(prefix = "reportflow.executor")
@Getter
@Setter
public class ExecutorProperties {

    /** Worker threads for graph ready sets; 1 runs graphs strictly sequentially. */
    private int parallelism = 1;

    /** Deadline applied when a caller does not give one; unset means no deadline. */
    private Duration defaultTimeout;
}
