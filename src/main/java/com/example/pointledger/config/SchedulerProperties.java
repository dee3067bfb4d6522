package com.example.pointledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scheduler.expiration-sweeper")
public class SchedulerProperties {

    /**
     * Cron expression for the expiration sweep.
     * Example: "0 &#42;/5 * * * ?" for every 5 minutes, "-" to disable
     */
    private String cron;

    /**
     * Rows fetched per page for both point batches and transfer requests.
     */
    private int pageSize = 100;

    /**
     * Maximum lock duration in seconds.
     * The lock is released after this duration even if the sweeping instance crashes.
     */
    private int lockAtMostSeconds;

    /**
     * Minimum lock duration in seconds.
     * Prevents another instance from re-running the sweep right after completion.
     */
    private int lockAtLeastSeconds;
}
