package com.payment.lifecycle.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning for the reconciliation queue and worker.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "payment.reconciliation")
public class ReconciliationProperties {

    private boolean enabled = true;

    /** Delay between the end of one worker tick and the start of the next. */
    private Duration tickInterval = Duration.ofSeconds(15);

    /** Delay before the first poll of a freshly initiated transaction. */
    private Duration firstCheckDelay = Duration.ofSeconds(15);

    /** Delay between polls while the gateway reports the payment as pending. */
    private Duration checkInterval = Duration.ofSeconds(15);

    /** Upper bound for the backoff applied when the gateway is unreachable. */
    private Duration maxBackoff = Duration.ofMinutes(5);

    /**
     * How far a claimed entry is pushed forward while it is being verified. The worker claims
     * no more entries per tick than it can verify within one lease at the gateway timeouts.
     */
    private Duration lease = Duration.ofMinutes(4);

    @Min(1)
    private int maxAttempts = 20;

    /** Entries claimed per tick. */
    @Min(1)
    private int batchSize = 10;

    /** Re-enqueue PENDING ledger rows missing from the queue when the application starts. */
    private boolean rebuildOnStartup = true;

    /** Page size used when scanning the ledger during a rebuild. */
    @Min(1)
    private int rebuildPageSize = 500;
}
