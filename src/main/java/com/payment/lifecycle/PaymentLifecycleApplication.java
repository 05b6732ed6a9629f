package com.payment.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the payment lifecycle service:
 * <ul>
 *   <li>Transaction ledger (PostgreSQL) with a conditional status update</li>
 *   <li>CinetPay gateway adapter behind a Resilience4j circuit breaker</li>
 *   <li>Authenticated webhook ingestion and a Redis-backed reconciliation worker</li>
 *   <li>Kafka status-changed events and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class PaymentLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentLifecycleApplication.class, args);
    }
}
