package com.campus.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Campus Payments Service
 * <p>
 * Takes tuition payments through external gateways (Paystack, Stripe) and keeps each
 * student's payment status in step with the provider.
 * <p>
 * Key Features:
 * - Charge initiation against the active provider
 * - Idempotent reconciliation from client confirmation, signed webhooks and a scheduled sweep
 * - Student payment status projection updated once per confirmed payment
 * - Circuit breakers, metrics and structured logging around every gateway call
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@EnableRetry
public class CampusPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampusPaymentsApplication.class, args);
    }
}
