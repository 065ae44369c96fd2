package com.campus.payments.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Gateway credentials, timeouts and sweep settings, bound once at startup and handed to the
 * provider clients and the sweeper. Nothing reads provider secrets from anywhere else.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "campus.payments")
public class PaymentProperties {

    /**
     * Provider used for new charges and for the provider-less webhook route.
     */
    @NotBlank
    private String activeProvider = "paystack";

    /**
     * Where the provider sends the payer after checkout.
     */
    private String callbackUrl;

    /**
     * Where the payer lands after abandoning a hosted checkout (Stripe only).
     */
    private String cancelUrl;

    private Gateway gateway = new Gateway();
    private Paystack paystack = new Paystack();
    private Stripe stripe = new Stripe();
    private Mock mock = new Mock();
    @Valid
    private Sweep sweep = new Sweep();

    @Data
    public static class Gateway {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Paystack {
        private String baseUrl = "https://api.paystack.co";
        private String secretKey;
    }

    @Data
    public static class Stripe {
        private String apiKey;
        private String webhookSecret;
        private Duration signatureTolerance = Duration.ofMinutes(5);
    }

    @Data
    public static class Mock {
        private boolean enabled;
        private String webhookSecret = "mock-webhook-secret";
        private double failureRate;
        private int latencyMs;
    }

    @Data
    public static class Sweep {
        private boolean enabled = true;
        @Positive
        private int batchSize = 100;
        @Positive
        private int maxAttempts = 5;
        private Duration staleThreshold = Duration.ofMinutes(15);
    }
}
