package com.campus.payments.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binding tests for PaymentProperties: bad settings must stop startup rather than the first sweep.
 */
class PaymentPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    @DisplayName("Should bind defaults")
    void shouldBindDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            PaymentProperties properties = context.getBean(PaymentProperties.class);
            assertThat(properties.getActiveProvider()).isEqualTo("paystack");
            assertThat(properties.getSweep().getBatchSize()).isEqualTo(100);
        });
    }

    @Test
    @DisplayName("Should refuse a zero sweep batch size")
    void shouldRejectZeroBatchSize() {
        contextRunner.withPropertyValues("campus.payments.sweep.batch-size=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should refuse a negative max attempts")
    void shouldRejectNegativeMaxAttempts() {
        contextRunner.withPropertyValues("campus.payments.sweep.max-attempts=-1")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should refuse a blank active provider")
    void shouldRejectBlankActiveProvider() {
        contextRunner.withPropertyValues("campus.payments.active-provider= ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(PaymentProperties.class)
    static class PropertiesConfiguration {
    }
}
