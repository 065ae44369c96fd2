package com.campus.payments.provider;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up gateway implementations by id. New charges go to the active provider; verification
 * of an existing charge always goes to the provider that issued its reference.
 */
@Component
@Slf4j
public class PaymentProviderRegistry {

    private final Map<String, PaymentProvider> providers;
    private final String activeProviderId;

    public PaymentProviderRegistry(List<PaymentProvider> providers, PaymentProperties properties) {
        this.providers = providers.stream()
                .collect(Collectors.toUnmodifiableMap(PaymentProvider::providerId, Function.identity()));
        this.activeProviderId = properties.getActiveProvider().toLowerCase(Locale.ROOT);
        log.info("Payment providers registered: {}, active: {}", this.providers.keySet(), activeProviderId);
    }

    public PaymentProvider resolve(String providerId) {
        PaymentProvider provider = providerId == null ? null : providers.get(providerId.toLowerCase(Locale.ROOT));
        if (provider == null) {
            throw new ResourceNotFoundException("Payment provider", providerId);
        }
        return provider;
    }

    public PaymentProvider active() {
        return resolve(activeProviderId);
    }
}
