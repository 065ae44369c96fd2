package com.campus.payments.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Bounds every outbound gateway HTTP call. Applied to the auto-configured
 * {@link org.springframework.web.client.RestClient.Builder} the provider clients are built from.
 */
@Configuration
public class GatewayClientConfig {

    @Bean
    public RestClientCustomizer gatewayTimeoutCustomizer(PaymentProperties properties) {
        PaymentProperties.Gateway gateway = properties.getGateway();
        return builder -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout((int) gateway.getConnectTimeout().toMillis());
            requestFactory.setReadTimeout((int) gateway.getReadTimeout().toMillis());
            builder.requestFactory(requestFactory);
        };
    }
}
