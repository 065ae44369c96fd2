package com.campus.payments.security;

import com.campus.payments.provider.MockPaymentProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Bearer-token protection of the API, with webhooks left to signature checks.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PaymentApiSecurityTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MockPaymentProvider mockProvider;

    @Test
    @DisplayName("Should answer 401 to an API call without a token")
    void shouldRequireToken() throws Exception {
        mockMvc.perform(get("/api/verify-payment/ref-abc"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should answer 401 to an API call with an invalid token")
    void shouldRejectInvalidToken() throws Exception {
        mockMvc.perform(get("/api/verify-payment/ref-abc")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should let an authenticated call reach the controller")
    void shouldAcceptValidToken() throws Exception {
        String token = TestTokens.issue("student-42", "student");

        mockMvc.perform(get("/api/verify-payment/unknown-ref")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should accept a signed webhook without a token")
    void shouldLeaveWebhooksOpen() throws Exception {
        byte[] body = "{\"event\":\"transfer.success\",\"data\":{}}".getBytes(StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(MockPaymentProvider.SIGNATURE_HEADER, mockProvider.sign(body))
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));
    }

    @Test
    @DisplayName("Should answer 401 to an unsigned webhook")
    void shouldRejectUnsignedWebhook() throws Exception {
        mockMvc.perform(post("/api/webhook/mock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":\"charge.success\",\"data\":{\"reference\":\"MOCK-1\"}}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should expose health without a token")
    void shouldExposeHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk());
    }
}
