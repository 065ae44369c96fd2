package com.campus.payments.provider;

import com.campus.payments.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChargeEventParserTest {

    private final ChargeEventParser parser = new ChargeEventParser(new ObjectMapper());

    @Nested
    @DisplayName("Charge Events")
    class ChargeEventTests {

        @Test
        @DisplayName("Should parse charge.success with object metadata")
        void shouldParseChargeSuccess() {
            WebhookEvent event = parser.parseChargeEvent(bytes("""
                    {"event": "charge.success",
                     "data": {"reference": "ref-123", "status": "success", "amount": 500000, "currency": "ngn",
                              "paid_at": "2025-09-01T10:15:30.000Z",
                              "metadata": {"student_id": 42, "semester": "Fall", "academic_year": "2025-2026",
                                           "description": "Tuition"}}}
                    """));

            assertThat(event.type()).isEqualTo(WebhookEvent.Type.CHARGE_SUCCESS);
            assertThat(event.eventType()).isEqualTo("charge.success");
            assertThat(event.reference()).isEqualTo("ref-123");
            assertThat(event.amount()).isEqualTo(500000L);
            assertThat(event.currency()).isEqualTo("NGN");
            assertThat(event.paidAt()).isEqualTo(OffsetDateTime.parse("2025-09-01T10:15:30Z"));
            assertThat(event.metadata()).isEqualTo(new PaymentMetadata(42L, "2025-2026", "Fall", "Tuition"));
            assertThat(event.metadata().isComplete()).isTrue();
        }

        @Test
        @DisplayName("Should accept metadata sent as a JSON-encoded string")
        void shouldParseStringMetadata() {
            WebhookEvent event = parser.parseChargeEvent(bytes("""
                    {"event": "charge.success",
                     "data": {"reference": "ref-123", "amount": "500000", "currency": "NGN",
                              "metadata": "{\\"student_id\\": \\"42\\", \\"semester\\": \\"Fall\\", \\"academic_year\\": \\"2025-2026\\"}"}}
                    """));

            assertThat(event.amount()).isEqualTo(500000L);
            assertThat(event.metadata().studentId()).isEqualTo(42L);
            assertThat(event.metadata().semester()).isEqualTo("Fall");
            assertThat(event.metadata().isComplete()).isTrue();
        }

        @Test
        @DisplayName("Should treat unusable metadata as empty")
        void shouldTolerateBrokenMetadata() {
            WebhookEvent event = parser.parseChargeEvent(bytes("""
                    {"event": "charge.success",
                     "data": {"reference": "ref-123", "amount": 100, "currency": "NGN",
                              "metadata": {"student_id": "S-12", "semester": "Fall"}}}
                    """));

            assertThat(event.metadata().studentId()).isNull();
            assertThat(event.metadata().isComplete()).isFalse();

            WebhookEvent garbled = parser.parseChargeEvent(bytes("""
                    {"event": "charge.success", "data": {"reference": "ref-124", "metadata": "not json"}}
                    """));

            assertThat(garbled.metadata()).isEqualTo(PaymentMetadata.empty());
        }

        @Test
        @DisplayName("Should parse charge.failed without a paid_at")
        void shouldParseChargeFailed() {
            WebhookEvent event = parser.parseChargeEvent(bytes("""
                    {"event": "charge.failed",
                     "data": {"reference": "ref-9", "status": "failed", "paid_at": "2025-09-01T10:15:30.000Z"}}
                    """));

            assertThat(event.type()).isEqualTo(WebhookEvent.Type.CHARGE_FAILED);
            assertThat(event.paidAt()).isNull();
        }

        @Test
        @DisplayName("Should ignore event types it does not reconcile")
        void shouldIgnoreOtherEvents() {
            WebhookEvent event = parser.parseChargeEvent(bytes("""
                    {"event": "transfer.success", "data": {"reference": "trf-1"}}
                    """));

            assertThat(event.type()).isEqualTo(WebhookEvent.Type.IGNORED);
            assertThat(event.reference()).isNull();
        }
    }

    @Nested
    @DisplayName("Malformed Bodies")
    class MalformedBodyTests {

        @Test
        @DisplayName("Should reject invalid JSON")
        void shouldRejectInvalidJson() {
            assertThatThrownBy(() -> parser.parseChargeEvent(bytes("{not json")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should reject an empty body")
        void shouldRejectEmptyBody() {
            assertThatThrownBy(() -> parser.parseChargeEvent(new byte[0]))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should reject an event without a type")
        void shouldRejectMissingEventType() {
            assertThatThrownBy(() -> parser.parseChargeEvent(bytes("{\"data\": {\"reference\": \"r\"}}")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("event type");
        }

        @Test
        @DisplayName("Should reject a charge event without a reference")
        void shouldRejectMissingReference() {
            assertThatThrownBy(() -> parser.parseChargeEvent(bytes("{\"event\": \"charge.success\", \"data\": {}}")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("reference");
        }

        @Test
        @DisplayName("Should reject a fractional amount instead of truncating it")
        void shouldRejectFractionalAmount() {
            String body = """
                    {"event": "charge.success",
                     "data": {"reference": "ref-123", "amount": 500000.5, "currency": "NGN"}}
                    """;

            assertThatThrownBy(() -> parser.parseChargeEvent(bytes(body)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("amount");
        }

        @Test
        @DisplayName("Should reject an amount too large for the smallest currency unit")
        void shouldRejectOversizedAmount() {
            String body = """
                    {"event": "charge.success",
                     "data": {"reference": "ref-123", "amount": 99999999999999999999, "currency": "NGN"}}
                    """;

            assertThatThrownBy(() -> parser.parseChargeEvent(bytes(body)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("amount");
        }
    }

    @Test
    @DisplayName("Should accept a whole amount written as a decimal")
    void shouldAcceptWholeDecimalAmount() {
        WebhookEvent event = parser.parseChargeEvent(bytes("""
                {"event": "charge.failed", "data": {"reference": "ref-123", "amount": 500000.0, "currency": "NGN"}}
                """));

        assertThat(event.amount()).isEqualTo(500000L);
    }

    @Test
    @DisplayName("Should map Paystack statuses onto provider statuses")
    void shouldMapStatuses() {
        assertThat(parser.mapStatus("success")).isEqualTo(ProviderStatus.SUCCESS);
        assertThat(parser.mapStatus("failed")).isEqualTo(ProviderStatus.FAILED);
        assertThat(parser.mapStatus("abandoned")).isEqualTo(ProviderStatus.ABANDONED);
        assertThat(parser.mapStatus("ongoing")).isEqualTo(ProviderStatus.PENDING);
        assertThat(parser.mapStatus("queued")).isEqualTo(ProviderStatus.PENDING);
        assertThat(parser.mapStatus(null)).isEqualTo(ProviderStatus.PENDING);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
