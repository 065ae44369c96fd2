package com.campus.payments.provider;

import com.campus.payments.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Reads Paystack-shaped charge payloads ({@code {"event": ..., "data": {...}}}) and the
 * metadata block shared by every provider.
 * <p>
 * Metadata may arrive as a JSON object or as a JSON-encoded string holding one; both are
 * accepted. Student ids may be numbers or numeric strings.
 */
@Component
@Slf4j
public class ChargeEventParser {

    static final String CHARGE_SUCCESS = "charge.success";
    static final String CHARGE_FAILED = "charge.failed";

    private final ObjectMapper objectMapper;

    public ChargeEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new ValidationException("Empty webhook body");
        }
        try {
            JsonNode root = objectMapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                throw new ValidationException("Webhook body is not a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new ValidationException("Webhook body is not valid JSON", e);
        }
    }

    public WebhookEvent parseChargeEvent(byte[] rawBody) {
        JsonNode root = readTree(rawBody);
        String eventType = text(root, "event");
        if (eventType == null) {
            throw new ValidationException("Webhook event has no event type");
        }

        WebhookEvent.Type type = switch (eventType) {
            case CHARGE_SUCCESS -> WebhookEvent.Type.CHARGE_SUCCESS;
            case CHARGE_FAILED -> WebhookEvent.Type.CHARGE_FAILED;
            default -> WebhookEvent.Type.IGNORED;
        };
        if (type == WebhookEvent.Type.IGNORED) {
            return WebhookEvent.ignored(eventType);
        }

        JsonNode data = root.path("data");
        String reference = text(data, "reference");
        if (reference == null) {
            throw new ValidationException("Webhook event " + eventType + " has no reference");
        }

        return new WebhookEvent(
                eventType,
                type,
                reference,
                longValue(data, "amount"),
                upper(text(data, "currency")),
                type == WebhookEvent.Type.CHARGE_SUCCESS ? parseTimestamp(text(data, "paid_at")) : null,
                parseMetadata(data.get("metadata"))
        );
    }

    /**
     * Builds a verification result from a Paystack transaction object (the {@code data} block
     * of a verify response).
     */
    public ProviderVerification toVerification(String providerReference, JsonNode data) {
        ProviderStatus status = mapStatus(text(data, "status"));
        return ProviderVerification.builder()
                .providerReference(providerReference)
                .status(status)
                .paidAt(status == ProviderStatus.SUCCESS ? parseTimestamp(text(data, "paid_at")) : null)
                .amount(longValue(data, "amount"))
                .currency(upper(text(data, "currency")))
                .gatewayResponse(text(data, "gateway_response"))
                .metadata(parseMetadata(data.get("metadata")))
                .build();
    }

    public ProviderStatus mapStatus(String providerStatus) {
        if (providerStatus == null) {
            return ProviderStatus.PENDING;
        }
        return switch (providerStatus.toLowerCase(Locale.ROOT)) {
            case "success" -> ProviderStatus.SUCCESS;
            case "failed", "reversed" -> ProviderStatus.FAILED;
            case "abandoned" -> ProviderStatus.ABANDONED;
            default -> ProviderStatus.PENDING;
        };
    }

    public PaymentMetadata parseMetadata(JsonNode metadata) {
        if (metadata == null || metadata.isNull() || metadata.isMissingNode()) {
            return PaymentMetadata.empty();
        }
        if (metadata.isTextual()) {
            String encoded = metadata.asText();
            if (encoded.isBlank()) {
                return PaymentMetadata.empty();
            }
            try {
                return parseMetadata(objectMapper.readTree(encoded));
            } catch (JsonProcessingException e) {
                log.warn("Ignoring metadata that is neither an object nor encoded JSON: {}", e.getOriginalMessage());
                return PaymentMetadata.empty();
            }
        }
        if (!metadata.isObject()) {
            return PaymentMetadata.empty();
        }
        return new PaymentMetadata(
                parseStudentId(text(metadata, PaymentMetadata.STUDENT_ID)),
                text(metadata, PaymentMetadata.ACADEMIC_YEAR),
                text(metadata, PaymentMetadata.SEMESTER),
                text(metadata, PaymentMetadata.DESCRIPTION)
        );
    }

    /**
     * Flat string metadata, as Stripe returns it.
     */
    public PaymentMetadata parseMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return PaymentMetadata.empty();
        }
        return parseMetadata(objectMapper.<JsonNode>valueToTree(metadata));
    }

    OffsetDateTime parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable paid_at timestamp '{}', falling back to confirmation time", value);
            return null;
        }
    }

    static OffsetDateTime fromEpochSeconds(long epochSeconds) {
        return epochSeconds > 0 ? OffsetDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC) : null;
    }

    private Long parseStudentId(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric student_id '{}' in payment metadata", value);
            return null;
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Amounts are whole numbers in the smallest currency unit; a fractional value is refused
     * rather than rounded.
     */
    static Long longValue(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            if (!value.canConvertToLong() || value.decimalValue().stripTrailingZeros().scale() > 0) {
                throw new ValidationException("Field " + field + " is not a whole number: " + value.asText());
            }
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Field " + field + " is not a whole number: " + value.asText(), e);
            }
        }
        return null;
    }

    static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
