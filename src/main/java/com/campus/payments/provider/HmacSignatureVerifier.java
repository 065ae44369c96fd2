package com.campus.payments.provider;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Keyed-hash check of webhook bodies.
 * <p>
 * The HMAC is always computed over the raw bytes as received, never over a re-serialized
 * payload, and compared in constant time. A mismatch, a missing header or a missing secret all
 * produce {@code false} without saying which.
 */
@Component
public class HmacSignatureVerifier {

    public static final String HMAC_SHA512 = "HmacSHA512";
    public static final String HMAC_SHA256 = "HmacSHA256";

    private static final HexFormat HEX = HexFormat.of();

    public boolean verify(byte[] rawBody, String signatureHeader, String secret) {
        return verify(rawBody, signatureHeader, secret, HMAC_SHA512);
    }

    public boolean verify(byte[] rawBody, String signatureHeader, String secret, String algorithm) {
        if (rawBody == null || isBlank(signatureHeader) || isBlank(secret)) {
            return false;
        }
        byte[] expected = sign(rawBody, secret, algorithm).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signatureHeader.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    /**
     * Lower-case hex HMAC of the body.
     */
    public String sign(byte[] rawBody, String secret, String algorithm) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return HEX.formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC algorithm unavailable: " + algorithm, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
