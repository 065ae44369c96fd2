package com.campus.payments.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HmacSignatureVerifierTest {

    // RFC 4231 test case 2
    private static final String KEY = "Jefe";
    private static final byte[] DATA = "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8);
    private static final String SHA256_DIGEST =
            "5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843";
    private static final String SHA512_DIGEST =
            "164b7a7bfcf819e2e395fbe73b56e0a387bd64222e831fd610270cd7ea250554"
                    + "9758bf75c05a994a6d034f65f8f0e6fdcaeab1a34d4a6b4b636e070a38bce737";

    private final HmacSignatureVerifier verifier = new HmacSignatureVerifier();

    @Nested
    @DisplayName("Signing")
    class SigningTests {

        @Test
        @DisplayName("Should produce the RFC 4231 HMAC-SHA512 digest as lower-case hex")
        void shouldSignWithSha512() {
            assertThat(verifier.sign(DATA, KEY, HmacSignatureVerifier.HMAC_SHA512)).isEqualTo(SHA512_DIGEST);
        }

        @Test
        @DisplayName("Should produce the RFC 4231 HMAC-SHA256 digest as lower-case hex")
        void shouldSignWithSha256() {
            assertThat(verifier.sign(DATA, KEY, HmacSignatureVerifier.HMAC_SHA256)).isEqualTo(SHA256_DIGEST);
        }
    }

    @Nested
    @DisplayName("Verification")
    class VerificationTests {

        @Test
        @DisplayName("Should accept the unmodified body with the correct secret")
        void shouldAcceptMatchingSignature() {
            assertThat(verifier.verify(DATA, SHA512_DIGEST, KEY)).isTrue();
            assertThat(verifier.verify(DATA, SHA256_DIGEST, KEY, HmacSignatureVerifier.HMAC_SHA256)).isTrue();
        }

        @Test
        @DisplayName("Should accept upper-case hex and surrounding whitespace in the header")
        void shouldNormaliseHeader() {
            assertThat(verifier.verify(DATA, "  " + SHA512_DIGEST.toUpperCase() + " ", KEY)).isTrue();
        }

        @Test
        @DisplayName("Should reject a tampered body with an unchanged header")
        void shouldRejectTamperedBody() {
            byte[] tampered = "what do ya want for nothing!".getBytes(StandardCharsets.UTF_8);

            assertThat(verifier.verify(tampered, SHA512_DIGEST, KEY)).isFalse();
        }

        @Test
        @DisplayName("Should reject a signature made with another secret")
        void shouldRejectWrongSecret() {
            assertThat(verifier.verify(DATA, SHA512_DIGEST, "Jeff")).isFalse();
        }

        @Test
        @DisplayName("Should reject a signature made with another algorithm")
        void shouldRejectWrongAlgorithm() {
            assertThat(verifier.verify(DATA, SHA256_DIGEST, KEY, HmacSignatureVerifier.HMAC_SHA512)).isFalse();
        }

        @Test
        @DisplayName("Should return false rather than throw on missing inputs")
        void shouldRejectMissingInputs() {
            assertThat(verifier.verify(DATA, null, KEY)).isFalse();
            assertThat(verifier.verify(DATA, "", KEY)).isFalse();
            assertThat(verifier.verify(DATA, SHA512_DIGEST, null)).isFalse();
            assertThat(verifier.verify(DATA, SHA512_DIGEST, " ")).isFalse();
            assertThat(verifier.verify(null, SHA512_DIGEST, KEY)).isFalse();
        }

        @Test
        @DisplayName("Should reject a truncated signature")
        void shouldRejectTruncatedSignature() {
            assertThat(verifier.verify(DATA, SHA512_DIGEST.substring(0, 64), KEY)).isFalse();
        }
    }
}
