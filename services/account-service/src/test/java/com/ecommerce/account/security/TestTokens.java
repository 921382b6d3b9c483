package com.ecommerce.account.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Base64;

/**
 * Hand-built compact tokens for cases the issuing service never produces.
 */
public final class TestTokens {

    public static final String SECRET = "test-secret-0123456789abcdefghijklmnop";

    public static final String HS256_HEADER = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

    private TestTokens() {
    }

    /** Claims as an older deployment wrote them: no token_type. */
    public static String legacyPayload(String userId, String email, String role, Instant issuedAt, Instant expiresAt) {
        return String.format("{\"user_id\":\"%s\",\"email\":\"%s\",\"role\":\"%s\",\"exp\":%d,\"iat\":%d}",
                userId, email, role, expiresAt.getEpochSecond(), issuedAt.getEpochSecond());
    }

    public static String unsigned(String payloadJson) {
        return encode("{\"alg\":\"none\",\"typ\":\"JWT\"}") + "." + encode(payloadJson) + ".";
    }

    public static String hmacSigned(String headerJson, String payloadJson, String secret) {
        String signingInput = encode(headerJson) + "." + encode(payloadJson);
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] signature = mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
            return signingInput + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String encode(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    public static String decodeSegment(String token, int index) {
        return new String(Base64.getUrlDecoder().decode(token.split("\\.")[index]), StandardCharsets.UTF_8);
    }
}
