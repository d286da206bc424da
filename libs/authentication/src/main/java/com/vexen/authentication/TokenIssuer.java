package com.vexen.authentication;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Issues and verifies HMAC-signed compact tokens of the form {@code header.claims.signature},
 * each part base64url-encoded without padding.
 * <p>
 * Thread-safe: a new {@link Mac} is created per operation.
 */
public final class TokenIssuer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    record Header(@JsonProperty("alg") String alg, @JsonProperty("typ") String typ) {}

    private final SecretKeySpec key;
    private final SigningAlgorithm algorithm;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if the secret is null or empty
     */
    public TokenIssuer(String secretKey, SigningAlgorithm algorithm, Clock clock) {
        if (secretKey == null || secretKey.isEmpty()) {
            throw new IllegalArgumentException("secretKey must not be empty");
        }
        this.key = new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), algorithm.jcaName());
        this.algorithm = algorithm;
        this.clock = clock;
    }

    public SigningAlgorithm algorithm() {
        return algorithm;
    }

    public String issue(TokenClaims claims) {
        try {
            String header = ENCODER.encodeToString(MAPPER.writeValueAsBytes(new Header(algorithm.name(), "JWT")));
            String payload = ENCODER.encodeToString(MAPPER.writeValueAsBytes(claims));
            String signingInput = header + "." + payload;
            return signingInput + "." + ENCODER.encodeToString(sign(signingInput));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode token claims", e);
        }
    }

    /**
     * Verifies signature, algorithm, type and expiry.
     *
     * @throws AuthenticationException with {@code INVALID_TOKEN} for a malformed, tampered or
     *                                 mistyped token and {@code EXPIRED_TOKEN} once it expired
     */
    public TokenClaims verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw invalid("Token is empty", null);
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw invalid("Token must have three parts", null);
        }
        TokenClaims claims;
        try {
            Header header = MAPPER.readValue(DECODER.decode(parts[0]), Header.class);
            if (header == null) {
                throw invalid("Malformed token header", null);
            }
            if (!algorithm.name().equals(header.alg())) {
                throw invalid("Unexpected token algorithm: " + header.alg(), null);
            }
            byte[] signature = DECODER.decode(parts[2]);
            if (!MessageDigest.isEqual(signature, sign(parts[0] + "." + parts[1]))) {
                throw invalid("Token signature mismatch", null);
            }
            claims = MAPPER.readValue(DECODER.decode(parts[1]), TokenClaims.class);
            if (claims == null) {
                throw invalid("Malformed token claims", null);
            }
            claims.userId();
        } catch (IOException | IllegalArgumentException e) {
            throw invalid("Malformed token", e);
        }
        if (claims.type() != expectedType) {
            throw invalid("Expected " + expectedType + " token but got " + claims.type(), null);
        }
        if (clock.instant().getEpochSecond() >= claims.expiresAt()) {
            throw new AuthenticationException(AuthenticationException.Reason.EXPIRED_TOKEN, "Token expired");
        }
        return claims;
    }

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(algorithm.jcaName());
            mac.init(key);
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm.jcaName() + " is not available", e);
        }
    }

    private static AuthenticationException invalid(String message, Throwable cause) {
        return new AuthenticationException(AuthenticationException.Reason.INVALID_TOKEN, message, cause);
    }
}
