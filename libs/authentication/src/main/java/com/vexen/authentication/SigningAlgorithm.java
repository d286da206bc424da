package com.vexen.authentication;

import java.util.Locale;

/**
 * HMAC algorithms available for token signing.
 */
public enum SigningAlgorithm {
    HS256("HmacSHA256"),
    HS384("HmacSHA384"),
    HS512("HmacSHA512");

    private final String jcaName;

    SigningAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    /** Name of the algorithm in the Java Cryptography Architecture. */
    public String jcaName() {
        return jcaName;
    }

    /**
     * Parses an algorithm name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException for null or unsupported names
     */
    public static SigningAlgorithm fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Signing algorithm must not be null");
        }
        String normalized = value.strip().toUpperCase(Locale.ROOT);
        for (SigningAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported signing algorithm: " + value);
    }
}
