package com.vexen.observability;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secrets before they reach a log line or a {@code toString()}.
 * <p>
 * Handles the two shapes that appear in Vexen configuration: a bare secret (signing key) and a
 * connection string that may embed credentials, either as {@code user:password@host} or as a
 * {@code password=} query/property parameter.
 */
public final class SecretRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Pattern USERINFO_PASSWORD = Pattern.compile("(://[^/:@]+:)([^@/]*)(@)");

    private static final Pattern PASSWORD_PARAMETER =
            Pattern.compile("((?:password|pwd)=)([^&;]*)", Pattern.CASE_INSENSITIVE);

    private SecretRedactor() {
        // utility class
    }

    /**
     * Masks a secret value entirely. Null and empty values are returned as-is so that "not set"
     * stays distinguishable from "set".
     *
     * @param secret the secret
     * @return {@value #REDACTED}, or the input when null or empty
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return secret;
        }
        return REDACTED;
    }

    /**
     * Masks the password portion of a connection string, keeping scheme, user, host and database
     * visible.
     *
     * @param connectionString JDBC or URL-style connection string (may be null)
     * @return the connection string with any embedded password replaced by {@value #REDACTED}
     */
    public static String maskConnectionString(String connectionString) {
        if (connectionString == null || connectionString.isEmpty()) {
            return connectionString;
        }
        String masked = replaceGroup(USERINFO_PASSWORD.matcher(connectionString));
        return replaceGroup(PASSWORD_PARAMETER.matcher(masked));
    }

    private static String replaceGroup(Matcher matcher) {
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = matcher.group(1) + REDACTED + (matcher.groupCount() > 2 ? matcher.group(3) : "");
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
