package com.vexen.identity;

import java.util.Locale;

/**
 * Email normalization shared by the service and the repository.
 */
public final class Emails {

    private Emails() {
        // utility class
    }

    /**
     * Trims and lower-cases an email address. Null stays null.
     */
    public static String normalize(String email) {
        return email == null ? null : email.strip().toLowerCase(Locale.ROOT);
    }
}
