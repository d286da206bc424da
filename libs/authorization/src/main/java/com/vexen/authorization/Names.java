package com.vexen.authorization;

final class Names {

    private Names() {
        // utility class
    }

    /** Strips a role or permission name and rejects blank ones. */
    static String require(String kind, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " name must not be null or blank");
        }
        return name.strip();
    }
}
