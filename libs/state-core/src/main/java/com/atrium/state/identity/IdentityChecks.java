package com.atrium.state.identity;

final class IdentityChecks {

    private IdentityChecks() {
        // utility class
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
