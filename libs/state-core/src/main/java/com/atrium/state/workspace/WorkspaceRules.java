package com.atrium.state.workspace;

import java.util.Optional;
import java.util.regex.Pattern;

/** Field rules for workspace names. Each check returns the violation message, if any. */
public final class WorkspaceRules {

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_DISPLAY_NAME_LENGTH = 200;

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private WorkspaceRules() {
        // utility class
    }

    public static Optional<String> checkName(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.of("workspace name must not be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            return Optional.of("workspace name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (!NAME.matcher(name).matches()) {
            return Optional.of("workspace name may only contain letters, digits, '-' and '_'");
        }
        return Optional.empty();
    }

    public static Optional<String> checkDisplayName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return Optional.of("display name must not be blank");
        }
        if (displayName.length() > MAX_DISPLAY_NAME_LENGTH) {
            return Optional.of("display name must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters");
        }
        return Optional.empty();
    }
}
