package com.atrium.state.identity;

import java.util.Optional;

/** The closed set of identity kinds. The discriminator never changes after creation. */
public enum IdentityType {

    USER("user"),
    ORGANIZATION("organization"),
    BOT("bot"),
    TEAM("team"),
    PARTNER("partner");

    private final String value;

    IdentityType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Only users and organizations own workspaces. */
    public boolean canOwnWorkspace() {
        return switch (this) {
            case USER, ORGANIZATION -> true;
            case BOT, TEAM, PARTNER -> false;
        };
    }

    /** Team and partner accounts exist only inside an organization. */
    public boolean belongsToOrganization() {
        return switch (this) {
            case TEAM, PARTNER -> true;
            case USER, ORGANIZATION, BOT -> false;
        };
    }

    public static Optional<IdentityType> fromString(String value) {
        for (IdentityType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
