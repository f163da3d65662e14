package com.atrium.state.context;

import com.atrium.state.identity.IdentityType;
import java.util.Optional;

/** Identity kinds a session can act as. Bots are not scopes. */
public enum ScopeType {

    USER("user"),
    ORGANIZATION("organization"),
    TEAM("team"),
    PARTNER("partner");

    private final String value;

    ScopeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public IdentityType identityType() {
        return switch (this) {
            case USER -> IdentityType.USER;
            case ORGANIZATION -> IdentityType.ORGANIZATION;
            case TEAM -> IdentityType.TEAM;
            case PARTNER -> IdentityType.PARTNER;
        };
    }

    public boolean canOwnWorkspace() {
        return identityType().canOwnWorkspace();
    }

    public static Optional<ScopeType> fromString(String value) {
        for (ScopeType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
