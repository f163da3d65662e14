package com.atrium.state.membership;

/**
 * Lifecycle of a membership. Moves forward only, except that ACTIVE and SUSPENDED can alternate.
 * ARCHIVED is terminal.
 */
public enum MembershipStatus {

    INVITED,
    ACTIVE,
    SUSPENDED,
    ARCHIVED;

    public boolean canTransitionTo(MembershipStatus target) {
        return switch (this) {
            case INVITED -> target == ACTIVE || target == ARCHIVED;
            case ACTIVE -> target == SUSPENDED || target == ARCHIVED;
            case SUSPENDED -> target == ACTIVE || target == ARCHIVED;
            case ARCHIVED -> false;
        };
    }
}
