package com.atrium.state.identity;

public enum BotStatus {
    ACTIVE,
    SUSPENDED,
    REVOKED
}
