package com.atrium.state.bot;

import com.atrium.state.identity.Bot;
import com.atrium.state.identity.BotStatus;
import java.time.Instant;

/** Partial update; null fields are left unchanged. */
public record BotPatch(String displayName, BotStatus status, Instant updatedAt) {

    public static BotPatch status(BotStatus status, Instant at) {
        return new BotPatch(null, status, at);
    }

    public Bot applyTo(Bot bot) {
        Bot result = displayName != null ? bot.withDisplayName(displayName) : bot;
        if (status != null) {
            result = result.withStatus(status, updatedAt != null ? updatedAt : result.updatedAt());
        }
        return result;
    }
}
