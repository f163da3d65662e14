package com.atrium.state.port;

import com.atrium.state.bot.BotDraft;
import com.atrium.state.bot.BotPatch;
import com.atrium.state.identity.Bot;

/** Scope keys {@code creator:<userId>}, {@code organization:<id>} and {@code workspace:<id>}. */
public interface BotRepository extends EntityRepository<Bot, BotDraft, BotPatch> {
}
