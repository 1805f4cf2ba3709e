package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.NlpParseResult;
import org.jetbrains.annotations.NotNull;

/**
 * External resolver for messages the local rules do not understand.
 */
public interface NlpIntentClient {

    /**
     * Never throws: timeouts, transport errors and unparseable answers come back as {@link NlpParseResult#unknown()}.
     */
    @NotNull
    NlpParseResult parse(@NotNull String text);
}
