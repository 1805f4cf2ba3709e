package com.cobrobot.bot.dto;

import lombok.Getter;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

@Getter
public class BotReply {

    private static final BotReply SILENT = new BotReply(null);

    private final String text;

    private BotReply(String text) {
        this.text = text;
    }

    @NotNull
    @Contract("_ -> new")
    public static BotReply of(@NotNull String text) {
        return new BotReply(text);
    }

    /**
     * No reply at all, used for re-delivered messages whose answer already went out.
     */
    @NotNull
    public static BotReply silent() {
        return SILENT;
    }

    public boolean isSilent() {
        return text == null;
    }
}
