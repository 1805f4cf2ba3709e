package com.cobrobot.bot.service;

import com.cobrobot.bot.exception.MessageDeliveryException;
import org.jetbrains.annotations.NotNull;

/**
 * Outbound chat messages, addressed by the transport identity ({@code whatsapp:+52...}).
 */
public interface MessageTransport {

    void send(@NotNull String to, @NotNull String text) throws MessageDeliveryException;
}
