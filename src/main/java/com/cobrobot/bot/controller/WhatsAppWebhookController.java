package com.cobrobot.bot.controller;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.dto.BotReply;
import com.cobrobot.bot.dto.InboundMessage;
import com.cobrobot.bot.service.BotService;
import com.cobrobot.bot.util.MessageUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Twilio's WhatsApp webhook. The reply travels back in the TwiML body; an empty {@code <Response/>}
 * acknowledges a delivery without answering it.
 */
@RestController
@Slf4j
public class WhatsAppWebhookController {

    private final BotService botService;

    @Autowired
    public WhatsAppWebhookController(BotService botService) {
        this.botService = botService;
    }

    @PostMapping(value = "/webhook/whatsapp",
            consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.TEXT_XML_VALUE)
    public ResponseEntity<String> handleMessage(@RequestParam(name = "From", required = false) String from,
                                                @RequestParam(name = "Body", required = false) String body,
                                                @RequestParam(name = "MessageSid", required = false) String messageSid) {
        InboundMessage message = InboundMessage.builder()
                .from(from)
                .body(body)
                .deliveryId(messageSid)
                .build();

        BotReply reply = botService.handleMessage(message);
        return ResponseEntity.ok()
                .contentType(MessageUtils.TWIML)
                .body(MessageUtils.toTwiml(reply.getText()));
    }

    @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public String health() {
        return "ok " + BotConstants.VERSION;
    }
}
