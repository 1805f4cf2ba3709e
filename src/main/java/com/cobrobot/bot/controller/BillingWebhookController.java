package com.cobrobot.bot.controller;

import com.cobrobot.bot.service.BillingWebhookService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/billing")
@Slf4j
public class BillingWebhookController {

    private final BillingWebhookService webhookService;

    @Autowired
    public BillingWebhookController(BillingWebhookService webhookService) {
        this.webhookService = webhookService;
    }

    /**
     * 200 for processed, duplicate and ignored events alike; 400 (via the exception handler) for a bad signature.
     */
    @PostMapping("/webhook")
    public ResponseEntity<String> handleBillingWebhook(@RequestBody String payload,
                                                       @RequestHeader(name = "Stripe-Signature", required = false) String signature) {
        BillingWebhookService.Result result = webhookService.process(payload, signature);
        log.debug("Billing webhook answered {}", result);
        return ResponseEntity.ok("");
    }
}
