package com.cobrobot.bot.exception;

import com.cobrobot.bot.constant.MessageTemplates;
import com.cobrobot.bot.util.MessageUtils;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@ControllerAdvice
public class ExceptionHandler {

    static final String CHAT_WEBHOOK_PATH = "/webhook/whatsapp";

    @org.springframework.web.bind.annotation.ExceptionHandler(BillingSignatureException.class)
    public ResponseEntity<Object> handleBillingSignatureException(@NotNull BillingSignatureException ex) {
        Map<String, Object> body = new HashMap<>();
        body.put("message", ex.getMessage());
        body.put("timestamp", System.currentTimeMillis());

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    /**
     * The chat transport always gets a TwiML answer with a short apology; anything else gets a 500 so the
     * sender retries.
     */
    @org.springframework.web.bind.annotation.ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGlobalException(@NotNull Exception ex, @NotNull HttpServletRequest request) {
        log.error("Unhandled error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        if (request.getRequestURI() != null && request.getRequestURI().startsWith(CHAT_WEBHOOK_PATH)) {
            return ResponseEntity.ok()
                    .contentType(MessageUtils.TWIML)
                    .body(MessageUtils.toTwiml(MessageTemplates.ERROR_MESSAGE));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("message", "Internal error");
        body.put("timestamp", System.currentTimeMillis());

        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
