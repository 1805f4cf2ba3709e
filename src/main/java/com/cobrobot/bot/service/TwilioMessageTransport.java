package com.cobrobot.bot.service;

import com.cobrobot.bot.exception.MessageDeliveryException;
import com.cobrobot.bot.util.MessageUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends WhatsApp messages through Twilio's Messages REST resource. Bodies over the WhatsApp limit go out
 * as several messages, in order.
 */
@Slf4j
@Service
public class TwilioMessageTransport implements MessageTransport {

    private static final String MESSAGES_URL = "%s/2010-04-01/Accounts/%s/Messages.json";

    private final RestTemplate restTemplate;

    @Value("${twilio.api-url:https://api.twilio.com}")
    private String apiUrl;

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.from:}")
    private String from;

    @Autowired
    public TwilioMessageTransport(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(@NotNull String to, @NotNull String text) throws MessageDeliveryException {
        if (!StringUtils.hasText(accountSid) || !StringUtils.hasText(authToken) || !StringUtils.hasText(from)) {
            throw new MessageDeliveryException("Twilio credentials are not configured");
        }

        for (String part : MessageUtils.splitLongMessage(text)) {
            sendPart(to, part);
        }
    }

    private void sendPart(String to, String body) throws MessageDeliveryException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(accountSid, authToken);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("From", from);
        form.add("To", to);
        form.add("Body", body);

        try {
            restTemplate.postForEntity(String.format(MESSAGES_URL, apiUrl, accountSid),
                    new HttpEntity<>(form, headers), String.class);
            log.debug("Sent {} chars to {}", body.length(), to);
        } catch (HttpStatusCodeException e) {
            log.error("Twilio rejected message to {}: status={}, body={}", to, e.getStatusCode(), e.getResponseBodyAsString());
            throw new MessageDeliveryException("Twilio returned " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Twilio unreachable while sending to {}: {}", to, e.getMessage());
            throw new MessageDeliveryException("Twilio unreachable", e);
        }
    }
}
