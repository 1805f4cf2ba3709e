package com.cobrobot.bot.service;

import com.cobrobot.bot.config.StripeProperties;
import com.cobrobot.bot.dto.BillingEvent;
import com.cobrobot.bot.dto.CheckoutRequest;
import com.cobrobot.bot.exception.BillingSignatureException;
import com.cobrobot.bot.model.BillingCycle;
import com.google.gson.JsonSyntaxException;
import com.stripe.net.Webhook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StripeBillingGatewayTest {

    private static final String SECRET = "whsec_test";

    // api_version deliberately differs from the library's pinned version
    private static final String PAYLOAD = "{\"id\":\"evt_1\",\"object\":\"event\",\"api_version\":\"2019-01-01\"," +
            "\"type\":\"checkout.session.completed\",\"data\":{\"object\":{\"id\":\"cs_1\",\"object\":\"checkout.session\"}}}";

    private StripeProperties properties;
    private StripeBillingGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new StripeProperties();
        properties.setWebhookSecret(SECRET);
        gateway = new StripeBillingGateway(properties, MutableClock.at("2026-10-17T15:00:00Z"));
    }

    private static String sign(String payload, String secret) throws Exception {
        long timestamp = Webhook.Util.getTimeNow();
        String signature = Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }

    @Test
    @DisplayName("Missing webhook secret rejects every request")
    void missingSecret() {
        properties.setWebhookSecret(null);

        assertThatThrownBy(() -> gateway.verify(PAYLOAD, "t=1,v1=abc"))
                .isInstanceOf(BillingSignatureException.class);
    }

    @Test
    @DisplayName("Wrong signature is rejected")
    void wrongSignature() throws Exception {
        assertThatThrownBy(() -> gateway.verify(PAYLOAD, sign(PAYLOAD, "whsec_other")))
                .isInstanceOf(BillingSignatureException.class);
    }

    @Test
    @DisplayName("A signed body that is not valid JSON is rejected as malformed")
    void malformedPayload() throws Exception {
        String garbage = "{\"id\": [}";

        assertThatThrownBy(() -> gateway.verify(garbage, sign(garbage, SECRET)))
                .isInstanceOf(BillingSignatureException.class)
                .hasMessage("Malformed Stripe payload")
                .hasCauseInstanceOf(JsonSyntaxException.class);
    }

    @Test
    @DisplayName("Missing signature header is rejected")
    void missingHeader() {
        assertThatThrownBy(() -> gateway.verify(PAYLOAD, null))
                .isInstanceOf(BillingSignatureException.class);
    }

    @Test
    @DisplayName("A signed event whose object cannot be read is flagged unreadable")
    void unreadablePayload() throws Exception {
        BillingEvent event = gateway.verify(PAYLOAD, sign(PAYLOAD, SECRET));

        assertThat(event.getEventId()).isEqualTo("evt_1");
        assertThat(event.getType()).isEqualTo("checkout.session.completed");
        assertThat(event.isPayloadReadable()).isFalse();
    }

    @Test
    @DisplayName("Checkout without a configured price is not attempted")
    void missingPrice() {
        CheckoutRequest request = CheckoutRequest.builder()
                .phone("whatsapp:+5215511111111")
                .cycle(BillingCycle.YEARLY)
                .build();

        assertThat(gateway.createCheckout(request)).isNull();
    }
}
