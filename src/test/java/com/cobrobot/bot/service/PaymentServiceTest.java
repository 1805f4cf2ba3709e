package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.CheckoutRequest;
import com.cobrobot.bot.dto.CheckoutResponse;
import com.cobrobot.bot.model.BillingCycle;
import com.cobrobot.bot.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.cobrobot.bot.constant.BotConstants.SUBSCRIPTION_ACTIVE;
import static com.cobrobot.bot.constant.MessageTemplates.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    private static final String PHONE = "whatsapp:+5215511111111";

    @Mock
    private BillingGateway billingGateway;

    private PaymentService service;

    @BeforeEach
    void setUp() {
        service = new PaymentService(billingGateway);
    }

    @Test
    @DisplayName("Checkout uses the cycle chosen at trial signup")
    void checkoutLink() {
        when(billingGateway.createCheckout(any())).thenReturn(new CheckoutResponse("cs_1", "https://pay.example/cs_1"));
        User user = User.builder().phone(PHONE).billingCycle(BillingCycle.YEARLY).stripeCustomerId("cus_1").build();

        String text = service.createCheckout(user).getText();

        assertThat(text).isEqualTo(String.format(CHECKOUT_LINK, "anual", "https://pay.example/cs_1"));
        ArgumentCaptor<CheckoutRequest> request = ArgumentCaptor.forClass(CheckoutRequest.class);
        verify(billingGateway).createCheckout(request.capture());
        assertThat(request.getValue().getCycle()).isEqualTo(BillingCycle.YEARLY);
        assertThat(request.getValue().getCustomerId()).isEqualTo("cus_1");
    }

    @Test
    @DisplayName("Active subscribers get no second checkout")
    void alreadySubscribed() {
        User user = User.builder().phone(PHONE).subscriptionStatus(SUBSCRIPTION_ACTIVE).build();

        assertThat(service.createCheckout(user).getText()).isEqualTo(ALREADY_PRO);
        verifyNoInteractions(billingGateway);
    }

    @Test
    @DisplayName("Gateway failure is reported to the user")
    void gatewayFailure() {
        when(billingGateway.createCheckout(any())).thenReturn(null);

        assertThat(service.createCheckout(User.builder().phone(PHONE).build()).getText()).isEqualTo(CHECKOUT_FAILED);
    }
}
