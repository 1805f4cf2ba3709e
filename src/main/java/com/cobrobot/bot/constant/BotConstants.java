package com.cobrobot.bot.constant;

public class BotConstants {

    public static final String VERSION = "v-2026-10-CORE-1";

    public static final String DEDUP_SID_PREFIX = "sid:";

    public static final String DEDUP_HASH_PREFIX = "hash:";

    public static final String SUBSCRIPTION_ACTIVE = "active";

    public static final String SUBSCRIPTION_TRIALING = "trialing";

    public static final String SUBSCRIPTION_PAST_DUE = "past_due";

    public static final String SUBSCRIPTION_UNPAID = "unpaid";

    public static final String SUBSCRIPTION_CANCELED = "canceled";

    public static final String EVENT_CHECKOUT_COMPLETED = "checkout.session.completed";

    public static final String EVENT_SUBSCRIPTION_CREATED = "customer.subscription.created";

    public static final String EVENT_SUBSCRIPTION_UPDATED = "customer.subscription.updated";

    public static final String EVENT_SUBSCRIPTION_DELETED = "customer.subscription.deleted";

    public static final String EVENT_INVOICE_PAYMENT_FAILED = "invoice.payment_failed";

    public static final String METADATA_PHONE = "phone";

    public static final String METADATA_CYCLE = "cycle";

    public static final String DEFAULT_CLIENT_NAME = "Cliente";

    public static final int MAX_MESSAGE_LENGTH = 1600; // límite de cuerpo de WhatsApp vía Twilio

    public static final double MONTHLY_PRICE_MXN = 149.00;

    public static final double YEARLY_PRICE_MXN = 1490.00;
}
