package com.cobrobot.bot.model.intent;

public enum IntentType {

    ADD_DEBT("add_debt", true),

    LIST_DEBTS("list_debts", false),

    PRIORITIZE("prioritize", true),

    REMIND("remind", true),

    MARK_PAID("mark_paid", false),

    SAVE_PHONE("save_phone", false),

    PRICING("pricing", false),

    WANT_PRO("want_pro", false),

    PAY("pay", false),

    HELP("help", false),

    SUPPORT("support", false),

    CANCEL("cancel", false),

    UNKNOWN("unknown", false);

    private final String code;
    private final boolean billable;

    IntentType(String code, boolean billable) {
        this.code = code;
        this.billable = billable;
    }

    public String getCode() {
        return code;
    }

    /**
     * Billable intents consume the free plan's daily quota.
     */
    public boolean isBillable() {
        return billable;
    }
}
