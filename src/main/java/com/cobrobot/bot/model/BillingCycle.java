package com.cobrobot.bot.model;

public enum BillingCycle {

    MONTHLY("mensual"),

    YEARLY("anual");

    private final String displayName;

    BillingCycle(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
