package com.cobrobot.bot.model;

public enum Plan {

    FREE("Gratis"),

    PRO("Pro");

    private final String displayName;

    Plan(String displayName) {
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
