package com.cobrobot.bot.model;

public enum PlanSource {

    TRIAL,

    BILLING,

    ADMIN
}
