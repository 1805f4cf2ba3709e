package com.cobrobot.bot.model;

public enum DebtStatus {

    PENDING,

    PAID
}
