package com.cobrobot.bot.model;

public enum ReminderStatus {

    PENDING,

    SENDING,

    SENT,

    FAILED
}
