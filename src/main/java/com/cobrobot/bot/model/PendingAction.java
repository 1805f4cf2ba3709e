package com.cobrobot.bot.model;

public enum PendingAction {

    CHOOSE_TONE,

    CONFIRM_SEND,

    ASK_NAME,

    ASK_CYCLE,

    SUPPORT_COLLECT
}
