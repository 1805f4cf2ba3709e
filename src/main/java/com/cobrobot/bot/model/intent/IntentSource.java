package com.cobrobot.bot.model.intent;

public enum IntentSource {

    GUARD,

    LOCAL,

    NLP
}
