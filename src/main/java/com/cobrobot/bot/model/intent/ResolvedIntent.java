package com.cobrobot.bot.model.intent;

import lombok.Value;

@Value
public class ResolvedIntent {

    Intent intent;

    IntentSource source;

    public IntentType getType() {
        return intent.getType();
    }
}
