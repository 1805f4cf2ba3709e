package com.cobrobot.bot.model.intent;

import com.cobrobot.bot.model.Tone;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;

/**
 * Closed set of user intents. Every variant is nested here and the constructor is private, so
 * nothing outside this file can add a case; each variant carries only the slots it needs.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class Intent {

    private final IntentType type;

    private Intent(IntentType type) {
        this.type = type;
    }

    public static final Intent LIST_DEBTS = new Simple(IntentType.LIST_DEBTS);
    public static final Intent PRIORITIZE = new Simple(IntentType.PRIORITIZE);
    public static final Intent PRICING = new Simple(IntentType.PRICING);
    public static final Intent WANT_PRO = new Simple(IntentType.WANT_PRO);
    public static final Intent PAY = new Simple(IntentType.PAY);
    public static final Intent HELP = new Simple(IntentType.HELP);
    public static final Intent SUPPORT = new Simple(IntentType.SUPPORT);
    public static final Intent CANCEL = new Simple(IntentType.CANCEL);
    public static final Intent UNKNOWN = new Simple(IntentType.UNKNOWN);

    /**
     * Intents without slots.
     */
    @ToString(callSuper = true)
    public static final class Simple extends Intent {
        private Simple(IntentType type) {
            super(type);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class AddDebt extends Intent {
        private final String clientName;
        private final BigDecimal amount;
        private final String sinceText;

        public AddDebt(@NotNull String clientName, @Nullable BigDecimal amount, @Nullable String sinceText) {
            super(IntentType.ADD_DEBT);
            this.clientName = clientName;
            this.amount = amount;
            this.sinceText = sinceText;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class Remind extends Intent {
        private final String clientName;
        private final Tone tone;
        private final String remindWhen;

        public Remind(@NotNull String clientName, @Nullable Tone tone, @Nullable String remindWhen) {
            super(IntentType.REMIND);
            this.clientName = clientName;
            this.tone = tone;
            this.remindWhen = remindWhen;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class MarkPaid extends Intent {
        private final String clientName;

        public MarkPaid(@NotNull String clientName) {
            super(IntentType.MARK_PAID);
            this.clientName = clientName;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class SavePhone extends Intent {
        private final String clientName;
        private final String phone;

        public SavePhone(@NotNull String clientName, @NotNull String phone) {
            super(IntentType.SAVE_PHONE);
            this.clientName = clientName;
            this.phone = phone;
        }
    }
}
