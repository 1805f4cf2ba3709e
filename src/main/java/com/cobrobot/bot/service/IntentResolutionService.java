package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.dto.NlpParseResult;
import com.cobrobot.bot.model.Tone;
import com.cobrobot.bot.model.intent.Intent;
import com.cobrobot.bot.model.intent.IntentSource;
import com.cobrobot.bot.model.intent.ResolvedIntent;
import com.cobrobot.bot.util.AmountParser;
import com.cobrobot.bot.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Text to intent, in three tiers: the payment guard, the local rules, then the external resolver.
 * Whatever the resolver returns is validated here; nothing downstream sees its raw output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentResolutionService {

    static final String PAY_COMMAND = "pagar";

    private final IntentRouter intentRouter;
    private final NlpIntentClient nlpIntentClient;
    private final PipelineMetrics metrics;

    @NotNull
    public ResolvedIntent resolve(@Nullable String text) {
        ResolvedIntent resolved = doResolve(text != null ? text.trim() : "");
        metrics.intentResolved(resolved.getSource(), resolved.getType());
        log.debug("Resolved '{}' as {} ({})", text, resolved.getType(), resolved.getSource());
        return resolved;
    }

    /**
     * True when {@code text} would resolve without the external resolver. Used by multi-turn flows to tell
     * a new command from a bad answer.
     */
    public boolean isCommand(@Nullable String text) {
        return isPayCommand(text) || intentRouter.matches(text);
    }

    public static boolean isPayCommand(@Nullable String text) {
        return PAY_COMMAND.equals(TextNormalizer.normalize(text));
    }

    private ResolvedIntent doResolve(String text) {
        if (isPayCommand(text)) {
            return new ResolvedIntent(Intent.PAY, IntentSource.GUARD);
        }

        Intent local = intentRouter.route(text);
        if (local != null) {
            return new ResolvedIntent(local, IntentSource.LOCAL);
        }

        if (text.isEmpty()) {
            return new ResolvedIntent(Intent.UNKNOWN, IntentSource.LOCAL);
        }

        return new ResolvedIntent(fromNlp(nlpIntentClient.parse(text), text), IntentSource.NLP);
    }

    @NotNull
    Intent fromNlp(@NotNull NlpParseResult result, @NotNull String text) {
        String intent = result.getIntent() != null ? result.getIntent().trim().toLowerCase(Locale.ROOT) : "unknown";
        String clientName = StringUtils.hasText(result.getClientName())
                ? TextNormalizer.displayName(result.getClientName())
                : null;

        switch (intent) {
            case "add_debt":
                return new Intent.AddDebt(
                        clientName != null ? clientName : BotConstants.DEFAULT_CLIENT_NAME,
                        AmountParser.reconcile(result.getAmountDue(), text),
                        StringUtils.hasText(result.getSinceText()) ? result.getSinceText().trim() : null);
            case "list_debts":
                return Intent.LIST_DEBTS;
            case "prioritize":
                return Intent.PRIORITIZE;
            case "remind":
                if (clientName == null) {
                    log.info("NLP remind without a client name: '{}'", text);
                    return Intent.UNKNOWN;
                }
                return new Intent.Remind(clientName, Tone.fromReply(TextNormalizer.normalize(result.getTone())),
                        StringUtils.hasText(result.getRemindWhenText()) ? result.getRemindWhenText().trim() : null);
            case "mark_paid":
                return clientName != null ? new Intent.MarkPaid(clientName) : Intent.UNKNOWN;
            case "help":
                return Intent.HELP;
            case "pricing":
                return Intent.PRICING;
            case "support":
                return Intent.SUPPORT;
            default:
                if (!"unknown".equals(intent)) {
                    log.info("NLP returned unsupported intent '{}'", intent);
                }
                return Intent.UNKNOWN;
        }
    }
}
