package com.cobrobot.bot.util;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts money amounts from informal Spanish text: "8500", "$8,500.00", "2k", "2 mil", "1.5k".
 */
public class AmountParser {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private static final Pattern THOUSANDS_SUFFIX =
            Pattern.compile("(\\d+(?:[.,]\\d+)?)\\s*(k|mil)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PLAIN_AMOUNT =
            Pattern.compile("\\$?\\s*(\\d{1,3}(?:[,\\s]\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)");

    private AmountParser() {
    }

    @Nullable
    public static BigDecimal parse(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        Matcher suffix = THOUSANDS_SUFFIX.matcher(text);
        if (suffix.find()) {
            BigDecimal base = new BigDecimal(suffix.group(1).replace(',', '.'));
            return base.multiply(THOUSAND).setScale(0, RoundingMode.HALF_UP);
        }

        Matcher plain = PLAIN_AMOUNT.matcher(text);
        if (!plain.find()) {
            return null;
        }
        String raw = plain.group(1).replace(",", "").replaceAll("\\s", "");
        try {
            BigDecimal value = new BigDecimal(raw);
            return value.signum() > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Fixes an amount reported by the NLP resolver when the text says "k"/"mil" but the number came back
     * un-multiplied ("2k" reported as 2).
     */
    @Nullable
    public static BigDecimal reconcile(@Nullable BigDecimal reported, @Nullable String text) {
        if (reported == null || reported.signum() <= 0) {
            return parse(text);
        }
        if (text != null && THOUSANDS_SUFFIX.matcher(text).find() && reported.compareTo(THOUSAND) < 0) {
            return reported.multiply(THOUSAND).setScale(0, RoundingMode.HALF_UP);
        }
        return reported;
    }
}
