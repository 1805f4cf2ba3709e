package com.cobrobot.bot.util;

import org.jetbrains.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads "when" phrases of a reminder request ("mañana", "pasado mañana", "en 3 días", "en 2 horas").
 * Works on normalized text.
 */
public class ReminderTimeParser {

    private static final Pattern WHEN = Pattern.compile(
            "\\b(pasado manana|manana|hoy|ahorita|en (\\d{1,3}|un|una) (dias?|horas?|semanas?))\\b");

    private ReminderTimeParser() {
    }

    /**
     * @return the first "when" phrase in {@code normalized}, or null
     */
    @Nullable
    public static String extract(@Nullable String normalized) {
        if (normalized == null) {
            return null;
        }
        Matcher matcher = WHEN.matcher(normalized);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Due time for a phrase. Day offsets land on {@code sendAt}; "hoy", "ahorita" and anything unreadable
     * return null, meaning the reminder goes out right away.
     */
    @Nullable
    public static LocalDateTime resolve(@Nullable String whenText, LocalDateTime now, LocalTime sendAt) {
        String phrase = extract(TextNormalizer.normalize(whenText));
        if (phrase == null) {
            return null;
        }
        switch (phrase) {
            case "hoy", "ahorita" -> {
                return null;
            }
            case "manana" -> {
                return now.toLocalDate().plusDays(1).atTime(sendAt);
            }
            case "pasado manana" -> {
                return now.toLocalDate().plusDays(2).atTime(sendAt);
            }
            default -> {
            }
        }

        String[] parts = phrase.split(" ");
        long count = parts[1].matches("\\d+") ? Long.parseLong(parts[1]) : 1;
        if (count <= 0) {
            return null;
        }
        if (parts[2].startsWith("hora")) {
            return now.plusHours(count).withSecond(0).withNano(0);
        }
        long days = parts[2].startsWith("semana") ? count * 7 : count;
        return now.toLocalDate().plusDays(days).atTime(sendAt);
    }
}
