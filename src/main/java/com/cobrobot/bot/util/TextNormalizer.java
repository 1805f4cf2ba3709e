package com.cobrobot.bot.util;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public class TextNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[¿?¡!.,;:\"']");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Lower-cases, strips accents and sentence punctuation and collapses whitespace,
     * so "¿Quién me debe?" becomes "quien me debe". Digits, '$', '+' and '-' survive.
     */
    @NotNull
    public static String normalize(@Nullable String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String plain = DIACRITICS.matcher(decomposed).replaceAll("");
        plain = PUNCTUATION.matcher(plain.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return SPACES.matcher(plain).replaceAll(" ").trim();
    }

    /**
     * Capitalizes each word of a client name ("juan perez" -> "Juan Perez").
     */
    @NotNull
    public static String displayName(@Nullable String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String[] words = SPACES.split(name.trim());
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
