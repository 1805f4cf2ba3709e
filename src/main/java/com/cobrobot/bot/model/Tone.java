package com.cobrobot.bot.model;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

public enum Tone {

    FRIENDLY("amable", List.of("1", "amable")),

    FIRM("firme", List.of("2", "firme")),

    FORMAL("formal", List.of("3", "formal"));

    private final String displayName;
    private final List<String> keywords;

    Tone(String displayName, List<String> keywords) {
        this.displayName = displayName;
        this.keywords = keywords;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Matches a normalized reply ("1", "firme", ...) against the tone vocabulary.
     */
    @Nullable
    public static Tone fromReply(@Nullable String normalized) {
        if (normalized == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(tone -> tone.keywords.contains(normalized))
                .findFirst()
                .orElse(null);
    }
}
