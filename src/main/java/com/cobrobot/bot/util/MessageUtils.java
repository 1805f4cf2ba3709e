package com.cobrobot.bot.util;

import com.cobrobot.bot.constant.BotConstants;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.http.MediaType;
import org.springframework.web.util.HtmlUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.text.NumberFormat;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class MessageUtils {

    public static final MediaType TWIML = new MediaType("text", "xml", StandardCharsets.UTF_8);

    private static final Locale ES_MX = Locale.forLanguageTag("es-MX");

    private static final DateTimeFormatter WHEN_FORMAT = DateTimeFormatter.ofPattern("dd/MM 'a las' HH:mm");

    private MessageUtils() {
    }

    @NotNull
    public static String formatMoney(@Nullable BigDecimal amount) {
        NumberFormat format = NumberFormat.getCurrencyInstance(ES_MX);
        return format.format(amount != null ? amount : BigDecimal.ZERO);
    }

    /**
     * "18/10 a las 09:00".
     */
    @NotNull
    public static String formatWhen(@NotNull LocalDateTime when) {
        return WHEN_FORMAT.format(when);
    }

    /**
     * TwiML body for the webhook answer; a null or blank reply becomes an empty acknowledgement.
     */
    @NotNull
    public static String toTwiml(@Nullable String reply) {
        if (reply == null || reply.isBlank()) {
            return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response/>";
        }
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?><Response><Message>"
                + HtmlUtils.htmlEscape(reply, "UTF-8")
                + "</Message></Response>";
    }

    /**
     * "5512345678" -> "whatsapp:+525512345678". Ten-digit numbers are taken as Mexican.
     */
    @NotNull
    public static String toWhatsAppAddress(@NotNull String phone) {
        if (phone.startsWith("whatsapp:")) {
            return phone;
        }
        String digits = phone.replaceAll("[^\\d+]", "");
        if (!digits.startsWith("+")) {
            digits = (digits.length() == 10 ? "+52" : "+") + digits;
        }
        return "whatsapp:" + digits;
    }

    @NotNull
    public static String[] splitLongMessage(@NotNull String text) {
        if (text.length() <= BotConstants.MAX_MESSAGE_LENGTH) {
            return new String[]{text};
        }

        List<String> parts = new ArrayList<>();
        int maxLength = BotConstants.MAX_MESSAGE_LENGTH;

        int start = 0;
        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                parts.add(text.substring(start));
                break;
            }

            int end = findBestSplitPoint(text, start, start + maxLength);
            parts.add(text.substring(start, end));
            start = end;
        }

        return parts.toArray(new String[0]);
    }

    private static int findBestSplitPoint(String text, int start, int maxEnd) {
        String segment = text.substring(start, maxEnd);

        int lineEnd = segment.lastIndexOf('\n');
        if (lineEnd > segment.length() * 0.6) {
            return start + lineEnd + 1;
        }

        int spaceIndex = segment.lastIndexOf(' ');
        if (spaceIndex > segment.length() * 0.5) {
            return start + spaceIndex + 1;
        }

        return maxEnd;
    }
}
