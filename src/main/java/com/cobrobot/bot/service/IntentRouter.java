package com.cobrobot.bot.service;

import com.cobrobot.bot.constant.BotConstants;
import com.cobrobot.bot.model.Tone;
import com.cobrobot.bot.model.intent.Intent;
import com.cobrobot.bot.util.AmountParser;
import com.cobrobot.bot.util.ReminderTimeParser;
import com.cobrobot.bot.util.TextNormalizer;
import org.jetbrains.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local, deterministic intent matching. Rules are tried in order over the normalized text and the first match wins,
 * so the more specific phrasings ("quien me debe") sit above the broader ones ("me debe").
 */
@Component
public class IntentRouter {

    private static final Pattern RAW_DEBTOR_NAME =
            Pattern.compile("^\\s*([\\p{L}\\s]+?)\\s+(?:me\\s+deben?|qued[oó]\\s+a\\s+deber)\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern RAW_SINCE = Pattern.compile("\\bdesde\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    // words that end a client name in "recuerdale a juan manana con tono firme"
    private static final Set<String> NAME_STOPWORDS = Set.of(
            "manana", "hoy", "en", "con", "tono", "por", "que", "amable", "firme", "formal", "ya", "pasado");

    private final List<Rule> rules = new ArrayList<>();

    public IntentRouter() {
        rule("^(cancelar|cancela|salir)$", (m, raw) -> Intent.CANCEL);
        rule("\\b(quien(es)? me deben?|que me deben|mis deudas|ver deudas|lista de deudas)\\b", (m, raw) -> Intent.LIST_DEBTS);
        rule("\\b(a quien (le )?cobro( primero)?|priori[sz]a(r)?)\\b", (m, raw) -> Intent.PRIORITIZE);
        rule("^guarda(r)?( el)? (telefono|tel|numero|celular|cel) de ([a-z ]+?):? (\\+?\\d[\\d -]{6,}\\d)$",
                (m, raw) -> savePhone(m.group(4), m.group(5)));
        rule("^(recuerdale|recordarle|recuerda|cobrale|mandale( un)? recordatorio) a (.+)$",
                (m, raw) -> remind(m.group(3)));
        rule("^(ya )?(me )?pago ([a-z ]+)$", (m, raw) -> markPaid(m.group(3)));
        rule("^([a-z ]+) ya (me )?pago$", (m, raw) -> markPaid(m.group(1)));
        rule("^marca(r)? (como )?pagad[oa] a ([a-z ]+)$", (m, raw) -> markPaid(m.group(3)));
        rule("\\b(me deben?|quedo a deber)\\b", (m, raw) -> addDebt(raw));
        rule("\\b(precio|precios|planes|cuanto cuesta|costo)\\b", (m, raw) -> Intent.PRICING);
        rule("^(quiero( el)?( plan)? pro|plan pro|probar pro|prueba pro|pro)$", (m, raw) -> Intent.WANT_PRO);
        rule("\\b(soporte|reportar|reporte|falla|problema)\\b", (m, raw) -> Intent.SUPPORT);
        rule("^(ayuda|help|menu|hola|inicio|comandos|que puedes hacer)$", (m, raw) -> Intent.HELP);
    }

    /**
     * @return the first matching intent, or null when no local rule applies
     */
    @Nullable
    public Intent route(@Nullable String text) {
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return null;
        }
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern.matcher(normalized);
            if (matcher.find()) {
                Intent intent = rule.extractor.apply(matcher, text);
                if (intent != null) {
                    return intent;
                }
            }
        }
        return null;
    }

    public boolean matches(@Nullable String text) {
        return route(text) != null;
    }

    private void rule(String regex, BiFunction<Matcher, String, Intent> extractor) {
        rules.add(new Rule(Pattern.compile(regex), extractor));
    }

    private static Intent addDebt(String raw) {
        Matcher nameMatcher = RAW_DEBTOR_NAME.matcher(raw);
        boolean named = nameMatcher.find();
        String name = named ? TextNormalizer.displayName(nameMatcher.group(1)) : BotConstants.DEFAULT_CLIENT_NAME;

        // the amount sits between the name and "desde ...", so a date is never read as money
        int amountFrom = named ? nameMatcher.end() : 0;
        int amountTo = raw.length();
        String since = null;
        Matcher sinceMatcher = RAW_SINCE.matcher(raw);
        if (sinceMatcher.find()) {
            since = sinceMatcher.group(1).trim();
            amountTo = sinceMatcher.start();
        }

        BigDecimal amount = amountFrom < amountTo ? AmountParser.parse(raw.substring(amountFrom, amountTo)) : null;
        return new Intent.AddDebt(name, amount, since);
    }

    @Nullable
    private static Intent remind(String tail) {
        String[] words = tail.split(" ");
        StringBuilder name = new StringBuilder();
        Tone tone = null;
        boolean nameClosed = false;
        for (String word : words) {
            if (!DIGITS.matcher(word).matches() && Tone.fromReply(word) != null) {
                tone = Tone.fromReply(word);
            }
            if (NAME_STOPWORDS.contains(word)) {
                nameClosed = true;
            }
            if (!nameClosed) {
                name.append(name.length() > 0 ? " " : "").append(word);
            }
        }
        if (name.length() == 0) {
            return null;
        }
        return new Intent.Remind(TextNormalizer.displayName(name.toString()), tone, ReminderTimeParser.extract(tail));
    }

    private static Intent markPaid(String name) {
        return new Intent.MarkPaid(TextNormalizer.displayName(name.trim()));
    }

    private static Intent savePhone(String name, String phone) {
        return new Intent.SavePhone(TextNormalizer.displayName(name.trim()), phone.replaceAll("[\\s-]", ""));
    }

    private static final class Rule {
        private final Pattern pattern;
        private final BiFunction<Matcher, String, Intent> extractor;

        private Rule(Pattern pattern, BiFunction<Matcher, String, Intent> extractor) {
            this.pattern = pattern;
            this.extractor = extractor;
        }
    }
}
