package com.cobrobot.bot.constant;

public class MessageTemplates {

    public static final String WELCOME_MESSAGE =
            "👋 ¡Hola! Soy tu asistente de cobranza.\n" +
            "Te ayudo a anotar quién te debe, a decidir a quién cobrar primero y a mandar recordatorios.\n\n";

    public static final String HELP_MESSAGE =
            "Así te ayudo:\n" +
            "1) Registra: \"Juan me debe 8500 desde el 3 de mayo\"\n" +
            "2) Consulta: \"¿Quién me debe?\"\n" +
            "3) Prioriza: \"¿A quién cobro primero?\"\n" +
            "4) Guarda un teléfono: \"Guarda el teléfono de Juan 5512345678\"\n" +
            "5) Recuerda: \"Recuérdale a Juan\"\n" +
            "6) Marca pagado: \"Ya pagó Juan\"\n\n" +
            "Tip: también entiendo \"me deben 2k\". Escribe \"precios\" para ver el plan Pro.";

    public static final String FALLBACK_MESSAGE =
            "Te leo, pero no entendí. Prueba:\n" +
            "• \"Juan me debe 8500 desde el 3 de mayo\"\n" +
            "• \"¿Quién me debe?\"\n" +
            "• \"¿A quién cobro primero?\"";

    public static final String SLOW_DOWN = "⏳ Vas muy rápido. Espera unos segundos y vuelve a escribirme.";

    public static final String ERROR_MESSAGE = "❌ Ocurrió un error. Intenta de nuevo en un momento.";

    public static final String NO_DEBTS = "✅ No tienes deudas registradas por cobrar.";

    public static final String DEBTS_HEADER = "📌 Te deben:\n";

    public static final String DEBT_REGISTERED =
            "Registrado ✅\n• Cliente: %s\n• Monto: %s\n%s\n¿Quieres agregar otro o me preguntas \"¿Quién me debe?\"";

    public static final String AMOUNT_MISSING =
            "No pude identificar el monto. Ejemplo:\n" +
            "• \"Juan me debe 8500 desde el 3 de mayo\"\n" +
            "• \"María me debe 2k desde ayer\"";

    public static final String PRIORITIZE_REPLY = "📌 Cobra primero a *%s* por *%s*.%s";

    public static final String DEBT_MARKED_PAID = "🎉 Marqué como pagado a %s (%s).";

    public static final String DEBT_NOT_FOUND = "No encontré deudas pendientes de %s.";

    public static final String PHONE_SAVED = "📇 Guardé el teléfono de %s: %s";

    public static final String PHONE_MISSING =
            "No tengo el teléfono de %s. Guárdalo así:\n\"Guarda el teléfono de %s 5512345678\"";

    public static final String CHOOSE_TONE =
            "¿Con qué tono le escribo a %s?\n1) amable\n2) firme\n3) formal\n\n(Escribe \"cancelar\" para salir)";

    public static final String CONFIRM_SEND =
            "Este es el mensaje para %s:\n\n\"%s\"\n\n¿Lo envío? Responde \"sí\" o \"no\".";

    public static final String CONFIRM_SCHEDULE =
            "Este es el mensaje para %s:\n\n\"%s\"\n\n¿Lo programo para el %s? Responde \"sí\" o \"no\".";

    public static final String REMINDER_SCHEDULED = "🗓️ Listo, le enviaré el recordatorio a %s el %s.";

    public static final String CONFIRM_SEND_REPROMPT = "Responde \"sí\" para enviar o \"no\" para descartar.";

    public static final String REMINDER_SENT = "📤 Listo, le mandé el recordatorio a %s.";

    public static final String REMINDER_SEND_FAILED = "⚠️ No pude enviar el mensaje a %s. Intenta de nuevo más tarde.";

    public static final String REMINDER_DISCARDED = "Ok, no envié nada.";

    public static final String FLOW_CANCELLED = "Listo, cancelado. ¿En qué más te ayudo?";

    public static final String NOTHING_TO_CANCEL = "No hay nada que cancelar.";

    public static final String TONE_FRIENDLY =
            "Hola %s, ¿cómo estás? Te escribo para recordarte con cariño el pago pendiente de %s. ¡Gracias!";

    public static final String TONE_FIRM =
            "Hola %s. Tienes un saldo pendiente de %s. Te pido liquidarlo a la brevedad, por favor.";

    public static final String TONE_FORMAL =
            "Estimado(a) %s: le recordamos atentamente que existe un adeudo pendiente por %s. Quedamos atentos a su pago.";

    public static final String PRICING_MESSAGE =
            "💼 Plan Gratis: %d acciones al día (registrar, priorizar, recordar).\n" +
            "⭐ Plan Pro: ilimitado.\n" +
            "• Mensual: %s\n" +
            "• Anual: %s\n\n" +
            "Escribe \"quiero pro\" para probarlo %d días gratis.";

    public static final String ASK_BUSINESS_NAME = "¡Genial! ¿Cómo se llama tu negocio?";

    public static final String ASK_CYCLE = "¿Prefieres pago mensual o anual?\n1) mensual\n2) anual";

    public static final String TRIAL_ACTIVATED =
            "⭐ ¡Listo, %s! Activé tu prueba Pro por %d días (plan %s).\n" +
            "Cuando quieras suscribirte escribe PAGAR.";

    public static final String TRIAL_ALREADY_USED = "Ya usaste tu prueba gratis. Escribe PAGAR para suscribirte a Pro.";

    public static final String ALREADY_PRO = "Ya tienes el plan Pro activo ⭐";

    public static final String CHECKOUT_LINK =
            "💳 Suscripción Pro (%s)\n\nPaga aquí:\n%s\n\nTu plan se activa en cuanto se confirme el pago.";

    public static final String CHECKOUT_FAILED = "⚠️ No pude generar tu liga de pago. Intenta de nuevo en un momento.";

    public static final String PAYWALL_MESSAGE =
            "🚫 Llegaste al límite de %d acciones gratis de hoy.\n" +
            "Escribe \"quiero pro\" para probar Pro gratis o PAGAR para suscribirte.";

    public static final String LOW_BALANCE_WARNING = "\n\n⚠️ Te quedan %d acciones gratis hoy.";

    public static final String SUPPORT_PROMPT = "🛠️ Cuéntame qué pasó y lo reviso. (Escribe \"cancelar\" para salir)";

    public static final String SUPPORT_CREATED = "Gracias, registré tu reporte #%d. Te contactamos pronto.";

    public static final String PAYMENT_SUCCESS = "⭐ ¡Pago confirmado! Ya tienes el plan Pro.";

    public static final String PAYMENT_FAILED =
            "⚠️ Tu pago de Pro no pasó. Conservas Pro unos días mientras actualizas tu método de pago.";

    public static final String SUBSCRIPTION_ENDED = "Tu suscripción Pro terminó. Puedes volver cuando quieras escribiendo PAGAR.";

    public static final String DIGEST_HEADER =
            "📌 *Recordatorio de cobranza (hoy)*\n\nTengo estas deudas pendientes que conviene revisar:\n";

    public static final String DIGEST_ITEM = "• *%s*: %s%s\n";

    public static final String DIGEST_UNNAMED_CLIENT = "Cliente (sin nombre)";

    public static final String DIGEST_MORE = "\n(+%d más pendientes)\n";

    public static final String DIGEST_TOTAL = "\n💰 *Total recuperable hoy (de este resumen):* %s\n";

    public static final String DIGEST_FOOTER =
            "\nResponde aquí con uno de estos:\n" +
            "• \"¿A quién cobro primero?\"\n" +
            "• \"Recuérdale a {Nombre}\"\n" +
            "• \"¿Quién me debe?\"\n";
}
