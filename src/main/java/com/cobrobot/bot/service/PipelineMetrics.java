package com.cobrobot.bot.service;

import com.cobrobot.bot.model.intent.IntentSource;
import com.cobrobot.bot.model.intent.IntentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Micrometer counters for the inbound pipeline.
 */
@Component
@RequiredArgsConstructor
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    public void admission(InboundAdmissionService.Admission admission) {
        Counter.builder("inbound.admission")
                .tag("result", admission.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    /**
     * The dedup store was unreachable and a message was admitted without its durable check.
     */
    public void dedupFailOpen() {
        Counter.builder("inbound.dedup.fail_open")
                .register(meterRegistry)
                .increment();
    }

    public void intentResolved(IntentSource source, IntentType type) {
        Counter.builder("intent.resolved")
                .tag("source", source.name().toLowerCase(Locale.ROOT))
                .tag("intent", type.getCode())
                .register(meterRegistry)
                .increment();

        if (type == IntentType.UNKNOWN) {
            Counter.builder("intent.unknown")
                    .tag("source", source.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry)
                    .increment();
        }
    }

    public void nlpFailure(String reason) {
        Counter.builder("intent.nlp.failure")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void paywall(boolean blocked) {
        Counter.builder("paywall.gate")
                .tag("result", blocked ? "blocked" : "admitted")
                .register(meterRegistry)
                .increment();
    }

    public void billingWebhook(String type, String result) {
        Counter.builder("billing.webhook")
                .tag("type", type != null ? type : "unknown")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
