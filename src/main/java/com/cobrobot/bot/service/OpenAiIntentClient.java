package com.cobrobot.bot.service;

import com.cobrobot.bot.dto.ChatCompletionResponse;
import com.cobrobot.bot.dto.NlpParseResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions call that turns an informal message into the JSON shape of {@link NlpParseResult}.
 */
@Slf4j
@Service
public class OpenAiIntentClient implements NlpIntentClient {

    static final String SYSTEM_PROMPT =
            "Eres un parser para un asistente de cobranza por WhatsApp en México (micro/pyme informal).\n" +
            "Tu trabajo es convertir mensajes informales a un JSON ESTRICTO.\n\n" +
            "Reglas:\n" +
            "- Responde ÚNICAMENTE con JSON válido (sin markdown, sin texto extra).\n" +
            "- Si el usuario pide \"¿Quién me debe?\" -> intent=\"list_debts\"\n" +
            "- Si el usuario describe una deuda (\"Juan me debe 8500\", \"me deben 2k\", \"Pedro quedó a deber 300\") -> intent=\"add_debt\"\n" +
            "- Si el usuario pide \"¿A quién cobro primero?\" o similar -> intent=\"prioritize\"\n" +
            "- Si el usuario pide recordar/cobrar (\"Recuérdale a Juan mañana\") -> intent=\"remind\"\n" +
            "- Si el usuario dice que un cliente ya pagó -> intent=\"mark_paid\"\n" +
            "- Si el usuario pide ayuda -> intent=\"help\"\n" +
            "- Si falta el monto en add_debt, deja amount_due = null\n" +
            "- Interpreta \"2k\" como 2000. Si no es claro, null.\n" +
            "- client_name: nombre corto (\"Juan\", \"Juan Pérez\"). Si no hay, null.\n" +
            "- since_text: lo que sigue a \"desde...\" si existe.\n" +
            "- remind_when_text: \"mañana\", \"hoy\", \"en 3 días\", etc. Si no hay, null.\n" +
            "- tone: \"amable\", \"firme\" o \"formal\" si el usuario lo pide; si no, null.\n\n" +
            "Formato EXACTO:\n" +
            "{\"intent\": \"add_debt|list_debts|prioritize|remind|mark_paid|help|unknown\", \"client_name\": string|null, " +
            "\"amount_due\": number|null, \"since_text\": string|null, \"remind_when_text\": string|null, " +
            "\"tone\": \"amable|firme|formal\"|null}";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;

    @Value("${openai.api-url:https://api.openai.com}")
    private String apiUrl;

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    public OpenAiIntentClient(@Qualifier("nlpRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              PipelineMetrics metrics) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @NotNull
    @Override
    public NlpParseResult parse(@NotNull String text) {
        if (!StringUtils.hasText(apiKey)) {
            log.debug("openai.api-key not set, NLP fallback disabled");
            return NlpParseResult.unknown();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(apiKey);

        Map<String, Object> requestMap = new HashMap<>();
        requestMap.put("model", model);
        requestMap.put("temperature", 0);
        requestMap.put("response_format", Map.of("type", "json_object"));
        requestMap.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", "Mensaje: " + text)
        ));

        try {
            ChatCompletionResponse response = restTemplate.postForObject(
                    apiUrl + "/v1/chat/completions",
                    new HttpEntity<>(requestMap, headers),
                    ChatCompletionResponse.class
            );
            return readResult(response);
        } catch (HttpStatusCodeException e) {
            log.warn("NLP HTTP error: status={}, body={}", e.getStatusCode(), e.getResponseBodyAsString());
            metrics.nlpFailure("http");
        } catch (ResourceAccessException e) {
            log.warn("NLP unreachable or timed out: {}", e.getMessage());
            metrics.nlpFailure("timeout");
        } catch (RestClientException e) {
            log.warn("NLP response could not be read: {}", e.getMessage());
            metrics.nlpFailure("malformed");
        }
        return NlpParseResult.unknown();
    }

    private NlpParseResult readResult(ChatCompletionResponse response) {
        String content = extractContent(response);
        if (content == null) {
            log.warn("NLP answered without content");
            metrics.nlpFailure("empty");
            return NlpParseResult.unknown();
        }

        try {
            NlpParseResult result = objectMapper.readValue(stripCodeFence(content), NlpParseResult.class);
            return result != null ? result : NlpParseResult.unknown();
        } catch (JsonProcessingException e) {
            log.warn("NLP content is not the expected JSON: {}", content);
            metrics.nlpFailure("malformed");
            return NlpParseResult.unknown();
        }
    }

    private String extractContent(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null) {
            return null;
        }
        for (ChatCompletionResponse.Choice choice : response.getChoices()) {
            if (choice.getMessage() != null && StringUtils.hasText(choice.getMessage().getContent())) {
                return choice.getMessage().getContent().trim();
            }
        }
        return null;
    }

    private static String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        String inner = content.replaceFirst("^```(json)?", "");
        int end = inner.lastIndexOf("```");
        return (end >= 0 ? inner.substring(0, end) : inner).trim();
    }
}
