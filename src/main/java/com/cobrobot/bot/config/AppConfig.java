package com.cobrobot.bot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock(@Value("${app.zone:America/Mexico_City}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    @Primary
    public RestTemplate restTemplate(ObjectMapper objectMapper) {
        return buildRestTemplate(objectMapper, 10000, 15000);
    }

    /**
     * Client for the NLP resolver, with a read timeout well under the webhook's own deadline so a slow
     * resolver degrades to an "unknown" intent instead of timing the whole delivery out.
     */
    @Bean
    @Qualifier("nlpRestTemplate")
    public RestTemplate nlpRestTemplate(ObjectMapper objectMapper,
                                        @Value("${nlp.connect-timeout-ms:2000}") int connectTimeout,
                                        @Value("${nlp.timeout-ms:4000}") int readTimeout) {
        return buildRestTemplate(objectMapper, connectTimeout, readTimeout);
    }

    private RestTemplate buildRestTemplate(ObjectMapper objectMapper, int connectTimeout, int readTimeout) {
        RestTemplate restTemplate = new RestTemplate();

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        restTemplate.setRequestFactory(factory);

        List<HttpMessageConverter<?>> messageConverters = new ArrayList<>();
        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter();
        jsonConverter.setSupportedMediaTypes(Arrays.asList(
                MediaType.APPLICATION_JSON,
                new MediaType("application", "json", StandardCharsets.UTF_8)
        ));

        ObjectMapper lenientMapper = objectMapper.copy();
        lenientMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        lenientMapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        jsonConverter.setObjectMapper(lenientMapper);

        messageConverters.add(jsonConverter);
        messageConverters.add(new FormHttpMessageConverter());
        messageConverters.add(new StringHttpMessageConverter(StandardCharsets.UTF_8));
        restTemplate.setMessageConverters(messageConverters);

        return restTemplate;
    }
}
