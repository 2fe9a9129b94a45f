package com.arunika.websocket.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * RestTemplate for the HTTP conversation model backends.
 */
@Configuration
public class RestTemplateConfig {

    /**
     * Some model gateways answer JSON with a text/plain content type, so the
     * JSON converter also accepts text types.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, VoiceProperties properties) {
        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter();
        jsonConverter.setSupportedMediaTypes(List.of(
                MediaType.APPLICATION_JSON,
                MediaType.TEXT_PLAIN,
                new MediaType("application", "*+json")
        ));

        RestTemplate restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(properties.getPipeline().getDeadline())
                .build();
        restTemplate.getMessageConverters().add(0, jsonConverter);
        return restTemplate;
    }
}
